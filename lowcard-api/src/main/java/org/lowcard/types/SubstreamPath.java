/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.lowcard.types;

import org.lowcard.annotation.Public;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static org.lowcard.utils.Preconditions.checkNotNull;
import static org.lowcard.utils.Preconditions.checkState;

/**
 * 子流路径,用于区分一个逻辑列在物理存储上占用的多个字节流。
 *
 * <p>复合类型在序列化时会把不同部分写入不同的子流。例如字典类型把去重后的字典元素写入
 * {@link Substream#DICTIONARY_ELEMENTS},把每行的编码写入 {@link Substream#DICTIONARY_INDEXES}。
 * 嵌套的复合类型在父路径后继续追加自己的子流标记,因此路径是一个有序的标记列表。
 *
 * <p>该类是不可变的,{@link #append} 和 {@link #withLast} 都返回新实例。
 *
 * <pre>{@code
 * SubstreamPath elements = SubstreamPath.EMPTY.append(Substream.DICTIONARY_ELEMENTS);
 * SubstreamPath indexes = elements.withLast(Substream.DICTIONARY_INDEXES);
 * }</pre>
 *
 * @see DataType#enumerateStreams(SubstreamPath, java.util.function.Consumer)
 */
@Public
public final class SubstreamPath implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 根路径,不包含任何子流标记。 */
    public static final SubstreamPath EMPTY = new SubstreamPath(Collections.emptyList());

    /** 子流标记。 */
    public enum Substream {
        /** 数组每行的元素个数。 */
        ARRAY_SIZES("ArraySizes"),

        /** 数组展开后的元素。 */
        ARRAY_ELEMENTS("ArrayElements"),

        /** 字典中去重后的元素。 */
        DICTIONARY_ELEMENTS("DictionaryElements"),

        /** 每行指向字典的编码。 */
        DICTIONARY_INDEXES("DictionaryIndexes");

        private final String displayName;

        Substream(String displayName) {
            this.displayName = displayName;
        }

        @Override
        public String toString() {
            return displayName;
        }
    }

    private final List<Substream> substreams;

    private SubstreamPath(List<Substream> substreams) {
        this.substreams = substreams;
    }

    /** 基于给定的子流标记创建路径。 */
    public static SubstreamPath of(Substream... substreams) {
        SubstreamPath path = EMPTY;
        for (Substream substream : substreams) {
            path = path.append(substream);
        }
        return path;
    }

    /** 在路径末尾追加一个子流标记。 */
    public SubstreamPath append(Substream substream) {
        checkNotNull(substream, "Substream must not be null.");
        List<Substream> newSubstreams = new ArrayList<>(substreams.size() + 1);
        newSubstreams.addAll(substreams);
        newSubstreams.add(substream);
        return new SubstreamPath(Collections.unmodifiableList(newSubstreams));
    }

    /**
     * 把路径的最后一个子流标记替换为给定标记。
     *
     * @throws IllegalStateException 如果路径为空
     */
    public SubstreamPath withLast(Substream substream) {
        checkNotNull(substream, "Substream must not be null.");
        checkState(!substreams.isEmpty(), "Cannot replace the tail of an empty substream path.");
        List<Substream> newSubstreams = new ArrayList<>(substreams);
        newSubstreams.set(newSubstreams.size() - 1, substream);
        return new SubstreamPath(Collections.unmodifiableList(newSubstreams));
    }

    public Substream last() {
        checkState(!substreams.isEmpty(), "Empty substream path has no last element.");
        return substreams.get(substreams.size() - 1);
    }

    public boolean isEmpty() {
        return substreams.isEmpty();
    }

    public int size() {
        return substreams.size();
    }

    public List<Substream> getSubstreams() {
        return substreams;
    }

    /**
     * 返回该路径对应的文件名后缀。
     *
     * <p>字典元素使用 {@code .dict},数组长度使用 {@code .size<level>},其中 level 是所在数组的嵌套层级;
     * 数组元素和字典编码不产生后缀,它们与父列共用同一个文件名。
     *
     * @param columnName 逻辑列名
     * @return 不含扩展名的文件名
     */
    public String toFileName(String columnName) {
        StringBuilder name = new StringBuilder(columnName);
        int arrayLevel = 0;
        for (Substream substream : substreams) {
            switch (substream) {
                case ARRAY_SIZES:
                    name.append(".size").append(arrayLevel);
                    break;
                case ARRAY_ELEMENTS:
                    arrayLevel++;
                    break;
                case DICTIONARY_ELEMENTS:
                    name.append(".dict");
                    break;
                case DICTIONARY_INDEXES:
                    break;
                default:
                    throw new UnsupportedOperationException("Unsupported substream: " + substream);
            }
        }
        return name.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SubstreamPath that = (SubstreamPath) o;
        return substreams.equals(that.substreams);
    }

    @Override
    public int hashCode() {
        return Objects.hash(substreams);
    }

    @Override
    public String toString() {
        return substreams.toString();
    }
}
