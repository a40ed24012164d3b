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

package org.lowcard.data.serializer;

import org.lowcard.io.DataInputView;
import org.lowcard.io.DataOutputView;

import javax.annotation.Nonnull;

import java.io.IOException;

/**
 * 为不支持 null 的序列化器增加 null 支持。
 *
 * <p>每个值之前写入一个布尔标记,{@code true} 表示 null,此时没有值的内容。
 * 文本形式中 null 表示为 {@value #NULL_STRING}。
 *
 * @param <T> 被序列化的值的类型
 */
public class NullableSerializer<T> implements Serializer<T> {

    private static final long serialVersionUID = 1L;

    /** null 的文本形式。 */
    public static final String NULL_STRING = "\\N";

    private final Serializer<T> originalSerializer;

    private NullableSerializer(Serializer<T> originalSerializer) {
        this.originalSerializer = originalSerializer;
    }

    /** 用 {@link NullableSerializer} 包装给定的序列化器,已经包装过的直接返回。 */
    public static <T> Serializer<T> wrap(@Nonnull Serializer<T> originalSerializer) {
        return originalSerializer instanceof NullableSerializer
                ? originalSerializer
                : new NullableSerializer<>(originalSerializer);
    }

    public Serializer<T> originalSerializer() {
        return originalSerializer;
    }

    @Override
    public Serializer<T> duplicate() {
        Serializer<T> duplicateOriginalSerializer = originalSerializer.duplicate();
        return duplicateOriginalSerializer == originalSerializer
                ? this
                : new NullableSerializer<>(duplicateOriginalSerializer);
    }

    @Override
    public T copy(T from) {
        return from == null ? null : originalSerializer.copy(from);
    }

    @Override
    public void serialize(T record, DataOutputView target) throws IOException {
        if (record == null) {
            target.writeBoolean(true);
        } else {
            target.writeBoolean(false);
            originalSerializer.serialize(record, target);
        }
    }

    @Override
    public T deserialize(DataInputView source) throws IOException {
        boolean isNull = source.readBoolean();
        return isNull ? null : originalSerializer.deserialize(source);
    }

    @Override
    public String serializeToString(T record) {
        return record == null ? NULL_STRING : originalSerializer.serializeToString(record);
    }

    @Override
    public T deserializeFromString(String s) {
        return NULL_STRING.equals(s) ? null : originalSerializer.deserializeFromString(s);
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this
                || (obj != null
                        && obj.getClass() == getClass()
                        && originalSerializer.equals(
                                ((NullableSerializer<?>) obj).originalSerializer));
    }

    @Override
    public int hashCode() {
        return originalSerializer.hashCode();
    }
}
