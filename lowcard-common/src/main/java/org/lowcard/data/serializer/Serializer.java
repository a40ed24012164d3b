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
import org.lowcard.io.DataInputViewStreamWrapper;
import org.lowcard.io.DataOutputView;
import org.lowcard.io.DataOutputViewStreamWrapper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.Serializable;

/**
 * 单个值的序列化器,定义了一种类型的值的二进制格式和文本格式。
 *
 * <p>字典列的单值格式与其元素类型的单值格式完全相同,因此同一个序列化器既用于普通列,
 * 也用于字典列的单值读写以及字典载荷的批量读写。
 *
 * @param <T> 被序列化的值的类型
 */
public interface Serializer<T> extends Serializable {

    /**
     * 如果序列化器有状态则创建深拷贝,否则返回自身。
     */
    Serializer<T> duplicate();

    /** 创建值的深拷贝,不可变的值可以直接返回。 */
    T copy(T from);

    void serialize(T record, DataOutputView target) throws IOException;

    T deserialize(DataInputView source) throws IOException;

    default byte[] serializeToBytes(T record) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        DataOutputViewStreamWrapper view = new DataOutputViewStreamWrapper(out);
        serialize(record, view);
        return out.toByteArray();
    }

    default T deserializeFromBytes(byte[] bytes) throws IOException {
        ByteArrayInputStream in = new ByteArrayInputStream(bytes);
        DataInputViewStreamWrapper view = new DataInputViewStreamWrapper(in);
        return deserialize(view);
    }

    /** 把值转换为文本形式。 */
    default String serializeToString(T record) {
        throw new UnsupportedOperationException(
                String.format("serialize %s to string is unsupported", record));
    }

    /** 从文本形式解析值。 */
    default T deserializeFromString(String s) {
        throw new UnsupportedOperationException(
                String.format("deserialize %s from string is unsupported", s));
    }
}
