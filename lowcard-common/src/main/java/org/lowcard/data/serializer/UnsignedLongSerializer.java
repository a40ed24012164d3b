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

import java.io.IOException;

/** 8 字节无符号整数的序列化器,值以 {@link Long} 的位模式保存。 */
public final class UnsignedLongSerializer extends SerializerSingleton<Long> {

    private static final long serialVersionUID = 1L;

    public static final UnsignedLongSerializer INSTANCE = new UnsignedLongSerializer();

    @Override
    public Long copy(Long from) {
        return from;
    }

    @Override
    public void serialize(Long record, DataOutputView target) throws IOException {
        target.writeLong(record);
    }

    @Override
    public Long deserialize(DataInputView source) throws IOException {
        return source.readLong();
    }

    @Override
    public String serializeToString(Long record) {
        return Long.toUnsignedString(record);
    }

    @Override
    public Long deserializeFromString(String s) {
        return Long.parseUnsignedLong(s.trim());
    }
}
