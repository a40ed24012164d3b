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

/**
 * 1 字节无符号整数的序列化器。
 *
 * <p>值以 {@link Byte} 的位模式保存,二进制格式与 {@link ByteSerializer} 相同,
 * 文本格式为 0 到 255 的十进制数。
 */
public final class UnsignedByteSerializer extends SerializerSingleton<Byte> {

    private static final long serialVersionUID = 1L;

    public static final UnsignedByteSerializer INSTANCE = new UnsignedByteSerializer();

    @Override
    public Byte copy(Byte from) {
        return from;
    }

    @Override
    public void serialize(Byte record, DataOutputView target) throws IOException {
        target.writeByte(record);
    }

    @Override
    public Byte deserialize(DataInputView source) throws IOException {
        return source.readByte();
    }

    @Override
    public String serializeToString(Byte record) {
        return Integer.toString(Byte.toUnsignedInt(record));
    }

    @Override
    public Byte deserializeFromString(String s) {
        return UnsignedValues.parseUnsignedByte(s);
    }
}
