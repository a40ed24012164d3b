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

/** 2 字节无符号整数的序列化器,值以 {@link Short} 的位模式保存。 */
public final class UnsignedShortSerializer extends SerializerSingleton<Short> {

    private static final long serialVersionUID = 1L;

    public static final UnsignedShortSerializer INSTANCE = new UnsignedShortSerializer();

    @Override
    public Short copy(Short from) {
        return from;
    }

    @Override
    public void serialize(Short record, DataOutputView target) throws IOException {
        target.writeShort(record);
    }

    @Override
    public Short deserialize(DataInputView source) throws IOException {
        return source.readShort();
    }

    @Override
    public String serializeToString(Short record) {
        return Integer.toString(Short.toUnsignedInt(record));
    }

    @Override
    public Short deserializeFromString(String s) {
        return UnsignedValues.parseUnsignedShort(s);
    }
}
