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

/** 4 字节无符号整数的序列化器,值以 {@link Integer} 的位模式保存。 */
public final class UnsignedIntSerializer extends SerializerSingleton<Integer> {

    private static final long serialVersionUID = 1L;

    public static final UnsignedIntSerializer INSTANCE = new UnsignedIntSerializer();

    @Override
    public Integer copy(Integer from) {
        return from;
    }

    @Override
    public void serialize(Integer record, DataOutputView target) throws IOException {
        target.writeInt(record);
    }

    @Override
    public Integer deserialize(DataInputView source) throws IOException {
        return source.readInt();
    }

    @Override
    public String serializeToString(Integer record) {
        return Integer.toUnsignedString(record);
    }

    @Override
    public Integer deserializeFromString(String s) {
        return Integer.parseUnsignedInt(s.trim());
    }
}
