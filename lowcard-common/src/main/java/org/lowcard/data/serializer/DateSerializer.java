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
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * DATE 类型的序列化器。
 *
 * <p>值是自 1970-01-01 起的天数,以 {@link Short} 的无符号位模式保存;二进制格式为 2 字节,
 * 文本格式为 ISO-8601 日期,例如 {@code 2024-03-01}。
 */
public final class DateSerializer extends SerializerSingleton<Short> {

    private static final long serialVersionUID = 1L;

    public static final DateSerializer INSTANCE = new DateSerializer();

    /** 可表示的最大天数。 */
    private static final long MAX_DAYS = 0xFFFF;

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
        return LocalDate.ofEpochDay(Short.toUnsignedInt(record)).toString();
    }

    @Override
    public Short deserializeFromString(String s) {
        long days;
        try {
            days = LocalDate.parse(s.trim()).toEpochDay();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid DATE value: " + s, e);
        }
        if (days < 0 || days > MAX_DAYS) {
            throw new IllegalArgumentException("DATE value out of range: " + s);
        }
        return (short) days;
    }
}
