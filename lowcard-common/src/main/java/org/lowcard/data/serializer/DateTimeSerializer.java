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
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * DATETIME 类型的序列化器。
 *
 * <p>值是 UTC 的 Unix 秒数,以 {@link Integer} 的无符号位模式保存;文本格式为
 * {@code yyyy-MM-dd HH:mm:ss}。
 */
public final class DateTimeSerializer extends SerializerSingleton<Integer> {

    private static final long serialVersionUID = 1L;

    public static final DateTimeSerializer INSTANCE = new DateTimeSerializer();

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final long MAX_SECONDS = 0xFFFFFFFFL;

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
        return LocalDateTime.ofEpochSecond(Integer.toUnsignedLong(record), 0, ZoneOffset.UTC)
                .format(FORMATTER);
    }

    @Override
    public Integer deserializeFromString(String s) {
        long seconds;
        try {
            seconds = LocalDateTime.parse(s.trim(), FORMATTER).toEpochSecond(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid DATETIME value: " + s, e);
        }
        if (seconds < 0 || seconds > MAX_SECONDS) {
            throw new IllegalArgumentException("DATETIME value out of range: " + s);
        }
        return (int) seconds;
    }
}
