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
import org.lowcard.utils.Preconditions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 定长字符串(CHAR(n))的序列化器。
 *
 * <p>二进制格式恰好是 {@code n} 个字节,没有长度前缀。值以 {@code byte[]} 表示,长度必须为 {@code n}。
 * 文本形式是 UTF-8 解码后去掉末尾填充的 0 字节;从文本解析时不足 {@code n} 字节的部分以 0 填充。
 */
public final class FixedStringSerializer implements Serializer<byte[]> {

    private static final long serialVersionUID = 1L;

    private final int length;

    public FixedStringSerializer(int length) {
        Preconditions.checkArgument(length > 0, "Fixed string length must be positive.");
        this.length = length;
    }

    public int getLength() {
        return length;
    }

    @Override
    public Serializer<byte[]> duplicate() {
        return this;
    }

    @Override
    public byte[] copy(byte[] from) {
        return Arrays.copyOf(from, from.length);
    }

    @Override
    public void serialize(byte[] record, DataOutputView target) throws IOException {
        if (record.length != length) {
            throw new IllegalArgumentException(
                    String.format(
                            "Fixed string value must have exactly %d bytes, but has %d.",
                            length, record.length));
        }
        target.write(record);
    }

    @Override
    public byte[] deserialize(DataInputView source) throws IOException {
        byte[] bytes = new byte[length];
        source.readFully(bytes);
        return bytes;
    }

    @Override
    public String serializeToString(byte[] record) {
        int end = record.length;
        while (end > 0 && record[end - 1] == 0) {
            end--;
        }
        return new String(record, 0, end, StandardCharsets.UTF_8);
    }

    @Override
    public byte[] deserializeFromString(String s) {
        return pad(s.getBytes(StandardCharsets.UTF_8), length);
    }

    /**
     * 把字节数组以 0 填充到 {@code length} 个字节。
     *
     * @throws IllegalArgumentException 如果字节数超过 {@code length}
     */
    public static byte[] pad(byte[] bytes, int length) {
        if (bytes.length > length) {
            throw new IllegalArgumentException(
                    String.format(
                            "Value of %d bytes is too long for a fixed string of %d bytes.",
                            bytes.length, length));
        }
        return bytes.length == length ? bytes : Arrays.copyOf(bytes, length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return length == ((FixedStringSerializer) o).length;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(length);
    }
}
