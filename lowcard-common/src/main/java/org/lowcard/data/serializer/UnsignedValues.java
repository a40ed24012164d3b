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

/** 解析无符号整数文本形式的工具方法。 */
final class UnsignedValues {

    private UnsignedValues() {}

    static Byte parseUnsignedByte(String s) {
        return (byte) parseInRange(s, 0xFF, "UTINYINT");
    }

    static Short parseUnsignedShort(String s) {
        return (short) parseInRange(s, 0xFFFF, "USMALLINT");
    }

    private static int parseInRange(String s, int max, String typeName) {
        int value = Integer.parseInt(s.trim());
        if (value < 0 || value > max) {
            throw new NumberFormatException(
                    String.format("Value %s is out of range for %s [0, %d].", s, typeName, max));
        }
        return value;
    }
}
