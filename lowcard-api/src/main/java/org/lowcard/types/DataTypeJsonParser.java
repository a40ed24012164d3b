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

package org.lowcard.types;

import org.lowcard.annotation.Public;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * 解析 {@link DataType#serializeJson} 生成的 JSON。
 *
 * <p>原子类型以 SQL 字符串表示,复合类型以对象表示:
 * <pre>
 * "INT NOT NULL"
 * {"type": "ARRAY", "element": "DATE"}
 * {"type": "DICTIONARY", "element": "STRING", "index": "UTINYINT"}
 * </pre>
 */
@Public
public final class DataTypeJsonParser {

    private static final String NOT_NULL_SUFFIX = " NOT NULL";

    private DataTypeJsonParser() {}

    public static DataType parseDataType(JsonNode json) {
        if (json.isTextual()) {
            return DataTypeParser.parseDataType(json.asText());
        } else if (json.isObject()) {
            String typeString = field(json, "type").asText().trim();
            boolean isNullable = true;
            if (typeString.toUpperCase(Locale.ROOT).endsWith(NOT_NULL_SUFFIX)) {
                isNullable = false;
                typeString =
                        typeString.substring(0, typeString.length() - NOT_NULL_SUFFIX.length());
            }
            String family = typeString.trim().toUpperCase(Locale.ROOT);
            switch (family) {
                case "ARRAY":
                    return new ArrayType(isNullable, parseDataType(field(json, "element")));
                case "DICTIONARY":
                    return new DictionaryType(
                            isNullable,
                            parseDataType(field(json, "element")),
                            parseDataType(field(json, "index")));
                default:
                    throw new IllegalArgumentException(
                            "Unknown composite data type in JSON: " + typeString);
            }
        }
        throw new IllegalArgumentException("Can not parse data type from JSON: " + json);
    }

    private static JsonNode field(JsonNode json, String name) {
        JsonNode node = json.get(name);
        if (node == null) {
            throw new IllegalArgumentException(
                    String.format("Missing field '%s' in data type JSON: %s", name, json));
        }
        return node;
    }
}
