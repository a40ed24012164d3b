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

package org.lowcard.utils;

import org.lowcard.types.DataType;
import org.lowcard.types.DataTypeJsonParser;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/** 数据类型与 JSON 字符串之间的转换工具。 */
public class JsonSerdeUtil {

    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private JsonSerdeUtil() {}

    public static String toJson(DataType dataType) {
        StringWriter writer = new StringWriter();
        try (JsonGenerator generator = OBJECT_MAPPER.getFactory().createGenerator(writer)) {
            dataType.serializeJson(generator);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    public static DataType fromJson(String json) {
        try {
            JsonNode node = OBJECT_MAPPER.readTree(json);
            return DataTypeJsonParser.parseDataType(node);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
