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

package org.lowcard.data.serializer.column;

import org.lowcard.options.Options;
import org.lowcard.types.DataType;
import org.lowcard.types.DictionaryType;

/** 根据 {@link DataType} 创建 {@link ColumnSerializer}。 */
public final class ColumnSerializers {

    public static ColumnSerializer create(DataType type) {
        return create(type, new Options());
    }

    public static ColumnSerializer create(DataType type, Options options) {
        switch (type.getTypeRoot()) {
            case DICTIONARY:
                return new DictionaryColumnSerializer((DictionaryType) type, options);
            case BOOLEAN:
            case ARRAY:
                throw new UnsupportedOperationException(
                        "Unsupported type '" + type + "' to get column serializer");
            default:
                return new ScalarColumnSerializer(type, options);
        }
    }

    private ColumnSerializers() {
        // no instantiation
    }
}
