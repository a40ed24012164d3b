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

import org.lowcard.types.DataType;
import org.lowcard.types.DataTypeChecks;
import org.lowcard.types.DictionaryType;

/**
 * 根据 {@link DataType} 创建单值 {@link Serializer}。
 *
 * <p>可空类型的序列化器会被 {@link NullableSerializer} 包装。字典类型的单值格式就是其元素类型的格式。
 */
public final class InternalSerializers {

    @SuppressWarnings("unchecked")
    public static <T> Serializer<T> create(DataType type) {
        Serializer<?> serializer = createInternal(DataTypeChecks.unwrapOptional(type));
        return (Serializer<T>)
                (type.isNullable() ? NullableSerializer.wrap(serializer) : serializer);
    }

    private static Serializer<?> createInternal(DataType type) {
        switch (type.getTypeRoot()) {
            case CHAR:
                return new FixedStringSerializer(DataTypeChecks.getLength(type));
            case VARCHAR:
                return StringSerializer.INSTANCE;
            case TINYINT:
                return ByteSerializer.INSTANCE;
            case SMALLINT:
                return ShortSerializer.INSTANCE;
            case INTEGER:
                return IntSerializer.INSTANCE;
            case BIGINT:
                return LongSerializer.INSTANCE;
            case UTINYINT:
                return UnsignedByteSerializer.INSTANCE;
            case USMALLINT:
                return UnsignedShortSerializer.INSTANCE;
            case UINTEGER:
                return UnsignedIntSerializer.INSTANCE;
            case UBIGINT:
                return UnsignedLongSerializer.INSTANCE;
            case FLOAT:
                return FloatSerializer.INSTANCE;
            case DOUBLE:
                return DoubleSerializer.INSTANCE;
            case DATE:
                return DateSerializer.INSTANCE;
            case DATETIME:
                return DateTimeSerializer.INSTANCE;
            case DICTIONARY:
                // the dictionary is invisible at single value granularity
                return create(((DictionaryType) type).getElementType());
            default:
                throw new UnsupportedOperationException(
                        "Unsupported type '" + type + "' to get internal serializer");
        }
    }

    private InternalSerializers() {
        // no instantiation
    }
}
