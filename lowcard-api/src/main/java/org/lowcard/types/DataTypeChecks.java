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

import java.util.EnumSet;
import java.util.Set;

/**
 * 用于检查 {@link DataType} 的工具类,避免大量的类型转换和重复性工作。
 *
 * <p>可空类型被视为其非空形式的 "可选" 包装。所有需要检查内部类型种类的地方
 * (字典类型的校验、列表示的选择)都通过 {@link #unwrapOptional(DataType)} 去掉这一层包装,
 * 保证校验规则与构造规则一致。
 */
public final class DataTypeChecks {

    /** 可以作为字典元素的类型根。 */
    private static final Set<DataTypeRoot> DICTIONARY_ELEMENT_ROOTS =
            EnumSet.of(
                    DataTypeRoot.TINYINT,
                    DataTypeRoot.SMALLINT,
                    DataTypeRoot.INTEGER,
                    DataTypeRoot.BIGINT,
                    DataTypeRoot.UTINYINT,
                    DataTypeRoot.USMALLINT,
                    DataTypeRoot.UINTEGER,
                    DataTypeRoot.UBIGINT,
                    DataTypeRoot.FLOAT,
                    DataTypeRoot.DOUBLE,
                    DataTypeRoot.VARCHAR,
                    DataTypeRoot.CHAR,
                    DataTypeRoot.DATE,
                    DataTypeRoot.DATETIME);

    private static final LengthExtractor LENGTH_EXTRACTOR = new LengthExtractor();

    private DataTypeChecks() {}

    /**
     * 去掉一层 "可选" 包装,返回内部的非空类型。
     *
     * @param dataType 可能可空的类型
     * @return 与 {@code dataType} 结构相同的非空类型
     */
    public static DataType unwrapOptional(DataType dataType) {
        return dataType.isNullable() ? dataType.copy(false) : dataType;
    }

    /** 判断类型是否为无符号整数(UTINYINT、USMALLINT、UINTEGER、UBIGINT)。 */
    public static boolean isUnsignedInteger(DataType dataType) {
        return dataType.is(DataTypeFamily.UNSIGNED_INTEGER_NUMERIC);
    }

    /**
     * 判断类型在去掉可选包装后能否作为字典元素。
     *
     * <p>支持数值、变长字符串、定长字符串、日期和日期时间。
     */
    public static boolean isDictionaryElement(DataType dataType) {
        return DICTIONARY_ELEMENT_ROOTS.contains(unwrapOptional(dataType).getTypeRoot());
    }

    /**
     * 获取 CHAR 或 VARCHAR 类型的长度。
     *
     * @throws IllegalArgumentException 如果类型不支持长度
     */
    public static int getLength(DataType dataType) {
        return dataType.accept(LENGTH_EXTRACTOR);
    }

    private static class LengthExtractor extends DataTypeDefaultVisitor<Integer> {

        @Override
        public Integer visit(CharType charType) {
            return charType.getLength();
        }

        @Override
        public Integer visit(VarCharType varCharType) {
            return varCharType.getLength();
        }

        @Override
        protected Integer defaultMethod(DataType dataType) {
            throw new IllegalArgumentException(
                    String.format(
                            "Invalid use of extractor %s. Called on logical type: %s",
                            this.getClass().getName(), dataType));
        }
    }
}
