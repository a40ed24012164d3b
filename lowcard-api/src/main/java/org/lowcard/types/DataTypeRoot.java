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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 数据类型根的枚举,包含逻辑数据类型的静态信息。
 *
 * <p>类型根是对 {@link DataType} 的基本描述,不包含额外参数。例如,参数化的数据类型
 * {@code CHAR(3)} 拥有其根类型 {@code CHAR} 的所有特征。类型根能够在类型评估期间进行高效的类型比较。
 *
 * <p>实现者注意事项: 当对类型根进行模式匹配时(例如使用 switch/case 语句),
 * 建议按照此类中类型根的定义顺序排列各个分支,并考虑所有类型根的行为。
 *
 * @see DataType
 * @see DataTypeFamily
 */
@Public
public enum DataTypeRoot {
    /** 定长字符类型,例如 CHAR(10)。 */
    CHAR(DataTypeFamily.PREDEFINED, DataTypeFamily.CHARACTER_STRING),

    /** 变长字符类型,例如 VARCHAR(100)。STRING 是最大长度的 VARCHAR。 */
    VARCHAR(DataTypeFamily.PREDEFINED, DataTypeFamily.CHARACTER_STRING),

    /** 布尔类型。 */
    BOOLEAN(DataTypeFamily.PREDEFINED),

    /** 1 字节有符号整数类型,范围 -128 到 127。 */
    TINYINT(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 2 字节有符号整数类型,范围 -32,768 到 32,767。 */
    SMALLINT(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 4 字节有符号整数类型。 */
    INTEGER(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 8 字节有符号整数类型。 */
    BIGINT(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 1 字节无符号整数类型,范围 0 到 255。 */
    UTINYINT(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.UNSIGNED_INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 2 字节无符号整数类型,范围 0 到 65,535。 */
    USMALLINT(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.UNSIGNED_INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 4 字节无符号整数类型,范围 0 到 4,294,967,295。 */
    UINTEGER(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.UNSIGNED_INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 8 字节无符号整数类型,范围 0 到 2^64 - 1。 */
    UBIGINT(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.UNSIGNED_INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 单精度浮点数类型(4 字节,IEEE 754)。 */
    FLOAT(DataTypeFamily.PREDEFINED, DataTypeFamily.NUMERIC, DataTypeFamily.APPROXIMATE_NUMERIC),

    /** 双精度浮点数类型(8 字节,IEEE 754)。 */
    DOUBLE(DataTypeFamily.PREDEFINED, DataTypeFamily.NUMERIC, DataTypeFamily.APPROXIMATE_NUMERIC),

    /** 日期类型,以 1970-01-01 起的天数存储在 2 字节无符号整数中。 */
    DATE(DataTypeFamily.PREDEFINED, DataTypeFamily.DATETIME),

    /** 日期时间类型,以 Unix 秒数存储在 4 字节无符号整数中。 */
    DATETIME(DataTypeFamily.PREDEFINED, DataTypeFamily.DATETIME),

    /** 数组类型,表示相同类型元素的有序集合。 */
    ARRAY(DataTypeFamily.CONSTRUCTED, DataTypeFamily.COLLECTION),

    /**
     * 字典编码类型(低基数类型)。
     *
     * <p>值只在去重字典中存储一次,每行只保存指向字典的无符号整数编码。
     */
    DICTIONARY(DataTypeFamily.CONSTRUCTED);

    /** 该类型根所属的类型族集合,不可变 */
    private final Set<DataTypeFamily> families;

    DataTypeRoot(DataTypeFamily firstFamily, DataTypeFamily... otherFamilies) {
        this.families = Collections.unmodifiableSet(EnumSet.of(firstFamily, otherFamilies));
    }

    /**
     * 获取该类型根所属的所有类型族。
     *
     * @return 该类型根所属的类型族集合,不可变
     */
    public Set<DataTypeFamily> getFamilies() {
        return families;
    }
}
