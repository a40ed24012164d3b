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

/**
 * 创建 {@link DataType} 实例的静态工厂。
 *
 * <p>所有方法返回可空类型,需要非空类型时调用 {@link DataType#notNull()}。
 *
 * <pre>{@code
 * DataType codes = DataTypes.DICTIONARY(DataTypes.CHAR(3), DataTypes.USMALLINT());
 * DataType days = DataTypes.DATE().notNull();
 * }</pre>
 */
@Public
public class DataTypes {

    /** 创建一个 4 字节有符号整数类型。 */
    public static IntType INT() {
        return new IntType();
    }

    /** 创建一个 1 字节有符号整数类型。范围: -128 到 127。 */
    public static TinyIntType TINYINT() {
        return new TinyIntType();
    }

    /** 创建一个 2 字节有符号整数类型。范围: -32,768 到 32,767。 */
    public static SmallIntType SMALLINT() {
        return new SmallIntType();
    }

    /** 创建一个 8 字节有符号整数类型。 */
    public static BigIntType BIGINT() {
        return new BigIntType();
    }

    /** 创建一个 1 字节无符号整数类型。范围: 0 到 255。 */
    public static UTinyIntType UTINYINT() {
        return new UTinyIntType();
    }

    /** 创建一个 2 字节无符号整数类型。范围: 0 到 65,535。 */
    public static USmallIntType USMALLINT() {
        return new USmallIntType();
    }

    public static UIntType UINT() {
        return new UIntType();
    }

    public static UBigIntType UBIGINT() {
        return new UBigIntType();
    }

    /**
     * 创建一个无长度限制的变长字符串类型。
     *
     * <p>这是最常用的字符串类型,等价于 VARCHAR(2147483647)。
     */
    public static VarCharType STRING() {
        return VarCharType.STRING_TYPE;
    }

    public static VarCharType VARCHAR(int length) {
        return new VarCharType(length);
    }

    /** 创建一个定长字符串类型,值恰好占用 {@code length} 个字节。 */
    public static CharType CHAR(int length) {
        return new CharType(length);
    }

    public static BooleanType BOOLEAN() {
        return new BooleanType();
    }

    public static FloatType FLOAT() {
        return new FloatType();
    }

    /** 创建一个 8 字节双精度浮点数类型(IEEE 754)。 */
    public static DoubleType DOUBLE() {
        return new DoubleType();
    }

    public static DateType DATE() {
        return new DateType();
    }

    public static DateTimeType DATETIME() {
        return new DateTimeType();
    }

    /**
     * 创建一个数组类型。
     *
     * @param element 数组元素的数据类型
     */
    public static ArrayType ARRAY(DataType element) {
        return new ArrayType(element);
    }

    /**
     * 创建一个字典编码类型。
     *
     * @param element 字典元素类型
     * @param index 索引类型,必须是无符号整数
     * @throws IllegalArgumentTypeException 如果参数类型不被支持
     */
    public static DictionaryType DICTIONARY(DataType element, DataType index) {
        return new DictionaryType(element, index);
    }
}
