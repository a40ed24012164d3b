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
 * 数据类型族的枚举,用于将 {@link DataTypeRoot} 分类到各个类别中。
 *
 * <p>类型族是对数据类型的高层次分组,它将具有相似特征或用途的类型归类在一起,
 * 例如字典类型的校验只需要判断元素类型是否属于 {@link #NUMERIC} 族,而不必逐个列举整数宽度。
 *
 * <p>类型族层次结构:
 * <pre>
 * PREDEFINED (预定义类型)
 * ├── CHARACTER_STRING (字符串类型): CHAR, VARCHAR
 * ├── NUMERIC (数值类型)
 * │   ├── INTEGER_NUMERIC (整数类型): TINYINT ... BIGINT, UTINYINT ... UBIGINT
 * │   │   └── UNSIGNED_INTEGER_NUMERIC (无符号整数类型): UTINYINT ... UBIGINT
 * │   ├── EXACT_NUMERIC (精确数值类型): INTEGER_NUMERIC
 * │   └── APPROXIMATE_NUMERIC (近似数值类型): FLOAT, DOUBLE
 * ├── DATETIME (日期时间类型): DATE, DATETIME
 * └── (其他): BOOLEAN
 *
 * CONSTRUCTED (构造类型)
 * ├── COLLECTION (集合类型): ARRAY
 * └── DICTIONARY
 * </pre>
 *
 * @see DataTypeRoot
 */
@Public
public enum DataTypeFamily {
    /** 预定义类型族,包含所有基本类型(非构造类型)。 */
    PREDEFINED,

    /** 构造类型族,包含由其他类型组合而成的类型,如 ARRAY、DICTIONARY。 */
    CONSTRUCTED,

    /** 字符串类型族,包含 CHAR 和 VARCHAR 类型。 */
    CHARACTER_STRING,

    /** 数值类型族,包含所有整数和浮点数类型。 */
    NUMERIC,

    /** 整数数值类型族,包含有符号和无符号整数。 */
    INTEGER_NUMERIC,

    /** 无符号整数类型族,字典编码的索引类型必须属于该族。 */
    UNSIGNED_INTEGER_NUMERIC,

    /** 精确数值类型族。 */
    EXACT_NUMERIC,

    /** 近似数值类型族,包含 FLOAT 和 DOUBLE 类型。 */
    APPROXIMATE_NUMERIC,

    /** 日期时间类型族,包含 DATE 和 DATETIME。 */
    DATETIME,

    /** 集合类型族,包含 ARRAY。 */
    COLLECTION
}
