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
 * {@link DataType} 的访问者接口。
 *
 * <p>每个具体类型都有一个对应的 {@code visit} 方法,使类型相关的处理逻辑(如列表示的选择、
 * 类型属性的提取)可以集中在一个类中实现,同时由编译器保证覆盖所有类型。
 *
 * @param <R> 访问结果的类型
 */
@Public
public interface DataTypeVisitor<R> {

    R visit(CharType charType);

    R visit(VarCharType varCharType);

    R visit(BooleanType booleanType);

    R visit(TinyIntType tinyIntType);

    R visit(SmallIntType smallIntType);

    R visit(IntType intType);

    R visit(BigIntType bigIntType);

    R visit(UTinyIntType uTinyIntType);

    R visit(USmallIntType uSmallIntType);

    R visit(UIntType uIntType);

    R visit(UBigIntType uBigIntType);

    R visit(FloatType floatType);

    R visit(DoubleType doubleType);

    R visit(DateType dateType);

    R visit(DateTimeType dateTimeType);

    R visit(ArrayType arrayType);

    R visit(DictionaryType dictionaryType);
}
