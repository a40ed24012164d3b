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
 * 1 字节无符号整数数据类型,取值范围从 0 到 255。
 *
 * <p>Java 没有无符号整数,值以 byte 的位模式存储,读取时通过 {@link Byte#toUnsignedInt} 还原。
 * 该类型是字典编码最常用的索引类型。
 */
@Public
public class UTinyIntType extends DataType {

    private static final long serialVersionUID = 1L;

    private static final String FORMAT = "UTINYINT";

    public UTinyIntType(boolean isNullable) {
        super(isNullable, DataTypeRoot.UTINYINT);
    }

    public UTinyIntType() {
        this(true);
    }

    @Override
    public int defaultSize() {
        return 1;
    }

    @Override
    public DataType copy(boolean isNullable) {
        return new UTinyIntType(isNullable);
    }

    @Override
    public String asSQLString() {
        return withNullability(FORMAT);
    }

    @Override
    public <R> R accept(DataTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
