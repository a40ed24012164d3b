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

package org.lowcard.data.columnar;

/**
 * 列向量的基础接口,一个列向量保存一列中连续的若干行。
 *
 * <p>具体的取值方法由类型化的子接口提供,例如 {@link IntColumnVector#getInt(int)}。
 */
public interface ColumnVector {

    /** 返回第 {@code i} 行是否为 null。 */
    boolean isNullAt(int i);

    /** 返回向量中的行数。 */
    int size();

    default int getCapacity() {
        return Integer.MAX_VALUE;
    }
}
