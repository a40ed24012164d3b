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

package org.lowcard.data.columnar.writable;

import org.lowcard.data.columnar.ColumnVector;

/**
 * 可写的列向量,支持追加行、预留容量和截断。
 */
public interface WritableColumnVector extends ColumnVector {

    /** 清空所有行,容量保持不变。 */
    void reset();

    /** 把第 {@code rowId} 行标记为 null。 */
    void setNullAt(int rowId);

    /** 追加一个 null 行。 */
    void appendNull();

    /** 保证至少可以容纳 {@code capacity} 行。 */
    void reserve(int capacity);

    /** 返回已经追加的行数。 */
    int getElementsAppended();

    /**
     * 删除末尾的行,只保留前 {@code size} 行。
     *
     * @throws IllegalArgumentException 如果 {@code size} 为负数或大于当前行数
     */
    void truncate(int size);

    default void reserveAdditional(int additionalCapacity) {
        reserve(getElementsAppended() + additionalCapacity);
    }
}
