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

import org.lowcard.utils.Preconditions;

import java.io.Serializable;

/**
 * 可写列向量的基类,维护行数、容量和 null 标记的汇总状态。
 *
 * <p>容量不足时按两倍扩容,具体的数组扩容由子类的 {@link #reserveInternal(int)} 完成。
 */
public abstract class AbstractWritableVector implements WritableColumnVector, Serializable {

    private static final long serialVersionUID = 1L;

    /** 为 true 时表示向量中一定没有 null,可以跳过 null 标记的检查。 */
    protected boolean noNulls = true;

    protected int elementsAppended;

    protected int capacity;

    public AbstractWritableVector(int capacity) {
        Preconditions.checkArgument(capacity >= 0, "Invalid capacity: %s", capacity);
        this.capacity = capacity;
    }

    @Override
    public int getElementsAppended() {
        return elementsAppended;
    }

    @Override
    public int size() {
        return elementsAppended;
    }

    @Override
    public int getCapacity() {
        return this.capacity;
    }

    @Override
    public void appendNull() {
        reserve(elementsAppended + 1);
        setNullAt(elementsAppended);
        elementsAppended++;
    }

    @Override
    public void reset() {
        noNulls = true;
        elementsAppended = 0;
    }

    @Override
    public void truncate(int size) {
        Preconditions.checkArgument(
                size >= 0 && size <= elementsAppended,
                "Cannot truncate %s rows to %s rows.",
                elementsAppended,
                size);
        truncateInternal(size);
        elementsAppended = size;
    }

    @Override
    public void reserve(int requiredCapacity) {
        if (requiredCapacity < 0) {
            throw new IllegalArgumentException("Invalid capacity: " + requiredCapacity);
        } else if (requiredCapacity > capacity) {
            int newCapacity = (int) Math.min(Integer.MAX_VALUE, requiredCapacity * 2L);
            if (requiredCapacity <= newCapacity) {
                try {
                    reserveInternal(newCapacity);
                } catch (OutOfMemoryError outOfMemoryError) {
                    throw new RuntimeException(
                            "Failed to allocate memory for vector", outOfMemoryError);
                }
            } else {
                throw new UnsupportedOperationException(
                        "Cannot allocate :" + newCapacity + " elements");
            }
            capacity = newCapacity;
        }
    }

    protected abstract void reserveInternal(int newCapacity);

    /** 清理被截断的行 {@code [size, elementsAppended)} 的状态。 */
    protected abstract void truncateInternal(int size);
}
