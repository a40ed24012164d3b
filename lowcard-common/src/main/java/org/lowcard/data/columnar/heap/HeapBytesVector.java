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

package org.lowcard.data.columnar.heap;

import org.lowcard.data.columnar.BytesColumnVector;

import java.util.Arrays;

/**
 * 以一个共享字节缓冲区存储变长字节序列的列向量。
 *
 * <p>第 {@code i} 行的内容是 {@code buffer[start[i], start[i] + length[i])}。
 * 行总是按顺序追加,因此截断时可以直接回收末尾的缓冲区空间。
 */
public class HeapBytesVector extends AbstractHeapVector implements BytesColumnVector {

    private static final long serialVersionUID = 1L;

    public int[] start;

    public int[] length;

    public byte[] buffer;

    private int bytesAppended;

    public HeapBytesVector(int capacity) {
        super(capacity);
        buffer = new byte[Math.max(capacity, 1) * 16];
        start = new int[capacity];
        length = new int[capacity];
    }

    @Override
    public void reset() {
        super.reset();
        if (start.length != capacity) {
            start = new int[capacity];
        } else {
            Arrays.fill(start, 0);
        }

        if (length.length != capacity) {
            length = new int[capacity];
        } else {
            Arrays.fill(length, 0);
        }

        this.bytesAppended = 0;
    }

    public void putByteArray(int elementNum, byte[] sourceBuf, int start, int length) {
        reserveBytes(bytesAppended + length);
        System.arraycopy(sourceBuf, start, buffer, bytesAppended, length);
        this.start[elementNum] = bytesAppended;
        this.length[elementNum] = length;
        bytesAppended += length;
    }

    public void appendByteArray(byte[] value, int offset, int length) {
        reserve(elementsAppended + 1);
        putByteArray(elementsAppended, value, offset, length);
        elementsAppended++;
    }

    @Override
    public void appendNull() {
        reserve(elementsAppended + 1);
        start[elementsAppended] = bytesAppended;
        length[elementsAppended] = 0;
        super.appendNull();
    }

    private void reserveBytes(int newCapacity) {
        if (newCapacity > buffer.length) {
            int newBytesCapacity = (int) Math.min(Integer.MAX_VALUE, newCapacity * 2L);
            buffer = Arrays.copyOf(buffer, newBytesCapacity);
        }
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (newCapacity > start.length) {
            start = Arrays.copyOf(start, newCapacity);
            length = Arrays.copyOf(length, newCapacity);
        }
    }

    @Override
    protected void truncateInternal(int size) {
        super.truncateInternal(size);
        bytesAppended = size == 0 ? 0 : start[size - 1] + length[size - 1];
    }

    @Override
    public Bytes getBytes(int i) {
        return new Bytes(buffer, start[i], length[i]);
    }
}
