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

import org.lowcard.data.columnar.ByteColumnVector;

import java.util.Arrays;

/** 以 byte 数组存储的列向量。 */
public class HeapByteVector extends AbstractHeapVector implements ByteColumnVector {

    private static final long serialVersionUID = 1L;

    public byte[] vector;

    public HeapByteVector(int len) {
        super(len);
        vector = new byte[len];
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (vector.length < newCapacity) {
            vector = Arrays.copyOf(vector, newCapacity);
        }
    }

    @Override
    public byte getByte(int i) {
        return vector[i];
    }

    public void setByte(int i, byte value) {
        vector[i] = value;
    }

    public void appendByte(byte v) {
        reserve(elementsAppended + 1);
        setByte(elementsAppended, v);
        elementsAppended++;
    }

    @Override
    public void reset() {
        super.reset();
        if (vector.length != capacity) {
            vector = new byte[capacity];
        } else {
            Arrays.fill(vector, (byte) 0);
        }
    }
}
