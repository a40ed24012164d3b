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

import org.lowcard.data.columnar.DoubleColumnVector;

import java.util.Arrays;

/** 以 double 数组存储的列向量。 */
public class HeapDoubleVector extends AbstractHeapVector implements DoubleColumnVector {

    private static final long serialVersionUID = 1L;

    public double[] vector;

    public HeapDoubleVector(int len) {
        super(len);
        vector = new double[len];
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (vector.length < newCapacity) {
            vector = Arrays.copyOf(vector, newCapacity);
        }
    }

    @Override
    public double getDouble(int i) {
        return vector[i];
    }

    public void setDouble(int i, double value) {
        vector[i] = value;
    }

    public void appendDouble(double v) {
        reserve(elementsAppended + 1);
        setDouble(elementsAppended, v);
        elementsAppended++;
    }

    @Override
    public void reset() {
        super.reset();
        if (vector.length != capacity) {
            vector = new double[capacity];
        } else {
            Arrays.fill(vector, (double) 0);
        }
    }
}
