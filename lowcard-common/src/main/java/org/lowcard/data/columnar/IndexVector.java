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

import org.lowcard.data.columnar.heap.HeapByteVector;
import org.lowcard.data.columnar.heap.HeapIntVector;
import org.lowcard.data.columnar.heap.HeapLongVector;
import org.lowcard.data.columnar.heap.HeapShortVector;
import org.lowcard.data.columnar.writable.WritableColumnVector;

import static org.lowcard.utils.Preconditions.checkArgument;
import static org.lowcard.utils.Preconditions.checkNotNull;

/**
 * 字典列的索引数组: 每行一个指向字典的无符号编码。
 *
 * <p>底层是一个无符号表示(UINT8/16/32/64)的列向量。编码统一以 {@code long} 读写,
 * 追加的编码超出索引宽度时抛出 {@link IllegalStateException},而不是静默截断。
 */
public class IndexVector {

    private final ElementRepresentation representation;

    private final WritableColumnVector vector;

    /** 该宽度可以表示的最大编码。 */
    private final long maxCode;

    public IndexVector(ElementRepresentation representation, int capacity) {
        this(representation, representation.createVector(capacity));
    }

    public IndexVector(ElementRepresentation representation, WritableColumnVector vector) {
        checkArgument(
                representation.isUnsigned(),
                "Index representation must be unsigned, but was %s.",
                representation);
        this.representation = representation;
        this.vector = checkNotNull(vector);
        this.maxCode =
                representation.getWidth() == 8
                        ? Long.MAX_VALUE
                        : (1L << (representation.getWidth() * 8)) - 1;
    }

    public ElementRepresentation getRepresentation() {
        return representation;
    }

    /** 返回底层的列向量,批量编解码直接读写它。 */
    public WritableColumnVector getVector() {
        return vector;
    }

    public int size() {
        return vector.getElementsAppended();
    }

    public long getMaxCode() {
        return maxCode;
    }

    public long getUnsigned(int row) {
        switch (representation) {
            case UINT8:
                return Byte.toUnsignedLong(((HeapByteVector) vector).getByte(row));
            case UINT16:
                return Short.toUnsignedLong(((HeapShortVector) vector).getShort(row));
            case UINT32:
                return Integer.toUnsignedLong(((HeapIntVector) vector).getInt(row));
            default:
                return ((HeapLongVector) vector).getLong(row);
        }
    }

    /**
     * 追加一个编码。
     *
     * @throws IllegalStateException 如果编码超出索引类型的范围
     */
    public void appendUnsigned(long code) {
        if (code < 0 || code > maxCode) {
            throw new IllegalStateException(
                    String.format(
                            "Index type overflow: code %d does not fit into %s (max %d).",
                            code, representation, maxCode));
        }
        switch (representation) {
            case UINT8:
                ((HeapByteVector) vector).appendByte((byte) code);
                break;
            case UINT16:
                ((HeapShortVector) vector).appendShort((short) code);
                break;
            case UINT32:
                ((HeapIntVector) vector).appendInt((int) code);
                break;
            default:
                ((HeapLongVector) vector).appendLong(code);
        }
    }

    public void truncate(int size) {
        vector.truncate(size);
    }

    public void reset() {
        vector.reset();
    }
}
