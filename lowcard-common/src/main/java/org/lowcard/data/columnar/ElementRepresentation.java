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

import org.lowcard.data.LogicalException;
import org.lowcard.data.columnar.heap.HeapByteVector;
import org.lowcard.data.columnar.heap.HeapBytesVector;
import org.lowcard.data.columnar.heap.HeapDoubleVector;
import org.lowcard.data.columnar.heap.HeapFloatVector;
import org.lowcard.data.columnar.heap.HeapIntVector;
import org.lowcard.data.columnar.heap.HeapLongVector;
import org.lowcard.data.columnar.heap.HeapShortVector;
import org.lowcard.data.columnar.writable.WritableColumnVector;
import org.lowcard.types.DataType;
import org.lowcard.types.DataTypeChecks;

import javax.annotation.Nullable;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * 列值的物理存储表示。
 *
 * <p>每个逻辑类型在去掉可选包装后对应唯一一种表示,每种表示负责:
 * <ul>
 *     <li>创建对应的堆内列向量</li>
 *     <li>以 Java 对象读取和追加一行的值</li>
 *     <li>为去重字典提供值的相等性键</li>
 * </ul>
 *
 * <p>Java 对象形式: 整数表示使用对应宽度的装箱类型(无符号表示保存位模式),
 * {@link #STRING} 使用 {@link String},{@link #FIXED_STRING} 使用 {@code byte[]}。
 */
public enum ElementRepresentation {
    INT8(1, false) {
        @Override
        public WritableColumnVector createVector(int capacity) {
            return new HeapByteVector(capacity);
        }

        @Override
        Object getNonNull(ColumnVector vector, int row) {
            return ((ByteColumnVector) vector).getByte(row);
        }

        @Override
        void appendNonNull(WritableColumnVector vector, Object value) {
            ((HeapByteVector) vector).appendByte((Byte) value);
        }
    },
    UINT8(1, true) {
        @Override
        public WritableColumnVector createVector(int capacity) {
            return INT8.createVector(capacity);
        }

        @Override
        Object getNonNull(ColumnVector vector, int row) {
            return INT8.getNonNull(vector, row);
        }

        @Override
        void appendNonNull(WritableColumnVector vector, Object value) {
            INT8.appendNonNull(vector, value);
        }
    },
    INT16(2, false) {
        @Override
        public WritableColumnVector createVector(int capacity) {
            return new HeapShortVector(capacity);
        }

        @Override
        Object getNonNull(ColumnVector vector, int row) {
            return ((ShortColumnVector) vector).getShort(row);
        }

        @Override
        void appendNonNull(WritableColumnVector vector, Object value) {
            ((HeapShortVector) vector).appendShort((Short) value);
        }
    },
    UINT16(2, true) {
        @Override
        public WritableColumnVector createVector(int capacity) {
            return INT16.createVector(capacity);
        }

        @Override
        Object getNonNull(ColumnVector vector, int row) {
            return INT16.getNonNull(vector, row);
        }

        @Override
        void appendNonNull(WritableColumnVector vector, Object value) {
            INT16.appendNonNull(vector, value);
        }
    },
    INT32(4, false) {
        @Override
        public WritableColumnVector createVector(int capacity) {
            return new HeapIntVector(capacity);
        }

        @Override
        Object getNonNull(ColumnVector vector, int row) {
            return ((IntColumnVector) vector).getInt(row);
        }

        @Override
        void appendNonNull(WritableColumnVector vector, Object value) {
            ((HeapIntVector) vector).appendInt((Integer) value);
        }
    },
    UINT32(4, true) {
        @Override
        public WritableColumnVector createVector(int capacity) {
            return INT32.createVector(capacity);
        }

        @Override
        Object getNonNull(ColumnVector vector, int row) {
            return INT32.getNonNull(vector, row);
        }

        @Override
        void appendNonNull(WritableColumnVector vector, Object value) {
            INT32.appendNonNull(vector, value);
        }
    },
    INT64(8, false) {
        @Override
        public WritableColumnVector createVector(int capacity) {
            return new HeapLongVector(capacity);
        }

        @Override
        Object getNonNull(ColumnVector vector, int row) {
            return ((LongColumnVector) vector).getLong(row);
        }

        @Override
        void appendNonNull(WritableColumnVector vector, Object value) {
            ((HeapLongVector) vector).appendLong((Long) value);
        }
    },
    UINT64(8, true) {
        @Override
        public WritableColumnVector createVector(int capacity) {
            return INT64.createVector(capacity);
        }

        @Override
        Object getNonNull(ColumnVector vector, int row) {
            return INT64.getNonNull(vector, row);
        }

        @Override
        void appendNonNull(WritableColumnVector vector, Object value) {
            INT64.appendNonNull(vector, value);
        }
    },
    FLOAT32(4, false) {
        @Override
        public WritableColumnVector createVector(int capacity) {
            return new HeapFloatVector(capacity);
        }

        @Override
        Object getNonNull(ColumnVector vector, int row) {
            return ((FloatColumnVector) vector).getFloat(row);
        }

        @Override
        void appendNonNull(WritableColumnVector vector, Object value) {
            ((HeapFloatVector) vector).appendFloat((Float) value);
        }
    },
    FLOAT64(8, false) {
        @Override
        public WritableColumnVector createVector(int capacity) {
            return new HeapDoubleVector(capacity);
        }

        @Override
        Object getNonNull(ColumnVector vector, int row) {
            return ((DoubleColumnVector) vector).getDouble(row);
        }

        @Override
        void appendNonNull(WritableColumnVector vector, Object value) {
            ((HeapDoubleVector) vector).appendDouble((Double) value);
        }
    },
    STRING(-1, false) {
        @Override
        public WritableColumnVector createVector(int capacity) {
            return new HeapBytesVector(capacity);
        }

        @Override
        Object getNonNull(ColumnVector vector, int row) {
            BytesColumnVector.Bytes bytes = ((BytesColumnVector) vector).getBytes(row);
            return new String(bytes.data, bytes.offset, bytes.len, StandardCharsets.UTF_8);
        }

        @Override
        void appendNonNull(WritableColumnVector vector, Object value) {
            byte[] bytes = ((String) value).getBytes(StandardCharsets.UTF_8);
            ((HeapBytesVector) vector).appendByteArray(bytes, 0, bytes.length);
        }
    },
    FIXED_STRING(-1, false) {
        @Override
        public WritableColumnVector createVector(int capacity) {
            return new HeapBytesVector(capacity);
        }

        @Override
        Object getNonNull(ColumnVector vector, int row) {
            BytesColumnVector.Bytes bytes = ((BytesColumnVector) vector).getBytes(row);
            byte[] copy = new byte[bytes.len];
            System.arraycopy(bytes.data, bytes.offset, copy, 0, bytes.len);
            return copy;
        }

        @Override
        void appendNonNull(WritableColumnVector vector, Object value) {
            byte[] bytes = (byte[]) value;
            ((HeapBytesVector) vector).appendByteArray(bytes, 0, bytes.length);
        }

        @Override
        public Object toKey(Object value) {
            return value == null ? null : ByteBuffer.wrap((byte[]) value);
        }
    };

    /** 定宽表示每个值的字节数,变长表示为 -1。 */
    private final int width;

    private final boolean unsigned;

    ElementRepresentation(int width, boolean unsigned) {
        this.width = width;
        this.unsigned = unsigned;
    }

    public int getWidth() {
        return width;
    }

    public boolean isUnsigned() {
        return unsigned;
    }

    /** 创建该表示的空列向量。 */
    public abstract WritableColumnVector createVector(int capacity);

    abstract Object getNonNull(ColumnVector vector, int row);

    abstract void appendNonNull(WritableColumnVector vector, Object value);

    /** 读取第 {@code row} 行的值,null 行返回 {@code null}。 */
    @Nullable
    public Object get(ColumnVector vector, int row) {
        return vector.isNullAt(row) ? null : getNonNull(vector, row);
    }

    /** 追加一行,{@code null} 追加为 null 行。 */
    public void append(WritableColumnVector vector, @Nullable Object value) {
        if (value == null) {
            vector.appendNull();
        } else {
            appendNonNull(vector, value);
        }
    }

    /**
     * 返回值的相等性键,两个值相等当且仅当它们的键 {@link Object#equals} 相等。
     *
     * <p>装箱的数值和 {@link String} 本身就是合适的键;{@code byte[]} 需要按内容比较。
     */
    public Object toKey(Object value) {
        return value;
    }

    /**
     * 返回逻辑类型对应的存储表示。
     *
     * @throws LogicalException 如果类型没有对应的存储表示
     */
    public static ElementRepresentation of(DataType type) {
        DataType inner = DataTypeChecks.unwrapOptional(type);
        switch (inner.getTypeRoot()) {
            case VARCHAR:
                return STRING;
            case CHAR:
                return FIXED_STRING;
            case DATE:
                return UINT16;
            case DATETIME:
                return UINT32;
            case TINYINT:
                return INT8;
            case SMALLINT:
                return INT16;
            case INTEGER:
                return INT32;
            case BIGINT:
                return INT64;
            case UTINYINT:
                return UINT8;
            case USMALLINT:
                return UINT16;
            case UINTEGER:
                return UINT32;
            case UBIGINT:
                return UINT64;
            case FLOAT:
                return FLOAT32;
            case DOUBLE:
                return FLOAT64;
            default:
                throw new LogicalException("Unexpected type for column storage: " + type);
        }
    }
}
