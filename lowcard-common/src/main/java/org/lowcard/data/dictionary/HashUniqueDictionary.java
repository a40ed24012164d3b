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

package org.lowcard.data.dictionary;

import org.lowcard.data.columnar.ColumnVector;
import org.lowcard.data.columnar.ElementRepresentation;
import org.lowcard.data.columnar.writable.WritableColumnVector;
import org.lowcard.types.DataType;
import org.lowcard.types.DataTypeChecks;
import org.lowcard.types.DataTypeRoot;

import javax.annotation.Nullable;

import java.util.HashMap;
import java.util.Map;

import static org.lowcard.utils.Preconditions.checkArgument;
import static org.lowcard.utils.Preconditions.checkElementIndex;
import static org.lowcard.utils.Preconditions.checkNotNull;

/**
 * 基于哈希表的 {@link UniqueDictionary}。
 *
 * <p>值按编码顺序保存在一个对应存储表示的列向量中,哈希表从值的相等性键
 * ({@link ElementRepresentation#toKey(Object)})映射到编码。
 */
public class HashUniqueDictionary implements UniqueDictionary {

    /** null 值在哈希表中的键。 */
    private static final Object NULL_KEY = new Object();

    private final DataType elementType;

    private final ElementRepresentation representation;

    private final boolean nullable;

    /** CHAR(n) 的字节数,其它类型为 -1。 */
    private final int fixedLength;

    private final WritableColumnVector values;

    private final Map<Object, Integer> codes;

    public HashUniqueDictionary(DataType elementType, int initialCapacity) {
        this.elementType = checkNotNull(elementType);
        this.representation = ElementRepresentation.of(elementType);
        this.nullable = elementType.isNullable();
        this.fixedLength =
                elementType.is(DataTypeRoot.CHAR) ? DataTypeChecks.getLength(elementType) : -1;
        this.values = representation.createVector(initialCapacity);
        this.codes = new HashMap<>();
    }

    public DataType getElementType() {
        return elementType;
    }

    @Override
    public ElementRepresentation getRepresentation() {
        return representation;
    }

    @Override
    public boolean isNullable() {
        return nullable;
    }

    @Override
    public int size() {
        return values.getElementsAppended();
    }

    @Override
    public int uniqueInsert(@Nullable Object value) {
        checkValue(value);
        Object key = keyOf(value);
        Integer existing = codes.get(key);
        if (existing != null) {
            return existing;
        }
        int code = size();
        representation.append(values, value);
        codes.put(key, code);
        return code;
    }

    @Override
    public int uniqueInsertFrom(ColumnVector src, int position) {
        return uniqueInsert(representation.get(src, position));
    }

    @Override
    public int[] uniqueInsertRangeFrom(ColumnVector src, int start, int length) {
        checkArgument(
                start >= 0 && length >= 0 && start + length <= src.size(),
                "Range [%s, %s) is out of bounds of a vector with %s rows.",
                start,
                start + length,
                src.size());
        values.reserveAdditional(length);
        int[] result = new int[length];
        for (int i = 0; i < length; i++) {
            result[i] = uniqueInsertFrom(src, start + i);
        }
        return result;
    }

    @Override
    public WritableColumnVector getNestedColumn() {
        return values;
    }

    @Override
    public void popBack(int n) {
        int size = size();
        checkArgument(n >= 0 && n <= size, "Cannot pop %s values from %s values.", n, size);
        for (int code = size - n; code < size; code++) {
            codes.remove(keyOf(getObject(code)));
        }
        values.truncate(size - n);
    }

    @Nullable
    @Override
    public Object getObject(int code) {
        checkElementIndex(code, size());
        return representation.get(values, code);
    }

    @Override
    public int indexOf(@Nullable Object value) {
        if (value == null && !nullable) {
            return -1;
        }
        Integer code = codes.get(keyOf(value));
        return code == null ? -1 : code;
    }

    private Object keyOf(@Nullable Object value) {
        return value == null ? NULL_KEY : representation.toKey(value);
    }

    private void checkValue(@Nullable Object value) {
        if (value == null) {
            checkArgument(
                    nullable, "Null value is not allowed in dictionary of %s.", elementType);
        } else if (fixedLength >= 0) {
            checkArgument(
                    value instanceof byte[] && ((byte[]) value).length == fixedLength,
                    "Value of %s must be a byte array of exactly %s bytes.",
                    elementType,
                    fixedLength);
        }
    }

    @Override
    public String toString() {
        return String.format("HashUniqueDictionary{type=%s, size=%d}", elementType, size());
    }
}
