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

import org.lowcard.data.columnar.writable.WritableColumnVector;
import org.lowcard.data.dictionary.HashUniqueDictionary;
import org.lowcard.data.dictionary.UniqueDictionary;
import org.lowcard.types.DictionaryType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import static org.lowcard.utils.Preconditions.checkArgument;
import static org.lowcard.utils.Preconditions.checkElementIndex;
import static org.lowcard.utils.Preconditions.checkNotNull;

/**
 * 字典编码的列: 一个保存不同值的 {@link UniqueDictionary} 加上每行一个编码的 {@link IndexVector}。
 *
 * <p>第 {@code i} 行的值是 {@code dictionary.getObject(indexes[i])}。插入一个值时先放入字典,
 * 再把编码追加到索引中;如果编码超出了索引类型的宽度,本次插入新增的字典值会被撤销,列保持插入前的状态。
 *
 * <p>列中的行不能原地修改,{@link #setNullAt(int)} 不受支持,null 行通过 {@link #appendNull()}
 * 以字典中的 null 值表示。
 */
public class DictionaryColumnVector implements WritableColumnVector {

    private static final Logger LOG = LoggerFactory.getLogger(DictionaryColumnVector.class);

    private final DictionaryType type;

    private final UniqueDictionary dictionary;

    private final IndexVector indexes;

    public DictionaryColumnVector(DictionaryType type, int capacity) {
        this(
                type,
                new HashUniqueDictionary(type.getElementType(), capacity),
                new IndexVector(ElementRepresentation.of(type.getIndexType()), capacity));
    }

    public DictionaryColumnVector(
            DictionaryType type, UniqueDictionary dictionary, IndexVector indexes) {
        this.type = checkNotNull(type);
        this.dictionary = checkNotNull(dictionary);
        this.indexes = checkNotNull(indexes);
        checkArgument(
                indexes.getRepresentation() == ElementRepresentation.of(type.getIndexType()),
                "Index vector of %s does not match index type %s.",
                indexes.getRepresentation(),
                type.getIndexType());
    }

    public DictionaryType getType() {
        return type;
    }

    public UniqueDictionary getDictionary() {
        return dictionary;
    }

    public IndexVector getIndexes() {
        return indexes;
    }

    /**
     * 追加一行。
     *
     * @return 该值在字典中的编码
     * @throws IllegalStateException 如果编码超出索引类型的范围,此时列保持不变
     */
    public long insert(@Nullable Object value) {
        int sizeBefore = dictionary.size();
        int code = dictionary.uniqueInsert(value);
        appendCode(code, sizeBefore);
        return code;
    }

    /** 追加 {@code src} 第 {@code position} 行的值。 */
    public long insertFrom(ColumnVector src, int position) {
        int sizeBefore = dictionary.size();
        int code = dictionary.uniqueInsertFrom(src, position);
        appendCode(code, sizeBefore);
        return code;
    }

    private void appendCode(int code, int sizeBefore) {
        int added = dictionary.size() - sizeBefore;
        try {
            indexes.appendUnsigned(code);
        } catch (IllegalStateException e) {
            if (added > 0) {
                dictionary.popBack(added);
            }
            throw e;
        }
        if (added > 0 && code < sizeBefore) {
            // the value already existed, anything the store appended is unreferenced
            LOG.debug("Dropping {} unreferenced dictionary values.", added);
            dictionary.popBack(added);
        }
    }

    /** 返回第 {@code row} 行的编码。 */
    public int getCode(int row) {
        checkElementIndex(row, size());
        return (int) indexes.getUnsigned(row);
    }

    @Nullable
    public Object getObject(int row) {
        return dictionary.getObject(getCode(row));
    }

    @Override
    public boolean isNullAt(int i) {
        return getObject(i) == null;
    }

    @Override
    public int size() {
        return indexes.size();
    }

    @Override
    public int getCapacity() {
        return indexes.getVector().getCapacity();
    }

    @Override
    public void reset() {
        indexes.reset();
        dictionary.popBack(dictionary.size());
    }

    @Override
    public void setNullAt(int rowId) {
        throw new UnsupportedOperationException(
                "Rows of a dictionary column cannot be modified in place.");
    }

    @Override
    public void appendNull() {
        insert(null);
    }

    @Override
    public void reserve(int capacity) {
        indexes.getVector().reserve(capacity);
    }

    @Override
    public int getElementsAppended() {
        return indexes.size();
    }

    /** 删除末尾的行,字典中的值保持不变。 */
    @Override
    public void truncate(int size) {
        indexes.truncate(size);
    }

    @Override
    public String toString() {
        return String.format(
                "DictionaryColumnVector{type=%s, rows=%d, dictionarySize=%d}",
                type, size(), dictionary.size());
    }
}
