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

package org.lowcard.data.serializer.column;

import org.lowcard.data.LogicalException;
import org.lowcard.data.columnar.ColumnVector;
import org.lowcard.data.columnar.DictionaryColumnVector;
import org.lowcard.data.columnar.IndexVector;
import org.lowcard.data.columnar.writable.WritableColumnVector;
import org.lowcard.data.dictionary.UniqueDictionary;
import org.lowcard.data.serializer.InternalSerializers;
import org.lowcard.data.serializer.Serializer;
import org.lowcard.io.DataInputView;
import org.lowcard.io.DataOutputView;
import org.lowcard.io.stream.InputStreamGetter;
import org.lowcard.io.stream.OutputStreamGetter;
import org.lowcard.options.DictionaryOptions;
import org.lowcard.options.Options;
import org.lowcard.types.DictionaryType;
import org.lowcard.types.SubstreamPath;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.EOFException;
import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import static org.lowcard.utils.Preconditions.checkNotNull;

/**
 * 字典类型的 {@link ColumnSerializer}。
 *
 * <p>一列占用两个子流:
 * <ul>
 *     <li>{@code DICTIONARY_ELEMENTS}: 一个 {@code long} 表示的字典大小,后跟按编码顺序排列的所有字典值,
 *         格式是元素类型的批量格式。每个 pass 只传输一次。</li>
 *     <li>{@code DICTIONARY_INDEXES}: 每行一个编码,格式是索引类型的批量格式,可以分任意多块传输。</li>
 * </ul>
 *
 * <p>读取时默认信任字典载荷已经去重,并且载荷的顺序就是编码 {@code 0..n-1}。
 * 打开 {@link DictionaryOptions#VERIFY_PAYLOAD} 后会校验这一点,以及读到的编码都在字典范围内。
 */
public class DictionaryColumnSerializer implements ColumnSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(DictionaryColumnSerializer.class);

    private final DictionaryType type;

    private final ScalarColumnSerializer elementSerializer;

    private final ScalarColumnSerializer indexSerializer;

    private final Serializer<Object> valueSerializer;

    private final boolean verifyPayload;

    private final int initialCapacity;

    public DictionaryColumnSerializer(DictionaryType type, Options options) {
        this.type = checkNotNull(type);
        this.elementSerializer = new ScalarColumnSerializer(type.getElementType(), options);
        this.indexSerializer = new ScalarColumnSerializer(type.getIndexType(), options);
        this.valueSerializer = InternalSerializers.create(type.getElementType());
        this.verifyPayload = options.get(DictionaryOptions.VERIFY_PAYLOAD);
        this.initialCapacity = options.get(DictionaryOptions.COLUMN_INITIAL_CAPACITY);
    }

    @Override
    public DictionaryType getType() {
        return type;
    }

    @Override
    public DictionaryColumnVector createColumn() {
        return createColumn(initialCapacity);
    }

    @Override
    public DictionaryColumnVector createColumn(int capacity) {
        return new DictionaryColumnVector(type, capacity);
    }

    @Override
    public void serializeBulk(
            ColumnVector column,
            OutputStreamGetter getter,
            int offset,
            int limit,
            SubstreamPath path,
            SerializeBulkState state)
            throws IOException {
        DictionaryColumnVector dictionaryColumn = asDictionaryColumn(column);

        SubstreamPath elementsPath = path.append(SubstreamPath.Substream.DICTIONARY_ELEMENTS);
        DataOutputView elements = getter.get(elementsPath);
        if (elements != null && !state.isDictionaryTransferred()) {
            UniqueDictionary dictionary = dictionaryColumn.getDictionary();
            int size = dictionary.size();
            elements.writeLong(size);
            if (size > 0) {
                elementSerializer.serializeBulk(
                        dictionary.getNestedColumn(),
                        p -> elements,
                        0,
                        size,
                        elementsPath,
                        elementSerializer.createSerializeState());
            }
            state.markDictionaryTransferred();
            LOG.debug("Wrote dictionary of {} values to {}", size, elementsPath);
        }

        SubstreamPath indexesPath =
                elementsPath.withLast(SubstreamPath.Substream.DICTIONARY_INDEXES);
        DataOutputView indexes = getter.get(indexesPath);
        if (indexes != null) {
            indexSerializer.serializeBulk(
                    dictionaryColumn.getIndexes().getVector(),
                    p -> indexes,
                    offset,
                    limit,
                    indexesPath,
                    indexSerializer.createSerializeState());
        }
    }

    @Override
    public void deserializeBulk(
            WritableColumnVector column,
            InputStreamGetter getter,
            int limit,
            SubstreamPath path,
            DeserializeBulkState state)
            throws IOException {
        DictionaryColumnVector dictionaryColumn = asDictionaryColumn(column);
        UniqueDictionary dictionary = dictionaryColumn.getDictionary();

        SubstreamPath elementsPath = path.append(SubstreamPath.Substream.DICTIONARY_ELEMENTS);
        DataInputView elements = getter.get(elementsPath);
        if (elements != null && !state.isDictionaryTransferred()) {
            long count = elements.readLong();
            if (count < 0 || count > Integer.MAX_VALUE) {
                throw new IOException(
                        "Invalid dictionary size " + count + " in substream " + elementsPath);
            }
            int size = (int) count;
            if (size > 0) {
                WritableColumnVector staging = elementSerializer.createColumn(size);
                elementSerializer.deserializeBulk(
                        staging,
                        p -> elements,
                        size,
                        elementsPath,
                        elementSerializer.createDeserializeState());
                if (staging.getElementsAppended() < size) {
                    throw new EOFException(
                            String.format(
                                    "Expected %d dictionary values in %s, but only %d were found.",
                                    size, elementsPath, staging.getElementsAppended()));
                }
                int[] codes = dictionary.uniqueInsertRangeFrom(staging, 0, size);
                if (verifyPayload) {
                    verifyCodes(codes, elementsPath);
                }
                state.setCodeMapping(isIdentity(codes) ? null : codes);
            }
            state.markDictionaryTransferred();
            LOG.debug("Read dictionary of {} values from {}", size, elementsPath);
        }

        SubstreamPath indexesPath =
                elementsPath.withLast(SubstreamPath.Substream.DICTIONARY_INDEXES);
        DataInputView indexes = getter.get(indexesPath);
        if (indexes != null) {
            IndexVector indexVector = dictionaryColumn.getIndexes();
            int rowsBefore = indexVector.size();
            indexSerializer.deserializeBulk(
                    indexVector.getVector(),
                    p -> indexes,
                    limit,
                    indexesPath,
                    indexSerializer.createDeserializeState());
            int[] mapping = state.getCodeMapping();
            if (mapping != null) {
                remapIndexes(indexVector, rowsBefore, mapping, indexesPath);
            } else if (verifyPayload) {
                verifyIndexes(indexVector, rowsBefore, dictionary.size());
            }
        }
    }

    private static boolean isIdentity(int[] codes) {
        for (int i = 0; i < codes.length; i++) {
            if (codes[i] != i) {
                return false;
            }
        }
        return true;
    }

    /** 列中已有字典时,载荷编码 i 对应列字典中的编码 mapping[i],需要改写本次读入的索引。 */
    private static void remapIndexes(
            IndexVector indexes, int from, int[] mapping, SubstreamPath path) {
        int rows = indexes.size() - from;
        long[] decoded = new long[rows];
        for (int i = 0; i < rows; i++) {
            decoded[i] = indexes.getUnsigned(from + i);
        }
        indexes.truncate(from);
        for (int i = 0; i < rows; i++) {
            long code = decoded[i];
            if (code >= mapping.length) {
                indexes.truncate(from);
                throw new IllegalStateException(
                        String.format(
                                "Index %d at row %d in %s is out of bounds of a dictionary"
                                        + " payload with %d values.",
                                code, from + i, path, mapping.length));
            }
            try {
                indexes.appendUnsigned(mapping[(int) code]);
            } catch (IllegalStateException e) {
                indexes.truncate(from);
                throw e;
            }
        }
    }

    private static void verifyCodes(int[] codes, SubstreamPath path) {
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < codes.length; i++) {
            if (!seen.add(codes[i])) {
                throw new IllegalStateException(
                        String.format(
                                "Dictionary payload in %s is not deduplicated: value %d was"
                                        + " assigned code %d.",
                                path, i, codes[i]));
            }
        }
    }

    private static void verifyIndexes(IndexVector indexes, int from, int dictionarySize) {
        for (int row = from; row < indexes.size(); row++) {
            long code = indexes.getUnsigned(row);
            if (code >= dictionarySize) {
                indexes.truncate(from);
                throw new IllegalStateException(
                        String.format(
                                "Index %d at row %d is out of bounds of a dictionary with %d"
                                        + " values.",
                                code, row, dictionarySize));
            }
        }
    }

    @Override
    public void serializeOne(ColumnVector column, int row, DataOutputView target)
            throws IOException {
        valueSerializer.serialize(asDictionaryColumn(column).getObject(row), target);
    }

    @Override
    public void deserializeOne(WritableColumnVector column, DataInputView source)
            throws IOException {
        DictionaryColumnVector dictionaryColumn = asDictionaryColumn(column);
        Object staged = valueSerializer.deserialize(source);
        dictionaryColumn.insert(staged);
    }

    @Override
    public String serializeOneToString(ColumnVector column, int row) {
        return valueSerializer.serializeToString(asDictionaryColumn(column).getObject(row));
    }

    @Override
    public void deserializeOneFromString(WritableColumnVector column, String text) {
        DictionaryColumnVector dictionaryColumn = asDictionaryColumn(column);
        Object staged = valueSerializer.deserializeFromString(text);
        dictionaryColumn.insert(staged);
    }

    @Override
    public void append(WritableColumnVector column, @Nullable Object value) {
        asDictionaryColumn(column).insert(value);
    }

    @Nullable
    @Override
    public Object get(ColumnVector column, int row) {
        return asDictionaryColumn(column).getObject(row);
    }

    private DictionaryColumnVector asDictionaryColumn(ColumnVector column) {
        if (!(column instanceof DictionaryColumnVector)) {
            throw new LogicalException(
                    String.format(
                            "Column of %s must be a DictionaryColumnVector, but was %s.",
                            type, column == null ? null : column.getClass().getName()));
        }
        return (DictionaryColumnVector) column;
    }

    @Override
    public String toString() {
        return "DictionaryColumnSerializer{" + type + '}';
    }
}
