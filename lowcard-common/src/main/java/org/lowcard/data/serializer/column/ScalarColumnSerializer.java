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

import org.lowcard.data.columnar.ColumnVector;
import org.lowcard.data.columnar.ElementRepresentation;
import org.lowcard.data.columnar.writable.WritableColumnVector;
import org.lowcard.data.serializer.InternalSerializers;
import org.lowcard.data.serializer.Serializer;
import org.lowcard.io.DataInputView;
import org.lowcard.io.DataOutputView;
import org.lowcard.io.stream.InputStreamGetter;
import org.lowcard.io.stream.OutputStreamGetter;
import org.lowcard.options.DictionaryOptions;
import org.lowcard.options.Options;
import org.lowcard.types.DataType;
import org.lowcard.types.SubstreamPath;

import javax.annotation.Nullable;

import java.io.IOException;

import static org.lowcard.utils.Preconditions.checkArgument;
import static org.lowcard.utils.Preconditions.checkNotNull;

/**
 * 标量类型的 {@link ColumnSerializer},整列只占用 {@code path} 本身一个子流。
 *
 * <p>批量格式是逐行单值格式的拼接,可空类型的每个值前面有一个 null 标志字节。
 */
public class ScalarColumnSerializer implements ColumnSerializer {

    private final DataType type;

    private final ElementRepresentation representation;

    private final Serializer<Object> serializer;

    private final int initialCapacity;

    public ScalarColumnSerializer(DataType type, Options options) {
        this.type = checkNotNull(type);
        this.representation = ElementRepresentation.of(type);
        this.serializer = InternalSerializers.create(type);
        this.initialCapacity = options.get(DictionaryOptions.COLUMN_INITIAL_CAPACITY);
    }

    @Override
    public DataType getType() {
        return type;
    }

    public ElementRepresentation getRepresentation() {
        return representation;
    }

    @Override
    public WritableColumnVector createColumn() {
        return createColumn(initialCapacity);
    }

    @Override
    public WritableColumnVector createColumn(int capacity) {
        return representation.createVector(capacity);
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
        DataOutputView out = getter.get(path);
        if (out == null) {
            return;
        }
        int size = column.size();
        checkArgument(
                offset >= 0 && offset <= size,
                "Offset %s is out of bounds of a column with %s rows.",
                offset,
                size);
        int end = limit == 0 || limit > size - offset ? size : offset + limit;
        for (int row = offset; row < end; row++) {
            serializer.serialize(get(column, row), out);
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
        DataInputView in = getter.get(path);
        if (in == null) {
            return;
        }
        if (limit > 0) {
            column.reserveAdditional(Math.min(limit, initialCapacity));
        }
        int count = 0;
        while ((limit == 0 || count < limit) && in.hasRemaining()) {
            append(column, serializer.deserialize(in));
            count++;
        }
    }

    @Override
    public void serializeOne(ColumnVector column, int row, DataOutputView target)
            throws IOException {
        serializer.serialize(get(column, row), target);
    }

    @Override
    public void deserializeOne(WritableColumnVector column, DataInputView source)
            throws IOException {
        append(column, serializer.deserialize(source));
    }

    @Override
    public String serializeOneToString(ColumnVector column, int row) {
        return serializer.serializeToString(get(column, row));
    }

    @Override
    public void deserializeOneFromString(WritableColumnVector column, String text) {
        append(column, serializer.deserializeFromString(text));
    }

    @Override
    public void append(WritableColumnVector column, @Nullable Object value) {
        checkArgument(
                value != null || type.isNullable(),
                "Null value is not allowed in column of %s.",
                type);
        representation.append(column, value);
    }

    @Nullable
    @Override
    public Object get(ColumnVector column, int row) {
        return representation.get(column, row);
    }

    @Override
    public String toString() {
        return "ScalarColumnSerializer{" + type + '}';
    }
}
