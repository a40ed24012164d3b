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

import org.lowcard.data.columnar.heap.HeapIntVector;
import org.lowcard.data.columnar.writable.WritableColumnVector;
import org.lowcard.io.DataInputDeserializer;
import org.lowcard.io.stream.InMemorySubstreams;
import org.lowcard.io.stream.InputStreamGetter;
import org.lowcard.options.Options;
import org.lowcard.types.DataTypes;
import org.lowcard.types.SubstreamPath;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ScalarColumnSerializer} and {@link ColumnSerializers}. */
class ScalarColumnSerializerTest {

    @Test
    void testNullableBulkFormat() throws IOException {
        ColumnSerializer serializer = ColumnSerializers.create(DataTypes.INT());
        WritableColumnVector column = serializer.createColumn(2);
        serializer.append(column, 1);
        serializer.append(column, null);
        serializer.append(column, 258);

        InMemorySubstreams streams = new InMemorySubstreams();
        serializer.serializeBulk(
                column,
                streams.writer(),
                0,
                0,
                SubstreamPath.EMPTY,
                serializer.createSerializeState());
        assertThat(streams.getBytes(SubstreamPath.EMPTY))
                .containsExactly(0, 0, 0, 0, 1, 1, 0, 0, 0, 1, 2);
    }

    @Test
    void testOffsetAndLimit() throws IOException {
        ColumnSerializer serializer = ColumnSerializers.create(DataTypes.SMALLINT().notNull());
        WritableColumnVector column = serializer.createColumn(8);
        for (short i = 0; i < 6; i++) {
            serializer.append(column, i);
        }

        InMemorySubstreams streams = new InMemorySubstreams();
        SerializeBulkState state = serializer.createSerializeState();
        serializer.serializeBulk(column, streams.writer(), 4, 10, SubstreamPath.EMPTY, state);
        serializer.serializeBulk(column, streams.writer(), 1, 2, SubstreamPath.EMPTY, state);
        assertThat(streams.getBytes(SubstreamPath.EMPTY)).containsExactly(0, 4, 0, 5, 0, 1, 0, 2);

        assertThatThrownBy(
                        () ->
                                serializer.serializeBulk(
                                        column,
                                        streams.writer(),
                                        7,
                                        1,
                                        SubstreamPath.EMPTY,
                                        state))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testReadStopsAtLimitAndEndOfStream() throws IOException {
        ColumnSerializer serializer = ColumnSerializers.create(DataTypes.UINT().notNull());
        InMemorySubstreams streams = new InMemorySubstreams();
        streams.writer().get(SubstreamPath.EMPTY).write(new byte[] {0, 0, 0, 1, -1, -1, -1, -1});

        WritableColumnVector column = serializer.createColumn(1);
        DeserializeBulkState state = serializer.createDeserializeState();
        InputStreamGetter reader = streams.reader();
        serializer.deserializeBulk(column, reader, 1, SubstreamPath.EMPTY, state);
        assertThat(column.getElementsAppended()).isEqualTo(1);

        serializer.deserializeBulk(column, reader, 5, SubstreamPath.EMPTY, state);
        assertThat(column.getElementsAppended()).isEqualTo(2);
        assertThat(((HeapIntVector) column).getInt(1)).isEqualTo(-1);
        assertThat(serializer.serializeOneToString(column, 1)).isEqualTo("4294967295");
    }

    @Test
    void testUnboundedLimitFromOffset() throws IOException {
        ColumnSerializer serializer = ColumnSerializers.create(DataTypes.UTINYINT().notNull());
        WritableColumnVector column = serializer.createColumn(4);
        for (byte i = 0; i < 4; i++) {
            serializer.append(column, i);
        }

        InMemorySubstreams streams = new InMemorySubstreams();
        SerializeBulkState state = serializer.createSerializeState();
        serializer.serializeBulk(column, streams.writer(), 0, 2, SubstreamPath.EMPTY, state);
        serializer.serializeBulk(
                column, streams.writer(), 2, Integer.MAX_VALUE, SubstreamPath.EMPTY, state);
        serializer.serializeBulk(
                column, streams.writer(), 4, Integer.MAX_VALUE, SubstreamPath.EMPTY, state);
        assertThat(streams.getBytes(SubstreamPath.EMPTY)).containsExactly(0, 1, 2, 3);
    }

    @Test
    void testReadWithUnboundedLimit() throws IOException {
        ColumnSerializer serializer = ColumnSerializers.create(DataTypes.UTINYINT().notNull());
        InMemorySubstreams streams = new InMemorySubstreams();
        streams.writer().get(SubstreamPath.EMPTY).write(new byte[] {4, 3, 2, 1});

        WritableColumnVector column = serializer.createColumn(1);
        serializer.deserializeBulk(
                column,
                streams.reader(),
                Integer.MAX_VALUE,
                SubstreamPath.EMPTY,
                serializer.createDeserializeState());
        assertThat(column.getElementsAppended()).isEqualTo(4);
        assertThat(serializer.get(column, 3)).isEqualTo((byte) 1);
    }

    @Test
    void testNullRejectedForNotNullType() {
        ColumnSerializer serializer = ColumnSerializers.create(DataTypes.STRING().notNull());
        WritableColumnVector column = serializer.createColumn();
        assertThatThrownBy(() -> serializer.append(column, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testSingleValuesAndTextForms() throws IOException {
        ColumnSerializer serializer = ColumnSerializers.create(DataTypes.DATE());
        WritableColumnVector column = serializer.createColumn();
        serializer.deserializeOneFromString(column, "1970-01-11");
        serializer.deserializeOneFromString(column, "\\N");
        serializer.deserializeOne(column, new DataInputDeserializer(new byte[] {0, 0, 1}));

        assertThat(serializer.get(column, 0)).isEqualTo((short) 10);
        assertThat(serializer.get(column, 1)).isNull();
        assertThat(serializer.get(column, 2)).isEqualTo((short) 1);
        assertThat(serializer.serializeOneToString(column, 2)).isEqualTo("1970-01-02");
    }

    @Test
    void testFactory() {
        assertThat(ColumnSerializers.create(DataTypes.CHAR(2)))
                .isInstanceOf(ScalarColumnSerializer.class);
        assertThat(
                        ColumnSerializers.create(
                                DataTypes.DICTIONARY(DataTypes.STRING(), DataTypes.UINT()),
                                new Options()))
                .isInstanceOf(DictionaryColumnSerializer.class);
        assertThatThrownBy(() -> ColumnSerializers.create(DataTypes.BOOLEAN()))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> ColumnSerializers.create(DataTypes.ARRAY(DataTypes.INT())))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
