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
import org.lowcard.data.columnar.heap.HeapIntVector;
import org.lowcard.data.columnar.writable.WritableColumnVector;
import org.lowcard.io.DataInputDeserializer;
import org.lowcard.io.DataOutputSerializer;
import org.lowcard.io.stream.InMemorySubstreams;
import org.lowcard.io.stream.InputStreamGetter;
import org.lowcard.options.DictionaryOptions;
import org.lowcard.options.Options;
import org.lowcard.types.DataType;
import org.lowcard.types.DataTypes;
import org.lowcard.types.DictionaryType;
import org.lowcard.types.SubstreamPath;

import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.lowcard.types.SubstreamPath.Substream.DICTIONARY_ELEMENTS;
import static org.lowcard.types.SubstreamPath.Substream.DICTIONARY_INDEXES;

/** Tests for {@link DictionaryColumnSerializer}. */
class DictionaryColumnSerializerTest {

    private static final SubstreamPath ELEMENTS = SubstreamPath.of(DICTIONARY_ELEMENTS);

    private static final SubstreamPath INDEXES = SubstreamPath.of(DICTIONARY_INDEXES);

    private static final DictionaryType STRING_DICTIONARY =
            new DictionaryType(DataTypes.STRING().notNull(), DataTypes.UTINYINT());

    @Test
    void testWriteAndReadColumn() throws IOException {
        DictionaryColumnSerializer serializer = serializer(STRING_DICTIONARY);
        DictionaryColumnVector column = serializer.createColumn();
        for (String value : Arrays.asList("a", "b", "a", "c")) {
            serializer.append(column, value);
        }
        assertThat(column.getDictionary().size()).isEqualTo(3);

        InMemorySubstreams streams = new InMemorySubstreams();
        serializer.serializeBulk(
                column,
                streams.writer(),
                0,
                column.size(),
                SubstreamPath.EMPTY,
                serializer.createSerializeState());

        assertThat(streams.paths()).containsExactly(ELEMENTS, INDEXES);
        assertThat(streams.getBytes(ELEMENTS))
                .containsExactly(
                        0, 0, 0, 0, 0, 0, 0, 3, 0, 0, 0, 1, 'a', 0, 0, 0, 1, 'b', 0, 0, 0, 1, 'c');
        assertThat(streams.getBytes(INDEXES)).containsExactly(0, 1, 0, 2);

        DictionaryColumnVector result = serializer.createColumn();
        serializer.deserializeBulk(
                result,
                streams.reader(),
                0,
                SubstreamPath.EMPTY,
                serializer.createDeserializeState());

        assertThat(read(serializer, result)).containsExactly("a", "b", "a", "c");
        assertThat(result.getDictionary().size()).isEqualTo(3);
    }

    @Test
    void testEmptyColumn() throws IOException {
        DictionaryColumnSerializer serializer = serializer(STRING_DICTIONARY);
        InMemorySubstreams streams = new InMemorySubstreams();
        serializer.serializeBulk(
                serializer.createColumn(),
                streams.writer(),
                0,
                0,
                SubstreamPath.EMPTY,
                serializer.createSerializeState());

        assertThat(streams.getBytes(ELEMENTS)).containsExactly(0, 0, 0, 0, 0, 0, 0, 0);
        assertThat(streams.getBytes(INDEXES)).isEmpty();

        DictionaryColumnVector result = serializer.createColumn();
        serializer.deserializeBulk(
                result,
                streams.reader(),
                0,
                SubstreamPath.EMPTY,
                serializer.createDeserializeState());
        assertThat(result.size()).isZero();
        assertThat(result.getDictionary().size()).isZero();
    }

    @Test
    void testChunkedPassTransfersDictionaryOnce() throws IOException {
        DictionaryColumnSerializer serializer =
                serializer(DataTypes.DICTIONARY(DataTypes.INT(), DataTypes.USMALLINT()));
        DictionaryColumnVector column = serializer.createColumn();
        List<Object> expected = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            serializer.append(column, i % 4);
            expected.add(i % 4);
        }

        InMemorySubstreams streams = new InMemorySubstreams();
        SerializeBulkState writeState = serializer.createSerializeState();
        for (int offset = 0; offset < column.size(); offset += 3) {
            serializer.serializeBulk(
                    column, streams.writer(), offset, 3, SubstreamPath.EMPTY, writeState);
        }
        assertThat(writeState.isDictionaryTransferred()).isTrue();
        // count + 4 nullable ints
        assertThat(streams.getBytes(ELEMENTS)).hasSize(8 + 4 * 5);
        assertThat(streams.getBytes(INDEXES)).hasSize(10 * 2);

        DictionaryColumnVector result = serializer.createColumn(2);
        DeserializeBulkState readState = serializer.createDeserializeState();
        InputStreamGetter reader = streams.reader();
        int chunks = 0;
        while (result.size() < 10) {
            serializer.deserializeBulk(result, reader, 4, SubstreamPath.EMPTY, readState);
            chunks++;
        }
        assertThat(chunks).isEqualTo(3);
        assertThat(result.getDictionary().size()).isEqualTo(4);
        assertThat(read(serializer, result)).isEqualTo(expected);
    }

    @Test
    void testNewPassResendsDictionary() throws IOException {
        DictionaryColumnSerializer serializer = serializer(STRING_DICTIONARY);
        DictionaryColumnVector column = serializer.createColumn();
        serializer.append(column, "only");

        InMemorySubstreams streams = new InMemorySubstreams();
        SerializeBulkState state = serializer.createSerializeState();
        serializer.serializeBulk(column, streams.writer(), 0, 0, SubstreamPath.EMPTY, state);
        int onePass = streams.getBytes(ELEMENTS).length;

        // resuming with the same state does not write the dictionary again
        serializer.serializeBulk(column, streams.writer(), 0, 0, SubstreamPath.EMPTY, state);
        assertThat(streams.getBytes(ELEMENTS)).hasSize(onePass);

        serializer.serializeBulk(
                column,
                streams.writer(),
                0,
                0,
                SubstreamPath.EMPTY,
                serializer.createSerializeState());
        assertThat(streams.getBytes(ELEMENTS)).hasSize(2 * onePass);
    }

    @Test
    void testChunkedPassWithUnboundedLimit() throws IOException {
        DictionaryColumnSerializer serializer = serializer(STRING_DICTIONARY);
        DictionaryColumnVector column = serializer.createColumn();
        for (String value : Arrays.asList("a", "b", "a", "c")) {
            serializer.append(column, value);
        }

        InMemorySubstreams streams = new InMemorySubstreams();
        SerializeBulkState writeState = serializer.createSerializeState();
        serializer.serializeBulk(column, streams.writer(), 0, 2, SubstreamPath.EMPTY, writeState);
        serializer.serializeBulk(
                column,
                streams.writer(),
                2,
                Integer.MAX_VALUE,
                SubstreamPath.EMPTY,
                writeState);
        assertThat(streams.getBytes(INDEXES)).containsExactly(0, 1, 0, 2);

        DictionaryColumnVector result = serializer.createColumn(1);
        serializer.deserializeBulk(
                result,
                streams.reader(),
                Integer.MAX_VALUE,
                SubstreamPath.EMPTY,
                serializer.createDeserializeState());
        assertThat(read(serializer, result)).containsExactly("a", "b", "a", "c");
    }

    @Test
    void testSecondPassIntoNonEmptyColumn() throws IOException {
        DictionaryColumnSerializer serializer = serializer(STRING_DICTIONARY);
        InMemorySubstreams first = write(serializer, "a", "b");
        InMemorySubstreams second = write(serializer, "b", "c", "b");

        DictionaryColumnVector result = serializer.createColumn();
        serializer.deserializeBulk(
                result,
                first.reader(),
                0,
                SubstreamPath.EMPTY,
                serializer.createDeserializeState());

        // the second pass is read in chunks, every chunk goes through the same code mapping
        DeserializeBulkState state = serializer.createDeserializeState();
        InputStreamGetter reader = second.reader();
        serializer.deserializeBulk(result, reader, 2, SubstreamPath.EMPTY, state);
        serializer.deserializeBulk(result, reader, 2, SubstreamPath.EMPTY, state);

        assertThat(read(serializer, result)).containsExactly("a", "b", "b", "c", "b");
        assertThat(result.getDictionary().size()).isEqualTo(3);
        assertThat(result.getCode(2)).isEqualTo(1);
        assertThat(result.getCode(3)).isEqualTo(2);
    }

    @Test
    void testSecondPassRejectsIndexOutsidePayload() throws IOException {
        DictionaryColumnSerializer serializer = serializer(STRING_DICTIONARY);
        DictionaryColumnVector result = serializer.createColumn();
        serializer.append(result, "z");

        // payload "x", "y" with the codes 0, 1 and 2
        InMemorySubstreams streams = handWrittenPayload("x", "y");
        assertThatThrownBy(
                        () ->
                                serializer.deserializeBulk(
                                        result,
                                        streams.reader(),
                                        0,
                                        SubstreamPath.EMPTY,
                                        serializer.createDeserializeState()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("out of bounds");
        assertThat(read(serializer, result)).containsExactly("z");
    }

    @Test
    void testAbsentSubstreamsAreSkipped() throws IOException {
        DictionaryColumnSerializer serializer = serializer(STRING_DICTIONARY);
        DictionaryColumnVector column = serializer.createColumn();
        serializer.append(column, "a");
        serializer.append(column, "b");

        InMemorySubstreams indexesOnly = new InMemorySubstreams().exclude(ELEMENTS);
        SerializeBulkState state = serializer.createSerializeState();
        serializer.serializeBulk(
                column, indexesOnly.writer(), 0, 0, SubstreamPath.EMPTY, state);
        assertThat(indexesOnly.paths()).containsExactly(INDEXES);
        assertThat(state.isDictionaryTransferred()).isFalse();

        InMemorySubstreams full = new InMemorySubstreams();
        serializer.serializeBulk(
                column,
                full.writer(),
                0,
                0,
                SubstreamPath.EMPTY,
                serializer.createSerializeState());

        DictionaryColumnVector dictionaryOnly = serializer.createColumn();
        serializer.deserializeBulk(
                dictionaryOnly,
                full.exclude(INDEXES).reader(),
                0,
                SubstreamPath.EMPTY,
                serializer.createDeserializeState());
        assertThat(dictionaryOnly.size()).isZero();
        assertThat(dictionaryOnly.getDictionary().size()).isEqualTo(2);
    }

    @Test
    void testNestedPath() throws IOException {
        DictionaryColumnSerializer serializer = serializer(STRING_DICTIONARY);
        DictionaryColumnVector column = serializer.createColumn();
        serializer.append(column, "v");

        SubstreamPath base = SubstreamPath.of(SubstreamPath.Substream.ARRAY_ELEMENTS);
        InMemorySubstreams streams = new InMemorySubstreams();
        serializer.serializeBulk(
                column, streams.writer(), 0, 0, base, serializer.createSerializeState());
        assertThat(streams.paths())
                .containsExactly(
                        base.append(DICTIONARY_ELEMENTS), base.append(DICTIONARY_INDEXES));
    }

    @Test
    void testNullableElements() throws IOException {
        DictionaryColumnSerializer serializer =
                serializer(DataTypes.DICTIONARY(DataTypes.STRING(), DataTypes.UINT()));
        DictionaryColumnVector column = serializer.createColumn();
        List<Object> values = Arrays.asList("x", null, "y", null, "x");
        for (Object value : values) {
            serializer.append(column, value);
        }
        assertThat(column.getDictionary().size()).isEqualTo(3);

        DictionaryColumnVector result = roundTrip(serializer, column);
        assertThat(read(serializer, result)).isEqualTo(values);
        assertThat(result.isNullAt(1)).isTrue();
        assertThat(result.isNullAt(2)).isFalse();
    }

    @Test
    void testEveryElementAndIndexType() throws IOException {
        byte[] abc = "abc".getBytes(StandardCharsets.UTF_8);
        byte[] xy = fixedString("xy", 3);
        Object[][] cases = {
            {DataTypes.TINYINT(), (byte) -3, (byte) 7},
            {DataTypes.SMALLINT(), (short) -300, (short) 12},
            {DataTypes.INT(), -70000, 3},
            {DataTypes.BIGINT(), Long.MIN_VALUE, 1L},
            {DataTypes.UTINYINT(), (byte) 200, (byte) 1},
            {DataTypes.USMALLINT(), (short) 60000, (short) 2},
            {DataTypes.UINT(), (int) 4000000000L, 5},
            {DataTypes.UBIGINT(), -1L, 9L},
            {DataTypes.FLOAT(), 1.5f, -0.25f},
            {DataTypes.DOUBLE(), Math.PI, 0.0},
            {DataTypes.STRING(), "müde", ""},
            {DataTypes.VARCHAR(8), "short", "s"},
            {DataTypes.CHAR(3), abc, xy},
            {DataTypes.DATE(), (short) 19000, (short) 0},
            {DataTypes.DATETIME(), 1700000000, 0}
        };
        DataType[] indexTypes = {
            DataTypes.UTINYINT(), DataTypes.USMALLINT(), DataTypes.UINT(), DataTypes.UBIGINT()
        };
        for (Object[] testCase : cases) {
            for (DataType indexType : indexTypes) {
                DataType element = (DataType) testCase[0];
                DictionaryColumnSerializer serializer =
                        serializer(new DictionaryType(element, indexType));
                DictionaryColumnVector column = serializer.createColumn();
                List<Object> values =
                        Arrays.asList(testCase[1], testCase[2], testCase[1], null, testCase[2]);
                for (Object value : values) {
                    serializer.append(column, value);
                }

                DictionaryColumnVector result = roundTrip(serializer, column);
                assertThat(read(serializer, result))
                        .as("values of %s", serializer.getType())
                        .containsExactly(values.toArray());
                assertThat(result.getDictionary().size()).isEqualTo(3);
            }
        }
    }

    @Test
    void testTrustedPayloadIsNotVerified() throws IOException {
        InMemorySubstreams streams = handWrittenPayload("a", "b", "a");
        DictionaryColumnSerializer serializer = serializer(STRING_DICTIONARY);

        DictionaryColumnVector result = serializer.createColumn();
        serializer.deserializeBulk(
                result,
                streams.reader(),
                0,
                SubstreamPath.EMPTY,
                serializer.createDeserializeState());
        assertThat(result.getDictionary().size()).isEqualTo(2);
        assertThat(read(serializer, result)).containsExactly("a", "b", "a");
    }

    @Test
    void testVerificationRejectsDuplicatedPayload() {
        InMemorySubstreams streams = handWrittenPayload("a", "b", "a");
        DictionaryColumnSerializer serializer =
                new DictionaryColumnSerializer(
                        STRING_DICTIONARY,
                        new Options().set(DictionaryOptions.VERIFY_PAYLOAD, true));

        assertThatThrownBy(
                        () ->
                                serializer.deserializeBulk(
                                        serializer.createColumn(),
                                        streams.reader(),
                                        0,
                                        SubstreamPath.EMPTY,
                                        serializer.createDeserializeState()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not deduplicated");
    }

    @Test
    void testVerificationRejectsOutOfRangeIndexes() throws IOException {
        InMemorySubstreams streams = handWrittenPayload("a", "b");
        DictionaryColumnSerializer serializer =
                new DictionaryColumnSerializer(
                        STRING_DICTIONARY,
                        new Options().set(DictionaryOptions.VERIFY_PAYLOAD, true));
        // code 2 has no dictionary value
        DictionaryColumnVector result = serializer.createColumn();
        assertThatThrownBy(
                        () ->
                                serializer.deserializeBulk(
                                        result,
                                        streams.reader(),
                                        0,
                                        SubstreamPath.EMPTY,
                                        serializer.createDeserializeState()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("out of bounds");
        assertThat(result.size()).isZero();
    }

    @Test
    void testTruncatedDictionaryPayload() throws IOException {
        DataOutputSerializer elements = new DataOutputSerializer(32);
        elements.writeLong(5);
        elements.writeInt(1);
        elements.write('a');
        DictionaryColumnSerializer serializer = serializer(STRING_DICTIONARY);

        assertThatThrownBy(
                        () ->
                                serializer.deserializeBulk(
                                        serializer.createColumn(),
                                        path ->
                                                path.equals(ELEMENTS)
                                                        ? new DataInputDeserializer(
                                                                elements.getCopyOfBuffer())
                                                        : null,
                                        0,
                                        SubstreamPath.EMPTY,
                                        serializer.createDeserializeState()))
                .isInstanceOf(EOFException.class);
    }

    @Test
    void testInvalidDictionarySize() throws IOException {
        DataOutputSerializer elements = new DataOutputSerializer(8);
        elements.writeLong(-1);
        DictionaryColumnSerializer serializer = serializer(STRING_DICTIONARY);

        assertThatThrownBy(
                        () ->
                                serializer.deserializeBulk(
                                        serializer.createColumn(),
                                        path ->
                                                new DataInputDeserializer(
                                                        elements.getCopyOfBuffer()),
                                        0,
                                        SubstreamPath.EMPTY,
                                        serializer.createDeserializeState()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid dictionary size");
    }

    @Test
    void testRejectsNonDictionaryColumn() {
        DictionaryColumnSerializer serializer = serializer(STRING_DICTIONARY);
        HeapIntVector ints = new HeapIntVector(1);
        assertThatThrownBy(
                        () ->
                                serializer.serializeBulk(
                                        ints,
                                        new InMemorySubstreams().writer(),
                                        0,
                                        0,
                                        SubstreamPath.EMPTY,
                                        serializer.createSerializeState()))
                .isInstanceOf(LogicalException.class);
        assertThatThrownBy(() -> serializer.append(ints, "a"))
                .isInstanceOf(LogicalException.class);
    }

    @Test
    void testSingleValues() throws IOException {
        DictionaryColumnSerializer serializer = serializer(STRING_DICTIONARY);
        DictionaryColumnVector column = serializer.createColumn();
        serializer.append(column, "hello");

        DataOutputSerializer out = new DataOutputSerializer(16);
        serializer.serializeOne(column, 0, out);
        assertThat(out.getCopyOfBuffer()).containsExactly(0, 0, 0, 5, 'h', 'e', 'l', 'l', 'o');

        DictionaryColumnVector target = serializer.createColumn();
        serializer.deserializeOne(target, new DataInputDeserializer(out.getCopyOfBuffer()));
        serializer.deserializeOne(target, new DataInputDeserializer(out.getCopyOfBuffer()));

        assertThat(target.size()).isEqualTo(2);
        assertThat(target.getDictionary().size()).isEqualTo(1);
        assertThat(serializer.get(target, 1)).isEqualTo("hello");
    }

    @Test
    void testSingleValueTextForms() {
        DictionaryColumnSerializer serializer =
                serializer(DataTypes.DICTIONARY(DataTypes.CHAR(4), DataTypes.USMALLINT()));
        DictionaryColumnVector column = serializer.createColumn();

        serializer.deserializeOneFromString(column, "ab");
        serializer.deserializeOneFromString(column, "\\N");
        serializer.deserializeOneFromString(column, "ab");

        assertThat(column.size()).isEqualTo(3);
        assertThat(column.getDictionary().size()).isEqualTo(2);
        assertThat((byte[]) serializer.get(column, 0)).containsExactly('a', 'b', 0, 0);
        assertThat(serializer.serializeOneToString(column, 0)).isEqualTo("ab");
        assertThat(serializer.serializeOneToString(column, 1)).isEqualTo("\\N");
    }

    private static DictionaryColumnSerializer serializer(DictionaryType type) {
        return new DictionaryColumnSerializer(type, new Options());
    }

    private static DictionaryColumnVector roundTrip(
            DictionaryColumnSerializer serializer, DictionaryColumnVector column)
            throws IOException {
        InMemorySubstreams streams = new InMemorySubstreams();
        serializer.serializeBulk(
                column,
                streams.writer(),
                0,
                0,
                SubstreamPath.EMPTY,
                serializer.createSerializeState());
        DictionaryColumnVector result = serializer.createColumn();
        serializer.deserializeBulk(
                result,
                streams.reader(),
                0,
                SubstreamPath.EMPTY,
                serializer.createDeserializeState());
        return result;
    }

    private static InMemorySubstreams write(DictionaryColumnSerializer serializer, String... rows)
            throws IOException {
        DictionaryColumnVector column = serializer.createColumn();
        for (String row : rows) {
            serializer.append(column, row);
        }
        InMemorySubstreams streams = new InMemorySubstreams();
        serializer.serializeBulk(
                column,
                streams.writer(),
                0,
                0,
                SubstreamPath.EMPTY,
                serializer.createSerializeState());
        return streams;
    }

    private static List<Object> read(ColumnSerializer serializer, ColumnVector column) {
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < column.size(); i++) {
            values.add(serializer.get(column, i));
        }
        return values;
    }

    /** Writes a not deduplicated string dictionary followed by the codes 0, 1 and 2. */
    private static InMemorySubstreams handWrittenPayload(String... dictionary) {
        InMemorySubstreams streams = new InMemorySubstreams();
        try {
            ScalarColumnSerializer strings =
                    new ScalarColumnSerializer(DataTypes.STRING().notNull(), new Options());
            WritableColumnVector values = strings.createColumn();
            for (String value : dictionary) {
                strings.append(values, value);
            }
            streams.writer().get(ELEMENTS).writeLong(dictionary.length);
            strings.serializeBulk(
                    values, streams.writer(), 0, 0, ELEMENTS, strings.createSerializeState());
            streams.writer().get(INDEXES).write(new byte[] {0, 1, 2});
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        return streams;
    }

    private static byte[] fixedString(String value, int length) {
        return Arrays.copyOf(value.getBytes(StandardCharsets.UTF_8), length);
    }
}
