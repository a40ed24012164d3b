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

package org.lowcard.io.stream;

import org.lowcard.io.DataInputView;
import org.lowcard.io.DataOutputView;
import org.lowcard.types.SubstreamPath;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lowcard.types.SubstreamPath.Substream.DICTIONARY_ELEMENTS;
import static org.lowcard.types.SubstreamPath.Substream.DICTIONARY_INDEXES;

/** Tests for {@link InMemorySubstreams}. */
class InMemorySubstreamsTest {

    private static final SubstreamPath ELEMENTS = SubstreamPath.of(DICTIONARY_ELEMENTS);

    private static final SubstreamPath INDEXES = SubstreamPath.of(DICTIONARY_INDEXES);

    @Test
    void testWritesToTheSamePathAppend() throws IOException {
        InMemorySubstreams streams = new InMemorySubstreams();
        streams.writer().get(INDEXES).writeByte(1);
        streams.writer().get(ELEMENTS).writeLong(0);
        streams.writer().get(INDEXES).writeByte(2);

        assertThat(streams.paths()).containsExactly(INDEXES, ELEMENTS);
        assertThat(streams.getBytes(INDEXES)).containsExactly(1, 2);
        assertThat(streams.getBytes(SubstreamPath.EMPTY)).isEmpty();
    }

    @Test
    void testReaderSessions() throws IOException {
        InMemorySubstreams streams = new InMemorySubstreams();
        DataOutputView out = streams.writer().get(INDEXES);
        out.writeByte(7);
        out.writeByte(8);

        InputStreamGetter first = streams.reader();
        assertThat(first.get(INDEXES).readByte()).isEqualTo((byte) 7);
        assertThat(first.get(INDEXES).readByte()).isEqualTo((byte) 8);
        assertThat(first.get(INDEXES).hasRemaining()).isFalse();

        DataInputView second = streams.reader().get(INDEXES);
        assertThat(second.readByte()).isEqualTo((byte) 7);

        assertThat(first.get(ELEMENTS)).isNull();
    }

    @Test
    void testExcludedPaths() throws IOException {
        InMemorySubstreams streams = new InMemorySubstreams();
        streams.writer().get(ELEMENTS).writeLong(1);
        streams.exclude(ELEMENTS);

        assertThat(streams.writer().get(ELEMENTS)).isNull();
        assertThat(streams.reader().get(ELEMENTS)).isNull();
        assertThat(streams.getBytes(ELEMENTS)).hasSize(8);
    }
}
