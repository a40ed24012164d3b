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

package org.lowcard.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.lowcard.types.SubstreamPath.Substream.ARRAY_ELEMENTS;
import static org.lowcard.types.SubstreamPath.Substream.ARRAY_SIZES;
import static org.lowcard.types.SubstreamPath.Substream.DICTIONARY_ELEMENTS;
import static org.lowcard.types.SubstreamPath.Substream.DICTIONARY_INDEXES;

/** Tests for {@link SubstreamPath}. */
class SubstreamPathTest {

    @Test
    void testAppendAndWithLastAreImmutable() {
        SubstreamPath elements = SubstreamPath.EMPTY.append(DICTIONARY_ELEMENTS);
        SubstreamPath indexes = elements.withLast(DICTIONARY_INDEXES);

        assertThat(SubstreamPath.EMPTY.isEmpty()).isTrue();
        assertThat(elements.last()).isEqualTo(DICTIONARY_ELEMENTS);
        assertThat(indexes.last()).isEqualTo(DICTIONARY_INDEXES);
        assertThat(indexes.size()).isEqualTo(1);
        assertThat(elements).isNotEqualTo(indexes);
        assertThat(elements).isEqualTo(SubstreamPath.of(DICTIONARY_ELEMENTS));
        assertThat(elements.hashCode())
                .isEqualTo(SubstreamPath.of(DICTIONARY_ELEMENTS).hashCode());
    }

    @Test
    void testEmptyPathHasNoTail() {
        assertThatThrownBy(() -> SubstreamPath.EMPTY.withLast(DICTIONARY_INDEXES))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(SubstreamPath.EMPTY::last).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testToFileName() {
        assertThat(SubstreamPath.EMPTY.toFileName("c")).isEqualTo("c");
        assertThat(SubstreamPath.of(DICTIONARY_ELEMENTS).toFileName("c")).isEqualTo("c.dict");
        assertThat(SubstreamPath.of(DICTIONARY_INDEXES).toFileName("c")).isEqualTo("c");
        assertThat(SubstreamPath.of(ARRAY_SIZES).toFileName("c")).isEqualTo("c.size0");
        assertThat(SubstreamPath.of(ARRAY_ELEMENTS, DICTIONARY_ELEMENTS).toFileName("c"))
                .isEqualTo("c.dict");
        assertThat(SubstreamPath.of(ARRAY_ELEMENTS, ARRAY_SIZES).toFileName("c"))
                .isEqualTo("c.size1");
    }

    @Test
    void testToString() {
        assertThat(SubstreamPath.of(ARRAY_ELEMENTS, DICTIONARY_INDEXES).toString())
                .isEqualTo("[ArrayElements, DictionaryIndexes]");
    }
}
