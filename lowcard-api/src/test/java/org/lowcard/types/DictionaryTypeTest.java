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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.lowcard.types.SubstreamPath.Substream.ARRAY_ELEMENTS;
import static org.lowcard.types.SubstreamPath.Substream.ARRAY_SIZES;
import static org.lowcard.types.SubstreamPath.Substream.DICTIONARY_ELEMENTS;
import static org.lowcard.types.SubstreamPath.Substream.DICTIONARY_INDEXES;

/** Tests for {@link DictionaryType}. */
class DictionaryTypeTest {

    private static final List<DataType> UNSIGNED_INDEX_TYPES =
            Arrays.asList(
                    DataTypes.UTINYINT(),
                    DataTypes.USMALLINT(),
                    DataTypes.UINT(),
                    DataTypes.UBIGINT());

    private static final List<DataType> ELEMENT_TYPES =
            Arrays.asList(
                    DataTypes.TINYINT(),
                    DataTypes.SMALLINT(),
                    DataTypes.INT(),
                    DataTypes.BIGINT(),
                    DataTypes.UTINYINT(),
                    DataTypes.USMALLINT(),
                    DataTypes.UINT(),
                    DataTypes.UBIGINT(),
                    DataTypes.FLOAT(),
                    DataTypes.DOUBLE(),
                    DataTypes.STRING(),
                    DataTypes.VARCHAR(10),
                    DataTypes.CHAR(3),
                    DataTypes.DATE(),
                    DataTypes.DATETIME());

    @Test
    void testAcceptsEveryUnsignedIndexType() {
        for (DataType index : UNSIGNED_INDEX_TYPES) {
            DictionaryType type = new DictionaryType(DataTypes.STRING(), index);
            assertThat(type.getIndexType()).isEqualTo(index.notNull());
            assertThat(type.getIndexType().isNullable()).isFalse();
        }
    }

    @Test
    void testRejectsSignedAndNonIntegerIndexTypes() {
        List<DataType> invalid =
                Arrays.asList(
                        DataTypes.TINYINT(),
                        DataTypes.SMALLINT(),
                        DataTypes.INT(),
                        DataTypes.BIGINT(),
                        DataTypes.FLOAT(),
                        DataTypes.DOUBLE(),
                        DataTypes.STRING(),
                        DataTypes.DATE());
        for (DataType index : invalid) {
            assertThatThrownBy(() -> new DictionaryType(DataTypes.STRING(), index))
                    .isInstanceOf(IllegalArgumentTypeException.class)
                    .satisfies(
                            e -> {
                                IllegalArgumentTypeException ex = (IllegalArgumentTypeException) e;
                                assertThat(ex.getRole())
                                        .isEqualTo(IllegalArgumentTypeException.Role.INDEX);
                                assertThat(ex.getArgumentType()).isEqualTo(index);
                            });
        }
    }

    @Test
    void testAcceptsSupportedElementTypesInBothNullabilities() {
        for (DataType element : ELEMENT_TYPES) {
            for (DataType index : UNSIGNED_INDEX_TYPES) {
                assertThat(new DictionaryType(element, index).isNullable()).isTrue();
                assertThat(new DictionaryType(element.notNull(), index).isNullable()).isFalse();
            }
        }
    }

    @Test
    void testRejectsUnsupportedElementTypes() {
        List<DataType> invalid =
                Arrays.asList(
                        DataTypes.BOOLEAN(),
                        DataTypes.BOOLEAN().notNull(),
                        DataTypes.ARRAY(DataTypes.INT()),
                        DataTypes.DICTIONARY(DataTypes.STRING(), DataTypes.UTINYINT()));
        for (DataType element : invalid) {
            assertThatThrownBy(() -> new DictionaryType(element, DataTypes.UTINYINT()))
                    .isInstanceOf(IllegalArgumentTypeException.class)
                    .extracting(e -> ((IllegalArgumentTypeException) e).getRole())
                    .isEqualTo(IllegalArgumentTypeException.Role.ELEMENT);
        }
    }

    @Test
    void testIndexTypeIsValidatedFirst() {
        assertThatThrownBy(() -> new DictionaryType(DataTypes.BOOLEAN(), DataTypes.INT()))
                .isInstanceOf(IllegalArgumentTypeException.class)
                .extracting(e -> ((IllegalArgumentTypeException) e).getRole())
                .isEqualTo(IllegalArgumentTypeException.Role.INDEX);
    }

    @Test
    void testEquality() {
        DictionaryType type = DataTypes.DICTIONARY(DataTypes.STRING(), DataTypes.UTINYINT());
        DictionaryType same = new DictionaryType(DataTypes.STRING(), DataTypes.UTINYINT());
        DictionaryType wider = new DictionaryType(DataTypes.STRING(), DataTypes.USMALLINT());
        DictionaryType otherElement = new DictionaryType(DataTypes.INT(), DataTypes.UTINYINT());

        assertThat(type).isEqualTo(type);
        assertThat(type).isEqualTo(same);
        assertThat(same).isEqualTo(type);
        assertThat(type.hashCode()).isEqualTo(same.hashCode());

        assertThat(type).isNotEqualTo(wider);
        assertThat(type).isNotEqualTo(otherElement);
        assertThat(type).isNotEqualTo(type.notNull());
        assertThat(type).isNotEqualTo(DataTypes.STRING());
        assertThat((DataType) DataTypes.STRING()).isNotEqualTo(type);
        assertThat(type.equalsIgnoreNullable(type.notNull())).isTrue();
    }

    @Test
    void testNullableIndexIsEqualToNotNullIndex() {
        DictionaryType nullableIndex =
                new DictionaryType(DataTypes.STRING(), DataTypes.UTINYINT());
        DictionaryType notNullIndex =
                new DictionaryType(DataTypes.STRING(), DataTypes.UTINYINT().notNull());
        assertThat(nullableIndex).isEqualTo(notNullIndex);
    }

    @Test
    void testNullabilityFollowsElement() {
        DictionaryType type =
                new DictionaryType(DataTypes.STRING().notNull(), DataTypes.UTINYINT());
        assertThat(type.isNullable()).isFalse();

        DictionaryType nullable = (DictionaryType) type.copy(true);
        assertThat(nullable.isNullable()).isTrue();
        assertThat(nullable.getElementType().isNullable()).isTrue();
    }

    @Test
    void testAsSQLString() {
        assertThat(DataTypes.DICTIONARY(DataTypes.STRING(), DataTypes.UTINYINT()).asSQLString())
                .isEqualTo("DICTIONARY<STRING, UTINYINT>");
        assertThat(
                        new DictionaryType(DataTypes.CHAR(4).notNull(), DataTypes.UINT())
                                .asSQLString())
                .isEqualTo("DICTIONARY<CHAR(4), UINTEGER> NOT NULL");
    }

    @Test
    void testDefaultSizeIsIndexSize() {
        assertThat(DataTypes.DICTIONARY(DataTypes.STRING(), DataTypes.USMALLINT()).defaultSize())
                .isEqualTo(DataTypes.USMALLINT().defaultSize());
    }

    @Test
    void testEnumerateStreams() {
        List<SubstreamPath> paths = new ArrayList<>();
        DataTypes.DICTIONARY(DataTypes.STRING(), DataTypes.UTINYINT())
                .enumerateStreams(paths::add);
        assertThat(paths)
                .containsExactly(
                        SubstreamPath.of(DICTIONARY_ELEMENTS),
                        SubstreamPath.of(DICTIONARY_INDEXES));
    }

    @Test
    void testEnumerateStreamsInsideArray() {
        List<SubstreamPath> paths = new ArrayList<>();
        DataTypes.ARRAY(DataTypes.DICTIONARY(DataTypes.STRING(), DataTypes.UTINYINT()))
                .enumerateStreams(paths::add);
        assertThat(paths)
                .containsExactly(
                        SubstreamPath.of(ARRAY_SIZES),
                        SubstreamPath.of(ARRAY_ELEMENTS, DICTIONARY_ELEMENTS),
                        SubstreamPath.of(ARRAY_ELEMENTS, DICTIONARY_INDEXES));
    }
}
