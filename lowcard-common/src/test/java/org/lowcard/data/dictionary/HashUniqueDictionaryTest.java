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

import org.lowcard.data.columnar.ElementRepresentation;
import org.lowcard.data.columnar.heap.HeapBytesVector;
import org.lowcard.data.columnar.heap.HeapIntVector;
import org.lowcard.types.DataTypes;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link HashUniqueDictionary}. */
class HashUniqueDictionaryTest {

    @Test
    void testCodesAreDenseAndStable() {
        HashUniqueDictionary dictionary = new HashUniqueDictionary(DataTypes.STRING(), 2);

        assertThat(dictionary.uniqueInsert("a")).isEqualTo(0);
        assertThat(dictionary.uniqueInsert("b")).isEqualTo(1);
        assertThat(dictionary.size()).isEqualTo(2);

        assertThat(dictionary.uniqueInsert("a")).isEqualTo(0);
        assertThat(dictionary.size()).isEqualTo(2);

        assertThat(dictionary.uniqueInsert("c")).isEqualTo(2);
        assertThat(dictionary.getObject(0)).isEqualTo("a");
        assertThat(dictionary.getObject(1)).isEqualTo("b");
        assertThat(dictionary.getObject(2)).isEqualTo("c");
        assertThat(dictionary.indexOf("b")).isEqualTo(1);
        assertThat(dictionary.indexOf("z")).isEqualTo(-1);
        assertThat(dictionary.getRepresentation()).isEqualTo(ElementRepresentation.STRING);
        assertThat(dictionary.getNestedColumn()).isInstanceOf(HeapBytesVector.class);
    }

    @Test
    void testNewValueGetsPreviousSize() {
        HashUniqueDictionary dictionary = new HashUniqueDictionary(DataTypes.INT(), 1);
        for (int i = 0; i < 100; i++) {
            int before = dictionary.size();
            assertThat(dictionary.uniqueInsert(i * 7)).isEqualTo(before);
            assertThat(dictionary.uniqueInsert(i * 7)).isEqualTo(before);
            assertThat(dictionary.size()).isEqualTo(before + 1);
        }
    }

    @Test
    void testNullIsARegularValueWhenNullable() {
        HashUniqueDictionary dictionary = new HashUniqueDictionary(DataTypes.STRING(), 4);
        assertThat(dictionary.isNullable()).isTrue();

        assertThat(dictionary.uniqueInsert("x")).isEqualTo(0);
        assertThat(dictionary.uniqueInsert(null)).isEqualTo(1);
        assertThat(dictionary.uniqueInsert(null)).isEqualTo(1);
        assertThat(dictionary.getObject(1)).isNull();
        assertThat(dictionary.indexOf(null)).isEqualTo(1);
        assertThat(dictionary.getNestedColumn().isNullAt(1)).isTrue();
    }

    @Test
    void testNullIsRejectedWhenNotNullable() {
        HashUniqueDictionary dictionary =
                new HashUniqueDictionary(DataTypes.STRING().notNull(), 4);
        assertThatThrownBy(() -> dictionary.uniqueInsert(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Null value is not allowed");
        assertThat(dictionary.size()).isZero();
        assertThat(dictionary.indexOf(null)).isEqualTo(-1);
    }

    @Test
    void testFixedStringsCompareByContent() {
        HashUniqueDictionary dictionary = new HashUniqueDictionary(DataTypes.CHAR(2), 4);
        byte[] ab = "ab".getBytes(StandardCharsets.UTF_8);

        assertThat(dictionary.uniqueInsert(ab)).isEqualTo(0);
        assertThat(dictionary.uniqueInsert("ab".getBytes(StandardCharsets.UTF_8))).isEqualTo(0);
        assertThat(dictionary.uniqueInsert("cd".getBytes(StandardCharsets.UTF_8))).isEqualTo(1);
        assertThat((byte[]) dictionary.getObject(0)).isEqualTo(ab);

        assertThatThrownBy(() -> dictionary.uniqueInsert("abc".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exactly 2 bytes");
    }

    @Test
    void testUniqueInsertRangeFrom() {
        HeapIntVector source = new HeapIntVector(8);
        for (int value : new int[] {5, 6, 5, 7, 6}) {
            source.appendInt(value);
        }
        HashUniqueDictionary dictionary = new HashUniqueDictionary(DataTypes.INT(), 2);
        dictionary.uniqueInsert(7);

        assertThat(dictionary.uniqueInsertRangeFrom(source, 0, 5)).containsExactly(1, 2, 1, 0, 2);
        assertThat(dictionary.uniqueInsertRangeFrom(source, 3, 0)).isEmpty();
        assertThat(dictionary.size()).isEqualTo(3);

        assertThatThrownBy(() -> dictionary.uniqueInsertRangeFrom(source, 3, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testPopBack() {
        HashUniqueDictionary dictionary = new HashUniqueDictionary(DataTypes.STRING(), 4);
        dictionary.uniqueInsert("a");
        dictionary.uniqueInsert("b");
        dictionary.uniqueInsert("c");

        dictionary.popBack(2);
        assertThat(dictionary.size()).isEqualTo(1);
        assertThat(dictionary.indexOf("b")).isEqualTo(-1);
        assertThat(dictionary.getNestedColumn().getElementsAppended()).isEqualTo(1);

        assertThat(dictionary.uniqueInsert("c")).isEqualTo(1);
        assertThat(dictionary.getObject(1)).isEqualTo("c");

        assertThatThrownBy(() -> dictionary.popBack(3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> dictionary.getObject(2))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
