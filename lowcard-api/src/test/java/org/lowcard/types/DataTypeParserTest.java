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

/** Tests for {@link DataTypeParser}. */
class DataTypeParserTest {

    @Test
    void testParseAtomicTypes() {
        assertThat(DataTypeParser.parseDataType("INT")).isEqualTo(DataTypes.INT());
        assertThat(DataTypeParser.parseDataType("INTEGER")).isEqualTo(DataTypes.INT());
        assertThat(DataTypeParser.parseDataType("UTINYINT")).isEqualTo(DataTypes.UTINYINT());
        assertThat(DataTypeParser.parseDataType("UINT")).isEqualTo(DataTypes.UINT());
        assertThat(DataTypeParser.parseDataType("STRING")).isEqualTo(DataTypes.STRING());
        assertThat(DataTypeParser.parseDataType("VARCHAR(12)")).isEqualTo(DataTypes.VARCHAR(12));
        assertThat(DataTypeParser.parseDataType("CHAR(3)")).isEqualTo(DataTypes.CHAR(3));
        assertThat(DataTypeParser.parseDataType("DATETIME")).isEqualTo(DataTypes.DATETIME());
        assertThat(DataTypeParser.parseDataType("double NOT NULL"))
                .isEqualTo(DataTypes.DOUBLE().notNull());
    }

    @Test
    void testParseDictionary() {
        DataType type = DataTypeParser.parseDataType("DICTIONARY<STRING, UTINYINT>");
        assertThat(type).isEqualTo(DataTypes.DICTIONARY(DataTypes.STRING(), DataTypes.UTINYINT()));
        assertThat(type.isNullable()).isTrue();

        assertThat(DataTypeParser.parseDataType("dictionary<char(3), usmallint>"))
                .isEqualTo(DataTypes.DICTIONARY(DataTypes.CHAR(3), DataTypes.USMALLINT()));
    }

    @Test
    void testParseDictionaryNullability() {
        DataType expected =
                new DictionaryType(DataTypes.STRING().notNull(), DataTypes.UBIGINT());
        assertThat(DataTypeParser.parseDataType("DICTIONARY<STRING NOT NULL, UBIGINT>"))
                .isEqualTo(expected);
        assertThat(DataTypeParser.parseDataType("DICTIONARY<STRING, UBIGINT> NOT NULL"))
                .isEqualTo(expected);
        assertThat(DataTypeParser.parseDataType("DICTIONARY<STRING NOT NULL, UBIGINT> NULL"))
                .isEqualTo(expected.nullable());
    }

    @Test
    void testParseNestedDictionary() {
        assertThat(DataTypeParser.parseDataType("ARRAY<DICTIONARY<DATE, UINT>>"))
                .isEqualTo(
                        DataTypes.ARRAY(
                                DataTypes.DICTIONARY(DataTypes.DATE(), DataTypes.UINT())));
    }

    @Test
    void testAsSQLStringRoundTrip() {
        DataType[] types = {
            DataTypes.DICTIONARY(DataTypes.STRING(), DataTypes.UTINYINT()),
            new DictionaryType(DataTypes.CHAR(8).notNull(), DataTypes.UINT()),
            DataTypes.ARRAY(DataTypes.DICTIONARY(DataTypes.FLOAT(), DataTypes.USMALLINT())),
            DataTypes.VARCHAR(5).notNull()
        };
        for (DataType type : types) {
            assertThat(DataTypeParser.parseDataType(type.asSQLString())).isEqualTo(type);
        }
    }

    @Test
    void testWrongArgumentCount() {
        assertThatThrownBy(() -> DataTypeParser.parseDataType("DICTIONARY<STRING>"))
                .isInstanceOf(ArgumentCountMismatchException.class)
                .hasMessage("Data type DICTIONARY takes exactly 2 type argument(s), but got 1.");
        assertThatThrownBy(
                        () -> DataTypeParser.parseDataType("DICTIONARY<STRING, UINT, UINT>"))
                .isInstanceOf(ArgumentCountMismatchException.class);
        assertThatThrownBy(() -> DataTypeParser.parseDataType("DICTIONARY"))
                .isInstanceOf(ArgumentCountMismatchException.class);
    }

    @Test
    void testInvalidDictionaryArguments() {
        assertThatThrownBy(() -> DataTypeParser.parseDataType("DICTIONARY<STRING, INT>"))
                .isInstanceOf(IllegalArgumentTypeException.class);
        assertThatThrownBy(() -> DataTypeParser.parseDataType("DICTIONARY<BOOLEAN, UINT>"))
                .isInstanceOf(IllegalArgumentTypeException.class);
    }

    @Test
    void testMalformedStrings() {
        assertThatThrownBy(() -> DataTypeParser.parseDataType("FOO"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown data type");
        assertThatThrownBy(() -> DataTypeParser.parseDataType("DICTIONARY<STRING, UINT"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unexpected end");
        assertThatThrownBy(() -> DataTypeParser.parseDataType("INT INT"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unexpected token");
        assertThatThrownBy(() -> DataTypeParser.parseDataType("INT NOT"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DataTypeParser.parseDataType("INT(3)"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not take a length");
        assertThatThrownBy(() -> DataTypeParser.parseDataType("INT#"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unexpected character");
    }
}
