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

package org.lowcard.data.serializer;

import org.lowcard.types.DataTypes;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link InternalSerializers} and the single value formats. */
class InternalSerializersTest {

    @Test
    void testDictionaryUsesElementFormat() {
        Serializer<Object> serializer =
                InternalSerializers.create(
                        DataTypes.DICTIONARY(DataTypes.STRING(), DataTypes.UTINYINT()));
        assertThat(serializer).isInstanceOf(NullableSerializer.class);
        assertThat(((NullableSerializer<Object>) serializer).originalSerializer())
                .isSameAs(StringSerializer.INSTANCE);

        assertThat(
                        InternalSerializers.<Object>create(
                                DataTypes.DICTIONARY(
                                        DataTypes.UINT().notNull(), DataTypes.UTINYINT())))
                .isSameAs(UnsignedIntSerializer.INSTANCE);
    }

    @Test
    void testUnsupportedType() {
        assertThatThrownBy(() -> InternalSerializers.create(DataTypes.BOOLEAN()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testBinaryFormats() throws IOException {
        assertThat(StringSerializer.INSTANCE.serializeToBytes("ab"))
                .containsExactly(0, 0, 0, 2, 'a', 'b');
        assertThat(new FixedStringSerializer(3).serializeToBytes(new byte[] {'a', 0, 0}))
                .containsExactly('a', 0, 0);
        assertThat(NullableSerializer.wrap(IntSerializer.INSTANCE).serializeToBytes(null))
                .containsExactly(1);
        assertThat(UnsignedShortSerializer.INSTANCE.deserializeFromBytes(new byte[] {-1, -2}))
                .isEqualTo((short) 0xFFFE);
    }

    @Test
    void testUnsignedTextForms() {
        assertThat(UnsignedByteSerializer.INSTANCE.serializeToString((byte) -1)).isEqualTo("255");
        assertThat(UnsignedByteSerializer.INSTANCE.deserializeFromString("200"))
                .isEqualTo((byte) 200);
        assertThat(UnsignedLongSerializer.INSTANCE.serializeToString(-1L))
                .isEqualTo("18446744073709551615");
        assertThat(UnsignedLongSerializer.INSTANCE.deserializeFromString("18446744073709551615"))
                .isEqualTo(-1L);
        assertThatThrownBy(() -> UnsignedByteSerializer.INSTANCE.deserializeFromString("256"))
                .isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> UnsignedShortSerializer.INSTANCE.deserializeFromString("-1"))
                .isInstanceOf(NumberFormatException.class);
    }

    @Test
    void testDateTextForms() {
        assertThat(DateSerializer.INSTANCE.serializeToString((short) 0)).isEqualTo("1970-01-01");
        assertThat(DateSerializer.INSTANCE.deserializeFromString("2024-03-01"))
                .isEqualTo((short) 19783);
        assertThat(DateTimeSerializer.INSTANCE.serializeToString(86461))
                .isEqualTo("1970-01-02 00:01:01");
        assertThat(DateTimeSerializer.INSTANCE.deserializeFromString("2023-11-14 22:13:20"))
                .isEqualTo(1700000000);
        assertThatThrownBy(() -> DateSerializer.INSTANCE.deserializeFromString("1969-12-31"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DateTimeSerializer.INSTANCE.deserializeFromString("noon"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testFixedStringTextForms() {
        FixedStringSerializer serializer = new FixedStringSerializer(4);
        byte[] padded = serializer.deserializeFromString("ok");
        assertThat(padded).containsExactly('o', 'k', 0, 0);
        assertThat(serializer.serializeToString(padded)).isEqualTo("ok");
        assertThat(new String(padded, StandardCharsets.UTF_8)).startsWith("ok");
        assertThatThrownBy(() -> serializer.deserializeFromString("toolong"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testNullTextForm() {
        Serializer<Integer> serializer = NullableSerializer.wrap(IntSerializer.INSTANCE);
        assertThat(serializer.serializeToString(null)).isEqualTo("\\N");
        assertThat(serializer.deserializeFromString("\\N")).isNull();
        assertThat(serializer.deserializeFromString("-12")).isEqualTo(-12);
    }
}
