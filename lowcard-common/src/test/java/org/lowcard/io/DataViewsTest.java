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

package org.lowcard.io;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for the big-endian memory and stream views. */
class DataViewsTest {

    @Test
    void testBigEndianLayout() throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(1);
        out.writeShort(0x0102);
        out.writeInt(0x03040506);
        out.writeLong(0x0708090A0B0C0D0EL);
        out.writeBytes("xy");

        assertThat(out.length()).isEqualTo(16);
        assertThat(out.getCopyOfBuffer())
                .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 'x', 'y');
    }

    @Test
    void testReadBack() throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(4);
        out.writeBoolean(true);
        out.writeFloat(2.5f);
        out.writeDouble(-1.25);
        out.writeUTF("grüße");

        DataInputDeserializer in = new DataInputDeserializer(out.getCopyOfBuffer());
        assertThat(in.readBoolean()).isTrue();
        assertThat(in.readFloat()).isEqualTo(2.5f);
        assertThat(in.readDouble()).isEqualTo(-1.25);
        assertThat(in.readUTF()).isEqualTo("grüße");
        assertThat(in.hasRemaining()).isFalse();
        assertThatThrownBy(in::readInt).isInstanceOf(EOFException.class);
    }

    @Test
    void testClearAndPosition() throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(8);
        out.writeInt(42);
        out.clear();
        assertThat(out.length()).isZero();

        out.writeInt(1);
        out.setPosition(0);
        out.writeByte(9);
        assertThat(out.getCopyOfBuffer()).containsExactly(9);
    }

    @Test
    void testReadWindow() throws IOException {
        DataInputDeserializer in = new DataInputDeserializer();
        assertThat(in.hasRemaining()).isFalse();

        in.setBuffer(new byte[] {9, 0, 0, 0, 5, 9}, 1, 4);
        assertThat(in.getPosition()).isEqualTo(1);
        assertThat(in.available()).isEqualTo(4);
        assertThat(in.readInt()).isEqualTo(5);
        assertThat(in.getPosition()).isEqualTo(5);
        assertThat(in.available()).isZero();
        assertThatThrownBy(() -> in.setBuffer(new byte[2], 1, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testStreamWrappers() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputViewStreamWrapper out = new DataOutputViewStreamWrapper(bytes);
        out.writeInt(7);
        out.skipBytesToWrite(2);
        out.flush();
        assertThat(bytes.toByteArray()).containsExactly(0, 0, 0, 7, 0, 0);

        DataInputViewStreamWrapper in =
                new DataInputViewStreamWrapper(new ByteArrayInputStream(bytes.toByteArray()));
        assertThat(in.hasRemaining()).isTrue();
        assertThat(in.readInt()).isEqualTo(7);
        in.skipBytesToRead(2);
        assertThat(in.hasRemaining()).isFalse();
        assertThatThrownBy(() -> in.skipBytesToRead(1)).isInstanceOf(EOFException.class);
    }
}
