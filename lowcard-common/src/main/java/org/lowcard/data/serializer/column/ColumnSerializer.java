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
import org.lowcard.data.columnar.writable.WritableColumnVector;
import org.lowcard.io.DataInputView;
import org.lowcard.io.DataOutputView;
import org.lowcard.io.stream.InputStreamGetter;
import org.lowcard.io.stream.OutputStreamGetter;
import org.lowcard.types.DataType;
import org.lowcard.types.SubstreamPath;

import javax.annotation.Nullable;

import java.io.IOException;

/**
 * 一种类型的列级编解码器,负责创建该类型的列,并在列与一组子流之间批量读写行。
 *
 * <p>一次完整的写入(或读取)称为一个 pass,可以分成多个行区间分块调用
 * {@link #serializeBulk} / {@link #deserializeBulk},同一个 pass 的所有分块共享同一个状态对象。
 * 子流由 {@link OutputStreamGetter} / {@link InputStreamGetter} 按 {@link SubstreamPath} 提供,
 * 返回 null 的子流被跳过。
 *
 * <p>单值读写的格式与该类型的单值 {@link org.lowcard.data.serializer.Serializer} 相同。
 */
public interface ColumnSerializer {

    DataType getType();

    /** 使用配置的初始容量创建一个空列。 */
    WritableColumnVector createColumn();

    WritableColumnVector createColumn(int capacity);

    default SerializeBulkState createSerializeState() {
        return new SerializeBulkState();
    }

    default DeserializeBulkState createDeserializeState() {
        return new DeserializeBulkState();
    }

    /**
     * 把 {@code column} 的行 {@code [offset, offset + limit)} 写入子流。
     *
     * @param limit 行数,0 表示一直写到列的末尾
     */
    void serializeBulk(
            ColumnVector column,
            OutputStreamGetter getter,
            int offset,
            int limit,
            SubstreamPath path,
            SerializeBulkState state)
            throws IOException;

    /**
     * 从子流读取最多 {@code limit} 行并追加到 {@code column},子流结束时提前停止。
     *
     * @param limit 行数,0 表示一直读到子流结束
     */
    void deserializeBulk(
            WritableColumnVector column,
            InputStreamGetter getter,
            int limit,
            SubstreamPath path,
            DeserializeBulkState state)
            throws IOException;

    void serializeOne(ColumnVector column, int row, DataOutputView target) throws IOException;

    void deserializeOne(WritableColumnVector column, DataInputView source) throws IOException;

    String serializeOneToString(ColumnVector column, int row);

    void deserializeOneFromString(WritableColumnVector column, String text);

    /** 追加一个值,{@code null} 表示 null 行。 */
    void append(WritableColumnVector column, @Nullable Object value);

    @Nullable
    Object get(ColumnVector column, int row);
}
