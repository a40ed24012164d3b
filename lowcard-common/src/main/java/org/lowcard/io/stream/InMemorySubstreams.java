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

import org.lowcard.io.DataInputDeserializer;
import org.lowcard.io.DataOutputSerializer;
import org.lowcard.options.DictionaryOptions;
import org.lowcard.options.Options;
import org.lowcard.types.SubstreamPath;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.lowcard.utils.Preconditions.checkNotNull;

/**
 * 保存在内存中的一组子流,每个子流路径对应一块字节缓冲区。
 *
 * <p>{@link #writer()} 在第一次请求某个路径时创建缓冲区,之后对同一路径返回同一个缓冲区,
 * 因此多次分块写入会追加到一起。{@link #reader()} 每次调用开始一个新的读取会话,
 * 会话内同一路径共享读取位置。被 {@link #exclude(SubstreamPath)} 排除的路径在写入和读取时都返回 null。
 */
public class InMemorySubstreams {

    private final int bufferSize;

    private final Map<SubstreamPath, DataOutputSerializer> outputs = new LinkedHashMap<>();

    private final Set<SubstreamPath> excluded = new HashSet<>();

    public InMemorySubstreams() {
        this(new Options());
    }

    public InMemorySubstreams(Options options) {
        this.bufferSize = options.get(DictionaryOptions.SUBSTREAM_BUFFER_SIZE);
    }

    /** 排除一个路径,之后对它的请求都返回 null。 */
    public InMemorySubstreams exclude(SubstreamPath path) {
        excluded.add(checkNotNull(path));
        return this;
    }

    public OutputStreamGetter writer() {
        return path -> {
            if (excluded.contains(path)) {
                return null;
            }
            return outputs.computeIfAbsent(path, p -> new DataOutputSerializer(bufferSize));
        };
    }

    public InputStreamGetter reader() {
        Map<SubstreamPath, DataInputDeserializer> session = new HashMap<>();
        return path -> {
            if (excluded.contains(path)) {
                return null;
            }
            DataInputDeserializer input = session.get(path);
            if (input == null) {
                DataOutputSerializer output = outputs.get(path);
                if (output == null) {
                    return null;
                }
                input = new DataInputDeserializer(output.getCopyOfBuffer());
                session.put(path, input);
            }
            return input;
        };
    }

    /** 按第一次写入的顺序返回所有写过的路径。 */
    public List<SubstreamPath> paths() {
        return new ArrayList<>(outputs.keySet());
    }

    /** 返回某个路径已写入的字节,没有写过时返回空数组。 */
    public byte[] getBytes(SubstreamPath path) {
        DataOutputSerializer output = outputs.get(path);
        return output == null ? new byte[0] : output.getCopyOfBuffer();
    }
}
