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
import org.lowcard.io.DataInputViewStreamWrapper;
import org.lowcard.io.DataOutputView;
import org.lowcard.io.DataOutputViewStreamWrapper;
import org.lowcard.options.DictionaryOptions;
import org.lowcard.options.Options;
import org.lowcard.types.SubstreamPath;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.lowcard.utils.Preconditions.checkNotNull;

/**
 * 把一列的每个子流保存为目录下的一个文件,文件名为 {@code <列名><后缀>.bin},
 * 后缀由 {@link SubstreamPath#toFileName(String)} 决定。
 *
 * <p>同一文件在一个实例中只打开一次,写入流在 {@link #close()} 时刷新并关闭。
 * 读取前应先关闭写入用的实例。读取时文件不存在的子流返回 null,即跳过。
 */
public class FileSubstreams implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(FileSubstreams.class);

    public static final String FILE_SUFFIX = ".bin";

    private final Path directory;

    private final String column;

    private final int bufferSize;

    private final Map<String, DataOutputViewStreamWrapper> outputs = new HashMap<>();

    private final Map<String, DataInputViewStreamWrapper> inputs = new HashMap<>();

    public FileSubstreams(Path directory, String column, Options options) {
        this.directory = checkNotNull(directory);
        this.column = checkNotNull(column);
        this.bufferSize = options.get(DictionaryOptions.SUBSTREAM_BUFFER_SIZE);
    }

    public Path fileOf(SubstreamPath path) {
        return directory.resolve(path.toFileName(column) + FILE_SUFFIX);
    }

    public OutputStreamGetter writer() {
        return this::openOutput;
    }

    public InputStreamGetter reader() {
        return this::openInput;
    }

    private DataOutputView openOutput(SubstreamPath path) throws IOException {
        Path file = fileOf(path);
        String name = file.getFileName().toString();
        DataOutputViewStreamWrapper output = outputs.get(name);
        if (output == null) {
            LOG.debug("Opening substream {} for writing at {}", path, file);
            Files.createDirectories(directory);
            output =
                    new DataOutputViewStreamWrapper(
                            new BufferedOutputStream(Files.newOutputStream(file), bufferSize));
            outputs.put(name, output);
        }
        return output;
    }

    private DataInputView openInput(SubstreamPath path) throws IOException {
        Path file = fileOf(path);
        String name = file.getFileName().toString();
        DataInputViewStreamWrapper input = inputs.get(name);
        if (input == null) {
            if (!Files.exists(file)) {
                LOG.debug("Substream {} has no file at {}, skipping it", path, file);
                return null;
            }
            LOG.debug("Opening substream {} for reading at {}", path, file);
            input =
                    new DataInputViewStreamWrapper(
                            new BufferedInputStream(Files.newInputStream(file), bufferSize));
            inputs.put(name, input);
        }
        return input;
    }

    @Override
    public void close() throws IOException {
        List<Closeable> streams = new ArrayList<>(outputs.values());
        streams.addAll(inputs.values());
        outputs.clear();
        inputs.clear();
        IOException exception = null;
        for (Closeable stream : streams) {
            try {
                stream.close();
            } catch (IOException e) {
                if (exception == null) {
                    exception = e;
                } else {
                    exception.addSuppressed(e);
                }
            }
        }
        LOG.debug("Closed {} substreams of column {} in {}", streams.size(), column, directory);
        if (exception != null) {
            throw exception;
        }
    }
}
