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

import java.io.DataInput;
import java.io.IOException;

/**
 * 数据输入视图,在 {@link DataInput} 的基础上增加了跳过字节和探测流结束的能力。
 *
 * <p>批量解码编码流时,读取方并不总是知道剩余多少行,需要通过 {@link #hasRemaining()}
 * 在流的末尾干净地停下,而不是依赖 {@link java.io.EOFException}。
 */
public interface DataInputView extends DataInput {

    /**
     * 跳过 {@code numBytes} 个字节。
     *
     * @throws java.io.EOFException 如果剩余的字节不足
     */
    void skipBytesToRead(int numBytes) throws IOException;

    int read(byte[] b, int off, int len) throws IOException;

    int read(byte[] b) throws IOException;

    /** 返回是否还有至少一个字节可以读取。 */
    boolean hasRemaining() throws IOException;
}
