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

import java.io.DataOutput;
import java.io.IOException;

/** 数据输出视图,在 {@link DataOutput} 的基础上增加了跳过和拷贝字节的能力。 */
public interface DataOutputView extends DataOutput {

    /**
     * 跳过 {@code numBytes} 个字节,被跳过的内容未定义。
     *
     * @throws IOException 如果无法跳过
     */
    void skipBytesToWrite(int numBytes) throws IOException;

    /** 从 {@code source} 拷贝 {@code numBytes} 个字节。 */
    void write(DataInputView source, int numBytes) throws IOException;
}
