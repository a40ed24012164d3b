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

package org.lowcard.options;

import org.lowcard.annotation.Public;

/** 字典编码列及其子流相关的配置项。 */
@Public
public class DictionaryOptions {

    /**
     * 反序列化字典元素时是否校验载荷。
     *
     * <p>写入端保证字典载荷已经去重,并且载荷中的顺序就是编码 0..n-1。默认信任这一前提,
     * 开启后会在插入字典后检查返回的编码是否恰好为 0..n-1,不符时抛出 {@link IllegalStateException}。
     */
    public static final ConfigOption<Boolean> VERIFY_PAYLOAD =
            ConfigOptions.key("dictionary.verify-payload")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether to verify that a deserialized dictionary payload is "
                                    + "deduplicated and defines the codes 0..n-1 in order.");

    public static final ConfigOption<Integer> COLUMN_INITIAL_CAPACITY =
            ConfigOptions.key("column.initial-capacity")
                    .intType()
                    .defaultValue(1024)
                    .withDescription("Initial capacity of materialized column vectors.");

    public static final ConfigOption<Integer> SUBSTREAM_BUFFER_SIZE =
            ConfigOptions.key("substream.buffer-size")
                    .intType()
                    .defaultValue(4096)
                    .withDescription(
                            "Initial buffer size of in-memory substreams and buffer size of "
                                    + "file substreams, in bytes.");

    private DictionaryOptions() {}
}
