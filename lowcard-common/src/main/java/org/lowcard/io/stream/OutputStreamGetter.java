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

import org.lowcard.io.DataOutputView;
import org.lowcard.types.SubstreamPath;

import javax.annotation.Nullable;

import java.io.IOException;

/** 按子流路径返回写入目标,返回 null 表示跳过该子流。 */
@FunctionalInterface
public interface OutputStreamGetter {

    @Nullable
    DataOutputView get(SubstreamPath path) throws IOException;
}
