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

import javax.annotation.Nullable;

/**
 * 一次读取 pass 的状态,记录共享的字典载荷是否已经读取过。
 *
 * <p>同一个 pass 的所有分块复用同一个状态对象,因此续传时不会重复读取字典;新的状态对象开始一个新的 pass。
 */
public class DeserializeBulkState {

    private boolean dictionaryTransferred;

    /** 载荷编码到列中字典编码的映射;为恒等映射时为 null。 */
    @Nullable private int[] codeMapping;

    public boolean isDictionaryTransferred() {
        return dictionaryTransferred;
    }

    public void markDictionaryTransferred() {
        this.dictionaryTransferred = true;
    }

    @Nullable
    public int[] getCodeMapping() {
        return codeMapping;
    }

    public void setCodeMapping(@Nullable int[] codeMapping) {
        this.codeMapping = codeMapping;
    }

    @Override
    public String toString() {
        return "DeserializeBulkState{dictionaryTransferred="
                + dictionaryTransferred
                + ", remapped="
                + (codeMapping != null)
                + '}';
    }
}
