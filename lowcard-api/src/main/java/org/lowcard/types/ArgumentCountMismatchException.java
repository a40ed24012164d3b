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

package org.lowcard.types;

import org.lowcard.annotation.Public;

/** 类型字符串中复合类型的参数个数与其要求不符时抛出。 */
@Public
public class ArgumentCountMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String typeName;

    private final int expected;

    private final int actual;

    public ArgumentCountMismatchException(String typeName, int expected, int actual) {
        super(
                String.format(
                        "Data type %s takes exactly %d type argument(s), but got %d.",
                        typeName, expected, actual));
        this.typeName = typeName;
        this.expected = expected;
        this.actual = actual;
    }

    public String getTypeName() {
        return typeName;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
