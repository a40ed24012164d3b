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

/**
 * 当复合类型的某个类型参数不被支持时抛出。
 *
 * <p>例如字典类型的索引类型不是无符号整数,或者元素类型不属于可字典编码的类型。
 * {@link #getRole()} 指明出错的是哪一个参数。
 */
@Public
public class IllegalArgumentTypeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /** 出错参数在复合类型中的角色。 */
    public enum Role {
        ELEMENT,
        INDEX
    }

    private final Role role;

    private final DataType argumentType;

    public IllegalArgumentTypeException(Role role, DataType argumentType, String message) {
        super(message);
        this.role = role;
        this.argumentType = argumentType;
    }

    public Role getRole() {
        return role;
    }

    public DataType getArgumentType() {
        return argumentType;
    }
}
