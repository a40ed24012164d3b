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

package org.lowcard.data.dictionary;

import org.lowcard.data.columnar.ColumnVector;
import org.lowcard.data.columnar.ElementRepresentation;
import org.lowcard.data.columnar.writable.WritableColumnVector;

import javax.annotation.Nullable;

/**
 * 去重的、只追加的、顺序稳定的值容器,为每个不同的值分配一个编码。
 *
 * <p>编码是从 0 开始的连续整数:
 * <ul>
 *     <li>插入已存在的值不改变容器,返回该值原有的编码</li>
 *     <li>插入新值时把它追加到末尾,返回插入前的大小</li>
 *     <li>编码一经分配,在容器的整个生命周期内始终指向同一个值</li>
 * </ul>
 *
 * <p>元素类型可空时,null 也是一个普通的值,同样会分配编码。唯一能让编码失效的操作是
 * {@link #popBack(int)},它只用于撤销尚未被任何行引用的新值。
 *
 * <p>实现不是线程安全的。
 */
public interface UniqueDictionary {

    ElementRepresentation getRepresentation();

    boolean isNullable();

    /** 返回不同值的个数。 */
    int size();

    /**
     * 插入一个值,返回它的编码。
     *
     * @throws IllegalArgumentException 如果值为 null 而元素类型不可空,或值的形式与元素类型不符
     */
    int uniqueInsert(@Nullable Object value);

    /** 插入 {@code src} 第 {@code position} 行的值,返回它的编码。 */
    int uniqueInsertFrom(ColumnVector src, int position);

    /**
     * 按顺序插入 {@code src} 中 {@code [start, start + length)} 的所有行。
     *
     * @return 每一行对应的编码
     */
    int[] uniqueInsertRangeFrom(ColumnVector src, int start, int length);

    /** 返回按编码顺序保存所有不同值的列向量,调用方不应修改它。 */
    WritableColumnVector getNestedColumn();

    /** 删除最后插入的 {@code n} 个值。 */
    void popBack(int n);

    /** 返回编码对应的值。 */
    @Nullable
    Object getObject(int code);

    /** 返回值的编码,值不存在时返回 -1。 */
    int indexOf(@Nullable Object value);
}
