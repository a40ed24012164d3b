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
import org.lowcard.utils.Preconditions;

import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 描述列式存储中一列的逻辑数据类型。
 *
 * <p>DataType 是类型系统的核心抽象类。每个数据类型都包含以下核心信息:
 * <ul>
 *     <li>类型根(typeRoot): 类型的基本分类,如 INTEGER、VARCHAR、DICTIONARY 等</li>
 *     <li>可空性(isNullable): 可空类型是其非空形式的 "可选" 包装,值允许为 null</li>
 *     <li>类型参数: 特定类型可能包含的额外参数,如 CHAR(3) 的长度、DICTIONARY 的元素与索引类型</li>
 * </ul>
 *
 * <p>设计特点:
 * <ul>
 *     <li>不可变性: 所有类型实例都是不可变的,修改操作返回新实例</li>
 *     <li>结构相等: 两个类型相等当且仅当类别、可空性和所有参数都相等</li>
 *     <li>访问者模式: 通过 {@link DataTypeVisitor} 支持类型遍历和处理</li>
 *     <li>子流枚举: 通过 {@link #enumerateStreams} 描述一列占用的全部物理子流</li>
 * </ul>
 *
 * <pre>{@code
 * DataType stringType = DataTypes.STRING();
 * DataType dictType = DataTypes.DICTIONARY(DataTypes.STRING(), DataTypes.UTINYINT());
 * DataType notNull = DataTypes.INT().notNull();
 * }</pre>
 *
 * @see DataTypes
 * @see DataTypeRoot
 * @see DataTypeVisitor
 */
@Public
public abstract class DataType implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 标识该类型的值是否可以为 null */
    private final boolean isNullable;

    /** 该类型的根分类 */
    private final DataTypeRoot typeRoot;

    public DataType(boolean isNullable, DataTypeRoot typeRoot) {
        this.isNullable = isNullable;
        this.typeRoot = Preconditions.checkNotNull(typeRoot);
    }

    /** 返回该类型的值是否可以为 {@code null}。 */
    public boolean isNullable() {
        return isNullable;
    }

    /** 返回该类型的根分类。 */
    public DataTypeRoot getTypeRoot() {
        return typeRoot;
    }

    /** 判断该类型的根是否等于指定的 {@code typeRoot}。 */
    public boolean is(DataTypeRoot typeRoot) {
        return this.typeRoot == typeRoot;
    }

    /** 判断该类型的根是否等于给定的任意一个 {@code typeRoots}。 */
    public boolean isAnyOf(DataTypeRoot... typeRoots) {
        return Arrays.stream(typeRoots).anyMatch(tr -> this.typeRoot == tr);
    }

    /** 判断该类型的根是否属于给定的任意一个类型族。 */
    public boolean isAnyOf(DataTypeFamily... typeFamilies) {
        return Arrays.stream(typeFamilies).anyMatch(tf -> this.typeRoot.getFamilies().contains(tf));
    }

    /** 判断该类型是否属于指定的类型族 {@code family}。 */
    public boolean is(DataTypeFamily family) {
        return typeRoot.getFamilies().contains(family);
    }

    /**
     * 返回该数据类型值的默认大小(字节数),用于缓冲区大小估算。
     *
     * @return 该类型值的默认大小(字节)
     */
    public abstract int defaultSize();

    /**
     * 返回该类型的深拷贝,并指定可空性。
     *
     * @param isNullable 复制后类型的目标可空性
     * @return 具有指定可空性的新类型实例
     */
    public abstract DataType copy(boolean isNullable);

    /** 返回该类型的深拷贝,保持原有的可空性。 */
    public final DataType copy() {
        return copy(isNullable);
    }

    /** 返回该类型的不可空版本。 */
    public DataType notNull() {
        return copy(false);
    }

    /** 返回该类型的可空版本。 */
    public DataType nullable() {
        return copy(true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataType that = (DataType) o;
        return isNullable == that.isNullable && typeRoot == that.typeRoot;
    }

    /** 比较两个数据类型是否相等,忽略可空性属性。 */
    public boolean equalsIgnoreNullable(DataType o) {
        return Objects.equals(this.copy(true), o.copy(true));
    }

    @Override
    public int hashCode() {
        return Objects.hash(isNullable, typeRoot);
    }

    /**
     * 返回该类型的字符串表示形式,可被 {@link DataTypeParser} 解析回等价的类型。
     *
     * <p>示例输出:
     * <pre>
     * INT NOT NULL
     * CHAR(3)
     * ARRAY&lt;INT&gt;
     * DICTIONARY&lt;STRING, UTINYINT&gt;
     * </pre>
     */
    public abstract String asSQLString();

    /**
     * 将该类型序列化为 JSON 格式。
     *
     * <p>默认实现将类型转换为 SQL 字符串写入 JSON,复合类型会重写此方法输出结构化的对象。
     *
     * @param generator JSON 生成器
     * @throws IOException 如果序列化过程中发生 I/O 错误
     */
    public void serializeJson(JsonGenerator generator) throws IOException {
        generator.writeString(asSQLString());
    }

    /** 根据可空性为格式化字符串添加 "NOT NULL" 后缀。 */
    protected String withNullability(String format, Object... params) {
        if (!isNullable) {
            return String.format(format + " NOT NULL", params);
        }
        return String.format(format, params);
    }

    @Override
    public String toString() {
        return asSQLString();
    }

    /**
     * 接受一个数据类型访问者的访问。
     *
     * @param visitor 数据类型访问者
     * @param <R> 访问者返回的结果类型
     * @return 访问者处理该类型后的返回值
     */
    public abstract <R> R accept(DataTypeVisitor<R> visitor);

    /**
     * 枚举该类型的一列在物理存储上占用的所有子流,不执行任何 I/O。
     *
     * <p>标量类型只占用一个子流,即 {@code path} 本身。复合类型会重写此方法,在路径后追加自己的
     * 子流标记并递归进入嵌套类型,因此嵌套的复合类型也能被正确展开。回调的顺序是固定的。
     *
     * @param path 当前累积的子流路径
     * @param callback 每个物理子流调用一次
     */
    public void enumerateStreams(SubstreamPath path, Consumer<SubstreamPath> callback) {
        callback.accept(path);
    }

    /** 从根路径开始枚举子流。 */
    public final void enumerateStreams(Consumer<SubstreamPath> callback) {
        enumerateStreams(SubstreamPath.EMPTY, callback);
    }
}
