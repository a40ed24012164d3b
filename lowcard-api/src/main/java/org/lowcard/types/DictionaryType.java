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
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 字典编码(低基数)数据类型。
 *
 * <p>字典类型由两个类型参数组成:
 * <ul>
 *     <li>元素类型: 字典中去重存储的值的类型,可以是数值、变长字符串、定长字符串、日期或日期时间,
 *         也可以是它们的可空形式</li>
 *     <li>索引类型: 每行保存的编码的类型,必须是无符号整数(UTINYINT、USMALLINT、UINTEGER、UBIGINT)</li>
 * </ul>
 *
 * <p>编码永远不会为 null,因此索引类型在构造时被规范化为非空形式。字典类型本身的可空性
 * 与元素类型的可空性一致: 一个可空元素的字典列可以把 null 作为普通的字典值存储。
 *
 * <p>一个字典列在物理上占用两个子流,先是字典元素
 * ({@link SubstreamPath.Substream#DICTIONARY_ELEMENTS}),再是每行的编码
 * ({@link SubstreamPath.Substream#DICTIONARY_INDEXES})。
 *
 * <pre>{@code
 * DataType type = DataTypes.DICTIONARY(DataTypes.STRING(), DataTypes.UTINYINT());
 * type.asSQLString(); // DICTIONARY<STRING, UTINYINT>
 * }</pre>
 */
@Public
public final class DictionaryType extends DataType {

    private static final long serialVersionUID = 1L;

    public static final String FORMAT = "DICTIONARY<%s, %s>";

    private final DataType elementType;

    private final DataType indexType;

    /**
     * 构造字典类型。
     *
     * @param elementType 字典元素类型,其可空性决定字典类型的可空性
     * @param indexType 索引类型,必须是无符号整数
     * @throws IllegalArgumentTypeException 如果索引类型不是无符号整数,或者元素类型不能被字典编码
     */
    public DictionaryType(DataType elementType, DataType indexType) {
        super(
                Preconditions.checkNotNull(elementType, "Element type must not be null.")
                        .isNullable(),
                DataTypeRoot.DICTIONARY);
        Preconditions.checkNotNull(indexType, "Index type must not be null.");
        if (!DataTypeChecks.isUnsignedInteger(indexType)) {
            throw new IllegalArgumentTypeException(
                    IllegalArgumentTypeException.Role.INDEX,
                    indexType,
                    String.format(
                            "Index type of %s must be an unsigned integer, but was %s.",
                            DataTypeRoot.DICTIONARY, indexType.asSQLString()));
        }
        if (!DataTypeChecks.isDictionaryElement(elementType)) {
            throw new IllegalArgumentTypeException(
                    IllegalArgumentTypeException.Role.ELEMENT,
                    elementType,
                    String.format(
                            "Element type of %s must be a numeric, string, fixed-length string, "
                                    + "date or datetime type, but was %s.",
                            DataTypeRoot.DICTIONARY, elementType.asSQLString()));
        }
        this.elementType = elementType;
        this.indexType = DataTypeChecks.unwrapOptional(indexType);
    }

    /**
     * 以指定的可空性构造字典类型,元素类型会被重新包装为该可空性。
     */
    public DictionaryType(boolean isNullable, DataType elementType, DataType indexType) {
        this(
                Preconditions.checkNotNull(elementType, "Element type must not be null.")
                        .copy(isNullable),
                indexType);
    }

    public DataType getElementType() {
        return elementType;
    }

    /** 返回索引类型,总是非空形式。 */
    public DataType getIndexType() {
        return indexType;
    }

    @Override
    public int defaultSize() {
        return indexType.defaultSize();
    }

    @Override
    public DataType copy(boolean isNullable) {
        return new DictionaryType(isNullable, elementType, indexType);
    }

    @Override
    public String asSQLString() {
        return withNullability(
                FORMAT, elementType.copy(true).asSQLString(), indexType.copy(true).asSQLString());
    }

    @Override
    public void serializeJson(JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        generator.writeStringField("type", isNullable() ? "DICTIONARY" : "DICTIONARY NOT NULL");
        generator.writeFieldName("element");
        elementType.copy(true).serializeJson(generator);
        generator.writeFieldName("index");
        indexType.copy(true).serializeJson(generator);
        generator.writeEndObject();
    }

    @Override
    public void enumerateStreams(SubstreamPath path, Consumer<SubstreamPath> callback) {
        SubstreamPath elements = path.append(SubstreamPath.Substream.DICTIONARY_ELEMENTS);
        elementType.enumerateStreams(elements, callback);
        indexType.enumerateStreams(
                elements.withLast(SubstreamPath.Substream.DICTIONARY_INDEXES), callback);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        if (!super.equals(o)) {
            return false;
        }
        DictionaryType that = (DictionaryType) o;
        return elementType.equals(that.elementType) && indexType.equals(that.indexType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), elementType, indexType);
    }

    @Override
    public <R> R accept(DataTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
