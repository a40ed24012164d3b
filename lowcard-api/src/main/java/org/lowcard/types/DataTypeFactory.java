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

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * 数据类型族的注册表,负责根据类型名和参数构造 {@link DataType}。
 *
 * <p>类型族分为三类:
 * <ul>
 *     <li>简单类型: 没有参数,如 {@code INT}、{@code STRING}</li>
 *     <li>带长度的类型: 可选一个整数参数,如 {@code CHAR(3)}</li>
 *     <li>复合类型: 接受固定个数的类型参数,如 {@code ARRAY<INT>}、{@code DICTIONARY<STRING, UTINYINT>}</li>
 * </ul>
 *
 * <p>类型名不区分大小写。{@link #defaultFactory()} 返回注册了所有内置类型族的共享实例。
 */
@Public
@ThreadSafe
public class DataTypeFactory {

    private static final DataTypeFactory DEFAULT = createDefault();

    private final Map<String, Family> families = new ConcurrentHashMap<>();

    /** 返回注册了所有内置类型族的共享实例。 */
    public static DataTypeFactory defaultFactory() {
        return DEFAULT;
    }

    /** 注册一个没有参数的类型族。 */
    public DataTypeFactory register(String name, Supplier<DataType> creator) {
        return register(name, new Family(creator, null, null, 0));
    }

    /**
     * 注册一个带长度参数的类型族。
     *
     * @param name 类型名
     * @param creator 根据长度构造类型
     * @param defaultLength 未指定长度时使用的默认值
     */
    public DataTypeFactory registerWithLength(
            String name, IntFunction<DataType> creator, int defaultLength) {
        return register(
                name, new Family(() -> creator.apply(defaultLength), creator, null, 0));
    }

    /**
     * 注册一个复合类型族。
     *
     * @param name 类型名
     * @param arity 要求的类型参数个数
     * @param creator 根据类型参数构造类型
     */
    public DataTypeFactory registerComposite(
            String name, int arity, Function<List<DataType>, DataType> creator) {
        Preconditions.checkArgument(arity > 0, "Arity of %s must be positive.", name);
        return register(name, new Family(null, null, creator, arity));
    }

    private DataTypeFactory register(String name, Family family) {
        families.put(normalize(name), family);
        return this;
    }

    public boolean contains(String name) {
        return families.containsKey(normalize(name));
    }

    /** 返回所有已注册的类型名,按字母排序。 */
    public Set<String> registeredNames() {
        return new TreeSet<>(families.keySet());
    }

    /**
     * 构造一个没有参数的类型。带长度的类型族会使用其默认长度。
     *
     * @throws IllegalArgumentException 如果类型名未注册,或者该类型族需要类型参数
     */
    public DataType create(String name) {
        Family family = lookup(name);
        if (family.composite != null) {
            throw new ArgumentCountMismatchException(normalize(name), family.arity, 0);
        }
        return family.simple.get();
    }

    /**
     * 构造一个带长度参数的类型。
     *
     * @throws IllegalArgumentException 如果类型名未注册或者该类型族不接受长度参数
     */
    public DataType create(String name, int length) {
        Family family = lookup(name);
        if (family.withLength == null) {
            throw new IllegalArgumentException(
                    String.format("Data type %s does not take a length.", normalize(name)));
        }
        return family.withLength.apply(length);
    }

    /**
     * 构造一个复合类型。
     *
     * @throws ArgumentCountMismatchException 如果类型参数的个数与该类型族的要求不符
     * @throws IllegalArgumentException 如果类型名未注册或者该类型族不接受类型参数
     */
    public DataType create(String name, List<DataType> typeArguments) {
        Family family = lookup(name);
        if (family.composite == null) {
            throw new IllegalArgumentException(
                    String.format("Data type %s does not take type arguments.", normalize(name)));
        }
        if (typeArguments.size() != family.arity) {
            throw new ArgumentCountMismatchException(
                    normalize(name), family.arity, typeArguments.size());
        }
        return family.composite.apply(typeArguments);
    }

    private Family lookup(String name) {
        Family family = families.get(normalize(name));
        if (family == null) {
            throw new IllegalArgumentException("Unknown data type: " + name);
        }
        return family;
    }

    private static String normalize(String name) {
        return Preconditions.checkNotNull(name, "Type name must not be null.")
                .trim()
                .toUpperCase(Locale.ROOT);
    }

    private static DataTypeFactory createDefault() {
        return new DataTypeFactory()
                .register("BOOLEAN", BooleanType::new)
                .register("TINYINT", TinyIntType::new)
                .register("SMALLINT", SmallIntType::new)
                .register("INT", IntType::new)
                .register("INTEGER", IntType::new)
                .register("BIGINT", BigIntType::new)
                .register("UTINYINT", UTinyIntType::new)
                .register("USMALLINT", USmallIntType::new)
                .register("UINT", UIntType::new)
                .register("UINTEGER", UIntType::new)
                .register("UBIGINT", UBigIntType::new)
                .register("FLOAT", FloatType::new)
                .register("DOUBLE", DoubleType::new)
                .register("DATE", DateType::new)
                .register("DATETIME", DateTimeType::new)
                .register("STRING", () -> VarCharType.STRING_TYPE)
                .registerWithLength("CHAR", CharType::new, CharType.DEFAULT_LENGTH)
                .registerWithLength("VARCHAR", VarCharType::new, VarCharType.DEFAULT_LENGTH)
                .registerComposite("ARRAY", 1, args -> new ArrayType(args.get(0)))
                .registerComposite(
                        "DICTIONARY", 2, args -> new DictionaryType(args.get(0), args.get(1)));
    }

    private static final class Family {

        @Nullable private final Supplier<DataType> simple;
        @Nullable private final IntFunction<DataType> withLength;
        @Nullable private final Function<List<DataType>, DataType> composite;
        private final int arity;

        private Family(
                @Nullable Supplier<DataType> simple,
                @Nullable IntFunction<DataType> withLength,
                @Nullable Function<List<DataType>, DataType> composite,
                int arity) {
            this.simple = simple;
            this.withLength = withLength;
            this.composite = composite;
            this.arity = arity;
        }
    }
}
