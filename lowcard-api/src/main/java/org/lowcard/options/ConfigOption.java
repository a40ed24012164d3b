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

import java.util.Arrays;
import java.util.Collections;

import static org.lowcard.utils.Preconditions.checkNotNull;

/**
 * 描述一个配置项: 键、值的类型、默认值以及可选的回退键。
 *
 * <p>配置项通过 {@link ConfigOptions#key(String)} 构建,实例是不可变的。
 *
 * @param <T> 配置值的类型
 */
@Public
public class ConfigOption<T> {

    private static final String[] EMPTY = new String[0];

    private final String key;

    private final String[] fallbackKeys;

    private final T defaultValue;

    private final String description;

    private final Class<?> clazz;

    Class<?> getClazz() {
        return clazz;
    }

    ConfigOption(
            String key,
            Class<?> clazz,
            String description,
            T defaultValue,
            String... fallbackKeys) {
        this.key = checkNotNull(key);
        this.description = description;
        this.defaultValue = defaultValue;
        this.fallbackKeys = fallbackKeys == null || fallbackKeys.length == 0 ? EMPTY : fallbackKeys;
        this.clazz = checkNotNull(clazz);
    }

    /** 返回增加了回退键的新配置项,回退键在主键缺失时按顺序检查。 */
    public ConfigOption<T> withFallbackKeys(String... fallbackKeys) {
        String[] merged = new String[fallbackKeys.length + this.fallbackKeys.length];
        System.arraycopy(fallbackKeys, 0, merged, 0, fallbackKeys.length);
        System.arraycopy(
                this.fallbackKeys, 0, merged, fallbackKeys.length, this.fallbackKeys.length);
        return new ConfigOption<>(key, clazz, description, defaultValue, merged);
    }

    public ConfigOption<T> withDescription(final String description) {
        return new ConfigOption<>(key, clazz, description, defaultValue, fallbackKeys);
    }

    public String key() {
        return key;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    public T defaultValue() {
        return defaultValue;
    }

    public boolean hasFallbackKeys() {
        return fallbackKeys != EMPTY;
    }

    public Iterable<String> fallbackKeys() {
        return (fallbackKeys == EMPTY) ? Collections.emptyList() : Arrays.asList(fallbackKeys);
    }

    public String description() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o != null && o.getClass() == ConfigOption.class) {
            ConfigOption<?> that = (ConfigOption<?>) o;
            return this.key.equals(that.key)
                    && Arrays.equals(this.fallbackKeys, that.fallbackKeys)
                    && (this.defaultValue == null
                            ? that.defaultValue == null
                            : (that.defaultValue != null
                                    && this.defaultValue.equals(that.defaultValue)));
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode()
                + 17 * Arrays.hashCode(fallbackKeys)
                + (defaultValue != null ? defaultValue.hashCode() : 0);
    }

    @Override
    public String toString() {
        return String.format(
                "Key: '%s' , default: %s (fallback keys: %s)",
                key, defaultValue, Arrays.toString(fallbackKeys));
    }
}
