/**
 * Copyright Pravega Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.hostmeta.common.util;

import com.google.common.base.Preconditions;
import io.hostmeta.common.Exceptions;
import java.util.Properties;

/**
 * A builder for a generic Property-based configuration.
 *
 * @param <T> Type of the configuration.
 */
public class ConfigBuilder<T> {
    private final Properties properties;
    private final String namespace;
    private final ConfigConstructor<T> constructor;

    /**
     * Creates a new instance of the ConfigBuilder class.
     *
     * @param namespace   The configuration namespace to use.
     * @param constructor A Function that, given a TypedProperties object, returns a new instance of T using the given
     *                    property values.
     */
    public ConfigBuilder(String namespace, ConfigConstructor<T> constructor) {
        this(namespace, new Properties(), constructor);
    }

    private ConfigBuilder(String namespace, Properties properties, ConfigConstructor<T> constructor) {
        Exceptions.checkNotNullOrEmpty(namespace, "namespace");
        Preconditions.checkNotNull(properties, "properties");
        Preconditions.checkNotNull(constructor, "constructor");
        this.properties = properties;
        this.namespace = namespace;
        this.constructor = constructor;
    }

    /**
     * Creates a new ConfigBuilder that uses a copy of the given java.util.Properties object as a base. Values already
     * set on this builder are carried over and take precedence. This method does not touch the current instance or
     * the given Properties.
     *
     * @param base A java.util.Properties object with the base values.
     * @return A new instance of the ConfigBuilder class.
     */
    public ConfigBuilder<T> rebase(Properties base) {
        Properties merged = new Properties();
        merged.putAll(base);
        merged.putAll(this.properties);
        return new ConfigBuilder<>(this.namespace, merged, this.constructor);
    }

    /**
     * Includes the given property and its value in the builder.
     *
     * @param property The property to set.
     * @param value    The value of the property. A null value is stored as an empty string.
     * @param <V>      Type of the property.
     * @return This instance.
     */
    public <V> ConfigBuilder<T> with(Property<V> property, V value) {
        this.properties.setProperty(property.getFullName(this.namespace), value == null ? "" : value.toString());
        return this;
    }

    /**
     * Creates a new instance of the configuration class with the information contained herein.
     *
     * @return The newly created instance.
     * @throws ConfigurationException When a required Property is missing or has an invalid value.
     */
    public T build() throws ConfigurationException {
        return this.constructor.apply(new TypedProperties(this.properties, this.namespace));
    }

    @FunctionalInterface
    public interface ConfigConstructor<R> {
        R apply(TypedProperties properties) throws ConfigurationException;
    }
}
