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
import java.time.Duration;
import java.time.temporal.TemporalUnit;
import java.util.Properties;
import java.util.function.Function;

/**
 * Wrapper for a java.util.Properties object, that sections it based on a namespace. Each property in the wrapped object
 * is prefixed by the namespace, so "agent.api.port" is the property "api.port" of namespace "agent".
 */
public class TypedProperties {
    private static final String SEPARATOR = ".";

    private final String keyPrefix;
    private final Properties properties;

    /**
     * Creates a new instance of the TypedProperties class.
     *
     * @param properties The java.util.Properties to wrap.
     * @param namespace  The namespace of this instance.
     */
    public TypedProperties(Properties properties, String namespace) {
        Preconditions.checkNotNull(properties, "properties");
        Exceptions.checkNotNullOrEmpty(namespace, "namespace");
        this.properties = properties;
        this.keyPrefix = namespace + SEPARATOR;
    }

    /**
     * Gets the value of a String property.
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the property is not defined and has no default value.
     */
    public String get(Property<String> property) throws ConfigurationException {
        return tryGet(property, s -> s);
    }

    /**
     * Gets the value of an Integer property.
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the property is not defined and has no default value, or when it cannot be
     *                                parsed as an Integer.
     */
    public int getInt(Property<Integer> property) throws ConfigurationException {
        return tryGet(property, Integer::parseInt);
    }

    /**
     * Gets the value of a boolean property. "true", "yes" and "1" map to true; "false", "no" and "0" map to false
     * (case insensitive).
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the property is not defined and has no default value, or when it cannot be
     *                                parsed as a Boolean.
     */
    public boolean getBoolean(Property<Boolean> property) throws ConfigurationException {
        return tryGet(property, this::parseBoolean);
    }

    /**
     * Gets the value of an Integer property only if it is greater than 0.
     *
     * @param property The Property to get.
     * @return The property value.
     * @throws ConfigurationException If the value is missing, unparseable or not positive.
     */
    public int getPositiveInt(Property<Integer> property) {
        int value = getInt(property);
        if (value <= 0) {
            throw new ConfigurationException(String.format("Property '%s' must be a positive integer.", property));
        }
        return value;
    }

    /**
     * Gets the value of an Integer property only if it is non-negative (greater than or equal to 0).
     *
     * @param property The Property to get.
     * @return The property value.
     * @throws ConfigurationException If the value is missing, unparseable or negative.
     */
    public int getNonNegativeInt(Property<Integer> property) {
        int value = getInt(property);
        if (value < 0) {
            throw new ConfigurationException(String.format("Property '%s' must be a non-negative integer.", property));
        }
        return value;
    }

    /**
     * Gets a Duration from a non-negative Integer property.
     *
     * @param property The Property to get.
     * @param unit     Temporal unit of the value (i.e, seconds, millis).
     * @return The Duration.
     * @throws ConfigurationException If the value is missing, unparseable or negative.
     */
    public Duration getDuration(Property<Integer> property, TemporalUnit unit) {
        return Duration.of(getNonNegativeInt(property), unit);
    }

    private <T> T tryGet(Property<T> property, Function<String, T> converter) {
        String fullName = this.keyPrefix + property.getName();
        String propValue = this.properties.getProperty(fullName, null);
        if (propValue == null) {
            if (property.hasDefaultValue()) {
                return property.getDefaultValue();
            } else {
                throw new MissingPropertyException(fullName);
            }
        }

        try {
            return converter.apply(propValue.trim());
        } catch (IllegalArgumentException ex) {
            throw new InvalidPropertyValueException(fullName, propValue, ex);
        }
    }

    private boolean parseBoolean(String value) {
        if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("yes") || value.equalsIgnoreCase("1")) {
            return true;
        } else if (value.equalsIgnoreCase("false") || value.equalsIgnoreCase("no") || value.equalsIgnoreCase("0")) {
            return false;
        } else {
            throw new IllegalArgumentException(String.format("String '%s' cannot be interpreted as a valid Boolean.", value));
        }
    }
}
