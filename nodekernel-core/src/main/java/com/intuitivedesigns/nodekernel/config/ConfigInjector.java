/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves placeholders inside node parameter trees.
 *
 * <p>A parameter tree is made of {@link Map}s, {@link List}s and scalars (String, Number,
 * Boolean, null). Both operations return a resolved copy and leave the input untouched.</p>
 *
 * <ul>
 * <li>{@link #injectEnvVars(Object)} replaces {@code {$NAME}} with the value of environment
 * variable {@code NAME}, failing if it is not set.</li>
 * <li>{@link #substituteParams(Object, Map)} replaces flat {@code $NAME} tokens from a supplied
 * mapping. Used on raw config files before validation.</li>
 * </ul>
 */
public final class ConfigInjector {

    private static final Pattern ENV_PLACEHOLDER = Pattern.compile("\\{\\$(.*?)\\}", Pattern.DOTALL);

    // Stops self-referencing variables ({$A} -> "{$A}") from expanding forever
    private static final int MAX_SUBSTITUTIONS = 1_000;

    private final Function<String, String> environment;

    public ConfigInjector() {
        this(System::getenv);
    }

    public ConfigInjector(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /**
     * @throws MissingEnvironmentVariableException naming the first unset variable found
     */
    @SuppressWarnings("unchecked")
    public <T> T injectEnvVars(T tree) {
        return (T) inject(tree);
    }

    private Object inject(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.put(e.getKey(), inject(e.getValue()));
            }
            return out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(inject(item));
            }
            return out;
        }
        if (value instanceof String s) {
            return injectString(s);
        }
        return value;
    }

    private String injectString(String value) {
        String current = value;
        for (int i = 0; i < MAX_SUBSTITUTIONS; i++) {
            Matcher m = ENV_PLACEHOLDER.matcher(current);
            if (!m.find()) {
                return current;
            }
            String placeholder = m.group();
            String variable = m.group(1);
            String resolved = environment.apply(variable);
            if (resolved == null) {
                throw new MissingEnvironmentVariableException(variable);
            }
            current = current.replace(placeholder, resolved);
        }
        throw new ConfigurationException("Environment variable expansion did not terminate for value: " + value);
    }

    /**
     * Replaces every {@code $KEY} with the mapped value, for each key in map order.
     *
     * @throws IllegalArgumentException for {@code null} leaves or scalars other than
     *                                  String, Number and Boolean
     */
    @SuppressWarnings("unchecked")
    public <T> T substituteParams(T tree, Map<String, String> params) {
        Objects.requireNonNull(params, "params");
        return (T) substitute(tree, params);
    }

    private static Object substitute(Object value, Map<String, String> params) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.put(e.getKey(), substitute(e.getValue(), params));
            }
            return out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(substitute(item, params));
            }
            return out;
        }
        if (value instanceof String s) {
            String out = s;
            for (Map.Entry<String, String> e : params.entrySet()) {
                out = out.replace("$" + e.getKey(), e.getValue());
            }
            return out;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value;
        }
        throw new IllegalArgumentException("Invalid value type "
                + (value == null ? "null" : value.getClass().getName())
                + ". Expected map, list, string, or number.");
    }
}
