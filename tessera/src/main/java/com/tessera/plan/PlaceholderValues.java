/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.tessera.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable input bindings supplied once per execution.
 */
public final class PlaceholderValues {
    private static final PlaceholderValues EMPTY = new PlaceholderValues(Collections.emptyMap());
    private final Map<String, Object> values;

    private PlaceholderValues(Map<String, Object> values) {
        this.values = values;
    }

    public static PlaceholderValues empty() {
        return EMPTY;
    }

    public static PlaceholderValues of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        // Null values are valid bindings, Map.copyOf would reject them.
        return new PlaceholderValues(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "PlaceholderValues" + values;
    }
}
