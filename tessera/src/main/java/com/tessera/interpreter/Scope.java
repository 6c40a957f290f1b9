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

package com.tessera.interpreter;

/**
 * Variables bound by let nodes. Scopes are immutable, binding a variable returns a child scope.
 */
final class Scope {
    private static final Scope ROOT = new Scope(null, null, null);
    private final Scope parent;
    private final String name;
    private final Object value;

    private Scope(Scope parent, String name, Object value) {
        this.parent = parent;
        this.name = name;
        this.value = value;
    }

    static Scope root() {
        return ROOT;
    }

    Scope bind(String name, Object value) {
        return new Scope(this, name, value);
    }

    boolean contains(String name) {
        return find(name) != null;
    }

    Object get(String name) {
        Scope scope = find(name);
        return scope == null ? null : scope.value;
    }

    private Scope find(String name) {
        for (Scope scope = this; scope != ROOT; scope = scope.parent) {
            if (scope.name.equals(name)) {
                return scope;
            }
        }
        return null;
    }
}
