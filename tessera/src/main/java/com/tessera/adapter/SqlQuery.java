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

package com.tessera.adapter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A SQL statement with positional arguments, ready to be sent to a driver adapter.
 *
 * @param sql  the statement text, placeholders are written in the provider's native syntax
 * @param args the positional arguments, already resolved to concrete values
 */
public record SqlQuery(String sql, List<Object> args) {
    public SqlQuery {
        if (sql == null) {
            throw new IllegalArgumentException("sql cannot be null");
        }
        // Arguments may contain null values, List.copyOf would reject them.
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }
}
