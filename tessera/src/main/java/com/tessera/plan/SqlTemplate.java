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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SQL text and its positional parameters. A parameter is either a literal or a {@link Placeholder}.
 *
 * @param sql    the statement text
 * @param params the positional parameters
 */
public record SqlTemplate(String sql, List<Object> params) {
    public SqlTemplate {
        Objects.requireNonNull(sql, "sql cannot be null");
        params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static SqlTemplate of(String sql, Object... params) {
        return new SqlTemplate(sql, Arrays.asList(params));
    }
}
