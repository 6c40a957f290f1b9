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

import java.time.Instant;
import java.util.List;

/**
 * Emitted once per leaf statement.
 *
 * @param timestamp  when the statement was sent
 * @param sql        the statement text
 * @param params     the resolved positional parameters
 * @param durationMs wall-clock time spent in the driver
 * @param target     the name of the component that ran the statement
 */
public record QueryEvent(Instant timestamp, String sql, List<Object> params, long durationMs, String target) {
}
