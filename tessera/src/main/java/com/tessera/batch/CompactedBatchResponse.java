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

package com.tessera.batch;

import com.tessera.plan.PlanNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Several requests merged into one plan. The rows of the plan are mapped back to the requests by
 * comparing the {@code keys} columns of each row with the {@code arguments} of each request.
 *
 * @param plan            the merged plan, yields a list of records
 * @param keys            the columns identifying a row
 * @param arguments       the key values of every request, in request order
 * @param expectNonEmpty  whether a request without a matching row is an error
 * @param nestedSelection the columns returned to the requests
 */
public record CompactedBatchResponse(PlanNode plan,
                                     List<String> keys,
                                     List<Map<String, Object>> arguments,
                                     boolean expectNonEmpty,
                                     List<String> nestedSelection) implements BatchResponse {
    public CompactedBatchResponse {
        keys = List.copyOf(keys);
        nestedSelection = List.copyOf(nestedSelection);
        List<Map<String, Object>> copy = new ArrayList<>(arguments.size());
        for (Map<String, Object> argument : arguments) {
            // Key values may be null, Map.copyOf would reject them.
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(argument)));
        }
        arguments = Collections.unmodifiableList(copy);
    }
}
