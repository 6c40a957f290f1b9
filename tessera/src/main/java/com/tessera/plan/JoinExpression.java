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

import java.util.List;
import java.util.Objects;

/**
 * A child relation of a {@link JoinNode}.
 *
 * @param child       the plan producing the child rows
 * @param on          the join key, compared column by column
 * @param parentField the field of the parent record the children are attached to
 * @param unique      true for one-to-one relations: a single record or null is attached instead of a list
 */
public record JoinExpression(PlanNode child, List<JoinCondition> on, String parentField, boolean unique) {
    public JoinExpression {
        Objects.requireNonNull(child, "child cannot be null");
        Objects.requireNonNull(parentField, "parentField cannot be null");
        on = List.copyOf(on);
        if (on.isEmpty()) {
            throw new IllegalArgumentException("join key cannot be empty");
        }
    }
}
