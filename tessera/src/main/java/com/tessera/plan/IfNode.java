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

import java.util.Objects;

/**
 * Evaluates {@code value}, tests it with {@code rule} and evaluates exactly one of the branches.
 */
public record IfNode(PlanNode value, IfRule rule, PlanNode then, PlanNode otherwise) implements PlanNode {
    public IfNode {
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(rule, "rule cannot be null");
        Objects.requireNonNull(then, "then cannot be null");
        Objects.requireNonNull(otherwise, "otherwise cannot be null");
    }

    @Override
    public <R> R accept(PlanNodeVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
