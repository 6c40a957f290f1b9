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
 * Projects and renames the fields of a record, or of every record of a list.
 * Fields without a mapping are dropped; a mapped field missing from the record yields null.
 */
public record MapNode(PlanNode expr, List<FieldMapping> fields) implements PlanNode {
    public MapNode {
        Objects.requireNonNull(expr, "expr cannot be null");
        fields = List.copyOf(fields);
    }

    @Override
    public <R> R accept(PlanNodeVisitor<R> visitor) {
        return visitor.visitMap(this);
    }
}
