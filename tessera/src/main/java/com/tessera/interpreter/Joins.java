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

import com.tessera.plan.JoinCondition;
import com.tessera.plan.JoinExpression;

import java.util.*;

/**
 * In-memory equi-join used by join nodes.
 * <p>
 * Parent order and cardinality are preserved. Every child row is attached to at most one parent:
 * when two parents share a key, the first one in parent order receives the matching children.
 * A key containing null never matches.
 */
final class Joins {

    private Joins() {
    }

    /**
     * Attaches the children to the parents.
     *
     * @param parent     a record, a list of records, or null
     * @param expression the join description
     * @param children   the child rowset
     * @return a new parent value, of the same shape as {@code parent}, with the children attached
     */
    static Object attach(Object parent, JoinExpression expression, Object children) {
        if (parent == null) {
            return null;
        }
        Map<List<Object>, List<Map<String, Object>>> groups = groupChildren(expression, Values.asRecords(children, "join"));

        if (parent instanceof Map<?, ?>) {
            return attachOne(Values.asRecords(parent, "join").get(0), expression, groups);
        }
        List<Map<String, Object>> parents = Values.asRecords(parent, "join");
        List<Map<String, Object>> result = new ArrayList<>(parents.size());
        for (Map<String, Object> record : parents) {
            result.add(attachOne(record, expression, groups));
        }
        return result;
    }

    private static Map<List<Object>, List<Map<String, Object>>> groupChildren(JoinExpression expression, List<Map<String, Object>> children) {
        Map<List<Object>, List<Map<String, Object>>> groups = new HashMap<>();
        for (Map<String, Object> child : children) {
            List<Object> key = key(child, expression.on(), false);
            if (key == null) {
                continue;
            }
            groups.computeIfAbsent(key, (k) -> new ArrayList<>()).add(child);
        }
        return groups;
    }

    private static Map<String, Object> attachOne(Map<String, Object> parent, JoinExpression expression,
                                                 Map<List<Object>, List<Map<String, Object>>> groups) {
        Map<String, Object> record = new LinkedHashMap<>(parent);
        List<Object> key = key(parent, expression.on(), true);
        // remove() hands each group to a single parent.
        List<Map<String, Object>> matches = key == null ? null : groups.remove(key);
        if (matches == null) {
            matches = List.of();
        }
        if (expression.unique()) {
            record.put(expression.parentField(), matches.isEmpty() ? null : matches.get(0));
        } else {
            record.put(expression.parentField(), new ArrayList<>(matches));
        }
        return record;
    }

    private static List<Object> key(Map<String, Object> record, List<JoinCondition> on, boolean parentSide) {
        List<Object> key = new ArrayList<>(on.size());
        for (JoinCondition condition : on) {
            String field = parentSide ? condition.parentField() : condition.childField();
            Object value = record.get(field);
            if (value == null) {
                return null;
            }
            key.add(Values.normalizeKey(value));
        }
        return key;
    }
}
