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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.common.TesseraException;
import com.tessera.internal.JSONUtil;
import com.tessera.plan.PlanCodec;
import com.tessera.plan.PlanFormatException;
import com.tessera.plan.PlanNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes batch responses in their JSON form.
 */
public final class BatchResponseCodec {
    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private BatchResponseCodec() {
    }

    public static BatchResponse decode(String json) {
        JsonNode root;
        try {
            root = JSONUtil.readTree(json);
        } catch (TesseraException e) {
            throw new PlanFormatException("Batch response is not valid JSON", e);
        }
        return decode(root);
    }

    public static BatchResponse decode(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new PlanFormatException("Batch response must be a JSON object");
        }
        String type = root.path("type").asText("");
        return switch (type) {
            case "multi" -> new MultiBatchResponse(decodePlans(array(root, "plans")));
            case "compacted" -> decodeCompacted(root);
            default -> throw new PlanFormatException("Unknown batch response type: " + type);
        };
    }

    private static List<PlanNode> decodePlans(JsonNode plans) {
        List<PlanNode> result = new ArrayList<>(plans.size());
        for (JsonNode plan : plans) {
            result.add(PlanCodec.decode(plan));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static CompactedBatchResponse decodeCompacted(JsonNode root) {
        JsonNode plan = root.get("plan");
        if (plan == null) {
            throw new PlanFormatException("Compacted batch response has no plan");
        }
        List<Map<String, Object>> arguments = new ArrayList<>();
        for (JsonNode argument : array(root, "arguments")) {
            if (!argument.isObject()) {
                throw new PlanFormatException("Compacted batch arguments must be objects");
            }
            arguments.add(JSONUtil.treeToValue(argument, LinkedHashMap.class));
        }
        return new CompactedBatchResponse(
                PlanCodec.decode(plan),
                strings(array(root, "keys")),
                arguments,
                root.path("expectNonEmpty").asBoolean(false),
                strings(array(root, "nestedSelection"))
        );
    }

    private static JsonNode array(JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || !value.isArray()) {
            throw new PlanFormatException("Batch response field '" + field + "' must be an array");
        }
        return value;
    }

    private static List<String> strings(JsonNode array) {
        List<String> result = new ArrayList<>(array.size());
        for (JsonNode item : array) {
            result.add(item.asText());
        }
        return result;
    }

    public static String encode(BatchResponse response) {
        return JSONUtil.writeValueAsString(toJsonNode(response));
    }

    public static JsonNode toJsonNode(BatchResponse response) {
        ObjectNode root = FACTORY.objectNode();
        if (response instanceof MultiBatchResponse multi) {
            root.put("type", "multi");
            ArrayNode plans = root.putArray("plans");
            for (PlanNode plan : multi.plans()) {
                plans.add(PlanCodec.toJsonNode(plan));
            }
        } else if (response instanceof CompactedBatchResponse compacted) {
            root.put("type", "compacted");
            root.set("plan", PlanCodec.toJsonNode(compacted.plan()));
            ArrayNode keys = root.putArray("keys");
            compacted.keys().forEach(keys::add);
            ArrayNode arguments = root.putArray("arguments");
            for (Map<String, Object> argument : compacted.arguments()) {
                arguments.add(JSONUtil.objectMapper.valueToTree(argument));
            }
            root.put("expectNonEmpty", compacted.expectNonEmpty());
            ArrayNode selection = root.putArray("nestedSelection");
            compacted.nestedSelection().forEach(selection::add);
        }
        return root;
    }
}
