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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.common.TesseraException;
import com.tessera.internal.JSONUtil;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes query plans in their JSON form, e.g.
 * <pre>
 * {"type":"unique","args":{"type":"query","args":{"sql":"SELECT * FROM users WHERE id = $1","params":[{"$param":"id"}]}}}
 * </pre>
 */
public final class PlanCodec {
    public static final String PLACEHOLDER_KEY = "$param";
    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private PlanCodec() {
    }

    /**
     * Decodes a plan from its JSON text.
     *
     * @param json the plan text
     * @return the root node
     * @throws PlanFormatException if the text is not a valid plan
     */
    public static PlanNode decode(String json) {
        JsonNode root;
        try {
            root = JSONUtil.readTree(json);
        } catch (TesseraException e) {
            throw new PlanFormatException("Query plan is not valid JSON", e);
        }
        return decode(root);
    }

    public static PlanNode decode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new PlanFormatException("Plan node must be a JSON object");
        }
        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new PlanFormatException("Plan node has no type");
        }
        JsonNode args = node.get("args");
        String type = typeNode.asText();
        return switch (type) {
            case "value" -> new ValueNode(toJava(args));
            case "get" -> new GetNode(requiredText(args, "name"));
            case "let" -> decodeLet(args);
            case "query" -> new QueryNode(decodeTemplate(args));
            case "execute" -> new ExecuteNode(decodeTemplate(args));
            case "concat" -> new ConcatNode(decodeList(args));
            case "sum" -> new SumNode(decodeList(args));
            case "seq" -> new SeqNode(decodeList(args));
            case "map" -> decodeMap(args);
            case "if" -> decodeIf(args);
            case "unique" -> new UniqueNode(decode(args));
            case "required" -> new RequiredNode(decode(args));
            case "transaction" -> new TransactionNode(decode(args));
            case "join" -> decodeJoin(args);
            default -> throw new PlanFormatException("Unknown plan node type: " + type);
        };
    }

    /**
     * Encodes a plan to its JSON text.
     *
     * @param plan the root node
     * @return the JSON text
     */
    public static String encode(PlanNode plan) {
        return JSONUtil.writeValueAsString(toJsonNode(plan));
    }

    public static JsonNode toJsonNode(PlanNode plan) {
        return plan.accept(new Encoder());
    }

    private static Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return JSONUtil.treeToValue(node, Object.class);
    }

    private static String requiredText(JsonNode args, String field) {
        JsonNode value = args == null ? null : args.get(field);
        if (value == null || !value.isTextual()) {
            throw new PlanFormatException(String.format("'%s' must be a string", field));
        }
        return value.asText();
    }

    private static JsonNode requiredField(JsonNode args, String field) {
        JsonNode value = args == null ? null : args.get(field);
        if (value == null || value.isNull()) {
            throw new PlanFormatException(String.format("'%s' is missing", field));
        }
        return value;
    }

    private static List<PlanNode> decodeList(JsonNode args) {
        if (args == null || !args.isArray()) {
            throw new PlanFormatException("Expected an array of plan nodes");
        }
        List<PlanNode> nodes = new ArrayList<>(args.size());
        for (JsonNode item : args) {
            nodes.add(decode(item));
        }
        return nodes;
    }

    private static LetNode decodeLet(JsonNode args) {
        JsonNode bindingsNode = requiredField(args, "bindings");
        if (!bindingsNode.isArray()) {
            throw new PlanFormatException("'bindings' must be an array");
        }
        List<Binding> bindings = new ArrayList<>(bindingsNode.size());
        for (JsonNode binding : bindingsNode) {
            bindings.add(new Binding(requiredText(binding, "name"), decode(requiredField(binding, "expr"))));
        }
        return new LetNode(bindings, decode(requiredField(args, "expr")));
    }

    private static SqlTemplate decodeTemplate(JsonNode args) {
        String sql = requiredText(args, "sql");
        JsonNode paramsNode = args.get("params");
        List<Object> params = new ArrayList<>();
        if (paramsNode != null && !paramsNode.isNull()) {
            if (!paramsNode.isArray()) {
                throw new PlanFormatException("'params' must be an array");
            }
            for (JsonNode param : paramsNode) {
                if (param.isObject() && param.size() == 1 && param.has(PLACEHOLDER_KEY)) {
                    params.add(new Placeholder(requiredText(param, PLACEHOLDER_KEY)));
                } else {
                    params.add(toJava(param));
                }
            }
        }
        return new SqlTemplate(sql, params);
    }

    private static MapNode decodeMap(JsonNode args) {
        JsonNode fieldsNode = requiredField(args, "fields");
        if (!fieldsNode.isObject()) {
            throw new PlanFormatException("'fields' must be an object");
        }
        List<FieldMapping> fields = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = fieldsNode.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> entry = iterator.next();
            if (!entry.getValue().isTextual()) {
                throw new PlanFormatException("Field mapping source must be a string");
            }
            fields.add(new FieldMapping(entry.getValue().asText(), entry.getKey()));
        }
        return new MapNode(decode(requiredField(args, "expr")), fields);
    }

    private static IfNode decodeIf(JsonNode args) {
        String rule = requiredText(args, "rule");
        IfRule ifRule = switch (rule) {
            case "notEmpty" -> IfRule.NOT_EMPTY;
            case "empty" -> IfRule.EMPTY;
            case "truthy" -> IfRule.TRUTHY;
            case "falsy" -> IfRule.FALSY;
            default -> throw new PlanFormatException("Unknown if rule: " + rule);
        };
        return new IfNode(
                decode(requiredField(args, "value")),
                ifRule,
                decode(requiredField(args, "then")),
                decode(requiredField(args, "else"))
        );
    }

    private static JoinNode decodeJoin(JsonNode args) {
        JsonNode childrenNode = requiredField(args, "children");
        if (!childrenNode.isArray()) {
            throw new PlanFormatException("'children' must be an array");
        }
        List<JoinExpression> children = new ArrayList<>(childrenNode.size());
        for (JsonNode childNode : childrenNode) {
            JsonNode onNode = requiredField(childNode, "on");
            List<JoinCondition> on = new ArrayList<>();
            for (JsonNode pair : onNode) {
                if (!pair.isArray() || pair.size() != 2) {
                    throw new PlanFormatException("Join condition must be a [parentField, childField] pair");
                }
                on.add(new JoinCondition(pair.get(0).asText(), pair.get(1).asText()));
            }
            JsonNode unique = childNode.get("unique");
            children.add(new JoinExpression(
                    decode(requiredField(childNode, "child")),
                    on,
                    requiredText(childNode, "parentField"),
                    unique != null && unique.asBoolean()
            ));
        }
        return new JoinNode(decode(requiredField(args, "parent")), children);
    }

    private static String ruleName(IfRule rule) {
        return switch (rule) {
            case NOT_EMPTY -> "notEmpty";
            case EMPTY -> "empty";
            case TRUTHY -> "truthy";
            case FALSY -> "falsy";
        };
    }

    private static class Encoder implements PlanNodeVisitor<JsonNode> {

        private ObjectNode node(String type, JsonNode args) {
            ObjectNode node = FACTORY.objectNode();
            node.put("type", type);
            node.set("args", args);
            return node;
        }

        private ArrayNode list(List<PlanNode> nodes) {
            ArrayNode array = FACTORY.arrayNode();
            for (PlanNode item : nodes) {
                array.add(item.accept(this));
            }
            return array;
        }

        private ObjectNode template(SqlTemplate template) {
            ObjectNode args = FACTORY.objectNode();
            args.put("sql", template.sql());
            ArrayNode params = args.putArray("params");
            for (Object param : template.params()) {
                if (param instanceof Placeholder placeholder) {
                    params.addObject().put(PLACEHOLDER_KEY, placeholder.name());
                } else {
                    params.add(JSONUtil.objectMapper.valueToTree(param));
                }
            }
            return args;
        }

        @Override
        public JsonNode visitValue(ValueNode node) {
            return node("value", JSONUtil.objectMapper.valueToTree(node.value()));
        }

        @Override
        public JsonNode visitGet(GetNode node) {
            ObjectNode args = FACTORY.objectNode();
            args.put("name", node.name());
            return node("get", args);
        }

        @Override
        public JsonNode visitLet(LetNode node) {
            ObjectNode args = FACTORY.objectNode();
            ArrayNode bindings = args.putArray("bindings");
            for (Binding binding : node.bindings()) {
                ObjectNode item = bindings.addObject();
                item.put("name", binding.name());
                item.set("expr", binding.expr().accept(this));
            }
            args.set("expr", node.expr().accept(this));
            return node("let", args);
        }

        @Override
        public JsonNode visitQuery(QueryNode node) {
            return node("query", template(node.template()));
        }

        @Override
        public JsonNode visitExecute(ExecuteNode node) {
            return node("execute", template(node.template()));
        }

        @Override
        public JsonNode visitConcat(ConcatNode node) {
            return node("concat", list(node.nodes()));
        }

        @Override
        public JsonNode visitSum(SumNode node) {
            return node("sum", list(node.nodes()));
        }

        @Override
        public JsonNode visitMap(MapNode node) {
            ObjectNode args = FACTORY.objectNode();
            args.set("expr", node.expr().accept(this));
            ObjectNode fields = args.putObject("fields");
            for (FieldMapping mapping : node.fields()) {
                fields.put(mapping.target(), mapping.source());
            }
            return node("map", args);
        }

        @Override
        public JsonNode visitIf(IfNode node) {
            ObjectNode args = FACTORY.objectNode();
            args.set("value", node.value().accept(this));
            args.put("rule", ruleName(node.rule()));
            args.set("then", node.then().accept(this));
            args.set("else", node.otherwise().accept(this));
            return node("if", args);
        }

        @Override
        public JsonNode visitUnique(UniqueNode node) {
            return node("unique", node.expr().accept(this));
        }

        @Override
        public JsonNode visitRequired(RequiredNode node) {
            return node("required", node.expr().accept(this));
        }

        @Override
        public JsonNode visitJoin(JoinNode node) {
            ObjectNode args = FACTORY.objectNode();
            args.set("parent", node.parent().accept(this));
            ArrayNode children = args.putArray("children");
            for (JoinExpression expression : node.children()) {
                ObjectNode child = children.addObject();
                child.set("child", expression.child().accept(this));
                ArrayNode on = child.putArray("on");
                for (JoinCondition condition : expression.on()) {
                    on.addArray().add(condition.parentField()).add(condition.childField());
                }
                child.put("parentField", expression.parentField());
                child.put("unique", expression.unique());
            }
            return node("join", args);
        }

        @Override
        public JsonNode visitSeq(SeqNode node) {
            return node("seq", list(node.nodes()));
        }

        @Override
        public JsonNode visitTransaction(TransactionNode node) {
            return node("transaction", node.body().accept(this));
        }
    }
}
