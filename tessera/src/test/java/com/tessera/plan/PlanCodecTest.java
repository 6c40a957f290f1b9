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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlanCodecTest {

    @Test
    void test_decode_query_with_placeholder() {
        String json = "{\"type\":\"unique\",\"args\":{\"type\":\"query\",\"args\":"
                + "{\"sql\":\"SELECT * FROM users WHERE id = $1 AND active = $2\",\"params\":[{\"$param\":\"id\"},true]}}}";

        PlanNode plan = PlanCodec.decode(json);

        UniqueNode unique = assertInstanceOf(UniqueNode.class, plan);
        QueryNode query = assertInstanceOf(QueryNode.class, unique.expr());
        assertEquals("SELECT * FROM users WHERE id = $1 AND active = $2", query.template().sql());
        assertEquals(List.of(Placeholder.of("id"), true), query.template().params());
    }

    @Test
    void test_decode_join() {
        String json = "{\"type\":\"join\",\"args\":{\"parent\":{\"type\":\"value\",\"args\":[]},"
                + "\"children\":[{\"child\":{\"type\":\"value\",\"args\":[]},\"on\":[[\"id\",\"userId\"]],\"parentField\":\"posts\",\"unique\":false}]}}";

        JoinNode join = assertInstanceOf(JoinNode.class, PlanCodec.decode(json));

        assertEquals(1, join.children().size());
        JoinExpression expression = join.children().get(0);
        assertEquals(List.of(new JoinCondition("id", "userId")), expression.on());
        assertEquals("posts", expression.parentField());
        assertFalse(expression.unique());
    }

    @Test
    void test_decode_if_and_map() {
        String json = "{\"type\":\"if\",\"args\":{\"value\":{\"type\":\"get\",\"args\":{\"name\":\"x\"}},\"rule\":\"notEmpty\","
                + "\"then\":{\"type\":\"map\",\"args\":{\"expr\":{\"type\":\"get\",\"args\":{\"name\":\"x\"}},\"fields\":{\"id\":\"user_id\"}}},"
                + "\"else\":{\"type\":\"value\",\"args\":null}}}";

        IfNode node = assertInstanceOf(IfNode.class, PlanCodec.decode(json));

        assertEquals(IfRule.NOT_EMPTY, node.rule());
        MapNode map = assertInstanceOf(MapNode.class, node.then());
        assertEquals(List.of(new FieldMapping("user_id", "id")), map.fields());
        assertEquals(new ValueNode(null), node.otherwise());
    }

    @Test
    void test_encode_then_decode() {
        PlanNode plan = new TransactionNode(new LetNode(
                List.of(new Binding("user", new UniqueNode(new QueryNode(SqlTemplate.of("SELECT * FROM users WHERE id = $1", Placeholder.of("id")))))),
                new SeqNode(List.of(
                        new ExecuteNode(SqlTemplate.of("UPDATE users SET n = n + 1")),
                        new RequiredNode(new GetNode("user")),
                        new ConcatNode(List.of(new ValueNode(List.of(1)), new ValueNode(List.of(2)))),
                        new SumNode(List.of(new ValueNode(1), new ValueNode(2))),
                        new IfNode(new GetNode("user"), IfRule.FALSY, new ValueNode("a"), new ValueNode(Map.of("k", "v")))
                ))
        ));

        assertEquals(plan, PlanCodec.decode(PlanCodec.encode(plan)));
    }

    @Test
    void when_node_type_is_unknown_then_format_error() {
        PlanFormatException e = assertThrows(PlanFormatException.class,
                () -> PlanCodec.decode("{\"type\":\"dataMap\",\"args\":{}}"));
        assertTrue(e.getMessage().contains("dataMap"));
    }

    @Test
    void when_plan_is_malformed_then_format_error() {
        assertThrows(PlanFormatException.class, () -> PlanCodec.decode("{\"args\":1}"));
        assertThrows(PlanFormatException.class, () -> PlanCodec.decode("[]"));
        assertThrows(PlanFormatException.class, () -> PlanCodec.decode("{\"type\":\"query\",\"args\":{}}"));
        assertThrows(PlanFormatException.class, () -> PlanCodec.decode("{"));
    }
}
