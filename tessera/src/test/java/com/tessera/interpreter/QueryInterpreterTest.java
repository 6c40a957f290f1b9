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

import com.tessera.adapter.Provider;
import com.tessera.adapter.RecordingDriverAdapter;
import com.tessera.common.ErrorCode;
import com.tessera.errors.AmbiguousResultException;
import com.tessera.errors.RecordNotFoundException;
import com.tessera.plan.*;
import com.tessera.transaction.TransactionManager;
import com.tessera.transaction.TransactionOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static com.tessera.adapter.RecordingDriverAdapter.rows;
import static org.junit.jupiter.api.Assertions.*;

class QueryInterpreterTest {
    private RecordingDriverAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new RecordingDriverAdapter(Provider.POSTGRES);
    }

    private QueryInterpreter interpreter() {
        return interpreter(PlaceholderValues.empty(), null);
    }

    private QueryInterpreter interpreter(PlaceholderValues values, QueryEventListener listener) {
        return new QueryInterpreter(InterpreterTransactionManager.disabled(), values, listener);
    }

    private static QueryNode query(String sql, Object... params) {
        return new QueryNode(SqlTemplate.of(sql, params));
    }

    @Test
    void test_value() {
        assertEquals(42, interpreter().run(new ValueNode(42), adapter));
        assertNull(interpreter().run(new ValueNode(null), adapter));
    }

    @Test
    void test_query_returns_records() {
        adapter.onQuery("SELECT id, name FROM users", rows(List.of("id", "name"), new Object[]{1, "a"}, new Object[]{2, "b"}));

        Object result = interpreter().run(query("SELECT id, name FROM users"), adapter);

        assertEquals(List.of(Map.of("id", 1, "name", "a"), Map.of("id", 2, "name", "b")), result);
    }

    @Test
    void test_execute_returns_affected_rows() {
        Object result = interpreter().run(new ExecuteNode(SqlTemplate.of("DELETE FROM users")), adapter);
        assertEquals(1L, result);
    }

    @Test
    void test_placeholder_resolution() {
        List<Object> seen = new ArrayList<>();
        adapter.onQuery("SELECT * FROM users WHERE id = $1", (q) -> {
            seen.addAll(q.args());
            return rows(List.of());
        });
        PlaceholderValues values = PlaceholderValues.of(Map.of("id", 7));

        interpreter(values, null).run(query("SELECT * FROM users WHERE id = $1", Placeholder.of("id")), adapter);

        assertEquals(List.of(7), seen);
    }

    @Test
    void test_let_binding_shadows_placeholder_values() {
        List<Object> seen = new ArrayList<>();
        adapter.onQuery("SELECT * FROM users WHERE id = $1", (q) -> {
            seen.addAll(q.args());
            return rows(List.of());
        });
        PlanNode plan = new LetNode(
                List.of(new Binding("id", new ValueNode(99))),
                query("SELECT * FROM users WHERE id = $1", Placeholder.of("id"))
        );

        interpreter(PlaceholderValues.of(Map.of("id", 7)), null).run(plan, adapter);

        assertEquals(List.of(99), seen);
    }

    @Test
    void test_let_binding_visible_to_later_bindings() {
        PlanNode plan = new LetNode(
                List.of(new Binding("a", new ValueNode(1)), new Binding("b", new GetNode("a"))),
                new SumNode(List.of(new GetNode("a"), new GetNode("b")))
        );
        assertEquals(2L, interpreter().run(plan, adapter));
    }

    @Test
    void when_placeholder_is_missing_then_evaluation_fails() {
        PlanNode plan = query("SELECT * FROM users WHERE id = $1", Placeholder.of("id"));
        InterpreterException e = assertThrows(InterpreterException.class, () -> interpreter().run(plan, adapter));
        assertTrue(e.getMessage().contains("id"));
        assertTrue(adapter.getStatements().isEmpty());
    }

    @Test
    void when_variable_is_unbound_then_evaluation_fails() {
        assertThrows(InterpreterException.class, () -> interpreter().run(new GetNode("missing"), adapter));
    }

    @Test
    void test_if_evaluates_only_the_taken_branch() {
        PlanNode plan = new IfNode(
                new ValueNode(List.of()),
                IfRule.NOT_EMPTY,
                query("SELECT 'then'"),
                query("SELECT 'else'")
        );

        interpreter().run(plan, adapter);

        assertEquals(List.of("auto:SELECT 'else'"), adapter.getStatements());
    }

    @Test
    void test_if_rules() {
        QueryInterpreter interpreter = interpreter();
        PlanNode yes = new ValueNode("yes");
        PlanNode no = new ValueNode("no");
        assertEquals("yes", interpreter.run(new IfNode(new ValueNode(List.of(1)), IfRule.NOT_EMPTY, yes, no), adapter));
        assertEquals("yes", interpreter.run(new IfNode(new ValueNode(null), IfRule.EMPTY, yes, no), adapter));
        assertEquals("yes", interpreter.run(new IfNode(new ValueNode(true), IfRule.TRUTHY, yes, no), adapter));
        assertEquals("no", interpreter.run(new IfNode(new ValueNode(0), IfRule.TRUTHY, yes, no), adapter));
        assertEquals("yes", interpreter.run(new IfNode(new ValueNode(""), IfRule.FALSY, yes, no), adapter));
    }

    @Test
    void test_unique() {
        QueryInterpreter interpreter = interpreter();
        assertEquals(Map.of("id", 1), interpreter.run(new UniqueNode(new ValueNode(List.of(Map.of("id", 1)))), adapter));
        assertNull(interpreter.run(new UniqueNode(new ValueNode(List.of())), adapter));
    }

    @Test
    void when_unique_receives_more_than_one_record_then_ambiguous() {
        PlanNode plan = new UniqueNode(new ValueNode(List.of(Map.of("id", 1), Map.of("id", 2))));
        AmbiguousResultException e = assertThrows(AmbiguousResultException.class, () -> interpreter().run(plan, adapter));
        assertEquals(ErrorCode.AMBIGUOUS_RESULT.getCode(), e.getCode());
        assertEquals(2, e.getMeta().get("count"));
    }

    @Test
    void when_required_value_is_empty_then_record_not_found() {
        RecordNotFoundException e = assertThrows(RecordNotFoundException.class,
                () -> interpreter().run(new RequiredNode(new UniqueNode(new ValueNode(List.of()))), adapter));
        assertEquals("P2025", e.getCode());

        assertThrows(RecordNotFoundException.class, () -> interpreter().run(new RequiredNode(new ValueNode(List.of())), adapter));
        assertEquals(List.of(1), interpreter().run(new RequiredNode(new ValueNode(List.of(1))), adapter));
    }

    @Test
    void test_concat_and_sum() {
        PlanNode concat = new ConcatNode(List.of(new ValueNode(List.of(1, 2)), new ValueNode(List.of(3)), new ValueNode(null)));
        assertEquals(List.of(1, 2, 3), interpreter().run(concat, adapter));

        PlanNode sum = new SumNode(List.of(new ValueNode(1), new ValueNode(2L), new ValueNode(3)));
        assertEquals(6L, interpreter().run(sum, adapter));
    }

    @Test
    void test_map_projects_fields() {
        PlanNode plan = new MapNode(
                new ValueNode(List.of(Map.of("user_id", 1, "user_name", "a", "secret", "x"))),
                List.of(new FieldMapping("user_id", "id"), new FieldMapping("user_name", "name"))
        );
        assertEquals(List.of(Map.of("id", 1, "name", "a")), interpreter().run(plan, adapter));
    }

    @Test
    void test_seq_runs_statements_in_order() {
        PlanNode plan = new SeqNode(List.of(
                new ExecuteNode(SqlTemplate.of("INSERT INTO a VALUES (1)")),
                new ExecuteNode(SqlTemplate.of("INSERT INTO b VALUES (1)")),
                query("SELECT * FROM a")
        ));

        interpreter().run(plan, adapter);

        assertEquals(List.of("auto:INSERT INTO a VALUES (1)", "auto:INSERT INTO b VALUES (1)", "auto:SELECT * FROM a"),
                adapter.getStatements());
    }

    @Test
    void test_join_attaches_children_to_matching_parents() {
        PlanNode parents = new ValueNode(List.of(Map.of("id", 1), Map.of("id", 2)));
        PlanNode children = new ValueNode(List.of(
                Map.of("userId", 1L, "title", "a"),
                Map.of("userId", 1L, "title", "b"),
                Map.of("userId", 3L, "title", "c")
        ));
        PlanNode plan = new JoinNode(parents, List.of(
                new JoinExpression(children, List.of(new JoinCondition("id", "userId")), "posts", false)
        ));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> result = (List<Map<String, Object>>) interpreter().run(plan, adapter);

        assertEquals(2, result.size());
        assertEquals(List.of(Map.of("userId", 1L, "title", "a"), Map.of("userId", 1L, "title", "b")), result.get(0).get("posts"));
        assertEquals(List.of(), result.get(1).get("posts"));
    }

    @Test
    void test_join_attaches_each_child_to_one_parent() {
        PlanNode parents = new ValueNode(List.of(Map.of("id", 1, "n", "first"), Map.of("id", 1, "n", "second")));
        PlanNode children = new ValueNode(List.of(Map.of("userId", 1, "title", "a")));
        PlanNode plan = new JoinNode(parents, List.of(
                new JoinExpression(children, List.of(new JoinCondition("id", "userId")), "posts", false)
        ));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> result = (List<Map<String, Object>>) interpreter().run(plan, adapter);

        assertEquals(1, ((List<?>) result.get(0).get("posts")).size());
        assertEquals(List.of(), result.get(1).get("posts"));
    }

    @Test
    void test_unique_join_and_null_keys() {
        Map<String, Object> withoutKey = new LinkedHashMap<>();
        withoutKey.put("id", null);
        PlanNode parents = new ValueNode(List.of(Map.of("id", 1), withoutKey));
        Map<String, Object> orphan = new LinkedHashMap<>();
        orphan.put("userId", null);
        PlanNode children = new ValueNode(List.of(Map.of("userId", 1, "bio", "x"), orphan));
        PlanNode plan = new JoinNode(parents, List.of(
                new JoinExpression(children, List.of(new JoinCondition("id", "userId")), "profile", true)
        ));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> result = (List<Map<String, Object>>) interpreter().run(plan, adapter);

        assertEquals(Map.of("userId", 1, "bio", "x"), result.get(0).get("profile"));
        assertTrue(result.get(1).containsKey("profile"));
        assertNull(result.get(1).get("profile"));
    }

    @Test
    void test_join_on_single_parent_record() {
        PlanNode plan = new JoinNode(new ValueNode(Map.of("id", 5)), List.of(
                new JoinExpression(new ValueNode(List.of(Map.of("userId", 5))), List.of(new JoinCondition("id", "userId")), "posts", false)
        ));
        assertEquals(Map.of("id", 5, "posts", List.of(Map.of("userId", 5))), interpreter().run(plan, adapter));
    }

    @Test
    void test_query_events() {
        List<QueryEvent> events = new CopyOnWriteArrayList<>();
        PlanNode plan = query("SELECT * FROM users WHERE id = $1", Placeholder.of("id"));

        interpreter(PlaceholderValues.of(Map.of("id", 3)), events::add).run(plan, adapter);

        assertEquals(1, events.size());
        QueryEvent event = events.get(0);
        assertEquals("SELECT * FROM users WHERE id = $1", event.sql());
        assertEquals(List.of(3), event.params());
        assertEquals(QueryInterpreter.TARGET, event.target());
        assertTrue(event.durationMs() >= 0);
        assertNotNull(event.timestamp());
    }

    @Test
    void test_query_event_is_emitted_when_statement_fails() {
        List<QueryEvent> events = new CopyOnWriteArrayList<>();
        adapter.failOn("SELECT 1", new IllegalStateException("boom"));
        assertThrows(IllegalStateException.class, () -> interpreter(PlaceholderValues.empty(), events::add).run(query("SELECT 1"), adapter));
        assertEquals(1, events.size());
    }

    @Nested
    class TransactionNodeTest {
        private ScheduledExecutorService scheduler;
        private TransactionManager manager;

        @BeforeEach
        void setUp() {
            scheduler = Executors.newSingleThreadScheduledExecutor();
            manager = new TransactionManager(adapter, scheduler, TransactionOptions.builder().build(), 2, 10);
        }

        @AfterEach
        void tearDown() {
            manager.shutdown();
            scheduler.shutdownNow();
        }

        private QueryInterpreter transactional() {
            return new QueryInterpreter(InterpreterTransactionManager.enabled(manager), PlaceholderValues.empty(), null);
        }

        @Test
        void test_transaction_node_commits() {
            PlanNode plan = new TransactionNode(new SeqNode(List.of(
                    new ExecuteNode(SqlTemplate.of("INSERT INTO a VALUES (1)")),
                    new ExecuteNode(SqlTemplate.of("INSERT INTO b VALUES (1)"))
            )));

            assertEquals(1L, transactional().run(plan, adapter));

            assertEquals(List.of("tx1:INSERT INTO a VALUES (1)", "tx1:INSERT INTO b VALUES (1)"), adapter.getStatements());
            assertEquals(1, adapter.getCommits());
            assertEquals(0, adapter.getOpenConnections());
        }

        @Test
        void test_transaction_node_rolls_back_on_failure() {
            adapter.failOn("INSERT INTO b VALUES (1)", new IllegalStateException("boom"));
            PlanNode plan = new TransactionNode(new SeqNode(List.of(
                    new ExecuteNode(SqlTemplate.of("INSERT INTO a VALUES (1)")),
                    new ExecuteNode(SqlTemplate.of("INSERT INTO b VALUES (1)"))
            )));

            assertThrows(IllegalStateException.class, () -> transactional().run(plan, adapter));

            assertEquals(0, adapter.getCommits());
            assertEquals(1, adapter.getRollbacks());
            assertEquals(0, adapter.getOpenConnections());
            assertEquals(0, manager.getRunningCount());
        }

        @Test
        void test_transaction_node_without_manager_runs_on_given_queryable() {
            PlanNode plan = new TransactionNode(new ExecuteNode(SqlTemplate.of("INSERT INTO a VALUES (1)")));

            interpreter().run(plan, adapter);

            assertEquals(List.of("auto:INSERT INTO a VALUES (1)"), adapter.getStatements());
            assertEquals(0, adapter.getStartedTransactions());
        }
    }
}
