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

package com.tessera.engine;

import com.tessera.BaseTest;
import com.tessera.Context;
import com.tessera.ContextImpl;
import com.tessera.adapter.Provider;
import com.tessera.adapter.jdbc.JdbcDriverAdapterFactory;
import com.tessera.batch.BatchItemResult;
import com.tessera.batch.BatchResponseCodec;
import com.tessera.errors.KnownRequestException;
import com.tessera.plan.PlanCodec;
import com.tessera.plan.PlanNode;
import org.hsqldb.jdbc.JDBCDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class QueryEngineJdbcTest extends BaseTest {
    private Context context;
    private QueryEngine engine;

    private static PlanNode plan(String json) {
        return PlanCodec.decode(json);
    }

    private static PlanNode execute(String sql) {
        return plan("{\"type\":\"execute\",\"args\":{\"sql\":\"" + sql + "\",\"params\":[]}}");
    }

    @BeforeEach
    void setUp() {
        JDBCDataSource dataSource = new JDBCDataSource();
        dataSource.setUrl(String.format("jdbc:hsqldb:mem:%s", UUID.randomUUID()));
        dataSource.setUser("sa");
        dataSource.setPassword("");

        context = new ContextImpl(loadConfig("test.conf"));
        EngineConfig config = EngineConfig.fromConfig(context.getConfig(),
                new JdbcDriverAdapterFactory(dataSource, Provider.POSTGRES), null, null);
        engine = new QueryEngine(context, config);
        engine.start();

        engine.request(execute("SET DATABASE TRANSACTION CONTROL MVCC"), RequestOptions.defaults()).join();
        engine.request(execute("CREATE TABLE users (id INTEGER PRIMARY KEY, name VARCHAR(50) NOT NULL)"), RequestOptions.defaults()).join();
        engine.request(execute("CREATE TABLE posts (id INTEGER PRIMARY KEY, user_id INTEGER NOT NULL, title VARCHAR(50))"), RequestOptions.defaults()).join();
    }

    @AfterEach
    void tearDown() {
        engine.request(execute("SHUTDOWN"), RequestOptions.defaults()).join();
        context.shutdown();
    }

    @Test
    void test_join_over_real_queries() {
        engine.request(execute("INSERT INTO users VALUES (1, 'alice'), (2, 'bob')"), RequestOptions.defaults()).join();
        engine.request(execute("INSERT INTO posts VALUES (10, 1, 'a'), (11, 1, 'b'), (12, 2, 'c')"), RequestOptions.defaults()).join();

        PlanNode plan = plan("{\"type\":\"join\",\"args\":{"
                + "\"parent\":{\"type\":\"query\",\"args\":{\"sql\":\"SELECT id, name FROM users ORDER BY id\",\"params\":[]}},"
                + "\"children\":[{\"child\":{\"type\":\"query\",\"args\":{\"sql\":\"SELECT user_id, title FROM posts ORDER BY id\",\"params\":[]}},"
                + "\"on\":[[\"ID\",\"USER_ID\"]],\"parentField\":\"posts\",\"unique\":false}]}}");

        Object result = engine.request(plan, RequestOptions.builder().operation("findMany").build()).join();

        assertEquals(List.of(
                Map.of("ID", 1, "NAME", "alice", "posts", List.of(Map.of("USER_ID", 1, "TITLE", "a"), Map.of("USER_ID", 1, "TITLE", "b"))),
                Map.of("ID", 2, "NAME", "bob", "posts", List.of(Map.of("USER_ID", 2, "TITLE", "c")))
        ), result);
    }

    @Test
    void test_interactive_transaction_rollback() {
        String id = engine.transaction(TransactionAction.START, null, null).join();
        engine.request(execute("INSERT INTO users VALUES (1, 'alice')"), RequestOptions.builder().interactiveTransaction(id).build()).join();
        engine.transaction(TransactionAction.ROLLBACK, id, null).join();

        Object rows = engine.request(plan("{\"type\":\"query\",\"args\":{\"sql\":\"SELECT * FROM users\",\"params\":[]}}"),
                RequestOptions.defaults()).join();
        assertEquals(List.of(), rows);
    }

    @Test
    void test_multi_batch_isolates_constraint_violation() {
        String batch = "{\"type\":\"multi\",\"plans\":["
                + "{\"type\":\"execute\",\"args\":{\"sql\":\"INSERT INTO users VALUES (1, 'alice')\",\"params\":[]}},"
                + "{\"type\":\"execute\",\"args\":{\"sql\":\"INSERT INTO users VALUES (1, 'again')\",\"params\":[]}},"
                + "{\"type\":\"execute\",\"args\":{\"sql\":\"INSERT INTO users VALUES (2, 'bob')\",\"params\":[]}}]}";

        List<BatchItemResult> results = engine.requestBatch(BatchResponseCodec.decode(batch), BatchRequestOptions.defaults()).join();

        assertEquals(1L, results.get(0).getData());
        KnownRequestException error = assertInstanceOf(KnownRequestException.class, results.get(1).getError());
        assertEquals("P2002", error.getCode());
        assertEquals(1L, results.get(2).getData());

        Object count = engine.request(plan("{\"type\":\"query\",\"args\":{\"sql\":\"SELECT COUNT(*) AS C FROM users\",\"params\":[]}}"),
                RequestOptions.defaults()).join();
        assertEquals(List.of(Map.of("C", 2L)), count);
    }

    @Test
    void test_known_error_from_driver() {
        engine.request(execute("INSERT INTO users VALUES (1, 'alice')"), RequestOptions.defaults()).join();

        CompletionException e = assertThrows(CompletionException.class,
                () -> engine.request(execute("INSERT INTO users VALUES (1, 'alice')"), RequestOptions.defaults()).join());

        KnownRequestException known = assertInstanceOf(KnownRequestException.class, e.getCause());
        assertEquals("P2002", known.getCode());
    }
}
