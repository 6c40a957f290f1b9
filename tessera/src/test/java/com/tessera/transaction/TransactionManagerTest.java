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

package com.tessera.transaction;

import com.tessera.adapter.Provider;
import com.tessera.adapter.Queryable;
import com.tessera.adapter.RecordingDriverAdapter;
import com.tessera.adapter.SqlQuery;
import com.tessera.common.ErrorCode;
import com.tessera.errors.OperationNotSupportedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.*;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class TransactionManagerTest {
    private static final TransactionOptions DEFAULT_OPTIONS = TransactionOptions.builder()
            .maxWait(Duration.ofMillis(200))
            .timeout(Duration.ofSeconds(5))
            .build();
    private ScheduledExecutorService scheduler;
    private RecordingDriverAdapter adapter;
    private TransactionManager manager;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        adapter = new RecordingDriverAdapter(Provider.POSTGRES);
        manager = new TransactionManager(adapter, scheduler, DEFAULT_OPTIONS, 2, 10);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
        scheduler.shutdownNow();
    }

    @Test
    void test_start_and_commit() {
        TransactionInfo info = manager.startTransaction(DEFAULT_OPTIONS);
        assertEquals(TransactionStatus.RUNNING, info.getStatus());
        assertEquals(1, adapter.getOpenConnections());

        manager.getTransaction(info.getId(), "query").executeRaw(new SqlQuery("INSERT INTO a VALUES (1)", List.of()));
        manager.commitTransaction(info.getId());

        assertEquals(1, adapter.getCommits());
        assertEquals(0, adapter.getOpenConnections());
        assertEquals(0, manager.getRunningCount());
        assertEquals(List.of("tx1:INSERT INTO a VALUES (1)"), adapter.getStatements());
    }

    @Test
    void when_committed_twice_then_already_closed() {
        TransactionInfo info = manager.startTransaction(DEFAULT_OPTIONS);
        manager.commitTransaction(info.getId());

        TransactionAlreadyClosedException e = assertThrows(TransactionAlreadyClosedException.class,
                () -> manager.commitTransaction(info.getId()));
        assertEquals(TransactionStatus.COMMITTED, e.getStatus());
        assertEquals(ErrorCode.TRANSACTION_API_ERROR.getCode(), e.getCode());

        assertThrows(TransactionAlreadyClosedException.class, () -> manager.rollbackTransaction(info.getId()));
        assertEquals(1, adapter.getCommits());
        assertEquals(0, adapter.getRollbacks());
    }

    @Test
    void when_rolled_back_then_lookup_fails() {
        TransactionInfo info = manager.startTransaction(DEFAULT_OPTIONS);
        manager.rollbackTransaction(info.getId());

        assertThrows(TransactionClosedException.class, () -> manager.getTransaction(info.getId(), "query"));
        assertEquals(1, adapter.getRollbacks());
    }

    @Test
    void when_transaction_is_unknown_then_not_found() {
        TransactionNotFoundException e = assertThrows(TransactionNotFoundException.class,
                () -> manager.getTransaction("no-such-id", "query"));
        assertEquals("no-such-id", e.getTransactionId());
        assertThrows(TransactionNotFoundException.class, () -> manager.commitTransaction("no-such-id"));
    }

    @Test
    void when_transaction_id_is_null_then_not_found() {
        TransactionNotFoundException e = assertThrows(TransactionNotFoundException.class, () -> manager.commitTransaction(null));
        assertNull(e.getTransactionId());
        assertTrue(e.getMeta().isEmpty());
        assertThrows(TransactionNotFoundException.class, () -> manager.rollbackTransaction(null));
        assertThrows(TransactionNotFoundException.class, () -> manager.getTransaction(null, "query"));
        assertThrows(TransactionNotFoundException.class, () -> manager.getTransactionInfo(null));
    }

    @Test
    void when_limit_is_reached_then_busy_after_max_wait() {
        manager.startTransaction(DEFAULT_OPTIONS);
        manager.startTransaction(DEFAULT_OPTIONS);

        TransactionOptions options = DEFAULT_OPTIONS.toBuilder().maxWait(Duration.ofMillis(100)).build();
        long started = System.nanoTime();
        assertThrows(TransactionBusyException.class, () -> manager.startTransaction(options));
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) >= 100);
        assertEquals(2, adapter.getStartedTransactions());
    }

    @Test
    void when_slot_frees_then_waiting_start_succeeds() throws Exception {
        TransactionInfo first = manager.startTransaction(DEFAULT_OPTIONS);
        manager.startTransaction(DEFAULT_OPTIONS);

        TransactionOptions options = DEFAULT_OPTIONS.toBuilder().maxWait(Duration.ofSeconds(5)).build();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<TransactionInfo> waiting = executor.submit(() -> manager.startTransaction(options));
            Thread.sleep(100);
            assertFalse(waiting.isDone());

            manager.commitTransaction(first.getId());

            TransactionInfo third = waiting.get(5, TimeUnit.SECONDS);
            assertEquals(TransactionStatus.RUNNING, third.getStatus());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void when_timeout_elapses_then_transaction_is_rolled_back() {
        TransactionOptions options = DEFAULT_OPTIONS.toBuilder().timeout(Duration.ofMillis(200)).build();
        TransactionInfo info = manager.startTransaction(options);
        Queryable queryable = manager.getTransaction(info.getId(), "query");

        await().atMost(Duration.ofSeconds(5)).until(() -> adapter.getRollbacks() == 1);

        assertEquals(0, adapter.getOpenConnections());
        assertThrows(TransactionTimedOutException.class, () -> manager.commitTransaction(info.getId()));
        assertThrows(TransactionTimedOutException.class, () -> manager.rollbackTransaction(info.getId()));
        assertThrows(TransactionClosedException.class, () -> manager.getTransaction(info.getId(), "query"));
        assertThrows(TransactionTimedOutException.class,
                () -> queryable.queryRaw(new SqlQuery("SELECT 1", List.of())));
        assertTrue(adapter.getStatements().isEmpty());
    }

    @Test
    void test_timed_out_transaction_frees_its_slot() {
        TransactionOptions shortLived = DEFAULT_OPTIONS.toBuilder().timeout(Duration.ofMillis(100)).build();
        manager.startTransaction(shortLived);
        manager.startTransaction(shortLived);

        TransactionOptions patient = DEFAULT_OPTIONS.toBuilder().maxWait(Duration.ofSeconds(5)).build();
        TransactionInfo info = manager.startTransaction(patient);

        assertEquals(TransactionStatus.RUNNING, info.getStatus());
    }

    @Test
    void when_isolation_level_is_unsupported_then_no_connection_is_opened() {
        TransactionOptions options = DEFAULT_OPTIONS.toBuilder().isolationLevel(IsolationLevel.SNAPSHOT).build();

        OperationNotSupportedException e = assertThrows(OperationNotSupportedException.class,
                () -> manager.startTransaction(options));

        assertEquals(ErrorCode.UNSUPPORTED_FEATURE.getCode(), e.getCode());
        assertEquals(0, adapter.getStartedTransactions());
        assertEquals(0, adapter.getOpenConnections());
    }

    @Test
    void test_isolation_level_is_passed_in_native_form() {
        RecordingDriverAdapter sqlServer = new RecordingDriverAdapter(Provider.SQLSERVER);
        TransactionManager sqlServerManager = new TransactionManager(sqlServer, scheduler, DEFAULT_OPTIONS, 2, 10);
        try {
            sqlServerManager.startTransaction(DEFAULT_OPTIONS.toBuilder().isolationLevel(IsolationLevel.SNAPSHOT).build());
            sqlServerManager.startTransaction(DEFAULT_OPTIONS.toBuilder().isolationLevel(IsolationLevel.READ_COMMITTED).build());
            assertEquals(List.of("SNAPSHOT", "READ COMMITTED"), sqlServer.getIsolationLevels());
        } finally {
            sqlServerManager.shutdown();
        }
    }

    @Test
    void test_cancel_all_transactions() {
        TransactionInfo first = manager.startTransaction(DEFAULT_OPTIONS);
        TransactionInfo second = manager.startTransaction(DEFAULT_OPTIONS);

        assertEquals(2, manager.cancelAllTransactions());

        assertEquals(2, adapter.getRollbacks());
        assertEquals(0, adapter.getOpenConnections());
        assertThrows(TransactionClosedException.class, () -> manager.getTransaction(first.getId(), "query"));
        assertThrows(TransactionClosedException.class, () -> manager.getTransaction(second.getId(), "query"));
        assertEquals(0, manager.cancelAllTransactions());
    }

    @Test
    void when_begin_is_slower_than_max_wait_then_busy_and_late_transaction_is_rolled_back() {
        adapter.setBeginDelay(Duration.ofMillis(500));
        TransactionOptions options = DEFAULT_OPTIONS.toBuilder().maxWait(Duration.ofMillis(100)).build();

        assertThrows(TransactionBusyException.class, () -> manager.startTransaction(options));

        await().atMost(Duration.ofSeconds(5)).until(() -> adapter.getRollbacks() == 1);
        assertEquals(0, adapter.getOpenConnections());
        assertEquals(0, manager.getRunningCount());
    }

    @Test
    void test_commit_waits_for_in_flight_statement() throws Exception {
        TransactionInfo info = manager.startTransaction(DEFAULT_OPTIONS);
        Queryable queryable = manager.getTransaction(info.getId(), "query");
        CountDownLatch gate = adapter.holdStatements();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Long> statement = executor.submit(() -> queryable.executeRaw(new SqlQuery("UPDATE a SET b = 1", List.of())));
            Thread.sleep(50);
            Future<?> commit = executor.submit(() -> manager.commitTransaction(info.getId()));
            Thread.sleep(100);
            assertFalse(commit.isDone());

            gate.countDown();

            assertEquals(1L, statement.get(5, TimeUnit.SECONDS));
            commit.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(List.of("tx1:UPDATE a SET b = 1"), adapter.getStatements());
        assertEquals(1, adapter.getCommits());
    }

    @Test
    void when_commit_follows_timeout_then_connection_is_already_released() throws Exception {
        TransactionOptions options = DEFAULT_OPTIONS.toBuilder().timeout(Duration.ofMillis(200)).build();
        TransactionInfo info = manager.startTransaction(options);
        Queryable queryable = manager.getTransaction(info.getId(), "query");
        CountDownLatch gate = adapter.holdStatements();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            // The in-flight statement keeps the timed out transaction from being rolled back.
            Future<Long> statement = executor.submit(() -> queryable.executeRaw(new SqlQuery("UPDATE a SET b = 1", List.of())));
            await().atMost(Duration.ofSeconds(5)).until(() -> manager.getRunningCount() == 0);

            Future<?> commit = executor.submit(() -> manager.commitTransaction(info.getId()));
            Thread.sleep(100);
            assertFalse(commit.isDone());

            gate.countDown();

            ExecutionException e = assertThrows(ExecutionException.class, () -> commit.get(5, TimeUnit.SECONDS));
            assertInstanceOf(TransactionTimedOutException.class, e.getCause());
            assertEquals(0, adapter.getOpenConnections());
            assertEquals(1, adapter.getRollbacks());
            assertEquals(1L, statement.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        assertEquals(0, adapter.getCommits());
    }
}
