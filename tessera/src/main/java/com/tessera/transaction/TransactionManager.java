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

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.Striped;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.tessera.adapter.Queryable;
import com.tessera.adapter.SqlDriverAdapter;
import com.tessera.adapter.Transaction;
import com.tessera.common.TesseraException;
import com.tessera.internal.TesseraExecutors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.locks.Lock;

/**
 * Owns the lifecycle of interactive transactions.
 * <p>
 * The number of RUNNING transactions is bounded by a fair semaphore. Every started transaction pins
 * one connection of the driver adapter until it is committed, rolled back, timed out or cancelled.
 * Registry mutations on a transaction id are serialized by a striped lock; the lock of an id is
 * always taken before the statement lock of its transaction.
 */
public class TransactionManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(TransactionManager.class);
    private final SqlDriverAdapter adapter;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final TransactionOptions defaultOptions;
    private final Semaphore slots;
    private final ConcurrentHashMap<String, ManagedTransaction> transactions = new ConcurrentHashMap<>();
    // Detached by the watchdog or by cancellation, still waiting for their rollback.
    private final ConcurrentHashMap<String, ManagedTransaction> releasing = new ConcurrentHashMap<>();
    private final Cache<String, ClosedTransaction> closedTransactions;
    private final Striped<Lock> locks = Striped.lock(64);

    /**
     * @param adapter           the driver adapter transactions are opened on
     * @param scheduler         the scheduler running the timeout watchdogs
     * @param defaultOptions    options used when a caller does not supply its own
     * @param maxConcurrent     maximum number of RUNNING transactions
     * @param closedHistorySize how many closed transaction ids are remembered
     */
    public TransactionManager(@Nonnull SqlDriverAdapter adapter,
                              @Nonnull ScheduledExecutorService scheduler,
                              @Nonnull TransactionOptions defaultOptions,
                              int maxConcurrent,
                              int closedHistorySize) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be greater than 0");
        }
        this.adapter = adapter;
        this.scheduler = scheduler;
        this.defaultOptions = defaultOptions;
        this.slots = new Semaphore(maxConcurrent, true);
        this.closedTransactions = CacheBuilder.newBuilder().maximumSize(closedHistorySize).build();
        ThreadFactory factory = new ThreadFactoryBuilder()
                .setNameFormat("tessera-transaction-%d")
                .setDaemon(true)
                .build();
        this.workers = TesseraExecutors.newBoundedExecutor(maxConcurrent, 1L, TimeUnit.MINUTES, factory);
    }

    public TransactionOptions getDefaultOptions() {
        return defaultOptions;
    }

    /**
     * Starts a new interactive transaction.
     *
     * @param options the transaction options
     * @return a view of the RUNNING transaction
     * @throws com.tessera.errors.OperationNotSupportedException if the provider does not support the isolation level
     * @throws TransactionBusyException                          if no slot frees or the begin does not complete within maxWait
     */
    public TransactionInfo startTransaction(@Nonnull TransactionOptions options) {
        // Fails before any connection is acquired.
        String isolationLevel = IsolationLevelMapping.toNative(adapter.getProvider(), options.getIsolationLevel());

        long deadline = System.nanoTime() + options.getMaxWait().toNanos();
        acquireSlot(options.getMaxWait());

        CompletableFuture<Transaction> begin;
        try {
            begin = CompletableFuture.supplyAsync(() -> adapter.startTransaction(isolationLevel), workers);
        } catch (RejectedExecutionException e) {
            slots.release();
            throw new TesseraException("Transaction manager is shut down", e);
        }

        Transaction handle;
        try {
            handle = begin.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            // The slot stays taken until the late native transaction is rolled back.
            begin.whenComplete((late, error) -> {
                try {
                    if (late != null) {
                        rollbackQuietly(late, "late begin");
                    }
                } finally {
                    slots.release();
                }
            });
            throw new TransactionBusyException(options.getMaxWait());
        } catch (ExecutionException e) {
            slots.release();
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new TesseraException("Failed to start transaction", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            begin.whenComplete((late, error) -> {
                try {
                    if (late != null) {
                        rollbackQuietly(late, "interrupted begin");
                    }
                } finally {
                    slots.release();
                }
            });
            throw new TesseraException("Interrupted while starting a transaction", e);
        }

        ManagedTransaction transaction = new ManagedTransaction(UUID.randomUUID().toString(), options, handle);
        Lock lock = locks.get(transaction.id);
        lock.lock();
        try {
            transaction.status = TransactionStatus.RUNNING;
            transactions.put(transaction.id, transaction);
            transaction.watchdog = scheduler.schedule(
                    () -> expire(transaction.id),
                    options.getTimeout().toNanos(),
                    TimeUnit.NANOSECONDS
            );
        } finally {
            lock.unlock();
        }
        LOGGER.debug("Started transaction {} with isolation level {}", transaction.id, isolationLevel);
        return transaction.toInfo();
    }

    private void acquireSlot(Duration maxWait) {
        boolean acquired;
        try {
            acquired = slots.tryAcquire(maxWait.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TesseraException("Interrupted while waiting for a transaction slot", e);
        }
        if (!acquired) {
            throw new TransactionBusyException(maxWait);
        }
    }

    /**
     * Returns the connection of a RUNNING transaction.
     *
     * @param id      the transaction id
     * @param purpose what the caller is about to do, used in error messages
     * @return the transaction-bound queryable
     * @throws TransactionClosedException if the transaction is unknown or not running
     */
    public Queryable getTransaction(String id, @Nonnull String purpose) {
        ensureId(id, purpose);
        ManagedTransaction transaction = transactions.get(id);
        if (transaction == null || transaction.status != TransactionStatus.RUNNING) {
            throw closedErrorAfterRelease(id, purpose);
        }
        return new TransactionQueryable(this, transaction);
    }

    /**
     * Returns a view of a RUNNING transaction.
     *
     * @param id the transaction id
     * @return the transaction view
     * @throws TransactionClosedException if the transaction is unknown or not running
     */
    public TransactionInfo getTransactionInfo(String id) {
        ensureId(id, "lookup");
        ManagedTransaction transaction = transactions.get(id);
        if (transaction != null) {
            return transaction.toInfo();
        }
        throw closedErrorAfterRelease(id, "lookup");
    }

    public int getRunningCount() {
        return transactions.size();
    }

    public void commitTransaction(String id) {
        close(id, TransactionStatus.COMMITTED, "commit");
    }

    public void rollbackTransaction(String id) {
        close(id, TransactionStatus.ROLLED_BACK, "rollback");
    }

    private void close(String id, TransactionStatus target, String operation) {
        ensureId(id, operation);
        Lock lock = locks.get(id);
        lock.lock();
        try {
            ManagedTransaction transaction = transactions.get(id);
            if (transaction == null || transaction.status != TransactionStatus.RUNNING) {
                throw closedErrorAfterRelease(id, operation);
            }
            transaction.watchdog.cancel(false);
            transaction.statementLock.lock();
            try {
                if (target == TransactionStatus.COMMITTED) {
                    commit(transaction);
                } else {
                    try {
                        transaction.handle.rollback();
                    } finally {
                        finish(transaction, TransactionStatus.ROLLED_BACK);
                    }
                }
            } finally {
                transaction.statementLock.unlock();
            }
        } finally {
            lock.unlock();
        }
        LOGGER.debug("Transaction {} closed with {}", id, operation);
    }

    private void commit(ManagedTransaction transaction) {
        try {
            transaction.handle.commit();
        } catch (RuntimeException e) {
            try {
                transaction.handle.rollback();
            } catch (RuntimeException rollbackError) {
                e.addSuppressed(rollbackError);
            }
            finish(transaction, TransactionStatus.ROLLED_BACK);
            throw e;
        }
        finish(transaction, TransactionStatus.COMMITTED);
    }

    private void finish(ManagedTransaction transaction, TransactionStatus status) {
        transaction.status = status;
        if (transactions.remove(transaction.id, transaction)) {
            remember(transaction, status);
            slots.release();
        }
    }

    private void remember(ManagedTransaction transaction, TransactionStatus status) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - transaction.startedNanos);
        closedTransactions.put(transaction.id, new ClosedTransaction(status, transaction.options.getTimeout(), elapsed));
    }

    /**
     * Watchdog task: marks the transaction TIMED_OUT and rolls it back on a transaction worker.
     */
    private void expire(String id) {
        ManagedTransaction transaction = detach(id, TransactionStatus.TIMED_OUT);
        if (transaction == null) {
            return;
        }
        LOGGER.warn("Transaction {} timed out after {} ms, rolling back", id, transaction.options.getTimeout().toMillis());
        try {
            workers.execute(() -> release(transaction, "timeout"));
        } catch (RejectedExecutionException e) {
            release(transaction, "timeout");
        }
    }

    /**
     * Removes a RUNNING transaction from the registry under its id lock and marks it with the given
     * terminal status. Statements issued afterwards are rejected.
     */
    private ManagedTransaction detach(String id, TransactionStatus status) {
        Lock lock = locks.get(id);
        lock.lock();
        try {
            ManagedTransaction transaction = transactions.get(id);
            if (transaction == null || transaction.status != TransactionStatus.RUNNING) {
                return null;
            }
            transaction.status = status;
            transaction.watchdog.cancel(false);
            transactions.remove(id);
            releasing.put(id, transaction);
            remember(transaction, status);
            return transaction;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rolls back a detached transaction once its in-flight statement completes, then frees its slot.
     */
    private void release(ManagedTransaction transaction, String reason) {
        transaction.statementLock.lock();
        try {
            rollbackQuietly(transaction.handle, reason);
        } finally {
            transaction.statementLock.unlock();
            releasing.remove(transaction.id, transaction);
            slots.release();
            transaction.released.complete(null);
        }
    }

    private void rollbackQuietly(Transaction handle, String reason) {
        try {
            handle.rollback();
        } catch (RuntimeException e) {
            LOGGER.error("Failed to roll back transaction ({})", reason, e);
        }
    }

    /**
     * Rolls back every RUNNING transaction and releases their connections.
     *
     * @return the number of cancelled transactions
     */
    public int cancelAllTransactions() {
        List<ManagedTransaction> cancelled = new ArrayList<>();
        for (String id : new ArrayList<>(transactions.keySet())) {
            ManagedTransaction transaction = detach(id, TransactionStatus.ROLLED_BACK);
            if (transaction != null) {
                cancelled.add(transaction);
            }
        }
        for (ManagedTransaction transaction : cancelled) {
            release(transaction, "cancel");
        }
        if (!cancelled.isEmpty()) {
            LOGGER.warn("Cancelled {} running transaction(s)", cancelled.size());
        }
        return cancelled.size();
    }

    /**
     * Cancels every transaction and stops the transaction workers.
     */
    public void shutdown() {
        cancelAllTransactions();
        TesseraExecutors.shutdown("Transaction workers", workers, TesseraExecutors.DEFAULT_SHUTDOWN_TIMEOUT);
    }

    private static void ensureId(String id, String operation) {
        if (id == null) {
            throw new TransactionNotFoundException(null, operation);
        }
    }

    /**
     * Like {@link #closedError(String, String)}, but first waits until a detached transaction with
     * this id has been rolled back, so a caller never observes a closed transaction whose
     * connection is still pinned. Must not be called while holding a statement lock.
     */
    private TransactionClosedException closedErrorAfterRelease(String id, String operation) {
        ManagedTransaction pending = releasing.get(id);
        if (pending != null) {
            pending.released.join();
        }
        return closedError(id, operation);
    }

    TransactionClosedException closedError(String id, String operation) {
        ManagedTransaction running = transactions.get(id);
        if (running != null && running.status.isTerminal()) {
            return statusError(id, operation, running.status, running.options.getTimeout(),
                    Duration.ofNanos(System.nanoTime() - running.startedNanos));
        }
        ClosedTransaction closed = closedTransactions.getIfPresent(id);
        if (closed == null) {
            return new TransactionNotFoundException(id, operation);
        }
        return statusError(id, operation, closed.status(), closed.timeout(), closed.elapsed());
    }

    private TransactionClosedException statusError(String id, String operation, TransactionStatus status,
                                                   Duration timeout, Duration elapsed) {
        if (status == TransactionStatus.TIMED_OUT) {
            return new TransactionTimedOutException(id, operation, timeout, elapsed);
        }
        return new TransactionAlreadyClosedException(id, operation, status);
    }
}
