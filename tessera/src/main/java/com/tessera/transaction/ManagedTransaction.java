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

import com.tessera.adapter.Transaction;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry entry of a running transaction. Status changes happen under the manager's per-id lock.
 */
final class ManagedTransaction {
    final String id;
    final TransactionOptions options;
    final Transaction handle;
    final Instant createdAt;
    final long startedNanos;
    // Serializes statements and the final commit/rollback on the pinned connection.
    final ReentrantLock statementLock = new ReentrantLock();
    volatile TransactionStatus status = TransactionStatus.PENDING;
    volatile ScheduledFuture<?> watchdog;
    // Completed once a detached transaction has been rolled back and its slot freed.
    final CompletableFuture<Void> released = new CompletableFuture<>();

    ManagedTransaction(String id, TransactionOptions options, Transaction handle) {
        this.id = id;
        this.options = options;
        this.handle = handle;
        this.createdAt = Instant.now();
        this.startedNanos = System.nanoTime();
    }

    TransactionInfo toInfo() {
        return new TransactionInfo(id, options.getIsolationLevel(), status, createdAt, options.getTimeout());
    }
}
