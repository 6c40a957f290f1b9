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

import java.time.Duration;
import java.time.Instant;

/**
 * A point-in-time view of an interactive transaction.
 */
public final class TransactionInfo {
    private final String id;
    private final IsolationLevel isolationLevel;
    private final TransactionStatus status;
    private final Instant createdAt;
    private final Duration timeout;

    TransactionInfo(String id, IsolationLevel isolationLevel, TransactionStatus status, Instant createdAt, Duration timeout) {
        this.id = id;
        this.isolationLevel = isolationLevel;
        this.status = status;
        this.createdAt = createdAt;
        this.timeout = timeout;
    }

    public String getId() {
        return id;
    }

    /**
     * Returns the requested isolation level, or null if the provider default is in use.
     */
    public IsolationLevel getIsolationLevel() {
        return isolationLevel;
    }

    public TransactionStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Instant getDeadline() {
        return createdAt.plus(timeout);
    }

    @Override
    public String toString() {
        return "TransactionInfo{id=" + id + ", status=" + status + ", isolationLevel=" + isolationLevel + "}";
    }
}
