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
import com.tessera.adapter.SqlQuery;
import com.tessera.adapter.SqlResultSet;

/**
 * The connection of an interactive transaction as seen by callers. Statements run one at a time
 * in submission order and are rejected once the transaction left the RUNNING state.
 */
final class TransactionQueryable implements Queryable {
    private final TransactionManager manager;
    private final ManagedTransaction transaction;

    TransactionQueryable(TransactionManager manager, ManagedTransaction transaction) {
        this.manager = manager;
        this.transaction = transaction;
    }

    @Override
    public Provider getProvider() {
        return transaction.handle.getProvider();
    }

    @Override
    public SqlResultSet queryRaw(SqlQuery query) {
        transaction.statementLock.lock();
        try {
            ensureRunning();
            return transaction.handle.queryRaw(query);
        } finally {
            transaction.statementLock.unlock();
        }
    }

    @Override
    public long executeRaw(SqlQuery query) {
        transaction.statementLock.lock();
        try {
            ensureRunning();
            return transaction.handle.executeRaw(query);
        } finally {
            transaction.statementLock.unlock();
        }
    }

    private void ensureRunning() {
        if (transaction.status != TransactionStatus.RUNNING) {
            throw manager.closedError(transaction.id, "query");
        }
    }
}
