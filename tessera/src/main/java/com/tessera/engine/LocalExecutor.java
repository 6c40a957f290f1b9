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

import com.tessera.adapter.Queryable;
import com.tessera.adapter.SqlDriverAdapter;
import com.tessera.transaction.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Holds the connected driver adapters and the transaction manager of a started engine.
 */
public class LocalExecutor {
    /**
     * Operations that only read and may be served by a read replica outside explicit transactions.
     */
    public static final Set<String> READ_OPERATIONS = Set.of(
            "findFirst",
            "findFirstOrThrow",
            "findMany",
            "findUnique",
            "findUniqueOrThrow",
            "groupBy",
            "aggregate",
            "count",
            "findRaw",
            "aggregateRaw"
    );
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalExecutor.class);
    private final SqlDriverAdapter primary;
    private final SqlDriverAdapter replica;
    private final TransactionManager transactionManager;

    private LocalExecutor(SqlDriverAdapter primary, SqlDriverAdapter replica, TransactionManager transactionManager) {
        this.primary = primary;
        this.replica = replica;
        this.transactionManager = transactionManager;
    }

    /**
     * Connects the primary adapter and, when configured, the read replica adapter. If the replica
     * fails to connect the primary is disposed before the failure is rethrown.
     *
     * @param config    the engine settings
     * @param scheduler the scheduler running transaction watchdogs
     * @return the connected executor
     */
    public static LocalExecutor connect(EngineConfig config, ScheduledExecutorService scheduler) {
        SqlDriverAdapter primary = config.getPrimaryFactory().connect();
        LOGGER.info("Connected to {} primary database", primary.getProvider().getId());
        SqlDriverAdapter replica = null;
        try {
            if (config.getReplicaFactory() != null) {
                replica = config.getReplicaFactory().connect();
                LOGGER.info("Connected to {} read replica", replica.getProvider().getId());
            }
            TransactionManager transactionManager = new TransactionManager(
                    primary,
                    scheduler,
                    config.getTransactionOptions(),
                    config.getMaxConcurrentTransactions(),
                    config.getClosedHistorySize()
            );
            return new LocalExecutor(primary, replica, transactionManager);
        } catch (RuntimeException e) {
            dispose(replica, e);
            dispose(primary, e);
            throw e;
        }
    }

    private static void dispose(SqlDriverAdapter adapter, RuntimeException primaryError) {
        if (adapter == null) {
            return;
        }
        try {
            adapter.dispose();
        } catch (RuntimeException e) {
            primaryError.addSuppressed(e);
        }
    }

    public SqlDriverAdapter getPrimary() {
        return primary;
    }

    /**
     * Returns the read replica adapter, or null.
     */
    public SqlDriverAdapter getReplica() {
        return replica;
    }

    public TransactionManager getTransactionManager() {
        return transactionManager;
    }

    /**
     * Returns the autocommit connection an operation runs on outside an interactive transaction.
     *
     * @param operation the client operation name, may be null
     * @return the replica for read operations when one is configured, the primary otherwise
     */
    public Queryable getQueryable(String operation) {
        if (replica != null && operation != null && READ_OPERATIONS.contains(operation)) {
            return replica;
        }
        return primary;
    }

    /**
     * Cancels every running transaction, then disposes the adapters even if cancelling failed.
     */
    public void disconnect() {
        try {
            transactionManager.shutdown();
        } finally {
            try {
                if (replica != null) {
                    replica.dispose();
                    LOGGER.info("Disconnected from read replica");
                }
            } finally {
                primary.dispose();
                LOGGER.info("Disconnected from primary database");
            }
        }
    }
}
