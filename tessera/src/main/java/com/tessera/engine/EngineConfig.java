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

import com.tessera.adapter.SqlDriverAdapterFactory;
import com.tessera.errors.InitializationException;
import com.tessera.errors.KnownRequestException;
import com.tessera.interpreter.QueryEventListener;
import com.tessera.transaction.TransactionOptions;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import javax.annotation.Nonnull;

/**
 * Validated settings of a {@link QueryEngine}.
 */
public final class EngineConfig {
    private final SqlDriverAdapterFactory primaryFactory;
    private final SqlDriverAdapterFactory replicaFactory;
    private final QueryEventListener listener;
    private final boolean logQueries;
    private final int maxConcurrentTransactions;
    private final int closedHistorySize;
    private final TransactionOptions transactionOptions;

    private EngineConfig(SqlDriverAdapterFactory primaryFactory,
                         SqlDriverAdapterFactory replicaFactory,
                         QueryEventListener listener,
                         boolean logQueries,
                         int maxConcurrentTransactions,
                         int closedHistorySize,
                         TransactionOptions transactionOptions) {
        this.primaryFactory = primaryFactory;
        this.replicaFactory = replicaFactory;
        this.listener = listener;
        this.logQueries = logQueries;
        this.maxConcurrentTransactions = maxConcurrentTransactions;
        this.closedHistorySize = closedHistorySize;
        this.transactionOptions = transactionOptions;
    }

    /**
     * Builds the engine settings from the {@code tessera} section of the configuration.
     *
     * @param config         the root configuration
     * @param primaryFactory the driver adapter factory of the primary database
     * @param replicaFactory the driver adapter factory of a read replica, or null
     * @param listener       receives an event for every executed statement, or null
     * @return the validated settings
     * @throws InitializationException if a value is missing or invalid
     */
    public static EngineConfig fromConfig(@Nonnull Config config,
                                          SqlDriverAdapterFactory primaryFactory,
                                          SqlDriverAdapterFactory replicaFactory,
                                          QueryEventListener listener) {
        if (primaryFactory == null) {
            throw new InitializationException("A driver adapter factory is required");
        }
        if (replicaFactory != null && replicaFactory.getProvider() != primaryFactory.getProvider()) {
            throw new InitializationException(String.format(
                    "Read replica provider %s does not match primary provider %s",
                    replicaFactory.getProvider().getId(), primaryFactory.getProvider().getId()));
        }
        try {
            int maxConcurrent = config.getInt("tessera.transactions.max_concurrent");
            if (maxConcurrent <= 0) {
                throw new InitializationException("tessera.transactions.max_concurrent must be greater than 0");
            }
            int closedHistorySize = config.getInt("tessera.transactions.closed_history_size");
            if (closedHistorySize < 0) {
                throw new InitializationException("tessera.transactions.closed_history_size cannot be negative");
            }
            return new EngineConfig(
                    primaryFactory,
                    replicaFactory,
                    listener,
                    config.getBoolean("tessera.log_queries"),
                    maxConcurrent,
                    closedHistorySize,
                    TransactionOptions.fromConfig(config)
            );
        } catch (ConfigException | IllegalArgumentException | KnownRequestException e) {
            throw new InitializationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    public SqlDriverAdapterFactory getPrimaryFactory() {
        return primaryFactory;
    }

    /**
     * Returns the read replica factory, or null if no replica is configured.
     */
    public SqlDriverAdapterFactory getReplicaFactory() {
        return replicaFactory;
    }

    public QueryEventListener getListener() {
        return listener;
    }

    public boolean isLogQueries() {
        return logQueries;
    }

    public int getMaxConcurrentTransactions() {
        return maxConcurrentTransactions;
    }

    public int getClosedHistorySize() {
        return closedHistorySize;
    }

    public TransactionOptions getTransactionOptions() {
        return transactionOptions;
    }
}
