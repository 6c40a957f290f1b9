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

import com.tessera.Context;
import com.tessera.TesseraService;
import com.tessera.adapter.Queryable;
import com.tessera.batch.BatchExecutor;
import com.tessera.batch.BatchItemResult;
import com.tessera.batch.BatchResponse;
import com.tessera.errors.ErrorTransformer;
import com.tessera.errors.NotImplementedException;
import com.tessera.interpreter.InterpreterTransactionManager;
import com.tessera.interpreter.QueryEvent;
import com.tessera.interpreter.QueryEventListener;
import com.tessera.interpreter.QueryInterpreter;
import com.tessera.plan.PlanNode;
import com.tessera.transaction.TransactionInfo;
import com.tessera.transaction.TransactionManager;
import com.tessera.transaction.TransactionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * QueryEngine is the entry point of Tessera. It executes query plans and batches, and drives
 * interactive transactions. Every operation runs on the request executor of the {@link Context}
 * and completes with an error of the public taxonomy when it fails.
 */
public class QueryEngine implements TesseraService {
    public static final String NAME = "QueryEngine";
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryEngine.class);
    private final Context context;
    private final EngineConfig config;
    private final QueryEventListener listener;
    private volatile LocalExecutor executor;
    private volatile BatchExecutor batchExecutor;
    private volatile boolean shutdown;

    public QueryEngine(@Nonnull Context context, @Nonnull EngineConfig config) {
        this.context = context;
        this.config = config;
        this.listener = buildListener(config);
    }

    private static QueryEventListener buildListener(EngineConfig config) {
        QueryEventListener userListener = config.getListener();
        if (!config.isLogQueries()) {
            return userListener;
        }
        return (QueryEvent event) -> {
            LOGGER.debug("{} {} ({} ms)", event.sql(), event.params(), event.durationMs());
            if (userListener != null) {
                userListener.onQuery(event);
            }
        };
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Context getContext() {
        return context;
    }

    /**
     * Connects the driver adapters and registers the engine in its context. Calling it again on a
     * started engine has no effect.
     *
     * @throws com.tessera.errors.InitializationException if the engine cannot be started
     */
    public synchronized void start() {
        if (shutdown) {
            throw new IllegalStateException("QueryEngine has been shut down");
        }
        if (executor != null) {
            return;
        }
        try {
            LocalExecutor localExecutor = LocalExecutor.connect(config, context.getScheduler());
            batchExecutor = new BatchExecutor(localExecutor.getTransactionManager(), listener);
            executor = localExecutor;
        } catch (RuntimeException e) {
            throw ErrorTransformer.transformInitError(e);
        }
        context.registerService(NAME, this);
        LOGGER.info("QueryEngine started with {} provider", executor.getPrimary().getProvider().getId());
    }

    private LocalExecutor ensureStarted() {
        LocalExecutor current = executor;
        if (current == null) {
            start();
            current = executor;
        }
        return current;
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return task.get();
            } catch (RuntimeException | Error e) {
                throw ErrorTransformer.transform(e);
            }
        }, context.getRequestExecutor());
    }

    /**
     * Executes a single query plan.
     *
     * @param plan    the plan
     * @param options placeholders, interactive transaction and operation name
     * @return the result value
     */
    public CompletableFuture<Object> request(@Nonnull PlanNode plan, @Nonnull RequestOptions options) {
        return submit(() -> {
            LocalExecutor local = ensureStarted();
            TransactionManager transactionManager = local.getTransactionManager();
            Queryable queryable;
            InterpreterTransactionManager interpreterTransactions;
            if (options.getInteractiveTransaction() != null) {
                queryable = transactionManager.getTransaction(options.getInteractiveTransaction(), "query");
                interpreterTransactions = InterpreterTransactionManager.disabled();
            } else {
                queryable = local.getQueryable(options.getOperation());
                interpreterTransactions = InterpreterTransactionManager.enabled(transactionManager);
            }
            QueryInterpreter interpreter = new QueryInterpreter(interpreterTransactions, options.getPlaceholders(), listener);
            return interpreter.run(plan, queryable);
        });
    }

    /**
     * Executes a compiled batch.
     *
     * @param batch   the compiled batch
     * @param options placeholders and transaction settings
     * @return one result per request, in request order
     */
    public CompletableFuture<List<BatchItemResult>> requestBatch(@Nonnull BatchResponse batch, @Nonnull BatchRequestOptions options) {
        return submit(() -> {
            LocalExecutor local = ensureStarted();
            TransactionOptions transactionOptions = local.getTransactionManager().getDefaultOptions();
            if (options.getIsolationLevel() != null) {
                transactionOptions = transactionOptions.toBuilder().isolationLevel(options.getIsolationLevel()).build();
            }
            return batchExecutor.execute(batch, options.getPlaceholders(), options.getInteractiveTransaction(), transactionOptions);
        });
    }

    public CompletableFuture<TransactionInfo> startTransaction(@Nonnull TransactionOptions options) {
        return submit(() -> ensureStarted().getTransactionManager().startTransaction(options));
    }

    public CompletableFuture<Void> commitTransaction(@Nonnull String id) {
        return submit(() -> {
            ensureStarted().getTransactionManager().commitTransaction(id);
            return null;
        });
    }

    public CompletableFuture<Void> rollbackTransaction(@Nonnull String id) {
        return submit(() -> {
            ensureStarted().getTransactionManager().rollbackTransaction(id);
            return null;
        });
    }

    /**
     * Drives an interactive transaction.
     *
     * @param action  the action
     * @param id      the transaction id, ignored by {@link TransactionAction#START}
     * @param options the options of a new transaction, null for the engine defaults
     * @return the id of the transaction the action was applied to
     */
    public CompletableFuture<String> transaction(@Nonnull TransactionAction action, String id, TransactionOptions options) {
        return submit(() -> {
            TransactionManager transactionManager = ensureStarted().getTransactionManager();
            switch (action) {
                case START -> {
                    TransactionOptions effective = options == null ? transactionManager.getDefaultOptions() : options;
                    return transactionManager.startTransaction(effective).getId();
                }
                case COMMIT -> transactionManager.commitTransaction(id);
                case ROLLBACK -> transactionManager.rollbackTransaction(id);
            }
            return id;
        });
    }

    /**
     * Metrics are not collected by this engine.
     *
     * @throws NotImplementedException always
     */
    public Object metrics() {
        throw new NotImplementedException("Metrics are not implemented by the query engine");
    }

    @Override
    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        LocalExecutor current = executor;
        executor = null;
        if (current != null) {
            current.disconnect();
        }
        LOGGER.info("QueryEngine has been shut down");
    }
}
