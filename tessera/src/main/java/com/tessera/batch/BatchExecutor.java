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

package com.tessera.batch;

import com.tessera.adapter.Queryable;
import com.tessera.errors.ErrorTransformer;
import com.tessera.errors.RecordNotFoundException;
import com.tessera.interpreter.InterpreterTransactionManager;
import com.tessera.interpreter.QueryEventListener;
import com.tessera.interpreter.QueryInterpreter;
import com.tessera.interpreter.Values;
import com.tessera.plan.PlaceholderValues;
import com.tessera.plan.PlanNode;
import com.tessera.transaction.TransactionInfo;
import com.tessera.transaction.TransactionManager;
import com.tessera.transaction.TransactionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.*;

/**
 * Runs compiled batches.
 * <p>
 * A batch runs inside the caller's interactive transaction when one is given, otherwise inside an
 * implicit transaction that is committed when the batch completes and rolled back when it aborts.
 * In multi mode the plans run in input order; a failing plan yields an error for its slot only,
 * unless the failure is an infrastructure one, which aborts the batch. In compacted mode any
 * failure aborts the batch.
 */
public class BatchExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchExecutor.class);
    private final TransactionManager transactionManager;
    private final QueryEventListener listener;

    public BatchExecutor(@Nonnull TransactionManager transactionManager, QueryEventListener listener) {
        this.transactionManager = transactionManager;
        this.listener = listener;
    }

    /**
     * Executes a batch.
     *
     * @param batch                    the compiled batch
     * @param placeholderValues        values of the placeholders used by the plans
     * @param interactiveTransactionId the caller's transaction, or null to open an implicit one
     * @param options                  options of the implicit transaction, ignored with an interactive transaction
     * @return one result per request, in request order
     */
    public List<BatchItemResult> execute(@Nonnull BatchResponse batch,
                                         @Nonnull PlaceholderValues placeholderValues,
                                         String interactiveTransactionId,
                                         @Nonnull TransactionOptions options) {
        if (interactiveTransactionId != null) {
            // Interactive transactions are never nested.
            Queryable queryable = transactionManager.getTransaction(interactiveTransactionId, "batch query");
            return run(batch, placeholderValues, queryable);
        }

        TransactionInfo transaction = transactionManager.startTransaction(options);
        List<BatchItemResult> results;
        try {
            Queryable queryable = transactionManager.getTransaction(transaction.getId(), "batch query");
            results = run(batch, placeholderValues, queryable);
        } catch (RuntimeException e) {
            LOGGER.debug("Batch aborted, rolling back transaction {}", transaction.getId());
            try {
                transactionManager.rollbackTransaction(transaction.getId());
            } catch (RuntimeException rollbackError) {
                e.addSuppressed(rollbackError);
            }
            throw e;
        }
        transactionManager.commitTransaction(transaction.getId());
        return results;
    }

    private List<BatchItemResult> run(BatchResponse batch, PlaceholderValues placeholderValues, Queryable queryable) {
        QueryInterpreter interpreter = new QueryInterpreter(InterpreterTransactionManager.disabled(), placeholderValues, listener);
        if (batch instanceof MultiBatchResponse multi) {
            return runMulti(multi, interpreter, queryable);
        }
        CompactedBatchResponse compacted = (CompactedBatchResponse) batch;
        Object rows = interpreter.run(compacted.plan(), queryable);
        return convertCompactedRows(Values.asRecords(rows, "compacted batch"), compacted);
    }

    private List<BatchItemResult> runMulti(MultiBatchResponse batch, QueryInterpreter interpreter, Queryable queryable) {
        List<BatchItemResult> results = new ArrayList<>(batch.plans().size());
        for (PlanNode plan : batch.plans()) {
            try {
                results.add(BatchItemResult.success(interpreter.run(plan, queryable)));
            } catch (RuntimeException e) {
                if (ErrorTransformer.isInfrastructureFailure(e)) {
                    throw e;
                }
                results.add(BatchItemResult.failure(ErrorTransformer.transform(e)));
            }
        }
        return results;
    }

    /**
     * Maps the rows of a compacted plan back to the requests. Each request receives the first row
     * whose key columns equal its arguments, restricted to the selected columns.
     *
     * @param rows     the rows of the compacted plan
     * @param response the compacted batch
     * @return one result per request argument, in argument order
     */
    static List<BatchItemResult> convertCompactedRows(List<Map<String, Object>> rows, CompactedBatchResponse response) {
        List<Map<String, Object>> keysPerRow = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> keys = new HashMap<>();
            for (String key : response.keys()) {
                keys.put(key, row.get(key));
            }
            keysPerRow.add(keys);
        }
        Set<String> selection = new HashSet<>(response.nestedSelection());

        List<BatchItemResult> results = new ArrayList<>(response.arguments().size());
        for (Map<String, Object> arguments : response.arguments()) {
            int index = indexOfMatch(keysPerRow, arguments);
            if (index == -1) {
                results.add(response.expectNonEmpty()
                        ? BatchItemResult.failure(new RecordNotFoundException())
                        : BatchItemResult.success(null));
                continue;
            }
            Map<String, Object> selected = new LinkedHashMap<>();
            for (Map.Entry<String, Object> column : rows.get(index).entrySet()) {
                if (selection.contains(column.getKey())) {
                    selected.put(column.getKey(), column.getValue());
                }
            }
            results.add(BatchItemResult.success(selected));
        }
        return results;
    }

    private static int indexOfMatch(List<Map<String, Object>> keysPerRow, Map<String, Object> arguments) {
        for (int index = 0; index < keysPerRow.size(); index++) {
            if (Values.keysMatch(keysPerRow.get(index), arguments)) {
                return index;
            }
        }
        return -1;
    }
}
