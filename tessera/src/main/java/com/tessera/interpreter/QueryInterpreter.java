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

package com.tessera.interpreter;

import com.tessera.adapter.Queryable;
import com.tessera.adapter.SqlQuery;
import com.tessera.adapter.SqlResultSet;
import com.tessera.errors.AmbiguousResultException;
import com.tessera.errors.RecordNotFoundException;
import com.tessera.plan.*;
import com.tessera.transaction.TransactionInfo;
import com.tessera.transaction.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * The QueryInterpreter evaluates a query plan against a {@link Queryable}.
 * <p>
 * Evaluation is depth-first and sequential: operands are evaluated in declaration order before the
 * node consuming them, so statements reach the connection in a deterministic order. The untaken
 * branch of an {@link IfNode} is never evaluated.
 * <p>
 * An interpreter holds no mutable state and can run any number of plans.
 */
public class QueryInterpreter {
    public static final String TARGET = "tessera";
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryInterpreter.class);
    private final InterpreterTransactionManager transactionManager;
    private final PlaceholderValues placeholderValues;
    private final QueryEventListener listener;

    public QueryInterpreter(@Nonnull InterpreterTransactionManager transactionManager,
                            @Nonnull PlaceholderValues placeholderValues,
                            QueryEventListener listener) {
        this.transactionManager = transactionManager;
        this.placeholderValues = placeholderValues;
        this.listener = listener;
    }

    /**
     * Evaluates the plan.
     *
     * @param plan      the root of the plan tree
     * @param queryable the connection the leaf statements run on
     * @return the result value
     */
    public Object run(@Nonnull PlanNode plan, @Nonnull Queryable queryable) {
        return plan.accept(new Evaluator(queryable, Scope.root(), transactionManager));
    }

    private void emit(SqlQuery query, long startedAt, long startedNanos) {
        if (listener == null) {
            return;
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        try {
            listener.onQuery(new QueryEvent(Instant.ofEpochMilli(startedAt), query.sql(), query.args(), durationMs, TARGET));
        } catch (RuntimeException e) {
            LOGGER.warn("Query event listener failed", e);
        }
    }

    private class Evaluator implements PlanNodeVisitor<Object> {
        private final Queryable queryable;
        private final Scope scope;
        private final InterpreterTransactionManager transactions;

        Evaluator(Queryable queryable, Scope scope, InterpreterTransactionManager transactions) {
            this.queryable = queryable;
            this.scope = scope;
            this.transactions = transactions;
        }

        private Object resolve(Object param) {
            if (!(param instanceof Placeholder placeholder)) {
                return param;
            }
            if (scope.contains(placeholder.name())) {
                return scope.get(placeholder.name());
            }
            if (placeholderValues.contains(placeholder.name())) {
                return placeholderValues.get(placeholder.name());
            }
            throw new InterpreterException("Missing value for query variable: " + placeholder.name());
        }

        private SqlQuery render(SqlTemplate template) {
            List<Object> args = new ArrayList<>(template.params().size());
            for (Object param : template.params()) {
                args.add(resolve(param));
            }
            return new SqlQuery(template.sql(), args);
        }

        private List<Object> evaluateAll(List<PlanNode> nodes) {
            List<Object> results = new ArrayList<>(nodes.size());
            for (PlanNode node : nodes) {
                results.add(node.accept(this));
            }
            return results;
        }

        @Override
        public Object visitValue(ValueNode node) {
            return node.value();
        }

        @Override
        public Object visitGet(GetNode node) {
            if (!scope.contains(node.name())) {
                throw new InterpreterException("Variable is not bound: " + node.name());
            }
            return scope.get(node.name());
        }

        @Override
        public Object visitLet(LetNode node) {
            Evaluator current = this;
            for (Binding binding : node.bindings()) {
                Object value = binding.expr().accept(current);
                current = new Evaluator(queryable, current.scope.bind(binding.name(), value), transactions);
            }
            return node.expr().accept(current);
        }

        @Override
        public Object visitQuery(QueryNode node) {
            SqlQuery query = render(node.template());
            long startedAt = System.currentTimeMillis();
            long startedNanos = System.nanoTime();
            SqlResultSet resultSet;
            try {
                resultSet = queryable.queryRaw(query);
            } finally {
                emit(query, startedAt, startedNanos);
            }
            return resultSet.toRecords();
        }

        @Override
        public Object visitExecute(ExecuteNode node) {
            SqlQuery query = render(node.template());
            long startedAt = System.currentTimeMillis();
            long startedNanos = System.nanoTime();
            try {
                return queryable.executeRaw(query);
            } finally {
                emit(query, startedAt, startedNanos);
            }
        }

        @Override
        public Object visitConcat(ConcatNode node) {
            List<Object> result = new ArrayList<>();
            for (Object value : evaluateAll(node.nodes())) {
                if (value instanceof List<?> list) {
                    result.addAll(list);
                } else if (value != null) {
                    result.add(value);
                }
            }
            return result;
        }

        @Override
        public Object visitSum(SumNode node) {
            return Values.sum(evaluateAll(node.nodes()));
        }

        @Override
        public Object visitMap(MapNode node) {
            Object value = node.expr().accept(this);
            if (value == null) {
                return null;
            }
            if (value instanceof Map<?, ?>) {
                return project(Values.asRecords(value, "map").get(0), node.fields());
            }
            List<Map<String, Object>> records = Values.asRecords(value, "map");
            List<Object> result = new ArrayList<>(records.size());
            for (Map<String, Object> record : records) {
                result.add(project(record, node.fields()));
            }
            return result;
        }

        private Map<String, Object> project(Map<String, Object> record, List<FieldMapping> fields) {
            Map<String, Object> projected = new LinkedHashMap<>();
            for (FieldMapping mapping : fields) {
                projected.put(mapping.target(), record.get(mapping.source()));
            }
            return projected;
        }

        @Override
        public Object visitIf(IfNode node) {
            Object value = node.value().accept(this);
            boolean taken = switch (node.rule()) {
                case NOT_EMPTY -> !Values.isEmpty(value);
                case EMPTY -> Values.isEmpty(value);
                case TRUTHY -> Values.isTruthy(value);
                case FALSY -> !Values.isTruthy(value);
            };
            return taken ? node.then().accept(this) : node.otherwise().accept(this);
        }

        @Override
        public Object visitUnique(UniqueNode node) {
            Object value = node.expr().accept(this);
            if (!(value instanceof List<?> list)) {
                return value;
            }
            if (list.size() > 1) {
                throw new AmbiguousResultException(list.size());
            }
            return list.isEmpty() ? null : list.get(0);
        }

        @Override
        public Object visitRequired(RequiredNode node) {
            Object value = node.expr().accept(this);
            if (Values.isEmpty(value)) {
                throw new RecordNotFoundException();
            }
            return value;
        }

        @Override
        public Object visitJoin(JoinNode node) {
            Object parent = node.parent().accept(this);
            for (JoinExpression expression : node.children()) {
                Object children = expression.child().accept(this);
                parent = Joins.attach(parent, expression, children);
            }
            return parent;
        }

        @Override
        public Object visitSeq(SeqNode node) {
            Object last = null;
            for (PlanNode item : node.nodes()) {
                last = item.accept(this);
            }
            return last;
        }

        @Override
        public Object visitTransaction(TransactionNode node) {
            if (!transactions.isEnabled()) {
                return node.body().accept(this);
            }
            TransactionManager manager = transactions.getManager();
            TransactionInfo info = manager.startTransaction(manager.getDefaultOptions());
            Object result;
            try {
                Queryable transaction = manager.getTransaction(info.getId(), "query");
                result = node.body().accept(new Evaluator(transaction, scope, InterpreterTransactionManager.disabled()));
            } catch (RuntimeException e) {
                try {
                    manager.rollbackTransaction(info.getId());
                } catch (RuntimeException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
                throw e;
            }
            manager.commitTransaction(info.getId());
            return result;
        }
    }
}
