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

package com.tessera.plan;

/**
 * PlanNodeVisitor defines a visitor over {@link PlanNode} kinds.
 * Each method corresponds to exactly one kind of node.
 *
 * @param <R> The type of the result produced by each visit method.
 */
public interface PlanNodeVisitor<R> {
    R visitValue(ValueNode node);

    R visitGet(GetNode node);

    R visitLet(LetNode node);

    R visitQuery(QueryNode node);

    R visitExecute(ExecuteNode node);

    R visitConcat(ConcatNode node);

    R visitSum(SumNode node);

    R visitMap(MapNode node);

    R visitIf(IfNode node);

    R visitUnique(UniqueNode node);

    R visitRequired(RequiredNode node);

    R visitJoin(JoinNode node);

    R visitSeq(SeqNode node);

    R visitTransaction(TransactionNode node);
}
