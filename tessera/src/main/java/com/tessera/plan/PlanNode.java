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
 * PlanNode is a node of a compiled query plan. A plan is an acyclic, rooted tree produced by an
 * external planner and evaluated exactly once per execution.
 * <p>
 * The set of node kinds is closed. Consumers dispatch with {@link PlanNodeVisitor}, so adding a
 * kind without handling it everywhere fails to compile.
 */
public sealed interface PlanNode permits ValueNode, GetNode, LetNode, QueryNode, ExecuteNode, ConcatNode, SumNode,
        MapNode, IfNode, UniqueNode, RequiredNode, JoinNode, SeqNode, TransactionNode {

    <R> R accept(PlanNodeVisitor<R> visitor);
}
