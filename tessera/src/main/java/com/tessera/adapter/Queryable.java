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

package com.tessera.adapter;

/**
 * Queryable is the boundary every SQL statement goes through. It is implemented both by autocommit
 * connections and by transaction-bound connections.
 * <p>
 * A Queryable is owned by one logical caller at a time. Implementations bound to a transaction run
 * statements strictly in submission order.
 */
public interface Queryable {

    /**
     * Returns the provider behind this queryable.
     *
     * @return the provider
     */
    Provider getProvider();

    /**
     * Runs a statement that returns rows.
     *
     * @param query the statement and its positional arguments
     * @return the rows produced by the statement
     * @throws DriverAdapterException if the driver reports a failure
     */
    SqlResultSet queryRaw(SqlQuery query);

    /**
     * Runs a statement that modifies data.
     *
     * @param query the statement and its positional arguments
     * @return the number of affected rows
     * @throws DriverAdapterException if the driver reports a failure
     */
    long executeRaw(SqlQuery query);
}
