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
 * A connected driver adapter. Statements sent through the adapter itself run in autocommit mode.
 */
public interface SqlDriverAdapter extends Queryable {

    /**
     * Acquires a physical connection and begins a transaction on it.
     *
     * @param isolationLevel the isolation level in the provider's native vocabulary
     *                       (e.g. "READ COMMITTED"), or null for the provider default
     * @return the native transaction handle
     * @throws DriverAdapterException if the connection cannot be acquired or the begin fails
     */
    Transaction startTransaction(String isolationLevel);

    /**
     * Returns metadata about the connection.
     *
     * @return the connection info
     */
    ConnectionInfo getConnectionInfo();

    /**
     * Releases every resource held by the adapter.
     */
    void dispose();
}
