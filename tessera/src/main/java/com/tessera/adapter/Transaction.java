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
 * A native transaction opened by a driver adapter. It pins one physical connection until
 * {@link #commit()} or {@link #rollback()} returns, at which point the connection is released.
 */
public interface Transaction extends Queryable {

    /**
     * Commits the transaction and releases its connection.
     */
    void commit();

    /**
     * Rolls the transaction back and releases its connection.
     */
    void rollback();
}
