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

import com.tessera.transaction.TransactionManager;

import javax.annotation.Nonnull;

/**
 * Tells the interpreter whether it may open transactions of its own. It is disabled when the
 * execution already runs inside a transaction, transactions are never nested.
 */
public final class InterpreterTransactionManager {
    private static final InterpreterTransactionManager DISABLED = new InterpreterTransactionManager(null);
    private final TransactionManager manager;

    private InterpreterTransactionManager(TransactionManager manager) {
        this.manager = manager;
    }

    public static InterpreterTransactionManager disabled() {
        return DISABLED;
    }

    public static InterpreterTransactionManager enabled(@Nonnull TransactionManager manager) {
        return new InterpreterTransactionManager(manager);
    }

    public boolean isEnabled() {
        return manager != null;
    }

    public TransactionManager getManager() {
        if (manager == null) {
            throw new IllegalStateException("transaction manager is disabled");
        }
        return manager;
    }
}
