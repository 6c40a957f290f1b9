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

package com.tessera.transaction;

import java.util.Map;

public class TransactionAlreadyClosedException extends TransactionClosedException {
    private final TransactionStatus status;

    public TransactionAlreadyClosedException(String transactionId, String operation, TransactionStatus status) {
        super(transactionId,
                String.format("Transaction already closed: a %s cannot be executed on a %s transaction.",
                        operation, status.name().toLowerCase().replace('_', ' ')),
                Map.of("transactionId", transactionId, "status", status.name()));
        this.status = status;
    }

    public TransactionStatus getStatus() {
        return status;
    }
}
