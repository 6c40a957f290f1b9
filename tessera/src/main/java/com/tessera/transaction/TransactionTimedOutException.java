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

import java.time.Duration;
import java.util.Map;

public class TransactionTimedOutException extends TransactionClosedException {
    public TransactionTimedOutException(String transactionId, String operation, Duration timeout, Duration elapsed) {
        super(transactionId,
                String.format("Transaction already closed: a %s cannot be executed on an expired transaction. "
                                + "The timeout for this transaction was %d ms, however %d ms passed since its start.",
                        operation, timeout.toMillis(), elapsed.toMillis()),
                Map.of("transactionId", transactionId, "timeoutMs", timeout.toMillis(), "elapsedMs", elapsed.toMillis()));
    }
}
