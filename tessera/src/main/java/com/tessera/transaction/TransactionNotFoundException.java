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

public class TransactionNotFoundException extends TransactionClosedException {
    public TransactionNotFoundException(String transactionId, String operation) {
        super(transactionId,
                String.format("Transaction not found: a %s was requested on transaction %s. The id is invalid, "
                        + "refers to a transaction closed long ago, or was obtained before disconnecting.", operation, transactionId),
                transactionId == null ? Map.of() : Map.of("transactionId", transactionId));
    }
}
