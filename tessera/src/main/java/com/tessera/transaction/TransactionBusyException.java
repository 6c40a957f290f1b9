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

/**
 * Raised when a transaction could not be started within its maximum wait time.
 */
public class TransactionBusyException extends TransactionException {
    public TransactionBusyException(Duration maxWait) {
        super(String.format("Unable to start a transaction in the given time. Waited %d ms, "
                        + "consider increasing the maximum wait time or the number of concurrent transactions.",
                maxWait.toMillis()), Map.of("maxWaitMs", maxWait.toMillis()));
    }
}
