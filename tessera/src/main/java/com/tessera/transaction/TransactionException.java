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

import com.tessera.common.ErrorCode;
import com.tessera.errors.KnownRequestException;

import java.util.Collections;
import java.util.Map;

/**
 * Base class of the interactive transaction API errors.
 */
public class TransactionException extends KnownRequestException {
    public TransactionException(String message) {
        this(message, Collections.emptyMap());
    }

    public TransactionException(String message, Map<String, Object> meta) {
        super(ErrorCode.TRANSACTION_API_ERROR, "Transaction API error: " + message, meta);
    }
}
