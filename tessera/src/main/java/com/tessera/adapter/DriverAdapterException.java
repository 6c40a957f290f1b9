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

import com.tessera.common.TesseraException;

/**
 * Raised by driver adapters. The original driver code and message are kept for diagnostics.
 */
public class DriverAdapterException extends TesseraException {
    private final DriverErrorKind kind;
    private final String originalCode;
    private final String originalMessage;

    public DriverAdapterException(DriverErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    public DriverAdapterException(DriverErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, null, cause);
    }

    public DriverAdapterException(DriverErrorKind kind, String message, String originalCode, String originalMessage, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.originalCode = originalCode;
        this.originalMessage = originalMessage;
    }

    public DriverErrorKind getKind() {
        return kind;
    }

    public String getOriginalCode() {
        return originalCode;
    }

    public String getOriginalMessage() {
        return originalMessage;
    }

    public boolean isInfrastructure() {
        return kind.isInfrastructure();
    }
}
