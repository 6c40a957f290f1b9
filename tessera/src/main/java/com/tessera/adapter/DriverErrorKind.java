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

import com.tessera.common.ErrorCode;

/**
 * Classes of failures a driver adapter reports.
 */
public enum DriverErrorKind {
    UNIQUE_CONSTRAINT_VIOLATION(ErrorCode.UNIQUE_CONSTRAINT_VIOLATION, false),
    FOREIGN_KEY_CONSTRAINT_VIOLATION(ErrorCode.FOREIGN_KEY_CONSTRAINT_VIOLATION, false),
    NULL_CONSTRAINT_VIOLATION(ErrorCode.NULL_CONSTRAINT_VIOLATION, false),
    TABLE_DOES_NOT_EXIST(ErrorCode.TABLE_DOES_NOT_EXIST, false),
    COLUMN_NOT_FOUND(ErrorCode.COLUMN_DOES_NOT_EXIST, false),
    TRANSACTION_WRITE_CONFLICT(ErrorCode.TRANSACTION_WRITE_CONFLICT, false),
    CONNECTION_CLOSED(null, true),
    SOCKET_TIMEOUT(null, true),
    DATABASE_NOT_REACHABLE(null, true),
    GENERIC(null, false);

    private final ErrorCode errorCode;
    private final boolean infrastructure;

    DriverErrorKind(ErrorCode errorCode, boolean infrastructure) {
        this.errorCode = errorCode;
        this.infrastructure = infrastructure;
    }

    /**
     * Returns the stable code for this kind, or null if the kind has no user-facing classification.
     *
     * @return the error code or null
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Infrastructure failures mean the connection itself is gone or unusable.
     *
     * @return true for connection-level failures
     */
    public boolean isInfrastructure() {
        return infrastructure;
    }
}
