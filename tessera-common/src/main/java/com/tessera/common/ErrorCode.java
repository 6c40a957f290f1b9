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

package com.tessera.common;

import java.util.HashMap;
import java.util.Map;

/**
 * Stable error codes exposed to callers for programmatic handling.
 */
public enum ErrorCode {
    UNIQUE_CONSTRAINT_VIOLATION("P2002", "Unique constraint failed"),
    FOREIGN_KEY_CONSTRAINT_VIOLATION("P2003", "Foreign key constraint failed"),
    NULL_CONSTRAINT_VIOLATION("P2011", "Null constraint violation"),
    TABLE_DOES_NOT_EXIST("P2021", "The table does not exist in the current database"),
    COLUMN_DOES_NOT_EXIST("P2022", "The column does not exist in the current database"),
    INCONSISTENT_COLUMN_DATA("P2023", "Inconsistent column data"),
    RECORD_NOT_FOUND("P2025", "An operation failed because it depends on one or more records that were required but not found"),
    UNSUPPORTED_FEATURE("P2026", "The current database provider doesn't support a feature that the query used"),
    TRANSACTION_API_ERROR("P2028", "Transaction API error"),
    TRANSACTION_WRITE_CONFLICT("P2034", "Transaction failed due to a write conflict or a deadlock"),
    ENGINE_INITIALIZATION("P2038", "Query engine could not be initialized"),
    AMBIGUOUS_RESULT("P2041", "Expected at most one record but the query returned more");

    private static final Map<String, ErrorCode> BY_CODE = new HashMap<>();

    static {
        for (ErrorCode errorCode : values()) {
            BY_CODE.put(errorCode.code, errorCode);
        }
    }

    private final String code;
    private final String description;

    ErrorCode(String code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * Finds the ErrorCode registered for the given machine code.
     *
     * @param code the machine code, e.g. "P2025"
     * @return the matching ErrorCode or null
     */
    public static ErrorCode of(String code) {
        return BY_CODE.get(code);
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
