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

import java.util.Map;

/**
 * Isolation levels a client can request, in the client's vocabulary.
 */
public enum IsolationLevel {
    READ_UNCOMMITTED("ReadUncommitted", "READ UNCOMMITTED"),
    READ_COMMITTED("ReadCommitted", "READ COMMITTED"),
    REPEATABLE_READ("RepeatableRead", "REPEATABLE READ"),
    SERIALIZABLE("Serializable", "SERIALIZABLE"),
    SNAPSHOT("Snapshot", "SNAPSHOT");

    private final String clientName;
    private final String nativeName;

    IsolationLevel(String clientName, String nativeName) {
        this.clientName = clientName;
        this.nativeName = nativeName;
    }

    /**
     * Parses a client isolation level name. Matching is case-sensitive.
     *
     * @param value the name, e.g. {@code ReadCommitted}
     * @return the isolation level
     * @throws KnownRequestException with code P2023 if the value is not a known level
     */
    public static IsolationLevel parse(String value) {
        for (IsolationLevel level : values()) {
            if (level.clientName.equals(value)) {
                return level;
            }
        }
        throw new KnownRequestException(
                ErrorCode.INCONSISTENT_COLUMN_DATA,
                "Invalid isolation level: " + value,
                Map.of("providedIsolationLevel", String.valueOf(value))
        );
    }

    public String getClientName() {
        return clientName;
    }

    /**
     * Returns the SQL spelling of the level, e.g. {@code READ COMMITTED}.
     */
    public String getNativeName() {
        return nativeName;
    }
}
