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

package com.tessera.errors;

import com.tessera.common.ErrorCode;
import com.tessera.common.TesseraException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A domain-classified request failure. Carries a stable machine-readable code and optional metadata.
 */
public class KnownRequestException extends TesseraException {
    private final Map<String, Object> meta;

    public KnownRequestException(ErrorCode code, String message) {
        this(code.getCode(), message, Collections.emptyMap(), null);
    }

    public KnownRequestException(ErrorCode code, String message, Map<String, Object> meta) {
        this(code.getCode(), message, meta, null);
    }

    public KnownRequestException(String code, String message, Map<String, Object> meta, Throwable cause) {
        super(code, message, cause);
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        // Metadata values can legitimately be null, ImmutableMap would reject them.
        this.meta = meta == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    public Map<String, Object> getMeta() {
        return meta;
    }
}
