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

import java.util.Map;

public class RecordNotFoundException extends KnownRequestException {
    public RecordNotFoundException() {
        super(ErrorCode.RECORD_NOT_FOUND, ErrorCode.RECORD_NOT_FOUND.getDescription());
    }

    public RecordNotFoundException(String message, Map<String, Object> meta) {
        super(ErrorCode.RECORD_NOT_FOUND, message, meta);
    }
}
