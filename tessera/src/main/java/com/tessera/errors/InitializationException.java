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

/**
 * Raised for a bad configuration or a missing collaborator. Fatal at startup.
 */
public class InitializationException extends TesseraException {
    public InitializationException(String message) {
        super(ErrorCode.ENGINE_INITIALIZATION, message);
    }

    public InitializationException(String message, Throwable cause) {
        super(ErrorCode.ENGINE_INITIALIZATION, message, cause);
    }

    public InitializationException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
