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

/**
 * TesseraException is the root of every runtime failure raised by Tessera.
 * <p>
 * An exception may carry a stable, machine-readable error code. Callers are expected to
 * branch on {@link #getCode()} rather than on the message text.
 */
public class TesseraException extends RuntimeException {
    private final String code;

    public TesseraException() {
        super();
        this.code = null;
    }

    public TesseraException(String message) {
        super(message);
        this.code = null;
    }

    public TesseraException(Throwable cause) {
        super(cause);
        this.code = null;
    }

    public TesseraException(String message, Throwable cause) {
        super(message, cause);
        this.code = null;
    }

    public TesseraException(ErrorCode code, String message) {
        super(message);
        this.code = code.getCode();
    }

    public TesseraException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code.getCode();
    }

    protected TesseraException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Returns the stable error code, or null if this failure has not been classified.
     *
     * @return the error code or null
     */
    public String getCode() {
        return code;
    }

    public boolean hasCode() {
        return code != null;
    }
}
