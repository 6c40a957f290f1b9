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

package com.tessera.interpreter;

import com.tessera.common.TesseraException;

/**
 * Raised when a plan cannot be evaluated because it is malformed, e.g. a node receives a value
 * of a shape it cannot consume or a variable is not bound.
 */
public class InterpreterException extends TesseraException {
    public InterpreterException(String message) {
        super(message);
    }
}
