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

import com.tessera.adapter.DriverAdapterException;
import com.tessera.common.TesseraException;
import com.tessera.transaction.TransactionException;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Classifies arbitrary failures into the public error taxonomy.
 * <p>
 * Known, unknown, crash, initialization and not-implemented errors pass through unchanged.
 * Driver failures with a stable code and {@link CodedFailure}s become {@link KnownRequestException}s,
 * a "PANIC:" message or a JVM error becomes an {@link EngineCrashException}, and everything else
 * degrades to an {@link UnknownRequestException} that keeps the original as its cause.
 */
public final class ErrorTransformer {
    static final String PANIC_PREFIX = "PANIC:";

    private ErrorTransformer() {
    }

    /**
     * Transforms a request failure.
     *
     * @param error the failure
     * @return the classified exception
     */
    public static TesseraException transform(Throwable error) {
        Throwable cause = unwrap(error);
        if (isClassified(cause)) {
            return (TesseraException) cause;
        }
        String message = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
        if (cause instanceof VirtualMachineError || message.startsWith(PANIC_PREFIX)) {
            return new EngineCrashException(message, cause);
        }
        if (cause instanceof DriverAdapterException driverError && driverError.getKind().getErrorCode() != null) {
            return new KnownRequestException(
                    driverError.getKind().getErrorCode().getCode(),
                    message,
                    driverError.getOriginalCode() == null
                            ? Map.of()
                            : Map.of("originalCode", driverError.getOriginalCode()),
                    driverError
            );
        }
        if (cause instanceof CodedFailure coded) {
            return new KnownRequestException(coded.getCode(), coded.getMessage(), coded.getMeta(), cause);
        }
        return new UnknownRequestException(message, cause);
    }

    /**
     * Transforms a failure raised while the engine starts. Anything that is not already an
     * {@link InitializationException} is wrapped into one.
     *
     * @param error the failure
     * @return the initialization error
     */
    public static InitializationException transformInitError(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof InitializationException initializationError) {
            return initializationError;
        }
        String message = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
        return new InitializationException(message, cause);
    }

    /**
     * Returns true if the failure means the connection or transaction itself is unusable,
     * in which case a batch must be aborted instead of isolating the failing slot.
     *
     * @param error the failure
     * @return true for infrastructure failures
     */
    public static boolean isInfrastructureFailure(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof DriverAdapterException driverError) {
            return driverError.isInfrastructure();
        }
        return cause instanceof TransactionException || transform(cause) instanceof EngineCrashException;
    }

    private static boolean isClassified(Throwable error) {
        return error instanceof KnownRequestException
                || error instanceof UnknownRequestException
                || error instanceof EngineCrashException
                || error instanceof InitializationException
                || error instanceof NotImplementedException;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
