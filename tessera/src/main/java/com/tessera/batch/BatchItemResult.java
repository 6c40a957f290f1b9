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

package com.tessera.batch;

import com.tessera.common.TesseraException;

/**
 * The outcome of one request of a batch: either data or a classified error.
 */
public final class BatchItemResult {
    private final Object data;
    private final TesseraException error;

    private BatchItemResult(Object data, TesseraException error) {
        this.data = data;
        this.error = error;
    }

    public static BatchItemResult success(Object data) {
        return new BatchItemResult(data, null);
    }

    public static BatchItemResult failure(TesseraException error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new BatchItemResult(null, error);
    }

    public Object getData() {
        return data;
    }

    public TesseraException getError() {
        return error;
    }

    public boolean isError() {
        return error != null;
    }

    @Override
    public String toString() {
        return isError() ? "BatchItemResult{error=" + error + "}" : "BatchItemResult{data=" + data + "}";
    }
}
