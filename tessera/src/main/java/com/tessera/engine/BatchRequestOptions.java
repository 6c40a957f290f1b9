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

package com.tessera.engine;

import com.tessera.plan.PlaceholderValues;
import com.tessera.transaction.IsolationLevel;

import java.util.Map;

/**
 * Options of {@link QueryEngine#requestBatch}. A batch runs either in a caller's interactive
 * transaction or in an implicit one, optionally with its own isolation level.
 */
public final class BatchRequestOptions {
    private static final BatchRequestOptions DEFAULT = builder().build();
    private final PlaceholderValues placeholders;
    private final String interactiveTransaction;
    private final IsolationLevel isolationLevel;

    private BatchRequestOptions(Builder builder) {
        if (builder.interactiveTransaction != null && builder.isolationLevel != null) {
            throw new IllegalArgumentException("isolation level cannot be set for a batch in an interactive transaction");
        }
        this.placeholders = builder.placeholders;
        this.interactiveTransaction = builder.interactiveTransaction;
        this.isolationLevel = builder.isolationLevel;
    }

    public static BatchRequestOptions defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public PlaceholderValues getPlaceholders() {
        return placeholders;
    }

    public String getInteractiveTransaction() {
        return interactiveTransaction;
    }

    /**
     * Returns the isolation level overriding the engine default, or null.
     */
    public IsolationLevel getIsolationLevel() {
        return isolationLevel;
    }

    public static final class Builder {
        private PlaceholderValues placeholders = PlaceholderValues.empty();
        private String interactiveTransaction;
        private IsolationLevel isolationLevel;

        private Builder() {
        }

        public Builder placeholders(PlaceholderValues placeholders) {
            this.placeholders = placeholders;
            return this;
        }

        public Builder placeholders(Map<String, Object> placeholders) {
            this.placeholders = PlaceholderValues.of(placeholders);
            return this;
        }

        public Builder interactiveTransaction(String interactiveTransaction) {
            this.interactiveTransaction = interactiveTransaction;
            return this;
        }

        public Builder isolationLevel(IsolationLevel isolationLevel) {
            this.isolationLevel = isolationLevel;
            return this;
        }

        public BatchRequestOptions build() {
            return new BatchRequestOptions(this);
        }
    }
}
