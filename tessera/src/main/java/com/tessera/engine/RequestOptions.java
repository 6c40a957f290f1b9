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

import java.util.Map;

/**
 * Per-request options of {@link QueryEngine#request}.
 */
public final class RequestOptions {
    private static final RequestOptions DEFAULT = builder().build();
    private final PlaceholderValues placeholders;
    private final String interactiveTransaction;
    private final String operation;

    private RequestOptions(Builder builder) {
        this.placeholders = builder.placeholders;
        this.interactiveTransaction = builder.interactiveTransaction;
        this.operation = builder.operation;
    }

    public static RequestOptions defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public PlaceholderValues getPlaceholders() {
        return placeholders;
    }

    /**
     * Returns the id of the interactive transaction the request runs in, or null.
     */
    public String getInteractiveTransaction() {
        return interactiveTransaction;
    }

    /**
     * Returns the client operation name, e.g. {@code findMany}, or null.
     */
    public String getOperation() {
        return operation;
    }

    public static final class Builder {
        private PlaceholderValues placeholders = PlaceholderValues.empty();
        private String interactiveTransaction;
        private String operation;

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

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(this);
        }
    }
}
