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

import com.typesafe.config.Config;

import java.time.Duration;
import java.util.Objects;

/**
 * Options of a single transaction start.
 */
public final class TransactionOptions {
    private final IsolationLevel isolationLevel;
    private final Duration maxWait;
    private final Duration timeout;

    private TransactionOptions(Builder builder) {
        this.isolationLevel = builder.isolationLevel;
        this.maxWait = Objects.requireNonNull(builder.maxWait, "maxWait");
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
        if (maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait cannot be negative");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the defaults from the {@code tessera.transactions} section.
     *
     * @param config the root configuration
     * @return the default options
     */
    public static TransactionOptions fromConfig(Config config) {
        Config section = config.getConfig("tessera.transactions");
        Builder builder = builder()
                .maxWait(section.getDuration("max_wait"))
                .timeout(section.getDuration("timeout"));
        String isolationLevel = section.getString("isolation_level");
        if (!isolationLevel.isEmpty()) {
            builder.isolationLevel(IsolationLevel.parse(isolationLevel));
        }
        return builder.build();
    }

    /**
     * Returns the isolation level, or null for the provider default.
     */
    public IsolationLevel getIsolationLevel() {
        return isolationLevel;
    }

    public Duration getMaxWait() {
        return maxWait;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Builder toBuilder() {
        return builder().isolationLevel(isolationLevel).maxWait(maxWait).timeout(timeout);
    }

    @Override
    public String toString() {
        return "TransactionOptions{isolationLevel=" + isolationLevel + ", maxWait=" + maxWait + ", timeout=" + timeout + "}";
    }

    public static final class Builder {
        private IsolationLevel isolationLevel;
        private Duration maxWait = Duration.ofSeconds(2);
        private Duration timeout = Duration.ofSeconds(5);

        private Builder() {
        }

        public Builder isolationLevel(IsolationLevel isolationLevel) {
            this.isolationLevel = isolationLevel;
            return this;
        }

        public Builder maxWait(Duration maxWait) {
            this.maxWait = maxWait;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public TransactionOptions build() {
            return new TransactionOptions(this);
        }
    }
}
