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

import com.tessera.BaseTest;
import com.tessera.adapter.Provider;
import com.tessera.adapter.RecordingDriverAdapter;
import com.tessera.errors.InitializationException;
import com.tessera.transaction.IsolationLevel;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest extends BaseTest {
    private final RecordingDriverAdapter adapter = new RecordingDriverAdapter(Provider.POSTGRES);

    @Test
    void test_from_config() {
        EngineConfig config = EngineConfig.fromConfig(loadConfig("test.conf"), adapter.factory(), null, null);

        assertTrue(config.isLogQueries());
        assertEquals(2, config.getMaxConcurrentTransactions());
        assertEquals(10, config.getClosedHistorySize());
        assertEquals(Duration.ofMillis(200), config.getTransactionOptions().getMaxWait());
        assertEquals(Duration.ofSeconds(1), config.getTransactionOptions().getTimeout());
        assertNull(config.getTransactionOptions().getIsolationLevel());
        assertNull(config.getReplicaFactory());
    }

    @Test
    void test_default_isolation_level() {
        EngineConfig config = EngineConfig.fromConfig(
                loadConfig("test.conf", "tessera.transactions.isolation_level", "ReadCommitted"), adapter.factory(), null, null);
        assertEquals(IsolationLevel.READ_COMMITTED, config.getTransactionOptions().getIsolationLevel());
    }

    @Test
    void when_values_are_invalid_then_initialization_error() {
        assertThrows(InitializationException.class, () -> EngineConfig.fromConfig(
                loadConfig("test.conf", "tessera.transactions.max_concurrent", 0), adapter.factory(), null, null));
        assertThrows(InitializationException.class, () -> EngineConfig.fromConfig(
                loadConfig("test.conf", "tessera.transactions.isolation_level", "Chaos"), adapter.factory(), null, null));
        assertThrows(InitializationException.class, () -> EngineConfig.fromConfig(
                loadConfig("test.conf", "tessera.transactions.timeout", "0s"), adapter.factory(), null, null));
        assertThrows(InitializationException.class, () -> EngineConfig.fromConfig(
                loadConfig("test.conf", "tessera.transactions.max_wait", "soon"), adapter.factory(), null, null));
    }

    @Test
    void when_factory_is_missing_or_providers_differ_then_initialization_error() {
        assertThrows(InitializationException.class, () -> EngineConfig.fromConfig(loadConfig("test.conf"), null, null, null));
        RecordingDriverAdapter mysql = new RecordingDriverAdapter(Provider.MYSQL);
        assertThrows(InitializationException.class, () -> EngineConfig.fromConfig(loadConfig("test.conf"), adapter.factory(), mysql.factory(), null));
    }
}
