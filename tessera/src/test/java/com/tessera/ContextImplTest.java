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

package com.tessera;

import com.tessera.errors.InitializationException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ContextImplTest extends BaseTest {

    @Test
    void test_services_are_shut_down_in_reverse_order() {
        ContextImpl context = new ContextImpl(loadConfig("test.conf"));
        List<String> stopped = new ArrayList<>();
        context.registerService("first", new RecordingService(context, "first", stopped));
        context.registerService("second", new RecordingService(context, "second", stopped));

        RecordingService first = context.getService("first");
        assertEquals("first", first.getName());

        context.shutdown();

        assertEquals(List.of("second", "first"), stopped);
        assertTrue(context.getRequestExecutor().isShutdown());
        assertTrue(context.getScheduler().isShutdown());
    }

    @Test
    void test_failing_service_does_not_stop_shutdown() {
        ContextImpl context = new ContextImpl(loadConfig("test.conf"));
        List<String> stopped = new ArrayList<>();
        context.registerService("ok", new RecordingService(context, "ok", stopped));
        context.registerService("broken", new RecordingService(context, "broken", stopped) {
            @Override
            public void shutdown() {
                throw new IllegalStateException("cannot stop");
            }
        });

        context.shutdown();

        assertEquals(List.of("ok"), stopped);
    }

    @Test
    void test_request_executor_runs_tasks() throws Exception {
        ContextImpl context = new ContextImpl(loadConfig("test.conf"));
        try {
            String name = context.getRequestExecutor().submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
            assertTrue(name.startsWith("tessera-worker-"));
        } finally {
            context.shutdown();
        }
    }

    @Test
    void when_configuration_is_invalid_then_initialization_error() {
        assertThrows(InitializationException.class, () -> new ContextImpl(ConfigFactory.empty()));
        assertThrows(InitializationException.class,
                () -> new ContextImpl(loadConfig("test.conf", "tessera.executor.worker_pool_size", -1)));
    }

    private static class RecordingService implements TesseraService {
        private final Context context;
        private final String name;
        private final List<String> stopped;

        RecordingService(Context context, String name, List<String> stopped) {
            this.context = context;
            this.name = name;
            this.stopped = stopped;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Context getContext() {
            return context;
        }

        @Override
        public void shutdown() {
            stopped.add(name);
        }
    }
}
