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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.tessera.errors.InitializationException;
import com.tessera.internal.TesseraExecutors;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.*;

/**
 * The ContextImpl class represents the implementation of the Context interface.
 */
public class ContextImpl implements Context {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContextImpl.class);
    private final Config config;
    private final ExecutorService requestExecutor;
    private final ScheduledExecutorService scheduler;
    private final LinkedHashMap<String, TesseraService> services = new LinkedHashMap<>();

    public ContextImpl(Config config) {
        if (!config.hasPath("tessera")) {
            throw new InitializationException("tessera section is missing in configuration");
        }
        this.config = config;

        int poolSize = config.getInt("tessera.executor.worker_pool_size");
        if (poolSize < 0) {
            throw new InitializationException("tessera.executor.worker_pool_size cannot be negative");
        }
        int workerPoolSize = (poolSize == 0) ? Runtime.getRuntime().availableProcessors() : poolSize;

        ThreadFactory workerFactory = new ThreadFactoryBuilder()
                .setNameFormat("tessera-worker-%d")
                .setDaemon(true)
                .build();
        this.requestExecutor = TesseraExecutors.newBoundedExecutor(workerPoolSize, 1L, TimeUnit.MINUTES, workerFactory);

        ThreadFactory schedulerFactory = new ThreadFactoryBuilder()
                .setNameFormat("tessera-scheduler-%d")
                .setDaemon(true)
                .build();
        ScheduledThreadPoolExecutor scheduledExecutor = new ScheduledThreadPoolExecutor(1, schedulerFactory);
        // Cancelled watchdogs must not linger in the queue until their deadline.
        scheduledExecutor.setRemoveOnCancelPolicy(true);
        this.scheduler = scheduledExecutor;
    }

    @Override
    public Config getConfig() {
        return config;
    }

    @Override
    public ExecutorService getRequestExecutor() {
        return requestExecutor;
    }

    @Override
    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    @Override
    public synchronized void registerService(@Nonnull String id, @Nonnull TesseraService service) {
        // Registration sort is important, this is why we use LinkedHashMap to store services.
        services.putIfAbsent(id, service);
    }

    @SuppressWarnings("unchecked")
    @Override
    public synchronized <T> T getService(@Nonnull String id) {
        return (T) services.get(id);
    }

    @Override
    public synchronized List<TesseraService> getServices() {
        return new ArrayList<>(services.values());
    }

    @Override
    public void shutdown() {
        List<TesseraService> registered = getServices();
        Collections.reverse(registered);
        for (TesseraService service : registered) {
            LOGGER.debug("Shutting down {} service", service.getName());
            try {
                service.shutdown();
            } catch (Exception e) {
                LOGGER.error("Error while shutting down {} service", service.getName(), e);
            }
        }

        TesseraExecutors.shutdown("Scheduler", scheduler, TesseraExecutors.DEFAULT_SHUTDOWN_TIMEOUT);
        TesseraExecutors.shutdown("Request executor", requestExecutor, TesseraExecutors.DEFAULT_SHUTDOWN_TIMEOUT);
    }
}
