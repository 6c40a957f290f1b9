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

import com.typesafe.config.Config;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * The Context interface represents the shared runtime state of a Tessera process.
 */
public interface Context {

    /**
     * Retrieves the configuration associated with the Context.
     *
     * @return the configuration associated with the Context.
     */
    Config getConfig();

    /**
     * Returns the bounded executor that runs inbound requests.
     *
     * @return the request executor
     */
    ExecutorService getRequestExecutor();

    /**
     * Returns the scheduler used for timers such as transaction watchdogs.
     *
     * @return the scheduled executor
     */
    ScheduledExecutorService getScheduler();

    /**
     * Registers a Tessera service in the context.
     *
     * @param id      the unique identifier for the service
     * @param service the Tessera service to register
     */
    void registerService(String id, TesseraService service);

    /**
     * Retrieves a Tessera service from the context using the specified service identifier.
     *
     * @param id  the unique identifier for the service
     * @param <T> the type of the service to retrieve
     * @return the Tessera service with the specified identifier
     */
    <T> T getService(@Nonnull String id);

    /**
     * Retrieves the list of Tessera services registered in the context.
     *
     * @return the list of Tessera services
     */
    List<TesseraService> getServices();

    /**
     * Shuts down every registered service in reverse registration order, then stops the executors.
     */
    void shutdown();
}
