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

package com.tessera.internal;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.tessera.common.TesseraException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.*;

/**
 * Factory methods for the bounded thread pools used by Tessera.
 * <p>
 * Pools scale from 0 to a maximum number of threads, buffer work in an unbounded
 * {@link LinkedBlockingQueue} once every thread is busy, and let idle threads (core
 * threads included) time out.
 */
public final class TesseraExecutors {
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
    private static final Logger LOGGER = LoggerFactory.getLogger(TesseraExecutors.class);

    private TesseraExecutors() {
    }

    /**
     * Creates a bounded executor service with customizable thread pool parameters.
     *
     * @param maxThreads    the maximum number of threads to allow in the pool. Must be greater than 0.
     * @param keepAliveTime the time limit for which idle threads may remain alive before being terminated.
     * @param timeUnit      the time unit for the {@code keepAliveTime} parameter.
     * @param factory       the factory to use when creating new threads.
     * @return a new bounded {@link ExecutorService}
     * @throws IllegalArgumentException if {@code maxThreads} is less than or equal to 0.
     */
    public static ExecutorService newBoundedExecutor(
            int maxThreads,
            long keepAliveTime,
            TimeUnit timeUnit,
            ThreadFactory factory
    ) {
        // Core size equals max size: with an unbounded queue a ThreadPoolExecutor never grows past its core size.
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                maxThreads,
                maxThreads,
                keepAliveTime,
                timeUnit,
                new LinkedBlockingQueue<>(),
                factory
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * Creates a bounded executor service sized to the number of available processors,
     * with a one minute keep-alive and "tessera-worker-%d" thread names.
     *
     * @return a new bounded {@link ExecutorService} with default configuration.
     */
    public static ExecutorService newBoundedExecutor() {
        long keepAliveTime = 1L;
        int maxThreads = Runtime.getRuntime().availableProcessors();
        ThreadFactory factory = new ThreadFactoryBuilder().setNameFormat("tessera-worker-%d").build();
        return newBoundedExecutor(maxThreads, keepAliveTime, TimeUnit.MINUTES, factory);
    }

    /**
     * Cancels the running tasks of an executor and waits for its threads to finish.
     *
     * @param name     the name of the executor, used in log messages
     * @param executor the executor to stop; null or already terminated executors are ignored
     * @param timeout  how long to wait for termination
     * @return true if the executor terminated within the timeout
     * @throws TesseraException if the waiting thread is interrupted
     */
    public static boolean shutdown(String name, ExecutorService executor, Duration timeout) {
        if (executor == null || executor.isTerminated()) {
            return true;
        }
        executor.shutdownNow();
        try {
            if (executor.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TesseraException("Interrupted while stopping " + name, e);
        }
        LOGGER.warn("{} did not stop within {} ms", name, timeout.toMillis());
        return false;
    }
}
