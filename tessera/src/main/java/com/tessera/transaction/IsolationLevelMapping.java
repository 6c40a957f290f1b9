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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import com.tessera.adapter.Provider;
import com.tessera.errors.OperationNotSupportedException;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Maps client isolation levels to provider-native ones.
 */
public final class IsolationLevelMapping {
    private static final Map<Provider, Set<IsolationLevel>> SUPPORTED = ImmutableMap.<Provider, Set<IsolationLevel>>builder()
            .put(Provider.POSTGRES, Sets.immutableEnumSet(EnumSet.range(IsolationLevel.READ_UNCOMMITTED, IsolationLevel.SERIALIZABLE)))
            .put(Provider.MYSQL, Sets.immutableEnumSet(EnumSet.range(IsolationLevel.READ_UNCOMMITTED, IsolationLevel.SERIALIZABLE)))
            .put(Provider.COCKROACHDB, Sets.immutableEnumSet(IsolationLevel.READ_COMMITTED, IsolationLevel.SERIALIZABLE))
            .put(Provider.SQLITE, Sets.immutableEnumSet(IsolationLevel.SERIALIZABLE))
            .put(Provider.SQLSERVER, Sets.immutableEnumSet(EnumSet.allOf(IsolationLevel.class)))
            .build();

    private IsolationLevelMapping() {
    }

    public static boolean isSupported(Provider provider, IsolationLevel level) {
        return SUPPORTED.getOrDefault(provider, Set.of()).contains(level);
    }

    /**
     * Returns the native name of the level for the given provider.
     *
     * @param provider the active provider
     * @param level    the requested level, null means the provider default
     * @return the native level name, or null if {@code level} is null
     * @throws OperationNotSupportedException if the provider does not support the level
     */
    public static String toNative(Provider provider, IsolationLevel level) {
        if (level == null) {
            return null;
        }
        if (!isSupported(provider, level)) {
            throw new OperationNotSupportedException(
                    String.format("Isolation level %s is not supported by %s", level.getClientName(), provider.getId()),
                    Map.of("isolationLevel", level.getClientName(), "provider", provider.getId())
            );
        }
        return level.getNativeName();
    }
}
