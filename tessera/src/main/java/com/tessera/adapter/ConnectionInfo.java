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

package com.tessera.adapter;

import javax.annotation.Nonnull;

/**
 * Connection metadata reported by a driver adapter.
 *
 * @param provider              the database provider behind the connection
 * @param schemaName            the default schema, may be null
 * @param maxBindValues         the maximum number of bind values per statement, may be null when unlimited
 * @param supportsRelationJoins true if the provider can resolve relations with SQL joins
 */
public record ConnectionInfo(@Nonnull Provider provider, String schemaName, Integer maxBindValues,
                             boolean supportsRelationJoins) {

    public static ConnectionInfo of(Provider provider) {
        return new ConnectionInfo(provider, null, null, false);
    }
}
