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

package com.tessera.adapter.jdbc;

import com.tessera.adapter.*;

import javax.annotation.Nonnull;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Creates {@link JdbcDriverAdapter}s over a {@link DataSource}.
 */
public class JdbcDriverAdapterFactory implements SqlDriverAdapterFactory {
    private final DataSource dataSource;
    private final Provider provider;

    public JdbcDriverAdapterFactory(@Nonnull DataSource dataSource, @Nonnull Provider provider) {
        this.dataSource = dataSource;
        this.provider = provider;
    }

    @Override
    public Provider getProvider() {
        return provider;
    }

    /**
     * Checks that the database is reachable and returns an adapter.
     *
     * @return the connected adapter
     * @throws DriverAdapterException if no connection can be obtained
     */
    @Override
    public SqlDriverAdapter connect() {
        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(5)) {
                throw new DriverAdapterException(DriverErrorKind.DATABASE_NOT_REACHABLE, "Database connection is not valid");
            }
        } catch (SQLException e) {
            throw new DriverAdapterException(DriverErrorKind.DATABASE_NOT_REACHABLE,
                    "Database is not reachable: " + e.getMessage(), e.getSQLState(), e.getMessage(), e);
        }
        return new JdbcDriverAdapter(dataSource, ConnectionInfo.of(provider));
    }
}
