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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Driver adapter over a JDBC {@link DataSource}. Autocommit statements borrow a connection for the
 * duration of one statement; pooling is left to the data source.
 */
public class JdbcDriverAdapter implements SqlDriverAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcDriverAdapter.class);
    private final DataSource dataSource;
    private final ConnectionInfo connectionInfo;
    private volatile boolean disposed;

    JdbcDriverAdapter(DataSource dataSource, ConnectionInfo connectionInfo) {
        this.dataSource = dataSource;
        this.connectionInfo = connectionInfo;
    }

    @Override
    public Provider getProvider() {
        return connectionInfo.provider();
    }

    private Connection acquire() throws SQLException {
        if (disposed) {
            throw new DriverAdapterException(DriverErrorKind.CONNECTION_CLOSED, "Driver adapter has been disposed");
        }
        return dataSource.getConnection();
    }

    @Override
    public SqlResultSet queryRaw(SqlQuery query) {
        try (Connection connection = acquire()) {
            return JdbcSupport.query(connection, query);
        } catch (SQLException e) {
            throw JdbcSupport.translate(e);
        }
    }

    @Override
    public long executeRaw(SqlQuery query) {
        try (Connection connection = acquire()) {
            return JdbcSupport.execute(connection, query);
        } catch (SQLException e) {
            throw JdbcSupport.translate(e);
        }
    }

    @Override
    public Transaction startTransaction(String isolationLevel) {
        Connection connection;
        try {
            connection = acquire();
        } catch (SQLException e) {
            throw JdbcSupport.translate(e);
        }
        try {
            int previousIsolation = connection.getTransactionIsolation();
            if (isolationLevel != null) {
                connection.setTransactionIsolation(JdbcSupport.isolationLevel(isolationLevel));
            }
            connection.setAutoCommit(false);
            return new JdbcTransaction(getProvider(), connection, previousIsolation);
        } catch (SQLException | RuntimeException e) {
            try {
                connection.close();
            } catch (SQLException closeError) {
                e.addSuppressed(closeError);
            }
            if (e instanceof SQLException sqlException) {
                throw JdbcSupport.translate(sqlException);
            }
            throw (RuntimeException) e;
        }
    }

    @Override
    public ConnectionInfo getConnectionInfo() {
        return connectionInfo;
    }

    @Override
    public void dispose() {
        disposed = true;
        LOGGER.debug("Disposed {} JDBC adapter", getProvider().getId());
    }
}
