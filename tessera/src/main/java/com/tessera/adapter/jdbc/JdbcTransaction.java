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

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A transaction pinned to one JDBC connection. The connection goes back to its
 * {@link javax.sql.DataSource} when the transaction is committed or rolled back, with the
 * autocommit mode and isolation level it was borrowed with.
 */
class JdbcTransaction implements Transaction {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcTransaction.class);
    private final Provider provider;
    private final Connection connection;
    private final int previousIsolation;
    private volatile boolean closed;

    JdbcTransaction(Provider provider, Connection connection, int previousIsolation) {
        this.provider = provider;
        this.connection = connection;
        this.previousIsolation = previousIsolation;
    }

    @Override
    public Provider getProvider() {
        return provider;
    }

    private void ensureOpen() {
        if (closed) {
            throw new DriverAdapterException(DriverErrorKind.CONNECTION_CLOSED, "Transaction connection is closed");
        }
    }

    @Override
    public SqlResultSet queryRaw(SqlQuery query) {
        ensureOpen();
        try {
            return JdbcSupport.query(connection, query);
        } catch (SQLException e) {
            throw JdbcSupport.translate(e);
        }
    }

    @Override
    public long executeRaw(SqlQuery query) {
        ensureOpen();
        try {
            return JdbcSupport.execute(connection, query);
        } catch (SQLException e) {
            throw JdbcSupport.translate(e);
        }
    }

    @Override
    public void commit() {
        ensureOpen();
        try {
            connection.commit();
        } catch (SQLException e) {
            throw JdbcSupport.translate(e);
        } finally {
            close();
        }
    }

    @Override
    public void rollback() {
        ensureOpen();
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw JdbcSupport.translate(e);
        } finally {
            close();
        }
    }

    private void close() {
        closed = true;
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            LOGGER.warn("Unable to restore autocommit before releasing connection", e);
        }
        try {
            if (connection.getTransactionIsolation() != previousIsolation) {
                connection.setTransactionIsolation(previousIsolation);
            }
        } catch (SQLException e) {
            LOGGER.warn("Unable to restore isolation level before releasing connection", e);
        }
        try {
            connection.close();
        } catch (SQLException e) {
            LOGGER.warn("Unable to close connection", e);
        }
    }
}
