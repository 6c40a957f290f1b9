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

import com.tessera.adapter.DriverAdapterException;
import com.tessera.adapter.DriverErrorKind;
import com.tessera.adapter.SqlQuery;
import com.tessera.adapter.SqlResultSet;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Statement execution and error classification shared by the JDBC adapter and its transactions.
 */
final class JdbcSupport {
    private static final Map<String, Integer> ISOLATION_LEVELS = Map.of(
            "READ UNCOMMITTED", Connection.TRANSACTION_READ_UNCOMMITTED,
            "READ COMMITTED", Connection.TRANSACTION_READ_COMMITTED,
            "REPEATABLE READ", Connection.TRANSACTION_REPEATABLE_READ,
            "SERIALIZABLE", Connection.TRANSACTION_SERIALIZABLE,
            // SQL Server's driver-specific constant.
            "SNAPSHOT", 4096
    );

    private JdbcSupport() {
    }

    static int isolationLevel(String nativeName) {
        Integer level = ISOLATION_LEVELS.get(nativeName);
        if (level == null) {
            throw new DriverAdapterException(DriverErrorKind.GENERIC, "Unknown isolation level: " + nativeName);
        }
        return level;
    }

    static SqlResultSet query(Connection connection, SqlQuery query) throws SQLException {
        try (PreparedStatement statement = prepare(connection, query);
             ResultSet resultSet = statement.executeQuery()) {
            ResultSetMetaData metaData = resultSet.getMetaData();
            int columnCount = metaData.getColumnCount();
            List<String> columnNames = new ArrayList<>(columnCount);
            for (int column = 1; column <= columnCount; column++) {
                columnNames.add(metaData.getColumnLabel(column));
            }
            List<List<Object>> rows = new ArrayList<>();
            while (resultSet.next()) {
                List<Object> row = new ArrayList<>(columnCount);
                for (int column = 1; column <= columnCount; column++) {
                    row.add(resultSet.getObject(column));
                }
                rows.add(row);
            }
            return new SqlResultSet(columnNames, rows);
        }
    }

    static long execute(Connection connection, SqlQuery query) throws SQLException {
        try (PreparedStatement statement = prepare(connection, query)) {
            return statement.executeUpdate();
        }
    }

    private static PreparedStatement prepare(Connection connection, SqlQuery query) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(query.sql());
        try {
            List<Object> args = query.args();
            for (int index = 0; index < args.size(); index++) {
                statement.setObject(index + 1, args.get(index));
            }
            return statement;
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
    }

    /**
     * Classifies a JDBC failure by its exception type and SQL state.
     *
     * @param e the failure
     * @return the driver error
     */
    static DriverAdapterException translate(SQLException e) {
        return new DriverAdapterException(kindOf(e), e.getMessage(), e.getSQLState(), e.getMessage(), e);
    }

    static DriverErrorKind kindOf(SQLException e) {
        if (e instanceof SQLTimeoutException) {
            return DriverErrorKind.SOCKET_TIMEOUT;
        }
        if (e instanceof SQLNonTransientConnectionException || e instanceof SQLRecoverableException) {
            return DriverErrorKind.CONNECTION_CLOSED;
        }
        String state = e.getSQLState();
        if (state == null) {
            return DriverErrorKind.GENERIC;
        }
        switch (state) {
            case "23505":
                return DriverErrorKind.UNIQUE_CONSTRAINT_VIOLATION;
            case "23503":
                return DriverErrorKind.FOREIGN_KEY_CONSTRAINT_VIOLATION;
            case "23502":
                return DriverErrorKind.NULL_CONSTRAINT_VIOLATION;
            case "42P01":
            case "42S02":
                return DriverErrorKind.TABLE_DOES_NOT_EXIST;
            case "42703":
            case "42S22":
                return DriverErrorKind.COLUMN_NOT_FOUND;
            case "40001":
            case "40P01":
                return DriverErrorKind.TRANSACTION_WRITE_CONFLICT;
            case "08001":
            case "08004":
                return DriverErrorKind.DATABASE_NOT_REACHABLE;
            default:
                break;
        }
        if (state.startsWith("08")) {
            return DriverErrorKind.CONNECTION_CLOSED;
        }
        // MySQL reports every integrity violation as 23000.
        if (state.equals("23000")) {
            return switch (e.getErrorCode()) {
                case 1062 -> DriverErrorKind.UNIQUE_CONSTRAINT_VIOLATION;
                case 1451, 1452 -> DriverErrorKind.FOREIGN_KEY_CONSTRAINT_VIOLATION;
                case 1048 -> DriverErrorKind.NULL_CONSTRAINT_VIOLATION;
                default -> DriverErrorKind.GENERIC;
            };
        }
        return DriverErrorKind.GENERIC;
    }
}
