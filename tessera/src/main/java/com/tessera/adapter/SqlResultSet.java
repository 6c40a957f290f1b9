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

import java.util.*;

/**
 * Tabular result returned by {@link Queryable#queryRaw(SqlQuery)}.
 */
public class SqlResultSet {
    private final List<String> columnNames;
    private final List<List<Object>> rows;

    public SqlResultSet(List<String> columnNames, List<List<Object>> rows) {
        this.columnNames = List.copyOf(columnNames);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != columnNames.size()) {
                throw new IllegalArgumentException(
                        String.format("Row has %d values but result set has %d columns", row.size(), columnNames.size())
                );
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    /**
     * Converts the result set to records keyed by column name, preserving the column order.
     *
     * @return a mutable list of mutable records
     */
    public List<Map<String, Object>> toRecords() {
        List<Map<String, Object>> records = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (int index = 0; index < columnNames.size(); index++) {
                record.put(columnNames.get(index), row.get(index));
            }
            records.add(record);
        }
        return records;
    }
}
