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

package com.tessera.interpreter;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValuesTest {

    @Test
    void test_normalizeKey() {
        assertEquals(Values.normalizeKey(1), Values.normalizeKey(1L));
        assertEquals(Values.normalizeKey(1), Values.normalizeKey(1.0d));
        assertEquals(Values.normalizeKey(new BigDecimal("1.00")), Values.normalizeKey((short) 1));
        assertEquals(Values.normalizeKey(0), Values.normalizeKey(new BigDecimal("0.000")));
        assertNotEquals(Values.normalizeKey(1), Values.normalizeKey("1"));
        assertEquals("a", Values.normalizeKey('a'));
    }

    @Test
    void test_keysMatch() {
        assertTrue(Values.keysMatch(Map.of("id", 1L, "k", "a"), Map.of("id", 1)));
        assertFalse(Values.keysMatch(Map.of("id", 2L), Map.of("id", 1)));
        assertFalse(Values.keysMatch(Map.of("id", 1L), Map.of("other", 1)));
        assertTrue(Values.keysMatch(Map.of("id", 1L), Map.of("id", "1", "name", "a")));
        assertTrue(Values.keysMatch(Map.of("id", new BigDecimal("12.50")), Map.of("id", "12.5")));
        assertFalse(Values.keysMatch(Map.of("id", 1L), Map.of("id", "1x")));

        Map<String, Object> withNull = new HashMap<>();
        withNull.put("id", null);
        assertTrue(Values.keysMatch(withNull, withNull));
    }

    @Test
    void test_sum() {
        assertEquals(6L, Values.sum(List.of(1, 2L, (short) 3)));
        assertEquals(new BigDecimal("3.5"), Values.sum(List.of(1, 2.5d)));
        assertEquals(new BigDecimal(Long.MAX_VALUE).add(BigDecimal.ONE), Values.sum(List.of(Long.MAX_VALUE, 1)));
        assertThrows(InterpreterException.class, () -> Values.sum(List.of(1, "2")));
    }

    @Test
    void test_truthiness_and_emptiness() {
        assertTrue(Values.isEmpty(null));
        assertTrue(Values.isEmpty(List.of()));
        assertFalse(Values.isEmpty(Map.of()));
        assertFalse(Values.isTruthy(0L));
        assertFalse(Values.isTruthy(""));
        assertTrue(Values.isTruthy("x"));
        assertTrue(Values.isTruthy(Map.of()));
    }

    @Test
    void when_value_is_not_records_then_interpreter_error() {
        assertThrows(InterpreterException.class, () -> Values.asRecords(List.of(1), "join"));
        assertThrows(InterpreterException.class, () -> Values.asRecords("x", "join"));
        assertEquals(List.of(), Values.asRecords(null, "join"));
    }
}
