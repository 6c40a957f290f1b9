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

import com.tessera.common.utils.Utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Helpers over runtime values: null, Boolean, Number, String, List and records as Map.
 */
public final class Values {

    private Values() {
    }

    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        return false;
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return Utils.toBigDecimal(number).signum() != 0;
        }
        if (value instanceof CharSequence cs) {
            return cs.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        return true;
    }

    /**
     * Returns the value as a list of records. A single record becomes a singleton list, null becomes an empty list.
     *
     * @param value the value
     * @param node  the name of the consuming node, used in error messages
     * @return the records
     */
    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> asRecords(Object value, String node) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Map<?, ?> record) {
            return List.of((Map<String, Object>) record);
        }
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (!(item instanceof Map)) {
                    throw new InterpreterException(String.format("%s expected records but got %s", node, describe(item)));
                }
            }
            return (List<Map<String, Object>>) list;
        }
        throw new InterpreterException(String.format("%s expected records but got %s", node, describe(value)));
    }

    /**
     * Normalizes a value so that equal keys compare equal regardless of their Java number type.
     * 1, 1L, 1.0 and BigDecimal("1.00") all normalize to the same value.
     *
     * @param value a scalar value
     * @return a value suitable for equals/hashCode based lookups
     */
    public static Object normalizeKey(Object value) {
        if (value instanceof Number number) {
            if (number instanceof Double d && (d.isNaN() || d.isInfinite())) {
                return d;
            }
            if (number instanceof Float f && (f.isNaN() || f.isInfinite())) {
                return f.doubleValue();
            }
            BigDecimal decimal = Utils.toBigDecimal(number);
            return decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
        }
        if (value instanceof Character c) {
            return String.valueOf(c);
        }
        return value;
    }

    /**
     * Returns true if both sides agree on every key of the smaller key set. A number and a string
     * are equal when the string parses to the same decimal value, as large integers and decimals
     * arrive as strings.
     *
     * @param actual   the values extracted from a row
     * @param expected the values to match against
     * @return true if the keys match
     */
    public static boolean keysMatch(Map<String, Object> actual, Map<String, Object> expected) {
        Map<String, Object> smaller = actual.size() < expected.size() ? actual : expected;
        Map<String, Object> other = smaller == actual ? expected : actual;
        for (Map.Entry<String, Object> entry : smaller.entrySet()) {
            if (!other.containsKey(entry.getKey())) {
                return false;
            }
            if (!keyEquals(entry.getValue(), other.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean keyEquals(Object left, Object right) {
        if (left instanceof Number && right instanceof CharSequence) {
            return Objects.equals(normalizeKey(left), parseDecimal(right.toString()));
        }
        if (right instanceof Number && left instanceof CharSequence) {
            return Objects.equals(normalizeKey(right), parseDecimal(left.toString()));
        }
        return Objects.equals(normalizeKey(left), normalizeKey(right));
    }

    private static Object parseDecimal(String text) {
        try {
            return normalizeKey(new BigDecimal(text.trim()));
        } catch (NumberFormatException e) {
            // Not a number, so it cannot equal one.
            return text;
        }
    }

    /**
     * Adds up numbers. The result is a Long when every operand is integral and the sum fits,
     * a BigDecimal otherwise.
     *
     * @param operands the numbers
     * @return the sum
     */
    public static Number sum(List<Object> operands) {
        BigDecimal total = BigDecimal.ZERO;
        boolean integral = true;
        for (Object operand : operands) {
            if (!(operand instanceof Number number)) {
                throw new InterpreterException("sum expected numbers but got " + describe(operand));
            }
            if (!(number instanceof Long || number instanceof Integer || number instanceof Short
                    || number instanceof Byte || number instanceof BigInteger)) {
                integral = false;
            }
            total = total.add(Utils.toBigDecimal(number));
        }
        if (integral) {
            try {
                return total.longValueExact();
            } catch (ArithmeticException e) {
                return total;
            }
        }
        return total;
    }

    public static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map) {
            return "a record";
        }
        if (value instanceof List) {
            return "a list";
        }
        return value.getClass().getSimpleName();
    }
}
