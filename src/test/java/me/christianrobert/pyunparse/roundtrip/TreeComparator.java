package me.christianrobert.pyunparse.roundtrip;

import me.christianrobert.pyunparse.tree.Statement;
import me.christianrobert.pyunparse.tree.element.ExceptHandler;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Structural tree comparison that ignores line numbers.
 *
 * <p>Integral numbers compare by value whatever their boxed type, floating numbers by their
 * double value; an int never equals a float.</p>
 */
final class TreeComparator {

    private TreeComparator() {
    }

    /**
     * @return Description of the first difference, or null when both trees match
     */
    static String difference(Object expected, Object actual) {
        return compare(expected, actual, "tree");
    }

    private static String compare(Object expected, Object actual, String path) {
        if (expected == null || actual == null) {
            return expected == actual ? null : path + ": expected " + expected + " but was " + actual;
        }
        if (expected instanceof Number && actual instanceof Number) {
            return numbersEqual((Number) expected, (Number) actual)
                    ? null : path + ": expected number " + expected + " but was " + actual;
        }
        if (expected instanceof byte[] && actual instanceof byte[]) {
            return Arrays.equals((byte[]) expected, (byte[]) actual)
                    ? null : path + ": byte arrays differ";
        }
        if (expected instanceof List && actual instanceof List) {
            List<?> left = (List<?>) expected;
            List<?> right = (List<?>) actual;
            if (left.size() != right.size()) {
                return path + ": expected " + left.size() + " elements but was " + right.size();
            }
            for (int i = 0; i < left.size(); i++) {
                String diff = compare(left.get(i), right.get(i), path + "[" + i + "]");
                if (diff != null) {
                    return diff;
                }
            }
            return null;
        }
        if (expected.getClass() != actual.getClass()) {
            return path + ": expected " + expected.getClass().getSimpleName()
                    + " but was " + actual.getClass().getSimpleName();
        }
        if (expected instanceof String || expected instanceof Enum || expected instanceof Boolean) {
            return expected.equals(actual) ? null : path + ": expected '" + expected + "' but was '" + actual + "'";
        }

        for (Field field : fields(expected.getClass())) {
            try {
                field.setAccessible(true);
                String diff = compare(field.get(expected), field.get(actual),
                        path + "." + expected.getClass().getSimpleName() + "#" + field.getName());
                if (diff != null) {
                    return diff;
                }
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot read " + field, e);
            }
        }
        return null;
    }

    private static List<Field> fields(Class<?> type) {
        List<Field> fields = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class && c != Statement.class; c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers())) {
                    continue;
                }
                if (c == ExceptHandler.class && field.getName().equals("lineNumber")) {
                    continue;
                }
                fields.add(field);
            }
        }
        return fields;
    }

    private static boolean numbersEqual(Number expected, Number actual) {
        boolean expectedIntegral = isIntegral(expected);
        if (expectedIntegral != isIntegral(actual)) {
            return false;
        }
        if (expectedIntegral) {
            return new BigInteger(expected.toString()).equals(new BigInteger(actual.toString()));
        }
        return Double.compare(expected.doubleValue(), actual.doubleValue()) == 0;
    }

    private static boolean isIntegral(Number value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }
}
