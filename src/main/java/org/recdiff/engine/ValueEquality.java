package org.recdiff.engine;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Equality policy for normalized values that are not compared structurally.
 */
@FunctionalInterface
public interface ValueEquality {
    boolean valuesEqual(Object left, Object right);

    /**
     * {@link Objects#equals} except that numbers compare by numeric value, so {@code 1}, {@code 1L} and
     * {@code 1.0} are equal.
     */
    static ValueEquality numericAware() {
        return ValueEquality::numericAwareEquals;
    }

    private static boolean numericAwareEquals(Object left, Object right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Number leftNumber && right instanceof Number rightNumber) {
            try {
                BigDecimal leftDecimal = new BigDecimal(leftNumber.toString());
                BigDecimal rightDecimal = new BigDecimal(rightNumber.toString());
                return leftDecimal.compareTo(rightDecimal) == 0;
            } catch (NumberFormatException ignored) {
                return Objects.equals(left, right);
            }
        }
        return Objects.equals(left, right);
    }
}
