package partitions;

import partitions.exceptions.PartitionFormatException;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Integer coercion for group and partition ids.
 */
final class Ids {

    private Ids() {}

    /**
     * Coerces a raw id to an {@code int}.
     *
     * <p>Integral numbers must fit an {@code int}. Other numbers are truncated
     * toward zero. Strings are parsed as decimal integers after trimming.
     *
     * @param raw the raw id value
     * @return the id as an int
     * @throws PartitionFormatException if the value cannot be represented as an int
     */
    static int coerce(Object raw) {
        if (raw instanceof Integer i) {
            return i;
        }
        if (raw instanceof Long || raw instanceof Short || raw instanceof Byte || raw instanceof BigInteger) {
            try {
                return new BigDecimal(raw.toString()).intValueExact();
            } catch (ArithmeticException e) {
                throw new PartitionFormatException("Id out of integer range: " + raw, e);
            }
        }
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new PartitionFormatException("Id is not an integer: " + raw);
            }
            try {
                return BigDecimal.valueOf(d).toBigInteger().intValueExact();
            } catch (ArithmeticException e) {
                throw new PartitionFormatException("Id out of integer range: " + raw, e);
            }
        }
        if (raw instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new PartitionFormatException("Id is not an integer: '" + s + "'", e);
            }
        }
        throw new PartitionFormatException("Id is not an integer: " + raw);
    }
}
