package heartdisease.etl.schema;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Closed numeric interval [min, max].
 */
@Getter
@EqualsAndHashCode
public final class NumericRange {

    private final double min;
    private final double max;

    private NumericRange(double min, double max) {
        if (min > max) {
            throw new IllegalArgumentException("Invalid range [" + min + ", " + max + "]");
        }
        this.min = min;
        this.max = max;
    }

    public static NumericRange closed(double min, double max) {
        return new NumericRange(min, max);
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    @Override
    public String toString() {
        return "[" + format(min) + ", " + format(max) + "]";
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
