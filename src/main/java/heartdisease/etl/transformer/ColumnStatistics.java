package heartdisease.etl.transformer;

import heartdisease.etl.schema.ColumnSpec;
import heartdisease.etl.schema.SemanticType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Predicate;

/**
 * Shared value logic for the transformation steps.
 *
 * Centralizes:
 * 1. Numeric and boolean parsing of raw cells (unparsable -> null, never an exception)
 * 2. Median and mode over the non-missing cells of a column
 * 3. Choosing and typing the imputation value for a column
 */
@Slf4j
public final class ColumnStatistics {

    private ColumnStatistics() {
    }

    /**
     * Parse a cell as a number.
     *
     * @return Long for integral input, Double for fractional input, null if missing or unparsable
     */
    public static Number toNumber(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1L : 0L;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException notLong) {
            try {
                double d = Double.parseDouble(text);
                return Double.isFinite(d) ? d : null;
            } catch (NumberFormatException notNumeric) {
                log.trace("Value '{}' is not numeric", text);
                return null;
            }
        }
    }

    /**
     * Truthiness of a present cell.
     *
     * Numbers are true when nonzero; strings are matched against true/false words,
     * then parsed as numbers; any other non-blank text counts as true.
     *
     * @return null only when the cell is missing, blank or NaN
     */
    public static Boolean toBoolean(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) ? null : d != 0;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty()) {
            return null;
        }
        switch (text) {
            case "true":
            case "t":
            case "yes":
            case "y":
                return Boolean.TRUE;
            case "false":
            case "f":
            case "no":
            case "n":
                return Boolean.FALSE;
            default:
                break;
        }
        if ("nan".equals(text)) {
            return null;
        }
        Number number = toNumber(text);
        if (number != null) {
            return number.doubleValue() != 0;
        }
        return Boolean.TRUE;
    }

    /**
     * Integer view of a number: integral doubles convert exactly, fractional ones are rounded.
     */
    public static Long toLong(Number number) {
        if (number == null) {
            return null;
        }
        if (number instanceof Long) {
            return (Long) number;
        }
        return Math.round(number.doubleValue());
    }

    /**
     * Median over the numeric, non-missing cells.
     *
     * @return empty when there is no such cell
     */
    public static OptionalDouble median(List<Object> values) {
        List<Double> numbers = new ArrayList<>();
        for (Object value : values) {
            if (value instanceof Number) {
                numbers.add(((Number) value).doubleValue());
            }
        }
        if (numbers.isEmpty()) {
            return OptionalDouble.empty();
        }
        Collections.sort(numbers);
        int n = numbers.size();
        if (n % 2 == 1) {
            return OptionalDouble.of(numbers.get(n / 2));
        }
        return OptionalDouble.of((numbers.get(n / 2 - 1) + numbers.get(n / 2)) / 2.0);
    }

    /**
     * Most frequent non-missing cell. Ties go to the value seen first.
     *
     * @return empty when every cell is missing
     */
    public static Optional<Object> mode(List<Object> values) {
        Map<Object, Integer> counts = new LinkedHashMap<>();
        for (Object value : values) {
            if (value != null) {
                counts.merge(value, 1, Integer::sum);
            }
        }
        Object best = null;
        int bestCount = 0;
        for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * A column with at least one present cell, all of them numbers.
     */
    public static boolean isNumericColumn(List<Object> values) {
        boolean sawNumber = false;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (!(value instanceof Number)) {
                return false;
            }
            sawNumber = true;
        }
        return sawNumber;
    }

    /**
     * Value used to fill missing cells of a column.
     *
     * Declared numeric columns and undeclared all-numeric columns get the median,
     * everything else gets the mode. The median is typed like the column: rounded
     * to Long for INTEGER columns (and undeclared columns holding only Longs),
     * Double otherwise.
     *
     * @param spec   declared column, or null for a pass-through column
     * @param values current cells
     * @return empty when the column has no present cell
     */
    public static Optional<Object> imputationValue(ColumnSpec spec, List<Object> values) {
        boolean useMedian = spec != null ? spec.isImputedWithMedian() : isNumericColumn(values);
        if (!useMedian) {
            return mode(values);
        }
        OptionalDouble median = median(values);
        if (median.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(typed(median.getAsDouble(), spec, values));
    }

    /**
     * Median of the present cells that satisfy the predicate, typed like the column.
     */
    public static Optional<Object> medianOf(ColumnSpec spec, List<Object> values, Predicate<Object> keep) {
        OptionalDouble median = median(filter(values, keep));
        if (median.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(typed(median.getAsDouble(), spec, values));
    }

    /**
     * Mode of the present cells that satisfy the predicate.
     */
    public static Optional<Object> modeOf(List<Object> values, Predicate<Object> keep) {
        return mode(filter(values, keep));
    }

    private static List<Object> filter(List<Object> values, Predicate<Object> keep) {
        List<Object> kept = new ArrayList<>();
        for (Object value : values) {
            if (value != null && keep.test(value)) {
                kept.add(value);
            }
        }
        return kept;
    }

    private static Object typed(double median, ColumnSpec spec, List<Object> values) {
        if (spec != null) {
            return spec.getType() == SemanticType.INTEGER ? (Object) Math.round(median) : (Object) median;
        }
        for (Object value : values) {
            if (value != null && !(value instanceof Long)) {
                return median;
            }
        }
        return Math.round(median);
    }

    /**
     * Replace every null cell with the given value.
     */
    public static List<Object> fillMissing(List<Object> values, Object fill) {
        List<Object> filled = new ArrayList<>(values.size());
        for (Object value : values) {
            filled.add(value == null ? fill : value);
        }
        return filled;
    }
}
