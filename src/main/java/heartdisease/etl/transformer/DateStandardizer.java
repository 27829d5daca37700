package heartdisease.etl.transformer;

import heartdisease.etl.model.DataTable;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rewrites date-like text columns to ISO {@code yyyy-MM-dd}.
 *
 * A column is a candidate when its name contains one of date/day/time/dt and every
 * present cell is text. It is rewritten only when more than half of its rows parse
 * as a date; cells that do not parse keep their original text.
 *
 * Disabled unless {@code etl.transform.standardize-dates} is set: the heart disease
 * columns carry no dates.
 */
@Slf4j
public class DateStandardizer implements TableTransformStep {

    public static final String NAME = "date-standardizer";

    private static final String[] DATE_TERMS = {"date", "day", "time", "dt"};

    /** Date-only formats tried in order. */
    private static final DateTimeFormatter[] DATE_FORMATTERS = {
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.BASIC_ISO_DATE,
            DateTimeFormatter.ofPattern("yyyy.MM.dd")
    };

    /** Date-time formats tried in order; only the date part is kept. */
    private static final DateTimeFormatter[] DATE_TIME_FORMATTERS = {
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss")
    };

    private final boolean enabled;

    public DateStandardizer(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public boolean requiresTransformation() {
        return enabled;
    }

    @Override
    public DataTable apply(DataTable table) {
        log.info("Standardizing date formats");
        List<String> standardized = new ArrayList<>();
        DataTable result = table;

        for (String column : table.getColumnNames()) {
            if (!isDateLikeName(column)) {
                continue;
            }
            List<Object> values = result.getColumn(column);
            if (!isTextColumn(values)) {
                continue;
            }

            List<Object> rewritten = new ArrayList<>(values.size());
            int parsed = 0;
            for (Object value : values) {
                LocalDate date = value == null ? null : parseDate(value.toString().trim());
                if (date != null) {
                    parsed++;
                    rewritten.add(date.format(DateTimeFormatter.ISO_LOCAL_DATE));
                } else {
                    rewritten.add(value);
                }
            }

            if (parsed > 0.5 * values.size()) {
                result = result.withColumn(column, rewritten);
                standardized.add(column);
                log.info("Standardized date format in column '{}' to YYYY-MM-DD", column);
            } else {
                log.debug("Column '{}' does not look like a date column ({} of {} values parsed)",
                        column, parsed, values.size());
            }
        }

        if (standardized.isEmpty()) {
            log.info("No date columns identified in the dataset");
        }
        return result;
    }

    static boolean isDateLikeName(String column) {
        String lower = column.toLowerCase(Locale.ROOT);
        for (String term : DATE_TERMS) {
            if (lower.contains(term)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTextColumn(List<Object> values) {
        boolean sawText = false;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (!(value instanceof String)) {
                return false;
            }
            sawText = true;
        }
        return sawText;
    }

    static LocalDate parseDate(String text) {
        if (text.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(text, formatter);
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", text, formatter);
            }
        }
        for (DateTimeFormatter formatter : DATE_TIME_FORMATTERS) {
            try {
                return LocalDateTime.parse(text, formatter).toLocalDate();
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", text, formatter);
            }
        }
        return null;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
