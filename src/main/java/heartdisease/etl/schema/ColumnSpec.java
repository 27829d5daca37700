package heartdisease.etl.schema;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.Set;

/**
 * One entry of the fixed column contract.
 *
 * A column may carry a numeric range, a category set, both (multi-class target), or neither.
 * Missing-value handling is not declared here: it is decided from the column's actual content
 * by the resolver, using the semantic type to pick median or mode.
 */
@Getter
@Builder
public class ColumnSpec {

    @NonNull
    private final String name;

    @NonNull
    private final SemanticType type;

    /** Inclusive bounds, or null when the column is not range-checked. */
    private final NumericRange range;

    /** Allowed values, or null when the column is not category-checked. */
    private final Set<Long> categories;

    /** Column must be present once names are normalized. */
    private final boolean required;

    /** Human readable meaning, used as the SQL column comment. */
    private final String description;

    public boolean hasRange() {
        return range != null;
    }

    public boolean hasCategories() {
        return categories != null && !categories.isEmpty();
    }

    /**
     * Numeric columns are imputed with the median, everything else with the mode.
     */
    public boolean isImputedWithMedian() {
        return type.isNumeric();
    }
}
