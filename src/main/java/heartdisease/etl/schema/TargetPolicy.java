package heartdisease.etl.schema;

/**
 * How the diagnosis column ({@code target}, renamed from {@code num}) is stored.
 */
public enum TargetPolicy {

    /** Any nonzero severity collapses to 1, zero stays 0. Target domain is {0, 1}. */
    BINARY,

    /**
     * Keep the 0-4 severity scale and derive {@code has_disease} (target > 0 -> 1, else 0).
     * Target domain is the range [0, 4] and the set {0..4}; has_disease domain is {0, 1}.
     */
    MULTI_CLASS
}
