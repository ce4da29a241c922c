package statemigrator.version;

import java.util.Optional;

/**
 * Allowed version interval for one module. Either bound may be absent.
 *
 * @param min lower bound, or null for none
 * @param max upper bound, or null for none
 * @param minInclusive whether {@code min} itself is allowed
 * @param maxInclusive whether {@code max} itself is allowed
 */
public record VersionRange(String min, String max, boolean minInclusive, boolean maxInclusive) {

    public static final VersionRange ANY = new VersionRange(null, null, true, true);

    /** Creates a range with both bounds inclusive. */
    public static VersionRange inclusive(String min, String max) {
        return new VersionRange(blankToNull(min), blankToNull(max), true, true);
    }

    public static VersionRange atLeast(String min) {
        return inclusive(min, null);
    }

    /**
     * Checks {@code version} against this range.
     *
     * @param version the pinned version
     * @param comparator the ordering to use
     * @return a description of the violation, or empty if the version is allowed
     */
    public Optional<String> violation(String version, VersionComparator comparator) {
        if (min != null) {
            int c = comparator.compare(version, min);
            if (c < 0 || (c == 0 && !minInclusive)) {
                return Optional.of("version " + version + " is below minimum " + describeMin());
            }
        }
        if (max != null) {
            int c = comparator.compare(version, max);
            if (c > 0 || (c == 0 && !maxInclusive)) {
                return Optional.of("version " + version + " exceeds maximum " + describeMax());
            }
        }
        return Optional.empty();
    }

    private String describeMin() {
        return minInclusive ? min : min + " (exclusive)";
    }

    private String describeMax() {
        return maxInclusive ? max : max + " (exclusive)";
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    @Override
    public String toString() {
        return (minInclusive ? "[" : "(") + (min != null ? min : "")
                + ", " + (max != null ? max : "") + (maxInclusive ? "]" : ")");
    }
}
