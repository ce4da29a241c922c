package statemigrator.version;

import java.util.Comparator;

/**
 * Orders module version strings. Organizations plug in their own ordering; the
 * default is {@link SemanticVersionComparator}.
 *
 * <p>{@link #compare(Object, Object)} throws {@link IllegalArgumentException} for a
 * string the comparator cannot parse.
 */
public interface VersionComparator extends Comparator<String> {

    /**
     * Returns true if {@code version} can be compared by this comparator.
     */
    default boolean isComparable(String version) {
        try {
            compare(version, version);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
