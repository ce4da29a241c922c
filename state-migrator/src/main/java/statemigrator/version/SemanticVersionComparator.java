package statemigrator.version;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Semantic-version ordering with a few practical allowances.
 *
 * <ul>
 *   <li>a leading {@code v} is ignored</li>
 *   <li>missing numeric parts count as zero, so {@code 1.2} equals {@code 1.2.0}</li>
 *   <li>a pre-release ({@code 1.2.0-rc1}) ranks below its release</li>
 *   <li>build metadata ({@code +build5}) is ignored</li>
 * </ul>
 */
public final class SemanticVersionComparator implements VersionComparator {

    public static final SemanticVersionComparator INSTANCE = new SemanticVersionComparator();

    private static final Pattern NUMERIC = Pattern.compile("\\d+");

    @Override
    public int compare(String a, String b) {
        Parsed pa = parse(a);
        Parsed pb = parse(b);

        int len = Math.max(pa.numbers.size(), pb.numbers.size());
        for (int i = 0; i < len; i++) {
            long x = i < pa.numbers.size() ? pa.numbers.get(i) : 0L;
            long y = i < pb.numbers.size() ? pb.numbers.get(i) : 0L;
            if (x != y) {
                return Long.compare(x, y);
            }
        }
        return comparePreRelease(pa.preRelease, pb.preRelease);
    }

    private static int comparePreRelease(String a, String b) {
        if (a == null && b == null) return 0;
        if (a == null) return 1;
        if (b == null) return -1;

        String[] xa = a.split("\\.");
        String[] xb = b.split("\\.");
        for (int i = 0; i < Math.min(xa.length, xb.length); i++) {
            boolean na = NUMERIC.matcher(xa[i]).matches();
            boolean nb = NUMERIC.matcher(xb[i]).matches();
            int c;
            if (na && nb) {
                c = Long.compare(Long.parseLong(xa[i]), Long.parseLong(xb[i]));
            } else if (na) {
                c = -1;
            } else if (nb) {
                c = 1;
            } else {
                c = xa[i].compareTo(xb[i]);
            }
            if (c != 0) return c;
        }
        return Integer.compare(xa.length, xb.length);
    }

    private static Parsed parse(String version) {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("empty version");
        }
        String v = version.trim();
        if (v.startsWith("v") || v.startsWith("V")) {
            v = v.substring(1);
        }
        int plus = v.indexOf('+');
        if (plus >= 0) {
            v = v.substring(0, plus);
        }
        String pre = null;
        int dash = v.indexOf('-');
        if (dash >= 0) {
            pre = v.substring(dash + 1);
            v = v.substring(0, dash);
            if (pre.isEmpty()) {
                throw new IllegalArgumentException("empty pre-release in '" + version + "'");
            }
        }
        List<Long> numbers = new ArrayList<>();
        for (String part : v.split("\\.", -1)) {
            if (!NUMERIC.matcher(part).matches()) {
                throw new IllegalArgumentException("'" + version + "' is not a version");
            }
            numbers.add(Long.parseLong(part));
        }
        return new Parsed(numbers, pre);
    }

    private record Parsed(List<Long> numbers, String preRelease) {}
}
