package statemigrator.version;

import statemigrator.transform.ModuleBlock;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts module version pins from configuration text.
 *
 * <p>Understands both source forms: a registry source with a separate {@code version}
 * attribute, and a git source carrying {@code ?ref=}.
 */
public final class ModuleVersionScanner {

    private static final Pattern REF = Pattern.compile("[?&]ref=([^&\"]+)");
    private static final Pattern OPERATOR = Pattern.compile("^(~>|>=|<=|!=|=|>|<)\\s*");
    private static final Pattern PROVIDER_PREFIX = Pattern.compile("^terraform-[a-z0-9]+-");

    private ModuleVersionScanner() {}

    /**
     * Scans one file's text.
     *
     * @param file path recorded in each pin
     * @param text the file content
     * @return pins in file order; modules without a source are ignored
     */
    public static List<ModulePin> scan(Path file, String text) {
        List<ModulePin> pins = new ArrayList<>();
        for (ModuleBlock block : ModuleBlock.findAll(text)) {
            String source = block.source();
            if (source == null || source.startsWith("./") || source.startsWith("../")) {
                continue;
            }
            pins.add(toPin(file, block.name(), source, block.version()));
        }
        return pins;
    }

    static ModulePin toPin(Path file, String instance, String source, String versionAttr) {
        String withoutQuery = source.contains("?") ? source.substring(0, source.indexOf('?')) : source;
        // a //subdir selects a submodule; the module identity is the part before it
        int schemeEnd = withoutQuery.indexOf("://");
        int subdir = withoutQuery.indexOf("//", schemeEnd < 0 ? 0 : schemeEnd + 3);
        String base = subdir >= 0 ? withoutQuery.substring(0, subdir) : withoutQuery;
        String trimmed = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        String[] segments = trimmed.split("/");

        String version = normalize(versionAttr);
        String sourceName = segments[segments.length - 1];
        if (sourceName.endsWith(".git")) {
            sourceName = sourceName.substring(0, sourceName.length() - 4);
        }
        String moduleName;
        if (source.startsWith("git::") || source.contains("://") || source.startsWith("git@")) {
            Matcher ref = REF.matcher(source);
            if (version == null && ref.find()) {
                String r = ref.group(1);
                version = "main".equals(r) || "master".equals(r) ? null : r;
            }
            moduleName = PROVIDER_PREFIX.matcher(sourceName).replaceFirst("");
        } else if (segments.length == 4 || segments.length == 3) {
            // [host/]namespace/name/provider
            moduleName = segments[segments.length - 2];
        } else {
            moduleName = sourceName;
        }
        return new ModulePin(file, instance, moduleName, sourceName, version);
    }

    private static String normalize(String constraint) {
        if (constraint == null || constraint.isBlank()) {
            return null;
        }
        String first = constraint.split(",")[0].trim();
        String v = OPERATOR.matcher(first).replaceFirst("").trim();
        return v.isEmpty() ? null : v;
    }
}
