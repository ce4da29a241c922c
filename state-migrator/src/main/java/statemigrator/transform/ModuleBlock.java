package statemigrator.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@code module "name" { ... }} block located in configuration text, with the
 * spans of its {@code source} and {@code version} attributes.
 *
 * @param name the module block label
 * @param start index of the {@code module} keyword
 * @param end index just past the closing brace
 * @param source value of the {@code source} attribute, or null
 * @param sourceValueStart index of the first character of the source value, or -1
 * @param sourceValueEnd index just past the source value, or -1
 * @param version value of the {@code version} attribute, or null
 * @param versionLineStart start of the line carrying {@code version}, or -1
 * @param versionLineEnd index just past that line including its newline, or -1
 */
public record ModuleBlock(
        String name,
        int start,
        int end,
        String source,
        int sourceValueStart,
        int sourceValueEnd,
        String version,
        int versionLineStart,
        int versionLineEnd
) {

    private static final Pattern MODULE_HEADER = Pattern.compile("(?m)^[ \\t]*module\\s+\"([^\"]+)\"\\s*\\{");
    private static final Pattern SOURCE_ATTR = Pattern.compile("(?m)^[ \\t]*source\\s*=\\s*\"([^\"]*)\"");
    private static final Pattern VERSION_ATTR = Pattern.compile("(?m)^[ \\t]*version\\s*=\\s*\"([^\"]*)\"[ \\t]*(?:#[^\\n]*)?(?:\\r?\\n|\\z)");

    /**
     * Locates every well-formed module block in {@code text}. Unbalanced blocks are skipped.
     */
    public static List<ModuleBlock> findAll(String text) {
        List<ModuleBlock> blocks = new ArrayList<>();
        Matcher header = MODULE_HEADER.matcher(text);
        int searchFrom = 0;
        while (header.find(searchFrom)) {
            int open = header.end() - 1;
            int close = BlockScanner.findClosingBrace(text, open);
            if (close < 0) {
                searchFrom = header.end();
                continue;
            }
            int moduleStart = header.start() + header.group().indexOf("module");
            blocks.add(parse(text, header.group(1), moduleStart, open, close));
            searchFrom = close + 1;
        }
        return blocks;
    }

    private static ModuleBlock parse(String text, String name, int start, int open, int close) {
        String source = null;
        int sStart = -1;
        int sEnd = -1;
        Matcher sm = SOURCE_ATTR.matcher(text).region(open + 1, close);
        while (sm.find()) {
            if (BlockScanner.depthAt(text, open + 1, sm.start()) == 0) {
                source = sm.group(1);
                sStart = sm.start(1);
                sEnd = sm.end(1);
                break;
            }
        }

        String version = null;
        int vStart = -1;
        int vEnd = -1;
        Matcher vm = VERSION_ATTR.matcher(text).region(open + 1, close);
        while (vm.find()) {
            if (BlockScanner.depthAt(text, open + 1, vm.start()) == 0) {
                version = vm.group(1);
                vStart = vm.start();
                vEnd = vm.end();
                break;
            }
        }
        return new ModuleBlock(name, start, close + 1, source, sStart, sEnd, version, vStart, vEnd);
    }
}
