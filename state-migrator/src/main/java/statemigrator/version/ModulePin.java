package statemigrator.version;

import java.nio.file.Path;

/**
 * A module reference with its pinned version, as found in one configuration file.
 *
 * @param file file the module block lives in, relative to the repository root
 * @param instance the module block label
 * @param moduleName short module name used to look up version requirements
 * @param sourceName last path segment of the source, also accepted for lookups
 * @param version pinned version without constraint operators, or null if unpinned
 */
public record ModulePin(Path file, String instance, String moduleName, String sourceName, String version) {

    public boolean isPinned() {
        return version != null && !version.isBlank();
    }
}
