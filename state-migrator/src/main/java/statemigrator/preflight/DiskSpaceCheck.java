package statemigrator.preflight;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Checks that the file system holding the working directory has room for the clones.
 *
 * <p>The working directory may not exist yet; the nearest existing ancestor is
 * measured instead.
 */
public final class DiskSpaceCheck implements PreflightCheck {

    /** Free space required by the standard checks: 1 GiB. */
    public static final long DEFAULT_REQUIRED_BYTES = 1024L * 1024 * 1024;

    private final Path directory;
    private final long requiredBytes;

    public DiskSpaceCheck(Path directory, long requiredBytes) {
        this.directory = directory;
        this.requiredBytes = requiredBytes;
    }

    @Override
    public PreflightResult run(String name) throws IOException {
        Path existing = nearestExisting(directory.toAbsolutePath());
        if (existing == null) {
            return PreflightResult.fail(name, "no existing directory above " + directory, null);
        }
        long usable = Files.getFileStore(existing).getUsableSpace();
        String available = gigabytes(usable) + " available under " + existing;
        if (usable < requiredBytes) {
            return PreflightResult.fail(name, "low disk space: " + available
                    + " (need " + gigabytes(requiredBytes) + ")", null);
        }
        return PreflightResult.ok(name, available);
    }

    private static Path nearestExisting(Path path) {
        Path current = path;
        while (current != null && !Files.exists(current)) {
            current = current.getParent();
        }
        return current;
    }

    static String gigabytes(long bytes) {
        return String.format(Locale.ROOT, "%.1f GB", bytes / (1024.0 * 1024 * 1024));
    }
}
