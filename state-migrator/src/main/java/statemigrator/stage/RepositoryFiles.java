package statemigrator.stage;

import statemigrator.exceptions.StageException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File access inside a clone: listing configuration and workflow files, and reading
 * and writing them as UTF-8.
 */
public final class RepositoryFiles {

    private RepositoryFiles() {}

    /**
     * Lists {@code *.tf} files below {@code root}, skipping VCS metadata and provider caches.
     */
    public static List<Path> configurationFiles(Path root) throws StageException {
        return walk(root, p -> p.getFileName().toString().endsWith(".tf"));
    }

    /**
     * Lists workflow definitions under {@code .github/workflows}.
     */
    public static List<Path> workflowFiles(Path root) throws StageException {
        Path dir = root.resolve(".github").resolve("workflows");
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        return walk(dir, p -> {
            String n = p.getFileName().toString();
            return n.endsWith(".yml") || n.endsWith(".yaml");
        });
    }

    /**
     * Reads {@code file} as UTF-8, or returns empty if its content is not valid UTF-8.
     * Other I/O failures still raise a {@link StageException}.
     */
    public static Optional<String> readIfText(Path file) throws StageException {
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (CharacterCodingException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StageException("Cannot read " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    public static void write(Path file, String text) throws StageException {
        try {
            Files.writeString(file, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StageException("Cannot write " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /** Returns {@code file} relative to {@code root}, with forward slashes. */
    public static String relative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static List<Path> walk(Path root, Predicate<Path> filter) throws StageException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> !isIgnored(root, p))
                    .filter(filter)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new StageException("Cannot list files under " + root.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static boolean isIgnored(Path root, Path file) {
        for (Path part : root.relativize(file)) {
            String name = part.toString();
            if (name.equals(".git") || name.equals(".terraform")) {
                return true;
            }
        }
        return false;
    }
}
