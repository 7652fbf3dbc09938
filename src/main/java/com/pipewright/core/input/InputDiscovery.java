package com.pipewright.core.input;

import com.pipewright.core.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Resolves the input path of a run into the list of files tasks read.
 *
 * <p>A file is used as-is. A directory is scanned recursively for requirement-like files
 * ({@link #SUPPORTED_EXTENSIONS}), skipping hidden files and everything under hidden
 * directories. The run's output directory can be excluded so that earlier artifacts are never
 * read back as input.
 */
@Component
public class InputDiscovery {

    private static final Logger log = LoggerFactory.getLogger(InputDiscovery.class);

    public static final List<String> SUPPORTED_EXTENSIONS = List.of(".md", ".yaml", ".yml", ".json", ".txt");

    public DiscoveredInput discover(Path input) {
        return discover(input, null);
    }

    /**
     * @param excluded directory whose files are never input, ignored when {@code null} or equal
     *                 to the input directory itself
     */
    public DiscoveredInput discover(Path input, Path excluded) {
        Path path = input.toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            throw new ConfigurationException("Input path not found: " + path);
        }
        if (!Files.isDirectory(path)) {
            return new DiscoveredInput(false, path, List.of(path), path);
        }

        Path skip = excluded != null ? excluded.toAbsolutePath().normalize() : null;
        if (skip != null && (skip.equals(path) || !skip.startsWith(path))) {
            skip = null;
        }
        List<Path> files = scan(path, skip);
        if (files.isEmpty()) {
            throw new ConfigurationException("No supported input files found in " + path
                    + " (supported: " + String.join(" ", SUPPORTED_EXTENSIONS) + ")");
        }
        var discovered = new DiscoveredInput(true, path, files, primaryFile(files));
        log.debug("Discovered {} input files under {}, primary {}", files.size(), path, discovered.primaryFile());
        return discovered;
    }

    private List<Path> scan(Path dir, Path skip) {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(file -> !isHidden(dir, file))
                    .filter(file -> skip == null || !file.startsWith(skip))
                    .filter(InputDiscovery::isSupported)
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new ConfigurationException("Failed to scan input directory " + dir + ": " + e.getMessage(), e);
        }
    }

    private static boolean isHidden(Path root, Path file) {
        for (Path part : root.relativize(file)) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static boolean isSupported(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return SUPPORTED_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    static Path primaryFile(List<Path> files) {
        for (Path file : files) {
            String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
            if (name.contains("prd") && name.endsWith(".md")) {
                return file;
            }
        }
        for (Path file : files) {
            if (file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".md")) {
                return file;
            }
        }
        return files.get(0);
    }
}
