package com.pipewright.core.input;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Input files found for a run.
 *
 * @param directory   true when the input path was a directory
 * @param path        absolute input path (file or directory)
 * @param files       absolute paths of all input files, sorted
 * @param primaryFile the file handed to tasks as the main input
 */
public record DiscoveredInput(
    boolean directory,
    Path path,
    List<Path> files,
    Path primaryFile
) {
    public DiscoveredInput {
        files = List.copyOf(files);
    }

    /**
     * Directory that relative input names are computed against.
     */
    public Path baseDir() {
        return directory ? path : path.getParent();
    }

    public List<String> relativePaths() {
        if (!directory) {
            return List.of(primaryFile.getFileName().toString());
        }
        var relative = new ArrayList<String>();
        for (Path file : files) {
            relative.add(path.relativize(file).toString());
        }
        return relative;
    }

    public String summary() {
        if (!directory) {
            return "Input: " + primaryFile.getFileName();
        }
        var byExtension = new TreeMap<String, Integer>();
        for (Path file : files) {
            String name = file.getFileName().toString();
            int dot = name.lastIndexOf('.');
            byExtension.merge(dot >= 0 ? name.substring(dot) : "", 1, Integer::sum);
        }
        var parts = new ArrayList<String>();
        for (Map.Entry<String, Integer> entry : byExtension.entrySet()) {
            parts.add(entry.getValue() + " " + entry.getKey());
        }
        return "Input: " + path.getFileName() + " (" + files.size() + " files: " + String.join(", ", parts) + ")";
    }
}
