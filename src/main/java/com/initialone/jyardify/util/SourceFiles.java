package com.initialone.jyardify.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Recursive source listing: file-name glob plus excluded directory names. */
public final class SourceFiles {

    private SourceFiles() {
    }

    /**
     * @param pattern glob applied to the file name only, e.g. {@code *.rb}
     * @param excludedDirs directory names; a file below any of them (relative to {@code root}) is skipped
     */
    public static List<Path> list(Path root, String pattern, Collection<String> excludedDirs) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .filter(p -> !isExcluded(root, p, excludedDirs))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    static boolean isExcluded(Path root, Path file, Collection<String> excludedDirs) {
        if (excludedDirs == null || excludedDirs.isEmpty()) return false;
        Path parent = root.relativize(file).getParent();
        if (parent == null) return false;
        for (Path segment : parent) {
            if (excludedDirs.contains(segment.toString())) return true;
        }
        return false;
    }
}
