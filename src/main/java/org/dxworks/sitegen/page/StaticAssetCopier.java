package org.dxworks.sitegen.page;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public final class StaticAssetCopier {

    private StaticAssetCopier() {}

    /**
     * Replaces {@code dest} with a recursive copy of {@code src}. Does nothing when
     * {@code src} does not exist.
     */
    public static void copyDirContents(Path src, Path dest) throws IOException {
        if (!Files.exists(src)) {
            return;
        }
        deleteRecursively(dest);
        Files.createDirectories(dest);

        List<Path> sources;
        try (Stream<Path> stream = Files.walk(src)) {
            sources = stream.filter(p -> !p.equals(src)).sorted().collect(Collectors.toList());
        }
        for (Path source : sources) {
            Path target = dest.resolve(src.relativize(source).toString());
            if (Files.isDirectory(source)) {
                Files.createDirectories(target);
            } else {
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
                System.out.println("Copied " + source + " -> " + target);
            }
        }
    }

    static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> stream = Files.walk(path)) {
            // children before their parents
            paths = stream.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path p : paths) {
            Files.delete(p);
        }
    }
}
