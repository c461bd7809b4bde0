package org.dxworks.sitegen.page;

import org.dxworks.sitegen.ContentFiles;
import org.dxworks.sitegen.SitegenConfig;
import org.dxworks.sitegen.parser.BlockTreeBuilder;
import org.dxworks.sitegen.parser.TitleExtractor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Generates HTML pages from markdown files using a template.
 */
public class PageGenerator {

    private final SitegenConfig config;

    public PageGenerator(SitegenConfig config) {
        this.config = config;
    }

    public static String readMarkdown(Path path) throws IOException {
        String markdown = Files.readString(path, StandardCharsets.UTF_8);
        // Remove BOM if present
        if (markdown.startsWith("\uFEFF")) {
            markdown = markdown.substring(1);
        }
        return markdown.replace("\r\n", "\n");
    }

    public static String renderPage(String markdown, String template, String basePath) {
        String content = BlockTreeBuilder.buildDocument(markdown).render();
        String title = TitleExtractor.extractTitle(markdown);
        return TemplateRenderer.render(template, title, content, basePath);
    }

    public void generatePage(Path fromPath, Path templatePath, Path destPath) throws IOException {
        synchronized (System.out) {
            System.out.println("Generating page from " + fromPath + " to " + destPath + " using " + templatePath);
        }
        String markdown = readMarkdown(fromPath);
        String template = Files.readString(templatePath, StandardCharsets.UTF_8);
        String html = renderPage(markdown, template, config.getBasePath());

        Path parent = destPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(destPath, html, StandardCharsets.UTF_8);
    }

    /**
     * Generates one page per markdown file under {@code contentDir}, mirroring the directory
     * layout under {@code destDir}. Pages are generated in parallel; unless errors are
     * tolerated, the first failure stops pages that have not started yet and is rethrown.
     */
    public GenerationSummary generatePagesRecursive(Path contentDir, Path templatePath, Path destDir) throws IOException {
        List<Path> files = collectMarkdownFiles(contentDir);
        synchronized (System.out) {
            System.out.println("Found " + files.size() + " markdown files");
        }

        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);
        AtomicReference<Exception> firstFailure = new AtomicReference<>();

        // failures are rethrown only once every running page has finished
        files.parallelStream().forEach(file -> {
            if (!config.isContinueOnError() && firstFailure.get() != null) {
                return;
            }
            Path relative = contentDir.relativize(file);
            Path destPath = destDir.resolve(relative.toString()).resolveSibling(
                    ContentFiles.toHtmlFileName(file.getFileName().toString()));
            int current = progressCounter.incrementAndGet();
            synchronized (System.out) {
                System.out.println("[" + current + "/" + files.size() + "] " + relative);
            }

            try {
                generatePage(file, templatePath, destPath);
                successCount.incrementAndGet();
            } catch (IOException | RuntimeException e) {
                errorCount.incrementAndGet();
                firstFailure.compareAndSet(null, e);
                synchronized (System.err) {
                    System.err.println("  Error generating " + file.getFileName() + ": " + e.getMessage());
                }
            }
        });

        Exception failure = firstFailure.get();
        if (failure != null && !config.isContinueOnError()) {
            if (failure instanceof IOException io) {
                throw io;
            }
            throw (RuntimeException) failure;
        }

        return new GenerationSummary(successCount.get(), errorCount.get());
    }

    List<Path> collectMarkdownFiles(Path contentDir) throws IOException {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(contentDir)) {
            return files;
        }
        try (Stream<Path> stream = Files.walk(contentDir)) {
            stream.filter(Files::isRegularFile)
                  .filter(ContentFiles::isMarkdown)
                  .filter(this::withinLineLimit)
                  .sorted()
                  .forEach(files::add);
        }
        return files;
    }

    private boolean withinLineLimit(Path file) {
        if (ContentFiles.withinMaxLines(file, config.getMaxFileLines())) {
            return true;
        }
        synchronized (System.out) {
            System.out.println("Skipping " + file + ": more than " + config.getMaxFileLines() + " lines");
        }
        return false;
    }
}
