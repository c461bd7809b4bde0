package org.dxworks.sitegen;

import org.dxworks.sitegen.page.GenerationSummary;
import org.dxworks.sitegen.page.PageGenerator;
import org.dxworks.sitegen.page.StaticAssetCopier;

import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;

public class App {

    public static void main(String[] args) throws Exception {
        if (args.length > 1) {
            System.err.println("Usage: java -jar sitegen.jar [base-path]");
            System.err.println("  [base-path]: Prefix for root-relative href/src links (default: /)");
            System.err.println("Directories and template are read from " + SitegenConfig.CONFIG_FILE_NAME + " when present");
            System.exit(2);
        }

        SitegenConfig config = SitegenConfig.load();
        if (args.length == 1) {
            config = config.withBasePath(args[0]);
        }

        if (!Files.exists(config.getTemplatePath())) {
            System.err.println("Error: Template does not exist: " + config.getTemplatePath());
            System.exit(1);
        }

        System.out.println("Starting site generation...");
        System.out.println("Content: " + config.getContentDir().toAbsolutePath());
        System.out.println("Output: " + config.getOutputDir().toAbsolutePath());
        System.out.println("Base path: " + config.getBasePath());

        Instant startTime = Instant.now();
        StaticAssetCopier.copyDirContents(config.getStaticDir(), config.getOutputDir());

        PageGenerator generator = new PageGenerator(config);
        GenerationSummary summary = generator.generatePagesRecursive(
                config.getContentDir(), config.getTemplatePath(), config.getOutputDir());

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Generation complete!");
        System.out.println("Pages generated: " + summary.pagesGenerated());
        if (summary.hasFailures()) {
            System.out.println("Errors: " + summary.pagesFailed());
        }
        System.out.println("Duration: " + Duration.between(startTime, Instant.now()).toMillis() + " ms");
        System.out.println("Output written to: " + config.getOutputDir().toAbsolutePath());
        System.out.println("=".repeat(60));

        if (summary.hasFailures()) {
            System.exit(1);
        }
    }
}
