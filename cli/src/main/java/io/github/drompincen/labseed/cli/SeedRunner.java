package io.github.drompincen.labseed.cli;

import io.github.drompincen.labseed.protocol.document.SeedDocument;
import io.github.drompincen.labseed.runtime.context.RunContext;
import io.github.drompincen.labseed.runtime.context.SeedOptions;
import io.github.drompincen.labseed.runtime.document.DocumentLoader;
import io.github.drompincen.labseed.runtime.error.DocumentException;
import io.github.drompincen.labseed.runtime.error.SeedException;
import io.github.drompincen.labseed.runtime.report.RunReport;
import io.github.drompincen.labseed.runtime.traversal.SeedEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads the configured document, runs the engine and keeps the process exit code:
 * 0 when the run completed, 1 when it failed.
 */
@Component
public class SeedRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(SeedRunner.class);

    private final DocumentLoader loader;
    private final SeedEngine engine;
    private final SeedOptions options;
    private final String config;

    private int exitCode = 1;

    public SeedRunner(DocumentLoader loader,
                      SeedEngine engine,
                      SeedOptions options,
                      @Value("${labseed.config:}") String config) {
        this.loader = loader;
        this.engine = engine;
        this.options = options;
        this.config = config;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (config == null || config.isBlank()) {
            log.error("No seed document configured (labseed.config)");
            return;
        }
        try {
            SeedDocument document = loader.load(Path.of(config));
            RunContext ctx = engine.run(document, options);
            List<RunReport.Entry> gaps = ctx.report().entries().stream().filter(RunReport.Entry::isGap).toList();
            if (!gaps.isEmpty()) {
                log.warn("Completed with {} gap(s):", gaps.size());
                gaps.forEach(gap -> log.warn("  {} {}: {}", gap.kind().displayName(), gap.subject(), gap.detail()));
            }
            exitCode = 0;
        } catch (DocumentException e) {
            log.error("Invalid seed document {}:", config);
            e.getProblems().forEach(problem -> log.error("  {}", problem));
        } catch (SeedException e) {
            log.error("Seeding failed: {}", e.getMessage());
            log.debug("Failure detail", e);
        } catch (RuntimeException e) {
            log.error("Seeding failed unexpectedly", e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
