package org.calista.decipher;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.decipher.core.DecipherComposer;
import org.calista.decipher.core.DecipherKernel;
import org.calista.decipher.core.DecipherLogFmt;
import org.calista.decipher.events.DecipherEvent;
import org.calista.decipher.section.RunReport;
import org.calista.decipher.section.SectionOrchestrator;
import org.calista.decipher.section.SectionResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * DecipherApp — console runner.
 *
 * Lifecycle:
 *  1) build kernel (loads/creates config, binds IO and stores)
 *  2) compose the orchestrator (composer owns the eval pool)
 *  3) run every configured section
 *  4) save results, print the summary
 *  5) close the composer
 *
 * Usage: {@code DecipherApp [configPath]}, default {@code config/decipher.json}.
 */
public final class DecipherApp {

    private static final Logger log = LogManager.getLogger(DecipherApp.class);

    static final String DEFAULT_CONFIG = "config/decipher.json";

    private final Path configRoot;
    private final Path cfgPath;

    public static void main(String[] args) throws Exception {
        Path cfg = Path.of((args != null && args.length > 0) ? args[0] : DEFAULT_CONFIG);
        RunReport report = new DecipherApp(Path.of("."), cfg).run();
        if (report.hasFailures()) System.exit(1);
    }

    public DecipherApp(Path configRoot, Path cfgPath) {
        this.configRoot = configRoot;
        this.cfgPath = cfgPath;
    }

    public RunReport run() throws IOException {
        DecipherKernel kernel = DecipherKernel.builder()
                .configRoot(configRoot)
                .build(cfgPath);

        try (DecipherComposer composer = new DecipherComposer(kernel)) {
            SectionOrchestrator orchestrator = composer.buildOrchestrator();

            RunReport report = orchestrator.runAll(kernel.config().sections);

            kernel.resultStore().save(report.results);
            kernel.eventStore().append(DecipherEvent.of(DecipherEvent.RESULTS_SAVED, report.runId, null,
                    kernel.resultStore().file().toString(), System.currentTimeMillis()));

            log.info("\n{}", summary(report));
            return report;
        }
    }

    static String summary(RunReport report) {
        return DecipherLogFmt.box("Decipher run " + report.runId, b -> {
            b.kv("sections.ok", report.results.size());
            b.kv("sections.failed", report.failures.size());
            b.kv("elapsedMs", report.elapsedMs);
            for (SectionResult r : report.results) {
                b.sep();
                b.kv("section", r.section);
                b.kv("mapping", r.bestMapping);
                b.kv("fitness", r.bestFitness + " (frequency " + r.frequencyScore + ", feedback " + r.feedbackScore + ")");
                b.kv("communities", r.communities);
                b.kv("translation", r.translation);
                b.kv("alignment", r.alignmentScore);
            }
            for (Map.Entry<String, String> f : report.failures.entrySet()) {
                b.sep();
                b.kv("FAILED " + f.getKey(), f.getValue());
            }
        });
    }
}
