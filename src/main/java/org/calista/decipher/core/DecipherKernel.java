package org.calista.decipher.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.decipher.events.EventStore;
import org.calista.decipher.io.FileIO;
import org.calista.decipher.section.SectionResultStore;
import org.calista.decipher.section.external.JsonlTranscriptionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * DecipherKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> loadOrCreate config, bind IO to baseDir, create stores
 *   2) hand to {@link DecipherComposer} to wire the orchestrator
 *
 * Holds no threads; the composer owns the evaluation pool.
 */
public final class DecipherKernel {

    private static final Logger log = LoggerFactory.getLogger(DecipherKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final DecipherConfig cfg;
    private final Path configFile;

    private final EventStore events;
    private final SectionResultStore results;
    private final JsonlTranscriptionSource transcription;

    private DecipherKernel(FileIO io,
                           ObjectMapper mapper,
                           DecipherConfig cfg,
                           Path configFile,
                           EventStore events,
                           SectionResultStore results,
                           JsonlTranscriptionSource transcription) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.configFile = Objects.requireNonNull(configFile, "configFile");
        this.events = Objects.requireNonNull(events, "events");
        this.results = Objects.requireNonNull(results, "results");
        this.transcription = Objects.requireNonNull(transcription, "transcription");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Directory the config path and a relative baseDir are resolved against.
         * The config is read before baseDir is known (baseDir lives inside it).
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public DecipherKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // Config IO (outside baseDir)
            FileIO external = new FileIO(configRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : external.baseDir().resolve(configFile).normalize();

            DecipherConfig cfg = DecipherConfig.loadOrCreate(external, cfgPath, om);

            // Runtime IO bound to cfg.baseDir
            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = external.baseDir().resolve(base);
            FileIO io = new FileIO(base, charset, true);

            EventStore events = new EventStore(io, om, io.resolve(cfg.events.logFile));
            SectionResultStore results = new SectionResultStore(io, om, io.resolve(cfg.results.file));

            String tf = cfg.transcription.file;
            Path transcriptionFile = Path.of(tf).isAbsolute() ? io.resolveExternal(tf) : io.resolve(tf);
            JsonlTranscriptionSource transcription =
                    new JsonlTranscriptionSource(io, om, transcriptionFile, cfg.transcription.failFast);

            DecipherKernel k = new DecipherKernel(io, om, cfg, cfgPath, events, results, transcription);
            k.logCreated();
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public DecipherConfig config() { return cfg; }
    public Path configFile() { return configFile; }
    public EventStore eventStore() { return events; }
    public SectionResultStore resultStore() { return results; }
    public JsonlTranscriptionSource transcription() { return transcription; }

    private void logCreated() {
        if (!log.isInfoEnabled()) return;
        log.info("DecipherKernel created: config={}, baseDir={}, transcription={}, sections={}",
                configFile, io.baseDir(), transcription.file(), cfg.sections);
    }
}
