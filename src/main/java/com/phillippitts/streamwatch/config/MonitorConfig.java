package com.phillippitts.streamwatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.phillippitts.streamwatch.client.LiveClientFactory;
import com.phillippitts.streamwatch.client.OfflineLiveClientFactory;
import com.phillippitts.streamwatch.config.properties.MonitorProperties;
import com.phillippitts.streamwatch.config.roster.CommandLineOverrides;
import com.phillippitts.streamwatch.config.roster.ConfigurationWatcher;
import com.phillippitts.streamwatch.config.roster.RosterLoader;
import com.phillippitts.streamwatch.persistence.CsvEventSink;
import com.phillippitts.streamwatch.persistence.SessionSinks;
import com.phillippitts.streamwatch.persistence.SessionSummaryLog;
import com.phillippitts.streamwatch.persistence.StatusFileWriter;
import com.phillippitts.streamwatch.service.control.ControlSignalChannel;
import com.phillippitts.streamwatch.service.disconnect.DisconnectConfirmationService;
import com.phillippitts.streamwatch.service.metrics.MonitorMetrics;
import com.phillippitts.streamwatch.service.monitor.MonitorLoop;
import com.phillippitts.streamwatch.service.monitor.MonitorRunner;
import com.phillippitts.streamwatch.service.probe.LivenessProber;
import com.phillippitts.streamwatch.service.probe.ParallelPollEngine;
import com.phillippitts.streamwatch.service.probe.RetryingLivenessProber;
import com.phillippitts.streamwatch.service.recording.DefaultRecordingOrchestrator;
import com.phillippitts.streamwatch.service.recording.RecordingOrchestrator;
import com.phillippitts.streamwatch.service.stability.StabilityTracker;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Validator;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the monitor explicitly: roster and settings, probing, stability, recording, disconnect
 * confirmation and the control loop.
 */
@Configuration
public class MonitorConfig {

    private static final Logger LOG = LogManager.getLogger(MonitorConfig.class);

    static final String BASE_LOGGER = "com.phillippitts.streamwatch";

    private final MonitorProperties properties;

    public MonitorConfig(MonitorProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public CsvMapper csvMapper() {
        return new CsvMapper();
    }

    /**
     * Command-line overrides ({@code --session-id}, {@code --data-center}, {@code --check-interval},
     * {@code --output-dir}, {@code --verbose}). {@code --verbose} raises the application loggers
     * to DEBUG.
     */
    @Bean
    public CommandLineOverrides commandLineOverrides(ApplicationArguments args) {
        CommandLineOverrides overrides = CommandLineOverrides.from(args);
        if (overrides.verbose()) {
            Configurator.setLevel(BASE_LOGGER, Level.DEBUG);
            LOG.debug("Verbose logging enabled");
        }
        if (!overrides.isEmpty()) {
            LOG.info("Command-line overrides: {}", overrides);
        }
        return overrides;
    }

    @Bean
    public RosterLoader rosterLoader(ObjectMapper objectMapper, Validator validator) {
        return new RosterLoader(objectMapper, validator);
    }

    /**
     * Loads the roster at startup. A malformed roster fails context startup.
     */
    @Bean
    public ConfigurationWatcher configurationWatcher(RosterLoader loader,
                                                     CommandLineOverrides overrides,
                                                     Clock clock) {
        return new ConfigurationWatcher(Path.of(properties.getConfigFile()), loader, overrides, clock);
    }

    @Bean
    public SessionSummaryLog sessionSummaryLog(CsvMapper csvMapper, Clock clock) {
        return new SessionSummaryLog(Path.of(properties.getLogDir()), csvMapper, clock);
    }

    @Bean
    public StatusFileWriter statusFileWriter(ObjectMapper objectMapper) {
        return new StatusFileWriter(Path.of(properties.getStatusFile()), objectMapper);
    }

    /**
     * Fallback used when no real live-stream client is on the classpath.
     */
    @Bean
    @ConditionalOnMissingBean(LiveClientFactory.class)
    public LiveClientFactory liveClientFactory() {
        return new OfflineLiveClientFactory();
    }

    @Bean
    public MonitorMetrics monitorMetrics(ObjectProvider<MeterRegistry> registry) {
        return new MonitorMetrics(registry.getIfAvailable());
    }

    @Bean
    public LivenessProber livenessProber(LiveClientFactory clientFactory,
                                         ConfigurationWatcher watcher,
                                         MonitorMetrics metrics) {
        return new RetryingLivenessProber(clientFactory, watcher, metrics);
    }

    @Bean
    public ParallelPollEngine parallelPollEngine(LivenessProber prober,
                                                 @Qualifier("probeExecutor") Executor probeExecutor,
                                                 ConfigurationWatcher watcher) {
        return new ParallelPollEngine(prober, probeExecutor, watcher);
    }

    @Bean
    public StabilityTracker stabilityTracker(ConfigurationWatcher watcher, Clock clock, MonitorMetrics metrics) {
        return new StabilityTracker(watcher, clock, metrics);
    }

    @Bean
    public RecordingOrchestrator recordingOrchestrator(LiveClientFactory clientFactory,
                                                       ConfigurationWatcher watcher,
                                                       CsvMapper csvMapper,
                                                       SessionSummaryLog summaryLog,
                                                       ApplicationEventPublisher publisher,
                                                       MonitorMetrics metrics,
                                                       Clock clock) {
        SessionSinks.SinkFactory sinks = (file, kind) -> new CsvEventSink(file, kind.columns(), csvMapper);
        return new DefaultRecordingOrchestrator(clientFactory, watcher, sinks, summaryLog, publisher, metrics, clock);
    }

    @Bean
    public DisconnectConfirmationService disconnectConfirmationService(
            RecordingOrchestrator orchestrator,
            LivenessProber prober,
            ConfigurationWatcher watcher,
            @Qualifier("disconnectScheduler") TaskScheduler scheduler,
            Clock clock,
            MonitorMetrics metrics) {
        return new DisconnectConfirmationService(orchestrator, prober, watcher, scheduler, clock, metrics);
    }

    @Bean
    public ControlSignalChannel controlSignalChannel() {
        Path dir = Path.of(properties.getControlDir());
        return new ControlSignalChannel(dir.resolve(properties.getStopFile()), dir.resolve(properties.getPauseFile()),
                Duration.ofSeconds(properties.getDefaultPauseSeconds()));
    }

    @Bean
    public MonitorLoop monitorLoop(ConfigurationWatcher watcher,
                                   ParallelPollEngine pollEngine,
                                   StabilityTracker tracker,
                                   RecordingOrchestrator orchestrator,
                                   DisconnectConfirmationService disconnects,
                                   ControlSignalChannel control,
                                   StatusFileWriter statusWriter,
                                   @Qualifier("sessionExecutor") Executor sessionExecutor,
                                   MonitorMetrics metrics,
                                   Clock clock) {
        return new MonitorLoop(watcher, pollEngine, tracker, orchestrator, disconnects, control, statusWriter,
                sessionExecutor, Duration.ofSeconds(properties.getMinSleepSeconds()),
                Duration.ofSeconds(properties.getErrorBackoffSeconds()), metrics, clock);
    }

    /**
     * Starts the loop after context refresh. Disabled with {@code monitor.autostart=false}.
     */
    @Bean
    @ConditionalOnProperty(prefix = "monitor", name = "autostart", havingValue = "true", matchIfMissing = true)
    public MonitorRunner monitorRunner(MonitorLoop loop) {
        return new MonitorRunner(loop, properties);
    }
}
