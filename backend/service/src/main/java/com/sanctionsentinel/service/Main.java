package com.sanctionsentinel.service;

import com.sanctionsentinel.core.bus.EventBus;
import com.sanctionsentinel.core.diff.ChangeDetector;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.core.risk.RiskClassifier;
import com.sanctionsentinel.service.api.ApiServer;
import com.sanctionsentinel.service.api.DiagnosticsTracker;
import com.sanctionsentinel.service.config.ConfigLoader;
import com.sanctionsentinel.service.config.NotificationSettings;
import com.sanctionsentinel.service.config.ServiceConfig;
import com.sanctionsentinel.service.config.SourceSettings;
import com.sanctionsentinel.service.dedup.ContentDeduplicator;
import com.sanctionsentinel.service.download.DownloadManager;
import com.sanctionsentinel.service.http.HttpClientFactory;
import com.sanctionsentinel.service.ledger.RunLedger;
import com.sanctionsentinel.service.notify.ChatNotificationChannel;
import com.sanctionsentinel.service.notify.DevOutboxEmailSender;
import com.sanctionsentinel.service.notify.EmailNotificationChannel;
import com.sanctionsentinel.service.notify.LogNotificationChannel;
import com.sanctionsentinel.service.notify.NotificationChannel;
import com.sanctionsentinel.service.notify.NotificationDispatcher;
import com.sanctionsentinel.service.notify.WebhookNotificationChannel;
import com.sanctionsentinel.service.runtime.Orchestrator;
import com.sanctionsentinel.service.runtime.RetentionService;
import com.sanctionsentinel.service.runtime.SchedulerService;
import com.sanctionsentinel.service.store.EventCodec;
import com.sanctionsentinel.service.store.JsonFileSanctionsRepository;
import com.sanctionsentinel.service.store.JsonlEventStore;
import com.sanctionsentinel.service.store.PayloadArchive;
import com.sanctionsentinel.sources.api.SourceAdapter;
import com.sanctionsentinel.sources.api.SourceFetchConfig;
import com.sanctionsentinel.sources.api.SourceRegistry;
import com.sanctionsentinel.sources.hmt.UkHmtCsvAdapter;
import com.sanctionsentinel.sources.ofac.OfacSdnAdapter;
import com.sanctionsentinel.sources.un.UnConsolidatedAdapter;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configDir = Path.of(System.getenv().getOrDefault("CONFIG_DIR", "config"));
        ServiceConfig config = ConfigLoader.loadService(configDir).withEnvironment(System.getenv());
        List<SourceSettings> sourceSettings = ConfigLoader.loadSources(configDir);
        Clock clock = Clock.systemUTC();

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(Path.of(config.eventLogFile()));
        EventCodec.subscribeAll(eventBus, eventStore::append);
        DiagnosticsTracker diagnosticsTracker = new DiagnosticsTracker(eventBus, clock);

        JsonFileSanctionsRepository repository = new JsonFileSanctionsRepository(Path.of(config.stateFile()));
        PayloadArchive archive = config.archiveDir() == null || config.archiveDir().isBlank()
                ? PayloadArchive.disabled()
                : new PayloadArchive(Path.of(config.archiveDir()));

        HttpClient sharedHttpClient = HttpClientFactory.create(Duration.ofSeconds(15));
        SourceRegistry registry = buildRegistry(sourceSettings);
        RunLedger ledger = new RunLedger(repository, clock);
        ledger.recoverInterruptedRuns()
                .forEach(run -> LOGGER.warning("Recovered interrupted run " + run.runId() + " for " + run.source()));

        NotificationDispatcher dispatcher = new NotificationDispatcher(
                buildChannels(config.notifications(), sharedHttpClient),
                repository,
                eventBus,
                clock,
                config.notifications().retry().toPolicy(),
                config.notifications().batchWindow()
        );
        Orchestrator orchestrator = new Orchestrator(
                registry,
                new DownloadManager(sharedHttpClient, config.retry().toPolicy(), config.maxConcurrentDownloads()),
                new ContentDeduplicator(repository),
                new ChangeDetector(),
                new RiskClassifier(),
                ledger,
                repository,
                dispatcher,
                archive,
                eventBus,
                clock,
                config.orchestratorSettings()
        );

        List<SchedulerService.ScheduledSource> scheduled = new ArrayList<>();
        for (SourceSettings settings : sourceSettings) {
            if (!registry.supports(settings.source())) {
                LOGGER.warning("No adapter for configured source " + settings.source() + "; not scheduling it");
                continue;
            }
            scheduled.add(new SchedulerService.ScheduledSource(settings.source(), settings.interval(), settings.enabled()));
        }
        SchedulerService scheduler = new SchedulerService(scheduled, orchestrator, eventBus, clock, config.sweepInterval());
        RetentionService retention = new RetentionService(repository, archive, eventStore, clock, config.retention());
        scheduler.scheduleMaintenance("retention", config.retentionInterval(), retention::sweep);
        ApiServer apiServer = new ApiServer(config.apiPort(), orchestrator, eventStore, diagnosticsTracker);

        dispatcher.start();
        scheduler.start();
        apiServer.start();
        LOGGER.info("Sanctions service listening on port " + apiServer.actualPort() + " with channels "
                + dispatcher.channelIds());

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            apiServer.stop();
            orchestrator.shutdown();
            dispatcher.close();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Unable to read bundled logging.properties", e);
        }
    }

    static SourceRegistry buildRegistry(List<SourceSettings> sourceSettings) {
        Map<SanctionsSource, SourceSettings> bySource = new EnumMap<>(SanctionsSource.class);
        for (SourceSettings settings : sourceSettings) {
            bySource.put(settings.source(), settings);
        }
        return SourceRegistry.builder()
                .register(configured(new OfacSdnAdapter(), bySource, OfacSdnAdapter::new))
                .register(configured(new UnConsolidatedAdapter(), bySource, UnConsolidatedAdapter::new))
                .register(configured(new UkHmtCsvAdapter(), bySource, UkHmtCsvAdapter::new))
                .build();
    }

    static List<NotificationChannel> buildChannels(NotificationSettings settings, HttpClient httpClient) {
        List<NotificationChannel> channels = new ArrayList<>();
        if (settings.logEnabled()) {
            channels.add(new LogNotificationChannel());
        }
        if (settings.webhookUrl() != null && !settings.webhookUrl().isBlank()) {
            channels.add(new WebhookNotificationChannel(httpClient, URI.create(settings.webhookUrl()),
                    settings.requestTimeout()));
        }
        if (settings.chatWebhookUrl() != null && !settings.chatWebhookUrl().isBlank()) {
            channels.add(new ChatNotificationChannel(httpClient, URI.create(settings.chatWebhookUrl()),
                    settings.requestTimeout()));
        }
        if (!settings.emailRecipients().isEmpty()) {
            channels.add(new EmailNotificationChannel(new DevOutboxEmailSender(Path.of(settings.emailOutboxFile())),
                    settings.emailRecipients()));
        }
        if (channels.isEmpty()) {
            LOGGER.warning("No notification channels configured; change alerts will not be delivered");
        }
        return channels;
    }

    private static SourceAdapter configured(
            SourceAdapter defaults,
            Map<SanctionsSource, SourceSettings> bySource,
            Function<SourceFetchConfig, SourceAdapter> factory
    ) {
        SourceSettings settings = bySource.get(defaults.source());
        if (settings == null) {
            return defaults;
        }
        return factory.apply(settings.applyTo(defaults.fetchConfig()));
    }
}
