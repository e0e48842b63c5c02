package com.trendsentinel.service;

import com.trendsentinel.collectors.cycle.CycleOrchestrator;
import com.trendsentinel.collectors.cycle.Sleeper;
import com.trendsentinel.collectors.reddit.RedditDocumentSource;
import com.trendsentinel.core.bus.EventBus;
import com.trendsentinel.core.text.Stopwords;
import com.trendsentinel.core.text.Tokenizer;
import com.trendsentinel.core.trend.FrequencyAggregator;
import com.trendsentinel.core.trend.TrendClassifier;
import com.trendsentinel.service.api.ApiServer;
import com.trendsentinel.service.api.CycleStatusTracker;
import com.trendsentinel.service.config.ConfigLoader;
import com.trendsentinel.service.config.MonitorConfig;
import com.trendsentinel.service.runtime.CycleScheduler;
import com.trendsentinel.service.store.JsonlTrendStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configDir = Path.of(System.getenv().getOrDefault("TREND_CONFIG_DIR", "config"));
        MonitorConfig config = ConfigLoader.loadMonitor(configDir);
        Clock clock = Clock.systemUTC();

        EventBus eventBus = new EventBus();
        CycleStatusTracker statusTracker = new CycleStatusTracker(eventBus);
        JsonlTrendStore store = new JsonlTrendStore(Path.of(config.dataDir()), clock);

        Stopwords stopwords = Stopwords.defaults().withExtras(config.extraStopwords());
        LOGGER.info("Loaded " + stopwords.size() + " stopwords");

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        CycleOrchestrator orchestrator = new CycleOrchestrator(
                new RedditDocumentSource(httpClient, config.redditSourceConfig()),
                store,
                new Tokenizer(stopwords),
                new FrequencyAggregator(),
                new TrendClassifier(config.trendThresholds()),
                config.cycleSettings(),
                Sleeper.system(),
                clock,
                eventBus
        );

        CycleScheduler scheduler = new CycleScheduler(orchestrator::runCycle, config.cycleInterval(), config.errorBackoff());
        ApiServer apiServer = new ApiServer(resolvePort(config), store, statusTracker, clock);

        apiServer.start();
        scheduler.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Stop requested; waiting for the current cycle to finish");
            scheduler.shutdown(Duration.ofMinutes(2));
            apiServer.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static int resolvePort(MonitorConfig config) {
        String raw = System.getenv("PORT");
        if (raw == null || raw.isBlank()) {
            return config.apiPort();
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            LOGGER.warning("Ignoring invalid PORT=" + raw + "; using " + config.apiPort());
            return config.apiPort();
        }
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
            LOGGER.warning("Could not read bundled logging.properties: " + e.getMessage());
        }
    }
}
