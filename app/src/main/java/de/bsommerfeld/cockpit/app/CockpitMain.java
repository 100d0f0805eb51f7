package de.bsommerfeld.cockpit.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.cockpit.app.config.CockpitModule;
import de.bsommerfeld.cockpit.cache.CacheJanitor;
import de.bsommerfeld.cockpit.core.event.ApplicationEventBus;
import de.bsommerfeld.cockpit.core.util.CockpitPaths;
import de.bsommerfeld.cockpit.service.poll.BackgroundPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;

/**
 * Headless entry point. Boots the injector, starts polling and the cache
 * janitor, and runs until the JVM is asked to shut down.
 *
 * <p>
 * {@code --test} is shorthand for {@code -Dapp.mode=TEST}.
 */
public final class CockpitMain {

    static {
        // LOG_DIR must be set before logback initializes
        Path logDir = CockpitPaths.logsDir();
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (IOException e) {
            System.err.println("Failed to create log directory " + logDir + ": " + e.getMessage());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(CockpitMain.class);

    private CockpitMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        if (Arrays.asList(args).contains("--test"))
            System.setProperty("app.mode", "TEST");

        LOG.info("Starting {}", CockpitPaths.APP_NAME);
        Injector injector = Guice.createInjector(new CockpitModule());

        ApplicationEventBus eventBus = injector.getInstance(ApplicationEventBus.class);
        eventBus.subscribe(new AlertLogger());

        BackgroundPoller poller = injector.getInstance(BackgroundPoller.class);
        CacheJanitor janitor = injector.getInstance(CacheJanitor.class);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down");
            poller.stop();
            janitor.stop();
            eventBus.clearSubscribers();
            stopped.countDown();
        }, "cockpit-shutdown"));

        janitor.start();
        poller.start();
        stopped.await();
    }
}
