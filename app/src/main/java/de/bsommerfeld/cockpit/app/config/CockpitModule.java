package de.bsommerfeld.cockpit.app.config;

import com.google.inject.AbstractModule;
import com.google.inject.Module;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.cockpit.app.source.TestSourceModule;
import de.bsommerfeld.cockpit.cache.CacheJanitor;
import de.bsommerfeld.cockpit.cache.SqlCacheStore;
import de.bsommerfeld.cockpit.cache.TieredCache;
import de.bsommerfeld.cockpit.core.config.ApplicationMode;
import de.bsommerfeld.cockpit.core.config.CacheConfig;
import de.bsommerfeld.cockpit.core.config.CockpitConfig;
import de.bsommerfeld.cockpit.core.config.ConfigLoader;
import de.bsommerfeld.cockpit.core.config.EventConfig;
import de.bsommerfeld.cockpit.core.config.IncidentConfig;
import de.bsommerfeld.cockpit.core.config.PollerConfig;
import de.bsommerfeld.cockpit.core.config.PullRequestConfig;
import de.bsommerfeld.cockpit.core.config.SearchConfig;
import de.bsommerfeld.cockpit.core.event.ApplicationEventBus;
import de.bsommerfeld.cockpit.core.util.CockpitPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Composition root. Loads {@code config.toml}, binds the configuration
 * sections, and creates the single event bus, cache and janitor instances.
 * Aggregators, the search service and the poller are just-in-time singletons.
 *
 * <p>
 * Sources depend on the {@link ApplicationMode}: {@code TEST} installs
 * {@link TestSourceModule}, {@code PROD} installs the integration module
 * handed to the constructor and fails injector creation without one.
 */
public class CockpitModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(CockpitModule.class);

    private final Path configPath;
    private final Path dataDir;
    private final ApplicationMode mode;
    private final Module integrations;

    public CockpitModule() {
        this(null);
    }

    /**
     * @param integrations binds the {@code PullRequestSource},
     *                     {@code TicketSource} and {@code IncidentSource} used
     *                     in PROD mode; ignored in TEST mode
     */
    public CockpitModule(Module integrations) {
        this(CockpitPaths.configFile(), CockpitPaths.dataDir(), ApplicationMode.get(), integrations);
    }

    public CockpitModule(Path configPath, Path dataDir, ApplicationMode mode, Module integrations) {
        this.configPath = configPath;
        this.dataDir = dataDir;
        this.mode = mode;
        this.integrations = integrations;
    }

    @Override
    protected void configure() {
        CockpitConfig config;
        try {
            config = new ConfigLoader(configPath, null).load();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + configPath, e);
        }

        bind(CockpitConfig.class).toInstance(config);
        bind(CacheConfig.class).toInstance(config.getCache());
        bind(PollerConfig.class).toInstance(config.getPoller());
        bind(PullRequestConfig.class).toInstance(config.getPullRequests());
        bind(IncidentConfig.class).toInstance(config.getIncidents());
        bind(SearchConfig.class).toInstance(config.getSearch());
        bind(EventConfig.class).toInstance(config.getEvents());
        bind(Clock.class).toInstance(Clock.systemUTC());

        LOG.info("Application mode: {}", mode);
        if (mode.isTest()) {
            install(new TestSourceModule());
        } else if (integrations != null) {
            install(integrations);
        } else {
            addError("PROD mode needs an integration module binding PullRequestSource, TicketSource and "
                    + "IncidentSource; start with -Dapp.mode=TEST to use generated data");
        }
    }

    @Provides
    @Singleton
    ApplicationEventBus eventBus(EventConfig config, Clock clock) {
        return new ApplicationEventBus(config.getHistorySize(), clock);
    }

    /**
     * Loader for runtime settings changes; announces every update on the bus.
     */
    @Provides
    @Singleton
    ConfigLoader configLoader(ApplicationEventBus eventBus) {
        return new ConfigLoader(configPath, eventBus);
    }

    @Provides
    @Singleton
    TieredCache cache(CacheConfig config, Clock clock) {
        if (!config.isPersistent()) {
            LOG.info("Cache is memory-only ({} entries)", config.getMemoryCapacity());
            return new TieredCache(config.getMemoryCapacity(), null, clock, config.getLockTimeout());
        }
        Path databaseFile = dataDir.resolve(config.getDatabaseFile());
        LOG.info("Cache database at {}", databaseFile.toAbsolutePath());
        return new TieredCache(config.getMemoryCapacity(), new SqlCacheStore(databaseFile), clock,
                config.getLockTimeout());
    }

    @Provides
    @Singleton
    CacheJanitor cacheJanitor(TieredCache cache, ApplicationEventBus eventBus, CacheConfig config) {
        return new CacheJanitor(cache, eventBus, config.getCleanupInterval());
    }
}
