package de.bsommerfeld.cockpit.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import de.bsommerfeld.cockpit.core.event.ApplicationEventBus;
import de.bsommerfeld.cockpit.core.event.CockpitEvents.SettingsChanged;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Reads and writes {@code config.toml}. A missing file is created with the
 * defaults on first load so users have something to edit. Unknown keys are
 * ignored, which keeps older binaries working with newer files.
 */
public class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private final Path path;
    private final ApplicationEventBus eventBus;

    /**
     * @param eventBus receives {@link SettingsChanged} after every
     *                 {@link #update}; may be {@code null}
     */
    public ConfigLoader(Path path, ApplicationEventBus eventBus) {
        this.path = path;
        this.eventBus = eventBus;
    }

    public Path getPath() {
        return path;
    }

    public CockpitConfig load() throws IOException {
        if (!Files.exists(path)) {
            LOG.info("No configuration at {}, writing defaults", path.toAbsolutePath());
            CockpitConfig defaults = new CockpitConfig();
            save(defaults);
            return defaults;
        }
        LOG.info("Loading configuration from {}", path.toAbsolutePath());
        return MAPPER.readValue(path.toFile(), CockpitConfig.class);
    }

    public void save(CockpitConfig config) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        MAPPER.writeValue(path.toFile(), config);
    }

    /**
     * Applies {@code change}, persists the result and announces the touched
     * section.
     */
    public void update(CockpitConfig config, String section, Consumer<CockpitConfig> change) throws IOException {
        change.accept(config);
        save(config);
        LOG.info("Configuration section '{}' updated", section);
        if (eventBus != null)
            eventBus.publish(new SettingsChanged(section));
    }
}
