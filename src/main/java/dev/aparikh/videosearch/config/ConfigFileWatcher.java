package dev.aparikh.videosearch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;

/**
 * Watches {@code videosearch.reload.file}. On every change the file is loaded as the
 * highest-precedence property source and a {@link SettingsReloadEvent} is published.
 * A rejected file is taken back out of the environment.
 */
@Component
class ConfigFileWatcher implements DisposableBean {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigFileWatcher.class);

    static final String PROPERTY_SOURCE_NAME = "videosearch-reload";

    private final ConfigurableEnvironment environment;
    private final ApplicationEventPublisher publisher;
    private final Path file;
    private volatile Thread worker;

    ConfigFileWatcher(ConfigurableEnvironment environment, ApplicationEventPublisher publisher,
                      ReloadProperties reload) {
        this.environment = environment;
        this.publisher = publisher;
        this.file = reload.getFile() == null ? null : reload.getFile().toAbsolutePath();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (file == null || worker != null) return;
        Thread thread = new Thread(this::watch, "config-file-watcher");
        thread.setDaemon(true);
        worker = thread;
        thread.start();
        LOG.info("Watching {} for settings changes", file);
    }

    @Override
    public void destroy() {
        Thread thread = worker;
        if (thread != null) {
            thread.interrupt();
        }
    }

    /**
     * Loads the file and publishes the reload.
     *
     * @throws IOException            when the file cannot be read or parsed
     * @throws ConfigurationException when the settings it holds are rejected
     */
    void apply() throws IOException {
        List<PropertySource<?>> loaded = new YamlPropertySourceLoader()
                .load(PROPERTY_SOURCE_NAME, new FileSystemResource(file));
        MutablePropertySources sources = environment.getPropertySources();
        PropertySource<?> previous = sources.remove(PROPERTY_SOURCE_NAME);
        if (!loaded.isEmpty()) {
            sources.addFirst(loaded.get(0));
        }
        try {
            publisher.publishEvent(new SettingsReloadEvent(file));
        } catch (RuntimeException e) {
            sources.remove(PROPERTY_SOURCE_NAME);
            if (previous != null) {
                sources.addFirst(previous);
            }
            throw e;
        }
    }

    /**
     * Watcher entry point: a failed reload is logged and the active settings stay in place.
     *
     * @return whether the new settings were applied
     */
    boolean reloadFromFile() {
        try {
            apply();
            return true;
        } catch (IOException | RuntimeException e) {
            LOG.error("Settings file {} not applied: {}", file, e.getMessage());
            return false;
        }
    }

    private void watch() {
        try (WatchService watcher = FileSystems.getDefault().newWatchService()) {
            file.getParent().register(watcher,
                    StandardWatchEventKinds.ENTRY_CREATE, StandardWatchEventKinds.ENTRY_MODIFY);
            while (!Thread.currentThread().isInterrupted()) {
                WatchKey key = watcher.take();
                boolean changed = false;
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (file.getFileName().equals(event.context())) {
                        changed = true;
                    }
                }
                key.reset();
                if (changed) {
                    reloadFromFile();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            LOG.error("Stopped watching {}", file, e);
        }
    }
}
