package com.activitytracker.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;

/**
 * Reads and writes {@code config.json} and notifies listeners when the file changes on disk.
 */
public class FileConfigManager implements ConfigManager {

    private static final Logger log = LoggerFactory.getLogger(FileConfigManager.class);

    private final ObjectMapper mapper;
    private final List<ConfigListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService watcherExecutor;
    private WatchService watchService;
    private volatile boolean watching;

    public FileConfigManager() {
        this.mapper = new ObjectMapper()
                .registerModule(new ParameterNamesModule())
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        this.watcherExecutor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("config-watcher"));
    }

    @Override
    public AppConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        ensureParentDirectory(path);
        if (Files.notExists(path) || Files.size(path) == 0) {
            AppConfig defaults = AppConfig.defaults();
            save(path, defaults);
            log.info("Wrote default configuration to {}", path);
            return defaults;
        }
        try (var reader = Files.newBufferedReader(path)) {
            AppConfig config = mapper.readValue(reader, AppConfig.class);
            log.debug("Loaded configuration from {}", path);
            return config;
        } catch (JsonProcessingException ex) {
            throw new IOException("Malformed configuration file " + path + ": " + ex.getOriginalMessage(), ex);
        }
    }

    @Override
    public void save(Path path, AppConfig config) throws IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(config, "config");
        ensureParentDirectory(path);
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try (var writer = Files.newBufferedWriter(temp)) {
            mapper.writeValue(writer, config);
        }
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Configuration saved to {}", path);
    }

    @Override
    public void registerListener(ConfigListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void startWatching(Path configFile) throws IOException {
        Objects.requireNonNull(configFile, "configFile");
        if (watching) {
            return;
        }
        ensureParentDirectory(configFile);
        Path dir = configFile.toAbsolutePath().getParent();
        watchService = dir.getFileSystem().newWatchService();
        dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY);
        watching = true;
        watcherExecutor.submit(() -> runWatcherLoop(configFile.toAbsolutePath()));
        log.info("Watching configuration changes in {}", dir);
    }

    private void runWatcherLoop(Path configFile) {
        while (watching) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception ex) {
                log.debug("Config watch service stopped", ex);
                break;
            }
            boolean changed = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.context() instanceof Path eventPath
                        && configFile.getParent().resolve(eventPath).equals(configFile)) {
                    changed = true;
                }
            }
            if (changed) {
                reloadAndNotify(configFile);
            }
            if (!key.reset()) {
                break;
            }
        }
    }

    private void reloadAndNotify(Path configFile) {
        AppConfig reloaded;
        try {
            reloaded = load(configFile);
        } catch (IOException ex) {
            log.warn("Ignoring configuration change: {}", ex.getMessage());
            return;
        }
        for (ConfigListener listener : listeners) {
            try {
                listener.onConfigReload(reloaded);
            } catch (RuntimeException ex) {
                log.error("Configuration listener failed", ex);
            }
        }
    }

    @Override
    public void close() {
        watching = false;
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException ex) {
                log.debug("Error closing config watch service", ex);
            }
        }
        watcherExecutor.shutdownNow();
    }

    private void ensureParentDirectory(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && Files.notExists(parent)) {
            Files.createDirectories(parent);
        }
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final String prefix;
        private int counter = 0;

        private DaemonThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public synchronized Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + "-" + counter++);
            thread.setDaemon(true);
            return thread;
        }
    }
}
