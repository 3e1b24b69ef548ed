package com.catalog.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Locale;

/**
 * Loads and saves {@code config.json} in the tools folder. Missing keys keep their defaults,
 * so an older file picks up new settings on the next save.
 */
public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    private final File toolsDir;
    private final File configFile;
    private final Gson gson;
    private Configuration configuration;

    public ConfigManager(File toolsDir) {
        this.toolsDir = toolsDir;
        // Liegt zentral im tools-Ordner
        this.configFile = new File(toolsDir, "config.json");
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        load();
    }

    public Configuration getConfig() {
        return configuration;
    }

    public File getConfigFile() {
        return configFile;
    }

    public File getToolsDir() {
        return toolsDir;
    }

    /** Writes via a temp file so a crash never leaves a half-written config behind. */
    public synchronized void save() {
        Path target = configFile.toPath();
        Path tmp = target.resolveSibling(configFile.getName() + ".tmp");
        try {
            Files.createDirectories(toolsDir.toPath());
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                gson.toJson(configuration, w);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            logger.info("Configuration saved to disk.");
        } catch (IOException e) {
            logger.error("Failed to save configuration to {}", configFile, e);
        }
    }

    private void load() {
        if (!configFile.exists()) {
            configuration = new Configuration();
            logger.info("No config file found. Created default configuration.");
            save(); // Defaults schreiben
            return;
        }

        try (Reader r = Files.newBufferedReader(configFile.toPath(), StandardCharsets.UTF_8)) {
            configuration = gson.fromJson(r, Configuration.class);
            if (configuration == null) configuration = new Configuration();
            normalize(configuration);
            logger.info("Configuration loaded from {}", configFile.getName());
        } catch (IOException | JsonParseException e) {
            logger.error("Failed to load configuration, using defaults", e);
            configuration = new Configuration();
        }
    }

    /** Repairs values a hand-edited file may have nulled out. */
    private static void normalize(Configuration config) {
        if (config.pluginConfigs == null) config.pluginConfigs = new HashMap<>();
        if (config.pluginDir == null || config.pluginDir.isBlank()) config.pluginDir = "plugins";
        config.storage = config.storage == null ? "file" : config.storage.trim().toLowerCase(Locale.ROOT);
    }
}
