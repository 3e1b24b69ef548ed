package com.catalog.core.plugin;

import com.catalog.core.config.Configuration;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Scans the plugin directory for descriptor/jar pairs ({@code name.json} + {@code name.jar})
 * and hands them to the {@link ResolverRegistry}. A broken pair is logged and skipped.
 *
 * <p>Descriptor format:
 * <pre>
 * { "id": "direct-link", "version": "1.0.0", "formats": ["video", "*"],
 *   "checksum": "sha256:...", "priority": 10, "jar": "optional-other-name.jar" }
 * </pre>
 */
public class PluginLoader {
    private static final Logger logger = LoggerFactory.getLogger(PluginLoader.class);

    private final ResolverRegistry registry;
    private final Configuration config;
    private final Gson gson = new Gson();
    private boolean configChanged;

    /** JSON shape of a descriptor file. */
    static class DescriptorFile {
        String id;
        String name;
        String version;
        List<String> formats;
        String checksum;
        int priority;
        String jar;
    }

    public PluginLoader(ResolverRegistry registry, Configuration config) {
        this.registry = registry;
        this.config = config;
    }

    public List<PluginDescriptor> loadPlugins(File pluginDir) {
        List<PluginDescriptor> result = new ArrayList<>();
        if (!pluginDir.exists()) {
            pluginDir.mkdirs();
        }

        File[] descriptors = pluginDir.listFiles((dir, name) -> name.endsWith(".json"));
        if (descriptors == null || descriptors.length == 0) {
            logger.info("No resolver plugins found in {}", pluginDir.getAbsolutePath());
            return result;
        }
        Arrays.sort(descriptors, Comparator.comparing(File::getName));

        for (File descriptorFile : descriptors) {
            try {
                PluginDescriptor descriptor = loadPluginFromFile(descriptorFile);
                if (descriptor != null) result.add(descriptor);
            } catch (IOException | JsonParseException | IllegalArgumentException e) {
                logger.error("Failed to read plugin descriptor: {}", descriptorFile.getName(), e);
            } catch (PluginChecksumException | PluginLoadException e) {
                logger.error("Failed to load plugin from {}: {}", descriptorFile.getName(), e.getMessage());
            }
        }
        logger.info("🔌 {} resolver plugin(s) loaded from {}", result.size(), pluginDir.getName());
        return result;
    }

    /**
     * Loads one descriptor and its jar.
     *
     * @return the descriptor, or null if the plugin is disabled in the configuration
     */
    public PluginDescriptor loadPluginFromFile(File descriptorFile) throws IOException {
        DescriptorFile raw;
        try (Reader r = Files.newBufferedReader(descriptorFile.toPath(), StandardCharsets.UTF_8)) {
            raw = gson.fromJson(r, DescriptorFile.class);
        }
        if (raw == null || raw.id == null || raw.checksum == null) {
            throw new JsonParseException("Descriptor needs at least 'id' and 'checksum'");
        }

        String jarName = raw.jar != null ? raw.jar : baseName(descriptorFile.getName()) + ".jar";
        File jarFile = new File(descriptorFile.getParentFile(), jarName);
        if (!jarFile.isFile()) {
            throw new IOException("Jar " + jarName + " not found for plugin " + raw.id);
        }

        if (config.getPluginSetting(raw.id, "enabled", null) == null) {
            logger.info("✨ New resolver plugin discovered: {}", raw.id);
            config.setPluginSetting(raw.id, "enabled", "true");
            configChanged = true;
        }
        if (!Boolean.parseBoolean(config.getPluginSetting(raw.id, "enabled", "true"))) {
            logger.info("Plugin {} is disabled in config.", raw.id);
            return null;
        }

        PluginDescriptor descriptor = new PluginDescriptor(raw.id, raw.name, raw.version,
                raw.formats, raw.checksum, raw.priority);
        byte[] bytes = Files.readAllBytes(jarFile.toPath());
        return registry.load(descriptor, bytes);
    }

    /** True if discovering plugins added entries to the configuration that should be saved. */
    public boolean isConfigChanged() {
        return configChanged;
    }

    private static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
