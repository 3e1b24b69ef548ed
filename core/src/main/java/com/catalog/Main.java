package com.catalog;

import com.catalog.common.model.ConfigSource;
import com.catalog.core.CatalogException;
import com.catalog.core.CatalogStatistics;
import com.catalog.core.DirectoryView;
import com.catalog.core.Kernel;
import com.catalog.core.config.ConfigManager;
import com.catalog.core.config.ConfigValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.net.URI;
import java.util.Locale;

/**
 * {@code Main <config-url>...}: registers the given feeds, aggregates once and prints the
 * statistics. Sources persist in the tools folder between runs.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        logger.info("🚀 Starting CatalogFramework...");
        logger.info("📄 Log File: logs/latest.log");

        ConfigManager configManager = new ConfigManager(new File("tools"));
        try {
            new ConfigValidator().validateAndReport(configManager.getConfig());
        } catch (IllegalStateException e) {
            logger.error("Invalid configuration in {}: {}", configManager.getConfigFile(), e.getMessage());
            System.exit(2);
            return;
        }

        int exitCode = 0;
        try (Kernel kernel = Kernel.create(configManager)) {
            kernel.open();
            kernel.loadPlugins();

            for (String url : args) {
                registerIfAbsent(kernel, url);
            }
            if (kernel.getSources().isEmpty()) {
                logger.warn("No config sources registered. Usage: Main <config-url>...");
                return;
            }

            DirectoryView view = kernel.getDirectory(true);
            if (view.isStale()) {
                logger.warn("⚠️ Refresh failed, showing directory from {}", view.getStoredAt());
            }
            view.getDirectory().getFailures().forEach(f ->
                    logger.warn("   {} [{}] {}", f.sourceId(), f.kind(), f.message()));

            CatalogStatistics stats = kernel.getStatistics();
            logger.info("📊 {} sources ({} active), {} sites ({} unique) in {} categories",
                    stats.totalSources(), stats.activeSources(), stats.totalSites(),
                    stats.uniqueSites(), stats.categories());
            logger.info("📊 fetch success {}%, avg latency {} ms, {} resolver plugin(s)",
                    String.format(Locale.ROOT, "%.1f", stats.successRate() * 100),
                    String.format(Locale.ROOT, "%.0f", stats.averageFetchLatencyMs()),
                    stats.loadedPlugins());
        } catch (CatalogException e) {
            logger.error("❌ {}", e.getMessage());
            exitCode = 1;
        } catch (Exception e) {
            logger.error("CRITICAL FAILURE", e);
            exitCode = 1;
        }
        if (exitCode != 0) System.exit(exitCode);
    }

    private static void registerIfAbsent(Kernel kernel, String url) {
        boolean known = kernel.getSources().stream().anyMatch(s -> s.getUrl().equals(url));
        if (known) {
            logger.info("Source already registered: {}", url);
            return;
        }
        String host = URI.create(url).getHost();
        String id = (host != null ? host : "source") + "-" + (kernel.getSources().size() + 1);
        kernel.registerSource(ConfigSource.of(id, url, host != null ? host : url, 0));
        logger.info("➕ Registered source {} -> {}", id, url);
    }
}
