package com.catalog.core.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

public class Configuration {
    // --- Aggregation ---
    public int parallelism = 8;
    public long fetchTimeoutMs = 10_000;
    public int failureThreshold = 3;

    // --- Scoring ---
    public int historyWindow = 10;
    public double decayFactor = 0.9;
    public int stalenessThresholdDays = 7;
    public double minQuality = 0.3;

    // --- Cache ---
    public long fragmentTtlMinutes = 30;
    public long directoryTtlMinutes = 10;

    // --- Resolution ---
    public long resolveTimeoutMs = 8_000;
    // Erfolgreiche Resolutions, pro Plugin ueberschreibbar via "cacheExpiryMinutes" / "timeoutMs"
    public long resolveCacheMinutes = 60;
    public String pluginDir = "plugins";

    // --- Persistence: "file" (JSON im tools-Ordner) oder "h2" ---
    public String storage = "file";
    public String databasePath = "tools/catalog.db";

    // Key = plugin id, Value = Settings (z.B. "user_agent" -> "...")
    public Map<String, Map<String, String>> pluginConfigs = new HashMap<>();

    public Duration fetchTimeout() { return Duration.ofMillis(fetchTimeoutMs); }
    public Duration resolveTimeout() { return Duration.ofMillis(resolveTimeoutMs); }
    public Duration fragmentTtl() { return Duration.ofMinutes(fragmentTtlMinutes); }
    public Duration directoryTtl() { return Duration.ofMinutes(directoryTtlMinutes); }
    public Duration stalenessThreshold() { return Duration.ofDays(stalenessThresholdDays); }

    public String getPluginSetting(String pluginId, String key, String defaultValue) {
        if (!pluginConfigs.containsKey(pluginId))
            return defaultValue;
        return pluginConfigs.get(pluginId).getOrDefault(key, defaultValue);
    }

    public void setPluginSetting(String pluginId, String key, String value) {
        pluginConfigs.computeIfAbsent(pluginId, k -> new HashMap<>()).put(key, value);
    }
}
