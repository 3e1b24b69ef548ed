package com.catalog.core.plugin;

import java.util.List;
import java.util.Objects;

/**
 * Declares a resolver plugin: identity, which site formats it handles ("video",
 * "video_api", "video_script", "other" or "*") and the checksum its bytes must match.
 */
public final class PluginDescriptor {
    private final String id;
    private final String name;
    private final String version;
    private final List<String> supportedFormats;
    private final String checksum;
    private final int priority;

    public PluginDescriptor(String id, String name, String version, List<String> supportedFormats,
                            String checksum, int priority) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name != null ? name : id;
        this.version = version != null ? version : "1.0.0";
        this.supportedFormats = supportedFormats == null ? List.of() : List.copyOf(supportedFormats);
        this.checksum = Objects.requireNonNull(checksum, "checksum");
        this.priority = priority;
    }

    public static PluginDescriptor of(String id, String checksum, int priority, String... formats) {
        return new PluginDescriptor(id, id, null, List.of(formats), checksum, priority);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getVersion() { return version; }
    public List<String> getSupportedFormats() { return supportedFormats; }
    public String getChecksum() { return checksum; }
    public int getPriority() { return priority; }

    public boolean supports(String format) {
        return supportedFormats.contains("*") || supportedFormats.contains(format);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PluginDescriptor)) return false;
        PluginDescriptor that = (PluginDescriptor) o;
        return priority == that.priority && id.equals(that.id) && name.equals(that.name)
                && version.equals(that.version) && supportedFormats.equals(that.supportedFormats)
                && checksum.equalsIgnoreCase(that.checksum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, version, supportedFormats, checksum.toLowerCase(), priority);
    }

    @Override
    public String toString() {
        return "PluginDescriptor[" + id + " v" + version + " prio=" + priority + " " + supportedFormats + "]";
    }
}
