package com.catalog.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the merged catalog. Replaced wholesale on every successful
 * aggregation cycle; readers keep their reference until they ask again.
 */
public final class AggregatedDirectory {
    private final List<AggregatedSiteEntry> sites;
    private final List<CategoryInfo> categories;
    private final long generatedAt;
    private final List<SourceFailure> failures;
    private final List<LiveEntry> lives;
    private final List<RuleEntry> rules;
    private final List<ResolverDescriptor> resolvers;
    private final List<String> wallpapers;
    private final int sourceCount;
    private final int successfulSources;

    // Gson skips transient fields, rebuilt on first lookup
    private transient volatile Map<String, AggregatedSiteEntry> byKey;

    public AggregatedDirectory(List<AggregatedSiteEntry> sites, List<CategoryInfo> categories,
                               long generatedAt, List<SourceFailure> failures,
                               List<LiveEntry> lives, List<RuleEntry> rules,
                               List<ResolverDescriptor> resolvers, List<String> wallpapers,
                               int sourceCount, int successfulSources) {
        this.sites = List.copyOf(sites);
        this.categories = List.copyOf(categories);
        this.generatedAt = generatedAt;
        this.failures = List.copyOf(failures);
        this.lives = List.copyOf(lives);
        this.rules = List.copyOf(rules);
        this.resolvers = List.copyOf(resolvers);
        this.wallpapers = List.copyOf(wallpapers);
        this.sourceCount = sourceCount;
        this.successfulSources = successfulSources;
    }

    public List<AggregatedSiteEntry> getSites() { return Collections.unmodifiableList(sites); }
    public List<CategoryInfo> getCategories() { return Collections.unmodifiableList(categories); }
    public long getGeneratedAt() { return generatedAt; }
    public List<SourceFailure> getFailures() { return Collections.unmodifiableList(failures); }
    public List<LiveEntry> getLives() { return Collections.unmodifiableList(lives); }
    public List<RuleEntry> getRules() { return Collections.unmodifiableList(rules); }
    public List<ResolverDescriptor> getResolvers() { return Collections.unmodifiableList(resolvers); }

    /** Background images in source precedence order. Snapshots written before this field existed have none. */
    public List<String> getWallpapers() {
        return wallpapers == null ? List.of() : Collections.unmodifiableList(wallpapers);
    }

    public int getSourceCount() { return sourceCount; }
    public int getSuccessfulSources() { return successfulSources; }

    public Optional<AggregatedSiteEntry> find(String key) {
        Map<String, AggregatedSiteEntry> index = byKey;
        if (index == null) {
            index = new LinkedHashMap<>();
            for (AggregatedSiteEntry e : sites) index.put(e.getKey(), e);
            byKey = index;
        }
        return Optional.ofNullable(index.get(key));
    }

    /** Number of (source, site) contributions before dedup. */
    public int getTotalSiteCount() {
        return sites.stream().mapToInt(s -> s.getOriginUrls().size()).sum();
    }

    public int getUniqueSiteCount() {
        return sites.size();
    }
}
