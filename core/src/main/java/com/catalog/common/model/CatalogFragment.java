package com.catalog.common.model;

import java.util.List;

/**
 * Parsed output of one config source. Immutable once produced.
 */
public final class CatalogFragment {
    private final String sourceId;
    private final String sourceUrl;
    private final long fetchedAt;
    private final List<SiteEntry> sites;
    private final List<ResolverDescriptor> resolvers;
    private final List<RuleEntry> rules;
    private final List<LiveEntry> lives;
    private final List<String> wallpapers;
    private final int rejectedEntries;

    public CatalogFragment(String sourceId, String sourceUrl, long fetchedAt,
                           List<SiteEntry> sites, List<ResolverDescriptor> resolvers,
                           List<RuleEntry> rules, List<LiveEntry> lives,
                           List<String> wallpapers, int rejectedEntries) {
        this.sourceId = sourceId;
        this.sourceUrl = sourceUrl;
        this.fetchedAt = fetchedAt;
        this.sites = List.copyOf(sites);
        this.resolvers = List.copyOf(resolvers);
        this.rules = List.copyOf(rules);
        this.lives = List.copyOf(lives);
        this.wallpapers = List.copyOf(wallpapers);
        this.rejectedEntries = rejectedEntries;
    }

    public String getSourceId() { return sourceId; }
    public String getSourceUrl() { return sourceUrl; }
    public long getFetchedAt() { return fetchedAt; }
    public List<SiteEntry> getSites() { return sites; }
    public List<ResolverDescriptor> getResolvers() { return resolvers; }
    public List<RuleEntry> getRules() { return rules; }
    public List<LiveEntry> getLives() { return lives; }
    public List<String> getWallpapers() { return wallpapers; }

    /** Entries dropped during validation (missing key/name/url etc.). */
    public int getRejectedEntries() { return rejectedEntries; }
}
