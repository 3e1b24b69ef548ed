package com.catalog.common.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A site in the merged directory: the winning source's {@link SiteEntry} plus every
 * source url that listed the same key.
 */
public final class AggregatedSiteEntry {
    private final SiteEntry site;
    private final String winningSourceId;
    private final Set<String> originUrls;
    private final double qualityScore;
    private final double reliabilityScore;
    private final long lastSeen;

    public AggregatedSiteEntry(SiteEntry site, String winningSourceId, Set<String> originUrls,
                               double qualityScore, double reliabilityScore, long lastSeen) {
        this.site = site;
        this.winningSourceId = winningSourceId;
        this.originUrls = Collections.unmodifiableSet(new LinkedHashSet<>(originUrls));
        this.qualityScore = qualityScore;
        this.reliabilityScore = reliabilityScore;
        this.lastSeen = lastSeen;
    }

    public SiteEntry getSite() { return site; }
    public String getKey() { return site.getKey(); }
    public String getName() { return site.getName(); }
    public SiteKind getKind() { return site.getKind(); }
    public String getEndpoint() { return site.getEndpoint(); }
    public String getWinningSourceId() { return winningSourceId; }
    public Set<String> getOriginUrls() { return originUrls; }
    public double getQualityScore() { return qualityScore; }
    public double getReliabilityScore() { return reliabilityScore; }
    public long getLastSeen() { return lastSeen; }

    @Override
    public String toString() {
        return String.format("AggregatedSiteEntry[%s q=%.2f r=%.2f from=%s]",
                getKey(), qualityScore, reliabilityScore, originUrls);
    }
}
