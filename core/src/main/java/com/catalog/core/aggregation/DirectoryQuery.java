package com.catalog.core.aggregation;

import com.catalog.common.model.AggregatedDirectory;
import com.catalog.common.model.AggregatedSiteEntry;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-side view over a directory: category filter, quality cut-off, keyword search,
 * sorting and paging. Never touches the network.
 */
public class DirectoryQuery {
    public static final double DEFAULT_MIN_QUALITY = 0.3;

    private String category;
    private String keyword;
    private boolean includeInactive = false;
    private double minQuality = DEFAULT_MIN_QUALITY;
    private SortOption sortBy = SortOption.QUALITY;
    private int page = 1;
    private int pageSize = 20;

    public static DirectoryQuery all() {
        return new DirectoryQuery().includeInactive(true).pageSize(Integer.MAX_VALUE);
    }

    public DirectoryQuery category(String categoryId) { this.category = categoryId; return this; }
    public DirectoryQuery keyword(String keyword) { this.keyword = keyword; return this; }
    public DirectoryQuery includeInactive(boolean include) { this.includeInactive = include; return this; }
    public DirectoryQuery minQuality(double min) { this.minQuality = min; return this; }
    public DirectoryQuery sortBy(SortOption option) { this.sortBy = option; return this; }
    public DirectoryQuery page(int page) { this.page = Math.max(1, page); return this; }
    public DirectoryQuery pageSize(int size) { this.pageSize = Math.max(1, size); return this; }

    public DirectoryPage apply(AggregatedDirectory directory) {
        Stream<AggregatedSiteEntry> stream = directory.getSites().stream();

        if (category != null) {
            stream = stream.filter(e -> e.getKind().getFormat().equals(category));
        }
        if (!includeInactive) {
            // "inaktive" Seiten = Qualität unter der Schwelle
            stream = stream.filter(e -> e.getQualityScore() > minQuality);
        }

        List<AggregatedSiteEntry> matched;
        if (keyword != null && !keyword.isBlank()) {
            String term = keyword.trim().toLowerCase(Locale.ROOT);
            matched = stream.filter(e -> relevance(e, term) > e.getQualityScore() * 2)
                    .sorted(Comparator.comparingDouble((AggregatedSiteEntry e) -> relevance(e, term)).reversed()
                            .thenComparing(AggregatedSiteEntry::getKey))
                    .collect(Collectors.toList());
        } else {
            matched = stream.sorted(sortBy.comparator()).collect(Collectors.toList());
        }

        int total = matched.size();
        long from = Math.min((long) (page - 1) * pageSize, total);
        long to = Math.min(from + pageSize, total);
        return new DirectoryPage(matched.subList((int) from, (int) to), total, page, pageSize);
    }

    /** name match 3, key match 2, ext match 1, plus twice the quality score. */
    static double relevance(AggregatedSiteEntry e, String term) {
        double score = 0;
        if (e.getName().toLowerCase(Locale.ROOT).contains(term)) score += 3;
        if (e.getKey().toLowerCase(Locale.ROOT).contains(term)) score += 2;
        String ext = e.getSite().getExtension().getExtAsString();
        if (ext != null && ext.toLowerCase(Locale.ROOT).contains(term)) score += 1;
        return score + e.getQualityScore() * 2;
    }
}
