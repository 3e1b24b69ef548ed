package com.plugins.directlink;

import com.catalog.api.ResolveRequest;
import com.catalog.api.ResolverPlugin;
import com.catalog.common.model.AggregatedSiteEntry;
import com.catalog.common.model.ResolvedStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Resolver for entries that already point at a playable file or playlist
 * (HLS, DASH, mp4, flv ...). No site-specific logic: the endpoint, or a url in the
 * entry's ext field, is handed back with the site's request headers.
 */
public class DirectLinkResolver implements ResolverPlugin {
    private static final Logger logger = LoggerFactory.getLogger(DirectLinkResolver.class);

    public static final String ID = "direct-link";
    private static final Set<String> PLAYABLE = Set.of("m3u8", "mpd", "mp4", "flv", "mkv", "ts", "webm", "m4v");

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public Optional<ResolvedStream> resolve(ResolveRequest request) {
        AggregatedSiteEntry entry = request.entry();
        List<String> urls = new ArrayList<>();
        if (isPlayable(entry.getEndpoint())) urls.add(entry.getEndpoint());

        String ext = entry.getSite().getExtension().getExtAsString();
        if (isPlayable(ext) && !urls.contains(ext)) urls.add(ext);

        if (urls.isEmpty()) {
            logger.debug("{} is not a direct link", entry.getKey());
            return Optional.empty();
        }
        return Optional.of(new ResolvedStream(urls, entry.getSite().getHeaders(), null));
    }

    static boolean isPlayable(String url) {
        if (url == null || url.isBlank()) return false;
        String path;
        try {
            URI uri = URI.create(url.trim());
            if (uri.getScheme() == null || !uri.getScheme().toLowerCase(Locale.ROOT).startsWith("http")) return false;
            path = uri.getPath();
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (path == null) return false;
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot < path.lastIndexOf('/')) return false;
        return PLAYABLE.contains(path.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
