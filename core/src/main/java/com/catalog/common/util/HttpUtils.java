package com.catalog.common.util;

import com.catalog.api.HttpFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.time.Duration;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Plain {@link HttpURLConnection} transport for config feeds. Follows redirects, unpacks gzip
 * and treats any status of 400 or above as a failure.
 */
public class HttpUtils implements HttpFetcher {
    private static final Logger logger = LoggerFactory.getLogger(HttpUtils.class);
    private static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) CatalogFramework/1.0";

    private final Map<String, String> headers;

    public HttpUtils() {
        this(Map.of());
    }

    public HttpUtils(Map<String, String> headers) {
        this.headers = Map.copyOf(headers);
    }

    @Override
    public byte[] fetch(String urlStr, Duration timeout) throws IOException {
        HttpURLConnection conn = (HttpURLConnection) new URL(urlStr).openConnection();
        int millis = (int) Math.min(Integer.MAX_VALUE, Math.max(1, timeout.toMillis()));
        conn.setConnectTimeout(millis);
        conn.setReadTimeout(millis);
        conn.setInstanceFollowRedirects(true);
        conn.setRequestMethod("GET");
        conn.setRequestProperty("User-Agent", DEFAULT_USER_AGENT);
        conn.setRequestProperty("Accept-Encoding", "gzip");
        headers.forEach(conn::setRequestProperty);

        try {
            int code = conn.getResponseCode();
            if (code >= 400) {
                throw new IOException("HTTP " + code + " for " + urlStr);
            }
            InputStream in = conn.getInputStream();
            if ("gzip".equalsIgnoreCase(conn.getContentEncoding())) {
                in = new GZIPInputStream(in);
            }
            try (InputStream body = in) {
                byte[] data = body.readAllBytes();
                logger.debug("GET {} -> {} ({} bytes)", urlStr, code, data.length);
                return data;
            }
        } finally {
            conn.disconnect();
        }
    }
}
