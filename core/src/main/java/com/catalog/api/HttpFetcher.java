package com.catalog.api;

import java.io.IOException;
import java.time.Duration;

/**
 * HTTP transport used to download config feeds. The default implementation is
 * {@link com.catalog.common.util.HttpUtils}.
 */
@FunctionalInterface
public interface HttpFetcher {
    byte[] fetch(String url, Duration timeout) throws IOException;
}
