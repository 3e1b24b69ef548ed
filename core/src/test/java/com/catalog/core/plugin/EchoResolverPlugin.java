package com.catalog.core.plugin;

import com.catalog.api.ResolveRequest;
import com.catalog.api.ResolverPlugin;
import com.catalog.common.model.ResolvedStream;

import java.util.Optional;

/** Service implementation packed into generated jars by the loader tests. */
public class EchoResolverPlugin implements ResolverPlugin {

    @Override
    public String getId() {
        return "echo";
    }

    @Override
    public String getVersion() {
        return "0.1";
    }

    @Override
    public Optional<ResolvedStream> resolve(ResolveRequest request) {
        return Optional.of(ResolvedStream.of(request.entry().getEndpoint()));
    }
}
