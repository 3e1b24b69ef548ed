package com.catalog.common.model;

import java.util.List;
import java.util.Map;

/**
 * A parser ("parses" block) advertised by a config source. Only carried through to the
 * directory; the executable plugins live in the resolver registry.
 */
public record ResolverDescriptor(String name, int type, String url, String ext,
                                 List<String> flags, Map<String, String> headers) {
    public ResolverDescriptor {
        flags = flags == null ? List.of() : List.copyOf(flags);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
