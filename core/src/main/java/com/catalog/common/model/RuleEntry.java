package com.catalog.common.model;

import java.util.List;

/** Host based blocking/sniffing rule from a config source. */
public record RuleEntry(String name, List<String> hosts, List<String> regex, List<String> script) {
    public RuleEntry {
        hosts = hosts == null ? List.of() : List.copyOf(hosts);
        regex = regex == null ? List.of() : List.copyOf(regex);
        script = script == null ? List.of() : List.copyOf(script);
    }
}
