package com.catalog.core.plugin;

public enum LoadState {
    UNVERIFIED, LOADED, REJECTED
}
