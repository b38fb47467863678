package com.dingdangmaoup.dock.access;

public enum Capability {
    PULL,
    PUSH,
    DELETE;

    public boolean isMutating() {
        return this != PULL;
    }
}
