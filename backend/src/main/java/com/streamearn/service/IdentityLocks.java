package com.streamearn.service;

import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Striped monitors serializing requests of the same identity within this
 * process. Cross-instance serialization comes from the session row lock.
 */
@Component
public class IdentityLocks {
    private final Object[] stripes = new Object[256];

    public IdentityLocks() {
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new Object();
        }
    }

    public Object of(String identity) {
        int idx = Objects.hashCode(identity) & (stripes.length - 1);
        return stripes[idx];
    }
}
