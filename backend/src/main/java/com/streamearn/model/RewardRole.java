package com.streamearn.model;

/**
 * Role under which an identity earns: consuming content or having created it.
 */
public enum RewardRole {
    ARTIST,
    LISTENER
}
