package com.streamearn.service;

/**
 * Where an identity stands relative to its last accepted activity.
 */
public enum SessionPhase {
    /** No prior activity, or the cooldown has fully elapsed. */
    NEW_SESSION,
    /** Last activity is within the idle timeout; the open session continues. */
    CONTINUING,
    /** The prior session went idle and the cooldown has not elapsed yet. */
    COOLDOWN
}
