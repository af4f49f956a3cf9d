package com.streamearn.service;

import lombok.Getter;

/**
 * Raised when ledger state contradicts its own bookkeeping or a monetary value
 * leaves the storable range. The affected period must stop paying out.
 */
@Getter
public class InvariantViolationException extends RuntimeException {

    private final String periodKey;

    public InvariantViolationException(String periodKey, String message) {
        super(message);
        this.periodKey = periodKey;
    }
}
