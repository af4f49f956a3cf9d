package com.streamearn.service;

import lombok.Getter;

@Getter
public class PoolNotFoundException extends RuntimeException {

    private final String periodKey;

    public PoolNotFoundException(String periodKey) {
        super("No reward pool exists for period " + periodKey);
        this.periodKey = periodKey;
    }
}
