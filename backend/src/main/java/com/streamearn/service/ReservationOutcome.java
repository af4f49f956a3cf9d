package com.streamearn.service;

public enum ReservationOutcome {
    RESERVED,
    INSUFFICIENT_FUNDS,
    HALTED
}
