package com.streamearn.service;

/**
 * Rate-limit bucket an endpoint belongs to. Each class has its own ceiling.
 */
public enum EndpointClass {
    PUBLIC,
    AUTHENTICATION,
    FINANCIAL
}
