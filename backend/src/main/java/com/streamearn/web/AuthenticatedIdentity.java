package com.streamearn.web;

/**
 * Headers set by the authentication gateway in front of this service.
 */
public final class AuthenticatedIdentity {

    public static final String IDENTITY_HEADER = "X-Authenticated-Identity";
    public static final String ROLE_HEADER = "X-Authenticated-Role";

    private AuthenticatedIdentity() {
    }
}
