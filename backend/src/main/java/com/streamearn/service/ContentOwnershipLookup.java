package com.streamearn.service;

import java.util.Optional;

/**
 * Resolves the identity that owns a piece of content. Content metadata is
 * maintained by another service; this core only reads ownership.
 */
public interface ContentOwnershipLookup {

    Optional<String> findOwner(String contentId);
}
