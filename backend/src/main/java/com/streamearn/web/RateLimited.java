package com.streamearn.web;

import com.streamearn.service.EndpointClass;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Assigns a handler (or every handler of a controller) to a rate-limit class.
 * Handlers without it are limited as {@link EndpointClass#PUBLIC}.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimited {

    EndpointClass value();
}
