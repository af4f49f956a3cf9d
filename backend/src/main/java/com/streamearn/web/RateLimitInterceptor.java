package com.streamearn.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamearn.controller.dto.ActivityResultResponse;
import com.streamearn.service.EndpointClass;
import com.streamearn.service.RateController;
import com.streamearn.service.RateDecision;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;

/**
 * Applies the rate controller to every API handler before business logic runs.
 * Authenticated and financial endpoints are keyed by the identity header, or by
 * client address when the request carries none. Public endpoints are always
 * keyed by client address since nothing vouches for the header there.
 */
public class RateLimitInterceptor implements HandlerInterceptor {

    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    private final RateController rateController;
    private final ObjectMapper objectMapper;

    public RateLimitInterceptor(RateController rateController, ObjectMapper objectMapper) {
        this.rateController = rateController;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }

        EndpointClass endpointClass = resolveEndpointClass(handlerMethod);
        RateDecision decision = rateController.admit(resolveKey(request, endpointClass), endpointClass);
        if (decision.allowed()) {
            response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
            return true;
        }

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        response.setHeader(REMAINING_HEADER, "0");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), ActivityResultResponse.throttled(decision.retryAfterSeconds()));
        return false;
    }

    static EndpointClass resolveEndpointClass(HandlerMethod handlerMethod) {
        RateLimited methodLevel = handlerMethod.getMethodAnnotation(RateLimited.class);
        if (methodLevel != null) {
            return methodLevel.value();
        }
        RateLimited typeLevel = handlerMethod.getBeanType().getAnnotation(RateLimited.class);
        return typeLevel != null ? typeLevel.value() : EndpointClass.PUBLIC;
    }

    static String resolveKey(HttpServletRequest request, EndpointClass endpointClass) {
        if (endpointClass != EndpointClass.PUBLIC) {
            String identity = request.getHeader(AuthenticatedIdentity.IDENTITY_HEADER);
            if (identity != null && !identity.isBlank()) {
                return identity.trim();
            }
        }
        return "addr:" + request.getRemoteAddr();
    }
}
