package com.recordhub.phoneauth.controller;

import com.recordhub.phoneauth.exception.UnauthorizedException;
import org.springframework.web.bind.annotation.RestController;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Base controller with common request helpers. Exception mapping lives in
 * {@link com.recordhub.phoneauth.exception.GlobalExceptionHandler}.
 */
@RestController
public abstract class BaseController {

    /**
     * Extract authenticated user ID from JWT token (set by authentication filter).
     */
    protected String extractUserId(HttpServletRequest request) {
        String userId = (String) request.getAttribute("userId");
        if (userId == null || userId.trim().isEmpty()) {
            throw new UnauthorizedException("No authenticated user");
        }
        return userId;
    }
}
