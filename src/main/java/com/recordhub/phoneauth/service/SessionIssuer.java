package com.recordhub.phoneauth.service;

/**
 * Mints the session credential handed out after a successful verification.
 */
public interface SessionIssuer {

    String issue(String userId);

    int getAccessTokenExpirationSeconds();
}
