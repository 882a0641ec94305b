package com.recordhub.phoneauth.service;

public record SessionGrant(String sessionToken, String userId, String phoneNumber, int expiresInSeconds) {
}
