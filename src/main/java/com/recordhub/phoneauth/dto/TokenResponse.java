package com.recordhub.phoneauth.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Session handed out after a successful verification.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {
    private String accessToken;
    private String tokenType;
    private int expiresIn;
    private String userId;
    private String phoneNumber;
}
