package com.recordhub.phoneauth.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OtpStatusResponse {
    private Boolean hasPendingOtp;
    private int attemptsRemaining;
    private Instant expiresAt;
    private Boolean canResend;
}
