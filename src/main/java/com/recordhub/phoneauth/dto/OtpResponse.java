package com.recordhub.phoneauth.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OtpResponse {
    private String status;
    private String message;
    private String referenceId;
    private long expiresInSeconds;
}
