package com.recordhub.phoneauth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of send-otp and resend-otp. The number is normalized to E.164 before use.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SendOtpRequest {

    @NotBlank(message = "Phone number is required")
    @Size(max = 32, message = "Phone number is too long")
    private String phoneNumber;
}
