package com.recordhub.phoneauth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VerifyOtpRequest {

    @NotBlank(message = "Phone number is required")
    @Size(max = 32, message = "Phone number is too long")
    private String phoneNumber;

    @NotBlank(message = "Code is required")
    @Pattern(regexp = "\\d{4,8}", message = "Code must be 4 to 8 digits")
    private String code;
}
