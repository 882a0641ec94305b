package com.recordhub.phoneauth.controller;

import com.recordhub.phoneauth.config.OpenApiConfig;
import com.recordhub.phoneauth.dto.OtpResponse;
import com.recordhub.phoneauth.dto.OtpStatusResponse;
import com.recordhub.phoneauth.dto.SendOtpRequest;
import com.recordhub.phoneauth.dto.TokenResponse;
import com.recordhub.phoneauth.dto.UserResponse;
import com.recordhub.phoneauth.dto.VerifyOtpRequest;
import com.recordhub.phoneauth.exception.UnauthorizedException;
import com.recordhub.phoneauth.model.User;
import com.recordhub.phoneauth.service.ChallengeStatus;
import com.recordhub.phoneauth.service.IssuedChallenge;
import com.recordhub.phoneauth.service.SessionGrant;
import com.recordhub.phoneauth.service.UserService;
import com.recordhub.phoneauth.service.VerificationEngine;
import com.recordhub.phoneauth.util.PhoneNumberNormalizer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Phone number sign-in with one-time codes")
public class AuthController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

    private final VerificationEngine verificationEngine;
    private final PhoneNumberNormalizer phoneNumberNormalizer;
    private final UserService userService;

    @PostMapping("/send-otp")
    @Operation(summary = "Send a verification code", description = "Issues a new code by SMS, replacing any earlier one")
    public ResponseEntity<OtpResponse> sendOtp(@Valid @RequestBody SendOtpRequest request) {
        String phoneNumber = phoneNumberNormalizer.normalize(request.getPhoneNumber());
        IssuedChallenge issued = verificationEngine.issue(phoneNumber);
        logger.info("OTP sent to {}", phoneNumber);
        return ResponseEntity.ok(toOtpResponse(issued, "Verification code sent successfully"));
    }

    @PostMapping("/resend-otp")
    @Operation(summary = "Resend a verification code", description = "Issues a fresh code; the previous one stops working")
    public ResponseEntity<OtpResponse> resendOtp(@Valid @RequestBody SendOtpRequest request) {
        String phoneNumber = phoneNumberNormalizer.normalize(request.getPhoneNumber());
        IssuedChallenge issued = verificationEngine.resend(phoneNumber);
        logger.info("OTP resent to {}", phoneNumber);
        return ResponseEntity.ok(toOtpResponse(issued, "Verification code resent successfully"));
    }

    @PostMapping("/verify-otp")
    @Operation(summary = "Verify a code", description = "Exchanges a valid code for an access token, creating the user on first sign-in")
    public ResponseEntity<TokenResponse> verifyOtp(@Valid @RequestBody VerifyOtpRequest request) {
        String phoneNumber = phoneNumberNormalizer.normalize(request.getPhoneNumber());
        SessionGrant grant = verificationEngine.verify(phoneNumber, request.getCode());
        return ResponseEntity.ok(new TokenResponse(grant.sessionToken(), "Bearer", grant.expiresInSeconds(),
                grant.userId(), grant.phoneNumber()));
    }

    @GetMapping("/otp-status")
    @Operation(summary = "Get code status", description = "Reports the pending code for a phone number without consuming attempts")
    public ResponseEntity<OtpStatusResponse> otpStatus(@RequestParam String phoneNumber) {
        String normalized = phoneNumberNormalizer.normalize(phoneNumber);
        ChallengeStatus status = verificationEngine.status(normalized);
        return ResponseEntity.ok(new OtpStatusResponse(status.pending(), status.attemptsRemaining(),
                status.expiresAt(), status.canResend()));
    }

    @GetMapping("/me")
    @Operation(summary = "Get current user", description = "Returns the account behind the bearer token")
    @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME)
    public ResponseEntity<UserResponse> me(HttpServletRequest request) {
        UUID userId;
        try {
            userId = UUID.fromString(extractUserId(request));
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("Malformed user id in token");
        }

        User user = userService.getUserById(userId);
        if (!Boolean.TRUE.equals(user.getActive())) {
            throw new UnauthorizedException("Inactive user");
        }
        return ResponseEntity.ok(UserResponse.from(user));
    }

    private OtpResponse toOtpResponse(IssuedChallenge issued, String message) {
        return new OtpResponse("success", message, issued.reference(), issued.expiresInSeconds());
    }
}
