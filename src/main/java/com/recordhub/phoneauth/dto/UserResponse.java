package com.recordhub.phoneauth.dto;

import com.recordhub.phoneauth.model.User;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {
    private UUID id;
    private String phoneNumber;
    private String displayName;
    private Instant createdAt;
    private Instant lastLoginAt;

    public static UserResponse from(User user) {
        return new UserResponse(user.getId(), user.getPhoneNumber(), user.getDisplayName(),
                user.getCreationDate(), user.getLastLoginAt());
    }
}
