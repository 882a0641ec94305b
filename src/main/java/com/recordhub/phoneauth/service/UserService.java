package com.recordhub.phoneauth.service;

import com.recordhub.phoneauth.exception.RepositoryException;
import com.recordhub.phoneauth.exception.UserNotFoundException;
import com.recordhub.phoneauth.model.User;
import com.recordhub.phoneauth.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Service
public class UserService implements UserProvisioner {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final Clock clock;

    public UserService(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    /**
     * Resolves the phone number to its user, creating one on first sign-in. Two sign-ins racing
     * for a new number both end up with the user whose claim was written first.
     */
    @Override
    public User provision(String phoneNumber) {
        Instant now = clock.instant();
        Optional<User> existing = userRepository.findByPhoneNumber(phoneNumber);

        if (existing.isEmpty()) {
            User created = new User(phoneNumber, now);
            created.setLastLoginAt(now);
            if (userRepository.createWithPhoneNumberClaim(created, now)) {
                logger.info("Created user {} for verified phone number {}", created.getId(), phoneNumber);
                return created;
            }

            existing = userRepository.findByPhoneNumber(phoneNumber);
            if (existing.isEmpty()) {
                throw new RepositoryException("Phone number " + phoneNumber + " is claimed but its user is missing");
            }
        }

        User user = existing.get();
        user.setLastLoginAt(now);
        return userRepository.save(user);
    }

    public User getUserById(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException("User not found: " + userId));
    }
}
