package com.recordhub.phoneauth.service;

import com.recordhub.phoneauth.config.OtpProperties;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Keyed one-way digest of OTP codes.
 * <p>
 * The digest is HMAC-SHA256 over {@code phoneNumber + ":" + code} with the server secret as key,
 * hex encoded. Mixing in the phone number means equal codes for different numbers never share a
 * digest. Comparisons run in constant time.
 */
@Component
public class SecretHasher {

    private static final int MIN_SECRET_LENGTH = 32;

    private final byte[] secret;

    @Autowired
    public SecretHasher(OtpProperties properties) {
        this(properties.getHashSecret());
    }

    public SecretHasher(String secret) {
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalArgumentException("OTP hash secret must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    public String digest(String phoneNumber, String code) {
        // HmacUtils wraps a Mac, which is not thread safe
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secret).hmacHex(phoneNumber + ":" + code);
    }

    public boolean matches(String phoneNumber, String code, String expectedDigest) {
        if (expectedDigest == null || code == null) {
            return false;
        }
        byte[] actual = digest(phoneNumber, code).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(actual, expectedDigest.getBytes(StandardCharsets.UTF_8));
    }
}
