package com.recordhub.phoneauth.service;

import com.recordhub.phoneauth.config.OtpProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Generates numeric one-time codes.
 * <p>
 * Each digit is drawn independently from {@link SecureRandom}, so every code of the configured
 * length is equally likely, including ones with leading zeros.
 */
@Component
public class CodeGenerator {

    private final int codeLength;
    private final SecureRandom secureRandom;

    @Autowired
    public CodeGenerator(OtpProperties properties) {
        this(properties.getCodeLength(), new SecureRandom());
    }

    public CodeGenerator(int codeLength, SecureRandom secureRandom) {
        if (codeLength < 1) {
            throw new IllegalArgumentException("Code length must be positive (was " + codeLength + ")");
        }
        this.codeLength = codeLength;
        this.secureRandom = secureRandom;
    }

    public String generate() {
        char[] digits = new char[codeLength];
        for (int i = 0; i < codeLength; i++) {
            digits[i] = (char) ('0' + secureRandom.nextInt(10));
        }
        return new String(digits);
    }

    public int getCodeLength() {
        return codeLength;
    }
}
