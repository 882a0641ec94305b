package com.recordhub.phoneauth.util;

import com.recordhub.phoneauth.config.OtpProperties;
import com.recordhub.phoneauth.exception.InvalidPhoneNumberException;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Normalizes user supplied phone numbers to E.164.
 * <p>
 * Spaces, dashes and parentheses are stripped. A bare national number of ten digits gets the
 * configured default country code, and a twelve digit number that already starts with that
 * country code only gets the leading {@code +}. Anything else must carry its own country code.
 */
@Component
public class PhoneNumberNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-()]");
    private static final Pattern E164_CANDIDATE = Pattern.compile("^\\+?[1-9]\\d{1,14}$");

    private final String defaultCountryCode;

    public PhoneNumberNormalizer(OtpProperties properties) {
        String code = properties.getPhone().getDefaultCountryCode().trim();
        this.defaultCountryCode = code.startsWith("+") ? code : "+" + code;
    }

    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidPhoneNumberException("Phone number is required");
        }
        String cleaned = SEPARATORS.matcher(raw).replaceAll("");
        if (!E164_CANDIDATE.matcher(cleaned).matches()) {
            throw new InvalidPhoneNumberException("Invalid phone number format");
        }
        if (cleaned.startsWith("+")) {
            return cleaned;
        }

        String countryDigits = defaultCountryCode.substring(1);
        if (cleaned.length() == 10 + countryDigits.length() && cleaned.startsWith(countryDigits)) {
            return "+" + cleaned;
        }
        if (cleaned.length() == 10) {
            return defaultCountryCode + cleaned;
        }
        throw new InvalidPhoneNumberException("Phone number must include country code");
    }
}
