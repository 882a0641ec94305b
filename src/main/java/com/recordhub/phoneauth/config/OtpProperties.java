package com.recordhub.phoneauth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Duration;

/**
 * OTP settings bound from the {@code otp.*} namespace.
 * <p>
 * TTL and max attempts are read once per issued challenge, so changing them only
 * affects challenges issued afterwards.
 */
@Validated
@ConfigurationProperties(prefix = "otp")
public class OtpProperties {

    @Min(4)
    @Max(10)
    private int codeLength = 6;

    @NotNull
    private Duration ttl = Duration.ofMinutes(5);

    @Min(1)
    private int maxAttempts = 3;

    /**
     * HMAC key for code digests. Deployed environments override the local default.
     */
    @NotBlank
    @Size(min = 32)
    private String hashSecret = "default_otp_hash_secret_for_local_development_only";

    private final RateLimit rateLimit = new RateLimit();
    private final Sms sms = new Sms();
    private final Storage storage = new Storage();
    private final Phone phone = new Phone();

    public int getCodeLength() {
        return codeLength;
    }

    public void setCodeLength(int codeLength) {
        this.codeLength = codeLength;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public String getHashSecret() {
        return hashSecret;
    }

    public void setHashSecret(String hashSecret) {
        this.hashSecret = hashSecret;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Sms getSms() {
        return sms;
    }

    public Storage getStorage() {
        return storage;
    }

    public Phone getPhone() {
        return phone;
    }

    public static class RateLimit {

        @NotNull
        private Duration window = Duration.ofMinutes(1);

        @Min(1)
        private int maxRequests = 3;

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }
    }

    public static class Sms {

        // {code} and {minutes} are substituted at send time
        @NotBlank
        private String template = "Your verification code is {code}. It expires in {minutes} minutes. Do not share it.";

        public String getTemplate() {
            return template;
        }

        public void setTemplate(String template) {
            this.template = template;
        }
    }

    public static class Storage {

        private StorageType type = StorageType.DYNAMODB;

        /**
         * How long records are kept after they stop mattering, before the table TTL reaps them.
         */
        @NotNull
        private Duration retention = Duration.ofDays(1);

        public StorageType getType() {
            return type;
        }

        public void setType(StorageType type) {
            this.type = type;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }

    public static class Phone {

        @NotBlank
        private String defaultCountryCode = "+91";

        public String getDefaultCountryCode() {
            return defaultCountryCode;
        }

        public void setDefaultCountryCode(String defaultCountryCode) {
            this.defaultCountryCode = defaultCountryCode;
        }
    }

    public enum StorageType {
        DYNAMODB,
        MEMORY
    }
}
