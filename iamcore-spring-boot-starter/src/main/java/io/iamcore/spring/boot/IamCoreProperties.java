package io.iamcore.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for iamcore.
 *
 * @see IamCoreAutoConfiguration
 */
@ConfigurationProperties(prefix = "iamcore")
public class IamCoreProperties {

    /**
     * Database table name for events.
     */
    private String tableName = "iam_event";

    /**
     * Base64-encoded AES key (16, 24 or 32 bytes) protecting stored passwords.
     */
    private String secretKey;

    /**
     * Identifier recorded with every protected secret, for key rotation.
     */
    private String secretKeyId = "default";

    private final Scim scim = new Scim();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public void setSecretKey(String secretKey) {
        this.secretKey = secretKey;
    }

    public String getSecretKeyId() {
        return secretKeyId;
    }

    public void setSecretKeyId(String secretKeyId) {
        this.secretKeyId = secretKeyId;
    }

    public Scim getScim() {
        return scim;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Scim {
        /**
         * Whether emails provisioned through the users handler are marked verified.
         */
        private boolean emailVerified;

        /**
         * Whether phone numbers provisioned through the users handler are marked verified.
         */
        private boolean phoneVerified;

        /**
         * Base URL used to build resource locations.
         */
        private String baseUrl = "http://localhost:8080/scim/v2";

        public boolean isEmailVerified() {
            return emailVerified;
        }

        public void setEmailVerified(boolean emailVerified) {
            this.emailVerified = emailVerified;
        }

        public boolean isPhoneVerified() {
            return phoneVerified;
        }

        public void setPhoneVerified(boolean phoneVerified) {
            this.phoneVerified = phoneVerified;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "iamcore";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
