package io.iamcore.resource;

import java.util.Objects;

/**
 * Settings of {@link UsersHandler}.
 *
 * @param emailVerified whether provisioned emails are marked verified
 * @param phoneVerified whether provisioned phone numbers are marked verified
 * @param baseUrl       the absolute URL resource locations are built from, without trailing slash
 */
public record UsersHandlerConfig(boolean emailVerified, boolean phoneVerified, String baseUrl) {

    public UsersHandlerConfig {
        Objects.requireNonNull(baseUrl, "baseUrl");
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
    }
}
