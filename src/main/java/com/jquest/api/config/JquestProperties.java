package com.jquest.api.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the jQuest API.
 */
@Component
@ConfigurationProperties(prefix = "jquest")
@Getter
@Setter
public class JquestProperties {

    private Api api = new Api();

    private Security security = new Security();

    private OpenApi openapi = new OpenApi();

    @Getter
    @Setter
    public static class Api {
        /**
         * Path all API namespaces live under.
         */
        private String prefix = "/api";

        /**
         * Name of the API namespace, the second segment of every resource URI.
         */
        private String name = "v1";
    }

    @Getter
    @Setter
    public static class Security {
        /**
         * Require HTTP Basic authentication and model permissions on every resource.
         * Only meant to be switched off for local exploration.
         */
        private boolean enabled = true;

        /**
         * Account created at startup when no account with this username exists.
         * Left empty, no account is created.
         */
        private String bootstrapUsername;

        private String bootstrapPassword;
    }

    @Getter
    @Setter
    public static class OpenApi {
        private String title = "jQuest API";

        private String description = "Users, instances, missions and progressions of the jQuest game";

        private String version = "1.0.0";

        private String contactName = "jQuest Team";

        private String contactEmail;

        private String licenseName = "LGPL-3.0";
    }
}
