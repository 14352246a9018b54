package org.morph.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

import java.util.HashMap;
import java.util.Map;

/**
 * Contents of {@code morph.yaml}.
 */
@Data
public class MorphConfiguration {

    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    public static class ProfileConfiguration {

        @JsonProperty("database")
        private DatabaseConfiguration database;

        @JsonProperty("state")
        private StateConfiguration state;
    }

    @Data
    public static class DatabaseConfiguration {

        @JsonProperty("url")
        private String url;

        @JsonProperty("username")
        private String username;

        @ToString.Exclude
        @JsonProperty("password")
        private String password;
    }

    @Data
    public static class StateConfiguration {

        @JsonProperty("schema")
        private String schema;

        @JsonProperty("queryTimeoutSeconds")
        private Integer queryTimeoutSeconds;
    }
}
