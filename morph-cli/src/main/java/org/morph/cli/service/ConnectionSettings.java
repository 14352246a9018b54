package org.morph.cli.service;

/**
 * Fully resolved connection and state settings for one CLI invocation.
 */
public record ConnectionSettings(
        String url,
        String username,
        String password,
        String stateSchema,
        int queryTimeoutSeconds
) {
    @Override
    public String toString() {
        return "ConnectionSettings[url=" + url + ", username=" + username
                + ", stateSchema=" + stateSchema + ", queryTimeoutSeconds=" + queryTimeoutSeconds + "]";
    }
}
