package org.morph.model;

import lombok.Builder;
import lombok.Value;

/**
 * Comparison of the live schema against the snapshot recorded by the latest
 * completed migration.
 */
@Value
@Builder
public class SchemaVerification {
    String schema;
    String version;
    String expectedHash;
    String actualHash;
    boolean upToDate;
}
