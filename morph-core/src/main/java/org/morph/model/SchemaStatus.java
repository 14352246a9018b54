package org.morph.model;

import lombok.Builder;
import lombok.Value;

/**
 * Summary of where a schema stands in its migration history.
 */
@Value
@Builder
public class SchemaStatus {
    String schema;
    /** Name of the latest completed migration, or null when none completed yet. */
    String version;
    State state;

    public enum State {
        NO_MIGRATIONS,
        IN_PROGRESS,
        COMPLETE,
        ROLLED_BACK
    }
}
