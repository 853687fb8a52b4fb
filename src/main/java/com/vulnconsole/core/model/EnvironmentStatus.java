package com.vulnconsole.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Last observed container state of an environment.
 */
public enum EnvironmentStatus {
    RUNNING,
    STOPPED,
    UNKNOWN;  // no runtime probe has succeeded for this environment yet

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static EnvironmentStatus fromWireName(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (EnvironmentStatus status : values()) {
            if (status.wireName().equalsIgnoreCase(value)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
