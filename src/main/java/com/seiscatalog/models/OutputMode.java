package com.seiscatalog.models;

import com.seiscatalog.AppLogger;

/**
 * What a virtual array stores at its leaves.
 */
public enum OutputMode {
    /** The full record. */
    DICT,
    /** Only the record's path. */
    PATH;

    /**
     * Unknown or missing names fall back to {@link #DICT}.
     */
    public static OutputMode parse(String name) {
        if (name != null) {
            for (OutputMode mode : values()) {
                if (mode.name().equalsIgnoreCase(name.trim())) {
                    return mode;
                }
            }
        }
        AppLogger.get().warn("[OutputMode] Output type should be 'path' or 'dict', got '" + name + "'; using 'dict'");
        return DICT;
    }
}
