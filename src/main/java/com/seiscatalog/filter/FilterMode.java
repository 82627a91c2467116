package com.seiscatalog.filter;

public enum FilterMode {
    LIST,
    RANGE;

    /**
     * @return the mode for a config name ("list" / "range"), or null
     */
    public static FilterMode fromName(String name) {
        if (name == null) {
            return null;
        }
        for (FilterMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name.trim())) {
                return mode;
            }
        }
        return null;
    }
}
