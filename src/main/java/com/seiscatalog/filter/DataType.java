package com.seiscatalog.filter;

import java.time.temporal.Temporal;

/**
 * Declared type of a filtered field, checked before the value is compared.
 */
public enum DataType {
    STR("str"),
    INT("int"),
    FLOAT("float"),
    NUMERIC("numeric"),
    DATETIME("datetime");

    private final String configName;

    DataType(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT || this == NUMERIC;
    }

    /**
     * @return the type for a config name, or null when the name is unknown
     *         (in which case no type check is made)
     */
    public static DataType fromName(String name) {
        if (name == null) {
            return null;
        }
        for (DataType type : values()) {
            if (type.configName.equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        return null;
    }

    public boolean accepts(Object value) {
        switch (this) {
            case DATETIME:
                return value instanceof Temporal;
            case INT:
            case FLOAT:
            case NUMERIC:
                return toDouble(value) != null;
            case STR:
                return value instanceof String;
            default:
                return true;
        }
    }

    /**
     * @return the value as a double, or null if it cannot be cast to one
     */
    public static Double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return configName;
    }
}
