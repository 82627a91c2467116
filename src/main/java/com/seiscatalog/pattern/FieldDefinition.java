package com.seiscatalog.pattern;

/**
 * A template token and the capture group it expands to,
 * e.g. {@code YYYY -> (?<year>\d{4})}.
 */
public class FieldDefinition {
    private final String name;
    private final String regex;

    public FieldDefinition(String name, String regex) {
        this.name = name;
        this.regex = regex;
    }

    public String getName() {
        return name;
    }

    public String getRegex() {
        return regex;
    }

    @Override
    public String toString() {
        return "{" + name + "} -> " + regex;
    }
}
