package com.seiscatalog.pattern;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validation rules applied to a template before it is compiled.
 */
public class TemplateRules {

    public static final List<String> DEFAULT_REQUIRED_FIELDS = List.of("home", "component", "station");

    /** Any token from these sets satisfies the date-field rule. */
    public static final List<List<String>> DATE_FIELD_SETS = List.of(
            List.of("YYYY", "MM", "DD"),
            List.of("YYYY", "JJJ"),
            List.of("YY", "MM", "DD"),
            List.of("YY", "JJJ")
    );

    private final Set<String> requiredFields;
    private final boolean requireDateFields;

    public TemplateRules(Set<String> requiredFields, boolean requireDateFields) {
        this.requiredFields = Collections.unmodifiableSet(new LinkedHashSet<>(requiredFields));
        this.requireDateFields = requireDateFields;
    }

    public static TemplateRules standard() {
        return new TemplateRules(new LinkedHashSet<>(DEFAULT_REQUIRED_FIELDS), true);
    }

    /**
     * Same required tokens, no date-field requirement.
     */
    public static TemplateRules withoutDateFields() {
        return new TemplateRules(new LinkedHashSet<>(DEFAULT_REQUIRED_FIELDS), false);
    }

    public Set<String> getRequiredFields() {
        return requiredFields;
    }

    public boolean isRequireDateFields() {
        return requireDateFields;
    }

    public TemplateRules requireDateFields(boolean required) {
        return new TemplateRules(requiredFields, required);
    }

    static Set<String> dateTokens() {
        Set<String> tokens = new LinkedHashSet<>();
        for (List<String> set : DATE_FIELD_SETS) {
            tokens.addAll(set);
        }
        return tokens;
    }
}
