package com.seiscatalog.pattern;

import com.seiscatalog.AppLogger;
import com.seiscatalog.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered vocabulary of template tokens.
 *
 * Templates are compiled by scanning for {@code {name}} tokens and expanding
 * each one in place, so a token name that is a prefix of another
 * ({@code YY} / {@code YYYY}) can never corrupt the result.
 */
public class FieldRegistry {

    /** Matches {@code {name}}, {@code {?}} and {@code {*}}. */
    static final Pattern TOKEN_PATTERN = Pattern.compile("\\{(\\w+|\\?|\\*)\\}");

    static final String ANY_SEGMENT_TOKEN = "?";
    static final String ANY_TOKEN = "*";
    static final String ANY_SEGMENT_REGEX = "[^. _/]*";
    static final String ANY_REGEX = ".*";

    private static final String REGEX_META = "\\.[]{}()*+?^$|_/";

    private final List<FieldDefinition> fields = new ArrayList<>();
    private final AppLogger logger = AppLogger.get();

    public FieldRegistry() {
    }

    public FieldRegistry(List<FieldDefinition> baseFields) {
        if (baseFields != null) {
            fields.addAll(baseFields);
        }
    }

    /**
     * A fresh registry holding the default vocabulary.
     */
    public static FieldRegistry defaults() {
        List<FieldDefinition> base = new ArrayList<>();
        base.add(new FieldDefinition("YYYY", "(?<year>\\d{4})"));
        base.add(new FieldDefinition("YY", "(?<year>\\d{2})"));
        base.add(new FieldDefinition("MM", "(?<month>\\d{2})"));
        base.add(new FieldDefinition("DD", "(?<day>\\d{2})"));
        base.add(new FieldDefinition("JJJ", "(?<jday>\\d{3})"));
        base.add(new FieldDefinition("HH", "(?<hour>\\d{2})"));
        base.add(new FieldDefinition("MI", "(?<minute>\\d{2})"));
        for (String name : List.of("home", "network", "event", "station", "component",
                "sampleF", "quality", "locid", "suffix")) {
            base.add(new FieldDefinition(name, "(?<" + name + ">\\w+)"));
        }
        for (int i = 0; i <= 9; i++) {
            String name = "label" + i;
            base.add(new FieldDefinition(name, "(?<" + name + ">\\w+)"));
        }
        return new FieldRegistry(base);
    }

    public FieldRegistry copy() {
        return new FieldRegistry(fields);
    }

    /**
     * Register {@code name} as the capture group {@code (?<name>fragment)}.
     *
     * @throws ConfigurationException if the group does not compile
     */
    public FieldRegistry add(String name, String fragment, boolean overwrite) {
        String namedGroup = "(?<" + name + ">" + fragment + ")";
        try {
            Pattern.compile(namedGroup);
        } catch (PatternSyntaxException e) {
            logger.error("[FieldRegistry] Invalid regex for field " + name + ": " + e.getDescription());
            throw new ConfigurationException("Invalid regex for field '" + name + "': " + e.getDescription(), e);
        }

        int index = indexOf(name);
        if (index >= 0) {
            if (!overwrite) {
                logger.warn("[FieldRegistry] Field " + name + " already exists, use overwrite to replace it");
                return this;
            }
            fields.set(index, new FieldDefinition(name, namedGroup));
            return this;
        }
        fields.add(new FieldDefinition(name, namedGroup));
        return this;
    }

    public FieldRegistry add(String name, String fragment) {
        return add(name, fragment, false);
    }

    public void remove(String name) {
        int index = indexOf(name);
        if (index < 0) {
            logger.warn("[FieldRegistry] Field " + name + " not found");
            return;
        }
        fields.remove(index);
    }

    public boolean has(String name) {
        return indexOf(name) >= 0;
    }

    public FieldDefinition get(String name) {
        int index = indexOf(name);
        return index >= 0 ? fields.get(index) : null;
    }

    public List<FieldDefinition> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public List<String> getNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (FieldDefinition field : fields) {
            names.add(field.getName());
        }
        return names;
    }

    /**
     * All {@code {name}} references in the template, in order of appearance.
     * Wildcards are not included.
     */
    public static List<String> fieldTokens(String template) {
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN_PATTERN.matcher(template);
        while (m.find()) {
            String token = m.group(1);
            if (!ANY_SEGMENT_TOKEN.equals(token) && !ANY_TOKEN.equals(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * @throws ConfigurationException listing every token that is not registered
     */
    public void validateFields(String template) {
        Set<String> invalid = new LinkedHashSet<>();
        for (String token : fieldTokens(template)) {
            if (!has(token)) {
                invalid.add(token);
            }
        }
        if (!invalid.isEmpty()) {
            logger.error("[FieldRegistry] Template contains unknown fields: " + invalid);
            throw new ConfigurationException("Template contains unknown fields: " + invalid);
        }
    }

    /**
     * Expand a template into regex source.
     *
     * @param literalBindings tokens replaced by literal text instead of a capture group
     */
    public String buildRegex(String template, Map<String, String> literalBindings) {
        StringBuilder sb = new StringBuilder();
        Matcher m = TOKEN_PATTERN.matcher(template);
        int last = 0;
        while (m.find()) {
            sb.append(escapeLiteral(template.substring(last, m.start())));
            String token = m.group(1);
            if (ANY_SEGMENT_TOKEN.equals(token)) {
                sb.append(ANY_SEGMENT_REGEX);
            } else if (ANY_TOKEN.equals(token)) {
                sb.append(ANY_REGEX);
            } else if (literalBindings != null && literalBindings.containsKey(token)) {
                sb.append(escapeLiteral(literalBindings.get(token)));
            } else {
                FieldDefinition field = get(token);
                if (field == null) {
                    throw new ConfigurationException("Template contains unknown fields: [" + token + "]");
                }
                sb.append(field.getRegex());
            }
            last = m.end();
        }
        sb.append(escapeLiteral(template.substring(last)));
        return sb.toString();
    }

    public String buildRegex(String template) {
        return buildRegex(template, Map.of());
    }

    /**
     * @throws ConfigurationException if the expanded template is not a valid
     *         regex, e.g. two tokens defining the same capture group
     */
    public Pattern compile(String template, Map<String, String> literalBindings) {
        String regex = buildRegex(template, literalBindings);
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            logger.error("[FieldRegistry] Template does not compile: " + e.getDescription());
            throw new ConfigurationException("Template '" + template + "' does not compile: " + e.getDescription(), e);
        }
    }

    static String escapeLiteral(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (REGEX_META.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private int indexOf(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
