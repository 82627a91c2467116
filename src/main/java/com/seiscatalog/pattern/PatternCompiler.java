package com.seiscatalog.pattern;

import com.seiscatalog.AppLogger;
import com.seiscatalog.ConfigurationException;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a path template into the anchored pattern used to match files.
 *
 * Checks, in order: unknown tokens, duplicated tokens, required tokens,
 * date tokens. Then binds {@code {home}} to the root directory and compiles.
 * Runs once per catalog, never per file.
 */
public class PatternCompiler {

    public static final String HOME_FIELD = "home";

    private final FieldRegistry registry;
    private final TemplateRules rules;
    private final AppLogger logger = AppLogger.get();

    public PatternCompiler(FieldRegistry registry, TemplateRules rules) {
        this.registry = registry;
        this.rules = rules != null ? rules : TemplateRules.standard();
    }

    public PatternCompiler(FieldRegistry registry) {
        this(registry, TemplateRules.standard());
    }

    public static Pattern checkPattern(String rootDir, String template, FieldRegistry registry) {
        return new PatternCompiler(registry).check(rootDir, template);
    }

    /**
     * @throws ConfigurationException naming the offending token(s)
     */
    public Pattern check(String rootDir, String template) {
        if (template == null) {
            logger.error("[PatternCompiler] Template must be a string, got null");
            throw new ConfigurationException("Template must be a string");
        }

        registry.validateFields(template);

        List<String> tokens = FieldRegistry.fieldTokens(template);
        List<String> duplicates = duplicates(tokens);
        if (!duplicates.isEmpty()) {
            logger.error("[PatternCompiler] Template contains duplicate fields: " + duplicates);
            throw new ConfigurationException("Template contains duplicate fields: " + duplicates);
        }

        for (String required : rules.getRequiredFields()) {
            if (!tokens.contains(required)) {
                logger.error("[PatternCompiler] Template must contain {" + required + "}");
                throw new ConfigurationException("Template must contain {" + required + "}");
            }
        }

        if (rules.isRequireDateFields()) {
            Set<String> dateTokens = TemplateRules.dateTokens();
            boolean hasDate = false;
            for (String token : tokens) {
                if (dateTokens.contains(token)) {
                    hasDate = true;
                    break;
                }
            }
            if (!hasDate) {
                logger.error("[PatternCompiler] Template must contain one set of date fields");
                throw new ConfigurationException("Template must contain one set of date fields, one of "
                        + TemplateRules.DATE_FIELD_SETS);
            }
        }

        Path root = normalizeRoot(rootDir);
        if (!Files.isDirectory(root)) {
            logger.warn("[PatternCompiler] " + root + " is not a directory");
        }

        Map<String, String> bindings = new LinkedHashMap<>();
        if (tokens.contains(HOME_FIELD)) {
            bindings.put(HOME_FIELD, toMatchablePath(root.toString()));
        }
        Pattern pattern = registry.compile(template, bindings);
        logger.debug("[PatternCompiler] " + template + " -> " + pattern.pattern());
        return pattern;
    }

    public static Path normalizeRoot(String rootDir) {
        return Paths.get(rootDir == null ? "" : rootDir).toAbsolutePath().normalize();
    }

    /**
     * Templates always use '/' as the separator, whatever the platform.
     */
    public static String toMatchablePath(String path) {
        return File.separatorChar == '/' ? path : path.replace(File.separatorChar, '/');
    }

    private static List<String> duplicates(List<String> tokens) {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> dup = new LinkedHashSet<>();
        for (String token : tokens) {
            if (!seen.add(token)) {
                dup.add(token);
            }
        }
        return new ArrayList<>(dup);
    }
}
