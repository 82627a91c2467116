package com.seiscatalog;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line configuration for a catalog run.
 */
public class AppConfig {

    public static final int DEFAULT_THREADS = 1;

    private final Path rootDir;
    private final String template;
    private final int threads;
    private final Path criteriaFile;
    private final List<String> groupLabels;
    private final List<String> sortLabels;
    private final List<String> organizeLabels;
    private final String outputType;
    private final Map<String, String> customFields;
    private final boolean overwrite;
    private final boolean useFiltered;
    private final boolean responseProfile;
    private final Path logPath;
    private final boolean verbose;
    private final boolean help;

    private AppConfig(Builder b) {
        this.rootDir = b.rootDir;
        this.template = b.template;
        this.threads = b.threads;
        this.criteriaFile = b.criteriaFile;
        this.groupLabels = Collections.unmodifiableList(b.groupLabels);
        this.sortLabels = Collections.unmodifiableList(b.sortLabels);
        this.organizeLabels = Collections.unmodifiableList(b.organizeLabels);
        this.outputType = b.outputType;
        this.customFields = Collections.unmodifiableMap(b.customFields);
        this.overwrite = b.overwrite;
        this.useFiltered = !b.raw && b.criteriaFile != null;
        this.responseProfile = b.response;
        this.logPath = b.logPath;
        this.verbose = b.verbose;
        this.help = b.help;
    }

    public Path getRootDir() {
        return rootDir;
    }

    public String getTemplate() {
        return template;
    }

    public int getThreads() {
        return threads;
    }

    public Path getCriteriaFile() {
        return criteriaFile;
    }

    public List<String> getGroupLabels() {
        return groupLabels;
    }

    public List<String> getSortLabels() {
        return sortLabels;
    }

    public List<String> getOrganizeLabels() {
        return organizeLabels;
    }

    public String getOutputType() {
        return outputType;
    }

    public Map<String, String> getCustomFields() {
        return customFields;
    }

    public boolean isOverwrite() {
        return overwrite;
    }

    /**
     * Group and organize the filtered records rather than all matches.
     * True only when criteria were given and --raw was not.
     */
    public boolean isUseFiltered() {
        return useFiltered;
    }

    public boolean isResponseProfile() {
        return responseProfile;
    }

    public Path getLogPath() {
        return logPath;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isHelp() {
        return help;
    }

    public static String usage() {
        return String.join("\n",
                "Usage: seis-catalog --root DIR --pattern TEMPLATE [options]",
                "",
                "  --root DIR            root directory of the data set ({home})",
                "  --pattern TEMPLATE    path template, e.g. {home}/{YYYY}/{station}_{component}.sac",
                "  --threads N           worker threads for matching and filtering (default 1)",
                "  --criteria FILE       JSON filter criteria",
                "  --group a,b           group records by these labels",
                "  --sort a,b            sort records by these labels before grouping",
                "  --organize a,b        nest records by these labels",
                "  --output dict|path    leaves of the organized array (default dict)",
                "  --field name=regex    add a custom template field (repeatable)",
                "  --overwrite           let --field replace a default field",
                "  --raw                 group/organize all matches, ignoring --criteria",
                "  --response            catalog instrument-response files (no date fields)",
                "  --log FILE            also write the log to FILE",
                "  --verbose             debug logging",
                "  --help                show this text");
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path rootDir = null;
        private String template = null;
        private int threads = DEFAULT_THREADS;
        private Path criteriaFile = null;
        private List<String> groupLabels = new ArrayList<>();
        private List<String> sortLabels = new ArrayList<>();
        private List<String> organizeLabels = new ArrayList<>();
        private String outputType = "dict";
        private final Map<String, String> customFields = new LinkedHashMap<>();
        private boolean overwrite = false;
        private boolean raw = false;
        private boolean response = false;
        private Path logPath = null;
        private boolean verbose = false;
        private boolean help = false;

        public Builder rootDir(String path) {
            if (path != null && !path.isEmpty()) {
                this.rootDir = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder template(String template) {
            this.template = template;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = Math.max(1, threads);
            return this;
        }

        public Builder criteriaFile(String path) {
            this.criteriaFile = path != null && !path.isEmpty() ? Paths.get(path) : null;
            return this;
        }

        public Builder customField(String assignment) {
            int eq = assignment.indexOf('=');
            if (eq <= 0) {
                throw new ConfigurationException("--field expects name=regex, got '" + assignment + "'");
            }
            customFields.put(assignment.substring(0, eq).trim(), assignment.substring(eq + 1));
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                String key = arg;
                String value = null;
                int eq = arg.indexOf('=');
                if (arg.startsWith("--") && eq > 0) {
                    key = arg.substring(0, eq);
                    value = arg.substring(eq + 1);
                }

                switch (key) {
                    case "--overwrite":
                        overwrite = true;
                        continue;
                    case "--raw":
                        raw = true;
                        continue;
                    case "--response":
                        response = true;
                        continue;
                    case "--verbose":
                        verbose = true;
                        continue;
                    case "--help":
                    case "-h":
                        help = true;
                        continue;
                    default:
                        break;
                }

                if (value == null) {
                    if (i + 1 >= args.length) {
                        throw new ConfigurationException("Missing value for " + key);
                    }
                    value = args[++i];
                }

                switch (key) {
                    case "--root":
                        rootDir(value);
                        break;
                    case "--pattern":
                        template(value);
                        break;
                    case "--threads":
                        try {
                            threads(Integer.parseInt(value.trim()));
                        } catch (NumberFormatException e) {
                            throw new ConfigurationException("--threads expects a number, got '" + value + "'", e);
                        }
                        break;
                    case "--criteria":
                        criteriaFile(value);
                        break;
                    case "--group":
                        groupLabels = splitLabels(value);
                        break;
                    case "--sort":
                        sortLabels = splitLabels(value);
                        break;
                    case "--organize":
                        organizeLabels = splitLabels(value);
                        break;
                    case "--output":
                        outputType = value;
                        break;
                    case "--field":
                        customField(value);
                        break;
                    case "--log":
                        logPath = Paths.get(value).toAbsolutePath().normalize();
                        break;
                    default:
                        throw new ConfigurationException("Unknown option " + key);
                }
            }
            return this;
        }

        /**
         * @throws ConfigurationException if --root or --pattern is missing
         */
        public AppConfig build() {
            if (!help) {
                if (rootDir == null) {
                    throw new ConfigurationException("--root is required");
                }
                if (template == null || template.isBlank()) {
                    throw new ConfigurationException("--pattern is required");
                }
            }
            return new AppConfig(this);
        }

        private static List<String> splitLabels(String value) {
            List<String> labels = new ArrayList<>();
            for (String part : value.split(",")) {
                String label = part.trim();
                if (!label.isEmpty()) {
                    labels.add(label);
                }
            }
            return labels;
        }
    }
}
