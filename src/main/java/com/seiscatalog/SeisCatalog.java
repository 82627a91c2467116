package com.seiscatalog;

import com.seiscatalog.filter.FileFilter;
import com.seiscatalog.filter.FilterCriteria;
import com.seiscatalog.group.RecordGrouper;
import com.seiscatalog.models.CatalogRecord;
import com.seiscatalog.models.OutputMode;
import com.seiscatalog.models.VirtualArray;
import com.seiscatalog.pattern.FieldRegistry;
import com.seiscatalog.pattern.PatternCompiler;
import com.seiscatalog.pattern.TemplateRules;
import com.seiscatalog.scan.FileScanner;
import com.seiscatalog.scan.RecordExtractor;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A catalog of the files under one root directory that match a path template.
 *
 * Usage is a small pipeline: {@link #match} scans the tree, {@link #filter}
 * narrows the records, {@link #group} or {@link #organize} reshape them.
 * A stage called before its input exists logs a warning and returns null
 * without touching the catalog; only template problems throw, and only at
 * construction.
 */
public class SeisCatalog {

    private final Path rootDir;
    private final String template;
    private final FieldRegistry registry;
    private final Pattern pattern;
    private final boolean deriveTimestamps;
    private final AppLogger logger = AppLogger.get();

    private CatalogStage stage = CatalogStage.UNINITIALIZED;
    private List<CatalogRecord> records;
    private List<CatalogRecord> filteredRecords;
    private Map<Object, List<CatalogRecord>> groups;
    private VirtualArray virtualArray;

    private SeisCatalog(Builder builder) {
        this.rootDir = PatternCompiler.normalizeRoot(builder.rootDir);
        this.template = builder.template;
        this.registry = FieldRegistry.defaults();
        for (Map.Entry<String, String> field : builder.customFields.entrySet()) {
            registry.add(field.getKey(), field.getValue(), builder.overwrite);
        }
        this.deriveTimestamps = builder.deriveTimestamps;
        TemplateRules rules = TemplateRules.standard().requireDateFields(builder.requireDateFields);
        this.pattern = new PatternCompiler(registry, rules).check(builder.rootDir, builder.template);
    }

    public static Builder builder(String rootDir, String template) {
        return new Builder(rootDir, template);
    }

    /**
     * A standard catalog with default options.
     *
     * @throws ConfigurationException if the template is invalid
     */
    public static SeisCatalog of(String rootDir, String template) {
        return builder(rootDir, template).build();
    }

    /**
     * A catalog of instrument-response files (RESP, StationXML, PAZ, FAP).
     * Adds the {@code resptype} and {@code version} fields; the template needs
     * no date fields and records carry no time.
     */
    public static SeisCatalog responseCatalog(String rootDir, String template) {
        return builder(rootDir, template).responseProfile().build();
    }

    // ==================== Pipeline ====================

    public List<CatalogRecord> match() {
        return match(1);
    }

    /**
     * Scan the root and extract a record from every matching file. Replaces
     * any earlier results, downstream ones included.
     */
    public List<CatalogRecord> match(int threads) {
        List<Path> files = new FileScanner().listFiles(rootDir);
        return match(files, threads);
    }

    /**
     * Match an explicit list of paths instead of scanning the root.
     */
    public List<CatalogRecord> match(List<Path> files, int threads) {
        RecordExtractor extractor = new RecordExtractor(pattern, deriveTimestamps);
        List<CatalogRecord> matched = extractor.extractAll(files, threads);
        this.records = Collections.unmodifiableList(matched);
        this.filteredRecords = null;
        this.groups = null;
        this.virtualArray = null;
        this.stage = CatalogStage.MATCHED;
        return records;
    }

    public List<CatalogRecord> filter(FilterCriteria criteria) {
        return filter(criteria, 1, false);
    }

    /**
     * @return the passing records, or null if {@link #match} has not run
     */
    public List<CatalogRecord> filter(FilterCriteria criteria, int threads, boolean verbose) {
        if (records == null) {
            logger.warn("[SeisCatalog] Please match the files first");
            return null;
        }
        FileFilter fileFilter = new FileFilter(criteria, threads);
        if (verbose) {
            fileFilter.describeCriteria();
        }
        this.filteredRecords = Collections.unmodifiableList(fileFilter.filter(records));
        this.stage = CatalogStage.FILTERED;
        return filteredRecords;
    }

    /**
     * @return groups keyed by label value (or value tuple), or null if the
     *         chosen record set does not exist yet
     */
    public Map<Object, List<CatalogRecord>> group(List<String> labels, List<String> sortLabels, boolean filtered) {
        List<CatalogRecord> source = source(filtered);
        if (source == null) {
            return null;
        }
        this.groups = Collections.unmodifiableMap(new RecordGrouper().group(source, labels, sortLabels));
        this.stage = CatalogStage.GROUPED;
        return groups;
    }

    /**
     * @param outputType "dict" or "path"; anything else falls back to "dict"
     * @return the virtual array, or null if the chosen record set does not exist yet
     */
    public VirtualArray organize(List<String> labelOrder, String outputType, boolean filtered) {
        List<CatalogRecord> source = source(filtered);
        if (source == null) {
            return null;
        }
        this.virtualArray = new RecordGrouper().organize(source, labelOrder, OutputMode.parse(outputType));
        this.stage = CatalogStage.ORGANIZED;
        return virtualArray;
    }

    // ==================== Projections ====================

    /**
     * Value of {@code field} for every record, null where a record lacks it.
     */
    public List<Object> values(String field, boolean filtered) {
        List<CatalogRecord> source = source(filtered);
        if (source == null) {
            return null;
        }
        List<Object> values = new ArrayList<>(source.size());
        for (CatalogRecord record : source) {
            values.add(record.get(field));
        }
        return values;
    }

    public List<String> stations(boolean filtered) {
        List<CatalogRecord> source = source(filtered);
        if (source == null) {
            return null;
        }
        List<String> stations = new ArrayList<>(source.size());
        for (CatalogRecord record : source) {
            stations.add(record.getString("station"));
        }
        return stations;
    }

    public List<LocalDateTime> times(boolean filtered) {
        List<CatalogRecord> source = source(filtered);
        if (source == null) {
            return null;
        }
        List<LocalDateTime> times = new ArrayList<>(source.size());
        for (CatalogRecord record : source) {
            times.add(record.getTime());
        }
        return times;
    }

    private List<CatalogRecord> source(boolean filtered) {
        List<CatalogRecord> source = filtered ? filteredRecords : records;
        if (source == null) {
            logger.warn(filtered ? "[SeisCatalog] Please filter the files first" : "[SeisCatalog] Please match the files first");
        }
        return source;
    }

    // ==================== Accessors ====================

    public Path getRootDir() {
        return rootDir;
    }

    public String getTemplate() {
        return template;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public FieldRegistry getRegistry() {
        return registry;
    }

    public CatalogStage getStage() {
        return stage;
    }

    public List<CatalogRecord> getRecords() {
        return records;
    }

    public List<CatalogRecord> getFilteredRecords() {
        return filteredRecords;
    }

    public Map<Object, List<CatalogRecord>> getGroups() {
        return groups;
    }

    public VirtualArray getVirtualArray() {
        return virtualArray;
    }

    /**
     * Builder for SeisCatalog.
     */
    public static class Builder {
        private final String rootDir;
        private final String template;
        private final Map<String, String> customFields = new LinkedHashMap<>();
        private boolean overwrite = false;
        private boolean requireDateFields = true;
        private boolean deriveTimestamps = true;

        private Builder(String rootDir, String template) {
            this.rootDir = rootDir;
            this.template = template;
        }

        public Builder customField(String name, String regex) {
            customFields.put(name, regex);
            return this;
        }

        public Builder customFields(Map<String, String> fields) {
            if (fields != null) {
                customFields.putAll(fields);
            }
            return this;
        }

        /**
         * Let custom fields replace default fields of the same name.
         */
        public Builder overwrite(boolean overwrite) {
            this.overwrite = overwrite;
            return this;
        }

        public Builder requireDateFields(boolean requireDateFields) {
            this.requireDateFields = requireDateFields;
            return this;
        }

        public Builder deriveTimestamps(boolean deriveTimestamps) {
            this.deriveTimestamps = deriveTimestamps;
            return this;
        }

        /**
         * Instrument-response files: adds {@code resptype} and {@code version},
         * drops the date-field rule and timestamp derivation.
         */
        public Builder responseProfile() {
            customFields.put("resptype", "RESP|StationXML|PAZ|FAP");
            customFields.put("version", "v\\d{2}");
            this.requireDateFields = false;
            this.deriveTimestamps = false;
            return this;
        }

        /**
         * @throws ConfigurationException if a custom field or the template is invalid
         */
        public SeisCatalog build() {
            return new SeisCatalog(this);
        }
    }
}
