package com.seiscatalog.scan;

import com.seiscatalog.AppLogger;
import com.seiscatalog.WorkerPool;
import com.seiscatalog.models.CatalogRecord;
import com.seiscatalog.pattern.PatternCompiler;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches paths against a compiled template and turns each match into a
 * {@link CatalogRecord}. Paths that do not match are dropped without a
 * diagnostic; matching is expected to be selective.
 */
public class RecordExtractor {

    private static final Pattern GROUP_NAME = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private final Pattern pattern;
    private final List<String> groupNames;
    private final boolean deriveTimestamps;
    private final TemporalResolver temporalResolver;
    private final AppLogger logger = AppLogger.get();

    public RecordExtractor(Pattern pattern, boolean deriveTimestamps) {
        this.pattern = pattern;
        this.groupNames = groupNames(pattern);
        this.deriveTimestamps = deriveTimestamps;
        this.temporalResolver = new TemporalResolver();
    }

    public RecordExtractor(Pattern pattern) {
        this(pattern, true);
    }

    public Pattern getPattern() {
        return pattern;
    }

    public List<String> getGroupNames() {
        return groupNames;
    }

    /**
     * @return the record, or null when the path does not match
     */
    public CatalogRecord extract(String path) {
        Matcher m = pattern.matcher(PatternCompiler.toMatchablePath(path));
        if (!m.matches()) {
            return null;
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (String name : groupNames) {
            String value;
            try {
                value = m.group(name);
            } catch (IllegalArgumentException e) {
                // text such as "(?<x>" inside a character class is not a group
                continue;
            }
            if (value != null) {
                fields.put(name, value);
            }
        }
        if (deriveTimestamps) {
            LocalDateTime time = temporalResolver.resolve(fields);
            if (time != null) {
                fields.put(CatalogRecord.TIME, time);
            }
        }
        fields.put(CatalogRecord.PATH, path);
        return new CatalogRecord(fields);
    }

    /**
     * Match every path; the result keeps the input order of the matching paths
     * whatever the number of threads.
     */
    public List<CatalogRecord> extractAll(List<Path> paths, int threads) {
        logger.info("[RecordExtractor] Start file pattern matching over " + paths.size() + " files");
        WorkerPool pool = new WorkerPool("matcher", threads);
        List<CatalogRecord> results = pool.map(paths, p -> extract(p.toString()));

        List<CatalogRecord> matched = new ArrayList<>();
        for (CatalogRecord record : results) {
            if (record != null) {
                matched.add(record);
            }
        }
        logger.info("[RecordExtractor] " + matched.size() + " files matched");
        return matched;
    }

    /**
     * Named groups in declaration order. {@link Pattern#namedGroups()} only
     * exists from JDK 20, so the names are read off the pattern source.
     */
    static List<String> groupNames(Pattern pattern) {
        List<String> names = new ArrayList<>();
        Matcher m = GROUP_NAME.matcher(pattern.pattern());
        while (m.find()) {
            int start = m.start();
            int backslashes = 0;
            for (int i = start - 1; i >= 0 && pattern.pattern().charAt(i) == '\\'; i--) {
                backslashes++;
            }
            if (backslashes % 2 == 0 && !names.contains(m.group(1))) {
                names.add(m.group(1));
            }
        }
        return names;
    }
}
