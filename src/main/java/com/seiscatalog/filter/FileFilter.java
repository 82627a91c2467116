package com.seiscatalog.filter;

import com.seiscatalog.AppLogger;
import com.seiscatalog.WorkerPool;
import com.seiscatalog.models.CatalogRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies {@link FilterCriteria} to a record list. Each record is checked
 * independently on the worker pool; passing records are returned as the
 * same instances, in their original order.
 */
public class FileFilter {

    private final FilterCriteria criteria;
    private final int threads;
    private final AppLogger logger = AppLogger.get();

    public FileFilter(FilterCriteria criteria, int threads) {
        this.criteria = criteria != null ? criteria : FilterCriteria.empty();
        this.threads = Math.max(1, threads);
    }

    public FileFilter(FilterCriteria criteria) {
        this(criteria, 1);
    }

    public FilterCriteria getCriteria() {
        return criteria;
    }

    public boolean isValid(CatalogRecord record) {
        for (Criterion criterion : criteria.getListCriteria().values()) {
            if (!criterion.test(record)) {
                return false;
            }
        }
        for (Criterion criterion : criteria.getRangeCriteria().values()) {
            if (!criterion.test(record)) {
                return false;
            }
        }
        return true;
    }

    public List<CatalogRecord> filter(List<CatalogRecord> records) {
        if (records == null || records.isEmpty()) {
            logger.warn("[FileFilter] No files provided for filtering");
            return new ArrayList<>();
        }
        logger.debug("[FileFilter] Filtering " + records.size() + " files");

        WorkerPool pool = new WorkerPool("filter", threads);
        List<Boolean> results = pool.map(records, this::isValid);

        List<CatalogRecord> passed = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            if (Boolean.TRUE.equals(results.get(i))) {
                passed.add(records.get(i));
            }
        }
        logger.info("[FileFilter] Filtering finished, " + passed.size() + " files passed");
        return passed;
    }

    /**
     * Log the parsed criteria at debug level.
     */
    public void describeCriteria() {
        logger.debug("[FileFilter] ===== Filter Criteria Summary =====");
        logger.debug("[FileFilter] List Criteria:");
        for (Criterion criterion : criteria.getListCriteria().values()) {
            logger.debug("[FileFilter]   - " + criterion);
        }
        logger.debug("[FileFilter] Range Criteria:");
        for (Criterion criterion : criteria.getRangeCriteria().values()) {
            logger.debug("[FileFilter]   - " + criterion);
        }
        logger.debug("[FileFilter] Type Map (field: declared_type):");
        for (Map.Entry<String, DataType> entry : criteria.getTypeMap().entrySet()) {
            logger.debug("[FileFilter]   - " + entry.getKey() + ": " + entry.getValue());
        }
    }
}
