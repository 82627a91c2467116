package com.seiscatalog.filter;

import com.seiscatalog.models.CatalogRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileFilterTest {

    private static CatalogRecord record(String station, String component, LocalDateTime time) {
        CatalogRecord record = new CatalogRecord(Map.of("station", station, "component", component));
        record.put(CatalogRecord.TIME, time);
        record.put(CatalogRecord.PATH, "/data/" + station + "_" + component + ".sac");
        return record;
    }

    private static List<CatalogRecord> sample() {
        List<CatalogRecord> records = new ArrayList<>();
        records.add(record("ABC", "BHZ", LocalDateTime.of(2023, 1, 1, 0, 0)));
        records.add(record("DEF", "LHZ", LocalDateTime.of(2023, 1, 2, 0, 0)));
        records.add(record("XYZ", "BHZ", LocalDateTime.of(2023, 1, 2, 23, 59, 59)));
        records.add(record("XYZ", "BHN", LocalDateTime.of(2023, 1, 3, 0, 0)));
        return records;
    }

    @Test
    void listCriterionKeepsMembers() {
        FilterCriteria criteria = FilterCriteria.builder()
                .list("station", DataType.STR, "ABC", "XYZ")
                .build();

        List<CatalogRecord> passed = new FileFilter(criteria).filter(sample());

        assertEquals(3, passed.size());
        for (CatalogRecord record : passed) {
            assertTrue(List.of("ABC", "XYZ").contains(record.get("station")));
        }
    }

    @Test
    void rangeBoundsAreInclusive() {
        FilterCriteria criteria = FilterCriteria.builder()
                .range("time", DataType.DATETIME,
                        LocalDateTime.of(2023, 1, 2, 0, 0), LocalDateTime.of(2023, 1, 2, 23, 59, 59))
                .build();

        List<CatalogRecord> passed = new FileFilter(criteria).filter(sample());

        assertEquals(2, passed.size());
        assertEquals("DEF", passed.get(0).get("station"));
        assertEquals("XYZ", passed.get(1).get("station"));
    }

    @Test
    void anyOfSeveralRangesSuffices() {
        FilterCriteria criteria = FilterCriteria.builder()
                .range("time", DataType.DATETIME,
                        LocalDateTime.of(2023, 1, 1, 0, 0), LocalDateTime.of(2023, 1, 1, 0, 0),
                        LocalDateTime.of(2023, 1, 3, 0, 0), LocalDateTime.of(2023, 1, 4, 0, 0))
                .build();

        List<CatalogRecord> passed = new FileFilter(criteria).filter(sample());

        assertEquals(2, passed.size());
        assertEquals("ABC", passed.get(0).get("station"));
        assertEquals("BHN", passed.get(1).get("component"));
    }

    @Test
    void allCriteriaMustPass() {
        FilterCriteria criteria = FilterCriteria.builder()
                .list("station", DataType.STR, "XYZ")
                .list("component", DataType.STR, "BHZ")
                .build();

        List<CatalogRecord> passed = new FileFilter(criteria).filter(sample());

        assertEquals(1, passed.size());
        assertEquals("BHZ", passed.get(0).get("component"));
    }

    @Test
    void oddRangeListDropsTrailingValue() {
        FilterCriteria criteria = FilterCriteria.builder()
                .range("time", DataType.DATETIME,
                        LocalDateTime.of(2023, 1, 1, 0, 0), LocalDateTime.of(2023, 1, 1, 12, 0),
                        LocalDateTime.of(2023, 1, 3, 0, 0))
                .build();

        assertEquals(1, criteria.getRangeCriteria().get("time").getRanges().size());
        assertEquals(1, new FileFilter(criteria).filter(sample()).size());
    }

    @Test
    void missingFieldFails() {
        FilterCriteria criteria = FilterCriteria.builder()
                .list("network", DataType.STR, "IU")
                .build();
        assertTrue(new FileFilter(criteria).filter(sample()).isEmpty());
    }

    @Test
    void typeMismatchFails() {
        FilterCriteria criteria = FilterCriteria.builder()
                .range("station", DataType.DATETIME,
                        LocalDateTime.of(2023, 1, 1, 0, 0), LocalDateTime.of(2023, 1, 4, 0, 0))
                .build();
        assertTrue(new FileFilter(criteria).filter(sample()).isEmpty());
    }

    @Test
    void numericTypesCompareByValue() {
        List<CatalogRecord> records = new ArrayList<>();
        records.add(new CatalogRecord(Map.of("station", "ABC", "size", 150)));
        records.add(new CatalogRecord(Map.of("station", "DEF", "size", 5000)));
        records.add(new CatalogRecord(Map.of("station", "GHI", "sampleF", "100")));

        FilterCriteria bySize = FilterCriteria.builder().range("size", DataType.INT, 100, 2000).build();
        List<CatalogRecord> passed = new FileFilter(bySize).filter(records);
        assertEquals(1, passed.size());
        assertEquals("ABC", passed.get(0).get("station"));

        FilterCriteria bySizeList = FilterCriteria.builder().list("size", DataType.INT, 150.0, 7).build();
        passed = new FileFilter(bySizeList).filter(records);
        assertEquals(1, passed.size());
        assertEquals("ABC", passed.get(0).get("station"));
    }

    @Test
    void listMembershipDoesNotCoerceStrings() {
        List<CatalogRecord> records = List.of(
                new CatalogRecord(Map.of("station", "GHI", "sampleF", "100")),
                new CatalogRecord(Map.of("station", "JKL", "sampleF", "01")));

        FilterCriteria byNumber = FilterCriteria.builder().list("sampleF", DataType.NUMERIC, 100.0, 1).build();
        assertTrue(new FileFilter(byNumber).filter(records).isEmpty());

        FilterCriteria byText = FilterCriteria.builder().list("sampleF", DataType.STR, "100", "1").build();
        List<CatalogRecord> passed = new FileFilter(byText).filter(records);
        assertEquals(1, passed.size());
        assertEquals("GHI", passed.get(0).get("station"));
    }

    @Test
    void nullFieldValueFailsOnlyThatRecord() {
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("station", "ABC");
        withNull.put("size", null);
        List<CatalogRecord> records = List.of(
                new CatalogRecord(withNull),
                new CatalogRecord(Map.of("station", "DEF", "size", 5)));

        assertFalse(records.get(0).has("size"));
        FilterCriteria criteria = FilterCriteria.builder().range("size", DataType.INT, 0, 10).build();
        List<CatalogRecord> passed = new FileFilter(criteria, 2).filter(records);

        assertEquals(1, passed.size());
        assertEquals("DEF", passed.get(0).get("station"));
    }

    @Test
    void incomparableRangeValueFails() {
        List<CatalogRecord> records = List.of(new CatalogRecord(Map.of("station", "ABC")));
        FilterCriteria criteria = FilterCriteria.builder()
                .range("station", null, LocalDateTime.of(2023, 1, 1, 0, 0), LocalDateTime.of(2023, 1, 4, 0, 0))
                .build();
        assertTrue(new FileFilter(criteria).filter(records).isEmpty());
    }

    @Test
    void emptyCriteriaKeepEverything() {
        List<CatalogRecord> records = sample();
        assertEquals(records, new FileFilter(FilterCriteria.empty()).filter(records));
    }

    @Test
    void emptyInputYieldsEmptyOutput() {
        FilterCriteria criteria = FilterCriteria.builder().list("station", DataType.STR, "ABC").build();
        assertTrue(new FileFilter(criteria).filter(List.of()).isEmpty());
    }

    @Test
    void resultIsOrderedSubsequenceOfSameInstances() {
        List<CatalogRecord> records = sample();
        FilterCriteria criteria = FilterCriteria.builder().list("component", DataType.STR, "BHZ", "BHN").build();

        List<CatalogRecord> passed = new FileFilter(criteria).filter(records);

        assertSame(records.get(0), passed.get(0));
        assertSame(records.get(2), passed.get(1));
        assertSame(records.get(3), passed.get(2));
    }

    @Test
    void filteringIsIdempotent() {
        FilterCriteria criteria = FilterCriteria.builder().list("station", DataType.STR, "XYZ").build();
        FileFilter filter = new FileFilter(criteria);

        List<CatalogRecord> once = filter.filter(sample());
        List<CatalogRecord> twice = filter.filter(once);

        assertEquals(once, twice);
    }

    @Test
    void poolSizeDoesNotChangeResult() {
        List<CatalogRecord> records = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            records.add(record(i % 3 == 0 ? "ABC" : "DEF", "BHZ", LocalDateTime.of(2023, 1, 1, 0, 0).plusHours(i)));
        }
        FilterCriteria criteria = FilterCriteria.builder()
                .list("station", DataType.STR, "ABC")
                .range("time", DataType.DATETIME,
                        LocalDateTime.of(2023, 1, 2, 0, 0), LocalDateTime.of(2023, 1, 10, 0, 0))
                .build();

        List<CatalogRecord> serial = new FileFilter(criteria, 1).filter(records);
        List<CatalogRecord> parallel = new FileFilter(criteria, 6).filter(records);

        assertFalse(serial.isEmpty());
        assertEquals(serial, parallel);
    }
}
