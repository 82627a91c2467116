package com.seiscatalog.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seiscatalog.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CriteriaParserTest {

    private final CriteriaParser parser = new CriteriaParser(new ObjectMapper());

    @Test
    void parsesListAndDatetimeRange() {
        String json = "{\"station\":{\"type\":\"list\",\"data_type\":\"str\",\"value\":[\"ABC\",\"XYZ\"]},"
                + "\"time\":{\"type\":\"range\",\"data_type\":\"datetime\","
                + "\"value\":[\"2023-01-01 00:00:00\",\"2023-01-02T12:00:00\"]}}";

        FilterCriteria criteria = parser.parse(json);

        Criterion station = criteria.getListCriteria().get("station");
        assertEquals(FilterMode.LIST, station.getMode());
        assertEquals(DataType.STR, station.getDataType());
        assertEquals(List.of("ABC", "XYZ"), station.getValues());

        Criterion time = criteria.getRangeCriteria().get("time");
        assertEquals(1, time.getRanges().size());
        assertEquals(LocalDateTime.of(2023, 1, 1, 0, 0), time.getRanges().get(0).getStart());
        assertEquals(LocalDateTime.of(2023, 1, 2, 12, 0), time.getRanges().get(0).getEnd());
    }

    @Test
    void parsesFixtureFile() throws Exception {
        URL resource = getClass().getResource("/criteria/station-and-time.json");
        assertNotNull(resource);
        Path file = Paths.get(resource.toURI());

        FilterCriteria criteria = parser.parseFile(file);

        assertEquals(List.of("ABC", "XYZ"), criteria.getListCriteria().get("station").getValues());
        Criterion.Range range = criteria.getRangeCriteria().get("time").getRanges().get(0);
        assertEquals(LocalDateTime.of(2023, 1, 1, 23, 59, 59), range.getEnd());
        assertEquals(DataType.DATETIME, criteria.getTypeMap().get("time"));
    }

    @Test
    void pairsRangeValuesAndDropsOddTail() {
        FilterCriteria criteria = parser.parse(
                "{\"size\":{\"type\":\"range\",\"data_type\":\"int\",\"value\":[1,10,20,30,99]}}");

        List<Criterion.Range> ranges = criteria.getRangeCriteria().get("size").getRanges();
        assertEquals(List.of(new Criterion.Range(1, 10), new Criterion.Range(20, 30)), ranges);
    }

    @Test
    void singleRangeValueYieldsNoCriterion() {
        FilterCriteria criteria = parser.parse(
                "{\"size\":{\"type\":\"range\",\"data_type\":\"int\",\"value\":[5]}}");
        assertTrue(criteria.isEmpty());
    }

    @Test
    void missingTypeOrValueIsAnError() {
        assertThrows(ConfigurationException.class,
                () -> parser.parse("{\"station\":{\"value\":[\"ABC\"]}}"));
        assertThrows(ConfigurationException.class,
                () -> parser.parse("{\"station\":{\"type\":\"list\"}}"));
        assertThrows(ConfigurationException.class,
                () -> parser.parse("{\"station\":\"ABC\"}"));
    }

    @Test
    void unknownFilterTypeIsSkipped() {
        FilterCriteria criteria = parser.parse(
                "{\"station\":{\"type\":\"regex\",\"value\":[\"A.*\"]},"
                        + "\"component\":{\"type\":\"list\",\"value\":[\"BHZ\"]}}");
        assertFalse(criteria.getListCriteria().containsKey("station"));
        assertTrue(criteria.getListCriteria().containsKey("component"));
    }

    @Test
    void nonListValueIsSkipped() {
        FilterCriteria criteria = parser.parse("{\"station\":{\"type\":\"list\",\"value\":\"ABC\"}}");
        assertTrue(criteria.isEmpty());
    }

    @Test
    void unknownDataTypeDisablesTypeCheck() {
        FilterCriteria criteria = parser.parse(
                "{\"station\":{\"type\":\"list\",\"data_type\":\"text\",\"value\":[\"ABC\"]}}");
        assertNull(criteria.getListCriteria().get("station").getDataType());
    }

    @Test
    void parsesInMemoryMapWithDatetimeObjects() {
        Map<String, Object> time = new LinkedHashMap<>();
        time.put("type", "range");
        time.put("data_type", "datetime");
        time.put("value", List.of(LocalDateTime.of(2023, 1, 1, 0, 0), "2023-01-03"));

        FilterCriteria criteria = parser.parse(Map.of("time", time));

        Criterion.Range range = criteria.getRangeCriteria().get("time").getRanges().get(0);
        assertEquals(LocalDateTime.of(2023, 1, 1, 0, 0), range.getStart());
        assertEquals(LocalDateTime.of(2023, 1, 3, 0, 0), range.getEnd());
    }

    @Test
    void invalidJsonIsAnError() {
        assertThrows(ConfigurationException.class, () -> parser.parse("{not json"));
        assertThrows(ConfigurationException.class, () -> parser.parse("[1, 2]"));
    }

    @Test
    void unparseableDatetimeBoundIsAnError() {
        assertThrows(ConfigurationException.class, () -> parser.parse(
                "{\"time\":{\"type\":\"range\",\"data_type\":\"datetime\",\"value\":[\"yesterday\",\"today\"]}}"));
    }
}
