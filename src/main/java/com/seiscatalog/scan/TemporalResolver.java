package com.seiscatalog.scan;

import com.seiscatalog.AppLogger;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Map;

/**
 * Derives a timestamp from the date fields of a record.
 *
 * Year + day-of-year wins over year + month + day. Hour and minute default
 * to zero; a two-digit year is read as 20YY. Incomplete or impossible dates
 * yield null and a warning, never an exception.
 */
public class TemporalResolver {

    public static final String YEAR = "year";
    public static final String MONTH = "month";
    public static final String DAY = "day";
    public static final String JDAY = "jday";
    public static final String HOUR = "hour";
    public static final String MINUTE = "minute";

    private final AppLogger logger = AppLogger.get();

    public LocalDateTime resolve(Map<String, ?> fields) {
        try {
            Integer year = intField(fields, YEAR);
            if (year != null && text(fields, YEAR).length() == 2) {
                year = 2000 + year;
            }
            Integer month = intField(fields, MONTH);
            Integer day = intField(fields, DAY);
            Integer jday = intField(fields, JDAY);
            Integer hour = intField(fields, HOUR);
            Integer minute = intField(fields, MINUTE);
            LocalTime timeOfDay = LocalTime.of(hour != null ? hour : 0, minute != null ? minute : 0);

            if (year != null && jday != null) {
                LocalDate jan1 = LocalDate.of(year, 1, 1);
                if (jday < 1 || jday > jan1.lengthOfYear()) {
                    logger.warn("[TemporalResolver] Invalid day of year " + jday + " for " + year + ": " + fields);
                    return null;
                }
                return LocalDateTime.of(jan1.plusDays(jday - 1L), timeOfDay);
            }
            if (year != null && month != null && day != null) {
                return LocalDateTime.of(LocalDate.of(year, month, day), timeOfDay);
            }
            logger.warn("[TemporalResolver] Insufficient time fields: " + fields);
            return null;
        } catch (NumberFormatException | DateTimeException e) {
            logger.warn("[TemporalResolver] Invalid date fields: " + fields + ", error: " + e.getMessage());
            return null;
        }
    }

    private static Integer intField(Map<String, ?> fields, String name) {
        String value = text(fields, name);
        if (value == null || value.isEmpty()) {
            return null;
        }
        return Integer.parseInt(value.trim());
    }

    private static String text(Map<String, ?> fields, String name) {
        Object value = fields.get(name);
        return value != null ? value.toString() : null;
    }
}
