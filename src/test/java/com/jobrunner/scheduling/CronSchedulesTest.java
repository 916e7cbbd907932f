package com.jobrunner.scheduling;

import com.jobrunner.core.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class CronSchedulesTest {

    @Test
    public void testNextFireIsStrictlyAfter() throws Exception {
        Instant from = ZonedDateTime.of(2024, 3, 1, 2, 30, 0, 0, ZoneId.systemDefault()).toInstant();

        ZonedDateTime next = CronSchedules.nextFire("0 3 * * *", from).atZone(ZoneId.systemDefault());
        assertEquals(3, next.getHour());
        assertEquals(0, next.getMinute());
        assertEquals(1, next.getDayOfMonth());

        Instant atThree = next.toInstant();
        assertTrue(CronSchedules.nextFire("0 3 * * *", atThree).isAfter(atThree));
    }

    @Test
    public void testMissingCrontab() {
        ValidationException e = assertThrows(ValidationException.class, () -> CronSchedules.parse("  "));
        assertEquals(1, e.getErrors().get(CronSchedules.FIELD).size());
        assertThrows(ValidationException.class, () -> CronSchedules.parse(null));
    }

    @Test
    public void testMalformedCrontab() {
        ValidationException e = assertThrows(ValidationException.class, () -> CronSchedules.parse("every tuesday"));
        assertTrue(e.hasError("crontab"));
    }
}
