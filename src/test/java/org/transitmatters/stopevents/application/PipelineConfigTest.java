package org.transitmatters.stopevents.application;

import com.google.common.collect.ImmutableMap;
import com.typesafe.config.ConfigFactory;
import org.junit.Test;

import java.nio.file.Paths;
import java.time.LocalDate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PipelineConfigTest {

    @Test
    public void defaultsAreLoaded() {
        PipelineConfig config = new PipelineConfig(ConfigFactory.parseResources("application.conf").resolve());

        assertEquals(5, config.getWorkers());
        assertEquals(LocalDate.of(2024, 1, 1), config.getRailFormatCutover());
        assertEquals(LocalDate.of(2024, 6, 1), config.getBusUtcCutover());
        assertEquals(LocalDate.of(2023, 12, 1), config.getNonRevenueCutover());
        assertTrue(config.getBusRoutes().isEmpty());
        assertFalse(config.getFerryStartDate().isPresent());
        assertFalse(config.getScheduleArchiveDir().isPresent());
        assertEquals(8, config.getScheduleCacheSize());
        assertEquals(Paths.get("data/output"), config.getOutputDir());
    }

    @Test
    public void valuesCanBeOverridden() {
        PipelineConfig config = new PipelineConfig(ConfigFactory.parseMap(ImmutableMap.of(
                "schedule.archiveDir", "/data/gtfs",
                "historic.ferry.endDate", "2024-03-31"))
                .withFallback(ConfigFactory.parseResources("application.conf"))
                .resolve());

        assertEquals(Paths.get("/data/gtfs"), config.getScheduleArchiveDir().get());
        assertEquals(LocalDate.of(2024, 3, 31), config.getFerryEndDate().get());
    }
}
