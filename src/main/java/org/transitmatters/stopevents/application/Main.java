package org.transitmatters.stopevents.application;

import org.transitmatters.stopevents.models.SourceKind;
import org.transitmatters.stopevents.output.LocalDirectorySink;
import org.transitmatters.stopevents.schedule.GtfsArchiveScheduleLookup;
import org.transitmatters.stopevents.schedule.ScheduleLookup;
import org.transitmatters.stopevents.utils.ServiceDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final String USAGE = "Usage: <realtime_feed|historic_rail|historic_bus|historic_ferry> <input.csv> [service date]";

    public static void main(String[] args) {
        if (args.length < 2) {
            log.error(USAGE);
            System.exit(2);
        }

        log.info("Starting stop event processor");
        PipelineConfig config = PipelineConfig.load();
        try {
            final SourceKind sourceKind = SourceKind.valueOf(args[0].toUpperCase());
            final Path input = Paths.get(args[1]);
            final LocalDate serviceDate = args.length > 2
                    ? ServiceDates.parseDate(args[2])
                    : ServiceDates.currentServiceDate(Clock.systemUTC());

            EventPipeline pipeline = new EventPipeline(config, createScheduleLookup(config),
                    new LocalDirectorySink(config.getOutputDir()));
            Runtime.getRuntime().addShutdownHook(new Thread(pipeline::cancel));

            ProcessingResult result = pipeline.run(input, sourceKind, serviceDate);
            log.info("Wrote {} partitions to {}", result.getPartitions().size(), config.getOutputDir());
        } catch (Exception e) {
            log.error("Exception at main", e);
            System.exit(1);
        }
    }

    static ScheduleLookup createScheduleLookup(PipelineConfig config) {
        return config.getScheduleArchiveDir()
                .<ScheduleLookup>map(GtfsArchiveScheduleLookup::new)
                .orElseGet(() -> {
                    log.warn("No schedule archive configured, events will not have scheduled values");
                    return serviceDate -> Collections.emptyList();
                });
    }
}
