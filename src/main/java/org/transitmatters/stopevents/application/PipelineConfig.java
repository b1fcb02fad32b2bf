package org.transitmatters.stopevents.application;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Typed access to the application configuration. Every value can be overridden with an environment variable,
 * see application.conf.
 */
public class PipelineConfig {
    private final Config config;

    public PipelineConfig(Config config) {
        this.config = config;
    }

    public static PipelineConfig load() {
        return new PipelineConfig(ConfigFactory.load());
    }

    public Config getConfig() {
        return config;
    }

    public int getWorkers() {
        return config.getInt("pipeline.workers");
    }

    public LocalDate getRailFormatCutover() {
        return LocalDate.parse(config.getString("historic.rail.formatCutover"));
    }

    public LocalDate getBusUtcCutover() {
        return LocalDate.parse(config.getString("historic.bus.utcCutover"));
    }

    public List<String> getBusRoutes() {
        return config.getStringList("historic.bus.routes");
    }

    public Optional<LocalDate> getFerryStartDate() {
        return optionalDate("historic.ferry.startDate");
    }

    public Optional<LocalDate> getFerryEndDate() {
        return optionalDate("historic.ferry.endDate");
    }

    public LocalDate getNonRevenueCutover() {
        return LocalDate.parse(config.getString("realtime.nonRevenueCutover"));
    }

    public Optional<Path> getScheduleArchiveDir() {
        return optionalString("schedule.archiveDir").map(Paths::get);
    }

    public long getScheduleCacheSize() {
        return config.getLong("schedule.cacheSize");
    }

    public Path getOutputDir() {
        return Paths.get(config.getString("output.dir"));
    }

    private Optional<String> optionalString(String path) {
        if (!config.hasPath(path)) {
            return Optional.empty();
        }
        String value = config.getString(path).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private Optional<LocalDate> optionalDate(String path) {
        return optionalString(path).map(LocalDate::parse);
    }
}
