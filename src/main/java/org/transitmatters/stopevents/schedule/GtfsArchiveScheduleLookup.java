package org.transitmatters.stopevents.schedule;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import org.transitmatters.stopevents.normalizer.SourceReadException;
import org.transitmatters.stopevents.normalizer.SourceTable;
import org.transitmatters.stopevents.processing.ProcessorUtils;
import org.transitmatters.stopevents.utils.ServiceDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Schedule lookup backed by a local directory of unpacked GTFS feeds.
 * <p>
 * The directory holds an {@code archives.csv} index with the columns
 * {@code feed_id,feed_start_date,feed_end_date,path}, where path is the feed directory relative to the index.
 */
public class GtfsArchiveScheduleLookup implements ScheduleLookup {
    private static final Logger log = LoggerFactory.getLogger(GtfsArchiveScheduleLookup.class);

    public static final String INDEX_FILE = "archives.csv";

    static final int EXCEPTION_SERVICE_ADDED = 1;
    static final int EXCEPTION_SERVICE_REMOVED = 2;

    private final Path archiveDir;
    // Parsed feeds are reused for consecutive service dates of the same feed
    private final LoadingCache<ArchiveEntry, GtfsFeed> feeds;

    public GtfsArchiveScheduleLookup(Path archiveDir) {
        this(archiveDir, 2);
    }

    public GtfsArchiveScheduleLookup(Path archiveDir, long cachedFeeds) {
        this.archiveDir = archiveDir;
        this.feeds = Caffeine.newBuilder()
                .maximumSize(cachedFeeds)
                .build(entry -> GtfsFeed.read(archiveDir.resolve(entry.path)));
    }

    @Override
    public List<FeedVersion> lookup(LocalDate serviceDate) throws IOException {
        List<FeedVersion> versions = new ArrayList<>();
        for (ArchiveEntry entry : readIndex()) {
            if (serviceDate.isBefore(entry.startDate) || serviceDate.isAfter(entry.endDate)) {
                continue;
            }
            GtfsFeed feed;
            try {
                feed = feeds.get(entry);
            } catch (CompletionException e) {
                if (e.getCause() instanceof IOException) {
                    throw (IOException) e.getCause();
                }
                throw new IOException("Failed to read feed " + entry.feedId, e.getCause());
            } catch (IllegalArgumentException e) {
                throw new IOException("Malformed feed " + entry.feedId, e);
            }
            versions.add(feed.forDate(entry, serviceDate));
        }
        log.debug("Found {} feed versions for {}", versions.size(), serviceDate);
        return versions;
    }

    List<ArchiveEntry> readIndex() throws IOException {
        SourceTable index = readTable(archiveDir.resolve(INDEX_FILE));
        int feedId = requireColumn(index, "feed_id");
        int start = requireColumn(index, "feed_start_date");
        int end = requireColumn(index, "feed_end_date");
        int path = requireColumn(index, "path");

        List<ArchiveEntry> entries = new ArrayList<>();
        for (String[] row : index.getRows()) {
            entries.add(new ArchiveEntry(row[feedId].trim(),
                    ServiceDates.parseDate(row[start]),
                    ServiceDates.parseDate(row[end]),
                    row[path].trim()));
        }
        return entries;
    }

    static SourceTable readTable(Path file) throws IOException {
        try {
            return SourceTable.fromFile(file);
        } catch (SourceReadException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    static int requireColumn(SourceTable table, String column) throws IOException {
        return table.getColumnIndex(column)
                .orElseThrow(() -> new IOException(table.getName() + " has no column " + column));
    }

    /**
     * @return seconds after midnight, for GTFS times such as 25:10:00 beyond 24 hours
     */
    static int parseGtfsTime(String value) {
        String[] parts = value.trim().split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Invalid GTFS time " + value);
        }
        return Integer.parseInt(parts[0]) * 3600 + Integer.parseInt(parts[1]) * 60 + Integer.parseInt(parts[2]);
    }

    static final class ArchiveEntry {
        final String feedId;
        final LocalDate startDate;
        final LocalDate endDate;
        final String path;

        ArchiveEntry(String feedId, LocalDate startDate, LocalDate endDate, String path) {
            this.feedId = feedId;
            this.startDate = startDate;
            this.endDate = endDate;
            this.path = path;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ArchiveEntry that = (ArchiveEntry) o;
            return feedId.equals(that.feedId) && path.equals(that.path);
        }

        @Override
        public int hashCode() {
            return feedId.hashCode() * 31 + path.hashCode();
        }
    }

    /**
     * Tables of one unpacked GTFS feed.
     */
    static final class GtfsFeed {
        private final List<ScheduledRoute> routes = new ArrayList<>();
        private final Map<String, List<ScheduledTrip>> tripsByService = new HashMap<>();
        private final Map<String, List<ScheduledStopTime>> stopTimesByTrip = new HashMap<>();
        private final Map<String, ServiceCalendar> calendars = new HashMap<>();
        // service id -> date -> exception type
        private final Map<String, Map<LocalDate, Integer>> calendarExceptions = new HashMap<>();

        static GtfsFeed read(Path dir) throws IOException {
            log.info("Reading GTFS feed from {}", dir);
            GtfsFeed feed = new GtfsFeed();
            feed.readRoutes(readTable(dir.resolve("routes.txt")));
            feed.readTrips(readTable(dir.resolve("trips.txt")));
            feed.readStopTimes(readTable(dir.resolve("stop_times.txt")));
            if (Files.exists(dir.resolve("calendar.txt"))) {
                feed.readCalendar(readTable(dir.resolve("calendar.txt")));
            }
            if (Files.exists(dir.resolve("calendar_dates.txt"))) {
                feed.readCalendarDates(readTable(dir.resolve("calendar_dates.txt")));
            }
            return feed;
        }

        private void readRoutes(SourceTable table) throws IOException {
            int routeId = requireColumn(table, "route_id");
            for (String[] row : table.getRows()) {
                String id = row[routeId].trim();
                routes.add(new ScheduledRoute(id, ProcessorUtils.isBranchRoute(id) ? ProcessorUtils.trunkRouteId(id) : null));
            }
        }

        private void readTrips(SourceTable table) throws IOException {
            int routeId = requireColumn(table, "route_id");
            int serviceId = requireColumn(table, "service_id");
            int tripId = requireColumn(table, "trip_id");
            int directionId = requireColumn(table, "direction_id");
            Integer trunk = table.getColumnIndex("trunk_route_id").orElse(null);
            Integer branch = table.getColumnIndex("branch_route_id").orElse(null);

            for (String[] row : table.getRows()) {
                ScheduledTrip trip = new ScheduledTrip(row[tripId].trim(), row[routeId].trim(),
                        Integer.parseInt(row[directionId].trim()),
                        optional(row, trunk), optional(row, branch));
                tripsByService.computeIfAbsent(row[serviceId].trim(), k -> new ArrayList<>()).add(trip);
            }
        }

        private void readStopTimes(SourceTable table) throws IOException {
            int tripId = requireColumn(table, "trip_id");
            int arrival = requireColumn(table, "arrival_time");
            int departure = requireColumn(table, "departure_time");
            int stopId = requireColumn(table, "stop_id");
            int stopSequence = requireColumn(table, "stop_sequence");

            int skipped = 0;
            for (String[] row : table.getRows()) {
                String arrivalValue = optional(row, arrival);
                String departureValue = optional(row, departure);
                if (arrivalValue == null && departureValue == null) {
                    // untimed stop
                    skipped++;
                    continue;
                }
                int arrivalSeconds = parseGtfsTime(arrivalValue != null ? arrivalValue : departureValue);
                int departureSeconds = parseGtfsTime(departureValue != null ? departureValue : arrivalValue);
                ScheduledStopTime stopTime = new ScheduledStopTime(row[tripId].trim(), row[stopId].trim(),
                        Integer.parseInt(row[stopSequence].trim()), arrivalSeconds, departureSeconds);
                stopTimesByTrip.computeIfAbsent(stopTime.getTripId(), k -> new ArrayList<>()).add(stopTime);
            }
            if (skipped > 0) {
                log.debug("Skipped {} untimed stop times", skipped);
            }
        }

        private void readCalendar(SourceTable table) throws IOException {
            int serviceId = requireColumn(table, "service_id");
            int start = requireColumn(table, "start_date");
            int end = requireColumn(table, "end_date");
            int[] days = new int[7];
            for (DayOfWeek day : DayOfWeek.values()) {
                days[day.ordinal()] = requireColumn(table, day.name().toLowerCase());
            }

            for (String[] row : table.getRows()) {
                Set<DayOfWeek> activeDays = new HashSet<>();
                for (DayOfWeek day : DayOfWeek.values()) {
                    if ("1".equals(row[days[day.ordinal()]].trim())) {
                        activeDays.add(day);
                    }
                }
                calendars.put(row[serviceId].trim(), new ServiceCalendar(
                        ServiceDates.parseDate(row[start]), ServiceDates.parseDate(row[end]), activeDays));
            }
        }

        private void readCalendarDates(SourceTable table) throws IOException {
            int serviceId = requireColumn(table, "service_id");
            int date = requireColumn(table, "date");
            int exceptionType = requireColumn(table, "exception_type");

            for (String[] row : table.getRows()) {
                calendarExceptions.computeIfAbsent(row[serviceId].trim(), k -> new HashMap<>())
                        .put(ServiceDates.parseDate(row[date]), Integer.parseInt(row[exceptionType].trim()));
            }
        }

        boolean isServiceActive(String serviceId, LocalDate date) {
            Integer exception = calendarExceptions.getOrDefault(serviceId, Map.of()).get(date);
            if (exception != null) {
                return exception == EXCEPTION_SERVICE_ADDED;
            }
            ServiceCalendar calendar = calendars.get(serviceId);
            return calendar != null && calendar.isActive(date);
        }

        FeedVersion forDate(ArchiveEntry entry, LocalDate date) {
            List<ScheduledTrip> trips = new ArrayList<>();
            List<ScheduledStopTime> stopTimes = new ArrayList<>();
            tripsByService.forEach((serviceId, serviceTrips) -> {
                if (isServiceActive(serviceId, date)) {
                    for (ScheduledTrip trip : serviceTrips) {
                        trips.add(trip);
                        stopTimes.addAll(stopTimesByTrip.getOrDefault(trip.getTripId(), ImmutableList.of()));
                    }
                }
            });
            return new FeedVersion(entry.feedId, entry.startDate, entry.endDate, routes, trips, stopTimes);
        }

        private static String optional(String[] row, Integer index) {
            if (index == null || index >= row.length || row[index] == null || row[index].trim().isEmpty()) {
                return null;
            }
            return row[index].trim();
        }
    }

    static final class ServiceCalendar {
        final LocalDate startDate;
        final LocalDate endDate;
        final Set<DayOfWeek> days;

        ServiceCalendar(LocalDate startDate, LocalDate endDate, Set<DayOfWeek> days) {
            this.startDate = startDate;
            this.endDate = endDate;
            this.days = days;
        }

        boolean isActive(LocalDate date) {
            return !date.isBefore(startDate) && !date.isAfter(endDate) && days.contains(date.getDayOfWeek());
        }
    }
}
