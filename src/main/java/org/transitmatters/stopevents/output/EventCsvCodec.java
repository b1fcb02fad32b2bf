package org.transitmatters.stopevents.output;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import org.transitmatters.stopevents.models.Event;
import org.transitmatters.stopevents.models.EventType;
import org.transitmatters.stopevents.utils.ServiceDates;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Reads and writes the events.csv format: one header row, one row per event, absent values left empty.
 */
public class EventCsvCodec {
    private EventCsvCodec() {}

    public static final String[] HEADER = {
            "service_date",
            "route_id",
            "trip_id",
            "direction_id",
            "stop_id",
            "stop_sequence",
            "vehicle_id",
            "vehicle_label",
            "event_type",
            "event_time",
            "travel_time_seconds",
            "dwell_time_seconds",
            "headway_seconds",
            "headway_branch_seconds",
            "scheduled_tt",
            "scheduled_headway",
            "scheduled_headway_branch",
            "vehicle_consist"
    };

    public static final DateTimeFormatter EVENT_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssxxx");

    /**
     * Encodes a partition. Compressed output carries no timestamp in its gzip header,
     * so the same events always encode to the same bytes.
     */
    public static byte[] encode(List<Event> events, boolean compressed) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (OutputStream out = compressed ? new GZIPOutputStream(bytes) : bytes;
             Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
            write(events, writer);
        }
        return bytes.toByteArray();
    }

    public static void write(List<Event> events, Writer writer) throws IOException {
        ICSVWriter csv = new CSVWriter(writer);
        csv.writeNext(HEADER, false);
        for (Event event : events) {
            csv.writeNext(toRow(event), false);
        }
        csv.flush();
    }

    static String[] toRow(Event event) {
        return new String[]{
                event.getServiceDate().toString(),
                nullToEmpty(event.getRouteId()),
                event.getTripId(),
                Integer.toString(event.getDirectionId()),
                event.getStopId(),
                Integer.toString(event.getStopSequence()),
                nullToEmpty(event.getVehicleId()),
                nullToEmpty(event.getVehicleLabel()),
                event.getEventType().name(),
                EVENT_TIME_FORMAT.format(event.getEventTime().withZoneSameInstant(ServiceDates.EASTERN)),
                format(event.getTravelTimeSeconds()),
                format(event.getDwellTimeSeconds()),
                format(event.getHeadwaySeconds()),
                format(event.getHeadwayBranchSeconds()),
                format(event.getScheduledTravelTime()),
                format(event.getScheduledHeadway()),
                format(event.getScheduledHeadwayBranch()),
                event.getVehicleConsist().orElse("")
        };
    }

    public static List<Event> decode(byte[] content, boolean compressed) throws IOException {
        try (InputStream in = compressed ? new GZIPInputStream(new ByteArrayInputStream(content)) : new ByteArrayInputStream(content);
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static List<Event> read(Reader reader) throws IOException {
        List<Event> events = new ArrayList<>();
        try (CSVReader csv = new CSVReaderBuilder(reader).build()) {
            String[] header = csv.readNext();
            if (header == null || !Arrays.equals(header, HEADER)) {
                throw new IOException("Unexpected events.csv header " + Arrays.toString(header));
            }
            String[] row;
            while ((row = csv.readNext()) != null) {
                events.add(fromRow(row));
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed events.csv", e);
        }
        return events;
    }

    static Event fromRow(String[] row) throws IOException {
        if (row.length != HEADER.length) {
            throw new IOException("Expected " + HEADER.length + " columns, got " + row.length);
        }
        try {
            return Event.newBuilder()
                    .setServiceDate(LocalDate.parse(row[0]))
                    .setRouteId(emptyToNull(row[1]))
                    .setTripId(row[2])
                    .setDirectionId(Integer.parseInt(row[3]))
                    .setStopId(row[4])
                    .setStopSequence(Integer.parseInt(row[5]))
                    .setVehicleId(emptyToNull(row[6]))
                    .setVehicleLabel(emptyToNull(row[7]))
                    .setEventType(EventType.valueOf(row[8]))
                    .setEventTime(parseEventTime(row[9]))
                    .setTravelTimeSeconds(parseLong(row[10]))
                    .setDwellTimeSeconds(parseLong(row[11]))
                    .setHeadwaySeconds(parseLong(row[12]))
                    .setHeadwayBranchSeconds(parseLong(row[13]))
                    .setScheduledTravelTime(parseLong(row[14]))
                    .setScheduledHeadway(parseLong(row[15]))
                    .setScheduledHeadwayBranch(parseLong(row[16]))
                    .setVehicleConsist(emptyToNull(row[17]))
                    .build();
        } catch (RuntimeException e) {
            throw new IOException("Invalid event row " + Arrays.toString(row), e);
        }
    }

    static ZonedDateTime parseEventTime(String value) {
        return OffsetDateTime.parse(value, EVENT_TIME_FORMAT).atZoneSameInstant(ServiceDates.EASTERN);
    }

    private static String format(Optional<Long> value) {
        return value.map(String::valueOf).orElse("");
    }

    private static Long parseLong(String value) {
        return value.isEmpty() ? null : Long.valueOf(value);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String emptyToNull(String value) {
        return value.isEmpty() ? null : value;
    }
}
