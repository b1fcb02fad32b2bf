package org.transitmatters.stopevents.application;

import com.google.common.collect.ImmutableList;
import com.typesafe.config.ConfigFactory;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.transitmatters.stopevents.MockDataFactory;
import org.transitmatters.stopevents.models.Event;
import org.transitmatters.stopevents.models.EventType;
import org.transitmatters.stopevents.models.SourceKind;
import org.transitmatters.stopevents.normalizer.SchemaMismatchException;
import org.transitmatters.stopevents.normalizer.SourceTable;
import org.transitmatters.stopevents.output.EventCsvCodec;
import org.transitmatters.stopevents.output.LocalDirectorySink;
import org.transitmatters.stopevents.output.PartitionSink;
import org.transitmatters.stopevents.schedule.ScheduleLookup;
import org.transitmatters.stopevents.schedule.ScheduledTrip;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EventPipelineTest {
    static final String REALTIME_HEADER = "service_date,route_id,trip_id,stop_id,direction_id,stop_sequence,vehicle_id,vehicle_label,move_timestamp,stop_timestamp";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final Map<String, byte[]> written = new ConcurrentHashMap<>();
    private final PartitionSink memorySink = (key, content) -> written.put(key.getObjectKey(), content);

    private static final ScheduleLookup SCHEDULE = date -> ImmutableList.of(MockDataFactory.mockFeed("winter",
            date.minusDays(30), date.plusDays(30),
            ImmutableList.of(new ScheduledTrip("T1", "Red", 0, null, null)),
            MockDataFactory.mockStopTimes("T1", 36000, 300, "A", "B")));

    private static PipelineConfig config() {
        return new PipelineConfig(ConfigFactory.load());
    }

    private static SourceTable realtimeSource() {
        return MockDataFactory.mockTable("2024-02-07.csv", REALTIME_HEADER,
                "20240207,Red,T1,A,0,1,R-5463A,1813,,1707317880",
                "20240207,Red,T1,B,0,2,R-5463A,1813,1707318000,1707318300",
                "20240207,Red,T1,,0,3,R-5463A,1813,,1707318600");
    }

    @Test
    public void realtimeSourceIsProcessedIntoStopPartitions() throws Exception {
        EventPipeline pipeline = new EventPipeline(config(), SCHEDULE, memorySink);

        ProcessingResult result = pipeline.run(realtimeSource(), SourceKind.REALTIME_FEED, MockDataFactory.SERVICE_DATE);

        assertEquals(2, result.getPartitions().size());
        assertEquals(2, written.size());
        List<Event> stopA = EventCsvCodec.decode(written.get("Events-lamp/daily-data/A/Year=2024/Month=2/Day=7/events.csv"), false);
        assertEquals(2, stopA.size());
        assertEquals(EventType.ARR, stopA.get(0).getEventType());
        assertEquals(EventType.DEP, stopA.get(1).getEventType());
        assertEquals(Long.valueOf(120), stopA.get(1).getDwellTimeSeconds().get());
        assertFalse(stopA.get(0).getScheduledTravelTime().isPresent());

        List<Event> stopB = EventCsvCodec.decode(written.get("Events-lamp/daily-data/B/Year=2024/Month=2/Day=7/events.csv"), false);
        assertEquals(1, stopB.size());
        assertEquals(Long.valueOf(300), stopB.get(0).getTravelTimeSeconds().get());
        assertEquals(Long.valueOf(300), stopB.get(0).getScheduledTravelTime().get());

        ProcessingStats stats = result.getStats();
        assertEquals(3, stats.getRecordsRead());
        assertEquals(3, stats.getEventsWritten());
        assertEquals(2, stats.getPartitionsWritten());
        assertEquals(1, result.getFaultCount(FaultKind.INVALID_RECORD));
        assertEquals(Long.valueOf(1), stats.getFaultReasons().get("INVALID_RECORD/validator-MissingStopIdValidator"));
        assertEquals(0, result.getFaultCount(FaultKind.SCHEDULE_LOOKUP_MISS));
        assertEquals(3, result.getEvents().size());
    }

    @Test
    public void departureRowWithoutStopCompletesThePreviousVisit() throws Exception {
        EventPipeline pipeline = new EventPipeline(config(), SCHEDULE, memorySink);
        SourceTable source = MockDataFactory.mockTable("2024-02-07.csv", REALTIME_HEADER,
                "20240207,Red,T1,A,0,1,R-5463A,1813,,1707317880",
                "20240207,Red,T1,B,0,2,R-5463A,1813,1707318000,1707318300",
                "20240207,Red,T1,,0,3,R-5463A,1813,1707318420,");

        ProcessingResult result = pipeline.run(source, SourceKind.REALTIME_FEED, MockDataFactory.SERVICE_DATE);

        List<Event> stopB = EventCsvCodec.decode(written.get("Events-lamp/daily-data/B/Year=2024/Month=2/Day=7/events.csv"), false);
        assertEquals(2, stopB.size());
        assertEquals(EventType.ARR, stopB.get(0).getEventType());
        assertEquals(EventType.DEP, stopB.get(1).getEventType());
        assertEquals(MockDataFactory.eastern("10:07:00"), stopB.get(1).getEventTime());
        assertEquals(Long.valueOf(120), stopB.get(1).getDwellTimeSeconds().get());
        assertEquals(0, result.getFaultCount(FaultKind.INVALID_RECORD));
        assertEquals(4, result.getEvents().size());
    }

    @Test
    public void rerunWritesIdenticalPartitions() throws Exception {
        new EventPipeline(config(), SCHEDULE, memorySink).run(realtimeSource(), SourceKind.REALTIME_FEED, MockDataFactory.SERVICE_DATE);
        Map<String, byte[]> first = new ConcurrentHashMap<>(written);
        written.clear();

        new EventPipeline(config(), SCHEDULE, memorySink).run(realtimeSource(), SourceKind.REALTIME_FEED, MockDataFactory.SERVICE_DATE);

        assertEquals(first.keySet(), written.keySet());
        for (String key : first.keySet()) {
            assertArrayEquals(first.get(key), written.get(key));
        }
    }

    @Test
    public void missingScheduleStillWritesEvents() throws Exception {
        EventPipeline pipeline = new EventPipeline(config(), date -> {
            throw new IOException("archive unavailable");
        }, memorySink);

        ProcessingResult result = pipeline.run(realtimeSource(), SourceKind.REALTIME_FEED, MockDataFactory.SERVICE_DATE);

        assertEquals(3, result.getStats().getEventsWritten());
        assertEquals(3, result.getFaultCount(FaultKind.SCHEDULE_LOOKUP_MISS));
    }

    @Test
    public void schemaMismatchWritesNothing() throws Exception {
        SourceTable source = MockDataFactory.mockTable("broken.csv", "service_date,route_id,trip_id,stop_id",
                "20240207,Red,T1,A");
        try {
            new EventPipeline(config(), SCHEDULE, memorySink).run(source, SourceKind.REALTIME_FEED, MockDataFactory.SERVICE_DATE);
            fail("Expected a schema mismatch");
        } catch (SchemaMismatchException e) {
            assertTrue(written.isEmpty());
        }
    }

    @Test
    public void sinkFailureIsReported() throws Exception {
        EventPipeline pipeline = new EventPipeline(config(), SCHEDULE, (key, content) -> {
            throw new IOException("disk full");
        });
        try {
            pipeline.run(realtimeSource(), SourceKind.REALTIME_FEED, MockDataFactory.SERVICE_DATE);
            fail("Expected an IOException");
        } catch (IOException e) {
            assertEquals("disk full", e.getMessage());
        }
    }

    @Test(expected = InterruptedException.class)
    public void cancelledPipelineStopsBeforeWriting() throws Exception {
        EventPipeline pipeline = new EventPipeline(config(), SCHEDULE, memorySink);
        pipeline.cancel();
        pipeline.run(realtimeSource(), SourceKind.REALTIME_FEED, MockDataFactory.SERVICE_DATE);
    }

    @Test
    public void busFileIsWrittenAsCompressedMonthlyPartitions() throws Exception {
        Path input = folder.newFile("bus-2024-02.csv").toPath();
        Files.write(input, String.join("\n",
                "service_date,route_id,direction,half_trip_id,stop_id,time_point_id,time_point_order,point_type,actual",
                "2024-02-07,01,Inbound,46374001,110,hhgat,1,Startpoint,1900-01-01 08:00:00Z",
                "2024-02-07,01,Inbound,46374001,67,maput,2,Midpoint,1900-01-01 08:10:00Z",
                "2024-02-07,01,Inbound,46374001,72,cntsq,3,Endpoint,1900-01-01 08:20:00Z").getBytes(StandardCharsets.UTF_8));
        Path output = folder.newFolder("out").toPath();

        EventPipeline pipeline = new EventPipeline(config(), date -> Collections.emptyList(), new LocalDirectorySink(output));
        ProcessingResult result = pipeline.run(input, SourceKind.HISTORIC_BUS, MockDataFactory.SERVICE_DATE);

        assertEquals(4, result.getStats().getEventsWritten());
        Path midpoint = output.resolve("Events/monthly-bus-data/1-1-67/Year=2024/Month=2/events.csv.gz");
        List<Event> events = EventCsvCodec.decode(Files.readAllBytes(midpoint), true);
        assertEquals(2, events.size());
        assertEquals(Long.valueOf(0), events.get(0).getDwellTimeSeconds().get());
        assertEquals(Long.valueOf(600), events.get(0).getTravelTimeSeconds().get());
    }
}
