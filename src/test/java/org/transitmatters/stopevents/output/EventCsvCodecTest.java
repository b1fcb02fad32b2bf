package org.transitmatters.stopevents.output;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.transitmatters.stopevents.MockDataFactory;
import org.transitmatters.stopevents.models.Event;
import org.transitmatters.stopevents.models.EventType;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EventCsvCodecTest {

    private static List<Event> events() {
        return ImmutableList.of(
                MockDataFactory.mockEvent("Red", "T1", "70063", 3, EventType.ARR, "10:00:00")
                        .setTravelTimeSeconds(300L)
                        .setDwellTimeSeconds(45L)
                        .setHeadwaySeconds(480L)
                        .setScheduledTravelTime(270L)
                        .setScheduledHeadway(450L)
                        .setVehicleConsist("1813|1812")
                        .build(),
                MockDataFactory.mockEvent("Green-B", "G1", "70196", 1, EventType.DEP, "10:02:00")
                        .setHeadwayBranchSeconds(600L)
                        .setScheduledHeadwayBranch(610L)
                        .setVehicleLabel("3706, 3821")
                        .build());
    }

    @Test
    public void rowsMatchTheOutputFormat() throws IOException {
        StringWriter writer = new StringWriter();
        EventCsvCodec.write(events(), writer);

        String[] lines = writer.toString().split("\n");
        assertEquals(3, lines.length);
        assertEquals(String.join(",", EventCsvCodec.HEADER), lines[0]);
        assertEquals("2024-02-07,Red,T1,0,70063,3,R-5463A,1813,ARR,2024-02-07 10:00:00-05:00,300,45,480,,270,450,,1813|1812", lines[1]);
        // values with commas are quoted
        assertTrue(lines[2].contains("\"3706, 3821\""));
        assertTrue(lines[2].endsWith(",600,,,610,"));
    }

    @Test
    public void eventTimeCarriesDaylightSavingOffset() {
        Event summer = MockDataFactory.mockEvent("Red", "T1", "70063", 3, EventType.ARR, "10:00:00")
                .setEventTime(MockDataFactory.eastern(LocalDate.of(2024, 7, 10), "10:00:00"))
                .build();

        assertEquals("2024-07-10 10:00:00-04:00", EventCsvCodec.toRow(summer)[9]);
    }

    @Test
    public void decodedEventsEqualTheEncodedOnes() throws IOException {
        byte[] plain = EventCsvCodec.encode(events(), false);
        byte[] compressed = EventCsvCodec.encode(events(), true);

        assertEquals(events(), EventCsvCodec.decode(plain, false));
        assertEquals(events(), EventCsvCodec.decode(compressed, true));
    }

    @Test
    public void compressedOutputIsReproducible() throws IOException {
        byte[] first = EventCsvCodec.encode(events(), true);
        byte[] second = EventCsvCodec.encode(events(), true);

        assertArrayEquals(first, second);
        assertEquals((byte) 0x1f, first[0]);
        assertEquals((byte) 0x8b, first[1]);
        // gzip MTIME field
        for (int i = 4; i < 8; i++) {
            assertEquals(0, first[i]);
        }
    }

    @Test
    public void plainOutputIsUtf8Text() throws IOException {
        String text = new String(EventCsvCodec.encode(events(), false), StandardCharsets.UTF_8);

        assertTrue(text.startsWith("service_date,route_id,trip_id"));
        assertFalse(text.contains("\r"));
    }

    @Test(expected = IOException.class)
    public void unexpectedHeaderIsRejected() throws IOException {
        EventCsvCodec.read(new StringReader("service_date,route_id\n2024-02-07,Red\n"));
    }
}
