package org.transitmatters.stopevents.output;

import java.io.IOException;

/**
 * Destination of encoded partitions. Writing a key that already exists replaces it.
 */
public interface PartitionSink {

    void write(PartitionKey key, byte[] content) throws IOException;
}
