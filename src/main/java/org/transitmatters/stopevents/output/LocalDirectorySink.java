package org.transitmatters.stopevents.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes partitions below a local directory, mirroring the object keys.
 */
public class LocalDirectorySink implements PartitionSink {
    private static final Logger log = LoggerFactory.getLogger(LocalDirectorySink.class);

    private final Path root;

    public LocalDirectorySink(Path root) {
        this.root = root;
    }

    public Path resolve(PartitionKey key) {
        return root.resolve(key.getObjectKey());
    }

    @Override
    public void write(PartitionKey key, byte[] content) throws IOException {
        final Path target = resolve(key);
        Files.createDirectories(target.getParent());

        // Readers never see a half written file
        Path temp = Files.createTempFile(target.getParent(), ".events", ".tmp");
        try {
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        log.debug("Wrote {} bytes to {}", content.length, target);
    }
}
