package org.transitmatters.stopevents.application;

import org.transitmatters.stopevents.models.Event;
import org.transitmatters.stopevents.models.RawMovementRecord;
import org.transitmatters.stopevents.models.SourceKind;
import org.transitmatters.stopevents.normalizer.HistoricBusNormalizer;
import org.transitmatters.stopevents.normalizer.HistoricFerryNormalizer;
import org.transitmatters.stopevents.normalizer.HistoricRailNormalizer;
import org.transitmatters.stopevents.normalizer.ISourceNormalizer;
import org.transitmatters.stopevents.normalizer.RealtimeFeedNormalizer;
import org.transitmatters.stopevents.normalizer.SchemaMismatchException;
import org.transitmatters.stopevents.normalizer.SourceReadException;
import org.transitmatters.stopevents.normalizer.SourceTable;
import org.transitmatters.stopevents.output.EventCsvCodec;
import org.transitmatters.stopevents.output.OutputAssembler;
import org.transitmatters.stopevents.output.PartitionKey;
import org.transitmatters.stopevents.output.PartitionSink;
import org.transitmatters.stopevents.processing.EventPairer;
import org.transitmatters.stopevents.processing.IntervalCalculator;
import org.transitmatters.stopevents.processing.ScheduleEnricher;
import org.transitmatters.stopevents.schedule.ScheduleIndexCache;
import org.transitmatters.stopevents.schedule.ScheduleLookup;
import org.transitmatters.stopevents.utils.WorkerPool;
import org.transitmatters.stopevents.validators.IRecordValidator;
import org.transitmatters.stopevents.validators.MissingStopIdValidator;
import org.transitmatters.stopevents.validators.NonRevenueTripValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;

/**
 * Runs one raw source through normalization, pairing, interval computation, schedule enrichment and output.
 * <p>
 * Everything up to partitioning runs on the calling thread. Enrichment, encoding and writing of the partitions
 * run on a bounded worker pool.
 */
public class EventPipeline {
    private static final Logger log = LoggerFactory.getLogger(EventPipeline.class);

    private final PipelineConfig config;
    private final ScheduleIndexCache schedules;
    private final PartitionSink sink;

    private final Map<SourceKind, ISourceNormalizer> normalizers = new EnumMap<>(SourceKind.class);
    private final List<IRecordValidator> recordValidators;
    private final OutputAssembler assembler = new OutputAssembler();

    private volatile boolean cancelled = false;
    private volatile WorkerPool activePool;

    public EventPipeline(PipelineConfig config, ScheduleLookup scheduleLookup, PartitionSink sink) {
        this.config = config;
        this.schedules = new ScheduleIndexCache(scheduleLookup, config.getScheduleCacheSize());
        this.sink = sink;

        registerNormalizers();
        recordValidators = registerRecordValidators();
    }

    private void registerNormalizers() {
        List<ISourceNormalizer> all = new ArrayList<>();
        all.add(new RealtimeFeedNormalizer());
        all.add(new HistoricRailNormalizer(config.getRailFormatCutover()));
        all.add(new HistoricBusNormalizer(config.getBusUtcCutover(), config.getBusRoutes()));
        all.add(new HistoricFerryNormalizer(config.getFerryStartDate().orElse(null), config.getFerryEndDate().orElse(null)));
        for (ISourceNormalizer normalizer : all) {
            normalizers.put(normalizer.getSourceKind(), normalizer);
        }
    }

    private List<IRecordValidator> registerRecordValidators() {
        List<IRecordValidator> validators = new ArrayList<>();
        validators.add(new MissingStopIdValidator());
        validators.add(new NonRevenueTripValidator(config.getNonRevenueCutover()));
        return validators;
    }

    public ProcessingResult run(Path input, SourceKind sourceKind, LocalDate serviceDate)
            throws SourceReadException, SchemaMismatchException, IOException, InterruptedException {
        return run(SourceTable.fromFile(input), sourceKind, serviceDate);
    }

    public ProcessingResult run(SourceTable source, SourceKind sourceKind, LocalDate serviceDate)
            throws SchemaMismatchException, IOException, InterruptedException {
        final ProcessingStats stats = new ProcessingStats();
        log.info("Processing {} from {} for service date {}", sourceKind, source.getName(), serviceDate);

        List<RawMovementRecord> records = normalize(source, sourceKind, serviceDate, stats);
        List<RawMovementRecord> valid = validate(records, stats);

        List<Event> events = new EventPairer(schedules::get, stats).pair(valid);
        events = new IntervalCalculator(stats).computeIntervals(events);

        SortedMap<PartitionKey, List<Event>> partitions = assembler.partition(events, sourceKind);
        SortedMap<PartitionKey, List<Event>> written = writePartitions(partitions, stats);

        log.info(stats.toString());
        return new ProcessingResult(sourceKind, written, stats);
    }

    public List<RawMovementRecord> normalize(SourceTable source, SourceKind sourceKind, LocalDate serviceDate, ProcessingStats stats)
            throws SchemaMismatchException {
        ISourceNormalizer normalizer = normalizers.get(sourceKind);
        if (normalizer == null) {
            throw new IllegalArgumentException("No normalizer for " + sourceKind);
        }
        return normalizer.normalize(source, serviceDate, stats);
    }

    List<RawMovementRecord> validate(List<RawMovementRecord> records, ProcessingStats stats) {
        List<RawMovementRecord> valid = new ArrayList<>(records.size());
        for (RawMovementRecord record : records) {
            final boolean isValid = recordValidators.stream().allMatch(validator -> {
                final boolean result = validator.validate(record);
                if (!result) {
                    log.debug("Record {} failed validation with {}", record, validator.getClass().getSimpleName());
                    stats.increment(FaultKind.INVALID_RECORD, "validator-" + validator.getClass().getSimpleName());
                }
                return result;
            });
            if (isValid) {
                valid.add(record);
            }
        }
        return valid;
    }

    private SortedMap<PartitionKey, List<Event>> writePartitions(SortedMap<PartitionKey, List<Event>> partitions, ProcessingStats stats)
            throws IOException, InterruptedException {
        final ScheduleEnricher enricher = new ScheduleEnricher(schedules::get, stats);
        final List<PartitionKey> keys = new ArrayList<>(partitions.keySet());

        List<List<Event>> enriched;
        try (WorkerPool pool = new WorkerPool(config.getWorkers())) {
            activePool = pool;
            if (cancelled) {
                throw new InterruptedException("Pipeline was cancelled");
            }
            enriched = pool.map(keys, key -> writePartition(key, partitions.get(key), enricher, stats));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException) {
                throw ((UncheckedIOException) cause).getCause();
            }
            if (cause instanceof CancellationException) {
                throw new InterruptedException("Pipeline was cancelled");
            }
            throw new IllegalStateException("Partition processing failed", cause);
        } catch (CancellationException e) {
            throw new InterruptedException("Pipeline was cancelled");
        } finally {
            activePool = null;
        }

        SortedMap<PartitionKey, List<Event>> written = new TreeMap<>();
        for (int i = 0; i < keys.size(); i++) {
            written.put(keys.get(i), enriched.get(i));
        }
        return written;
    }

    private List<Event> writePartition(PartitionKey key, List<Event> events, ScheduleEnricher enricher, ProcessingStats stats) {
        if (cancelled || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Cancelled before writing " + key);
        }
        List<Event> rows = enricher.enrich(events);
        OutputAssembler.sortRows(rows);
        try {
            sink.write(key, EventCsvCodec.encode(rows, key.isCompressed()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + key, e);
        }
        stats.incrementPartitionsWritten();
        stats.addEventsWritten(rows.size());
        return rows;
    }

    /**
     * Stops the current run between partitions. Partitions already written stay in place, a retry replaces them.
     */
    public void cancel() {
        cancelled = true;
        WorkerPool pool = activePool;
        if (pool != null) {
            pool.cancel();
        }
    }
}
