package org.transitmatters.stopevents.normalizer;

import org.transitmatters.stopevents.application.FaultKind;
import org.transitmatters.stopevents.application.ProcessingStats;
import org.transitmatters.stopevents.models.RawMovementRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Row by row normalization. Subclasses turn one source row into zero or more records.
 */
public abstract class AbstractSourceNormalizer implements ISourceNormalizer {
    private static final Logger log = LoggerFactory.getLogger(AbstractSourceNormalizer.class);

    /**
     * Chooses the schema variant for a source published for the given date.
     */
    protected abstract SchemaVariant selectVariant(LocalDate serviceDate);

    /**
     * Invoked for each source row.
     *
     * @param output records produced from the row are appended here, in the order they appear in the row
     */
    protected abstract void normalizeRow(ColumnBinding columns, String[] row, List<RawMovementRecord> output, ProcessingStats stats);

    @Override
    public List<RawMovementRecord> normalize(SourceTable source, LocalDate serviceDate, ProcessingStats stats) throws SchemaMismatchException {
        final SchemaVariant variant = selectVariant(serviceDate);
        final ColumnBinding columns = variant.bind(source);
        log.info("Normalizing {} rows of {} as {}", source.size(), source.getName(), variant);

        List<RawMovementRecord> records = new ArrayList<>(source.size());
        int rowNumber = 1;
        for (String[] row : source.getRows()) {
            rowNumber++;
            try {
                normalizeRow(columns, row, records, stats);
            } catch (DateTimeException | IllegalArgumentException e) {
                log.debug("Skipping row {} of {}: {}", rowNumber, source.getName(), e.getMessage());
                stats.increment(FaultKind.INVALID_RECORD, variant.name());
            }
        }
        stats.addRecordsRead(source.size());
        return records;
    }
}
