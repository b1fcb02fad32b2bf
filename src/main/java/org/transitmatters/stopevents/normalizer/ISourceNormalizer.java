package org.transitmatters.stopevents.normalizer;

import org.transitmatters.stopevents.application.ProcessingStats;
import org.transitmatters.stopevents.models.RawMovementRecord;
import org.transitmatters.stopevents.models.SourceKind;

import java.time.LocalDate;
import java.util.List;

public interface ISourceNormalizer {

    SourceKind getSourceKind();

    /**
     * Converts a raw source into canonical records, in source row order.
     * Rows that cannot be used are skipped and counted in {@code stats}.
     *
     * @param serviceDate service date the source was published for, selects the schema variant
     * @throws SchemaMismatchException if the source lacks a column its variant requires
     */
    List<RawMovementRecord> normalize(SourceTable source, LocalDate serviceDate, ProcessingStats stats) throws SchemaMismatchException;
}
