package io.fhirrules.core.spi;

import io.fhirrules.core.model.FhirRecord;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.FindingSource;
import java.util.List;

/**
 * One independent validation layer. Every finding a layer returns must be
 * tagged with the layer's {@link #source()}; the aggregator rejects a finding
 * carrying any other source, so an advisory layer cannot pass off its
 * findings as blocking ones.
 *
 * <p>
 * Implementations must be thread-safe and must not perform blocking I/O
 * during {@link #validate}.
 */
public interface ValidationLayer {

    /** The source every finding of this layer carries. */
    FindingSource source();

    /**
     * Validates a record.
     *
     * @param record the record
     * @return findings in the layer's own deterministic order
     */
    List<Finding> validate(FhirRecord record);
}
