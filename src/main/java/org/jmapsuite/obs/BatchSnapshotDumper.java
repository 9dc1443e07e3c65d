package org.jmapsuite.obs;

import java.util.Objects;
import org.bson.BsonDocument;
import org.jmapsuite.batch.Batch;
import org.jmapsuite.batch.BatchInvariantChecker;
import org.jmapsuite.batch.CorrelationReport;
import org.jmapsuite.json.JsonValues;

/**
 * Serializes a decoded batch and its invariant report into a deterministic JSON snapshot.
 */
public final class BatchSnapshotDumper {
    private final BatchInvariantChecker invariantChecker;

    public BatchSnapshotDumper() {
        this(new BatchInvariantChecker());
    }

    public BatchSnapshotDumper(final BatchInvariantChecker invariantChecker) {
        this.invariantChecker = Objects.requireNonNull(invariantChecker, "invariantChecker");
    }

    public BsonDocument dumpDocument(final Batch batch) {
        Objects.requireNonNull(batch, "batch");
        final CorrelationReport correlation = batch.correlation();
        final BsonDocument correlationDocument = new BsonDocument()
                .append("missing", JsonValues.toJson(correlation.missing()))
                .append("extra", JsonValues.toJson(correlation.extra()))
                .append("duplicates", JsonValues.toJson(correlation.duplicates()));

        return new BsonDocument()
                .append("batch", batch.toDocument())
                .append("correlation", correlationDocument)
                .append("invariants", invariantChecker.check(batch).toDocument());
    }

    public String dumpJson(final Batch batch) {
        return JsonValues.renderIndented(dumpDocument(batch));
    }
}
