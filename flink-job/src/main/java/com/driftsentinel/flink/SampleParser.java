package com.driftsentinel.flink;

import com.driftsentinel.core.config.DriftConfig;
import com.driftsentinel.core.ingest.SampleIngestor;
import com.driftsentinel.core.ingest.ValidationException;
import com.driftsentinel.core.model.RawRecord;
import com.driftsentinel.core.model.Sample;
import org.apache.flink.api.common.functions.RichFlatMapFunction;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Validates raw records ahead of keying so that the watermark can be taken
 * from the parsed event time. Invalid records are logged, counted and dropped.
 */
public class SampleParser extends RichFlatMapFunction<RawRecord, Sample> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SampleParser.class);

    private final DriftConfig config;

    private transient SampleIngestor ingestor;
    private transient DriftJobMetrics metrics;

    public SampleParser(DriftConfig config) {
        this.config = Objects.requireNonNull(config, "DriftConfig must not be null");
    }

    @Override
    public void open(Configuration parameters) {
        ingestor = new SampleIngestor(config);
        metrics = new DriftJobMetrics(getRuntimeContext().getMetricGroup());
    }

    @Override
    public void flatMap(RawRecord record, Collector<Sample> out) {
        try {
            out.collect(ingestor.ingest(record));
        } catch (ValidationException e) {
            metrics.incrementRecordsRejected();
            LOG.warn("Rejected record: {}", e.getMessage());
        }
    }
}
