package com.energy.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.energy.anomaly.config.AerospikeConfig;
import com.energy.anomaly.model.ScoredReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores the current scored dataset, one record per reading keyed by generation and position.
 * Each replacement writes its rows under a fresh generation and then flips the meta record to it,
 * so readers see either the complete previous dataset or the complete new one. Rows of the
 * superseded generation are deleted afterwards.
 *
 * Aerospike limits bin names to 15 characters, hence the short names below.
 */
@Repository
public class ConsumptionDataRepository {

    private static final Logger log = LoggerFactory.getLogger(ConsumptionDataRepository.class);

    private static final String META_KEY = "current";

    static final String BIN_TIMESTAMP = "timestamp";
    static final String BIN_CONSUMPTION = "consumptionKw";
    static final String BIN_LABEL = "isAnomaly";
    static final String BIN_KMEANS_SCORE = "kmeansScore";
    static final String BIN_IF_ANOMALY = "ifAnomaly";
    static final String BIN_FINAL_ANOMALY = "finalAnomaly";
    static final String BIN_ROW_COUNT = "rowCount";
    static final String BIN_STORED_AT = "storedAt";
    static final String BIN_GENERATION = "generation";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy replacePolicy;
    private final Policy readPolicy;
    private final BatchPolicy batchPolicy;

    public ConsumptionDataRepository(AerospikeClient client,
                                     @Qualifier("aerospikeNamespace") String namespace,
                                     @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                     @Qualifier("defaultReadPolicy") Policy readPolicy,
                                     @Qualifier("defaultBatchPolicy") BatchPolicy batchPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.batchPolicy = batchPolicy;
        this.replacePolicy = new WritePolicy(writePolicy);
        this.replacePolicy.recordExistsAction = RecordExistsAction.REPLACE;
    }

    /**
     * Replace the stored dataset with {@code readings}. A failure before the meta write leaves the
     * previous dataset visible and the rows of the unpublished generation unreachable.
     */
    public synchronized void replaceAll(List<ScoredReading> readings) {
        Generation previous = readMeta();
        long generation = previous.number() + 1;
        try {
            for (int i = 0; i < readings.size(); i++) {
                client.put(replacePolicy, rowKey(generation, i), toBins(readings.get(i)));
            }
            // Publish the new generation only once all of its rows are written
            client.put(replacePolicy, metaKey(),
                    new Bin(BIN_ROW_COUNT, readings.size()),
                    new Bin(BIN_GENERATION, generation),
                    new Bin(BIN_STORED_AT, System.currentTimeMillis()));
        } catch (AerospikeException e) {
            log.error("Failed to store {} scored readings", readings.size(), e);
            throw e;
        }

        try {
            for (int i = 0; i < previous.rowCount(); i++) {
                client.delete(replacePolicy, rowKey(previous.number(), i));
            }
        } catch (AerospikeException e) {
            // The new dataset is already published; leftover rows are unreachable
            log.warn("Failed to delete rows of superseded generation {}", previous.number(), e);
        }
        log.info("Stored {} scored readings as generation {} (replaced {})",
                readings.size(), generation, previous.rowCount());
    }

    public List<ScoredReading> findAll() {
        Generation current = readMeta();
        int rowCount = current.rowCount();
        if (rowCount == 0) {
            return List.of();
        }

        Key[] keys = new Key[rowCount];
        for (int i = 0; i < rowCount; i++) {
            keys[i] = rowKey(current.number(), i);
        }
        Record[] records = client.get(batchPolicy, keys);

        List<ScoredReading> readings = new ArrayList<>(rowCount);
        for (int i = 0; i < records.length; i++) {
            if (records[i] == null) {
                log.warn("Row {} of {} is missing from set {}", i, rowCount, AerospikeConfig.SET_CONSUMPTION_DATA);
                continue;
            }
            readings.add(mapRecord(records[i]));
        }
        return readings;
    }

    public int count() {
        return readMeta().rowCount();
    }

    private Generation readMeta() {
        Record meta = client.get(readPolicy, metaKey());
        if (meta == null) return new Generation(0, 0);
        return new Generation(meta.getLong(BIN_GENERATION), meta.getInt(BIN_ROW_COUNT));
    }

    private Bin[] toBins(ScoredReading reading) {
        List<Bin> bins = new ArrayList<>(6);
        bins.add(new Bin(BIN_TIMESTAMP, reading.getTimestamp().toString()));
        bins.add(new Bin(BIN_CONSUMPTION, reading.getConsumptionKw()));
        if (reading.hasGroundTruth()) {
            bins.add(new Bin(BIN_LABEL, reading.getGroundTruth().booleanValue()));
        }
        bins.add(new Bin(BIN_KMEANS_SCORE, reading.getKmeansAnomalyScore()));
        bins.add(new Bin(BIN_IF_ANOMALY, reading.isIsolationAnomaly()));
        bins.add(new Bin(BIN_FINAL_ANOMALY, reading.isFinalAnomaly()));
        return bins.toArray(new Bin[0]);
    }

    private ScoredReading mapRecord(Record record) {
        return ScoredReading.builder()
                .timestamp(LocalDateTime.parse(record.getString(BIN_TIMESTAMP)))
                .consumptionKw(record.getDouble(BIN_CONSUMPTION))
                .groundTruth(record.bins.containsKey(BIN_LABEL) ? record.getBoolean(BIN_LABEL) : null)
                .kmeansAnomalyScore(record.getDouble(BIN_KMEANS_SCORE))
                .isolationAnomaly(record.getBoolean(BIN_IF_ANOMALY))
                .finalAnomaly(record.getBoolean(BIN_FINAL_ANOMALY))
                .build();
    }

    private Key rowKey(long generation, int position) {
        return new Key(namespace, AerospikeConfig.SET_CONSUMPTION_DATA, generation + ":" + position);
    }

    private Key metaKey() {
        return new Key(namespace, AerospikeConfig.SET_DATASET_META, META_KEY);
    }

    private record Generation(long number, int rowCount) {
    }
}
