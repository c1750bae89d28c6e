package com.energy.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.energy.anomaly.config.AerospikeConfig;
import com.energy.anomaly.engine.ModelSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

@Repository
public class ModelSnapshotRepository {

    private static final Logger log = LoggerFactory.getLogger(ModelSnapshotRepository.class);

    private static final String CURRENT_KEY = "current";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public ModelSnapshotRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Persist {@code snapshot} as the current model. A failure is logged and the snapshot stays
     * usable in memory; it is only lost on restart.
     */
    public void saveCurrent(ModelSnapshot snapshot) {
        try {
            String modelJson = objectMapper.writeValueAsString(snapshot);
            Key key = new Key(namespace, AerospikeConfig.SET_DETECTOR_MODELS, CURRENT_KEY);

            client.put(writePolicy, key,
                    new Bin("modelId", snapshot.getModelId()),
                    new Bin("modelJson", modelJson),
                    new Bin("featureCount", snapshot.getFeatureNames().size()),
                    new Bin("trainedAt", snapshot.getTrainedAt()),
                    new Bin("trainSamples", snapshot.getTrainingSamples()));

            log.info("Saved model {}: {} samples, {} trees",
                    snapshot.getModelId(), snapshot.getTrainingSamples(),
                    snapshot.getIsolationForest().getTrees().size());
        } catch (Exception e) {
            log.error("Failed to save model {}", snapshot.getModelId(), e);
        }
    }

    /**
     * @return the stored model, or null when none is stored or it cannot be read
     */
    public ModelSnapshot loadCurrent() {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTOR_MODELS, CURRENT_KEY);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;

        try {
            return objectMapper.readValue(record.getString("modelJson"), ModelSnapshot.class);
        } catch (Exception e) {
            log.error("Failed to load stored model {}", record.getString("modelId"), e);
            return null;
        }
    }
}
