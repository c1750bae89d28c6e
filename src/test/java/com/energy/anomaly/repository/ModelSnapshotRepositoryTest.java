package com.energy.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.AnomalyDetector;
import com.energy.anomaly.engine.ModelSnapshot;
import com.energy.anomaly.model.DetectionResult;
import com.energy.anomaly.model.Reading;
import com.energy.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.invocation.Invocation;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelSnapshotRepositoryTest {

    @Mock private AerospikeClient client;

    private ModelSnapshotRepository repository;
    private AnomalyDetector detector;
    private List<Reading> readings;

    @BeforeEach
    void setUp() {
        repository = new ModelSnapshotRepository(client, "test", new WritePolicy(), new Policy());
        detector = new AnomalyDetector(new DetectionConfig());
        readings = TestDataFactory.seriesWithOutliers(80, Set.of(20, 60), 2L);
    }

    @Test
    void saveCurrent_thenLoadCurrent_scoresIdentically() {
        ModelSnapshot snapshot = detector.train(readings).getSnapshot();

        repository.saveCurrent(snapshot);
        Map<String, Object> bins = writtenBins();
        assertThat(bins).containsKeys("modelId", "modelJson", "featureCount", "trainedAt", "trainSamples");
        assertThat(bins.get("modelId")).isEqualTo(snapshot.getModelId());

        when(client.get(any(Policy.class), any(Key.class))).thenReturn(new Record(bins, 1, 0));
        ModelSnapshot loaded = repository.loadCurrent();

        assertThat(loaded.getModelId()).isEqualTo(snapshot.getModelId());
        assertThat(loaded.getFeatureNames()).isEqualTo(snapshot.getFeatureNames());
        assertThat(loaded.getTrainingKmeansThreshold()).isEqualTo(snapshot.getTrainingKmeansThreshold());
        assertThat(loaded.getIsolationForest().getThreshold()).isEqualTo(snapshot.getIsolationForest().getThreshold());

        DetectionResult original = detector.score(snapshot, readings);
        DetectionResult restored = detector.score(loaded, readings);
        assertThat(restored.getReadings()).isEqualTo(original.getReadings());
    }

    @Test
    void loadCurrent_nothingStored_returnsNull() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(null);

        assertThat(repository.loadCurrent()).isNull();
    }

    @Test
    void loadCurrent_unreadableModel_returnsNull() {
        Map<String, Object> bins = new HashMap<>();
        bins.put("modelId", "broken");
        bins.put("modelJson", "{not json");
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(new Record(bins, 1, 0));

        assertThat(repository.loadCurrent()).isNull();
    }

    @Test
    void saveCurrent_clientFailure_isNotPropagated() {
        ModelSnapshot snapshot = detector.train(readings).getSnapshot();
        doThrow(new RuntimeException("cluster unavailable"))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        repository.saveCurrent(snapshot);
    }

    private Map<String, Object> writtenBins() {
        Map<String, Object> bins = new HashMap<>();
        for (Invocation invocation : mockingDetails(client).getInvocations()) {
            if (!invocation.getMethod().getName().equals("put")) continue;
            for (Object argument : invocation.getArguments()) {
                if (argument instanceof Bin) {
                    Bin bin = (Bin) argument;
                    bins.put(bin.name, bin.value.getObject());
                }
            }
        }
        return bins;
    }
}
