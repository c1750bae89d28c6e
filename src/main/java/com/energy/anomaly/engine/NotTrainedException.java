package com.energy.anomaly.engine;

public class NotTrainedException extends DetectionException {

    public NotTrainedException() {
        super("Model is not trained. Train on a batch of readings first.");
    }
}
