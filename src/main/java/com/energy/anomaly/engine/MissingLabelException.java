package com.energy.anomaly.engine;

public class MissingLabelException extends DetectionException {

    public MissingLabelException(int position) {
        super("Ground-truth label 'is_anomaly' is missing for reading at position " + position);
    }
}
