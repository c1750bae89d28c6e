package com.energy.anomaly.engine;

import java.util.List;

public class SchemaMismatchException extends DetectionException {

    public SchemaMismatchException(int expectedFeatures, int actualFeatures) {
        super("Expected " + expectedFeatures + " features but got " + actualFeatures);
    }

    public SchemaMismatchException(List<String> expected, List<String> actual) {
        super("Feature schema " + actual + " does not match the trained schema " + expected);
    }
}
