package com.energy.anomaly.service;

public class NoDataException extends RuntimeException {

    public NoDataException() {
        super("No consumption data stored. Generate a dataset first.");
    }
}
