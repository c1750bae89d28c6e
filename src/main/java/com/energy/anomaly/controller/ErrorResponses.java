package com.energy.anomaly.controller;

import com.energy.anomaly.engine.DetectionException;
import com.energy.anomaly.engine.NotTrainedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

final class ErrorResponses {

    private ErrorResponses() {}

    static ResponseEntity<Map<String, String>> of(HttpStatus status, Exception e) {
        return ResponseEntity.status(status).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    /**
     * 409 when no model is trained yet, 400 for every other misuse (missing labels, schema mismatch).
     */
    static ResponseEntity<Map<String, String>> of(DetectionException e) {
        HttpStatus status = e instanceof NotTrainedException ? HttpStatus.CONFLICT : HttpStatus.BAD_REQUEST;
        return of(status, e);
    }
}
