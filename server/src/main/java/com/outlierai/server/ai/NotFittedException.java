package com.outlierai.server.ai;

public class NotFittedException extends IllegalStateException {

    public NotFittedException(String detectorName) {
        super(detectorName + " is not fitted yet, call fit() first");
    }
}
