package com.outlierai.server.ai;

public enum DegeneracyPolicy {
    // surface a DegenerateDistributionException
    FAIL,
    // replace the zero quantity by a small documented floor
    EPSILON_FLOOR;

    public static DegeneracyPolicy fromName(String name, DegeneracyPolicy fallback) {
        if (name == null || name.trim().isEmpty()) {
            return fallback;
        }
        switch (name.trim().toUpperCase()) {
            case "FAIL":
                return FAIL;
            case "EPSILON_FLOOR":
            case "FLOOR":
                return EPSILON_FLOOR;
            default:
                throw new InvalidInputException("Unknown degeneracy policy: " + name);
        }
    }
}
