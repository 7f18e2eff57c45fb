package com.mimecast.wren.config.server;

import com.mimecast.wren.config.ConfigFoundation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Failure injection configuration.
 *
 * <p>When enabled a share of requests, given by the rate, is answered with a synthetic server error
 * instead of being routed. Intended for exercising client error handling only.
 *
 * <p><strong>WARNING:</strong> Do NOT enable in production environments.
 */
public class FailureConfig extends ConfigFoundation {

    private static final List<Integer> DEFAULT_STATUSES = List.of(500, 503, 504);

    /**
     * Constructs a new FailureConfig instance.
     *
     * @param map Configuration map.
     */
    public FailureConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Is failure injection enabled.
     *
     * @return Boolean.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", false);
    }

    /**
     * Gets the probability of a request being failed.
     * <p>Clamped to [0, 1].
     *
     * @return Rate.
     */
    public double getRate() {
        double rate = getDoubleProperty("rate", 0.1D);
        return Math.max(0D, Math.min(1D, rate));
    }

    /**
     * Gets the status codes to pick from.
     * <p>Only 500, 503 and 504 are honoured, anything else is ignored.
     *
     * @return List of status codes.
     */
    public List<Integer> getStatuses() {
        if (!hasProperty("statuses")) {
            return DEFAULT_STATUSES;
        }

        List<Integer> statuses = new ArrayList<>();
        for (Object entry : getListProperty("statuses")) {
            if (entry instanceof Number number && DEFAULT_STATUSES.contains(number.intValue())) {
                statuses.add(number.intValue());
            }
        }
        return statuses.isEmpty() ? DEFAULT_STATUSES : statuses;
    }
}
