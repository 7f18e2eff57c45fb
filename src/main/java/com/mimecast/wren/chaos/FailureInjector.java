package com.mimecast.wren.chaos;

import com.mimecast.wren.config.server.FailureConfig;
import com.mimecast.wren.http.HttpResponse;
import com.mimecast.wren.http.HttpStatus;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Simulated server failures.
 *
 * <p>For each request a draw in [0, 1) below the configured rate replaces normal processing with a
 * synthetic 500, 503 or 504 response. The reason phrase carries a <code>(Simulated)</code> marker so
 * clients and logs can tell these apart from real failures.
 *
 * <p><strong>WARNING:</strong> This feature is intended for testing purposes only.
 *
 * @see FailureConfig
 */
public class FailureInjector {

    /**
     * Reason phrase marker.
     */
    public static final String MARKER = "(Simulated)";

    private final boolean enabled;
    private final double rate;
    private final List<HttpStatus> statuses;
    private final DoubleSupplier random;

    /**
     * Constructs a new FailureInjector instance.
     *
     * @param config FailureConfig instance.
     */
    public FailureInjector(FailureConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Constructs a new FailureInjector instance with a given random source.
     *
     * @param config FailureConfig instance.
     * @param random Source of draws in [0, 1).
     */
    public FailureInjector(FailureConfig config, DoubleSupplier random) {
        this.enabled = config.isEnabled();
        this.rate = config.getRate();
        this.statuses = config.getStatuses().stream().map(HttpStatus::fromCode).toList();
        this.random = random;
    }

    /**
     * Disabled injector.
     *
     * @return FailureInjector instance.
     */
    public static FailureInjector disabled() {
        return new FailureInjector(new FailureConfig(null));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public double getRate() {
        return rate;
    }

    /**
     * Draws for the current request.
     *
     * @return Optional of a synthetic failure response, empty to process normally.
     */
    public Optional<HttpResponse> draw() {
        if (!enabled || random.getAsDouble() >= rate) {
            return Optional.empty();
        }

        // Independent second draw picks the status.
        HttpStatus status = statuses.get(Math.min(statuses.size() - 1,
                (int) (random.getAsDouble() * statuses.size())));
        return Optional.of(new HttpResponse(status.getCode(), status.getReason() + " " + MARKER,
                HttpResponse.TEXT_PLAIN, ("Simulated failure: " + status.getCode() + " " + status.getReason() + "\n")
                .getBytes(StandardCharsets.UTF_8)));
    }
}
