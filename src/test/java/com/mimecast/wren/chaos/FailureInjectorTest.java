package com.mimecast.wren.chaos;

import com.mimecast.wren.config.server.FailureConfig;
import com.mimecast.wren.http.HttpResponse;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FailureInjectorTest {

    @Test
    void alwaysFailsAtRateOne() {
        FailureInjector injector = new FailureInjector(new FailureConfig(Map.of(
                "enabled", true, "rate", 1.0, "statuses", List.of(503))));

        for (int i = 0; i < 20; i++) {
            Optional<HttpResponse> response = injector.draw();
            assertTrue(response.isPresent());
            assertEquals(503, response.get().getCode());
            assertEquals("Service Unavailable (Simulated)", response.get().getReason());
            assertEquals(HttpResponse.TEXT_PLAIN, response.get().getContentType());
            assertEquals("Simulated failure: 503 Service Unavailable\n",
                    new String(response.get().getBody(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void neverFailsAtRateZero() {
        FailureInjector injector = new FailureInjector(new FailureConfig(Map.of("enabled", true, "rate", 0.0)));

        for (int i = 0; i < 100; i++) {
            assertTrue(injector.draw().isEmpty());
        }
    }

    @Test
    void disabled() {
        FailureInjector injector = FailureInjector.disabled();

        assertFalse(injector.isEnabled());
        assertTrue(injector.draw().isEmpty());
    }

    @Test
    void statusPickedBySecondDraw() {
        Iterator<Double> draws = List.of(0.4, 0.99, 0.4, 0.0, 0.6).iterator();
        FailureInjector injector = new FailureInjector(new FailureConfig(Map.of("enabled", true, "rate", 0.5)),
                draws::next);

        assertEquals(504, injector.draw().orElseThrow().getCode());
        assertEquals(500, injector.draw().orElseThrow().getCode());
        assertTrue(injector.draw().isEmpty());
    }
}
