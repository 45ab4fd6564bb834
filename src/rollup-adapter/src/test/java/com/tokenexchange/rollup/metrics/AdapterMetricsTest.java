package com.tokenexchange.rollup.metrics;

import com.tokenexchange.rollup.AdapterFixtures;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AdapterMetricsTest {

    private AdapterMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = new AdapterMetrics(new PrometheusRegistry());
    }

    @Test
    void shouldCountOutcomesBySourceAndType() {
        metrics.recordOutcome("http", AdapterFixtures.notice(), 0.002);
        metrics.recordOutcome("http", AdapterFixtures.report(), 0.001);
        metrics.recordOutcome("rollup", AdapterFixtures.notice(), 0.003);

        assertEquals(1.0, metrics.batchesTotal.labelValues("http", "notice").get());
        assertEquals(1.0, metrics.batchesTotal.labelValues("http", "report").get());
        assertEquals(1.0, metrics.batchesTotal.labelValues("rollup", "notice").get());
        assertEquals(2.0, metrics.tradesTotal.get());
    }

    @Test
    void shouldCountInstrumentFailures() {
        metrics.recordOutcome("rollup", AdapterFixtures.noticeWithFailure(), 0.001);

        assertEquals(1.0, metrics.instrumentFailuresTotal.get());
    }

    @Test
    void shouldGroupHttpRequestsByStatusClass() {
        metrics.recordHttpRequest("/execute", 200);
        metrics.recordHttpRequest("/execute", 400);
        metrics.recordHttpRequest("/execute", 405);
        metrics.recordHttpRequest("/execute", 503);

        assertEquals(1.0, metrics.httpRequestsTotal.labelValues("/execute", "2xx").get());
        assertEquals(2.0, metrics.httpRequestsTotal.labelValues("/execute", "4xx").get());
        assertEquals(1.0, metrics.httpRequestsTotal.labelValues("/execute", "5xx").get());
    }
}
