/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.metrics;

import com.eventrelay.common.exception.PublishException;
import com.eventrelay.messaging.core.ConnectionListener;
import com.eventrelay.messaging.core.ConnectionState;
import com.eventrelay.messaging.core.ConsumeOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer instrumentation for the register and its reader.
 *
 * <h3>Metric Catalogue</h3>
 * <table>
 *   <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   <tr><td>relay.register.published</td><td>Counter</td><td>-</td></tr>
 *   <tr><td>relay.register.duplicates</td><td>Counter</td><td>-</td></tr>
 *   <tr><td>relay.register.retries</td><td>Counter</td><td>-</td></tr>
 *   <tr><td>relay.register.failures</td><td>Counter</td><td>reason</td></tr>
 *   <tr><td>relay.register.publish.duration</td><td>Timer</td><td>-</td></tr>
 *   <tr><td>relay.reader.deliveries</td><td>Counter</td><td>outcome</td></tr>
 *   <tr><td>relay.reader.decode_errors</td><td>Counter</td><td>-</td></tr>
 *   <tr><td>relay.connection.reconnects</td><td>Counter</td><td>-</td></tr>
 *   <tr><td>relay.connection.state</td><td>Gauge</td><td>-</td></tr>
 * </table>
 *
 * <p>The state gauge reports the ordinal of the current {@link ConnectionState}.</p>
 */
public class RegisterMetrics implements ConnectionListener {

    private final MeterRegistry registry;
    private final Counter published;
    private final Counter duplicates;
    private final Counter retries;
    private final Counter decodeErrors;
    private final Counter reconnects;
    private final Timer publishDuration;
    private final Map<PublishException.Reason, Counter> failures = new EnumMap<>(PublishException.Reason.class);
    private final Map<ConsumeOutcome, Counter> deliveries = new EnumMap<>(ConsumeOutcome.class);
    private final AtomicInteger connectionState = new AtomicInteger(ConnectionState.DISCONNECTED.ordinal());

    public RegisterMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.published = Counter.builder("relay.register.published")
                .description("Events confirmed by the broker")
                .register(registry);
        this.duplicates = Counter.builder("relay.register.duplicates")
                .description("Registrations answered from the duplicate window")
                .register(registry);
        this.retries = Counter.builder("relay.register.retries")
                .description("Publish attempts retried after a transport failure")
                .register(registry);
        this.decodeErrors = Counter.builder("relay.reader.decode_errors")
                .description("Deliveries that could not be decoded")
                .register(registry);
        this.reconnects = Counter.builder("relay.connection.reconnects")
                .description("Successful reconnects after a lost connection")
                .register(registry);
        this.publishDuration = Timer.builder("relay.register.publish.duration")
                .description("Time from registerEvent to broker confirm")
                .register(registry);
        for (PublishException.Reason reason : PublishException.Reason.values()) {
            failures.put(reason, Counter.builder("relay.register.failures")
                    .tag("reason", reason.name().toLowerCase())
                    .description("Registrations that failed")
                    .register(registry));
        }
        for (ConsumeOutcome outcome : ConsumeOutcome.values()) {
            deliveries.put(outcome, Counter.builder("relay.reader.deliveries")
                    .tag("outcome", outcome.name().toLowerCase())
                    .description("Deliveries settled by the reader")
                    .register(registry));
        }
        Gauge.builder("relay.connection.state", connectionState, AtomicInteger::get)
                .description("Ordinal of the broker connection state")
                .register(registry);
    }

    /** Metrics on a private registry, for callers that do not export them. */
    public static RegisterMetrics standalone() {
        return new RegisterMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() { return registry; }

    public void recordPublished(long durationNanos) {
        published.increment();
        publishDuration.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordDuplicate() { duplicates.increment(); }

    public void recordRetry() { retries.increment(); }

    public void recordFailure(PublishException.Reason reason) { failures.get(reason).increment(); }

    public void recordDelivery(ConsumeOutcome outcome) { deliveries.get(outcome).increment(); }

    public void recordDecodeError() { decodeErrors.increment(); }

    @Override
    public void onStateChange(ConnectionState previous, ConnectionState current, Throwable cause) {
        connectionState.set(current.ordinal());
        if (previous == ConnectionState.RECONNECTING && current == ConnectionState.CONNECTED) {
            reconnects.increment();
        }
    }
}
