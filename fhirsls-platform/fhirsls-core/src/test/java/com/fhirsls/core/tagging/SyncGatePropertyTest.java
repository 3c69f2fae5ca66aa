package com.fhirsls.core.tagging;

import com.fasterxml.jackson.databind.node.ObjectNode;
import net.jqwik.api.*;
import net.jqwik.api.constraints.LongRange;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static com.fhirsls.core.FhirFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the sync gate.
 */
class SyncGatePropertyTest {

    private static final Instant EPOCH = Instant.parse("2024-06-01T00:00:00Z");

    private final SyncGate gate = new SyncGate();

    /**
     * Property: a record is skipped exactly when its marker is at or after the epoch.
     */
    @Property(tries = 200)
    void skip_iffMarkerAtOrAfterEpoch(@ForAll @LongRange(min = -100_000, max = 100_000) long offsetMillis) {
        Instant marker = EPOCH.plusMillis(offsetMillis);
        ObjectNode record = withMarker(resource("Condition", "c1"), marker);

        assertThat(gate.shouldSkip(record, Optional.of(EPOCH))).isEqualTo(offsetMillis >= 0);
    }

    /**
     * Property: without an epoch nothing is ever skipped.
     */
    @Property(tries = 50)
    void noEpoch_neverSkips(@ForAll @LongRange(min = -1_000_000, max = 1_000_000) long offsetSeconds) {
        ObjectNode record = withMarker(resource("Condition", "c1"), EPOCH.plusSeconds(offsetSeconds));

        assertThat(gate.shouldSkip(record, Optional.empty())).isFalse();
    }

    @Test
    void markerEqualToEpoch_isCurrent() {
        assertThat(gate.shouldSkip(withMarker(resource("Condition", "c1"), EPOCH), Optional.of(EPOCH))).isTrue();
    }

    @Test
    void markerOneMillisecondEarly_isStale() {
        ObjectNode record = withMarker(resource("Condition", "c1"), EPOCH.minusMillis(1));

        assertThat(gate.shouldSkip(record, Optional.of(EPOCH))).isFalse();
    }

    @Test
    void missingMarker_isNeverCurrent() {
        assertThat(gate.shouldSkip(resource("Condition", "c1"), Optional.of(EPOCH))).isFalse();
    }

    @Test
    void unreadableMarker_isNeverCurrent() {
        ObjectNode record = resource("Condition", "c1");
        ObjectNode extension = record.putObject("meta").putArray("extension").addObject();
        extension.put("url", "http://hl7.org/fhir/StructureDefinition/lastSourceSync");
        extension.put("valueDateTime", "not a date");

        assertThat(gate.readMarker(record)).isEmpty();
        assertThat(gate.shouldSkip(record, Optional.of(EPOCH))).isFalse();
    }

    @Test
    void partialDateMarker_isReadAsStartOfPeriod() {
        ObjectNode record = resource("Condition", "c1");
        ObjectNode extension = record.putObject("meta").putArray("extension").addObject();
        extension.put("url", "http://hl7.org/fhir/StructureDefinition/lastSourceSync");
        extension.put("valueDateTime", "2024-06");

        assertThat(gate.readMarker(record)).contains(EPOCH);
    }
}
