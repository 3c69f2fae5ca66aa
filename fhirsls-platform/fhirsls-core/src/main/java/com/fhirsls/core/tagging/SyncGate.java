package com.fhirsls.core.tagging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fhirsls.core.fhir.FhirDates;
import com.fhirsls.core.fhir.FhirTerms;

import java.time.Instant;
import java.util.Optional;

/**
 * Decides whether a record is already current with respect to the rule table's epoch.
 *
 * A record is current, and skipped, when its lastSourceSync marker is at or after the epoch.
 * Without an epoch nothing is skipped; a missing or unreadable marker never counts as current.
 */
public class SyncGate {

    public Optional<Instant> readMarker(JsonNode record) {
        if (record == null) {
            return Optional.empty();
        }
        for (JsonNode extension : record.path("meta").path("extension")) {
            if (FhirTerms.LAST_SOURCE_SYNC_URL.equals(extension.path("url").asText(null))) {
                return FhirDates.parse(extension.path("valueDateTime").asText(null));
            }
        }
        return Optional.empty();
    }

    public boolean isCurrent(Optional<Instant> marker, Optional<Instant> epoch) {
        if (epoch.isEmpty() || marker.isEmpty()) {
            return false;
        }
        return !marker.get().isBefore(epoch.get());
    }

    public boolean shouldSkip(JsonNode record, Optional<Instant> epoch) {
        return isCurrent(readMarker(record), epoch);
    }
}
