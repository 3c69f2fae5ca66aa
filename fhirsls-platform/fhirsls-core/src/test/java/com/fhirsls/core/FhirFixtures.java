package com.fhirsls.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fhirsls.core.fhir.FhirTerms;
import com.fhirsls.core.rules.CodeIdentity;
import com.fhirsls.core.rules.TopicLabel;

import java.time.Instant;
import java.util.List;

/**
 * Builders for the FHIR JSON used across the engine tests.
 */
public final class FhirFixtures {

    public static final String SNOMED = "http://snomed.info/sct";
    public static final String ICD10 = "http://hl7.org/fhir/sid/icd-10-cm";
    public static final String ACT_CODE = "http://terminology.hl7.org/CodeSystem/v3-ActCode";

    public static final TopicLabel PSY = new TopicLabel(ACT_CODE, "PSY", "psychiatry information sensitivity");
    public static final TopicLabel ETH = new TopicLabel(ACT_CODE, "ETH", "substance abuse information sensitivity");
    public static final TopicLabel HIV = new TopicLabel(ACT_CODE, "HIV", "HIV/AIDS information sensitivity");

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private FhirFixtures() {
    }

    public static ObjectNode coding(String system, String code) {
        ObjectNode coding = JSON.objectNode();
        coding.put("system", system);
        coding.put("code", code);
        return coding;
    }

    public static ObjectNode coding(CodeIdentity identity) {
        return coding(identity.system(), identity.code());
    }

    public static ObjectNode concept(ObjectNode... codings) {
        ObjectNode concept = JSON.objectNode();
        ArrayNode array = concept.putArray("coding");
        for (ObjectNode coding : codings) {
            array.add(coding);
        }
        return concept;
    }

    /**
     * A ValueSet with a primary topic and a flat expansion.
     */
    public static ObjectNode valueSet(String id, TopicLabel topic, String date, CodeIdentity... codes) {
        ObjectNode valueSet = JSON.objectNode();
        valueSet.put(FhirTerms.RESOURCE_TYPE, FhirTerms.VALUE_SET);
        valueSet.put("id", id);
        if (date != null) {
            valueSet.put("date", date);
        }
        if (topic != null) {
            valueSet.putArray("topic").add(concept(topic.toCoding()));
        }
        ArrayNode contains = valueSet.putObject("expansion").putArray("contains");
        for (CodeIdentity code : codes) {
            contains.add(coding(code));
        }
        return valueSet;
    }

    /**
     * A ValueSet whose topics are given only as focus use contexts.
     */
    public static ObjectNode focusValueSet(String id, List<TopicLabel> topics, List<CodeIdentity> codes) {
        ObjectNode valueSet = valueSet(id, null, null, codes.toArray(new CodeIdentity[0]));
        ObjectNode context = valueSet.putArray("useContext").addObject();
        context.set("code", coding("http://terminology.hl7.org/CodeSystem/usage-context-type", "focus"));
        ArrayNode codings = context.putObject("valueCodeableConcept").putArray("coding");
        topics.forEach(t -> codings.add(t.toCoding()));
        return valueSet;
    }

    public static ObjectNode resource(String type, String id) {
        ObjectNode resource = JSON.objectNode();
        resource.put(FhirTerms.RESOURCE_TYPE, type);
        resource.put("id", id);
        return resource;
    }

    public static ObjectNode condition(String id, CodeIdentity... codes) {
        ObjectNode condition = resource("Condition", id);
        ObjectNode[] codings = new ObjectNode[codes.length];
        for (int i = 0; i < codes.length; i++) {
            codings[i] = coding(codes[i]);
        }
        condition.set("code", concept(codings));
        return condition;
    }

    public static ObjectNode withMarker(ObjectNode resource, Instant marker) {
        ObjectNode meta = resource.has("meta") ? (ObjectNode) resource.get("meta") : resource.putObject("meta");
        ArrayNode extensions = meta.has("extension") ? (ArrayNode) meta.get("extension") : meta.putArray("extension");
        ObjectNode extension = extensions.addObject();
        extension.put("url", FhirTerms.LAST_SOURCE_SYNC_URL);
        extension.put("valueDateTime", marker.toString());
        return resource;
    }

    public static ObjectNode bundle(JsonNode... resources) {
        ObjectNode bundle = JSON.objectNode();
        bundle.put(FhirTerms.RESOURCE_TYPE, FhirTerms.BUNDLE);
        bundle.put("type", "collection");
        ArrayNode entries = bundle.putArray("entry");
        for (JsonNode resource : resources) {
            entries.addObject().set("resource", resource);
        }
        return bundle;
    }

    public static ArrayNode security(JsonNode resource) {
        JsonNode security = resource.path("meta").path("security");
        return security.isArray() ? (ArrayNode) security : JSON.arrayNode();
    }

    public static long markerCount(JsonNode resource) {
        long count = 0;
        for (JsonNode extension : resource.path("meta").path("extension")) {
            if (FhirTerms.LAST_SOURCE_SYNC_URL.equals(extension.path("url").asText())) {
                count++;
            }
        }
        return count;
    }

    public static boolean hasLabel(JsonNode resource, String system, String code) {
        for (JsonNode label : resource.path("meta").path("security")) {
            if (system.equals(label.path("system").asText()) && code.equals(label.path("code").asText())) {
                return true;
            }
        }
        return false;
    }
}
