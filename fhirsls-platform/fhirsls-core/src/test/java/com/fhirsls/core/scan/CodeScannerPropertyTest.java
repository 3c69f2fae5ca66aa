package com.fhirsls.core.scan;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fhirsls.core.rules.CodeIdentity;
import com.fhirsls.core.rules.CompiledSource;
import com.fhirsls.core.rules.RuleTable;
import com.fhirsls.core.rules.TopicLabel;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static com.fhirsls.core.FhirFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the record scanner.
 */
class CodeScannerPropertyTest {

    private static final CodeIdentity DEPRESSION = new CodeIdentity(SNOMED, "35489007");
    private static final CodeIdentity ALCOHOL = new CodeIdentity(SNOMED, "7200002");
    private static final CodeIdentity HIV_DISEASE = new CodeIdentity(SNOMED, "86406008");

    private final CodeScanner scanner = new CodeScanner();

    private static RuleTable table() {
        return RuleTable.empty().merge(List.of(
                new CompiledSource("psy", List.of(PSY), Set.of(DEPRESSION), null),
                new CompiledSource("eth", List.of(ETH), Set.of(ALCOHOL), null),
                new CompiledSource("hiv", List.of(HIV, PSY), Set.of(HIV_DISEASE), null)
        ), Instant.EPOCH);
    }

    // ==================== Nesting ====================

    /**
     * Property: a rule code is found however deep it sits, as long as the depth bound allows it.
     */
    @Property(tries = 100)
    void ruleCode_isFoundAtAnyNestingDepth(
            @ForAll @IntRange(min = 0, max = 40) int depth,
            @ForAll boolean viaArrays) {

        ObjectNode record = resource("Observation", "o1");
        ObjectNode cursor = record;
        for (int i = 0; i < depth; i++) {
            cursor = viaArrays
                    ? cursor.putArray("component").addObject()
                    : cursor.putObject("part" + i);
        }
        cursor.set("valueCodeableConcept", concept(coding(DEPRESSION)));

        assertThat(scanner.scan(record, table())).containsExactly(PSY);
    }

    /**
     * Property: codes that are not rules never produce a match.
     */
    @Property(tries = 100)
    void unknownCodes_matchNothing(@ForAll("unknownCodes") List<String> codes) {
        ObjectNode record = resource("Condition", "c1");
        ArrayNode category = record.putArray("category");
        codes.forEach(code -> category.add(concept(coding(SNOMED, code))));
        record.set("code", concept(codes.stream().map(c -> coding(ICD10, c)).toArray(ObjectNode[]::new)));

        assertThat(scanner.scan(record, table())).isEmpty();
    }

    @Provide
    Arbitrary<List<String>> unknownCodes() {
        return Arbitraries.strings().numeric().ofMinLength(1).ofMaxLength(6)
                .map(s -> "x" + s)
                .list().ofMinSize(1).ofMaxSize(5);
    }

    // ==================== Shapes ====================

    @Test
    void codeThreeLevelsDown_isMatched() {
        ObjectNode record = resource("Observation", "o1");
        record.putArray("component").addObject()
                .putObject("valueCodeableConcept")
                .putArray("coding").add(coding(ALCOHOL));

        assertThat(scanner.scan(record, table())).containsExactly(ETH);
    }

    @Test
    void bareCoding_outsideConcept_isMatched() {
        ObjectNode record = resource("Encounter", "e1");
        record.set("class", coding(DEPRESSION));

        assertThat(scanner.scan(record, table())).containsExactly(PSY);
    }

    @Test
    void codingExtensions_areScannedToo() {
        ObjectNode outer = coding(SNOMED, "not-a-rule");
        outer.putArray("extension").addObject().set("valueCoding", coding(HIV_DISEASE));
        ObjectNode record = resource("Condition", "c1");
        record.set("code", concept(outer));

        assertThat(scanner.scan(record, table())).containsExactly(HIV, PSY);
    }

    @Test
    void conceptFieldsBesideCoding_areScanned() {
        ObjectNode concept = concept(coding(DEPRESSION));
        concept.putArray("extension").addObject().set("valueCodeableConcept", concept(coding(ALCOHOL)));
        ObjectNode record = resource("Condition", "c1");
        record.set("code", concept);

        assertThat(scanner.scan(record, table())).containsExactly(PSY, ETH);
    }

    @Test
    void repeatedMatches_areDeduplicated() {
        ObjectNode record = condition("c1", DEPRESSION, HIV_DISEASE);
        record.putArray("evidence").addObject().putArray("code").add(concept(coding(DEPRESSION)));

        Set<TopicLabel> topics = scanner.scan(record, table());

        assertThat(topics).containsExactly(PSY, HIV);
    }

    @Test
    void systemMustMatchExactly() {
        ObjectNode record = condition("c1", new CodeIdentity(ICD10, DEPRESSION.code()));

        assertThat(scanner.scan(record, table())).isEmpty();
    }

    @Test
    void nonTextualSystemOrCode_isNotALeaf() {
        ObjectNode odd = JsonNodeFactory.instance.objectNode();
        odd.put("system", 42);
        odd.put("code", DEPRESSION.code());
        ObjectNode record = resource("Observation", "o1");
        record.set("valueCoding", odd);

        assertThat(scanner.scan(record, table())).isEmpty();
    }

    // ==================== Depth Bound ====================

    @Test
    void nestingBeyondBound_throws() {
        ObjectNode record = resource("Observation", "o1");
        ObjectNode cursor = record;
        for (int i = 0; i < 10; i++) {
            cursor = cursor.putObject("nested");
        }

        CodeScanner shallow = new CodeScanner(3);

        assertThatThrownBy(() -> shallow.scan(record, table()))
                .isInstanceOf(ScanDepthExceededException.class)
                .extracting(e -> ((ScanDepthExceededException) e).getMaxDepth())
                .isEqualTo(3);
    }

    @Test
    void nonPositiveBound_isRejected() {
        assertThatThrownBy(() -> new CodeScanner(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void classifier_recognisesEachShape() {
        assertThat(NodeClassifier.classify(coding(DEPRESSION))).isEqualTo(NodeShape.LEAF_CODE);
        assertThat(NodeClassifier.classify(concept(coding(DEPRESSION)))).isEqualTo(NodeShape.CONCEPT_WRAPPER);
        assertThat(NodeClassifier.classify(resource("Patient", "p"))).isEqualTo(NodeShape.CONTAINER);
        assertThat(NodeClassifier.classify(JsonNodeFactory.instance.arrayNode())).isEqualTo(NodeShape.CONTAINER);
        assertThat(NodeClassifier.classify(JsonNodeFactory.instance.textNode("x"))).isEqualTo(NodeShape.SCALAR);
    }
}
