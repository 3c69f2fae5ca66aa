package com.fhirsls.core.scan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fhirsls.core.rules.CodeIdentity;
import com.fhirsls.core.rules.LabelKey;
import com.fhirsls.core.rules.RuleTable;
import com.fhirsls.core.rules.TopicLabel;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Finds the sensitive topics a record touches by walking its tree and looking every
 * embedded code up in a rule table.
 *
 * The walk is an explicit recursive descent over {@link NodeShape}s. A leaf code is looked
 * up and then descended like any container, since codings may carry extensions; a concept
 * wrapper visits its codings first and then its remaining fields. Every node is visited
 * once. Input is untrusted, so depth is bounded.
 */
public class CodeScanner {

    public static final int DEFAULT_MAX_DEPTH = 128;

    private final int maxDepth;

    public CodeScanner() {
        this(DEFAULT_MAX_DEPTH);
    }

    public CodeScanner(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Max depth must be positive");
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Returns the matched topics, deduplicated by label identity, in first-match order.
     *
     * @throws ScanDepthExceededException when the record nests deeper than the bound
     */
    public Set<TopicLabel> scan(JsonNode record, RuleTable table) {
        Objects.requireNonNull(table, "Rule table cannot be null");
        Map<LabelKey, TopicLabel> matches = new LinkedHashMap<>();
        visit(record, table, matches, 0);
        return Collections.unmodifiableSet(new LinkedHashSet<>(matches.values()));
    }

    private void visit(JsonNode node, RuleTable table, Map<LabelKey, TopicLabel> matches, int depth) {
        if (depth > maxDepth) {
            throw new ScanDepthExceededException(maxDepth);
        }
        switch (NodeClassifier.classify(node)) {
            case LEAF_CODE -> {
                CodeIdentity identity = new CodeIdentity(node.get("system").asText(), node.get("code").asText());
                for (TopicLabel topic : table.lookup(identity)) {
                    matches.putIfAbsent(topic.key(), topic);
                }
                visitFields(node, null, table, matches, depth);
            }
            case CONCEPT_WRAPPER -> {
                for (JsonNode coding : node.get("coding")) {
                    visit(coding, table, matches, depth + 1);
                }
                visitFields(node, "coding", table, matches, depth);
            }
            case CONTAINER -> {
                if (node.isArray()) {
                    for (JsonNode item : node) {
                        visit(item, table, matches, depth + 1);
                    }
                } else {
                    visitFields(node, null, table, matches, depth);
                }
            }
            case SCALAR -> {
                // nothing to find
            }
        }
    }

    private void visitFields(JsonNode object, String skipField, RuleTable table,
                             Map<LabelKey, TopicLabel> matches, int depth) {
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().equals(skipField)) {
                continue;
            }
            JsonNode value = field.getValue();
            if (value.isContainerNode()) {
                visit(value, table, matches, depth + 1);
            }
        }
    }
}
