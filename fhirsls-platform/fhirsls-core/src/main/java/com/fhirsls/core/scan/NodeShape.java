package com.fhirsls.core.scan;

/**
 * The structural shapes a node of a clinical record can take, as far as code discovery cares.
 */
public enum NodeShape {
    /** An object carrying both a textual system and a textual code, such as a Coding. */
    LEAF_CODE,
    /** An object holding an ordered {@code coding} array, such as a CodeableConcept. */
    CONCEPT_WRAPPER,
    /** Any other object, or an array. */
    CONTAINER,
    /** Text, numbers, booleans and nulls. */
    SCALAR
}
