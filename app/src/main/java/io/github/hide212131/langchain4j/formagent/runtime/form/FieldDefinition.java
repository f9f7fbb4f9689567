package io.github.hide212131.langchain4j.formagent.runtime.form;

/**
 * A node of the form field tree. Groups hold only {@link ScalarField} children, so the tree is at most one
 * level deep by construction.
 */
public sealed interface FieldDefinition permits ScalarField, GroupField {

    String id();

    FieldKind kind();

    String label();

    boolean required();

    String placeholder();

    /** 1-based display position among siblings. */
    int order();
}
