package org.contextql.model;

/**
 * Closed set of the named elements a context document declares.
 *
 * Every element carries a {@link Kind} tag so consumers (most importantly the
 * validator) can switch over all variants exhaustively.
 */
public sealed interface ContextElement
        permits DatasetRef, Relationship, Metric, NamedFilter, BusinessRule, GlossaryEntry {

    enum Kind {
        DATASET("datasets"),
        RELATIONSHIP("relationships"),
        METRIC("metrics"),
        FILTER("filters"),
        RULE("business_rules"),
        GLOSSARY("glossary");

        private final String section;

        Kind(String section) {
            this.section = section;
        }

        /**
         * @return The structured-block key this kind of element is declared under
         */
        public String section() {
            return section;
        }
    }

    /**
     * @return The identifier of this element within its document
     */
    String elementId();

    Kind kind();
}
