package org.contextql.engine.service;

import org.contextql.model.GlossaryEntry;

/**
 * A glossary entry found by term or synonym, with the context version defining it.
 */
public record GlossaryMatch(String contextId, String contextName, String version, GlossaryEntry entry) {
}
