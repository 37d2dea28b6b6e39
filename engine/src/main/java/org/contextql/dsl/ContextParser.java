package org.contextql.dsl;

import org.contextql.model.ContextDocument;
import org.contextql.model.SourceFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for turning document text into a {@link ContextDocument}.
 *
 * The format is chosen by a cheap prefix check ({@link SourceFormat#detect}):
 * text opening with a {@code ---} line is parsed as a structured block, any
 * other text by heading conventions. Both strategies compute the content
 * fingerprint.
 */
public final class ContextParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContextParser.class);

    private ContextParser() {
    }

    /**
     * @throws ContextParseException if the text is malformed
     */
    public static ContextDocument parse(String text) {
        return parse(text, null);
    }

    /**
     * Parses a document; a convention-form document that declares no dataset is
     * bound to {@code fallbackExternalDatasetId} as a single dataset {@code main}.
     *
     * @param fallbackExternalDatasetId External dataset id to fall back to (may be null)
     * @throws ContextParseException if the text is malformed
     */
    public static ContextDocument parse(String text, String fallbackExternalDatasetId) {
        if (text == null) {
            throw new ContextParseException("Document text is missing", 1, 1);
        }
        SourceFormat format = SourceFormat.detect(text);
        ContextDocument document = switch (format) {
            case STRUCTURED -> StructuredBlockParser.parse(text);
            case CONVENTION -> ConventionParser.parse(text, fallbackExternalDatasetId);
        };
        LOGGER.debug("Parsed {} context '{}' v{} with {} dataset(s), fingerprint {}",
                format, document.id(), document.version(), document.datasets().size(), document.fingerprint());
        return document;
    }
}
