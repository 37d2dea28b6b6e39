package org.contextql.dsl;

import org.contextql.model.ColumnRef;
import org.contextql.model.ContextDocument;
import org.contextql.model.ContextStatus;
import org.contextql.model.DatasetRef;
import org.contextql.model.Relationship;
import org.contextql.model.SourceFormat;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers a context document from plain prose using heading conventions:
 *
 * <pre>
 * # Sales Analysis
 *
 * Orders joined to the customers who placed them.
 *
 * ## Dataset: Orders (id: ds-orders)
 * ## Datasets
 * - Customers (id: ds-customers)
 *
 * ## Relationships
 * - Orders -> Customers via customer_id
 * </pre>
 *
 * Only syntax is checked here. Whether the datasets and columns exist is left
 * to the validator.
 */
final class ConventionParser {

    static final String DEFAULT_NAME = "Dataset Context";
    static final String DEFAULT_DESCRIPTION = "Dataset context documentation";
    static final String DEFAULT_VERSION = "1.0.0";
    static final String FALLBACK_DATASET_ID = "main";

    private static final int MAX_DESCRIPTION = 200;

    private static final Pattern TITLE = Pattern.compile("^#\\s+(.+)$");
    private static final Pattern SUBHEADING = Pattern.compile("^##\\s+(.*)$");
    private static final Pattern DATASET_HEADING = Pattern.compile("^Dataset:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATASETS_SECTION = Pattern.compile("^Datasets?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern RELATIONSHIPS_SECTION = Pattern.compile("^Relationships?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*[-*]\\s+(.*)$");
    private static final Pattern NAMED_ID = Pattern.compile("^(.+?)\\s*\\(id:\\s*([^)]*)\\)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");
    private static final Pattern RELATIONSHIP = Pattern.compile(
            "^(.+?)\\s*(?:->|\\u2192)\\s*(.+?)\\s+via\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*$");

    private enum Section { NONE, DATASETS, RELATIONSHIPS }

    private ConventionParser() {
    }

    static ContextDocument parse(String text, String fallbackExternalDatasetId) {
        String normalized = ContentFingerprint.normalizeBody(text);
        String[] lines = normalized.split("\n", -1);

        String name = null;
        Section section = Section.NONE;
        List<DatasetRef> datasets = new ArrayList<>();
        Map<String, Integer> datasetLines = new HashMap<>();
        List<Relationship> relationships = new ArrayList<>();
        Map<String, Integer> relationshipIds = new HashMap<>();

        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            String line = lines[i];

            Matcher title = TITLE.matcher(line);
            if (title.matches()) {
                if (name == null) {
                    name = title.group(1).strip();
                }
                section = Section.NONE;
                continue;
            }

            Matcher heading = SUBHEADING.matcher(line);
            if (heading.matches()) {
                String headingText = heading.group(1).strip();
                Matcher datasetHeading = DATASET_HEADING.matcher(headingText);
                if (datasetHeading.matches()) {
                    addDataset(datasetHeading.group(1), lineNo, line.indexOf(':') + 2, datasets, datasetLines);
                    section = Section.NONE;
                } else if (DATASETS_SECTION.matcher(headingText).matches()) {
                    section = Section.DATASETS;
                } else if (RELATIONSHIPS_SECTION.matcher(headingText).matches()) {
                    section = Section.RELATIONSHIPS;
                } else {
                    section = Section.NONE;
                }
                continue;
            }
            if (line.startsWith("#")) {
                section = Section.NONE;
                continue;
            }

            Matcher item = LIST_ITEM.matcher(line);
            if (!item.matches()) {
                continue;
            }
            int column = item.start(1) + 1;
            if (section == Section.DATASETS) {
                addDataset(item.group(1), lineNo, column, datasets, datasetLines);
            } else if (section == Section.RELATIONSHIPS) {
                relationships.add(relationship(item.group(1), lineNo, column, relationshipIds));
            }
        }

        if (datasets.isEmpty() && fallbackExternalDatasetId != null) {
            datasets.add(DatasetRef.of(FALLBACK_DATASET_ID, fallbackExternalDatasetId,
                    name == null ? DEFAULT_NAME : name));
        }

        String resolvedName = name == null ? DEFAULT_NAME : name;
        ContextDocument document = new ContextDocument(
                StructuredBlockParser.slug(resolvedName),
                resolvedName,
                DEFAULT_VERSION,
                firstParagraph(normalized),
                ContextStatus.DRAFT,
                List.of(),
                null,
                null,
                datasets,
                relationships,
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                null,
                normalized,
                SourceFormat.CONVENTION,
                null);
        return ContentFingerprint.stamp(document);
    }

    private static void addDataset(String declaration, int line, int column,
                                   List<DatasetRef> datasets, Map<String, Integer> datasetLines) {
        Matcher m = NAMED_ID.matcher(declaration.strip());
        if (!m.matches()) {
            throw new ContextParseException(
                    "Expected a dataset declaration of the form 'Name (id: identifier)'", line, column);
        }
        String displayName = m.group(1).strip();
        String externalId = m.group(2).strip();
        if (!IDENTIFIER.matcher(externalId).matches()) {
            throw new ContextParseException("Invalid dataset identifier '" + externalId + "'", line, column);
        }
        String localId = localId(displayName);
        Integer previous = datasetLines.putIfAbsent(localId, line);
        if (previous != null) {
            throw new ContextParseException(
                    "Duplicate dataset '" + displayName + "', already declared on line " + previous, line, column);
        }
        datasets.add(DatasetRef.of(localId, externalId, displayName));
    }

    private static Relationship relationship(String declaration, int line, int column,
                                             Map<String, Integer> relationshipIds) {
        Matcher m = RELATIONSHIP.matcher(declaration.strip());
        if (!m.matches()) {
            throw new ContextParseException(
                    "Expected a relationship of the form 'A -> B via column'", line, column);
        }
        String from = localId(m.group(1).strip());
        String to = localId(m.group(2).strip());
        String joinColumn = m.group(3);

        String baseId = from + "_" + to;
        int seen = relationshipIds.merge(baseId, 1, Integer::sum);
        String id = seen == 1 ? baseId : baseId + "_" + seen;

        return Relationship.of(id, new ColumnRef(from, joinColumn), new ColumnRef(to, joinColumn), null);
    }

    /**
     * Local id of a dataset declared by display name: lower-cased, spaces
     * replaced by underscores.
     */
    static String localId(String displayName) {
        return displayName.strip().toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    private static String firstParagraph(String text) {
        for (String paragraph : text.split("\n\\s*\n")) {
            String p = paragraph.strip();
            if (p.isEmpty() || p.startsWith("#") || LIST_ITEM.matcher(p.lines().findFirst().orElse("")).matches()) {
                continue;
            }
            String joined = String.join(" ", p.lines().map(String::strip).toList());
            return joined.length() > MAX_DESCRIPTION ? joined.substring(0, MAX_DESCRIPTION) : joined;
        }
        return DEFAULT_DESCRIPTION;
    }
}
