package org.contextql.dsl;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.contextql.model.BusinessRule;
import org.contextql.model.ColumnDef;
import org.contextql.model.ColumnRef;
import org.contextql.model.ContextDocument;
import org.contextql.model.ContextSettings;
import org.contextql.model.ContextStatus;
import org.contextql.model.DatasetRef;
import org.contextql.model.FilterParameter;
import org.contextql.model.GlossaryEntry;
import org.contextql.model.Metric;
import org.contextql.model.NamedFilter;
import org.contextql.model.Relationship;
import org.contextql.model.SourceFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BiFunction;

/**
 * Parses the structured form: a YAML block between two {@code ---} lines,
 * followed by free-form prose.
 *
 * Only the fields of the context schema are read; unknown keys are ignored.
 * Errors in the YAML itself are reported with their line and column in the
 * whole document, errors against the schema with the path of the field.
 */
final class StructuredBlockParser {

    static final String DELIMITER = "---";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private StructuredBlockParser() {
    }

    static ContextDocument parse(String text) {
        String source = text.startsWith("\uFEFF") ? text.substring(1) : text;
        String[] lines = source.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);

        int close = -1;
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].strip().equals(DELIMITER)) {
                close = i;
                break;
            }
        }
        if (close < 0) {
            throw new ContextParseException("Structured block is not terminated by a '---' line", 1, 1);
        }

        String block = String.join("\n", List.of(lines).subList(1, close));
        String body = String.join("\n", List.of(lines).subList(close + 1, lines.length));

        JsonNode root = readBlock(block);
        return toDocument(root, body);
    }

    private static JsonNode readBlock(String block) {
        JsonNode root;
        try {
            root = YAML.readTree(block);
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            // +1 for the opening delimiter line
            int line = location != null && location.getLineNr() > 0 ? location.getLineNr() + 1 : 2;
            int column = location != null && location.getColumnNr() > 0 ? location.getColumnNr() : 1;
            throw new ContextParseException("Invalid YAML: " + e.getOriginalMessage(), line, column, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ContextParseException("Structured block is empty", 2, 1);
        }
        if (!root.isObject()) {
            throw new ContextParseException("Structured block must be a mapping", 2, 1);
        }
        return root;
    }

    private static ContextDocument toDocument(JsonNode root, String body) {
        String name = requiredText(root, "name", "");
        String version = requiredText(root, "version", "");
        String description = requiredText(root, "description", "");
        String id = optionalText(root, "id", "");
        if (id == null || id.isBlank()) {
            id = slug(name);
        }

        String statusText = optionalText(root, "status", "");
        ContextStatus status = ContextStatus.DRAFT;
        if (statusText != null) {
            status = ContextStatus.fromDeclared(statusText).orElseThrow(() -> new ContextParseException(
                    "Unknown status '" + statusText + "', expected draft, active or deprecated", "status"));
        }

        JsonNode datasetsNode = root.get("datasets");
        if (datasetsNode == null || datasetsNode.isNull()) {
            throw new ContextParseException("Missing required field", "datasets");
        }
        if (!datasetsNode.isArray() || datasetsNode.isEmpty()) {
            throw new ContextParseException("Expected a non-empty list of datasets", "datasets");
        }

        List<DatasetRef> datasets = list(root, "datasets", StructuredBlockParser::dataset);
        List<Relationship> relationships = list(root, "relationships", StructuredBlockParser::relationship);
        List<Metric> metrics = list(root, "metrics", StructuredBlockParser::metric);
        List<NamedFilter> filters = list(root, "filters", StructuredBlockParser::filter);
        List<BusinessRule> rules = list(root, "business_rules", StructuredBlockParser::rule);
        List<GlossaryEntry> glossary = list(root, "glossary", StructuredBlockParser::glossaryEntry);

        ContextDocument document = new ContextDocument(
                id.trim(),
                name,
                version,
                description,
                status,
                stringList(root, "tags", ""),
                optionalText(root, "category", ""),
                optionalText(root, "owner", ""),
                datasets,
                relationships,
                metrics,
                filters,
                rules,
                glossary,
                settings(root),
                ContentFingerprint.normalizeBody(body),
                SourceFormat.STRUCTURED,
                null);
        return ContentFingerprint.stamp(document);
    }

    // ==================== Elements ====================

    private static DatasetRef dataset(JsonNode node, String path) {
        List<ColumnDef> columns = list(node, "columns", path, StructuredBlockParser::column);
        return new DatasetRef(
                requiredText(node, "id", path),
                requiredText(node, "dataset_id", path),
                requiredText(node, "name", path),
                optionalText(node, "description", path),
                columns);
    }

    private static ColumnDef column(JsonNode node, String path) {
        if (node.isTextual()) {
            return ColumnDef.of(node.asText(), null);
        }
        String dataType = optionalText(node, "data_type", path);
        if (dataType == null) {
            dataType = optionalText(node, "type", path);
        }
        JsonNode nullable = node.get("nullable");
        if (nullable != null && !nullable.isNull() && !nullable.isBoolean()) {
            throw new ContextParseException("Expected true or false", child(path, "nullable"));
        }
        return new ColumnDef(
                requiredText(node, "name", path),
                optionalText(node, "business_name", path),
                dataType,
                nullable == null || nullable.isNull() || nullable.asBoolean(),
                optionalText(node, "description", path));
    }

    private static Relationship relationship(JsonNode node, String path) {
        return new Relationship(
                requiredText(node, "id", path),
                new ColumnRef(requiredText(node, "from_dataset", path), requiredText(node, "from_column", path)),
                new ColumnRef(requiredText(node, "to_dataset", path), requiredText(node, "to_column", path)),
                optionalText(node, "join_type", path),
                optionalText(node, "description", path));
    }

    private static Metric metric(JsonNode node, String path) {
        String id = requiredText(node, "id", path);
        String name = optionalText(node, "name", path);
        return new Metric(
                id,
                name == null ? id : name,
                optionalText(node, "expression", path),
                optionalText(node, "data_type", path),
                optionalText(node, "format", path),
                stringList(node, "datasets", path),
                optionalText(node, "description", path));
    }

    private static NamedFilter filter(JsonNode node, String path) {
        String id = requiredText(node, "id", path);
        String name = optionalText(node, "name", path);
        return new NamedFilter(
                id,
                name == null ? id : name,
                optionalText(node, "condition", path),
                list(node, "parameters", path, StructuredBlockParser::parameter),
                optionalText(node, "description", path));
    }

    private static FilterParameter parameter(JsonNode node, String path) {
        return new FilterParameter(
                requiredText(node, "name", path),
                optionalText(node, "data_type", path),
                optionalText(node, "default", path));
    }

    private static BusinessRule rule(JsonNode node, String path) {
        String id = requiredText(node, "id", path);
        String name = optionalText(node, "name", path);
        return new BusinessRule(
                id,
                name == null ? id : name,
                optionalText(node, "severity", path),
                optionalText(node, "rule_type", path),
                optionalText(node, "condition", path),
                optionalText(node, "description", path));
    }

    private static GlossaryEntry glossaryEntry(JsonNode node, String path) {
        return new GlossaryEntry(
                requiredText(node, "term", path),
                optionalText(node, "definition", path),
                stringList(node, "synonyms", path),
                stringList(node, "related_columns", path),
                optionalText(node, "examples", path));
    }

    private static ContextSettings settings(JsonNode root) {
        JsonNode settings = root.get("settings");
        if (settings == null || settings.isNull()) {
            return ContextSettings.DEFAULTS;
        }
        if (!settings.isObject()) {
            throw new ContextParseException("Expected a mapping", "settings");
        }
        JsonNode ttl = settings.get("cache_ttl_seconds");
        if (ttl == null || ttl.isNull()) {
            return ContextSettings.DEFAULTS;
        }
        if (!ttl.canConvertToLong() || !ttl.isIntegralNumber() || ttl.asLong() < 0) {
            throw new ContextParseException("Expected a non-negative integer", "settings.cache_ttl_seconds");
        }
        return new ContextSettings(ttl.asLong());
    }

    // ==================== Field Helpers ====================

    private static <T> List<T> list(JsonNode parent, String key, BiFunction<JsonNode, String, T> reader) {
        return list(parent, key, "", reader);
    }

    private static <T> List<T> list(JsonNode parent, String key, String parentPath,
                                    BiFunction<JsonNode, String, T> reader) {
        String path = child(parentPath, key);
        JsonNode node = parent.get(key);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ContextParseException("Expected a list", path);
        }
        List<T> items = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode item = node.get(i);
            String itemPath = path + "[" + i + "]";
            if (!item.isObject() && !(item.isTextual() && key.equals("columns"))) {
                throw new ContextParseException("Expected a mapping", itemPath);
            }
            items.add(reader.apply(item, itemPath));
        }
        return items;
    }

    private static String requiredText(JsonNode node, String key, String parentPath) {
        String value = optionalText(node, key, parentPath);
        if (value == null) {
            throw new ContextParseException("Missing required field", child(parentPath, key));
        }
        return value;
    }

    private static String optionalText(JsonNode node, String key, String parentPath) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new ContextParseException("Expected a scalar value", child(parentPath, key));
        }
        return value.asText();
    }

    private static List<String> stringList(JsonNode node, String key, String parentPath) {
        String path = child(parentPath, key);
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new ContextParseException("Expected a list", path);
        }
        List<String> items = new ArrayList<>();
        for (int i = 0; i < value.size(); i++) {
            JsonNode item = value.get(i);
            if (!item.isValueNode() || item.isNull()) {
                throw new ContextParseException("Expected a scalar value", path + "[" + i + "]");
            }
            items.add(item.asText());
        }
        return items;
    }

    private static String child(String parentPath, String key) {
        return parentPath.isEmpty() ? key : parentPath + "." + key;
    }

    /**
     * Derives a context id from its name: lower-cased, runs of anything other
     * than letters and digits collapsed to a single '-'.
     */
    static String slug(String name) {
        String slug = name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "context" : slug;
    }
}
