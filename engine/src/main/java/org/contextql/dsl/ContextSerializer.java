package org.contextql.dsl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.contextql.model.BusinessRule;
import org.contextql.model.ColumnDef;
import org.contextql.model.ContextDocument;
import org.contextql.model.DatasetRef;
import org.contextql.model.FilterParameter;
import org.contextql.model.GlossaryEntry;
import org.contextql.model.Metric;
import org.contextql.model.NamedFilter;
import org.contextql.model.Relationship;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Renders a context document in structured form: the schema fields as a YAML
 * block between {@code ---} lines, followed by the prose body.
 *
 * Parsing the output yields a document equal to the input for any document
 * that was itself parsed from structured form. Convention-form documents are
 * rendered too, but come back marked as structured.
 */
public final class ContextSerializer {

    private static final ObjectMapper YAML = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build());

    private ContextSerializer() {
    }

    public static String serialize(ContextDocument document) {
        String block;
        try {
            block = YAML.writeValueAsString(toBlock(document));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render context " + document.id(), e);
        }
        StringBuilder sb = new StringBuilder();
        sb.append(StructuredBlockParser.DELIMITER).append('\n');
        sb.append(block);
        if (!block.endsWith("\n")) {
            sb.append('\n');
        }
        sb.append(StructuredBlockParser.DELIMITER).append('\n');
        String body = ContentFingerprint.normalizeBody(document.body());
        if (!body.isEmpty()) {
            sb.append('\n').append(body).append('\n');
        }
        return sb.toString();
    }

    private static Map<String, Object> toBlock(ContextDocument d) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", d.id());
        putIfPresent(m, "name", d.name());
        putIfPresent(m, "version", d.version());
        putIfPresent(m, "description", d.description());
        m.put("status", d.status().declaredName());
        putIfPresent(m, "tags", d.tags());
        putIfPresent(m, "category", d.category());
        putIfPresent(m, "owner", d.owner());
        m.put("datasets", each(d.datasets(), ContextSerializer::dataset));
        putIfPresent(m, "relationships", each(d.relationships(), ContextSerializer::relationship));
        putIfPresent(m, "metrics", each(d.metrics(), ContextSerializer::metric));
        putIfPresent(m, "filters", each(d.filters(), ContextSerializer::filter));
        putIfPresent(m, "business_rules", each(d.rules(), ContextSerializer::rule));
        putIfPresent(m, "glossary", each(d.glossary(), ContextSerializer::glossary));
        if (d.settings().cacheTtlSeconds() != null) {
            m.put("settings", Map.of("cache_ttl_seconds", d.settings().cacheTtlSeconds()));
        }
        return m;
    }

    private static Map<String, Object> dataset(DatasetRef ds) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", ds.localId());
        m.put("name", ds.name());
        m.put("dataset_id", ds.externalDatasetId());
        putIfPresent(m, "description", ds.description());
        putIfPresent(m, "columns", each(ds.columns(), ContextSerializer::column));
        return m;
    }

    private static Map<String, Object> column(ColumnDef c) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", c.name());
        putIfPresent(m, "business_name", c.businessName());
        putIfPresent(m, "data_type", c.dataType());
        m.put("nullable", c.nullable());
        putIfPresent(m, "description", c.description());
        return m;
    }

    private static Map<String, Object> relationship(Relationship r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", r.id());
        m.put("from_dataset", r.from().datasetId());
        m.put("from_column", r.from().column());
        m.put("to_dataset", r.to().datasetId());
        m.put("to_column", r.to().column());
        putIfPresent(m, "join_type", r.joinType());
        putIfPresent(m, "description", r.description());
        return m;
    }

    private static Map<String, Object> metric(Metric metric) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", metric.id());
        putIfPresent(m, "name", metric.name());
        m.put("expression", metric.expression());
        putIfPresent(m, "data_type", metric.dataType());
        putIfPresent(m, "format", metric.format());
        putIfPresent(m, "datasets", metric.datasets());
        putIfPresent(m, "description", metric.description());
        return m;
    }

    private static Map<String, Object> filter(NamedFilter f) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", f.id());
        putIfPresent(m, "name", f.name());
        m.put("condition", f.condition());
        putIfPresent(m, "parameters", each(f.parameters(), ContextSerializer::parameter));
        putIfPresent(m, "description", f.description());
        return m;
    }

    private static Map<String, Object> parameter(FilterParameter p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", p.name());
        putIfPresent(m, "data_type", p.dataType());
        putIfPresent(m, "default", p.defaultValue());
        return m;
    }

    private static Map<String, Object> rule(BusinessRule r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", r.id());
        putIfPresent(m, "name", r.name());
        putIfPresent(m, "severity", r.severity());
        putIfPresent(m, "rule_type", r.ruleType());
        m.put("condition", r.condition());
        putIfPresent(m, "description", r.description());
        return m;
    }

    private static Map<String, Object> glossary(GlossaryEntry g) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("term", g.term());
        putIfPresent(m, "definition", g.definition());
        putIfPresent(m, "synonyms", g.synonyms());
        putIfPresent(m, "related_columns", g.relatedColumns());
        putIfPresent(m, "examples", g.examples());
        return m;
    }

    private static <T> List<Map<String, Object>> each(List<T> items, Function<T, Map<String, Object>> fn) {
        List<Map<String, Object>> out = new ArrayList<>(items.size());
        for (T item : items) {
            out.add(fn.apply(item));
        }
        return out;
    }

    private static void putIfPresent(Map<String, Object> m, String key, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof List<?> list && list.isEmpty()) {
            return;
        }
        m.put(key, value);
    }
}
