package org.contextql.dsl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.contextql.model.BusinessRule;
import org.contextql.model.ColumnDef;
import org.contextql.model.ContextDocument;
import org.contextql.model.DatasetRef;
import org.contextql.model.FilterParameter;
import org.contextql.model.GlossaryEntry;
import org.contextql.model.Metric;
import org.contextql.model.NamedFilter;
import org.contextql.model.Relationship;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Computes the content fingerprint of a context document by canonicalizing it
 * to key-sorted JSON and hashing that with SHA-256.
 *
 * Declaration order of datasets, relationships and the other element lists is
 * significant (it drives join tie-breaks) and is preserved. The lifecycle
 * status and the source format are not content and are left out, so activating
 * a version or re-rendering it in structured form keeps its fingerprint.
 */
public final class ContentFingerprint {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private ContentFingerprint() {
    }

    public static String of(ContextDocument document) {
        try {
            return sha256Hex(MAPPER.writeValueAsString(canonicalize(document)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to compute fingerprint of context " + document.id(), e);
        }
    }

    /**
     * @return A copy of the document carrying its computed fingerprint
     */
    public static ContextDocument stamp(ContextDocument document) {
        String fingerprint = of(document);
        return new ContextDocument(document.id(), document.name(), document.version(), document.description(),
                document.status(), document.tags(), document.category(), document.owner(), document.datasets(),
                document.relationships(), document.metrics(), document.filters(), document.rules(),
                document.glossary(), document.settings(), document.body(), document.format(), fingerprint);
    }

    /**
     * Unifies line endings, strips trailing whitespace from every line and drops
     * leading and trailing blank lines.
     */
    public static String normalizeBody(String body) {
        if (body == null) {
            return "";
        }
        String unified = body.replace("\r\n", "\n").replace('\r', '\n');
        List<String> lines = new ArrayList<>();
        for (String line : unified.split("\n", -1)) {
            lines.add(line.stripTrailing());
        }
        int start = 0;
        while (start < lines.size() && lines.get(start).isEmpty()) start++;
        int end = lines.size();
        while (end > start && lines.get(end - 1).isEmpty()) end--;
        return String.join("\n", lines.subList(start, end));
    }

    public static String sha256Hex(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static Map<String, Object> canonicalize(ContextDocument d) {
        Map<String, Object> result = new TreeMap<>();
        result.put("id", d.id());
        result.put("name", d.name());
        result.put("version", d.version());
        result.put("description", d.description());
        result.put("tags", d.tags());
        result.put("category", d.category());
        result.put("owner", d.owner());
        result.put("datasets", each(d.datasets(), ContentFingerprint::dataset));
        result.put("relationships", each(d.relationships(), ContentFingerprint::relationship));
        result.put("metrics", each(d.metrics(), ContentFingerprint::metric));
        result.put("filters", each(d.filters(), ContentFingerprint::filter));
        result.put("business_rules", each(d.rules(), ContentFingerprint::rule));
        result.put("glossary", each(d.glossary(), ContentFingerprint::glossary));
        result.put("cache_ttl_seconds", d.settings().cacheTtlSeconds());
        result.put("body", normalizeBody(d.body()));
        return result;
    }

    private static <T> List<Map<String, Object>> each(List<T> items, Function<T, Map<String, Object>> fn) {
        List<Map<String, Object>> out = new ArrayList<>(items.size());
        for (T item : items) {
            out.add(fn.apply(item));
        }
        return out;
    }

    private static Map<String, Object> dataset(DatasetRef ds) {
        Map<String, Object> m = new TreeMap<>();
        m.put("id", ds.localId());
        m.put("dataset_id", ds.externalDatasetId());
        m.put("name", ds.name());
        m.put("description", ds.description());
        m.put("columns", each(ds.columns(), ContentFingerprint::column));
        return m;
    }

    private static Map<String, Object> column(ColumnDef c) {
        Map<String, Object> m = new TreeMap<>();
        m.put("name", c.name());
        m.put("business_name", c.businessName());
        m.put("data_type", c.dataType());
        m.put("nullable", c.nullable());
        m.put("description", c.description());
        return m;
    }

    private static Map<String, Object> relationship(Relationship r) {
        Map<String, Object> m = new TreeMap<>();
        m.put("id", r.id());
        m.put("from", r.from().toString());
        m.put("to", r.to().toString());
        m.put("join_type", r.joinType());
        m.put("description", r.description());
        return m;
    }

    private static Map<String, Object> metric(Metric metric) {
        Map<String, Object> m = new TreeMap<>();
        m.put("id", metric.id());
        m.put("name", metric.name());
        m.put("expression", metric.expression());
        m.put("data_type", metric.dataType());
        m.put("format", metric.format());
        m.put("datasets", metric.datasets());
        m.put("description", metric.description());
        return m;
    }

    private static Map<String, Object> filter(NamedFilter f) {
        Map<String, Object> m = new TreeMap<>();
        m.put("id", f.id());
        m.put("name", f.name());
        m.put("condition", f.condition());
        m.put("parameters", each(f.parameters(), ContentFingerprint::parameter));
        m.put("description", f.description());
        return m;
    }

    private static Map<String, Object> parameter(FilterParameter p) {
        Map<String, Object> m = new TreeMap<>();
        m.put("name", p.name());
        m.put("data_type", p.dataType());
        m.put("default", p.defaultValue());
        return m;
    }

    private static Map<String, Object> rule(BusinessRule r) {
        Map<String, Object> m = new TreeMap<>();
        m.put("id", r.id());
        m.put("name", r.name());
        m.put("severity", r.severity());
        m.put("rule_type", r.ruleType());
        m.put("condition", r.condition());
        m.put("description", r.description());
        return m;
    }

    private static Map<String, Object> glossary(GlossaryEntry g) {
        Map<String, Object> m = new TreeMap<>();
        m.put("term", g.term());
        m.put("definition", g.definition());
        m.put("synonyms", g.synonyms());
        m.put("related_columns", g.relatedColumns());
        m.put("examples", g.examples());
        return m;
    }
}
