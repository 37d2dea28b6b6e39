package org.contextql.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A parsed context document: the declarative description of one or more
 * datasets, how they relate, and the metrics, filters, rules and glossary
 * defined over them.
 *
 * Instances are immutable. Lifecycle transitions produce a new instance via
 * {@link #withStatus(ContextStatus)}; the content fingerprint covers the
 * document content and body but not its lifecycle status.
 *
 * @param id            Context identifier, stable across versions
 * @param name          Display name
 * @param version       Semantic version ({@code MAJOR.MINOR.PATCH})
 * @param description   Description
 * @param status        Lifecycle status
 * @param tags          Free-form tags
 * @param category      Optional category
 * @param owner         Optional owner
 * @param datasets      Datasets in declaration order
 * @param relationships Relationships in declaration order
 * @param metrics       Metrics in declaration order
 * @param filters       Named filters in declaration order
 * @param rules         Business rules in declaration order
 * @param glossary      Glossary entries
 * @param settings      Per-context setting overrides
 * @param body          Free-form prose following the structured block
 * @param format        The textual form the document was parsed from
 * @param fingerprint   SHA-256 content fingerprint (hex)
 */
public record ContextDocument(
        String id,
        String name,
        String version,
        String description,
        ContextStatus status,
        List<String> tags,
        String category,
        String owner,
        List<DatasetRef> datasets,
        List<Relationship> relationships,
        List<Metric> metrics,
        List<NamedFilter> filters,
        List<BusinessRule> rules,
        List<GlossaryEntry> glossary,
        ContextSettings settings,
        String body,
        SourceFormat format,
        String fingerprint) {

    public ContextDocument {
        Objects.requireNonNull(id, "Context id cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
        Objects.requireNonNull(format, "Format cannot be null");
        tags = tags == null ? List.of() : List.copyOf(tags);
        datasets = datasets == null ? List.of() : List.copyOf(datasets);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        filters = filters == null ? List.of() : List.copyOf(filters);
        rules = rules == null ? List.of() : List.copyOf(rules);
        glossary = glossary == null ? List.of() : List.copyOf(glossary);
        settings = settings == null ? ContextSettings.DEFAULTS : settings;
        body = body == null ? "" : body;
    }

    /**
     * @return multi_dataset iff more than one dataset is declared
     */
    public ContextType type() {
        return ContextType.forDatasetCount(datasets.size());
    }

    public ContextDocument withStatus(ContextStatus newStatus) {
        return new ContextDocument(id, name, version, description, newStatus, tags, category, owner,
                datasets, relationships, metrics, filters, rules, glossary, settings, body, format, fingerprint);
    }

    /**
     * All named elements, grouped by kind in declaration order.
     */
    public Stream<ContextElement> elements() {
        return Stream.of(datasets, relationships, metrics, filters, rules, glossary)
                .flatMap(List::stream);
    }

    public Optional<DatasetRef> findDataset(String localId) {
        return datasets.stream().filter(d -> d.localId().equals(localId)).findFirst();
    }

    public Optional<DatasetRef> findDatasetByExternalId(String externalDatasetId) {
        return datasets.stream().filter(d -> d.externalDatasetId().equals(externalDatasetId)).findFirst();
    }

    public Optional<Metric> findMetric(String metricId) {
        return metrics.stream().filter(m -> m.id().equals(metricId)).findFirst();
    }

    public Optional<NamedFilter> findFilter(String filterId) {
        return filters.stream().filter(f -> f.id().equals(filterId)).findFirst();
    }

    public Optional<Relationship> findRelationship(String relationshipId) {
        return relationships.stream().filter(r -> r.id().equals(relationshipId)).findFirst();
    }

    /**
     * @return The declaration index of a dataset, or -1 if it is not declared
     */
    public int datasetOrder(String localId) {
        for (int i = 0; i < datasets.size(); i++) {
            if (datasets.get(i).localId().equals(localId)) {
                return i;
            }
        }
        return -1;
    }

    public boolean isActive() {
        return status == ContextStatus.ACTIVE;
    }
}
