package org.contextql.engine.validation;

import org.contextql.dsl.expr.Expression;
import org.contextql.dsl.expr.ExpressionParseException;
import org.contextql.dsl.expr.ExpressionParser;
import org.contextql.engine.execution.DatasetSchema;
import org.contextql.engine.execution.DatasetStore;
import org.contextql.engine.graph.Cycle;
import org.contextql.engine.graph.RelationshipGraph;
import org.contextql.model.BusinessRule;
import org.contextql.model.ColumnDef;
import org.contextql.model.ColumnRef;
import org.contextql.model.ContextDocument;
import org.contextql.model.ContextElement;
import org.contextql.model.DatasetRef;
import org.contextql.model.GlossaryEntry;
import org.contextql.model.JoinType;
import org.contextql.model.Metric;
import org.contextql.model.NamedFilter;
import org.contextql.model.Relationship;
import org.contextql.model.RuleType;
import org.contextql.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates a context document in four ordered passes:
 * <ol>
 *   <li>{@link ValidationPass#SCHEMA}: field presence, lengths, enums, version format;</li>
 *   <li>{@link ValidationPass#SEMANTIC}: datasets resolve in the store for the calling
 *       user, and every referenced column exists;</li>
 *   <li>{@link ValidationPass#RELATIONSHIP_GRAPH}: cycles, self and duplicate
 *       relationships, disconnected datasets;</li>
 *   <li>{@link ValidationPass#BUSINESS_RULES}: severities, rule types and conditions.</li>
 * </ol>
 * Passes never short-circuit; all issues are accumulated. A dataset that failed
 * to resolve in pass 2 is not checked again by later passes, so one defect is
 * reported once.
 *
 * The validator holds no state between calls and is safe to share.
 */
public final class ContextValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContextValidator.class);

    public static final int MIN_NAME_LENGTH = 3;
    public static final int MAX_NAME_LENGTH = 100;
    public static final int MIN_DESCRIPTION_LENGTH = 10;

    private static final Pattern VERSION = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");
    private static final Pattern LOCAL_ID = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    /** Bare identifiers that are SQL values rather than column references. */
    private static final Set<String> NILADIC_FUNCTIONS = Set.of("CURRENT_DATE", "CURRENT_TIME", "CURRENT_TIMESTAMP");

    private final DatasetStore store;

    public ContextValidator(DatasetStore store) {
        this.store = store;
    }

    /**
     * Validates a document on behalf of a user; datasets must be owned by that user.
     *
     * @throws org.contextql.engine.execution.DatasetStoreException if the store cannot be reached
     */
    public ValidatedContext validate(ContextDocument document, String userId) {
        Run run = new Run(document, userId);
        run.schemaPass();
        run.semanticPass();
        run.graphPass();
        run.rulePass();

        ValidationResult result = ValidationResult.of(run.issues);
        LOGGER.debug("Validated context '{}' v{} for user {}: {} ({} error(s), {} warning(s))",
                document.id(), document.version(), userId, result.status(),
                result.errors().size(), result.warnings().size());
        return new ValidatedContext(document, result, run.schemas);
    }

    /**
     * State of a single validation.
     */
    private final class Run {

        private final ContextDocument document;
        private final String userId;
        private final List<ValidationIssue> issues = new ArrayList<>();
        private final Map<String, DatasetSchema> schemas = new LinkedHashMap<>();
        private final Set<String> declared = new LinkedHashSet<>();
        private final Set<String> unresolved = new HashSet<>();
        /** Datasets each metric and filter references, used to classify cycles. */
        private final Map<String, Set<String>> requirements = new LinkedHashMap<>();

        Run(ContextDocument document, String userId) {
            this.document = document;
            this.userId = userId;
            for (DatasetRef ds : document.datasets()) {
                declared.add(ds.localId());
            }
        }

        // ==================== Pass 1: Schema ====================

        void schemaPass() {
            ValidationPass pass = ValidationPass.SCHEMA;
            String name = document.name();
            if (name == null || name.strip().length() < MIN_NAME_LENGTH || name.strip().length() > MAX_NAME_LENGTH) {
                error(IssueCode.INVALID_NAME, pass, "name",
                        "Name must be between " + MIN_NAME_LENGTH + " and " + MAX_NAME_LENGTH + " characters");
            }
            String description = document.description();
            if (description == null || description.strip().length() < MIN_DESCRIPTION_LENGTH) {
                error(IssueCode.INVALID_DESCRIPTION, pass, "description",
                        "Description must be at least " + MIN_DESCRIPTION_LENGTH + " characters");
            }
            if (document.version() == null || !VERSION.matcher(document.version()).matches()) {
                error(IssueCode.INVALID_VERSION, pass, "version",
                        "Version '" + document.version() + "' is not a semantic version (MAJOR.MINOR.PATCH)");
            }
            if (document.datasets().isEmpty()) {
                error(IssueCode.NO_DATASETS, pass, "datasets", "At least one dataset is required");
            }

            Map<ContextElement.Kind, Integer> positions = new EnumMap<>(ContextElement.Kind.class);
            Map<ContextElement.Kind, Set<String>> ids = new EnumMap<>(ContextElement.Kind.class);
            document.elements().forEach(element -> {
                ContextElement.Kind kind = element.kind();
                String path = kind.section() + "[" + (positions.merge(kind, 1, Integer::sum) - 1) + "]";
                boolean firstId = ids.computeIfAbsent(kind, k -> new HashSet<>()).add(element.elementId());
                switch (kind) {
                    case DATASET -> {
                        DatasetRef ds = (DatasetRef) element;
                        if (!LOCAL_ID.matcher(ds.localId()).matches()) {
                            error(IssueCode.INVALID_LOCAL_ID, pass, path + ".id",
                                    "Dataset id '" + ds.localId() + "' must be a SQL identifier ([A-Za-z_][A-Za-z0-9_]*)");
                        }
                        if (!firstId) {
                            error(IssueCode.DUPLICATE_DATASET_ID, pass, path + ".id",
                                    "Dataset id '" + ds.localId() + "' is declared more than once");
                        }
                        if (ds.externalDatasetId().isBlank()) {
                            error(IssueCode.MISSING_DATASET_ID, pass, path + ".dataset_id",
                                    "Dataset '" + ds.localId() + "' has no dataset_id");
                        }
                    }
                    case RELATIONSHIP -> {
                        Relationship r = (Relationship) element;
                        duplicateId(firstId, "Relationship", r.id(), path);
                        if (r.joinType() != null && JoinType.fromDeclared(r.joinType()).isEmpty()) {
                            error(IssueCode.INVALID_JOIN_TYPE, pass, path + ".join_type",
                                    "Join type '" + r.joinType() + "' must be one of inner, left, right, outer");
                        }
                    }
                    case METRIC -> {
                        Metric m = (Metric) element;
                        duplicateId(firstId, "Metric", m.id(), path);
                        // metric ids become column aliases
                        if (!LOCAL_ID.matcher(m.id()).matches()) {
                            error(IssueCode.INVALID_METRIC_ID, pass, path + ".id",
                                    "Metric id '" + m.id() + "' must be a SQL identifier ([A-Za-z_][A-Za-z0-9_]*)");
                        }
                        if (m.expression().isBlank()) {
                            error(IssueCode.EMPTY_EXPRESSION, pass, path + ".expression",
                                    "Metric '" + m.id() + "' has no expression");
                        }
                    }
                    case FILTER -> {
                        NamedFilter f = (NamedFilter) element;
                        duplicateId(firstId, "Filter", f.id(), path);
                        if (f.condition().isBlank()) {
                            error(IssueCode.EMPTY_EXPRESSION, pass, path + ".condition",
                                    "Filter '" + f.id() + "' has no condition");
                        }
                    }
                    case RULE -> duplicateId(firstId, "Business rule", element.elementId(), path);
                    case GLOSSARY -> {
                        // terms may repeat
                    }
                }
            });
        }

        private void duplicateId(boolean firstId, String what, String id, String path) {
            if (!firstId) {
                error(IssueCode.DUPLICATE_ID, ValidationPass.SCHEMA, path + ".id",
                        what + " id '" + id + "' is declared more than once");
            }
        }

        // ==================== Pass 2: Semantic ====================

        void semanticPass() {
            ValidationPass pass = ValidationPass.SEMANTIC;
            Map<ContextElement.Kind, Integer> positions = new EnumMap<>(ContextElement.Kind.class);
            Set<String> resolvedOnce = new HashSet<>();
            document.elements().forEach(element -> {
                ContextElement.Kind kind = element.kind();
                String path = kind.section() + "[" + (positions.merge(kind, 1, Integer::sum) - 1) + "]";
                switch (kind) {
                    case DATASET -> {
                        DatasetRef ds = (DatasetRef) element;
                        if (resolvedOnce.add(ds.localId())) {
                            resolveDataset(ds, path);
                        }
                    }
                    case RELATIONSHIP -> {
                        Relationship r = (Relationship) element;
                        checkColumn(r.from(), pass, path + ".from");
                        checkColumn(r.to(), pass, path + ".to");
                    }
                    case METRIC -> checkMetric((Metric) element, path);
                    case FILTER -> checkFilter((NamedFilter) element, path);
                    case RULE -> {
                        // checked in the business rule pass
                    }
                    case GLOSSARY -> checkGlossary((GlossaryEntry) element, path);
                }
            });
        }

        private void resolveDataset(DatasetRef ds, String path) {
            if (ds.externalDatasetId().isBlank()) {
                unresolved.add(ds.localId());
                return;
            }
            DatasetSchema schema = store.lookup(ds.externalDatasetId(), userId).orElse(null);
            if (schema == null) {
                unresolved.add(ds.localId());
                error(IssueCode.MISSING_DATASET, ValidationPass.SEMANTIC, path + ".dataset_id",
                        "Dataset '" + ds.externalDatasetId() + "' does not exist or is not accessible",
                        Map.of("dataset", ds.localId(), "dataset_id", ds.externalDatasetId()));
                return;
            }
            schemas.put(ds.localId(), schema);
            for (int i = 0; i < ds.columns().size(); i++) {
                ColumnDef column = ds.columns().get(i);
                if (!schema.hasColumn(column.name())) {
                    error(IssueCode.MISSING_COLUMN, ValidationPass.SEMANTIC, path + ".columns[" + i + "]",
                            "Column '" + column.name() + "' does not exist in dataset '" + ds.externalDatasetId() + "'",
                            Map.of("dataset", ds.localId(), "column", column.name()));
                }
            }
        }

        private void checkMetric(Metric metric, String path) {
            List<String> scope = new ArrayList<>();
            for (int i = 0; i < metric.datasets().size(); i++) {
                String ds = metric.datasets().get(i);
                if (!declared.contains(ds)) {
                    error(IssueCode.MISSING_DATASET, ValidationPass.SEMANTIC, path + ".datasets[" + i + "]",
                            "Metric '" + metric.id() + "' applies to undeclared dataset '" + ds + "'",
                            Map.of("dataset", ds));
                } else {
                    scope.add(ds);
                }
            }
            if (metric.expression().isBlank()) {
                return;
            }
            Expression expression = parse(metric.expression(), ValidationPass.SEMANTIC,
                    IssueCode.INVALID_EXPRESSION, path + ".expression", "Metric '" + metric.id() + "'");
            if (expression == null) {
                return;
            }
            Set<String> used = checkReferences(expression, scope.isEmpty() ? List.copyOf(declared) : scope,
                    ValidationPass.SEMANTIC, path + ".expression");
            used.addAll(scope);
            requirements.put("metric " + metric.id(), used);
        }

        private void checkFilter(NamedFilter filter, String path) {
            if (filter.condition().isBlank()) {
                return;
            }
            Expression expression = parse(filter.condition(), ValidationPass.SEMANTIC,
                    IssueCode.INVALID_EXPRESSION, path + ".condition", "Filter '" + filter.id() + "'");
            if (expression == null) {
                return;
            }
            Set<String> used = checkReferences(expression, List.copyOf(declared),
                    ValidationPass.SEMANTIC, path + ".condition");
            requirements.put("filter " + filter.id(), used);
            for (String parameter : expression.parameterNames()) {
                if (filter.findParameter(parameter).isEmpty()) {
                    error(IssueCode.UNDECLARED_PARAMETER, ValidationPass.SEMANTIC, path + ".condition",
                            "Filter '" + filter.id() + "' uses parameter {" + parameter + "} which is not declared",
                            Map.of("parameter", parameter));
                }
            }
        }

        private void checkGlossary(GlossaryEntry entry, String path) {
            for (int i = 0; i < entry.relatedColumns().size(); i++) {
                String qualified = entry.relatedColumns().get(i);
                String field = path + ".related_columns[" + i + "]";
                ColumnRef ref;
                try {
                    ref = ColumnRef.parse(qualified);
                } catch (IllegalArgumentException e) {
                    warning(IssueCode.UNKNOWN_GLOSSARY_COLUMN, ValidationPass.SEMANTIC, field,
                            "Glossary term '" + entry.term() + "' refers to '" + qualified
                                    + "', expected dataset.column", Map.of("column", qualified));
                    continue;
                }
                if (unresolved.contains(ref.datasetId())) {
                    continue;
                }
                DatasetSchema schema = schemas.get(ref.datasetId());
                if (!declared.contains(ref.datasetId()) || schema == null || !schema.hasColumn(ref.column())) {
                    warning(IssueCode.UNKNOWN_GLOSSARY_COLUMN, ValidationPass.SEMANTIC, field,
                            "Glossary term '" + entry.term() + "' refers to unknown column '" + qualified + "'",
                            Map.of("column", qualified));
                }
            }
        }

        // ==================== Pass 3: Relationship graph ====================

        void graphPass() {
            ValidationPass pass = ValidationPass.RELATIONSHIP_GRAPH;
            RelationshipGraph graph = RelationshipGraph.build(document);

            for (Cycle cycle : graph.cycles()) {
                Set<String> members = cycle.datasetSet();
                String requiredBy = null;
                for (Map.Entry<String, Set<String>> requirement : requirements.entrySet()) {
                    if (requirement.getValue().containsAll(members)) {
                        requiredBy = requirement.getKey();
                        break;
                    }
                }
                Map<String, Object> details = new HashMap<>();
                details.put("cycle", List.copyOf(cycle.datasets()));
                details.put("relationships", cycle.relationships().stream().map(Relationship::id).toList());
                if (requiredBy != null) {
                    details.put("required_by", requiredBy);
                    error(IssueCode.CIRCULAR_DEPENDENCY, pass, "relationships",
                            "Circular dependency " + cycle.describe() + " is required by " + requiredBy, details);
                } else {
                    warning(IssueCode.CIRCULAR_RELATIONSHIP, pass, "relationships",
                            "Circular relationship " + cycle.describe() + "; relationship '"
                                    + cycle.closing().id() + "' will not be used for joins", details);
                }
            }

            Map<String, Integer> seenPairs = new HashMap<>();
            List<Relationship> relationships = document.relationships();
            for (int i = 0; i < relationships.size(); i++) {
                Relationship r = relationships.get(i);
                String path = "relationships[" + i + "]";
                if (!declared.contains(r.from().datasetId()) || !declared.contains(r.to().datasetId())) {
                    continue;
                }
                if (r.isSelfReferencing()) {
                    warning(IssueCode.SELF_REFERENCING_RELATIONSHIP, pass, path,
                            "Relationship '" + r.id() + "' joins dataset '" + r.from().datasetId() + "' to itself",
                            Map.of("relationship", r.id()));
                }
                Integer first = seenPairs.putIfAbsent(r.from() + "->" + r.to(), i);
                if (first != null) {
                    warning(IssueCode.DUPLICATE_RELATIONSHIP, pass, path,
                            "Relationship '" + r.id() + "' duplicates '" + relationships.get(first).id() + "'",
                            Map.of("relationship", r.id(), "duplicates", relationships.get(first).id()));
                }
            }

            if (graph.datasets().size() > 1) {
                if (graph.relationships().isEmpty()) {
                    warning(IssueCode.NO_RELATIONSHIPS, pass, "relationships",
                            "Context declares " + graph.datasets().size() + " datasets but no relationships",
                            Map.of());
                } else {
                    for (String ds : graph.datasets()) {
                        if (graph.degree(ds) == 0) {
                            warning(IssueCode.DISCONNECTED_DATASET, pass, "datasets",
                                    "Dataset '" + ds + "' takes part in no relationship", Map.of("dataset", ds));
                        }
                    }
                }
            }
        }

        // ==================== Pass 4: Business rules ====================

        void rulePass() {
            ValidationPass pass = ValidationPass.BUSINESS_RULES;
            List<BusinessRule> rules = document.rules();
            for (int i = 0; i < rules.size(); i++) {
                BusinessRule rule = rules.get(i);
                String path = "business_rules[" + i + "]";
                if (rule.severity() == null) {
                    error(IssueCode.INVALID_SEVERITY, pass, path + ".severity",
                            "Rule '" + rule.id() + "' has no severity");
                } else if (Severity.fromDeclared(rule.severity()).isEmpty()) {
                    error(IssueCode.INVALID_SEVERITY, pass, path + ".severity",
                            "Severity '" + rule.severity() + "' must be one of error, warning, info");
                }
                if (rule.ruleType() != null && RuleType.fromDeclared(rule.ruleType()).isEmpty()) {
                    error(IssueCode.INVALID_RULE_TYPE, pass, path + ".rule_type",
                            "Rule type '" + rule.ruleType() + "' must be one of validation, quality, constraint");
                }
                if (rule.condition().isBlank()) {
                    error(IssueCode.EMPTY_RULE_CONDITION, pass, path + ".condition",
                            "Rule '" + rule.id() + "' has no condition");
                    continue;
                }
                Expression condition = parse(rule.condition(), pass, IssueCode.UNPARSABLE_RULE_CONDITION,
                        path + ".condition", "Rule '" + rule.id() + "'");
                if (condition == null) {
                    continue;
                }
                if (!condition.parameterNames().isEmpty()) {
                    error(IssueCode.UNPARSABLE_RULE_CONDITION, pass, path + ".condition",
                            "Rule '" + rule.id() + "' cannot use parameters " + condition.parameterNames());
                    continue;
                }
                // mandatory rules are injected into every query and must resolve in any join
                boolean mandatory = rule.severityLevel().filter(s -> s == Severity.ERROR).isPresent();
                checkReferences(condition, List.copyOf(declared), pass, path + ".condition", mandatory);
            }
        }

        // ==================== Shared checks ====================

        private Expression parse(String text, ValidationPass pass, IssueCode code, String field, String owner) {
            try {
                return ExpressionParser.parse(text);
            } catch (ExpressionParseException e) {
                error(code, pass, field, owner + " cannot be parsed: " + e.getMessage(),
                        Map.of("position", e.getPosition()));
                return null;
            }
        }

        /**
         * Checks every column an expression references and returns the datasets
         * it touches. Unqualified columns are looked up in {@code scope}.
         */
        private Set<String> checkReferences(Expression expression, List<String> scope, ValidationPass pass,
                                            String field) {
            return checkReferences(expression, scope, pass, field, false);
        }

        /**
         * @param ambiguityIsError Report a column found in several datasets as an error
         */
        private Set<String> checkReferences(Expression expression, List<String> scope, ValidationPass pass,
                                            String field, boolean ambiguityIsError) {
            Set<String> used = new LinkedHashSet<>();
            for (Expression.ColumnRef ref : expression.columnReferences()) {
                if (ref.isStar()) {
                    continue;
                }
                if (ref.isQualified()) {
                    used.add(ref.qualifier());
                    checkColumn(new ColumnRef(ref.qualifier(), ref.columnName()), pass, field);
                    continue;
                }
                if (NILADIC_FUNCTIONS.contains(ref.columnName().toUpperCase(Locale.ROOT))) {
                    continue;
                }
                List<String> candidates = new ArrayList<>();
                boolean incomplete = false;
                for (String ds : scope) {
                    DatasetSchema schema = schemas.get(ds);
                    if (schema == null) {
                        incomplete = true;
                    } else if (schema.hasColumn(ref.columnName())) {
                        candidates.add(ds);
                    }
                }
                used.addAll(candidates);
                if (candidates.isEmpty() && !incomplete) {
                    error(IssueCode.MISSING_COLUMN, pass, field,
                            "Column '" + ref.columnName() + "' does not exist in any of " + scope,
                            Map.of("column", ref.columnName()));
                } else if (candidates.size() > 1) {
                    String message = "Column '" + ref.columnName() + "' exists in " + candidates
                            + "; qualify it with a dataset id";
                    Map<String, Object> details = Map.of("column", ref.columnName(), "datasets",
                            List.copyOf(candidates));
                    if (ambiguityIsError) {
                        error(IssueCode.AMBIGUOUS_COLUMN, pass, field, message, details);
                    } else {
                        warning(IssueCode.AMBIGUOUS_COLUMN, pass, field, message, details);
                    }
                }
            }
            return used;
        }

        private void checkColumn(ColumnRef ref, ValidationPass pass, String field) {
            if (!declared.contains(ref.datasetId())) {
                error(IssueCode.MISSING_DATASET, pass, field,
                        "'" + ref + "' refers to undeclared dataset '" + ref.datasetId() + "'",
                        Map.of("dataset", ref.datasetId()));
                return;
            }
            if (unresolved.contains(ref.datasetId())) {
                return;
            }
            DatasetSchema schema = schemas.get(ref.datasetId());
            if (schema != null && !schema.hasColumn(ref.column())) {
                error(IssueCode.MISSING_COLUMN, pass, field,
                        "Column '" + ref.column() + "' does not exist in dataset '" + ref.datasetId() + "'",
                        Map.of("dataset", ref.datasetId(), "column", ref.column()));
            }
        }

        // ==================== Issue helpers ====================

        private void error(IssueCode code, ValidationPass pass, String field, String message) {
            error(code, pass, field, message, Map.of());
        }

        private void error(IssueCode code, ValidationPass pass, String field, String message,
                           Map<String, Object> details) {
            issues.add(new ValidationIssue(code, IssueSeverity.ERROR, pass, field, message, details));
        }

        private void warning(IssueCode code, ValidationPass pass, String field, String message,
                             Map<String, Object> details) {
            issues.add(new ValidationIssue(code, IssueSeverity.WARNING, pass, field, message, details));
        }
    }
}
