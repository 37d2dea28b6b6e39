package org.contextql.engine.plan;

import org.contextql.dsl.ContentFingerprint;
import org.contextql.dsl.expr.Expression;
import org.contextql.dsl.expr.ExpressionParseException;
import org.contextql.dsl.expr.ExpressionParser;
import org.contextql.dsl.expr.ParameterBinder;
import org.contextql.engine.execution.DatasetSchema;
import org.contextql.engine.graph.JoinPath;
import org.contextql.engine.graph.JoinStep;
import org.contextql.engine.transpiler.DuckDBDialect;
import org.contextql.engine.transpiler.SQLDialect;
import org.contextql.engine.validation.ValidatedContext;
import org.contextql.model.BusinessRule;
import org.contextql.model.ColumnRef;
import org.contextql.model.ContextDocument;
import org.contextql.model.DatasetRef;
import org.contextql.model.FilterParameter;
import org.contextql.model.Metric;
import org.contextql.model.NamedFilter;
import org.contextql.model.Relationship;
import org.contextql.model.Severity;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Compiles a {@link QueryRequest} against a validated context and a resolved
 * join path into a {@link CompiledPlan}.
 *
 * Compilation is a pure function of its inputs: no I/O, no clock, no
 * randomness. The produced query has the shape
 * <pre>
 * SELECT &lt;group-by fields&gt;, &lt;fields&gt;, &lt;metric expression&gt; AS &lt;metric id&gt;
 * FROM "&lt;external id&gt;" AS &lt;root&gt;
 * LEFT JOIN "&lt;external id&gt;" AS &lt;local id&gt; ON a.col = b.col
 * WHERE (&lt;user filters&gt;) AND (&lt;named filters&gt;) AND (&lt;error rules&gt;)
 * GROUP BY ... ORDER BY ... LIMIT n
 * </pre>
 * Metric expressions and conditions are inlined as written; dataset local ids
 * double as table aliases so their column references resolve unchanged.
 */
public final class QueryCompiler {

    private final SQLDialect dialect;

    public QueryCompiler() {
        this(DuckDBDialect.INSTANCE);
    }

    public QueryCompiler(SQLDialect dialect) {
        this.dialect = dialect;
    }

    /**
     * Collects the datasets a request touches: the ones it lists explicitly, the
     * qualifiers of its fields, the datasets referenced by the metrics and named
     * filters it asks for, and the datasets of every {@code error} rule, which
     * applies to all queries. Undeclared qualifiers are left out so that
     * {@link #compile} can report them.
     */
    public static Set<String> requiredDatasets(QueryRequest request, ValidatedContext context) {
        ContextDocument document = context.document();
        Set<String> required = new LinkedHashSet<>(request.datasets());
        List<String> fieldRefs = new ArrayList<>(request.groupBy());
        fieldRefs.addAll(request.fields());
        request.filters().forEach(f -> fieldRefs.add(f.field()));
        request.sort().forEach(s -> fieldRefs.add(s.key()));
        for (String field : fieldRefs) {
            int dot = field.indexOf('.');
            if (dot > 0) {
                String ds = field.substring(0, dot);
                if (document.findDataset(ds).isPresent()) {
                    required.add(ds);
                }
            }
        }
        for (String metricId : request.metrics()) {
            document.findMetric(metricId).ifPresent(m -> required.addAll(qualifiers(m.expression(), document)));
        }
        for (String filterId : request.namedFilters()) {
            document.findFilter(filterId).ifPresent(f -> required.addAll(qualifiers(f.condition(), document)));
        }
        for (BusinessRule rule : document.rules()) {
            if (isMandatory(rule)) {
                required.addAll(ruleDatasets(rule, context));
            }
        }
        return required;
    }

    private static boolean isMandatory(BusinessRule rule) {
        return rule.severityLevel().filter(s -> s == Severity.ERROR).isPresent();
    }

    /**
     * Datasets a rule condition reads. An unqualified column belongs to the one
     * dataset whose store schema (or, failing that, declared columns) has it;
     * columns found in several datasets are rejected by validation.
     */
    private static Set<String> ruleDatasets(BusinessRule rule, ValidatedContext context) {
        ContextDocument document = context.document();
        Set<String> datasets = new LinkedHashSet<>();
        Expression condition;
        try {
            condition = ExpressionParser.parse(rule.condition());
        } catch (ExpressionParseException e) {
            return datasets;
        }
        for (Expression.ColumnRef ref : condition.columnReferences()) {
            if (ref.isStar()) {
                continue;
            }
            if (ref.isQualified()) {
                if (document.findDataset(ref.qualifier()).isPresent()) {
                    datasets.add(ref.qualifier());
                }
                continue;
            }
            List<String> owners = new ArrayList<>();
            for (DatasetRef ds : document.datasets()) {
                boolean hasColumn = context.schema(ds.localId())
                        .map(schema -> schema.hasColumn(ref.columnName()))
                        .orElseGet(() -> ds.findColumn(ref.columnName()).isPresent());
                if (hasColumn) {
                    owners.add(ds.localId());
                }
            }
            if (owners.size() == 1) {
                datasets.add(owners.get(0));
            }
        }
        return datasets;
    }

    private static Set<String> qualifiers(String expression, ContextDocument document) {
        Set<String> datasets = new LinkedHashSet<>();
        try {
            for (Expression.ColumnRef ref : ExpressionParser.parse(expression).columnReferences()) {
                if (ref.isQualified() && document.findDataset(ref.qualifier()).isPresent()) {
                    datasets.add(ref.qualifier());
                }
            }
        } catch (ExpressionParseException e) {
            // unparsable expressions are rejected by validation; nothing to add
            return datasets;
        }
        return datasets;
    }

    /**
     * @throws UndefinedMetricException   if a requested metric is not defined
     * @throws UndefinedFilterException   if a requested named filter is not defined
     * @throws UndefinedColumnException   if a field names an unjoined dataset or unknown column
     * @throws MissingParameterException  if a named filter parameter has no value
     * @throws InvalidQueryException      if the request is otherwise malformed, or the join path
     *                                    misses a dataset an error rule reads
     */
    public CompiledPlan compile(QueryRequest request, ValidatedContext context, JoinPath joinPath) {
        ContextDocument document = context.document();
        Set<String> joined = new LinkedHashSet<>(joinPath.datasets());

        List<Metric> metrics = new ArrayList<>();
        for (String metricId : request.metrics()) {
            metrics.add(document.findMetric(metricId).orElseThrow(() -> new UndefinedMetricException(metricId)));
        }
        List<NamedFilter> namedFilters = new ArrayList<>();
        for (String filterId : request.namedFilters()) {
            namedFilters.add(document.findFilter(filterId).orElseThrow(() -> new UndefinedFilterException(filterId)));
        }
        if (request.limit() != null && request.limit() <= 0) {
            throw new InvalidQueryException("Limit must be positive, got " + request.limit());
        }

        List<Object> parameters = new ArrayList<>();
        List<OutputColumn> outputs = new ArrayList<>();
        List<String> lines = new ArrayList<>();

        // SELECT
        Set<String> projected = new LinkedHashSet<>();
        StringJoiner select = new StringJoiner(", ");
        List<String> projectedFields = new ArrayList<>(request.groupBy());
        projectedFields.addAll(request.fields());
        for (String field : projectedFields) {
            ColumnRef ref = resolveField(field, context, joined);
            if (projected.add(ref.toString())) {
                select.add(ref.toString());
                outputs.add(OutputColumn.field(ref.toString(), ref.column()));
            }
        }
        for (Metric metric : metrics) {
            select.add(metric.expression().strip() + " AS " + metric.id());
            outputs.add(OutputColumn.metric(metric.id(), metric.format()));
        }
        lines.add("SELECT " + (outputs.isEmpty() ? "*" : select.toString()));

        // FROM / JOIN
        lines.add("FROM " + table(document, joinPath.root()));
        for (JoinStep step : joinPath.steps()) {
            Relationship r = step.relationship();
            lines.add(dialect.joinKeyword(step.joinType()) + " " + table(document, step.target())
                    + " ON " + r.from() + " = " + r.to());
        }

        // WHERE
        List<String> predicates = new ArrayList<>();
        for (FilterCondition filter : request.filters()) {
            predicates.add(userFilter(filter, context, joined, parameters));
        }
        for (NamedFilter filter : namedFilters) {
            predicates.add("(" + bindNamedFilter(filter, request, parameters) + ")");
        }
        List<String> appliedRules = new ArrayList<>();
        List<Advisory> advisories = new ArrayList<>();
        for (BusinessRule rule : document.rules()) {
            Optional<Severity> severity = rule.severityLevel();
            if (severity.isEmpty()) {
                continue;
            }
            if (severity.get() == Severity.ERROR) {
                Set<String> missing = new LinkedHashSet<>(ruleDatasets(rule, context));
                missing.removeAll(joined);
                if (!missing.isEmpty()) {
                    throw new InvalidQueryException("Mandatory rule '" + rule.id() + "' reads dataset(s) "
                            + missing + " which the join path does not include");
                }
                predicates.add("(" + rule.condition().strip() + ")");
                appliedRules.add(rule.id());
            } else if (appliesTo(rule, context, joined)) {
                advisories.add(new Advisory(rule.id(), severity.get(), rule.name(), rule.condition(),
                        rule.description()));
            }
        }
        if (!predicates.isEmpty()) {
            lines.add("WHERE " + String.join(" AND ", predicates));
        }

        // GROUP BY
        if (!request.groupBy().isEmpty()) {
            StringJoiner groupBy = new StringJoiner(", ");
            for (String field : request.groupBy()) {
                groupBy.add(resolveField(field, context, joined).toString());
            }
            lines.add("GROUP BY " + groupBy);
        }

        // ORDER BY
        if (!request.sort().isEmpty()) {
            StringJoiner orderBy = new StringJoiner(", ");
            for (SortSpec spec : request.sort()) {
                orderBy.add(sortKey(spec, request, context, joined) + " " + spec.direction().name());
            }
            lines.add("ORDER BY " + orderBy);
        }

        if (request.limit() != null) {
            lines.add(dialect.limitClause(request.limit()));
        }

        String sql = String.join("\n", lines);
        return new CompiledPlan(
                document.id(),
                document.version(),
                document.fingerprint(),
                joinPath.root(),
                joinPath.steps(),
                sql,
                parameters,
                request.metrics(),
                request.namedFilters(),
                appliedRules,
                advisories,
                outputs,
                cacheKey(document.fingerprint(), sql, parameters));
    }

    /**
     * SHA-256 over the context fingerprint, the query text and every bound value
     * with its type, so that {@code 1} and {@code '1'} never share an entry.
     */
    static String cacheKey(String fingerprint, String sql, List<Object> parameters) {
        StringBuilder sb = new StringBuilder();
        sb.append(fingerprint).append('\n').append(sql);
        for (Object value : parameters) {
            sb.append('\n');
            if (value == null) {
                sb.append("null");
            } else {
                sb.append(value.getClass().getSimpleName()).append(':').append(value);
            }
        }
        return ContentFingerprint.sha256Hex(sb.toString());
    }

    // ==================== Clauses ====================

    private String table(ContextDocument document, String localId) {
        DatasetRef ds = document.findDataset(localId)
                .orElseThrow(() -> new InvalidQueryException("Join path names unknown dataset '" + localId + "'"));
        return dialect.quoteIdentifier(ds.externalDatasetId()) + " AS " + ds.localId();
    }

    private String userFilter(FilterCondition filter, ValidatedContext context, Set<String> joined,
                              List<Object> parameters) {
        String field = resolveField(filter.field(), context, joined).toString();
        String marker = dialect.parameterMarker();
        FilterOperator op = filter.operator();
        switch (op) {
            case IS_NULL, IS_NOT_NULL -> {
                return field + " " + op.symbol();
            }
            case IN, NOT_IN -> {
                if (!(filter.value() instanceof Collection<?> values) || values.isEmpty()) {
                    throw new InvalidQueryException(op.symbol() + " filter on '" + filter.field()
                            + "' needs a non-empty list of values");
                }
                StringJoiner markers = new StringJoiner(", ", "(", ")");
                for (Object value : values) {
                    markers.add(marker);
                    parameters.add(value);
                }
                return field + " " + op.symbol() + " " + markers;
            }
            case BETWEEN -> {
                if (!(filter.value() instanceof List<?> bounds) || bounds.size() != 2) {
                    throw new InvalidQueryException("BETWEEN filter on '" + filter.field()
                            + "' needs exactly two values");
                }
                parameters.add(bounds.get(0));
                parameters.add(bounds.get(1));
                return field + " BETWEEN " + marker + " AND " + marker;
            }
            case ILIKE -> {
                parameters.add(filter.value());
                return field + " " + dialect.caseInsensitiveLike() + " " + marker;
            }
            default -> {
                if (filter.value() == null) {
                    throw new InvalidQueryException("Filter on '" + filter.field() + "' has no value; use "
                            + FilterOperator.IS_NULL.symbol() + " to match nulls");
                }
                parameters.add(filter.value());
                return field + " " + op.symbol() + " " + marker;
            }
        }
    }

    private String bindNamedFilter(NamedFilter filter, QueryRequest request, List<Object> parameters) {
        ParameterBinder.BoundCondition bound = ParameterBinder.bind(filter.condition().strip());
        for (String name : bound.parameters()) {
            parameters.add(parameterValue(filter, name, request));
        }
        return bound.text();
    }

    private static Object parameterValue(NamedFilter filter, String name, QueryRequest request) {
        String qualified = filter.id() + "." + name;
        if (request.parameters().containsKey(qualified)) {
            return request.parameters().get(qualified);
        }
        if (request.parameters().containsKey(name)) {
            return request.parameters().get(name);
        }
        Optional<FilterParameter> declared = filter.findParameter(name);
        if (declared.isPresent() && declared.get().defaultValue() != null) {
            return coerce(declared.get(), declared.get().defaultValue(), filter);
        }
        throw new MissingParameterException(filter.id(), name);
    }

    /**
     * Converts a textual default to the parameter's declared type.
     */
    private static Object coerce(FilterParameter parameter, String text, NamedFilter filter) {
        String type = parameter.dataType() == null ? "string" : parameter.dataType().toLowerCase(Locale.ROOT);
        try {
            return switch (type) {
                case "integer", "int", "bigint" -> Long.parseLong(text.strip());
                case "decimal", "number", "double", "float" -> new BigDecimal(text.strip());
                case "boolean", "bool" -> Boolean.parseBoolean(text.strip());
                case "date" -> LocalDate.parse(text.strip());
                default -> text;
            };
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new InvalidQueryException("Default '" + text + "' of parameter '" + parameter.name()
                    + "' in filter '" + filter.id() + "' is not a valid " + type);
        }
    }

    private String sortKey(SortSpec spec, QueryRequest request, ValidatedContext context, Set<String> joined) {
        if (spec.key().indexOf('.') < 0) {
            if (request.metrics().contains(spec.key())) {
                return spec.key();
            }
            throw new InvalidQueryException("Sort key '" + spec.key()
                    + "' must be a dataset.column field or a requested metric");
        }
        return resolveField(spec.key(), context, joined).toString();
    }

    /**
     * Checks that a {@code dataset.column} field names a joined dataset and a
     * column the store (or, failing that, the document) knows.
     */
    private static ColumnRef resolveField(String field, ValidatedContext context, Set<String> joined) {
        ColumnRef ref;
        try {
            ref = ColumnRef.parse(field);
        } catch (IllegalArgumentException e) {
            throw new UndefinedColumnException(field, "must be of the form dataset.column");
        }
        if (!joined.contains(ref.datasetId())) {
            throw new UndefinedColumnException(field, "refers to dataset '" + ref.datasetId()
                    + "' which is not part of the join");
        }
        Optional<DatasetSchema> schema = context.schema(ref.datasetId());
        if (schema.isPresent()) {
            if (!schema.get().hasColumn(ref.column())) {
                throw new UndefinedColumnException(field, "refers to unknown column '" + ref.column() + "'");
            }
            return ref;
        }
        DatasetRef ds = context.document().findDataset(ref.datasetId()).orElseThrow();
        if (!ds.columns().isEmpty() && ds.findColumn(ref.column()).isEmpty()) {
            throw new UndefinedColumnException(field, "refers to unknown column '" + ref.column() + "'");
        }
        return ref;
    }

    /**
     * An advisory rule applies when every dataset its condition references is joined.
     * Unqualified columns count as satisfied when some joined dataset has them.
     */
    private static boolean appliesTo(BusinessRule rule, ValidatedContext context, Set<String> joined) {
        Expression condition;
        try {
            condition = ExpressionParser.parse(rule.condition());
        } catch (ExpressionParseException e) {
            return false;
        }
        for (Expression.ColumnRef ref : condition.columnReferences()) {
            if (ref.isStar()) {
                continue;
            }
            if (ref.isQualified()) {
                if (!joined.contains(ref.qualifier())) {
                    return false;
                }
            } else if (!context.schemas().isEmpty() && joined.stream()
                    .map(context::schema)
                    .noneMatch(s -> s.map(schema -> schema.hasColumn(ref.columnName())).orElse(true))) {
                return false;
            }
        }
        return true;
    }
}
