package org.contextql.engine.plan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a caller wants to know, expressed against a context.
 *
 * @param datasets     Local ids of datasets to include even if nothing else references them
 * @param metrics      Ids of metrics to compute
 * @param fields       {@code dataset.column} fields to project
 * @param filters      User filters
 * @param namedFilters Ids of named filters to apply
 * @param parameters   Values for named filter parameters, keyed by {@code name} or
 *                     {@code filterId.name}
 * @param groupBy      {@code dataset.column} grouping fields
 * @param sort         Ordering
 * @param limit        Maximum number of rows, or null
 * @param joinVia      Ids of relationships the join must use
 */
public record QueryRequest(
        List<String> datasets,
        List<String> metrics,
        List<String> fields,
        List<FilterCondition> filters,
        List<String> namedFilters,
        Map<String, Object> parameters,
        List<String> groupBy,
        List<SortSpec> sort,
        Integer limit,
        List<String> joinVia) {

    public QueryRequest {
        datasets = datasets == null ? List.of() : List.copyOf(datasets);
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        fields = fields == null ? List.of() : List.copyOf(fields);
        filters = filters == null ? List.of() : List.copyOf(filters);
        namedFilters = namedFilters == null ? List.of() : List.copyOf(namedFilters);
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        sort = sort == null ? List.of() : List.copyOf(sort);
        joinVia = joinVia == null ? List.of() : List.copyOf(joinVia);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> datasets = new ArrayList<>();
        private final List<String> metrics = new ArrayList<>();
        private final List<String> fields = new ArrayList<>();
        private final List<FilterCondition> filters = new ArrayList<>();
        private final List<String> namedFilters = new ArrayList<>();
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final List<String> groupBy = new ArrayList<>();
        private final List<SortSpec> sort = new ArrayList<>();
        private final List<String> joinVia = new ArrayList<>();
        private Integer limit;

        private Builder() {
        }

        public Builder datasets(String... localIds) {
            datasets.addAll(Arrays.asList(localIds));
            return this;
        }

        public Builder metrics(String... metricIds) {
            metrics.addAll(Arrays.asList(metricIds));
            return this;
        }

        public Builder fields(String... qualifiedFields) {
            fields.addAll(Arrays.asList(qualifiedFields));
            return this;
        }

        public Builder filter(String field, String operator, Object value) {
            filters.add(FilterCondition.of(field, operator, value));
            return this;
        }

        public Builder filter(FilterCondition condition) {
            filters.add(condition);
            return this;
        }

        public Builder namedFilters(String... filterIds) {
            namedFilters.addAll(Arrays.asList(filterIds));
            return this;
        }

        public Builder parameter(String name, Object value) {
            parameters.put(name, value);
            return this;
        }

        public Builder groupBy(String... qualifiedFields) {
            groupBy.addAll(Arrays.asList(qualifiedFields));
            return this;
        }

        public Builder orderBy(SortSpec spec) {
            sort.add(spec);
            return this;
        }

        public Builder limit(int rows) {
            this.limit = rows;
            return this;
        }

        public Builder joinVia(String... relationshipIds) {
            joinVia.addAll(Arrays.asList(relationshipIds));
            return this;
        }

        public QueryRequest build() {
            return new QueryRequest(datasets, metrics, fields, filters, namedFilters, parameters, groupBy, sort,
                    limit, joinVia);
        }
    }
}
