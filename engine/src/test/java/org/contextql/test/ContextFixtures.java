package org.contextql.test;

/**
 * Context documents shared by the test suites.
 */
public final class ContextFixtures {

    public static final String OWNER = "alice";

    /** Orders and customers joined by customer id, with a metric, a filter and two rules. */
    public static final String SALES = """
            ---
            id: sales
            name: Sales Analysis
            version: 1.0.0
            description: Orders joined to the customers who placed them
            tags: [finance, orders]
            datasets:
              - id: o1
                dataset_id: orders
                name: Orders
                columns: [order_id, customer_id, amount, status]
              - id: c1
                dataset_id: customers
                name: Customers
                columns:
                  - name: customer_id
                    data_type: integer
                    nullable: false
                  - name: name
                    business_name: Customer name
                  - region
            relationships:
              - id: order_customer
                from_dataset: o1
                from_column: customer_id
                to_dataset: c1
                to_column: customer_id
                join_type: left
            metrics:
              - id: total_revenue
                name: Total Revenue
                expression: SUM(o1.amount)
                format: currency
              - id: order_count
                name: Order Count
                expression: COUNT(*)
                format: integer
            filters:
              - id: by_status
                name: Orders in a status
                condition: o1.status = {status}
                parameters:
                  - name: status
                    data_type: string
                    default: completed
              - id: min_amount
                name: Large orders
                condition: o1.amount >= {threshold}
                parameters:
                  - name: threshold
                    data_type: decimal
            business_rules:
              - id: positive_amount
                name: Positive amounts
                severity: error
                rule_type: validation
                condition: o1.amount > 0
              - id: region_known
                name: Region known
                severity: warning
                rule_type: quality
                condition: c1.region IS NOT NULL
            glossary:
              - term: Revenue
                definition: Money earned from orders
                synonyms: [sales, turnover]
                related_columns: [o1.amount]
            settings:
              cache_ttl_seconds: 600
            ---

            Revenue is recognised when an order is placed.
            """;

    /** Three datasets related pairwise, so one relationship closes a cycle. */
    public static final String TRIANGLE = """
            ---
            id: triangle
            name: Triangle
            version: 1.0.0
            description: Three datasets related in a ring
            datasets:
              - id: a
                dataset_id: ds_a
                name: A
              - id: b
                dataset_id: ds_b
                name: B
              - id: c
                dataset_id: ds_c
                name: C
            relationships:
              - id: a_b
                from_dataset: a
                from_column: b_id
                to_dataset: b
                to_column: id
              - id: b_c
                from_dataset: b
                from_column: c_id
                to_dataset: c
                to_column: id
              - id: c_a
                from_dataset: c
                from_column: a_id
                to_dataset: a
                to_column: id
            ---
            """;

    /** The same ring, with a metric that needs all three datasets. */
    public static final String TRIANGLE_WITH_METRIC = TRIANGLE.replaceFirst(
            "relationships:\n",
            "metrics:\n  - id: ring_total\n    expression: SUM(a.v + b.v + c.v)\nrelationships:\n");

    public static final String CONVENTION = """
            # Retail Analytics

            Sales and customer data for the retail business.

            ## Datasets
            - Orders (id: orders)
            - Customers (id: customers)

            ## Relationships
            - Orders -> Customers via customer_id
            """;

    private ContextFixtures() {
    }
}
