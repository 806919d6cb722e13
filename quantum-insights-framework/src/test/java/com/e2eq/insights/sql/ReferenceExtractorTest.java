package com.e2eq.insights.sql;

import com.e2eq.insights.model.security.TableReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReferenceExtractor unit tests")
class ReferenceExtractorTest {

    private ReferenceExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ReferenceExtractor();
        extractor.defaultProject = Optional.of("default-proj");
    }

    private static TableReference ref(String project, String dataset, String table) {
        return TableReference.of(project, dataset, table);
    }

    @Test
    @DisplayName("FROM and JOIN references with aliases, in order of appearance")
    void fromAndJoin() {
        List<TableReference> refs = extractor.extract(
            "SELECT * FROM proj.ds.tbl a JOIN ds2.tbl2 b ON a.id = b.id");

        assertEquals(List.of(ref("proj", "ds", "tbl"), ref("default-proj", "ds2", "tbl2")), refs);
    }

    @Test
    @DisplayName("backtick-quoted fully qualified name with a hyphenated project")
    void quotedQualifiedName() {
        assertEquals(List.of(ref("my-project", "sales", "orders")),
            extractor.extract("SELECT id FROM `my-project.sales.orders` WHERE id > 3"));
    }

    @Test
    @DisplayName("unquoted hyphenated project stays one identifier")
    void hyphenatedProject() {
        assertEquals(List.of(ref("my-project", "sales", "orders")),
            extractor.extract("SELECT id FROM my-project.sales.orders"));
    }

    @Test
    @DisplayName("separately quoted parts are normalized to lower case")
    void quotedParts_normalized() {
        assertEquals(List.of(ref("default-proj", "sales", "orders")),
            extractor.extract("SELECT * FROM `Sales`.`Orders`"));
    }

    @Test
    @DisplayName("CTE names are not table references but their bodies are scanned")
    void cteNames_skipped() {
        List<TableReference> refs = extractor.extract(
            "WITH recent AS (SELECT * FROM sales.orders WHERE created_at > '2024-01-01') "
                + "SELECT * FROM recent JOIN sales.customers c USING (customer_id)");

        assertEquals(List.of(ref("default-proj", "sales", "orders"), ref("default-proj", "sales", "customers")), refs);
    }

    @Test
    @DisplayName("tables inside subqueries are found")
    void subquery() {
        assertEquals(List.of(ref("default-proj", "hr", "salaries")),
            extractor.extract("SELECT s.total FROM (SELECT SUM(amount) AS total FROM hr.salaries) s"));
    }

    @Test
    @DisplayName("comma-separated FROM list yields every table")
    void commaList() {
        assertEquals(List.of(ref("default-proj", "sales", "orders"), ref("default-proj", "sales", "customers")),
            extractor.extract("SELECT * FROM sales.orders o, sales.customers c WHERE o.cid = c.id"));
    }

    @Test
    @DisplayName("comma items after a join condition are still tables")
    void commaAfterJoin() {
        assertEquals(List.of(ref("default-proj", "sales", "orders"), ref("default-proj", "hr", "salaries")),
            extractor.extract("SELECT * FROM sales.orders a JOIN sales.orders b ON a.id = b.id, hr.salaries s"));
        assertEquals(List.of(ref("default-proj", "sales", "orders"), ref("default-proj", "sales", "customers"),
                ref("default-proj", "hr", "salaries")),
            extractor.extract("SELECT * FROM sales.orders CROSS JOIN sales.customers, hr.salaries"));
    }

    @Test
    @DisplayName("USING and LEFT OUTER joins continue the FROM clause")
    void mixedJoins() {
        assertEquals(List.of(ref("default-proj", "sales", "orders"), ref("default-proj", "sales", "customers"),
                ref("default-proj", "hr", "salaries")),
            extractor.extract("SELECT LEFT(c.name, 3) FROM sales.orders o JOIN sales.customers c USING (cid) "
                + "LEFT OUTER JOIN hr.salaries s ON LEFT(s.code, 2) = c.code WHERE o.id > 1"));
    }

    @Test
    @DisplayName("every table of a parenthesized join is found")
    void parenthesizedJoin() {
        assertEquals(List.of(ref("default-proj", "hr", "salaries"), ref("default-proj", "sales", "orders")),
            extractor.extract("SELECT * FROM (hr.salaries s JOIN sales.orders o ON s.id = o.id)"));
        assertEquals(List.of(ref("default-proj", "hr", "salaries"), ref("default-proj", "sales", "orders"),
                ref("default-proj", "sales", "customers")),
            extractor.extract("SELECT * FROM ((hr.salaries s JOIN sales.orders o ON s.id = o.id), sales.customers c)"));
    }

    @Test
    @DisplayName("subqueries inside join conditions are scanned")
    void subqueryInJoinCondition() {
        assertEquals(List.of(ref("default-proj", "sales", "orders"), ref("default-proj", "sales", "customers"),
                ref("default-proj", "hr", "salaries")),
            extractor.extract("SELECT * FROM sales.orders o JOIN sales.customers c "
                + "ON c.id = o.cid AND c.id IN (SELECT employee_id FROM hr.salaries)"));
    }

    @Test
    @DisplayName("a carriage return ends a line comment")
    void carriageReturn_endsLineComment() {
        assertEquals(List.of(ref("default-proj", "hr", "salaries")),
            extractor.extract("SELECT 1 --\rFROM hr.salaries"));
        assertEquals(List.of(ref("default-proj", "hr", "salaries")),
            extractor.extract("SELECT 1 # note\rFROM hr.salaries"));
    }

    @Test
    @DisplayName("FROM inside EXTRACT and IS DISTINCT FROM is not a table clause")
    void functionFrom_ignored() {
        assertEquals(List.of(ref("default-proj", "sales", "orders")), extractor.extract(
            "SELECT EXTRACT(YEAR FROM created_at) AS y FROM sales.orders WHERE a IS DISTINCT FROM b"));
    }

    @Test
    @DisplayName("string literals and comments are not scanned")
    void literalsAndComments_ignored() {
        assertEquals(List.of(ref("default-proj", "sales", "orders")), extractor.extract(
            "SELECT 'FROM hr.salaries' AS s FROM sales.orders -- JOIN hr.salaries\n /* FROM hr.bonus */"));
    }

    @Test
    @DisplayName("table functions contribute no reference")
    void tableFunction_skipped() {
        assertEquals(List.of(ref("default-proj", "sales", "orders")),
            extractor.extract("SELECT item FROM sales.orders, UNNEST(items) AS item"));
    }

    @Test
    @DisplayName("repeated tables are reported once")
    void duplicates_removed() {
        assertEquals(1, extractor.extract(
            "SELECT * FROM sales.orders a JOIN sales.orders b ON a.parent = b.id").size());
    }

    @Test
    @DisplayName("wildcard tables keep their suffix")
    void wildcardTable() {
        assertEquals(List.of(ref("default-proj", "analytics", "events_*")),
            extractor.extract("SELECT COUNT(*) FROM analytics.events_* WHERE _table_suffix > '2024'"));
    }

    @Test
    @DisplayName("bare table name has no dataset under the reject policy")
    void unqualified_rejectPolicy() {
        List<TableReference> refs = extractor.extract("SELECT * FROM orders");

        assertEquals(1, refs.size());
        assertFalse(refs.get(0).hasDataset());
        assertEquals("orders", refs.get(0).getTable());
    }

    @Test
    @DisplayName("bare table name is placed in the default dataset when configured")
    void unqualified_defaultDatasetPolicy() {
        extractor.unqualifiedTablePolicy = UnqualifiedTablePolicy.DEFAULT_DATASET;
        extractor.defaultDataset = Optional.of("analytics");

        assertEquals(List.of(ref("default-proj", "analytics", "orders")), extractor.extract("SELECT * FROM orders"));
    }

    @Test
    @DisplayName("blank input yields no references")
    void blank_empty() {
        assertTrue(extractor.extract(null).isEmpty());
        assertTrue(extractor.extract("  ").isEmpty());
        assertTrue(extractor.extract("SELECT 1").isEmpty());
    }
}
