package org.carball.dbbench.parser;

import org.carball.dbbench.parser.SqlInspector.RelationHint;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class SqlInspectorTest {

    @Test
    void shouldInferRelationFromForeignKeyLookup() {
        // When
        Optional<RelationHint> hint = SqlInspector.inferRelation("SELECT * FROM `user_profiles` WHERE `user_id` = ?");

        // Then
        assertThat(hint).isPresent();
        assertThat(hint.get().table()).isEqualTo("user_profiles");
        assertThat(hint.get().column()).isEqualTo("user_id");
        assertThat(hint.get().relation()).isEqualTo("userProfile");
    }

    @Test
    void shouldInferRelationFromPrimaryKeyLookup() {
        // When
        Optional<RelationHint> hint = SqlInspector.inferRelation("select name from categories where id = 12");

        // Then
        assertThat(hint).isPresent();
        assertThat(hint.get().relation()).isEqualTo("category");
    }

    @Test
    void shouldReturnEmptyWhenNoKeyLookup() {
        // Then
        assertThat(SqlInspector.inferRelation("UPDATE orders SET status = ? WHERE id = ?")).isEmpty();
        assertThat(SqlInspector.inferRelation("SELECT COUNT(*) FROM orders")).isEmpty();
        assertThat(SqlInspector.inferRelation(null)).isEmpty();
    }

    @Test
    void shouldSingularizeCommonPlurals() {
        // Then
        assertThat(Inflector.singular("users")).isEqualTo("user");
        assertThat(Inflector.singular("categories")).isEqualTo("category");
        assertThat(Inflector.singular("boxes")).isEqualTo("box");
        assertThat(Inflector.singular("people")).isEqualTo("person");
        assertThat(Inflector.singular("order_items")).isEqualTo("order_item");
        assertThat(Inflector.singular("status")).isEqualTo("status");
    }

    @Test
    void shouldCamelCaseSnakeCase() {
        // Then
        assertThat(Inflector.camel("order_item")).isEqualTo("orderItem");
        assertThat(Inflector.camel("user")).isEqualTo("user");
    }

    @Test
    void shouldFindEqualityFilterColumn() {
        // Then
        assertThat(SqlInspector.equalityFilterColumn("SELECT * FROM orders o WHERE o.customer_id = :customer"))
                .contains("customer_id");
        assertThat(SqlInspector.equalityFilterColumn("SELECT * FROM orders WHERE total > 10")).isEmpty();
    }

    @Test
    void shouldDetectClauses() {
        // Given
        String sql = "select * from orders where status = ? order by created_at limit 10";

        // Then
        assertThat(SqlInspector.isSelect(sql)).isTrue();
        assertThat(SqlInspector.hasWhere(sql)).isTrue();
        assertThat(SqlInspector.hasOrderBy(sql)).isTrue();
        assertThat(SqlInspector.hasLimit(sql)).isTrue();
        assertThat(SqlInspector.selectsAllColumns(sql)).isTrue();
        assertThat(SqlInspector.selectsAllColumns("SELECT id, name FROM orders")).isFalse();
    }

    @Test
    void shouldDetectLeadingWildcardInlineAndBound() {
        // Then
        assertThat(SqlInspector.hasLeadingWildcard("SELECT * FROM products WHERE name LIKE '%phone'", List.of()))
                .isTrue();
        assertThat(SqlInspector.hasLeadingWildcard("SELECT * FROM products WHERE name LIKE ?", List.of("%phone")))
                .isTrue();
        assertThat(SqlInspector.hasLeadingWildcard("SELECT * FROM products WHERE name LIKE ?", List.of("phone%")))
                .isFalse();
    }
}
