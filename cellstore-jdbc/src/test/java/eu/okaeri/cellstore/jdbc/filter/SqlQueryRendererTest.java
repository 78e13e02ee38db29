package eu.okaeri.cellstore.jdbc.filter;

import eu.okaeri.cellstore.filter.Query;
import eu.okaeri.cellstore.filter.condition.Condition;
import eu.okaeri.cellstore.filter.predicate.Predicate;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlQueryRendererTest {

    private final SqlQueryRenderer renderer = new SqlQueryRenderer("responses_documents", "responses_elements");

    @Test
    void renderList_without_conditions() {
        RenderedQuery rendered = this.renderer.renderList(new Query(Collections.emptyList(), null, 50));
        assertThat(rendered.getSql()).isEqualTo("select d.* from \"responses_documents\" d order by d.\"id\" asc limit ?");
        assertThat(rendered.getParams()).containsExactly(50);
    }

    @Test
    void renderList_document_conditions_and_cursor() {

        RenderedQuery rendered = this.renderer.renderList(new Query(Arrays.asList(
            Condition.document("status", Predicate.eq("completed")),
            Condition.document("total_tokens", Predicate.gte(new BigDecimal("10"))),
            Condition.document("total_tokens", Predicate.lte(new BigDecimal("20")))
        ), "0190a1b2", 10));

        assertThat(rendered.getSql()).isEqualTo("select d.* from \"responses_documents\" d where d.\"status\" = ?"
            + " and d.\"total_tokens\" >= ? and d.\"total_tokens\" <= ? and d.\"id\" > ? order by d.\"id\" asc limit ?");
        assertThat(rendered.getParams()).containsExactly("completed", new BigDecimal("10"), new BigDecimal("20"), "0190a1b2", 10);
    }

    @Test
    void renderList_joins_distinct_parents_for_element_conditions() {

        RenderedQuery rendered = this.renderer.renderList(new Query(Arrays.asList(
            Condition.element("role", Predicate.eq("assistant")),
            Condition.element("content_excerpt", Predicate.contains("unicorn")),
            Condition.document("model", Predicate.eq("gpt-4o"))
        ), null, 5));

        assertThat(rendered.getSql()).isEqualTo("select d.* from \"responses_documents\" d"
            + " join (select distinct e.\"parent_id\" from \"responses_elements\" e where e.\"role\" = ?"
            + " and e.\"content_excerpt\" like ? escape '|') m on m.\"parent_id\" = d.\"id\""
            + " where d.\"model\" = ? order by d.\"id\" asc limit ?");
        assertThat(rendered.getParams()).containsExactly("assistant", "%unicorn%", "gpt-4o", 5);
    }

    @Test
    void renderList_rejects_unsafe_column() {
        Query query = new Query(Collections.singletonList(Condition.document("x\" or 1=1 --", Predicate.eq("a"))), null, 5);
        assertThatThrownBy(() -> this.renderer.renderList(query)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void escapeLike_escapes_wildcards() {
        assertThat(SqlQueryRenderer.escapeLike("50%_off|now")).isEqualTo("50|%|_off||now");
        assertThat(SqlQueryRenderer.escapeLike("plain")).isEqualTo("plain");
    }
}
