package eu.okaeri.cellstore.jdbc.filter;

import eu.okaeri.cellstore.filter.Query;
import eu.okaeri.cellstore.filter.condition.Condition;
import eu.okaeri.cellstore.filter.predicate.Predicate;
import eu.okaeri.cellstore.filter.predicate.equality.EqPredicate;
import eu.okaeri.cellstore.filter.predicate.numeric.GtPredicate;
import eu.okaeri.cellstore.filter.predicate.numeric.GtePredicate;
import eu.okaeri.cellstore.filter.predicate.numeric.LtePredicate;
import eu.okaeri.cellstore.filter.predicate.string.ContainsPredicate;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

import static eu.okaeri.cellstore.jdbc.commons.JdbcHelper.quote;

/**
 * Renders a {@link Query} into a single select over the document table. The element table
 * is joined through a distinct set of parent ids, and only when element conditions exist,
 * so a document never appears twice in a page.
 */
@Getter
public class SqlQueryRenderer {

    public static final char LIKE_ESCAPE = '|';

    private static final String DOCUMENT_ALIAS = "d";
    private static final String ELEMENT_ALIAS = "e";

    private final String documentTable;
    private final String elementTable;

    public SqlQueryRenderer(@NonNull String documentTable, @NonNull String elementTable) {
        this.documentTable = documentTable;
        this.elementTable = elementTable;
    }

    public RenderedQuery renderList(@NonNull Query query) {

        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("select d.* from ").append(quote(this.documentTable)).append(' ').append(DOCUMENT_ALIAS);

        if (query.hasElementConditions()) {
            sql.append(" join (select distinct e.\"parent_id\" from ").append(quote(this.elementTable)).append(' ').append(ELEMENT_ALIAS)
                .append(" where ").append(this.renderConditions(ELEMENT_ALIAS, query.getElementConditions(), params))
                .append(") m on m.\"parent_id\" = d.\"id\"");
        }

        List<Condition> documentConditions = new ArrayList<>(query.getDocumentConditions());
        if (query.getAfter() != null) {
            documentConditions.add(Condition.document("id", Predicate.gt(query.getAfter())));
        }
        if (!documentConditions.isEmpty()) {
            sql.append(" where ").append(this.renderConditions(DOCUMENT_ALIAS, documentConditions, params));
        }

        sql.append(" order by d.\"id\" asc limit ?");
        params.add(query.getLimit());

        return new RenderedQuery(sql.toString(), params);
    }

    private String renderConditions(String alias, List<Condition> conditions, List<Object> params) {
        List<String> rendered = new ArrayList<>();
        for (Condition condition : conditions) {
            rendered.add(this.renderPredicate(alias + "." + quote(condition.getColumn()), condition.getPredicate(), params));
        }
        return String.join(" and ", rendered);
    }

    private String renderPredicate(String column, Predicate predicate, List<Object> params) {

        if (predicate instanceof ContainsPredicate) {
            params.add("%" + escapeLike(((ContainsPredicate) predicate).getSubstring()) + "%");
            return column + " like ? escape '" + LIKE_ESCAPE + "'";
        }

        params.add(predicate.getRightOperand());
        if (predicate instanceof EqPredicate) {
            return column + " = ?";
        }
        if (predicate instanceof GtPredicate) {
            return column + " > ?";
        }
        if (predicate instanceof GtePredicate) {
            return column + " >= ?";
        }
        if (predicate instanceof LtePredicate) {
            return column + " <= ?";
        }

        throw new IllegalArgumentException("cannot render predicate " + predicate.getClass().getSimpleName());
    }

    public static String escapeLike(@NonNull String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if ((c == LIKE_ESCAPE) || (c == '%') || (c == '_')) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
