package eu.okaeri.cellstore.filter;

import eu.okaeri.cellstore.filter.condition.Condition;
import eu.okaeri.cellstore.filter.predicate.Predicate;
import eu.okaeri.cellstore.index.ElementTag;
import eu.okaeri.cellstore.index.IndexColumn;
import eu.okaeri.cellstore.index.IndexScope;
import eu.okaeri.cellstore.index.TableShape;
import eu.okaeri.cellstore.variant.PromotedField;
import eu.okaeri.cellstore.variant.PromotedType;
import lombok.Getter;
import lombok.NonNull;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Translates listing filters into a {@link Query}.
 * <p>
 * Keys are resolved in order: {@code limit} and {@code after}, promoted fields and their
 * range bounds, element tags ({@code <field>_type}, {@code <field>_role}, {@code <field>_status},
 * {@code <field>_content}), then mapped column names and raw paths of configured indexes.
 * Unknown keys and blank values are ignored.
 */
@Getter
public class QueryTranslator {

    private static final Logger LOGGER = Logger.getLogger(QueryTranslator.class.getSimpleName());

    public static final String LIMIT_KEY = "limit";
    public static final String AFTER_KEY = "after";
    public static final String CONTENT_SUFFIX = "_content";
    public static final String CONTENT_COLUMN = "content_excerpt";

    private final TableShape shape;
    private final Pager pager;
    private final Map<String, PromotedField> promotedByName = new LinkedHashMap<>();
    private final Map<String, PromotedField> promotedByMin = new LinkedHashMap<>();
    private final Map<String, PromotedField> promotedByMax = new LinkedHashMap<>();

    public QueryTranslator(@NonNull TableShape shape, @NonNull List<PromotedField> promotedFields, @NonNull Pager pager) {
        this.shape = shape;
        this.pager = pager;
        for (PromotedField field : promotedFields) {
            this.promotedByName.put(field.getName(), field);
            if (field.getMinKey() != null) this.promotedByMin.put(field.getMinKey(), field);
            if (field.getMaxKey() != null) this.promotedByMax.put(field.getMaxKey(), field);
        }
    }

    public Query translate(Map<String, String> filters) {

        Map<String, String> sorted = new TreeMap<>();
        if (filters != null) {
            filters.forEach((key, value) -> {
                if (key != null) {
                    sorted.put(key, value);
                }
            });
        }
        List<Condition> conditions = new ArrayList<>();
        int limit = this.pager.resolveLimit(sorted.get(LIMIT_KEY));
        String after = null;

        for (Map.Entry<String, String> entry : sorted.entrySet()) {

            String key = entry.getKey();
            String value = entry.getValue();
            if ((value == null) || value.isEmpty() || LIMIT_KEY.equals(key)) {
                continue;
            }

            if (AFTER_KEY.equals(key)) {
                after = value;
                continue;
            }

            Optional<Condition> condition = this.resolvePromoted(key, value);
            if (!condition.isPresent()) {
                condition = this.resolveElementTag(key, value);
            }
            if (!condition.isPresent()) {
                condition = this.shape.resolve(key).map(column -> toCondition(column, value));
            }

            condition.ifPresent(conditions::add);
        }

        return new Query(conditions, after, limit);
    }

    private Optional<Condition> resolvePromoted(String key, String value) {

        PromotedField field = this.promotedByName.get(key);
        if (field != null) {
            if (field.getType() == PromotedType.TEXT) {
                return Optional.of(Condition.document(field.getName(), Predicate.eq(value)));
            }
            return parseNumber(key, value).map(number -> Condition.document(field.getName(), Predicate.eq(number)));
        }

        PromotedField lower = this.promotedByMin.get(key);
        if (lower != null) {
            return parseNumber(key, value).map(number -> Condition.document(lower.getName(), Predicate.gte(number)));
        }

        PromotedField upper = this.promotedByMax.get(key);
        if (upper != null) {
            return parseNumber(key, value).map(number -> Condition.document(upper.getName(), Predicate.lte(number)));
        }

        return Optional.empty();
    }

    private Optional<Condition> resolveElementTag(String key, String value) {

        String field = this.shape.getRepeatingField();
        if ((field == null) || !key.startsWith(field + "_")) {
            return Optional.empty();
        }

        String suffix = key.substring(field.length());
        if (CONTENT_SUFFIX.equals(suffix)) {
            return Optional.of(Condition.element(CONTENT_COLUMN, Predicate.contains(value)));
        }

        return ElementTag.byField(suffix.substring(1))
            .map(tag -> Condition.element(tag.getColumn(), Predicate.eq(value)));
    }

    private static Condition toCondition(IndexColumn column, String value) {
        if (column.getScope() == IndexScope.ELEMENT) {
            return Condition.element(column.getName(), Predicate.eq(value));
        }
        return Condition.document(column.getName(), Predicate.eq(value));
    }

    private static Optional<BigDecimal> parseNumber(String key, String value) {
        try {
            return Optional.of(new BigDecimal(value.trim()));
        } catch (NumberFormatException exception) {
            LOGGER.warning("Ignoring filter " + key + ": '" + value + "' is not a number");
            return Optional.empty();
        }
    }
}
