package eu.okaeri.cellstore.document;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.index.ElementTag;
import eu.okaeri.cellstore.index.IndexColumn;
import eu.okaeri.cellstore.index.PathExtractor;
import eu.okaeri.cellstore.index.TableShape;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Derives element table rows from the repeating field of a document.
 * <p>
 * Tags come from the element's own {@code type}, {@code role} and {@code status}. The excerpt is
 * taken from {@code content} (a string verbatim, or the {@code text} of its {@code text} and
 * {@code output_text} parts joined by a space), otherwise from {@code text}. The size estimate
 * ({@code ceil(length / 4)}) is computed before the excerpt is cut to the configured length.
 */
@Getter
public class ElementIndexer {

    private static final String PART_SEPARATOR = " ";

    private final TableShape shape;
    private final PathExtractor extractor;
    private final int maxExcerptLength;

    public ElementIndexer(@NonNull TableShape shape, int maxExcerptLength) {
        if (maxExcerptLength < 1) {
            throw new IllegalArgumentException("maxExcerptLength must be positive, got " + maxExcerptLength);
        }
        this.shape = shape;
        this.extractor = new PathExtractor(shape.getRepeatingField());
        this.maxExcerptLength = maxExcerptLength;
    }

    public List<ElementRecord> index(@NonNull JsonNode document) {

        if (!this.shape.hasRepeatingField()) {
            return Collections.emptyList();
        }

        JsonNode elements = document.get(this.shape.getRepeatingField());
        if ((elements == null) || !elements.isArray()) {
            return Collections.emptyList();
        }

        List<ElementRecord> records = new ArrayList<>(elements.size());
        for (int position = 0; position < elements.size(); position++) {
            records.add(this.indexElement(position, elements.get(position)));
        }
        return records;
    }

    private ElementRecord indexElement(int position, JsonNode element) {

        String excerpt = excerpt(element);
        Integer estimate = null;
        if (excerpt != null) {
            estimate = (excerpt.length() + 3) / 4;
            excerpt = truncate(excerpt, this.maxExcerptLength);
        }

        ElementRecord.ElementRecordBuilder builder = ElementRecord.builder()
            .position(position)
            .type(tag(element, ElementTag.TYPE))
            .role(tag(element, ElementTag.ROLE))
            .status(tag(element, ElementTag.STATUS))
            .contentExcerpt(excerpt)
            .contentSizeEstimate(estimate);

        for (IndexColumn column : this.shape.getElementColumns()) {
            builder.column(column.getName(), this.extractor.extractElementValue(element, column.getSubPath()));
        }

        return builder.build();
    }

    private static String tag(JsonNode element, ElementTag tag) {
        JsonNode value = element.get(tag.getField());
        return JsonValues.isTruthy(value) ? JsonValues.stringify(value) : null;
    }

    static String excerpt(JsonNode element) {

        JsonNode content = element.get("content");
        String excerpt = null;

        if (JsonValues.isTruthy(content)) {
            if (content.isTextual()) {
                excerpt = content.textValue();
            } else if (content.isArray()) {
                excerpt = StreamSupport.stream(content.spliterator(), false)
                    .filter(part -> isTextPart(part.get("type")))
                    .map(part -> part.get("text"))
                    .filter(JsonValues::isTruthy)
                    .map(JsonValues::stringify)
                    .collect(Collectors.joining(PART_SEPARATOR));
            }
        } else {
            JsonNode text = element.get("text");
            if (JsonValues.isTruthy(text)) {
                excerpt = JsonValues.stringify(text);
            }
        }

        return ((excerpt == null) || excerpt.isEmpty()) ? null : excerpt;
    }

    private static boolean isTextPart(JsonNode type) {
        return (type != null) && type.isTextual()
            && ("text".equals(type.textValue()) || "output_text".equals(type.textValue()));
    }

    private static String truncate(String value, int length) {
        if (value.length() <= length) {
            return value;
        }
        int end = length;
        if (Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }
}
