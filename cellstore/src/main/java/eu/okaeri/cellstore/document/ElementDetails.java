package eu.okaeri.cellstore.document;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Data;
import lombok.NonNull;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Element rows of the most recent document with a given external id, excerpts shortened to previews.
 */
@Data
public class ElementDetails {

    private final String externalId;
    private final List<ElementRecord> elements;

    public static ElementDetails of(@NonNull String externalId, @NonNull List<ElementRecord> elements, int previewLength) {
        return new ElementDetails(externalId, elements.stream()
            .map(element -> element.preview(previewLength))
            .collect(Collectors.toList()));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("external_id", this.externalId);
        ArrayNode array = node.putArray("elements");
        this.elements.forEach(element -> array.add(element.toJson()));
        return node;
    }
}
