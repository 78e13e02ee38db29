package eu.okaeri.cellstore.document;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.Map;

/**
 * One row of the element table: a single entry of the repeating field of a document.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
public class ElementRecord {

    private final int position;
    private final String type;
    private final String role;
    private final String status;
    private final String contentExcerpt;
    private final Integer contentSizeEstimate;
    @Singular("column")
    private final Map<String, String> columns;

    /**
     * Copy with the excerpt cut to {@code length} characters and {@code ...} appended when longer.
     */
    public ElementRecord preview(int length) {
        if ((this.contentExcerpt == null) || (this.contentExcerpt.length() <= length)) {
            return this;
        }
        return this.toBuilder()
            .contentExcerpt(this.contentExcerpt.substring(0, length) + "...")
            .build();
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("position", this.position);
        node.put("type", this.type);
        node.put("role", this.role);
        node.put("status", this.status);
        node.put("content_size_estimate", this.contentSizeEstimate);
        node.put("content_excerpt", this.contentExcerpt);
        return node;
    }
}
