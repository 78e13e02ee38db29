package eu.okaeri.cellstore.index;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.document.JsonValues;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PathExtractorTest {

    private static final JsonNode DOCUMENT = JsonValues.readTree("{" +
        "\"id\": \"r1\"," +
        "\"status\": \"completed\"," +
        "\"score\": 1.50," +
        "\"count\": 42," +
        "\"flag\": false," +
        "\"missing\": null," +
        "\"usage\": {\"total_tokens\": 120, \"details\": {\"cached\": 3}}," +
        "\"tags\": [\"a\", \"b\"]," +
        "\"output\": [" +
        "  {\"role\": \"assistant\", \"text\": \"hi\"}," +
        "  {\"text\": \"no role\"}," +
        "  {\"role\": \"tool\", \"text\": \"x\", \"role_meta\": null}" +
        "]" +
        "}");

    private final PathExtractor extractor = new PathExtractor("output");

    @Test
    void extract_returns_scalar_value() {
        assertThat(this.extractor.extract(DOCUMENT, "status")).containsExactly("completed");
        assertThat(this.extractor.extract(DOCUMENT, "usage.total_tokens")).containsExactly("120");
    }

    @Test
    void extract_returns_nothing_for_absent_or_null() {
        assertThat(this.extractor.extract(DOCUMENT, "nope")).isEmpty();
        assertThat(this.extractor.extract(DOCUMENT, "missing")).isEmpty();
        assertThat(this.extractor.extract(DOCUMENT, "usage.nope.deeper")).isEmpty();
        assertThat(this.extractor.extract(DOCUMENT, "status.length")).isEmpty();
    }

    @Test
    void extract_returns_one_value_per_element_for_repeating_field() {
        assertThat(this.extractor.extract(DOCUMENT, "output.role")).containsExactly("assistant", "tool");
        assertThat(this.extractor.extract(DOCUMENT, "output.text")).containsExactly("hi", "no role", "x");
    }

    @Test
    void extract_repeating_field_absent_or_not_array() {
        JsonNode document = JsonValues.readTree("{\"output\": \"text\"}");
        assertThat(this.extractor.extract(document, "output.role")).isEmpty();
        assertThat(this.extractor.extract(JsonValues.readTree("{}"), "output.role")).isEmpty();
    }

    @Test
    void extract_stringifies_values() {
        assertThat(this.extractor.extract(DOCUMENT, "score")).containsExactly("1.5");
        assertThat(this.extractor.extract(DOCUMENT, "count")).containsExactly("42");
        assertThat(this.extractor.extract(DOCUMENT, "flag")).containsExactly("false");
        assertThat(this.extractor.extract(DOCUMENT, "usage.details")).containsExactly("{\"cached\":3}");
    }

    @Test
    void extract_walks_arrays_by_index_and_fans_out_otherwise() {
        assertThat(this.extractor.extract(DOCUMENT, "tags.1")).containsExactly("b");
        PathExtractor plain = new PathExtractor(null);
        assertThat(plain.extract(DOCUMENT, "output.role")).containsExactly("assistant", "tool");
        assertThat(plain.extractColumnValue(DOCUMENT, IndexPath.of("output.role"))).isEqualTo("assistant|tool");
    }

    @Test
    void extractColumnValue_returns_null_when_nothing_found() {
        assertThat(this.extractor.extractColumnValue(DOCUMENT, IndexPath.of("nope"))).isNull();
        assertThat(this.extractor.extractColumnValue(DOCUMENT, IndexPath.of("status"))).isEqualTo("completed");
    }
}
