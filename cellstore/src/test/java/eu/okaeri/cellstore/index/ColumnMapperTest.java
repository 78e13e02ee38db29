package eu.okaeri.cellstore.index;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnMapperTest {

    private static final String LONG_PREFIX = "metadata.request.context.client.session.attributes.";

    @Test
    void mapPath_replaces_separator_runs_and_prefixes() {
        assertThat(ColumnMapper.TRUNCATING.mapPath("a.b.c")).isEqualTo("k_a_b_c");
        assertThat(ColumnMapper.TRUNCATING.mapPath("usage.total_tokens")).isEqualTo("k_usage_total_tokens");
        assertThat(ColumnMapper.TRUNCATING.mapPath("a..--b")).isEqualTo("k_a_b");
        assertThat(ColumnMapper.TRUNCATING.mapPath("status")).isEqualTo("k_status");
    }

    @Test
    void mapPath_is_deterministic() {
        String path = "output.content.0.text";
        assertThat(ColumnMapper.TRUNCATING.mapPath(path)).isEqualTo(ColumnMapper.TRUNCATING.mapPath(path));
        assertThat(ColumnMapper.COLLISION_RESISTANT.mapPath(LONG_PREFIX + "x"))
            .isEqualTo(ColumnMapper.COLLISION_RESISTANT.mapPath(LONG_PREFIX + "x"));
    }

    @Test
    void mapPath_truncates_body_to_48_characters() {
        String column = ColumnMapper.TRUNCATING.mapPath(LONG_PREFIX + "locale");
        assertThat(column).startsWith("k_metadata_request_context_client_session_");
        assertThat(column).hasSize(ColumnMapper.PREFIX.length() + ColumnMapper.MAX_BODY_LENGTH);
    }

    @Test
    void mapPath_truncating_mode_aliases_paths_sharing_first_48_characters() {
        String first = ColumnMapper.TRUNCATING.mapPath(LONG_PREFIX + "locale");
        String second = ColumnMapper.TRUNCATING.mapPath(LONG_PREFIX + "timezone");
        assertThat(first).isEqualTo(second);
    }

    @Test
    void mapPath_aliases_paths_differing_only_in_separators() {
        assertThat(ColumnMapper.TRUNCATING.mapPath("a.b")).isEqualTo(ColumnMapper.TRUNCATING.mapPath("a-b"));
    }

    @Test
    void mapPath_collision_resistant_mode_separates_long_paths() {
        String first = ColumnMapper.COLLISION_RESISTANT.mapPath(LONG_PREFIX + "locale");
        String second = ColumnMapper.COLLISION_RESISTANT.mapPath(LONG_PREFIX + "timezone");
        assertThat(first).isNotEqualTo(second);
        assertThat(first).hasSize(ColumnMapper.PREFIX.length() + ColumnMapper.MAX_BODY_LENGTH);
        assertThat(first).matches("k_[a-zA-Z0-9_]{39}_[0-9a-f]{8}");
    }

    @Test
    void mapPath_collision_resistant_mode_keeps_short_names() {
        assertThat(ColumnMapper.COLLISION_RESISTANT.mapPath("output.role")).isEqualTo("k_output_role");
        assertThat(ColumnMapper.COLLISION_RESISTANT.mapPath("a.b.c")).isEqualTo("k_a_b_c");
    }

    @Test
    void mapPath_collision_resistant_mode_separates_paths_differing_in_separators() {

        String dotted = ColumnMapper.COLLISION_RESISTANT.mapPath("a.b");
        String dashed = ColumnMapper.COLLISION_RESISTANT.mapPath("a-b");
        String underscored = ColumnMapper.COLLISION_RESISTANT.mapPath("a_b");
        String doubled = ColumnMapper.COLLISION_RESISTANT.mapPath("a..b");

        assertThat(dotted).isEqualTo("k_a_b");
        assertThat(dashed).matches("k_a_b_[0-9a-f]{8}");
        assertThat(underscored).matches("k_a_b_[0-9a-f]{8}");
        assertThat(doubled).matches("k_a_b_[0-9a-f]{8}");
        assertThat(new HashSet<>(Arrays.asList(dotted, dashed, underscored, doubled))).hasSize(4);
    }
}
