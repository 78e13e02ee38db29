package eu.okaeri.cellstore.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tunables of a cell, the {@code params} section of its configuration.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CellParams {

    /**
     * Element excerpts are cut to this many characters.
     */
    @JsonProperty("max_output_content_length")
    @JsonAlias("max_excerpt_length")
    private int maxExcerptLength = 1000;

    /**
     * Creates the element excerpt index. Substring filtering works either way.
     */
    @JsonProperty("enable_content_search")
    private boolean enableContentSearch = true;

    /**
     * Array field indexed per element ({@code store.v1} only, fixed for other kinds).
     */
    @JsonProperty("repeating_field")
    private String repeatingField;

    @JsonProperty("external_id_path")
    private String externalIdPath = "id";

    @JsonProperty("preview_length")
    private int previewLength = 200;

    @JsonProperty("default_limit")
    private int defaultLimit = 50;

    @JsonProperty("max_limit")
    private int maxLimit = 200;

    /**
     * Index paths that would truncate or lose separators get a digest suffix, so distinct paths get distinct columns.
     */
    @JsonProperty("collision_resistant_columns")
    private boolean collisionResistantColumns = false;
}
