package com.codegen.gencore.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO representation of a kind taxonomy file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class TaxonomyDefinition {
    private String name, version;
    private List<KindDef> kinds = new ArrayList<>();
    private List<EdgeDef> edges = new ArrayList<>();

    /** Definition of a single kind. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class KindDef {
        private String name, category;
    }

    /** Definition of a transform edge; {@code transform} is optional. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class EdgeDef {
        private String from, to, relation, transform;
    }
}
