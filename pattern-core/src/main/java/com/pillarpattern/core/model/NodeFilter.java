package com.pillarpattern.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * Selects chart nodes by branch, stem or element value, restricted to the given node kinds.
 * Empty value lists mean "no constraint on that axis".
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record NodeFilter(
    @JsonProperty("branches") List<String> branches,
    @JsonProperty("stems") List<String> stems,
    @JsonProperty("elements") List<String> elements,
    @JsonProperty("node_types") Set<NodeType> nodeTypes
) {
    public NodeFilter {
        branches  = branches  == null ? List.of() : List.copyOf(branches);
        stems     = stems     == null ? List.of() : List.copyOf(stems);
        elements  = elements  == null ? List.of() : List.copyOf(elements);
        nodeTypes = nodeTypes == null ? Set.of() : Set.copyOf(nodeTypes);
    }

    public static NodeFilter ofBranches(String... branches) {
        return new NodeFilter(List.of(branches), null, null, Set.of(NodeType.EARTHLY_BRANCH));
    }

    public static NodeFilter ofStems(String... stems) {
        return new NodeFilter(null, List.of(stems), null, Set.of(NodeType.HEAVENLY_STEM));
    }
}
