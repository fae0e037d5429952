package com.pillarpattern.core;

import com.pillarpattern.core.model.BadgeType;
import com.pillarpattern.core.model.LifeDomain;
import com.pillarpattern.core.model.NodeFilter;
import com.pillarpattern.core.model.PatternCategory;
import com.pillarpattern.core.model.PatternSpec;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Minimal hand-built specs for registry and resolver tests.
 */
public final class PatternFixtures {

    private PatternFixtures() {}

    public static PatternSpec spec(String id, PatternCategory category, int priority, String... branches) {
        return builder(id, category).priority(priority).branches(branches).build();
    }

    public static Builder builder(String id, PatternCategory category) {
        return new Builder(id, category);
    }

    public static final class Builder {
        private final String id;
        private final PatternCategory category;
        private int priority = 100;
        private List<String> branches = List.of();
        private int minNodes = 2;
        private Integer maxNodes;
        private BadgeType badgeType = BadgeType.COMBINATION;
        private Set<LifeDomain> domains = Set.of();
        private Set<String> requires = Set.of();
        private Set<String> blockedBy = Set.of();

        private Builder(String id, PatternCategory category) {
            this.id = id;
            this.category = category;
        }

        public Builder priority(int priority) { this.priority = priority; return this; }
        public Builder branches(String... branches) { this.branches = List.of(branches); return this; }
        public Builder minNodes(int minNodes) { this.minNodes = minNodes; return this; }
        public Builder maxNodes(Integer maxNodes) { this.maxNodes = maxNodes; return this; }
        public Builder badge(BadgeType badgeType) { this.badgeType = badgeType; return this; }
        public Builder domains(LifeDomain... domains) { this.domains = new LinkedHashSet<>(List.of(domains)); return this; }
        public Builder requires(String... ids) { this.requires = new LinkedHashSet<>(List.of(ids)); return this; }
        public Builder blockedBy(String... ids) { this.blockedBy = new LinkedHashSet<>(List.of(ids)); return this; }

        public PatternSpec build() {
            return new PatternSpec(id, category, priority, id, id,
                branches.isEmpty() ? List.of() : List.of(NodeFilter.ofBranches(branches.toArray(String[]::new))),
                minNodes, maxNodes, null, null, null, 10.0, null, List.of(), List.of(), badgeType,
                domains, null, null, "", "", "", requires, blockedBy);
        }
    }
}
