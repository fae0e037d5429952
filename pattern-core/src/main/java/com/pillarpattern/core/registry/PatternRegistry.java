package com.pillarpattern.core.registry;

import com.pillarpattern.core.exception.CircularDependencyException;
import com.pillarpattern.core.exception.ContradictionException;
import com.pillarpattern.core.exception.InvalidPatternException;
import com.pillarpattern.core.exception.MissingDependencyException;
import com.pillarpattern.core.model.BadgeType;
import com.pillarpattern.core.model.LifeDomain;
import com.pillarpattern.core.model.PatternCategory;
import com.pillarpattern.core.model.PatternSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Indexed store of {@link PatternSpec}s.
 *
 * <p>Indexes: identifier (unique, registration order), category, life domain, badge type,
 * participant value and canonical {@link PatternKey}. Registering an identifier that is
 * already present is a no-op, so loading the same catalog twice is harmless.
 *
 * <p>Registration is not synchronized. Build the registry completely, then share it;
 * reads never mutate and are safe from any number of threads once registration is over.
 */
public class PatternRegistry {

    private static final Logger log = LoggerFactory.getLogger(PatternRegistry.class);

    private final Map<String, PatternSpec> byId = new LinkedHashMap<>();
    private final Map<PatternKey, PatternSpec> byKey = new HashMap<>();
    private final Map<PatternCategory, List<PatternSpec>> byCategory = new EnumMap<>(PatternCategory.class);
    private final Map<LifeDomain, List<PatternSpec>> byDomain = new EnumMap<>(LifeDomain.class);
    private final Map<BadgeType, List<PatternSpec>> byBadgeType = new EnumMap<>(BadgeType.class);
    private final Map<String, List<PatternSpec>> byParticipant = new HashMap<>();

    public static PatternRegistry of(Collection<PatternSpec> patterns) {
        PatternRegistry registry = new PatternRegistry();
        registry.registerAll(patterns, true);
        return registry;
    }

    // ── registration ─────────────────────────────────────────────────────────

    /**
     * Registers with validation.
     *
     * @return false when the identifier was already registered (nothing changes)
     */
    public boolean register(PatternSpec pattern) {
        return register(pattern, true);
    }

    /**
     * @param validate run structural and dependency checks before inserting
     * @return false when the identifier was already registered (nothing changes)
     * @throws InvalidPatternException when {@code validate} is set and the pattern is malformed
     */
    public boolean register(PatternSpec pattern, boolean validate) {
        if (byId.containsKey(pattern.id())) {
            log.debug("Pattern {} already registered, skipping", pattern.id());
            return false;
        }
        if (validate) {
            validate(pattern);
        }

        byId.put(pattern.id(), pattern);
        PatternKey key = PatternKey.forSpec(pattern);
        PatternSpec previous = byKey.putIfAbsent(key, pattern);
        if (previous != null) {
            log.warn("Pattern {} shares lookup key with {}; lookups resolve to the earlier one",
                pattern.id(), previous.id());
        }
        byCategory.computeIfAbsent(pattern.category(), c -> new ArrayList<>()).add(pattern);
        byBadgeType.computeIfAbsent(pattern.badgeType(), b -> new ArrayList<>()).add(pattern);
        for (LifeDomain domain : pattern.lifeDomains()) {
            byDomain.computeIfAbsent(domain, d -> new ArrayList<>()).add(pattern);
        }
        for (String participant : pattern.participants()) {
            byParticipant.computeIfAbsent(participant, p -> new ArrayList<>()).add(pattern);
        }
        return true;
    }

    /**
     * @return number of patterns actually added
     */
    public int registerAll(Collection<PatternSpec> patterns, boolean validate) {
        int added = 0;
        for (PatternSpec pattern : patterns) {
            if (register(pattern, validate)) {
                added++;
            }
        }
        return added;
    }

    private void validate(PatternSpec pattern) {
        if (pattern.id().isBlank()) {
            throw new InvalidPatternException(pattern.id(), "has a blank identifier");
        }
        if (pattern.minNodes() < 1) {
            throw new InvalidPatternException(pattern.id(), "requires at least one node, got min_nodes=" + pattern.minNodes());
        }
        if (pattern.maxNodes() != null && pattern.maxNodes() < pattern.minNodes()) {
            throw new InvalidPatternException(pattern.id(),
                "has max_nodes=" + pattern.maxNodes() + " below min_nodes=" + pattern.minNodes());
        }
        for (String required : pattern.requires()) {
            if (!byId.containsKey(required)) {
                throw new MissingDependencyException(pattern.id(), required);
            }
        }
        List<String> contradictions = pattern.requires().stream()
            .filter(pattern.blockedBy()::contains)
            .toList();
        if (!contradictions.isEmpty()) {
            throw new ContradictionException(pattern.id(), contradictions);
        }
    }

    // ── lookup ───────────────────────────────────────────────────────────────

    public Optional<PatternSpec> get(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    /**
     * Order-independent lookup for pairs and triads; see {@link PatternKey}.
     */
    public Optional<PatternSpec> find(PatternKey key) {
        return Optional.ofNullable(byKey.get(key));
    }

    /** Registration order. */
    public List<PatternSpec> getByCategory(PatternCategory category) {
        return List.copyOf(byCategory.getOrDefault(category, List.of()));
    }

    public List<PatternSpec> getByDomain(LifeDomain domain) {
        return List.copyOf(byDomain.getOrDefault(domain, List.of()));
    }

    public List<PatternSpec> getByBadgeType(BadgeType badgeType) {
        return List.copyOf(byBadgeType.getOrDefault(badgeType, List.of()));
    }

    /** Patterns whose node filters name the given branch or stem. */
    public List<PatternSpec> getByParticipant(String participant) {
        return List.copyOf(byParticipant.getOrDefault(participant, List.of()));
    }

    /**
     * Patterns involving every one of the given branches or stems, in registration order.
     * No participants yields an empty list.
     */
    public List<PatternSpec> getByParticipants(String... participants) {
        if (participants.length == 0) {
            return List.of();
        }
        Set<PatternSpec> matching = new LinkedHashSet<>(byParticipant.getOrDefault(participants[0], List.of()));
        for (int i = 1; i < participants.length && !matching.isEmpty(); i++) {
            matching.retainAll(byParticipant.getOrDefault(participants[i], List.of()));
        }
        return List.copyOf(matching);
    }

    public List<PatternSpec> getAll() {
        return List.copyOf(byId.values());
    }

    public int size() {
        return byId.size();
    }

    /**
     * Ascending priority; ties keep registration order. Informational only: nothing
     * schedules evaluation by it.
     */
    public List<PatternSpec> getProcessingOrder() {
        List<PatternSpec> ordered = new ArrayList<>(byId.values());
        ordered.sort(Comparator.comparingInt(PatternSpec::priority));
        return List.copyOf(ordered);
    }

    /**
     * Patterns that may apply to a chart, in processing order: at least one participant is
     * present, no active pattern blocks it and every pattern it requires is active.
     *
     * @param participants   branches and stems present in the chart
     * @param activePatterns identifiers of patterns already established
     */
    public List<PatternSpec> getApplicablePatterns(Set<String> participants, Set<String> activePatterns) {
        List<PatternSpec> applicable = new ArrayList<>();
        for (PatternSpec pattern : getProcessingOrder()) {
            if (pattern.participants().stream().noneMatch(participants::contains)) {
                continue;
            }
            if (pattern.blockedBy().stream().anyMatch(activePatterns::contains)) {
                continue;
            }
            if (!activePatterns.containsAll(pattern.requires())) {
                continue;
            }
            applicable.add(pattern);
        }
        return applicable;
    }

    public RegistryStatistics statistics() {
        Map<String, Integer> categories = new LinkedHashMap<>();
        byCategory.forEach((category, patterns) -> categories.put(category.token(), patterns.size()));
        Map<String, Integer> domains = new LinkedHashMap<>();
        byDomain.forEach((domain, patterns) -> domains.put(domain.token(), patterns.size()));
        int withDependencies = 0;
        int withBlockers = 0;
        for (PatternSpec pattern : byId.values()) {
            if (!pattern.requires().isEmpty()) withDependencies++;
            if (!pattern.blockedBy().isEmpty()) withBlockers++;
        }
        return new RegistryStatistics(byId.size(), categories, domains, byParticipant.size(),
            withDependencies, withBlockers);
    }

    // ── dependencies ─────────────────────────────────────────────────────────

    /**
     * Identifiers ordered so that every pattern follows the patterns it requires.
     * Requirements that are not registered are ignored here and reported by {@link #validateAll()}.
     *
     * @throws CircularDependencyException when requirements form a cycle
     */
    public List<String> dependencyOrder() {
        DependencyGraph graph = new DependencyGraph();
        for (PatternSpec pattern : byId.values()) {
            graph.addNode(pattern.id());
            for (String required : pattern.requires()) {
                if (byId.containsKey(required)) {
                    graph.addEdge(required, pattern.id());
                }
            }
        }
        return graph.topologicalSort();
    }

    /**
     * Consistency check over the whole registry. Useful after unvalidated bulk registration.
     *
     * @return human-readable issues; empty when consistent
     */
    public List<String> validateAll() {
        List<String> issues = new ArrayList<>();
        for (PatternSpec pattern : byId.values()) {
            for (String required : pattern.requires()) {
                if (!byId.containsKey(required)) {
                    issues.add("Pattern '" + pattern.id() + "' requires missing '" + required + "'");
                }
            }
        }
        try {
            dependencyOrder();
        } catch (CircularDependencyException e) {
            issues.add("Circular dependency detected among " + e.getCycle());
        }
        return issues;
    }
}
