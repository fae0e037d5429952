package com.pillarpattern.core.analysis;

import com.pillarpattern.core.catalog.SpecialStarCatalog;
import com.pillarpattern.core.model.InteractionId;
import com.pillarpattern.core.model.NodeFilter;
import com.pillarpattern.core.model.PatternSpec;
import com.pillarpattern.core.model.PillarPosition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the special stars whose target branch appears in the chart.
 *
 * <p>The chart's branches are approximated by every participant named in an interaction
 * identifier, plus the Year Branch. Triggers come from identifiers whose third segment lists
 * node ids aligned with the participants, e.g. {@code CLASH~Zi-Wu~eb_d-eb_m}. A node id that
 * names no known pillar yields no trigger; it is never reported against the day pillar.
 */
public class SpecialStarDetector {

    // Longest branch or stem name is four letters (Chou, Geng, Shen)
    static final int MAX_PARTICIPANT_LENGTH = 4;

    public List<SpecialStarHit> detect(String daymasterStem, Collection<String> interactionIds, String yearBranch) {
        List<PatternSpec> applicable = new ArrayList<>(SpecialStarCatalog.forDayMaster(daymasterStem));
        applicable.addAll(SpecialStarCatalog.forYearBranch(yearBranch));

        List<InteractionId> parsed = new ArrayList<>();
        Set<String> presentBranches = new LinkedHashSet<>();
        for (String id : interactionIds) {
            if (id == null || !id.contains(InteractionId.SEGMENT_SEPARATOR)) {
                continue;
            }
            InteractionId interactionId = InteractionId.parse(id);
            parsed.add(interactionId);
            for (String participant : interactionId.participants()) {
                if (participant.length() <= MAX_PARTICIPANT_LENGTH) {
                    presentBranches.add(participant);
                }
            }
        }
        if (yearBranch != null && !yearBranch.isEmpty()) {
            presentBranches.add(yearBranch);
        }

        List<SpecialStarHit> hits = new ArrayList<>();
        for (PatternSpec star : applicable) {
            for (NodeFilter filter : star.nodeFilters()) {
                for (String target : filter.branches()) {
                    if (presentBranches.contains(target)) {
                        hits.add(new SpecialStarHit(star.id(), star.nativeName(), star.englishName(),
                            star.category(), target, star.description(), star.pillarMeanings(),
                            triggers(target, parsed)));
                    }
                }
            }
        }
        return hits;
    }

    private static List<StarTrigger> triggers(String targetBranch, List<InteractionId> interactions) {
        Set<StarTrigger> triggers = new LinkedHashSet<>();
        for (InteractionId id : interactions) {
            List<String> participants = id.participants();
            List<String> nodeIds = id.tailTokens();
            for (int i = 0; i < participants.size() && i < nodeIds.size(); i++) {
                if (!participants.get(i).equals(targetBranch)) {
                    continue;
                }
                PillarPosition pillar = PillarPosition.fromNodeId(nodeIds.get(i));
                if (pillar != null) {
                    triggers.add(new StarTrigger(nodeIds.get(i), pillar.label()));
                }
            }
        }
        return new ArrayList<>(triggers);
    }
}
