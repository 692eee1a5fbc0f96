package com.facility.resolution.match;

import com.facility.resolution.core.model.Candidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses candidates that point at the same target and orders the survivors.
 *
 * <p>For each target the highest confidence wins; on equal confidence the strategy with the
 * lower priority number wins. The result is sorted by confidence descending, then strategy
 * priority, then first appearance, and carries 1-based ranks.</p>
 */
public final class CandidateRanker {

    private static final Comparator<Ranked> ORDER = Comparator
            .comparingDouble((Ranked r) -> r.candidate.confidence()).reversed()
            .thenComparingInt(r -> r.candidate.strategy().priority())
            .thenComparingInt(r -> r.firstSeen);

    private CandidateRanker() {
    }

    public static List<Candidate> rank(List<Candidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        Map<String, Ranked> best = new LinkedHashMap<>();
        int index = 0;
        for (Candidate candidate : candidates) {
            Ranked current = best.get(candidate.targetId());
            if (current == null) {
                best.put(candidate.targetId(), new Ranked(candidate, index));
            } else if (beats(candidate, current.candidate)) {
                best.put(candidate.targetId(), new Ranked(candidate, current.firstSeen));
            }
            index++;
        }

        List<Ranked> ordered = new ArrayList<>(best.values());
        ordered.sort(ORDER);

        List<Candidate> ranked = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            ranked.add(ordered.get(i).candidate.withRank(i + 1));
        }
        return List.copyOf(ranked);
    }

    private static boolean beats(Candidate challenger, Candidate holder) {
        if (challenger.confidence() != holder.confidence()) {
            return challenger.confidence() > holder.confidence();
        }
        return challenger.strategy().priority() < holder.strategy().priority();
    }

    private record Ranked(Candidate candidate, int firstSeen) {}
}
