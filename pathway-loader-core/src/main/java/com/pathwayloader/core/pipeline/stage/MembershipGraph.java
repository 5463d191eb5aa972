package com.pathwayloader.core.pipeline.stage;

import com.pathwayloader.core.model.MembershipRelation;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Adjacency view of membership relations keyed by complex node identifier.
 *
 * <p>Members keep first-seen order and appear at most once per complex.
 */
final class MembershipGraph {

    private final Map<String, Set<String>> members = new LinkedHashMap<>();

    MembershipGraph(Collection<MembershipRelation> relations) {
        for (MembershipRelation relation : relations) {
            members.computeIfAbsent(relation.complexId(), id -> new LinkedHashSet<>()).add(relation.memberId());
        }
    }

    Set<String> membersOf(String complexId) {
        return members.getOrDefault(complexId, Set.of());
    }
}
