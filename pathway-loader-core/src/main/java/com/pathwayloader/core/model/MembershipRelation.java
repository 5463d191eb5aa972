package com.pathwayloader.core.model;

import java.util.Objects;

/**
 * Derived relation "complex node {@code complexId} contains {@code memberId}".
 *
 * @param complexId identifier of the containing complex node
 * @param memberId identifier of the member node
 */
public record MembershipRelation(
    String complexId,
    String memberId
) {
    /**
     * Compact constructor with validation.
     */
    public MembershipRelation {
        Objects.requireNonNull(complexId, "complexId must not be null");
        Objects.requireNonNull(memberId, "memberId must not be null");
    }
}
