package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.TransitionContext;
import com.phillippitts.lifecycle.domain.status.StatusType;

import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Allows any status in {@code from} to move to any status in {@code to} for one entity kind,
 * subject to an optional guard.
 *
 * @param entityKind kind the rule applies to
 * @param from source statuses
 * @param to permitted targets
 * @param guard extra condition on the context; {@code ctx -> true} when unconditional
 */
public record TransitionRule(EntityKind entityKind,
                             Set<StatusType> from,
                             Set<StatusType> to,
                             Predicate<TransitionContext> guard) {

    public TransitionRule {
        Objects.requireNonNull(entityKind, "entityKind");
        from = Set.copyOf(from);
        to = Set.copyOf(to);
        guard = guard == null ? ctx -> true : guard;
        for (StatusType status : from) {
            requireOwned(entityKind, status);
        }
        for (StatusType status : to) {
            requireOwned(entityKind, status);
        }
    }

    public static TransitionRule of(EntityKind kind, StatusType from, StatusType... to) {
        return new TransitionRule(kind, Set.of(from), Set.of(to), null);
    }

    public TransitionRule withGuard(Predicate<TransitionContext> newGuard) {
        return new TransitionRule(entityKind, from, to, newGuard);
    }

    boolean covers(StatusType source, StatusType target) {
        return from.contains(source) && to.contains(target);
    }

    private static void requireOwned(EntityKind kind, StatusType status) {
        if (!kind.owns(status)) {
            throw new IllegalArgumentException(status + " is not a " + kind.key() + " status");
        }
    }
}
