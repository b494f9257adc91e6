package Powerset.Model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * A DFA state of the powerset construction: an immutable set of NFA states.
 * Two instances are equal iff their member sets are equal, regardless of the order members were added in.
 * @param <S> - NFA state type
 */
public final class StateSet<S> implements Iterable<S> {

    private final Set<S> members;

    private StateSet(Set<S> members) {
        this.members = members;
    }

    /**
     * @param members - NFA states, iteration order is kept for printing
     * @return composite state holding a copy of the members
     */
    public static <S> StateSet<S> of(Collection<? extends S> members) {
        if (members.isEmpty()) {
            return empty();
        }
        final Set<S> copy = new LinkedHashSet<>(members.size());
        for (S s : members) {
            copy.add(Objects.requireNonNull(s, "null NFA state"));
        }
        return new StateSet<>(Collections.unmodifiableSet(copy));
    }

    @SafeVarargs
    public static <S> StateSet<S> of(S... members) {
        return of(Arrays.asList(members));
    }

    public static <S> StateSet<S> empty() {
        return new StateSet<>(Collections.emptySet());
    }

    public Set<S> states() {
        return members;
    }

    public boolean contains(Object state) {
        return members.contains(state);
    }

    /**
     * Whether any member is in the given set, e.g. the accepting states of an NFA.
     */
    public boolean intersects(Set<?> other) {
        for (S s : members) {
            if (other.contains(s)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public Iterator<S> iterator() {
        return members.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateSet)) {
            return false;
        }
        return members.equals(((StateSet<?>) o).members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        final StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (S s : members) {
            joiner.add(String.valueOf(s));
        }
        return joiner.toString();
    }
}
