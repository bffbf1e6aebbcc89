/* @LICENSE@
 */
package org.rxnfa.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Arena of NFA states, indexed by integer id, together with their outgoing
 * transitions. Ids are handed out by {@link #newState()} in increasing order
 * from 0. States refer to each other by id only, so the loops that star and
 * plus introduce are plain edges.
 * <p>
 * A table is filled by exactly one {@link ThompsonBuilder} and then
 * {@linkplain #freeze() frozen}; after that it is immutable and may be shared.
 */
final class TransitionTable {

    static final class State {

        final int id;
        // a Thompson state never has two arcs on the same symbol
        private final SortedMap<Character, Integer> arcs = new TreeMap<Character, Integer>();
        private final Set<Integer> epsilons = new LinkedHashSet<Integer>(4);

        private State(int id) {
            this.id = id;
        }

        @Override
        public String toString() {
            return id + ": arcs=" + arcs + " eps=" + epsilons;
        }
    }

    private final List<State> states = new ArrayList<State>();
    private boolean frozen = false;

    int newState() {
        checkMutable();
        final int id = states.size();
        states.add(new State(id));
        return id;
    }

    void addSymbol(int from, char c, int to) {
        checkMutable();
        assert isState(to) : to;
        final Integer prev = state(from).arcs.put(c, to);
        assert prev == null : "second arc on '" + c + "' from " + from;
    }

    void addEpsilon(int from, int to) {
        checkMutable();
        assert isState(to) : to;
        state(from).epsilons.add(to);
    }

    TransitionTable freeze() {
        frozen = true;
        return this;
    }

    int size() {
        return states.size();
    }

    boolean isState(int id) {
        return 0 <= id && id < states.size();
    }

    boolean isDeadEnd(int id) {
        final State s = state(id);
        return s.arcs.isEmpty() && s.epsilons.isEmpty();
    }

    Set<Integer> destinations(int from, char c) {
        final Integer to = state(from).arcs.get(c);
        return to == null ? Collections.<Integer>emptySet() : Collections.singleton(to);
    }

    Set<Integer> epsilonDestinations(int from) {
        return Collections.unmodifiableSet(state(from).epsilons);
    }

    Set<Character> symbols(int from) {
        return Collections.unmodifiableSet(state(from).arcs.keySet());
    }

    Map<Character, Integer> arcs(int from) {
        return Collections.unmodifiableMap(state(from).arcs);
    }

    private State state(int id) {
        if (!isState(id)) {
            throw new IllegalArgumentException("no such state: " + id);
        }
        return states.get(id);
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("frozen TransitionTable");
        }
    }

    @Override
    public String toString() {
        return states.toString();
    }
}
