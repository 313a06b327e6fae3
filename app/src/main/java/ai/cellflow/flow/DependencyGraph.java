package ai.cellflow.flow;

import ai.cellflow.exception.UnknownFragmentException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Snapshot of the last-writer graph of a {@link DependencyIndex}: for every fragment, in order, the fragments it
 * immediately depends on and the names carried along each edge. Later changes to the index are not reflected.
 */
public final class DependencyGraph {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /** {@code from} writes each of {@code symbols} last before {@code to} reads it. */
    public record Edge(int from, int to, SortedSet<String> symbols) {}

    /** A fragment as it appears in {@link #toJson()}. */
    public record Node(int index, SortedSet<String> reads, SortedSet<String> writes) {}

    private final List<Fragment> fragments;
    private final List<Map<Integer, Set<String>>> predecessors;

    DependencyGraph(List<Fragment> fragments, List<Map<Integer, Set<String>>> predecessors) {
        this.fragments = fragments;
        this.predecessors = predecessors;
    }

    public int size() {
        return fragments.size();
    }

    public List<Fragment> fragments() {
        return fragments;
    }

    /** Indices of the fragments that fragment {@code index} depends on, ascending. */
    public SortedSet<Integer> predecessorIndices(int index) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(predecessors.get(index).keySet()));
    }

    public Set<Fragment> predecessors(int index) {
        var result = new LinkedHashSet<Fragment>();
        for (var predecessor : predecessorIndices(index)) {
            result.add(fragments.get(predecessor));
        }
        return Collections.unmodifiableSet(result);
    }

    public Set<Fragment> predecessors(Fragment fragment) {
        return predecessors(requireIndex(fragment));
    }

    /** Predecessor indices of every fragment, in fragment order. */
    public List<SortedSet<Integer>> predecessorIndices() {
        var result = new ArrayList<SortedSet<Integer>>(fragments.size());
        for (int i = 0; i < fragments.size(); i++) {
            result.add(predecessorIndices(i));
        }
        return Collections.unmodifiableList(result);
    }

    /** Indices of the fragments that depend directly on fragment {@code index}, ascending. */
    public SortedSet<Integer> successorIndices(int index) {
        var result = new TreeSet<Integer>();
        for (int i = index + 1; i < predecessors.size(); i++) {
            if (predecessors.get(i).containsKey(index)) {
                result.add(i);
            }
        }
        return Collections.unmodifiableSortedSet(result);
    }

    /** Every edge, ordered by target then source. */
    public List<Edge> edges() {
        var edges = new ArrayList<Edge>();
        for (int to = 0; to < predecessors.size(); to++) {
            for (var from : predecessorIndices(to)) {
                var symbols = Collections.unmodifiableSortedSet(new TreeSet<>(predecessors.get(to).get(from)));
                edges.add(new Edge(from, to, symbols));
            }
        }
        return Collections.unmodifiableList(edges);
    }

    /**
     * Everything that transitively depends on fragment {@code index}, i.e. the fragments to re-run after it
     * changes, ascending. Does not include {@code index} itself.
     */
    public SortedSet<Integer> downstreamOf(int index) {
        if (index < 0 || index >= fragments.size()) {
            throw new IndexOutOfBoundsException("Index: " + index + ", size: " + fragments.size());
        }
        var visited = new TreeSet<Integer>();
        var queue = new ArrayDeque<Integer>();
        queue.add(index);
        while (!queue.isEmpty()) {
            var current = queue.poll();
            for (var successor : successorIndices(current)) {
                if (visited.add(successor)) {
                    queue.add(successor);
                }
            }
        }
        return Collections.unmodifiableSortedSet(visited);
    }

    /** Node and edge list, for external renderers. */
    public String toJson() {
        var nodes = new ArrayList<Node>(fragments.size());
        for (int i = 0; i < fragments.size(); i++) {
            var fragment = fragments.get(i);
            var reads = new TreeSet<>(fragment.reads());
            // rebound builtins are filtered from reads() but still label edges
            predecessors.get(i).values().forEach(reads::addAll);
            nodes.add(new Node(i, reads, new TreeSet<>(fragment.writes())));
        }
        try {
            var document = new LinkedHashMap<String, Object>();
            document.put("nodes", nodes);
            document.put("edges", edges());
            return OBJECT_MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize dependency graph", e);
        }
    }

    private int requireIndex(Fragment fragment) {
        for (int i = 0; i < fragments.size(); i++) {
            if (fragments.get(i) == fragment) {
                return i;
            }
        }
        throw new UnknownFragmentException(fragment);
    }

    @Override
    public String toString() {
        return "DependencyGraph" + predecessorIndices();
    }
}
