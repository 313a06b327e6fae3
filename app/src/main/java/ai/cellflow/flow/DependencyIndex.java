package ai.cellflow.flow;

import ai.cellflow.exception.UnknownFragmentException;
import ai.cellflow.util.FlowSettings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * An ordered sequence of fragments (a notebook, in program order) with reverse indices from each name to the
 * fragments reading and writing it. Fragments can be added, replaced and removed anywhere; only the symbols of the
 * fragments involved are re-indexed.
 *
 * <p>The reverse indices and all queries work on {@link Fragment#allReads()}: a builtin read only produces an edge
 * when an earlier fragment rebinds the name, since nothing else writes it.
 *
 * <p>A name read by a fragment depends on the nearest fragment before it that writes the name (last writer wins). A
 * fragment never depends on itself.
 *
 * <p>Not thread-safe. Callers sharing an index must serialize every mutation and query.
 */
public final class DependencyIndex implements Iterable<Fragment> {
    private static final Logger log = LogManager.getLogger(DependencyIndex.class);

    private final List<Fragment> fragments = new ArrayList<>();
    // Maps symbol names to the fragments that use it
    private final Map<String, Set<Fragment>> readBy = new HashMap<>();
    // Maps symbol names to the fragments that assign it
    private final Map<String, Set<Fragment>> writtenBy = new HashMap<>();

    public DependencyIndex() {}

    public static DependencyIndex of(List<Fragment> fragments) {
        var index = new DependencyIndex();
        fragments.forEach(index::add);
        return index;
    }

    /**
     * Parses every source into a fragment, in order.
     *
     * @throws ai.cellflow.exception.SourceParseException for the first source that is not valid Python
     */
    public static DependencyIndex parse(List<String> sources) {
        return parse(sources, FlowSettings.load());
    }

    public static DependencyIndex parse(List<String> sources, FlowSettings settings) {
        var parsed = new ArrayList<Fragment>(sources.size());
        for (var source : sources) {
            parsed.add(Fragment.parse(source, settings));
        }
        return of(parsed);
    }

    // ---------------------------------------------------------------------------------------------
    // Sequence access
    // ---------------------------------------------------------------------------------------------

    public int size() {
        return fragments.size();
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    public Fragment get(int index) {
        return fragments.get(index);
    }

    /** Position of {@code fragment}, or -1 when it is not part of this index. */
    public int indexOf(Fragment fragment) {
        return fragments.indexOf(fragment);
    }

    public boolean contains(Fragment fragment) {
        return indexOf(fragment) >= 0;
    }

    public List<Fragment> fragments() {
        return List.copyOf(fragments);
    }

    @Override
    public Iterator<Fragment> iterator() {
        return Collections.unmodifiableList(fragments).iterator();
    }

    // ---------------------------------------------------------------------------------------------
    // Mutation
    // ---------------------------------------------------------------------------------------------

    public void add(Fragment fragment) {
        insert(fragments.size(), fragment);
    }

    /** Parses {@code source} with the default settings and appends it. */
    public Fragment add(String source) {
        var fragment = Fragment.parse(source);
        add(fragment);
        return fragment;
    }

    public void insert(int index, Fragment fragment) {
        if (index < 0 || index > fragments.size()) {
            throw new IndexOutOfBoundsException("Index: " + index + ", size: " + fragments.size());
        }
        requireAbsent(fragment);
        fragments.add(index, fragment);
        addToIndices(fragment);
        log.debug("Inserted {} at {}", fragment, index);
    }

    /** Replaces the fragment at {@code index}, returning the one that was there. */
    public Fragment set(int index, Fragment replacement) {
        var previous = fragments.get(index);
        if (replacement == previous) {
            return previous;
        }
        requireAbsent(replacement);
        removeFromIndices(previous);
        fragments.set(index, replacement);
        addToIndices(replacement);
        log.debug("Replaced {} with {} at {}", previous, replacement, index);
        return previous;
    }

    public void replace(Fragment existing, Fragment replacement) {
        set(requireIndex(existing), replacement);
    }

    public Fragment remove(int index) {
        var removed = fragments.remove(index);
        removeFromIndices(removed);
        log.debug("Removed {} from {}", removed, index);
        return removed;
    }

    public void remove(Fragment fragment) {
        remove(requireIndex(fragment));
    }

    /** Replaces the fragments in {@code [from, to)} with {@code replacements}, which may have a different length. */
    public void replaceRange(int from, int to, List<Fragment> replacements) {
        checkRange(from, to);
        var outgoing = Collections.newSetFromMap(new IdentityHashMap<Fragment, Boolean>());
        outgoing.addAll(fragments.subList(from, to));
        var incoming = Collections.newSetFromMap(new IdentityHashMap<Fragment, Boolean>());
        for (var replacement : replacements) {
            if (!incoming.add(replacement)) {
                throw new IllegalArgumentException("Fragment appears twice in replacement: " + replacement);
            }
            if (!outgoing.contains(replacement)) {
                requireAbsent(replacement);
            }
        }

        var window = fragments.subList(from, to);
        window.forEach(this::removeFromIndices);
        window.clear();
        fragments.addAll(from, replacements);
        replacements.forEach(this::addToIndices);
        log.debug("Replaced range [{}, {}) with {} fragment(s)", from, to, replacements.size());
    }

    public void removeRange(int from, int to) {
        replaceRange(from, to, List.of());
    }

    private void addToIndices(Fragment fragment) {
        for (var symbol : fragment.allReads()) {
            readBy.computeIfAbsent(symbol, k -> new HashSet<>()).add(fragment);
        }
        for (var symbol : fragment.writes()) {
            writtenBy.computeIfAbsent(symbol, k -> new HashSet<>()).add(fragment);
        }
    }

    private void removeFromIndices(Fragment fragment) {
        for (var symbol : fragment.allReads()) {
            removeEntry(readBy, symbol, fragment);
        }
        for (var symbol : fragment.writes()) {
            removeEntry(writtenBy, symbol, fragment);
        }
    }

    private static void removeEntry(Map<String, Set<Fragment>> reverseIndex, String symbol, Fragment fragment) {
        var owners = reverseIndex.get(symbol);
        if (owners == null || !owners.remove(fragment)) {
            throw new IllegalStateException("Reverse index out of sync for '" + symbol + "' and " + fragment);
        }
        if (owners.isEmpty()) {
            reverseIndex.remove(symbol);
        }
    }

    private void requireAbsent(Fragment fragment) {
        if (contains(fragment)) {
            throw new IllegalArgumentException("Fragment is already part of this index: " + fragment);
        }
    }

    private int requireIndex(Fragment fragment) {
        var index = indexOf(fragment);
        if (index < 0) {
            throw new UnknownFragmentException(fragment);
        }
        return index;
    }

    private void checkRange(int from, int to) {
        if (from < 0 || to > fragments.size() || from > to) {
            throw new IndexOutOfBoundsException("Range [" + from + ", " + to + ") outside size " + fragments.size());
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Reverse lookups
    // ---------------------------------------------------------------------------------------------

    /** Fragments whose {@link Fragment#allReads()} contain {@code symbol}, in no particular order. */
    public Set<Fragment> readersOf(String symbol) {
        return Collections.unmodifiableSet(readBy.getOrDefault(symbol, Set.of()));
    }

    /** Fragments whose writes contain {@code symbol}, in no particular order. */
    public Set<Fragment> writersOf(String symbol) {
        return Collections.unmodifiableSet(writtenBy.getOrDefault(symbol, Set.of()));
    }

    /** Every name read or written by some fragment, sorted. */
    public Set<String> symbols() {
        var all = new TreeSet<String>(readBy.keySet());
        all.addAll(writtenBy.keySet());
        return Collections.unmodifiableSet(all);
    }

    // ---------------------------------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------------------------------

    /**
     * Immediate predecessors: for every name {@code fragment} reads, the nearest earlier fragment writing it.
     *
     * @return the distinct writers, in index order
     * @throws UnknownFragmentException if {@code fragment} is not part of this index
     */
    public Set<Fragment> dependencies(Fragment fragment) {
        var position = requireIndex(fragment);
        var symbols = new HashSet<>(fragment.allReads());
        var lastAssign = new HashSet<Fragment>();

        for (int i = position - 1; i >= 0 && !symbols.isEmpty(); i--) {
            var other = fragments.get(i);
            if (symbols.removeAll(other.writes())) {
                lastAssign.add(other);
            }
        }
        return inIndexOrder(lastAssign);
    }

    /**
     * Immediate successors: for every name {@code fragment} writes, the nearest later fragment reading it. Rewrites
     * of the name in between are not considered; {@link DependencyGraph#successorIndices(int)} is exact.
     *
     * @return the distinct readers, in index order
     * @throws UnknownFragmentException if {@code fragment} is not part of this index
     */
    public Set<Fragment> dependents(Fragment fragment) {
        var position = requireIndex(fragment);
        var symbols = new HashSet<>(fragment.writes());
        var lastRead = new HashSet<Fragment>();

        for (int i = position + 1; i < fragments.size() && !symbols.isEmpty(); i++) {
            var other = fragments.get(i);
            if (symbols.removeAll(other.allReads())) {
                lastRead.add(other);
            }
        }
        return inIndexOrder(lastRead);
    }

    /**
     * The whole last-writer graph in one forward pass. A fragment's own writes become visible only to the fragments
     * after it, so the result has no self-loops.
     */
    public DependencyGraph graph() {
        var predecessors = new ArrayList<Map<Integer, Set<String>>>(fragments.size());
        var lastAssign = new HashMap<String, Integer>();

        for (int i = 0; i < fragments.size(); i++) {
            var fragment = fragments.get(i);
            var deps = new LinkedHashMap<Integer, Set<String>>();
            for (var symbol : fragment.allReads()) {
                var writer = lastAssign.get(symbol);
                if (writer != null) {
                    deps.computeIfAbsent(writer, k -> new TreeSet<>()).add(symbol);
                }
            }
            predecessors.add(deps);
            for (var symbol : fragment.writes()) {
                lastAssign.put(symbol, i);
            }
        }
        return new DependencyGraph(List.copyOf(fragments), predecessors);
    }

    private Set<Fragment> inIndexOrder(Set<Fragment> selected) {
        var ordered = new LinkedHashSet<Fragment>();
        for (var fragment : fragments) {
            if (selected.contains(fragment)) {
                ordered.add(fragment);
            }
        }
        return Collections.unmodifiableSet(ordered);
    }

    @Override
    public String toString() {
        return "DependencyIndex[" + fragments.size() + " fragments, " + symbols().size() + " symbols]";
    }
}
