package ai.cellflow.flow;

import ai.cellflow.analyzer.SymbolClassifier;
import ai.cellflow.analyzer.SymbolState;
import ai.cellflow.analyzer.python.PythonBuiltins;
import ai.cellflow.analyzer.python.PythonParser;
import ai.cellflow.analyzer.python.PythonSyntaxTree;
import ai.cellflow.util.FlowSettings;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A piece of code that is parsed independently, e.g. one notebook cell. Dependencies are only computed between
 * fragments; no analysis happens between the statements of a single fragment.
 *
 * <p>Immutable once constructed. Equality is identity: two cells with the same text are still two cells.
 */
public final class Fragment {
    private static final Logger log = LogManager.getLogger(Fragment.class);

    private final PythonSyntaxTree tree;
    private final Map<String, SymbolState> symbols;
    private final Set<String> reads;
    private final Set<String> allReads;
    private final Set<String> writes;

    private Fragment(PythonSyntaxTree tree, FlowSettings settings) {
        this.tree = tree;
        this.symbols = SymbolClassifier.classify(tree, settings);

        var readNames = new LinkedHashSet<String>();
        var allReadNames = new LinkedHashSet<String>();
        var writeNames = new LinkedHashSet<String>();
        symbols.forEach((name, state) -> {
            if (state.isRead()) {
                allReadNames.add(name);
                if (!(settings.ignoreBuiltinReads() && PythonBuiltins.isBuiltin(name))) {
                    readNames.add(name);
                }
            }
            if (state.isWritten()) {
                writeNames.add(name);
            }
        });
        this.reads = Collections.unmodifiableSet(readNames);
        this.allReads = Collections.unmodifiableSet(allReadNames);
        this.writes = Collections.unmodifiableSet(writeNames);

        log.debug(
                "Parsed fragment:\n----------\n{}\n----------\n  reads: {}\n  writes: {}",
                tree.source().strip(),
                String.join(", ", reads),
                String.join(", ", writes));
    }

    /**
     * Parses and classifies {@code source} with the settings from {@link FlowSettings#load()}.
     *
     * @throws ai.cellflow.exception.SourceParseException if the text is not valid Python
     */
    public static Fragment parse(String source) {
        return parse(source, FlowSettings.load());
    }

    public static Fragment parse(String source, FlowSettings settings) {
        return new Fragment(PythonParser.parse(source), settings);
    }

    /** Classifies an already parsed tree. */
    public static Fragment of(PythonSyntaxTree tree) {
        return of(tree, FlowSettings.load());
    }

    public static Fragment of(PythonSyntaxTree tree, FlowSettings settings) {
        return new Fragment(tree, settings);
    }

    /**
     * Names this fragment consumes from the shared environment. Builtins are left out when
     * {@link FlowSettings#ignoreBuiltinReads()} is set.
     */
    public Set<String> reads() {
        return reads;
    }

    /**
     * Every name read from the shared environment, builtins included whatever the settings. Dependency tracking uses
     * this set, so a cell that rebinds {@code sum} or {@code input} is still a predecessor of the cells reading it.
     */
    public Set<String> allReads() {
        return allReads;
    }

    /** Names this fragment creates or changes in the shared environment. */
    public Set<String> writes() {
        return writes;
    }

    /** Final state of every fragment-level name, builtins included. */
    public Map<String, SymbolState> symbols() {
        return symbols;
    }

    public PythonSyntaxTree tree() {
        return tree;
    }

    public String source() {
        return tree.source();
    }

    @Override
    public String toString() {
        var firstLine = source().strip().lines().findFirst().orElse("");
        if (firstLine.length() > 40) {
            firstLine = firstLine.substring(0, 40) + "...";
        }
        return "Fragment[" + firstLine + "]";
    }
}
