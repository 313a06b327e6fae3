package ai.cellflow.analyzer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Fragment-level symbol states, in order of first occurrence. Owned by a single classifier run. */
public final class SymbolTable {
    private static final Logger log = LogManager.getLogger(SymbolTable.class);

    private final Map<String, SymbolState> states = new LinkedHashMap<>();

    public void read(String name) {
        var before = state(name);
        var after = before.onRead();
        if (after != before) {
            log.trace("{}: {} -> {}", name, before, after);
            states.put(name, after);
        }
    }

    public void deferredRead(String name) {
        var before = state(name);
        var after = before.onDeferredRead();
        if (after != before) {
            log.trace("{}: {} -> {} (deferred read)", name, before, after);
            states.put(name, after);
        }
    }

    public void write(String name) {
        var before = state(name);
        var after = before.onWrite();
        if (after != before) {
            log.trace("{}: {} -> {}", name, before, after);
            states.put(name, after);
        }
    }

    public SymbolState state(String name) {
        return states.getOrDefault(name, SymbolState.UNSEEN);
    }

    public Set<String> reads() {
        var result = new LinkedHashSet<String>();
        states.forEach((name, state) -> {
            if (state.isRead()) {
                result.add(name);
            }
        });
        return result;
    }

    public Set<String> writes() {
        var result = new LinkedHashSet<String>();
        states.forEach((name, state) -> {
            if (state.isWritten()) {
                result.add(name);
            }
        });
        return result;
    }

    public Map<String, SymbolState> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }
}
