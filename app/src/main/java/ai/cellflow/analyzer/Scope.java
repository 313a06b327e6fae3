package ai.cellflow.analyzer;

import java.util.HashSet;
import java.util.Set;

/**
 * A lexical scope entered while walking a fragment. Bindings recorded here never reach the fragment's read/write
 * sets unless the name was declared {@code global}.
 */
final class Scope {
    enum Kind {
        FUNCTION,
        LAMBDA,
        CLASS,
        /** List/set/dict comprehensions and generator expressions; transparent for name lookups. */
        COMPREHENSION
    }

    private final Kind kind;
    private final Set<String> globals = new HashSet<>();
    private final Set<String> nonlocals = new HashSet<>();
    private final Set<String> locals = new HashSet<>();

    Scope(Kind kind) {
        this.kind = kind;
    }

    Kind kind() {
        return kind;
    }

    /** Walrus targets and {@code global}/{@code nonlocal} declarations skip comprehension scopes. */
    boolean isBindingScope() {
        return kind != Kind.COMPREHENSION;
    }

    void declareGlobal(String name) {
        globals.add(name);
        locals.remove(name);
    }

    void declareNonlocal(String name) {
        nonlocals.add(name);
        locals.remove(name);
    }

    void bindLocal(String name) {
        locals.add(name);
    }

    boolean isGlobal(String name) {
        return globals.contains(name);
    }

    boolean isNonlocal(String name) {
        return nonlocals.contains(name);
    }

    boolean isLocal(String name) {
        return locals.contains(name);
    }

    @Override
    public String toString() {
        return kind + "{globals=" + globals + ", nonlocals=" + nonlocals + ", locals=" + locals + "}";
    }
}
