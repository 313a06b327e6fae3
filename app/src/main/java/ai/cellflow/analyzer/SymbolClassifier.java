package ai.cellflow.analyzer;

import static ai.cellflow.analyzer.ASTTraversalUtils.field;
import static ai.cellflow.analyzer.ASTTraversalUtils.isPresent;
import static ai.cellflow.analyzer.python.PythonTreeSitterNodeTypes.*;

import ai.cellflow.analyzer.python.PythonNodeKind;
import ai.cellflow.analyzer.python.PythonSyntaxTree;
import ai.cellflow.util.FlowSettings;
import com.google.common.base.Splitter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Walks one fragment's syntax tree and decides, per name, whether the fragment reads it from the shared environment,
 * writes it into that environment, or both.
 *
 * <p>Only the module level writes into the fragment's symbol table. Function, lambda and class bodies (and
 * comprehensions) get their own {@link Scope}; names bound there stay local unless declared {@code global}. Writes
 * through an attribute or subscript ({@code obj.x = 1}, {@code obj[k] = 1}) and method calls ({@code obj.m()}) count
 * as a read followed by a write of {@code obj}: the classifier does not try to tell mutating calls apart.
 *
 * <p>An instance is used for exactly one tree; {@link #classify(PythonSyntaxTree, FlowSettings)} creates it.
 */
public final class SymbolClassifier {
    private static final Logger log = LogManager.getLogger(SymbolClassifier.class);

    private static final Splitter DOT_SPLITTER = Splitter.on('.').trimResults();

    /** Target node types whose elements are bound one by one. */
    private static final Set<String> TARGET_CONTAINERS = Set.of(
            PATTERN_LIST,
            TUPLE_PATTERN,
            LIST_PATTERN,
            LIST_SPLAT_PATTERN,
            DICTIONARY_SPLAT_PATTERN,
            TUPLE,
            LIST,
            EXPRESSION_LIST,
            PARENTHESIZED_EXPRESSION,
            LIST_SPLAT,
            AS_PATTERN_TARGET);

    private final PythonSyntaxTree tree;
    private final boolean warnOnUnknownSyntax;
    private final SymbolTable table = new SymbolTable();
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final Set<String> reportedUnknownTypes = new HashSet<>();

    private SymbolClassifier(PythonSyntaxTree tree, boolean warnOnUnknownSyntax) {
        this.tree = tree;
        this.warnOnUnknownSyntax = warnOnUnknownSyntax;
    }

    public static Map<String, SymbolState> classify(PythonSyntaxTree tree) {
        return classify(tree, FlowSettings.defaults());
    }

    /** Classifies every name occurring at fragment level. Names that never occur are absent (i.e. UNSEEN). */
    public static Map<String, SymbolState> classify(PythonSyntaxTree tree, FlowSettings settings) {
        var classifier = new SymbolClassifier(tree, settings.warnOnUnknownSyntax());
        classifier.visit(tree.root());
        if (!classifier.scopes.isEmpty()) {
            throw new IllegalStateException("Unbalanced scopes after traversal: " + classifier.scopes);
        }
        return classifier.table.snapshot();
    }

    // ---------------------------------------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------------------------------------

    private void visit(@Nullable TSNode node) {
        if (!isPresent(node)) {
            return;
        }
        switch (PythonNodeKind.of(node)) {
            case IDENTIFIER -> read(tree.text(node));
            case DOTTED_NAME -> visitDottedName(node);
            case ATTRIBUTE -> visit(field(node, "object"));
            case SUBSCRIPT, PASSTHROUGH -> visitChildren(node);
            case CALL -> visitCall(node);
            case KEYWORD_ARGUMENT -> visit(field(node, "value"));
            case NAMED_EXPRESSION -> {
                visit(field(node, "value"));
                bindTarget(field(node, "name"), this::bind);
            }
            case LAMBDA -> visitLambda(node);
            case ASSIGNMENT -> visitAssignment(node);
            case AUGMENTED_ASSIGNMENT -> visitAugmentedAssignment(node);
            case DELETE_STATEMENT -> children(node).forEach(this::deleteTarget);
            case TYPE_ALIAS_STATEMENT -> visitTypeAlias(node);
            case FUNCTION_DEFINITION -> visitFunctionDefinition(node, List.of());
            case CLASS_DEFINITION -> visitClassDefinition(node, List.of());
            case DECORATED_DEFINITION -> visitDecoratedDefinition(node);
            case FOR_STATEMENT -> visitFor(node);
            case WITH_ITEM -> visitWithItem(node);
            case EXCEPT_CLAUSE -> visitExceptClause(node);
            case IMPORT_STATEMENT -> visitImport(node);
            case IMPORT_FROM_STATEMENT -> visitImportFrom(node);
            case FUTURE_IMPORT_STATEMENT -> log.trace("Skipping __future__ import");
            case GLOBAL_STATEMENT -> visitGlobal(node);
            case NONLOCAL_STATEMENT -> visitNonlocal(node);
            case COMPREHENSION -> visitComprehension(node);
            case CASE_CLAUSE -> visitCaseClause(node);
            case COMMENT -> {}
            case UNKNOWN -> visitUnknown(node);
        }
    }

    private void visitChildren(TSNode node) {
        for (var child : children(node)) {
            visit(child);
        }
    }

    private void visitUnknown(TSNode node) {
        var type = node.getType();
        if (reportedUnknownTypes.add(type)) {
            var line = node.getStartPoint().getRow() + 1;
            if (warnOnUnknownSyntax) {
                log.warn("No scope rule for node type '{}' (line {}); treating its children as reads", type, line);
            } else {
                log.debug("No scope rule for node type '{}' (line {}); treating its children as reads", type, line);
            }
        }
        visitChildren(node);
    }

    // ---------------------------------------------------------------------------------------------
    // Scopes and the three primitive effects: read, bind, mutate
    // ---------------------------------------------------------------------------------------------

    private void withScope(Scope scope, Consumer<Scope> body) {
        scopes.push(scope);
        log.debug("Entered {} scope ({})", scope.kind(), scopes.size());
        try {
            body.accept(scope);
        } finally {
            scopes.pop();
            log.debug("Left {} scope ({})", scope.kind(), scopes.size());
        }
    }

    /**
     * True when {@code name} resolves to a binding inside the fragment: a local of the innermost binding scope, of a
     * comprehension, or of an enclosing function. Enclosing class bodies are not visible from nested scopes.
     */
    private boolean isLocal(String name) {
        var innermost = true;
        for (var scope : scopes) {
            if (scope.isGlobal(name)) {
                return false;
            }
            if (scope.isLocal(name) && (innermost || scope.kind() != Scope.Kind.CLASS)) {
                return true;
            }
            if (scope.isBindingScope()) {
                innermost = false;
            }
        }
        return false;
    }

    /** The scope a plain assignment of {@code name} binds in, or null for the fragment level. */
    private @Nullable Scope bindingScopeFor(String name) {
        // nonlocal resolves to the next enclosing function, never to a class body
        var skipClasses = false;
        for (var scope : scopes) {
            if (!scope.isBindingScope() || (skipClasses && scope.kind() == Scope.Kind.CLASS)) {
                continue;
            }
            if (scope.isGlobal(name)) {
                return null;
            }
            if (scope.isNonlocal(name)) {
                skipClasses = true;
                continue;
            }
            return scope;
        }
        return null;
    }

    private @Nullable Scope innermostBindingScope() {
        for (var scope : scopes) {
            if (scope.isBindingScope()) {
                return scope;
            }
        }
        return null;
    }

    private void read(String name) {
        if (isLocal(name)) {
            log.trace("Local read of {}", name);
            return;
        }
        recordRead(name);
    }

    /** Reads inside a function or lambda body happen at call time, after everything the fragment writes. */
    private void recordRead(String name) {
        var deferred = scopes.stream()
                .anyMatch(scope -> scope.kind() == Scope.Kind.FUNCTION || scope.kind() == Scope.Kind.LAMBDA);
        if (deferred) {
            table.deferredRead(name);
        } else {
            table.read(name);
        }
    }

    private void bind(String name) {
        var scope = bindingScopeFor(name);
        if (scope == null) {
            log.trace("Added to writes: {}", name);
            table.write(name);
        } else {
            log.trace("Bound {} in {} scope", name, scope.kind());
            scope.bindLocal(name);
        }
    }

    /**
     * In-place change of the object behind {@code target}: the base name is read, and written as well when the
     * binding lives at fragment level. Mutating a free name inside a function creates no local binding.
     */
    private void mutate(@Nullable TSNode target) {
        if (!isPresent(target)) {
            return;
        }
        switch (PythonNodeKind.of(target)) {
            case IDENTIFIER -> {
                var name = tree.text(target);
                if (isLocal(name)) {
                    return;
                }
                recordRead(name);
                if (bindingScopeFor(name) == null) {
                    table.write(name);
                }
            }
            case ATTRIBUTE -> mutate(field(target, "object"));
            case SUBSCRIPT -> {
                var children = children(target);
                mutate(field(target, "value"));
                for (int i = 1; i < children.size(); i++) {
                    visit(children.get(i));
                }
            }
            default -> {
                if (PARENTHESIZED_EXPRESSION.equals(target.getType()) && children(target).size() == 1) {
                    mutate(children(target).get(0));
                } else {
                    visit(target);
                }
            }
        }
    }

    /** Binds every name in an assignment target; {@code binder} decides which scope receives plain names. */
    private void bindTarget(@Nullable TSNode target, Consumer<String> binder) {
        if (!isPresent(target)) {
            return;
        }
        switch (PythonNodeKind.of(target)) {
            case IDENTIFIER -> binder.accept(tree.text(target));
            case ATTRIBUTE, SUBSCRIPT -> mutate(target);
            case COMMENT -> {}
            default -> {
                var type = target.getType();
                var elements = children(target);
                if (AS_PATTERN_TARGET.equals(type) && elements.isEmpty()) {
                    binder.accept(tree.text(target).strip());
                } else if (TARGET_CONTAINERS.contains(type)) {
                    elements.forEach(element -> bindTarget(element, binder));
                } else {
                    log.debug("Visiting unsupported assignment target '{}' as a read", type);
                    visit(target);
                }
            }
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------------------------------

    private void visitDottedName(TSNode node) {
        var parts = children(node);
        if (!parts.isEmpty()) {
            visit(parts.get(0));
        }
    }

    private void visitCall(TSNode node) {
        var function = field(node, "function");
        if (function != null && PythonNodeKind.of(function) == PythonNodeKind.ATTRIBUTE) {
            mutate(field(function, "object"));
        } else {
            visit(function);
        }
        visit(field(node, "arguments"));
    }

    private void visitLambda(TSNode node) {
        var parameterNames = new ArrayList<String>();
        collectParameters(field(node, "parameters"), parameterNames);
        withScope(new Scope(Scope.Kind.LAMBDA), scope -> {
            parameterNames.forEach(scope::bindLocal);
            visit(field(node, "body"));
        });
    }

    private void visitComprehension(TSNode node) {
        var body = field(node, "body");
        withScope(new Scope(Scope.Kind.COMPREHENSION), scope -> {
            for (var clause : children(node)) {
                if (body != null && sameNode(clause, body)) {
                    continue;
                }
                if (FOR_IN_CLAUSE.equals(clause.getType())) {
                    var left = field(clause, "left");
                    for (var part : children(clause)) {
                        if (left == null || !sameNode(part, left)) {
                            visit(part);
                        }
                    }
                    bindTarget(left, scope::bindLocal);
                } else {
                    visit(clause);
                }
            }
            visit(body);
        });
    }

    // ---------------------------------------------------------------------------------------------
    // Assignment-like statements
    // ---------------------------------------------------------------------------------------------

    private void visitAssignment(TSNode node) {
        var left = field(node, "left");
        var right = field(node, "right");
        visit(right);
        visit(field(node, "type"));
        if (right != null) {
            bindTarget(left, this::bind);
        } else if (left != null && PythonNodeKind.of(left) == PythonNodeKind.IDENTIFIER) {
            // bare annotation: makes the name local to a function, but assigns nothing
            var scope = bindingScopeFor(tree.text(left));
            if (scope != null) {
                scope.bindLocal(tree.text(left));
            }
        }
    }

    private void visitAugmentedAssignment(TSNode node) {
        var left = field(node, "left");
        if (left != null && PythonNodeKind.of(left) == PythonNodeKind.IDENTIFIER) {
            var name = tree.text(left);
            read(name);
            visit(field(node, "right"));
            bind(name);
        } else {
            visit(field(node, "right"));
            mutate(left);
        }
    }

    private void deleteTarget(TSNode target) {
        switch (PythonNodeKind.of(target)) {
            case IDENTIFIER -> {
                var name = tree.text(target);
                read(name);
                bind(name);
            }
            case ATTRIBUTE, SUBSCRIPT -> mutate(target);
            case COMMENT -> {}
            default -> {
                if (TARGET_CONTAINERS.contains(target.getType())) {
                    children(target).forEach(this::deleteTarget);
                } else {
                    visit(target);
                }
            }
        }
    }

    private void visitTypeAlias(TSNode node) {
        visit(field(node, "right"));
        var alias = ASTTraversalUtils.findNodeRecursive(
                field(node, "left"), n -> PythonNodeKind.of(n) == PythonNodeKind.IDENTIFIER);
        if (alias != null) {
            bind(tree.text(alias));
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Definitions
    // ---------------------------------------------------------------------------------------------

    private void visitDecoratedDefinition(TSNode node) {
        var decorators = new ArrayList<TSNode>();
        for (var child : children(node)) {
            if (DECORATOR.equals(child.getType())) {
                decorators.add(child);
            }
        }
        var definition = field(node, "definition");
        if (definition == null) {
            visitUnknown(node);
            return;
        }
        switch (PythonNodeKind.of(definition)) {
            case FUNCTION_DEFINITION -> visitFunctionDefinition(definition, decorators);
            case CLASS_DEFINITION -> visitClassDefinition(definition, decorators);
            default -> {
                decorators.forEach(this::visit);
                visit(definition);
            }
        }
    }

    /**
     * Decorators, defaults and annotations are evaluated where the function is defined; the name is bound there
     * afterwards; parameters and the body belong to a new scope.
     */
    private void visitFunctionDefinition(TSNode node, List<TSNode> decorators) {
        decorators.forEach(this::visit);
        var parameterNames = new ArrayList<String>();
        collectParameters(field(node, "parameters"), parameterNames);
        visit(field(node, "return_type"));

        var name = field(node, "name");
        if (name != null) {
            bind(tree.text(name));
        }
        withScope(new Scope(Scope.Kind.FUNCTION), scope -> {
            parameterNames.forEach(scope::bindLocal);
            visit(field(node, "body"));
        });
    }

    private void visitClassDefinition(TSNode node, List<TSNode> decorators) {
        decorators.forEach(this::visit);
        visit(field(node, "superclasses"));

        var name = field(node, "name");
        if (name != null) {
            bind(tree.text(name));
        }
        withScope(new Scope(Scope.Kind.CLASS), scope -> visit(field(node, "body")));
    }

    /** Collects parameter names; default values and annotations are visited as reads in the current scope. */
    private void collectParameters(@Nullable TSNode parameters, List<String> names) {
        for (var parameter : children(parameters)) {
            switch (parameter.getType()) {
                case IDENTIFIER, KEYWORD_IDENTIFIER -> names.add(tree.text(parameter));
                case TYPED_PARAMETER -> {
                    for (var part : children(parameter)) {
                        if (!"type".equals(part.getType())) {
                            collectPatternNames(part, names);
                        }
                    }
                    visit(field(parameter, "type"));
                }
                case DEFAULT_PARAMETER, TYPED_DEFAULT_PARAMETER -> {
                    visit(field(parameter, "type"));
                    visit(field(parameter, "value"));
                    collectPatternNames(field(parameter, "name"), names);
                }
                case LIST_SPLAT_PATTERN, DICTIONARY_SPLAT_PATTERN, TUPLE_PATTERN ->
                    collectPatternNames(parameter, names);
                case "keyword_separator", "positional_separator", COMMENT -> {}
                default -> {
                    log.debug("Unexpected parameter node '{}'; visiting as a read", parameter.getType());
                    visit(parameter);
                }
            }
        }
    }

    private void collectPatternNames(@Nullable TSNode pattern, List<String> names) {
        if (!isPresent(pattern)) {
            return;
        }
        if (PythonNodeKind.of(pattern) == PythonNodeKind.IDENTIFIER) {
            names.add(tree.text(pattern));
            return;
        }
        for (var child : children(pattern)) {
            collectPatternNames(child, names);
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Compound statements
    // ---------------------------------------------------------------------------------------------

    /** Loop variables persist after the loop, so they bind in the current scope. */
    private void visitFor(TSNode node) {
        visit(field(node, "right"));
        bindTarget(field(node, "left"), this::bind);
        visit(field(node, "body"));
        visit(field(node, "alternative"));
    }

    private void visitWithItem(TSNode node) {
        var value = field(node, "value");
        if (value == null) {
            visitChildren(node);
        } else if (AS_PATTERN.equals(value.getType())) {
            visitAsPattern(value);
        } else {
            visit(value);
        }
    }

    /** {@code expr as target}: the expression is read, the target bound in the current scope. */
    private void visitAsPattern(TSNode node) {
        var parts = children(node);
        if (parts.isEmpty()) {
            return;
        }
        visit(parts.get(0));
        var alias = field(node, "alias");
        if (alias != null) {
            bindTarget(alias, this::bind);
        } else {
            for (int i = 1; i < parts.size(); i++) {
                bindTarget(parts.get(i), this::bind);
            }
        }
    }

    /**
     * Handles both shapes tree-sitter-python has used for handlers: {@code value}/{@code alias} fields, or an
     * {@code as_pattern} / positional expressions ahead of the block.
     */
    private void visitExceptClause(TSNode node) {
        var value = field(node, "value");
        var alias = field(node, "alias");
        var blocks = new ArrayList<TSNode>();
        var expressions = new ArrayList<TSNode>();
        for (var child : children(node)) {
            if (BLOCK.equals(child.getType())) {
                blocks.add(child);
            } else if ((value == null || !sameNode(child, value)) && (alias == null || !sameNode(child, alias))) {
                expressions.add(child);
            }
        }

        if (value != null) {
            if (AS_PATTERN.equals(value.getType())) {
                visitAsPattern(value);
            } else {
                visit(value);
            }
            bindTarget(alias, this::bind);
        } else if (!expressions.isEmpty()) {
            var first = expressions.get(0);
            if (AS_PATTERN.equals(first.getType())) {
                visitAsPattern(first);
            } else {
                visit(first);
            }
            for (int i = 1; i < expressions.size(); i++) {
                bindTarget(expressions.get(i), this::bind);
            }
        }
        blocks.forEach(this::visit);
    }

    private void visitCaseClause(TSNode node) {
        for (var child : children(node)) {
            if (CASE_PATTERN.equals(child.getType())) {
                bindPattern(child);
            } else {
                visit(child);
            }
        }
    }

    /** Capture patterns bind, dotted value patterns and class patterns read. */
    private void bindPattern(TSNode pattern) {
        switch (pattern.getType()) {
            case IDENTIFIER, KEYWORD_IDENTIFIER -> {
                var name = tree.text(pattern);
                if (!"_".equals(name)) {
                    bind(name);
                }
            }
            case DOTTED_NAME -> {
                var parts = children(pattern);
                if (parts.size() == 1) {
                    bindPattern(parts.get(0));
                } else {
                    visitDottedName(pattern);
                }
            }
            case CLASS_PATTERN -> {
                var parts = children(pattern);
                for (int i = 0; i < parts.size(); i++) {
                    if (i == 0 && DOTTED_NAME.equals(parts.get(i).getType())) {
                        visitDottedName(parts.get(i));
                    } else {
                        bindPattern(parts.get(i));
                    }
                }
            }
            case KEYWORD_PATTERN -> {
                var parts = children(pattern);
                for (int i = 1; i < parts.size(); i++) {
                    bindPattern(parts.get(i));
                }
            }
            case COMMENT -> {}
            default -> children(pattern).forEach(this::bindPattern);
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Imports and declarations
    // ---------------------------------------------------------------------------------------------

    /** {@code import a.b.c} binds {@code a}; {@code import a.b as c} binds {@code c}. */
    private void visitImport(TSNode node) {
        for (var child : children(node)) {
            switch (child.getType()) {
                case DOTTED_NAME -> bind(DOT_SPLITTER.split(tree.text(child)).iterator().next());
                case ALIASED_IMPORT -> bindAlias(child);
                case COMMENT -> {}
                default -> log.debug("Unexpected import child '{}'", child.getType());
            }
        }
    }

    private void visitImportFrom(TSNode node) {
        var module = field(node, "module_name");
        for (var child : children(node)) {
            if (module != null && sameNode(child, module)) {
                continue;
            }
            switch (child.getType()) {
                case DOTTED_NAME -> bind(tree.text(child).strip());
                case ALIASED_IMPORT -> bindAlias(child);
                case WILDCARD_IMPORT -> log.debug("Star import from '{}' binds unknown names", tree.text(module));
                case COMMENT -> {}
                default -> log.debug("Unexpected from-import child '{}'", child.getType());
            }
        }
    }

    private void bindAlias(TSNode aliasedImport) {
        var alias = field(aliasedImport, "alias");
        if (alias != null) {
            bind(tree.text(alias));
        } else {
            var name = field(aliasedImport, "name");
            if (name != null) {
                bind(DOT_SPLITTER.split(tree.text(name)).iterator().next());
            }
        }
    }

    private void visitGlobal(TSNode node) {
        var scope = innermostBindingScope();
        if (scope == null) {
            log.debug("Ignoring global declaration at module level");
            return;
        }
        for (var name : declaredNames(node)) {
            scope.declareGlobal(name);
        }
    }

    private void visitNonlocal(TSNode node) {
        var scope = innermostBindingScope();
        if (scope == null) {
            log.debug("Ignoring nonlocal declaration at module level");
            return;
        }
        for (var name : declaredNames(node)) {
            scope.declareNonlocal(name);
        }
    }

    private List<String> declaredNames(TSNode node) {
        var names = new ArrayList<String>();
        for (var child : children(node)) {
            if (PythonNodeKind.of(child) == PythonNodeKind.IDENTIFIER) {
                names.add(tree.text(child));
            }
        }
        return names;
    }

    // ---------------------------------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------------------------------

    /** Named children without comments, which tree-sitter attaches wherever they occur. */
    private static List<TSNode> children(@Nullable TSNode node) {
        var children = new ArrayList<TSNode>();
        for (var child : ASTTraversalUtils.namedChildren(node)) {
            if (!COMMENT.equals(child.getType())) {
                children.add(child);
            }
        }
        return children;
    }

    private static boolean sameNode(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }
}
