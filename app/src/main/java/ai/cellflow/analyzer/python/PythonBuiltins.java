package ai.cellflow.analyzer.python;

import java.util.Set;

/** Names provided by Python's {@code builtins} module (CPython 3.12). */
public final class PythonBuiltins {

    private static final Set<String> NAMES = Set.of(
            // functions
            "abs", "aiter", "all", "anext", "any", "ascii", "bin", "breakpoint", "callable", "chr", "compile",
            "delattr", "dir", "divmod", "eval", "exec", "format", "getattr", "globals", "hasattr", "hash", "help",
            "hex", "id", "input", "isinstance", "issubclass", "iter", "len", "locals", "max", "min", "next", "oct",
            "open", "ord", "pow", "print", "repr", "round", "setattr", "sorted", "sum", "vars", "__import__",
            // types
            "bool", "bytearray", "bytes", "classmethod", "complex", "dict", "enumerate", "filter", "float",
            "frozenset", "int", "list", "map", "memoryview", "object", "property", "range", "reversed", "set",
            "slice", "staticmethod", "str", "super", "tuple", "type", "zip",
            // constants
            "Ellipsis", "NotImplemented", "__debug__", "__name__", "__doc__", "__file__", "__builtins__",
            "copyright", "credits", "license", "exit", "quit",
            // exceptions
            "BaseException", "BaseExceptionGroup", "Exception", "ExceptionGroup", "ArithmeticError",
            "AssertionError", "AttributeError", "BlockingIOError", "BrokenPipeError", "BufferError",
            "ChildProcessError", "ConnectionAbortedError", "ConnectionError", "ConnectionRefusedError",
            "ConnectionResetError", "EOFError", "EnvironmentError", "FileExistsError", "FileNotFoundError",
            "FloatingPointError", "GeneratorExit", "IOError", "ImportError", "IndentationError", "IndexError",
            "InterruptedError", "IsADirectoryError", "KeyError", "KeyboardInterrupt", "LookupError", "MemoryError",
            "ModuleNotFoundError", "NameError", "NotADirectoryError", "NotImplementedError", "OSError",
            "OverflowError", "PermissionError", "ProcessLookupError", "RecursionError", "ReferenceError",
            "RuntimeError", "StopAsyncIteration", "StopIteration", "SyntaxError", "SystemError", "SystemExit",
            "TabError", "TimeoutError", "TypeError", "UnboundLocalError", "UnicodeDecodeError",
            "UnicodeEncodeError", "UnicodeError", "UnicodeTranslateError", "ValueError", "ZeroDivisionError",
            // warnings
            "BytesWarning", "DeprecationWarning", "EncodingWarning", "FutureWarning", "ImportWarning",
            "PendingDeprecationWarning", "ResourceWarning", "RuntimeWarning", "SyntaxWarning", "UnicodeWarning",
            "UserWarning", "Warning");

    private PythonBuiltins() {}

    public static boolean isBuiltin(String name) {
        return NAMES.contains(name);
    }

    public static Set<String> names() {
        return NAMES;
    }
}
