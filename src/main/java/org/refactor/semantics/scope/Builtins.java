package org.refactor.semantics.scope;

import java.util.HashSet;
import java.util.Set;

/**
 * Platform names that are never reported as unresolved.
 */
public final class Builtins {

    private Builtins() {}

    public static final Set<String> JAVASCRIPT = Set.of(
            "globalThis", "window", "self", "global",
            "console",
            "setTimeout", "clearTimeout", "setInterval", "clearInterval", "setImmediate", "clearImmediate",
            "atob", "btoa",
            "fetch", "Request", "Response", "Headers",
            "URL", "URLSearchParams",
            "Event", "CustomEvent", "EventTarget",
            "document", "navigator", "location", "history",
            "process", "Buffer", "__dirname", "__filename", "module", "exports", "require",
            "Object", "Array", "String", "Number", "Boolean", "Symbol", "BigInt",
            "Function", "Date", "RegExp", "Error", "TypeError", "RangeError",
            "SyntaxError", "ReferenceError", "EvalError", "URIError",
            "Map", "Set", "WeakMap", "WeakSet", "Promise", "Proxy", "Reflect",
            "ArrayBuffer", "SharedArrayBuffer", "DataView",
            "Int8Array", "Uint8Array", "Uint8ClampedArray", "Int16Array", "Uint16Array",
            "Int32Array", "Uint32Array", "Float32Array", "Float64Array", "BigInt64Array", "BigUint64Array",
            "eval", "isFinite", "isNaN", "parseFloat", "parseInt",
            "decodeURI", "decodeURIComponent", "encodeURI", "encodeURIComponent",
            "Math", "JSON", "Intl",
            "undefined", "NaN", "Infinity");

    /** Implicitly imported {@code java.lang} types. */
    public static final Set<String> JAVA_LANG = Set.of(
            "Object", "String", "StringBuilder", "StringBuffer", "CharSequence",
            "Boolean", "Byte", "Character", "Short", "Integer", "Long", "Float", "Double", "Number", "Void",
            "Math", "StrictMath", "System", "Runtime", "Thread", "ThreadLocal", "Runnable",
            "Class", "ClassLoader", "Enum", "Record", "Iterable", "Comparable", "AutoCloseable", "Cloneable",
            "Throwable", "Exception", "Error", "RuntimeException",
            "IllegalArgumentException", "IllegalStateException", "NullPointerException",
            "IndexOutOfBoundsException", "ArrayIndexOutOfBoundsException", "ClassCastException",
            "ArithmeticException", "NumberFormatException", "UnsupportedOperationException",
            "InterruptedException", "CloneNotSupportedException", "AssertionError", "StackOverflowError",
            "OutOfMemoryError", "Deprecated", "Override", "SuppressWarnings", "FunctionalInterface",
            "SafeVarargs");

    public static final Set<String> DEFAULT = union(JAVASCRIPT, JAVA_LANG);

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> all = new HashSet<>(a);
        all.addAll(b);
        return Set.copyOf(all);
    }
}
