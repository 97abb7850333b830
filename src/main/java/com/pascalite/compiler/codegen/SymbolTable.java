package com.pascalite.compiler.codegen;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.pascalite.compiler.parser.SourcePosition;

/**
 * Stack of lexical scopes. Names are case-insensitive. A name may be declared
 * once per scope; inner scopes may shadow outer ones.
 */
public final class SymbolTable {

    private static final class Scope {
        final String path;
        final Map<String, Symbol> symbols = new LinkedHashMap<>();

        Scope(String path) {
            this.path = path;
        }
    }

    private final Deque<Scope> scopes = new ArrayDeque<>();

    public SymbolTable() {
        scopes.push(new Scope(""));
    }

    /** Opens the scope of the named procedure, nested in the current one. */
    public void enter(String name) {
        String key = key(name);
        String parent = scopes.peek().path;
        scopes.push(new Scope(parent.isEmpty() ? key : parent + "." + key));
    }

    public void exit() {
        if (scopes.size() == 1) throw new IllegalStateException("cannot exit the global scope");
        scopes.pop();
    }

    public int depth() {
        return scopes.size() - 1;
    }

    /** Dotted slot name for a variable declared in the current scope, e.g. {@code swap.tmp}. */
    public String qualify(String name) {
        String path = scopes.peek().path;
        return path.isEmpty() ? key(name) : path + "." + key(name);
    }

    public void define(Symbol symbol) {
        Map<String, Symbol> current = scopes.peek().symbols;
        Symbol existing = current.get(key(symbol.name));
        if (existing != null) {
            throw new SemanticException(symbol.declaredAt,
                    "Duplicate declaration of '" + symbol.name + "' (already declared as "
                            + existing.kind.describe() + " at line " + existing.declaredAt + ")");
        }
        current.put(key(symbol.name), symbol);
    }

    /** Innermost symbol with this name, or null. */
    public Symbol lookup(String name) {
        String k = key(name);
        for (Scope scope : scopes) {
            Symbol s = scope.symbols.get(k);
            if (s != null) return s;
        }
        return null;
    }

    public Symbol resolve(String name, SourcePosition at) {
        Symbol s = lookup(name);
        if (s == null) throw new SemanticException(at, "Undeclared identifier '" + name + "'");
        return s;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
