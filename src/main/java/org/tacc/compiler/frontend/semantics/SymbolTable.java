package org.tacc.compiler.frontend.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps variable names to their declared type.
 * <p>
 * The language has a single implicit integer type, so every entry currently maps to
 * {@link #DEFAULT_TYPE}. There is one flat scope: both branches of a conditional define into
 * the same table. A table typically outlives one compilation, being seeded from the result of
 * the previous run in a session.
 */
public class SymbolTable {

    /** Type recorded for every assigned or pre-declared variable. */
    public static final String DEFAULT_TYPE = "int";

    private final Map<String, String> symbols = new LinkedHashMap<>();

    /**
     * Creates an empty symbol table.
     */
    public SymbolTable() {
    }

    /**
     * Creates a symbol table seeded with the given entries. The map is copied.
     * @param initialSymbols Name to type entries to start from.
     */
    public SymbolTable(Map<String, String> initialSymbols) {
        symbols.putAll(initialSymbols);
    }

    /**
     * Defines (or redefines) a variable with the default type.
     * @param name The variable name.
     */
    public void define(String name) {
        define(name, DEFAULT_TYPE);
    }

    /**
     * Defines (or redefines) a variable with the given type.
     * @param name The variable name.
     * @param type The type name.
     */
    public void define(String name, String type) {
        symbols.put(name, type);
    }

    public boolean isDefined(String name) {
        return symbols.containsKey(name);
    }

    public Optional<String> typeOf(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    /**
     * @return An unmodifiable snapshot of the entries, in definition order.
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
    }

    @Override
    public String toString() {
        return symbols.toString();
    }
}
