package com.spreadsheet.calc.functions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Case-insensitive function table. New functions are added by
 * registration; the evaluator never needs to change.
 */
public class FunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, FunctionDefinition> functions = new ConcurrentHashMap<>();

    /**
     * A registry holding every built-in function.
     */
    public static FunctionRegistry standard() {
        FunctionRegistry registry = new FunctionRegistry();
        LogicalFunctions.register(registry);
        InformationFunctions.register(registry);
        MathFunctions.register(registry);
        StatisticalFunctions.register(registry);
        LookupFunctions.register(registry);
        TextFunctions.register(registry);
        FinancialFunctions.register(registry);
        DateFunctions.register(registry);
        log.debug("Registered {} built-in functions", registry.size());
        return registry;
    }

    /**
     * Adds or replaces a function.
     */
    public void register(FunctionDefinition definition) {
        FunctionDefinition previous = functions.put(definition.getName(), definition);
        if (previous != null) {
            log.debug("Replaced function {}", definition.getName());
        }
    }

    /**
     * Looks a function up by name, ignoring case. Returns null if unknown.
     */
    public FunctionDefinition lookup(String name) {
        return name == null ? null : functions.get(name.toUpperCase());
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    public int size() {
        return functions.size();
    }

    public Map<String, FunctionDefinition> asMap() {
        return Collections.unmodifiableMap(new TreeMap<>(functions));
    }
}
