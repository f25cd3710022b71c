package com.spreadsheet.calc.evaluator;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Functions callable from formulas, with the number of arguments each accepts.
 */
public enum BuiltinFunction {
    SUM(1, Integer.MAX_VALUE),
    AVERAGE(1, Integer.MAX_VALUE),
    MIN(1, Integer.MAX_VALUE),
    MAX(1, Integer.MAX_VALUE),
    COUNT(1, Integer.MAX_VALUE),
    ROUND(2, 2),
    ABS(1, 1),
    SQRT(1, 1),
    CONCATENATE(1, Integer.MAX_VALUE),
    LEN(1, 1),
    UPPER(1, 1),
    LOWER(1, 1),
    TRIM(1, 1),
    IF(2, 3),
    AND(1, Integer.MAX_VALUE),
    OR(1, Integer.MAX_VALUE),
    NOT(1, 1);

    private static final Map<String, BuiltinFunction> BY_NAME;

    static {
        Map<String, BuiltinFunction> byName = new HashMap<>();
        for (BuiltinFunction function : values()) {
            byName.put(function.name(), function);
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final int minArgs;
    private final int maxArgs;

    BuiltinFunction(int minArgs, int maxArgs) {
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    public int getMinArgs() {
        return minArgs;
    }

    public int getMaxArgs() {
        return maxArgs;
    }

    /**
     * Case-insensitive lookup; null when no function has that name.
     */
    public static BuiltinFunction lookup(String name) {
        return name == null ? null : BY_NAME.get(name.toUpperCase(Locale.ROOT));
    }

    public boolean acceptsArgumentCount(int count) {
        return count >= minArgs && count <= maxArgs;
    }

    public String describeArity() {
        if (minArgs == maxArgs) {
            return minArgs == 1 ? "exactly 1 argument" : "exactly " + minArgs + " arguments";
        }
        if (maxArgs == Integer.MAX_VALUE) {
            return minArgs == 1 ? "at least 1 argument" : "at least " + minArgs + " arguments";
        }
        return "between " + minArgs + " and " + maxArgs + " arguments";
    }
}
