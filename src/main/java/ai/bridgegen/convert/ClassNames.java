package ai.bridgegen.convert;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregate names discovered so far in one conversion pass, used to turn the
 * binding generator's flattened method names ({@code Class_method}) back into
 * method names. Only grows.
 */
public final class ClassNames {

    private final Set<String> names = new LinkedHashSet<>();

    public void registerType(String name) {
        Objects.requireNonNull(name, "name");
        names.add(name);
    }

    /**
     * Strips the longest {@code Class_} prefix matching a discovered class.
     * Returns the name unchanged when no prefix matches or nothing would be left.
     */
    public String stripClassPrefix(String functionName) {
        Objects.requireNonNull(functionName, "functionName");
        String best = null;
        int bestLen = -1;

        for (String cn : names) {
            final String prefix = cn + "_";
            if (functionName.startsWith(prefix) && functionName.length() > prefix.length()) {
                if (prefix.length() > bestLen) {
                    bestLen = prefix.length();
                    best = cn;
                }
            }
        }

        if (best == null) {
            return functionName;
        }
        return functionName.substring(bestLen);
    }
}
