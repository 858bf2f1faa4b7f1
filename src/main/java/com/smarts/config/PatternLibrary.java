package com.smarts.config;

import com.smarts.exception.ConfigurationException;

import java.util.List;
import java.util.Optional;

/**
 * Named SMARTS patterns loaded from a library file.
 *
 * @param name     Library name
 * @param patterns Patterns that parsed, in file order
 * @param failed   Names of entries that failed to parse (lenient libraries only)
 */
public record PatternLibrary(
        String name,
        List<NamedPattern> patterns,
        List<String> failed
) {
    public PatternLibrary {
        patterns = List.copyOf(patterns);
        failed = List.copyOf(failed);
    }

    /**
     * Find pattern by name.
     */
    public Optional<NamedPattern> find(String patternName) {
        return patterns.stream()
                .filter(p -> p.name().equals(patternName))
                .findFirst();
    }

    /**
     * Get pattern by name.
     *
     * @throws ConfigurationException if the library has no such pattern
     */
    public NamedPattern get(String patternName) {
        return find(patternName).orElseThrow(() -> new ConfigurationException(
                "Pattern '" + patternName + "' not found in library '" + name + "'"));
    }

    public int size() {
        return patterns.size();
    }
}
