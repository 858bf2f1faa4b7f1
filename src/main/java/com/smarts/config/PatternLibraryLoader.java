package com.smarts.config;

import com.smarts.ast.SmartsPattern;
import com.smarts.exception.ConfigurationException;
import com.smarts.exception.SmartsSyntaxException;
import com.smarts.parser.SmartsParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads pattern libraries from YAML files.
 * <pre>
 * smarts:
 *   name: functional-groups
 *   strict: true
 *   parser:
 *     max-length: 1024
 *     max-recursion-depth: 8
 *   defines:
 *     carbonyl: "[CX3]=[OX1]"
 *   patterns:
 *     - name: amide
 *       smarts: "[$carbonyl][NX3]"
 * </pre>
 * A {@code $name} reference expands to {@code $(definition)}. Definitions may refer to
 * definitions declared above them.
 */
public class PatternLibraryLoader {

    private static final Logger log = LoggerFactory.getLogger(PatternLibraryLoader.class);

    private static final Pattern REFERENCE = Pattern.compile("\\$([A-Za-z0-9_]+)");

    /**
     * Load a library from a path, using the parser limits declared in the file or the defaults.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the library file
     * @return Loaded library
     */
    public static PatternLibrary load(String path) {
        return load(path, null);
    }

    /**
     * Load a library from a path.
     *
     * @param path   Path to the library file
     * @param parser Parser used when the file declares no parser section, may be null
     * @return Loaded library
     */
    public static PatternLibrary load(String path, SmartsParser parser) {
        log.info("Loading SMARTS library from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream, parser);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load SMARTS library from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static PatternLibrary parseYaml(InputStream inputStream, SmartsParser fallbackParser) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("SMARTS library file is empty");
        }

        // The library may sit at the root or under a 'smarts' key
        Map<String, Object> libraryMap = root.containsKey("smarts")
                ? (Map<String, Object>) root.get("smarts")
                : root;

        String name = getString(libraryMap, "name", "default-library");
        boolean strict = getBoolean(libraryMap, "strict", true);

        Map<String, Object> parserMap = (Map<String, Object>) libraryMap.get("parser");
        SmartsParser parser = parserMap != null
                ? new SmartsParser(parseParserConfig(parserMap))
                : fallbackParser != null ? fallbackParser : new SmartsParser();

        Map<String, String> defines = parseDefines((Map<String, Object>) libraryMap.get("defines"));

        List<Map<String, Object>> patternList = (List<Map<String, Object>>) libraryMap.get("patterns");
        if (patternList == null || patternList.isEmpty()) {
            log.warn("SMARTS library '{}' declares no patterns", name);
            patternList = List.of();
        }

        List<NamedPattern> patterns = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < patternList.size(); i++) {
            Map<String, Object> entry = patternList.get(i);
            String patternName = getString(entry, "name", "pattern-" + (i + 1));
            String source = getString(entry, "smarts", null);

            if (source == null) {
                throw new ConfigurationException("Pattern '" + patternName + "' has no smarts");
            }
            if (!names.add(patternName)) {
                throw new ConfigurationException("Duplicate pattern name '" + patternName
                        + "' in library '" + name + "'");
            }

            String expanded = expand(source, defines, patternName);
            try {
                SmartsPattern pattern = parser.parse(expanded);
                patterns.add(new NamedPattern(patternName, source, expanded, pattern));
                log.debug("Parsed pattern '{}': {}", patternName, expanded);
            } catch (SmartsSyntaxException e) {
                if (strict) {
                    throw new ConfigurationException("Pattern '" + patternName + "' in library '"
                            + name + "' is invalid: " + e.getMessage(), e);
                }
                log.warn("Skipping invalid pattern '{}' in library '{}': {}", patternName, name, e.getMessage());
                failed.add(patternName);
            }
        }

        log.info("Loaded SMARTS library: {} with {} patterns, {} defines, {} failed",
                name, patterns.size(), defines.size(), failed.size());

        return new PatternLibrary(name, patterns, failed);
    }

    private static SmartsParserConfig parseParserConfig(Map<String, Object> map) {
        return new SmartsParserConfig(
                getInt(map, "max-length", SmartsParserConfig.DEFAULT_MAX_LENGTH),
                getInt(map, "max-recursion-depth", SmartsParserConfig.DEFAULT_MAX_RECURSION_DEPTH)
        );
    }

    /**
     * Resolve definitions in declaration order; each may only use those declared before it.
     */
    private static Map<String, String> parseDefines(Map<String, Object> map) {
        Map<String, String> resolved = new LinkedHashMap<>();
        if (map == null) {
            return resolved;
        }
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String tag = entry.getKey();
            if (entry.getValue() == null) {
                throw new ConfigurationException("Define '" + tag + "' has no value");
            }
            resolved.put(tag, expand(entry.getValue().toString(), resolved, "define " + tag));
        }
        return resolved;
    }

    static String expand(String smarts, Map<String, String> defines, String owner) {
        Matcher matcher = REFERENCE.matcher(smarts);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String tag = matcher.group(1);
            String definition = defines.get(tag);
            if (definition == null) {
                throw new ConfigurationException("Unknown define '$" + tag + "' in " + owner);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement("$(" + definition + ")"));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.parseInt(value.toString());
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
