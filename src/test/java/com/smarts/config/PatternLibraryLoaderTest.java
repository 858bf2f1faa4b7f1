package com.smarts.config;

import com.smarts.exception.ConfigurationException;
import com.smarts.exception.SmartsSyntaxException;
import com.smarts.parser.SmartsParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PatternLibraryLoader.
 */
class PatternLibraryLoaderTest {

    // =====================================================================
    // Loading from files
    // =====================================================================

    @Test
    @DisplayName("Should load a strict library from the classpath")
    void shouldLoadClasspathLibrary() {
        PatternLibrary library = PatternLibraryLoader.load("classpath:libraries/functional-groups.yaml");

        assertEquals("functional-groups", library.name());
        assertEquals(5, library.size());
        assertTrue(library.failed().isEmpty());
        assertEquals(List.of("ketone", "amide", "benzene", "halide", "acyl"),
                library.patterns().stream().map(NamedPattern::name).toList());
    }

    @Test
    @DisplayName("Should expand define references before parsing")
    void shouldExpandDefines() {
        PatternLibrary library = PatternLibraryLoader.load("classpath:libraries/functional-groups.yaml");

        NamedPattern amide = library.get("amide");
        assertEquals("[$carbonyl][NX3]", amide.source());
        assertEquals("[$([CX3]=[OX1])][NX3]", amide.expanded());
        assertEquals(new SmartsParser().parse("[$([CX3]=[OX1])][NX3]"), amide.pattern());

        assertEquals("[$([$([CX3]=[OX1])])]C", library.get("acyl").expanded());
    }

    @Test
    @DisplayName("Should keep patterns without references unchanged")
    void shouldKeepPlainPatterns() {
        PatternLibrary library = PatternLibraryLoader.load("classpath:libraries/functional-groups.yaml");

        NamedPattern ketone = library.get("ketone");
        assertEquals(ketone.source(), ketone.expanded());
        assertEquals(3, ketone.pattern().branches().size());
    }

    @Test
    @DisplayName("Should look up patterns by name")
    void shouldLookUpByName() {
        PatternLibrary library = PatternLibraryLoader.load("classpath:libraries/functional-groups.yaml");

        assertTrue(library.find("benzene").isPresent());
        assertTrue(library.find("nitrile").isEmpty());
        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> library.get("nitrile"));
        assertTrue(ex.getMessage().contains("nitrile"));
    }

    @Test
    @DisplayName("Lenient library should skip invalid patterns")
    void lenientLibrarySkipsInvalidPatterns() {
        PatternLibrary library = PatternLibraryLoader.load("classpath:libraries/lenient.yaml");

        assertEquals("lenient-library", library.name());
        assertEquals(1, library.size());
        assertEquals("ethanol", library.patterns().get(0).name());
        assertEquals(List.of("broken-ring", "unknown-element"), library.failed());
    }

    @Test
    @DisplayName("Strict library should fail on the first invalid pattern")
    void strictLibraryFailsOnInvalidPattern() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> PatternLibraryLoader.load("classpath:libraries/strict-invalid.yaml"));

        assertTrue(ex.getMessage().contains("'unclosed'"));
        assertTrue(ex.getMessage().contains("'strict-library'"));
        assertInstanceOf(SmartsSyntaxException.class, ex.getCause());
    }

    @Test
    @DisplayName("Should fail for a missing file")
    void shouldFailForMissingFile() {
        assertThrows(ConfigurationException.class,
                () -> PatternLibraryLoader.load("classpath:libraries/does-not-exist.yaml"));
        assertThrows(ConfigurationException.class,
                () -> PatternLibraryLoader.load("/nonexistent/smarts-library.yaml"));
    }

    // =====================================================================
    // Library contents
    // =====================================================================

    @Test
    @DisplayName("Should reject an empty file")
    void shouldRejectEmptyFile() {
        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> parse(""));

        assertEquals("SMARTS library file is empty", ex.getMessage());
    }

    @Test
    @DisplayName("Should accept a library without patterns")
    void shouldAcceptLibraryWithoutPatterns() {
        PatternLibrary library = parse("strict: true\n");

        assertEquals("default-library", library.name());
        assertEquals(0, library.size());
    }

    @Test
    @DisplayName("Should reject duplicate pattern names")
    void shouldRejectDuplicateNames() {
        String yaml = """
                patterns:
                  - name: alcohol
                    smarts: "[OX2H]"
                  - name: alcohol
                    smarts: "[CX4][OX2H]"
                """;

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> parse(yaml));
        assertTrue(ex.getMessage().contains("Duplicate pattern name 'alcohol'"));
    }

    @Test
    @DisplayName("Should reject a pattern without smarts")
    void shouldRejectPatternWithoutSmarts() {
        String yaml = """
                patterns:
                  - name: empty
                """;

        assertThrows(ConfigurationException.class, () -> parse(yaml));
    }

    @Test
    @DisplayName("Should reject an unknown define reference")
    void shouldRejectUnknownDefine() {
        String yaml = """
                defines:
                  hydroxyl: "[OX2H]"
                patterns:
                  - name: acid
                    smarts: "[$carboxyl]"
                """;

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> parse(yaml));
        assertTrue(ex.getMessage().contains("$carboxyl"));
    }

    @Test
    @DisplayName("Defines may only refer to earlier defines")
    void definesReferToEarlierDefines() {
        String yaml = """
                defines:
                  acid: "[$hydroxyl]"
                  hydroxyl: "[OX2H]"
                """;
        String selfReference = """
                defines:
                  loop: "[$loop]"
                """;

        assertThrows(ConfigurationException.class, () -> parse(yaml));
        assertThrows(ConfigurationException.class, () -> parse(selfReference));
    }

    @Test
    @DisplayName("Should name unnamed patterns by position")
    void shouldNameUnnamedPatterns() {
        String yaml = """
                patterns:
                  - smarts: "C"
                  - smarts: "N"
                """;

        PatternLibrary library = parse(yaml);
        assertEquals("pattern-2", library.patterns().get(1).name());
    }

    // =====================================================================
    // Parser limits
    // =====================================================================

    @Test
    @DisplayName("Parser section of the file sets the limits")
    void parserSectionSetsLimits() {
        String yaml = """
                strict: false
                parser:
                  max-length: 3
                patterns:
                  - name: short
                    smarts: "CCC"
                  - name: long
                    smarts: "CCCC"
                """;

        PatternLibrary library = parse(yaml);
        assertEquals(List.of("long"), library.failed());
    }

    @Test
    @DisplayName("Fallback parser is used without a parser section")
    void fallbackParserIsUsed() {
        String yaml = """
                strict: false
                patterns:
                  - name: long
                    smarts: "CCCC"
                """;
        SmartsParser parser = new SmartsParser(new SmartsParserConfig(3, SmartsParserConfig.DEFAULT_MAX_RECURSION_DEPTH));

        PatternLibrary library = PatternLibraryLoader.parseYaml(stream(yaml), parser);
        assertEquals(List.of("long"), library.failed());
    }

    @Test
    @DisplayName("Invalid parser limits are rejected")
    void invalidParserLimits() {
        String yaml = """
                parser:
                  max-recursion-depth: 0
                """;

        assertThrows(ConfigurationException.class, () -> parse(yaml));
    }

    // =====================================================================
    // Reference expansion
    // =====================================================================

    @Test
    @DisplayName("Should expand references to recursive patterns")
    void shouldExpandReferences() {
        Map<String, String> defines = Map.of("a", "C=O", "b_2", "N");

        assertEquals("[$(C=O);!$(N)]", PatternLibraryLoader.expand("[$a;!$b_2]", defines, "test"));
    }

    @Test
    @DisplayName("Should leave written recursive patterns alone")
    void shouldLeaveRecursivePatternsAlone() {
        assertEquals("[$(C=O)]", PatternLibraryLoader.expand("[$(C=O)]", Map.of(), "test"));
    }

    private static PatternLibrary parse(String yaml) {
        return PatternLibraryLoader.parseYaml(stream(yaml), null);
    }

    private static InputStream stream(String yaml) {
        return new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
    }
}
