package com.smarts.adapter.spring;

import com.smarts.config.SmartsParserConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the SMARTS parser.
 */
@ConfigurationProperties(prefix = "smarts")
public class SmartsProperties {

    /**
     * Whether the SMARTS beans are created.
     */
    private boolean enabled = true;

    /**
     * Maximum number of characters in a SMARTS string.
     */
    private int maxLength = SmartsParserConfig.DEFAULT_MAX_LENGTH;

    /**
     * Maximum nesting of recursive $(...) sub-patterns.
     */
    private int maxRecursionDepth = SmartsParserConfig.DEFAULT_MAX_RECURSION_DEPTH;

    /**
     * Path to a pattern library file. No library bean is created when unset.
     * Supports classpath: prefix for classpath resources.
     */
    private String libraryPath;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public void setMaxLength(int maxLength) {
        this.maxLength = maxLength;
    }

    public int getMaxRecursionDepth() {
        return maxRecursionDepth;
    }

    public void setMaxRecursionDepth(int maxRecursionDepth) {
        this.maxRecursionDepth = maxRecursionDepth;
    }

    public String getLibraryPath() {
        return libraryPath;
    }

    public void setLibraryPath(String libraryPath) {
        this.libraryPath = libraryPath;
    }
}
