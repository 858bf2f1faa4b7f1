package com.smarts.adapter.spring;

import com.smarts.config.PatternLibrary;
import com.smarts.config.PatternLibraryLoader;
import com.smarts.config.SmartsParserConfig;
import com.smarts.json.SmartsJsonWriter;
import com.smarts.parser.SmartsParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for the SMARTS parser.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "smarts", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(SmartsProperties.class)
public class SmartsAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SmartsAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public SmartsParserConfig smartsParserConfig(SmartsProperties properties) {
        return new SmartsParserConfig(properties.getMaxLength(), properties.getMaxRecursionDepth());
    }

    @Bean
    @ConditionalOnMissingBean
    public SmartsParser smartsParser(SmartsParserConfig config) {
        log.info("Creating SmartsParser: max-length={}, max-recursion-depth={}",
                config.maxLength(), config.maxRecursionDepth());
        return new SmartsParser(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public SmartsJsonWriter smartsJsonWriter() {
        return new SmartsJsonWriter();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "smarts", name = "library-path")
    public PatternLibrary patternLibrary(SmartsProperties properties, SmartsParser parser) {
        return PatternLibraryLoader.load(properties.getLibraryPath(), parser);
    }
}
