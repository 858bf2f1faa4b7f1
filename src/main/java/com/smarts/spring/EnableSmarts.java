package com.smarts.spring;

import com.smarts.adapter.spring.SmartsAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Registers the SMARTS parser, JSON writer and optional pattern library beans
 * in contexts that do not use auto-configuration discovery.
 * <pre>
 * &#64;Configuration
 * &#64;EnableSmarts
 * class ChemistryConfig {
 * }
 * </pre>
 * Limits and the library path are read from the {@code smarts.*} properties.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(SmartsAutoConfiguration.class)
public @interface EnableSmarts {
}
