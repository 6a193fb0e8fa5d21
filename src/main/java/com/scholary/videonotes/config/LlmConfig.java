package com.scholary.videonotes.config;

import com.scholary.videonotes.llm.LlmProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the language model client.
 *
 * <p>Enables the LlmProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(LlmProperties.class)
public class LlmConfig {}
