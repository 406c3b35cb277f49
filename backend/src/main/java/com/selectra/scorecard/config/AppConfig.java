package com.selectra.scorecard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.selectra.scorecard.rubric.Rubric;
import com.selectra.scorecard.rubric.RubricLoader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

@Configuration
public class AppConfig {

    @Value("${app.cors.allowed-origins:http://localhost:5000}")
    private String allowedOrigins;

    @Value("${selectra.rubric.location:classpath:rubric/rubric.json}")
    private String rubricLocation;

    @Bean
    public CorsFilter corsFilter() {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOrigins(List.of(allowedOrigins.split(",")));
        config.setAllowCredentials(true);
        config.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        config.setAllowedHeaders(List.of("*"));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return new CorsFilter(source);
    }

    @Bean
    public Rubric rubric(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(rubricLocation);
        if (!resource.exists()) {
            throw new IllegalStateException("Rubric resource not found: " + rubricLocation);
        }
        try (InputStream in = resource.getInputStream()) {
            return new RubricLoader(objectMapper).load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read rubric from " + rubricLocation, e);
        }
    }
}
