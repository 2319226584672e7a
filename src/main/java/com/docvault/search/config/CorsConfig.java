package com.docvault.search.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.List;
import java.util.stream.Stream;

@Configuration
public class CorsConfig {
    private static final List<String> DOCUMENT_METHODS = Stream.of(
            HttpMethod.GET, HttpMethod.POST, HttpMethod.PUT, HttpMethod.DELETE, HttpMethod.OPTIONS)
            .map(HttpMethod::name)
            .toList();

    @Bean
    public CorsWebFilter corsWebFilter(@Value("${cors.allowed-origin-patterns:*}") List<String> originPatterns) {
        CorsConfiguration documents = new CorsConfiguration();
        documents.setAllowedOriginPatterns(originPatterns);
        documents.setAllowedMethods(DOCUMENT_METHODS);
        documents.setAllowedHeaders(List.of("*"));
        documents.setAllowCredentials(false);

        CorsConfiguration readOnly = new CorsConfiguration();
        readOnly.setAllowedOriginPatterns(originPatterns);
        readOnly.setAllowedMethods(List.of(HttpMethod.GET.name(), HttpMethod.OPTIONS.name()));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/documents/**", documents);
        source.registerCorsConfiguration("/health/**", readOnly);
        source.registerCorsConfiguration("/", readOnly);
        return new CorsWebFilter(source);
    }
}
