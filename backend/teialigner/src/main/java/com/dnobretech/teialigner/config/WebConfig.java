package com.dnobretech.teialigner.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;


@Configuration
public class WebConfig {

    // browser clients (notebooks, editors) post TEI straight to the aligner
    @Bean
    public CorsFilter corsFilter(@Value("${teialigner.cors.allowed-origins:*}") List<String> allowedOrigins) {
        CorsConfiguration c = new CorsConfiguration();
        allowedOrigins.forEach(c::addAllowedOriginPattern);
        c.addAllowedHeader("*");
        c.addAllowedMethod(HttpMethod.GET);
        c.addAllowedMethod(HttpMethod.POST);
        c.addAllowedMethod(HttpMethod.OPTIONS);
        c.addExposedHeader("X-Processing-Time");
        UrlBasedCorsConfigurationSource s = new UrlBasedCorsConfigurationSource();
        s.registerCorsConfiguration("/align/**", c);
        s.registerCorsConfiguration("/health", c);
        s.registerCorsConfiguration("/", c);
        return new CorsFilter(s);
    }
}
