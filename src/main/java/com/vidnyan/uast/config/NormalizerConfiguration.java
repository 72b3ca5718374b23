package com.vidnyan.uast.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.uast.NormalizerProperties;
import com.vidnyan.uast.domain.annotation.Annotator;
import com.vidnyan.uast.domain.position.PositionResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the normalizer components.
 * The domain classes carry no framework annotations; they are wired here.
 */
@Configuration
public class NormalizerConfiguration {

    /**
     * ObjectMapper for JSON rule tables.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    public Annotator annotator() {
        return new Annotator();
    }

    @Bean
    public PositionResolver positionResolver(NormalizerProperties properties) {
        return new PositionResolver(properties.isLogPositionWarnings());
    }
}
