package com.vidnyan.uast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * UAST Normalizer - turns language-specific parse trees into role-annotated universal trees.
 *
 * Rule tables are loaded at startup; {@code NormalizeTreeUseCase} is the entry point.
 */
@SpringBootApplication
public class UastNormalizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(UastNormalizerApplication.class, args);
    }
}
