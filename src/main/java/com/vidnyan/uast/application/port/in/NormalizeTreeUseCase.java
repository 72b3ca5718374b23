package com.vidnyan.uast.application.port.in;

import com.vidnyan.uast.domain.node.AnnotatedNode;
import com.vidnyan.uast.domain.node.NativeNode;
import com.vidnyan.uast.domain.position.PositionWarning;

import java.util.List;

/**
 * Primary use case: turn a native parse tree into a role-annotated, positioned tree.
 * This is the main entry point to the application.
 */
public interface NormalizeTreeUseCase {

    /**
     * Annotate and position one tree.
     * @param request language, native tree and source text
     * @return the normalized tree, or the structural error that rejected it
     * @throws IllegalArgumentException if no rule table is registered for the language
     */
    NormalizationResult normalize(NormalizationRequest request);

    /**
     * Normalization request parameters.
     */
    record NormalizationRequest(
        String language,
        NativeNode root,
        String sourceText
    ) {
        public static NormalizationRequest of(String language, NativeNode root, String sourceText) {
            return new NormalizationRequest(language, root, sourceText);
        }
    }

    /**
     * Normalization result. A rejected result never carries a tree.
     */
    record NormalizationResult(
        Status status,
        AnnotatedNode root,
        List<PositionWarning> warnings,
        String errorMessage,
        String errorPath,
        NormalizationStats stats
    ) {

        public enum Status {
            SUCCESS,
            REJECTED
        }

        /**
         * Create a successful result.
         */
        public static NormalizationResult success(AnnotatedNode root, List<PositionWarning> warnings,
                                                  NormalizationStats stats) {
            return new NormalizationResult(Status.SUCCESS, root, List.copyOf(warnings), null, null, stats);
        }

        /**
         * Create a rejected result.
         */
        public static NormalizationResult rejected(String message, String path, NormalizationStats stats) {
            return new NormalizationResult(Status.REJECTED, null, List.of(), message, path, stats);
        }

        public boolean isSuccess() {
            return status == Status.SUCCESS;
        }

        public boolean hasWarnings() {
            return !warnings.isEmpty();
        }
    }

    /**
     * Normalization statistics.
     */
    record NormalizationStats(
        int nodes,
        int unannotatedNodes,
        long durationMs
    ) {}
}
