package com.vidnyan.uast.application.service;

import com.vidnyan.uast.NormalizerProperties;
import com.vidnyan.uast.application.port.in.NormalizeTreeUseCase;
import com.vidnyan.uast.application.port.out.RuleTableRepository;
import com.vidnyan.uast.domain.annotation.Annotator;
import com.vidnyan.uast.domain.annotation.StructuralException;
import com.vidnyan.uast.domain.node.AnnotatedNode;
import com.vidnyan.uast.domain.position.PositionResolver;
import com.vidnyan.uast.domain.position.PositionWarning;
import com.vidnyan.uast.domain.position.PositionedTree;
import com.vidnyan.uast.domain.rule.RuleTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Runs the normalization pipeline: annotation, then position resolution.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NormalizationApplicationService implements NormalizeTreeUseCase {

    private final RuleTableRepository ruleTableRepository;
    private final Annotator annotator;
    private final PositionResolver positionResolver;
    private final NormalizerProperties properties;

    @Override
    public NormalizationResult normalize(NormalizationRequest request) {
        Objects.requireNonNull(request.root(), "root");
        Instant startTime = Instant.now();

        RuleTable table = ruleTableRepository.findByLanguage(request.language())
                .orElseThrow(() -> new IllegalArgumentException(
                        "No rule table registered for language: " + request.language()));

        // Step 1: attach roles
        AnnotatedNode annotated;
        try {
            annotated = annotator.annotate(table, request.root());
        } catch (StructuralException e) {
            log.info("Rejected {} tree at {}: {}", table.language(), e.getNodePath(), e.getMessage());
            return NormalizationResult.rejected(e.getMessage(), e.getNodePath(),
                    new NormalizationStats(request.root().size(), 0, elapsed(startTime)));
        }

        // Step 2: fill offsets
        List<PositionWarning> warnings = List.of();
        if (properties.isResolvePositions()) {
            PositionedTree positioned = positionResolver.resolvePositions(
                    Objects.requireNonNullElse(request.sourceText(), ""), annotated);
            annotated = positioned.root();
            warnings = positioned.warnings();
        }

        List<AnnotatedNode> nodes = annotated.preOrder();
        int unannotated = (int) nodes.stream().filter(n -> n.roles().isEmpty()).count();
        NormalizationStats stats = new NormalizationStats(nodes.size(), unannotated, elapsed(startTime));
        log.debug("Normalized {} tree: {} nodes, {} without roles, {} position warnings in {}ms",
                table.language(), stats.nodes(), stats.unannotatedNodes(), warnings.size(), stats.durationMs());
        return NormalizationResult.success(annotated, warnings, stats);
    }

    private static long elapsed(Instant startTime) {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
