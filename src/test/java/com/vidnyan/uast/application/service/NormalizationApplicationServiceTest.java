package com.vidnyan.uast.application.service;

import com.vidnyan.uast.NormalizerProperties;
import com.vidnyan.uast.application.port.in.NormalizeTreeUseCase.NormalizationRequest;
import com.vidnyan.uast.application.port.in.NormalizeTreeUseCase.NormalizationResult;
import com.vidnyan.uast.application.port.out.RuleTableRepository;
import com.vidnyan.uast.domain.annotation.Annotator;
import com.vidnyan.uast.domain.node.AnnotatedNode;
import com.vidnyan.uast.domain.node.NativeNode;
import com.vidnyan.uast.domain.node.Position;
import com.vidnyan.uast.domain.node.UastRole;
import com.vidnyan.uast.domain.position.PositionResolver;
import com.vidnyan.uast.domain.rule.RuleTable;
import com.vidnyan.uast.testing.SampleTrees;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationApplicationServiceTest {

    private final RuleTableRepository repository = new RuleTableRepository() {
        @Override
        public Optional<RuleTable> findByLanguage(String language) {
            return "python".equals(language) ? Optional.of(SampleTrees.PYTHON) : Optional.empty();
        }

        @Override
        public List<RuleTable> findAll() {
            return List.of(SampleTrees.PYTHON);
        }
    };

    private final NormalizerProperties properties = new NormalizerProperties();

    private final NormalizationApplicationService service = new NormalizationApplicationService(
            repository, new Annotator(), new PositionResolver(), properties);

    @Test
    void normalize_ShouldAnnotateThenPosition() {
        NormalizationResult result = service.normalize(
                NormalizationRequest.of("python", SampleTrees.assignment(), SampleTrees.ASSIGNMENT_SOURCE));

        assertTrue(result.isSuccess());
        assertFalse(result.hasWarnings());
        AnnotatedNode binOp = result.root().child("body").child("value");
        assertTrue(binOp.hasRole(UastRole.BINARY));
        assertEquals(new Position(4, 1, 4), binOp.start().orElseThrow());
        assertEquals(7, result.stats().nodes());
        assertEquals(0, result.stats().unannotatedNodes());
    }

    @Test
    void normalize_ShouldRejectWrongRootWithoutTree() {
        NativeNode expression = NativeNode.builder("Expression").build();

        NormalizationResult result = service.normalize(NormalizationRequest.of("python", expression, ""));

        assertEquals(NormalizationResult.Status.REJECTED, result.status());
        assertNull(result.root());
        assertEquals("root must be of kind Module", result.errorMessage());
        assertEquals("Expression", result.errorPath());
    }

    @Test
    void normalize_ShouldReturnPositionWarningsWithTree() {
        NativeNode tree = NativeNode.builder("Module")
                .children("body", NativeNode.builder("Pass").position(5, 0).build())
                .build();

        NormalizationResult result = service.normalize(NormalizationRequest.of("python", tree, "pass\n"));

        assertTrue(result.isSuccess());
        assertEquals(1, result.warnings().size());
        assertEquals(1, result.stats().unannotatedNodes());
        assertEquals(Position.START, result.root().child("body").start().orElseThrow());
    }

    @Test
    void normalize_ShouldSkipPositionsWhenDisabled() {
        properties.setResolvePositions(false);

        NormalizationResult result = service.normalize(
                NormalizationRequest.of("python", SampleTrees.assignment(), SampleTrees.ASSIGNMENT_SOURCE));

        assertTrue(result.isSuccess());
        assertTrue(result.root().preOrder().stream().allMatch(n -> n.start().isEmpty()));
    }

    @Test
    void normalize_ShouldFailForUnknownLanguage() {
        NormalizationRequest request = NormalizationRequest.of("cobol", SampleTrees.assignment(), "");

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> service.normalize(request));
        assertTrue(error.getMessage().contains("cobol"));
    }
}
