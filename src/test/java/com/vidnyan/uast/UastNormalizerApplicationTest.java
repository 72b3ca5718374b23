package com.vidnyan.uast;

import com.vidnyan.uast.application.port.in.NormalizeTreeUseCase;
import com.vidnyan.uast.application.port.in.NormalizeTreeUseCase.NormalizationRequest;
import com.vidnyan.uast.application.port.in.NormalizeTreeUseCase.NormalizationResult;
import com.vidnyan.uast.application.port.out.RuleTableRepository;
import com.vidnyan.uast.domain.node.UastRole;
import com.vidnyan.uast.testing.SampleTrees;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class UastNormalizerApplicationTest {

    @Autowired
    private NormalizeTreeUseCase normalizeTreeUseCase;

    @Autowired
    private RuleTableRepository ruleTableRepository;

    @Autowired
    private NormalizerProperties properties;

    @Test
    void context_ShouldLoadRuleTablesFromClasspath() {
        assertTrue(ruleTableRepository.findByLanguage("python").isPresent());
        assertTrue(properties.isLogPositionWarnings());
    }

    @Test
    void normalize_ShouldRunWholePipeline() {
        NormalizationResult result = normalizeTreeUseCase.normalize(
                NormalizationRequest.of("python", SampleTrees.callWithComparison(), SampleTrees.CALL_SOURCE));

        assertTrue(result.isSuccess());
        assertTrue(result.root().hasRole(UastRole.FILE));
        assertEquals(10, result.root().child("body").child("value").start().orElseThrow().offset());
    }
}
