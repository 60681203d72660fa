package com.bsl.dimrank.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.bsl.dimrank.TestConfigs;
import com.bsl.dimrank.config.RetrievalConfig;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FilterParserTest {

    private RetrievalConfig.FilterSettings settings;

    @BeforeEach
    void setUp() {
        settings = TestConfigs.sample().getFilters();
    }

    @Test
    void simpleMapsToLowComplexity() {
        List<FilterConstraint> constraints = FilterParser.parse("A Simple explanation of transformers", settings);

        assertEquals(1, constraints.size());
        FilterConstraint constraint = constraints.get(0);
        assertEquals("simple", constraint.phrase());
        assertEquals(0.8, constraint.confidence(), 1e-9);
        assertEquals(List.of(DimensionTarget.low("complexity")), constraint.targets());
    }

    @Test
    void overlappingPhrasesAreUnionedInDeclarationOrder() {
        List<FilterConstraint> constraints = FilterParser.parse("innovative and advanced methods", settings);

        assertEquals(2, constraints.size());
        assertEquals("advanced", constraints.get(0).phrase());
        assertEquals("innovative", constraints.get(1).phrase());
        assertTrue(constraints.get(0).targets().contains(DimensionTarget.high("technical_depth")));
        assertTrue(constraints.get(1).targets().contains(DimensionTarget.high("novelty")));
    }

    @Test
    void noPhraseYieldsNoConstraints() {
        assertTrue(FilterParser.parse("transformer attention", settings).isEmpty());
    }

    @Test
    void phrasesBelowConfidenceThresholdAreDropped() {
        RetrievalConfig.FilterSettings strict = new RetrievalConfig.FilterSettings(
            true,
            0.9,
            settings.filterStrength(),
            settings.highThreshold(),
            settings.lowThreshold(),
            settings.baseConfidence(),
            List.of(
                new FilterMapping("simple", List.of(DimensionTarget.low("complexity")), null),
                new FilterMapping("peer reviewed", List.of(DimensionTarget.atLeast("credibility", 0.7)), 0.95)
            )
        );

        List<FilterConstraint> constraints = FilterParser.parse("simple peer reviewed papers", strict);

        assertEquals(1, constraints.size());
        assertEquals("peer reviewed", constraints.get(0).phrase());
    }

    @Test
    void disabledParsingReturnsEmpty() {
        RetrievalConfig.FilterSettings disabled = new RetrievalConfig.FilterSettings(
            false,
            settings.confidenceThreshold(),
            settings.filterStrength(),
            settings.highThreshold(),
            settings.lowThreshold(),
            settings.baseConfidence(),
            settings.mappings()
        );

        assertTrue(FilterParser.parse("simple guide", disabled).isEmpty());
    }

    @Test
    void targetsCompareScoresAgainstThresholds() {
        assertTrue(DimensionTarget.low("complexity").isSatisfiedBy(0.5, 0.5, 0.5));
        assertTrue(!DimensionTarget.low("complexity").isSatisfiedBy(0.9, 0.5, 0.5));
        assertTrue(DimensionTarget.high("novelty").isSatisfiedBy(0.5, 0.5, 0.5));
        assertTrue(!DimensionTarget.atLeast("credibility", 0.7).isSatisfiedBy(0.69, 0.5, 0.5));
    }
}
