package com.sitelens.crawl.structure;

import com.sitelens.crawl.model.SectionStats;
import com.sitelens.crawl.model.SectionType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SectionScorerTest {
    private final SectionScorer scorer = new SectionScorer(ScoringWeights.defaults());

    @Test
    void articleFavorsDenseLinkFreeText() {
        SectionStats stats = stats(1000, 180, 0, 5, 1.0, 0.0, 20);

        assertThat(scorer.score(stats, SectionType.ARTICLE)).isCloseTo(0.74, within(1e-9));
        assertThat(scorer.score(stats, SectionType.MAIN_CONTENT)).isCloseTo(0.74, within(1e-9));
        assertThat(scorer.confidence(stats, SectionType.ARTICLE)).isCloseTo(0.672, within(1e-9));
    }

    @Test
    void navigationFavorsShortLinkHeavyRegions() {
        SectionStats stats = stats(40, 6, 8, 0, 1.0, 10.0, 17);

        assertThat(scorer.score(stats, SectionType.NAVIGATION)).isCloseTo(0.776, within(1e-9));
        assertThat(scorer.score(stats, SectionType.FOOTER)).isCloseTo(0.776, within(1e-9));
    }

    @Test
    void sidebarTermsAreCapped() {
        SectionStats stats = stats(3000, 400, 30, 0, 1.0, 0.5, 90);

        assertThat(scorer.score(stats, SectionType.SIDEBAR)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void commentsRewardElementCountAndLengthSpread() {
        assertThat(scorer.score(stats(500, 90, 0, 0, 1.0, 0.0, 100), SectionType.COMMENTS))
            .isCloseTo(0.4, within(1e-9));
        assertThat(scorer.score(stats(3000, 500, 0, 0, 1.0, 0.0, 100), SectionType.COMMENTS))
            .isCloseTo(0.7, within(1e-9));
    }

    @Test
    void unknownTypesGetFixedScore() {
        assertThat(scorer.score(stats(10, 2, 0, 0, 0.5, 0.0, 3), SectionType.UNKNOWN)).isEqualTo(0.5);
        assertThat(scorer.score(stats(10, 2, 0, 0, 0.5, 0.0, 3), SectionType.ADVERTISEMENTS)).isEqualTo(0.5);
    }

    @Test
    void balancedLinkDensityEarnsConfidenceBonus() {
        SectionStats balanced = stats(1000, 0, 4, 0, 1.0, 0.2, 20);
        SectionStats sparse = stats(1000, 0, 0, 0, 1.0, 0.0, 20);

        assertThat(scorer.confidence(balanced, SectionType.SIDEBAR)).isCloseTo(0.6, within(1e-9));
        assertThat(scorer.confidence(sparse, SectionType.SIDEBAR)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void promotionRequiresLongDenseText() {
        assertThat(scorer.shouldPromoteToArticle(stats(501, 80, 0, 3, 0.71, 0.0, 10))).isTrue();
        assertThat(scorer.shouldPromoteToArticle(stats(500, 80, 0, 3, 0.9, 0.0, 10))).isFalse();
        assertThat(scorer.shouldPromoteToArticle(stats(900, 80, 0, 3, 0.7, 0.0, 10))).isFalse();
    }

    @Test
    void tunedWeightsStillProduceClampedScores() {
        ScoringWeights weights = new ScoringWeights();
        weights.setContentDensity(2.0);
        weights.setContentLinkSparsity(2.0);
        weights.setConfidenceBase(3.0);
        SectionScorer tuned = new SectionScorer(weights);
        SectionStats stats = stats(1000, 180, 0, 5, 1.0, 0.0, 20);

        assertThat(tuned.score(stats, SectionType.ARTICLE)).isEqualTo(1.0);
        assertThat(tuned.rawScore(tuned.terms(stats, SectionType.ARTICLE))).isGreaterThan(1.0);
        assertThat(tuned.confidence(stats, SectionType.ARTICLE)).isEqualTo(1.0);
    }

    private static SectionStats stats(
        int textLength,
        int wordCount,
        int linkCount,
        int paragraphCount,
        double density,
        double linkDensity,
        int elementCount
    ) {
        return new SectionStats(textLength, wordCount, linkCount, 0, paragraphCount, 0, density, linkDensity, elementCount);
    }
}
