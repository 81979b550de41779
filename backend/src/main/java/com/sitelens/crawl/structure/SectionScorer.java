package com.sitelens.crawl.structure;

import com.sitelens.crawl.model.SectionStats;
import com.sitelens.crawl.model.SectionType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Linear scoring of a candidate region. Every term is clamped to [0,1] before weighting and the
 * final score and confidence are clamped to [0,1].
 */
public class SectionScorer {
    private final ScoringWeights weights;

    public SectionScorer(ScoringWeights weights) {
        this.weights = weights == null ? ScoringWeights.defaults() : weights;
    }

    public boolean shouldPromoteToArticle(SectionStats stats) {
        return stats.textLength() > weights.getPromotionMinLength()
            && stats.densityScore() > weights.getPromotionMinDensity();
    }

    public double score(SectionStats stats, SectionType type) {
        return clamp(rawScore(terms(stats, type)));
    }

    /**
     * Weighted contribution of each scoring term, keyed by term name.
     */
    public Map<String, Double> terms(SectionStats stats, SectionType type) {
        Map<String, Double> terms = new LinkedHashMap<>();
        switch (type) {
            case ARTICLE, MAIN_CONTENT -> {
                terms.put("density", weights.getContentDensity() * clamp(stats.densityScore()));
                terms.put("linkSparsity", weights.getContentLinkSparsity() * (1.0 - clamp(stats.linkDensity())));
                terms.put("paragraphs", weights.getContentParagraphs()
                    * ratio(stats.paragraphCount(), weights.getContentParagraphCap()));
                terms.put("length", weights.getContentLength()
                    * ratio(stats.textLength(), weights.getContentLengthCap()));
            }
            case SIDEBAR -> {
                terms.put("links", weights.getSidebarLinks() * ratio(stats.linkCount(), weights.getSidebarLinkCap()));
                terms.put("brevity", weights.getSidebarBrevity()
                    * (1.0 - ratio(stats.textLength(), weights.getSidebarLengthCap())));
            }
            case NAVIGATION, HEADER, FOOTER -> {
                terms.put("linkDensity", weights.getChromeLinkDensity() * clamp(stats.linkDensity()));
                terms.put("brevity", weights.getChromeBrevity()
                    * (1.0 - ratio(stats.textLength(), weights.getChromeLengthCap())));
            }
            case COMMENTS -> {
                terms.put("elements", weights.getCommentsElements()
                    * ratio(stats.elementCount(), weights.getCommentsElementCap()));
                double spread = Math.abs(stats.textLength() - (double) weights.getCommentsLengthPivot())
                    / weights.getCommentsSpreadCap();
                terms.put("lengthSpread", weights.getCommentsLengthSpread() * clamp(spread));
            }
            default -> terms.put("base", weights.getUnknownScore());
        }
        return terms;
    }

    public double rawScore(Map<String, Double> terms) {
        double total = 0.0;
        for (double value : terms.values()) {
            total += value;
        }
        return total;
    }

    public double confidence(SectionStats stats, SectionType type) {
        double confidence = weights.getConfidenceBase();
        confidence += weights.getConfidenceWords() * ratio(stats.wordCount(), weights.getConfidenceWordCap());
        if (type.isContent()) {
            confidence += weights.getConfidenceParagraphs()
                * ratio(stats.paragraphCount(), weights.getContentParagraphCap());
        }
        if (stats.linkDensity() > weights.getBalancedLinkDensityMin()
            && stats.linkDensity() < weights.getBalancedLinkDensityMax()) {
            confidence += weights.getBalancedLinkDensityBonus();
        }
        return clamp(confidence);
    }

    private static double ratio(int value, int cap) {
        return Math.min(Math.max(0, value), cap) / (double) cap;
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, value));
    }
}
