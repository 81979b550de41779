package com.sitelens.crawl.structure;

/**
 * Coefficients and caps used by {@link SectionScorer}. Bound from {@code sitelens.analysis.weights}
 * so scoring policy can be tuned without touching the scorer.
 */
public class ScoringWeights {
    private double contentDensity = 0.3;
    private double contentLinkSparsity = 0.3;
    private double contentParagraphs = 0.2;
    private double contentLength = 0.2;
    private int contentParagraphCap = 10;
    private int contentLengthCap = 5000;

    private double sidebarLinks = 0.5;
    private double sidebarBrevity = 0.3;
    private int sidebarLinkCap = 20;
    private int sidebarLengthCap = 2000;

    private double chromeLinkDensity = 0.5;
    private double chromeBrevity = 0.3;
    private int chromeLengthCap = 500;

    private double commentsElements = 0.4;
    private double commentsLengthSpread = 0.3;
    private int commentsElementCap = 50;
    private int commentsLengthPivot = 500;
    private int commentsSpreadCap = 2000;

    private double unknownScore = 0.5;

    private double confidenceBase = 0.5;
    private double confidenceWords = 0.2;
    private int confidenceWordCap = 500;
    private double confidenceParagraphs = 0.2;
    private double balancedLinkDensityBonus = 0.1;
    private double balancedLinkDensityMin = 0.1;
    private double balancedLinkDensityMax = 0.3;

    private int promotionMinLength = 500;
    private double promotionMinDensity = 0.7;

    public static ScoringWeights defaults() {
        return new ScoringWeights();
    }

    public double getContentDensity() {
        return contentDensity;
    }

    public void setContentDensity(double contentDensity) {
        this.contentDensity = nonNegative(contentDensity);
    }

    public double getContentLinkSparsity() {
        return contentLinkSparsity;
    }

    public void setContentLinkSparsity(double contentLinkSparsity) {
        this.contentLinkSparsity = nonNegative(contentLinkSparsity);
    }

    public double getContentParagraphs() {
        return contentParagraphs;
    }

    public void setContentParagraphs(double contentParagraphs) {
        this.contentParagraphs = nonNegative(contentParagraphs);
    }

    public double getContentLength() {
        return contentLength;
    }

    public void setContentLength(double contentLength) {
        this.contentLength = nonNegative(contentLength);
    }

    public int getContentParagraphCap() {
        return contentParagraphCap;
    }

    public void setContentParagraphCap(int contentParagraphCap) {
        this.contentParagraphCap = Math.max(1, contentParagraphCap);
    }

    public int getContentLengthCap() {
        return contentLengthCap;
    }

    public void setContentLengthCap(int contentLengthCap) {
        this.contentLengthCap = Math.max(1, contentLengthCap);
    }

    public double getSidebarLinks() {
        return sidebarLinks;
    }

    public void setSidebarLinks(double sidebarLinks) {
        this.sidebarLinks = nonNegative(sidebarLinks);
    }

    public double getSidebarBrevity() {
        return sidebarBrevity;
    }

    public void setSidebarBrevity(double sidebarBrevity) {
        this.sidebarBrevity = nonNegative(sidebarBrevity);
    }

    public int getSidebarLinkCap() {
        return sidebarLinkCap;
    }

    public void setSidebarLinkCap(int sidebarLinkCap) {
        this.sidebarLinkCap = Math.max(1, sidebarLinkCap);
    }

    public int getSidebarLengthCap() {
        return sidebarLengthCap;
    }

    public void setSidebarLengthCap(int sidebarLengthCap) {
        this.sidebarLengthCap = Math.max(1, sidebarLengthCap);
    }

    public double getChromeLinkDensity() {
        return chromeLinkDensity;
    }

    public void setChromeLinkDensity(double chromeLinkDensity) {
        this.chromeLinkDensity = nonNegative(chromeLinkDensity);
    }

    public double getChromeBrevity() {
        return chromeBrevity;
    }

    public void setChromeBrevity(double chromeBrevity) {
        this.chromeBrevity = nonNegative(chromeBrevity);
    }

    public int getChromeLengthCap() {
        return chromeLengthCap;
    }

    public void setChromeLengthCap(int chromeLengthCap) {
        this.chromeLengthCap = Math.max(1, chromeLengthCap);
    }

    public double getCommentsElements() {
        return commentsElements;
    }

    public void setCommentsElements(double commentsElements) {
        this.commentsElements = nonNegative(commentsElements);
    }

    public double getCommentsLengthSpread() {
        return commentsLengthSpread;
    }

    public void setCommentsLengthSpread(double commentsLengthSpread) {
        this.commentsLengthSpread = nonNegative(commentsLengthSpread);
    }

    public int getCommentsElementCap() {
        return commentsElementCap;
    }

    public void setCommentsElementCap(int commentsElementCap) {
        this.commentsElementCap = Math.max(1, commentsElementCap);
    }

    public int getCommentsLengthPivot() {
        return commentsLengthPivot;
    }

    public void setCommentsLengthPivot(int commentsLengthPivot) {
        this.commentsLengthPivot = Math.max(0, commentsLengthPivot);
    }

    public int getCommentsSpreadCap() {
        return commentsSpreadCap;
    }

    public void setCommentsSpreadCap(int commentsSpreadCap) {
        this.commentsSpreadCap = Math.max(1, commentsSpreadCap);
    }

    public double getUnknownScore() {
        return unknownScore;
    }

    public void setUnknownScore(double unknownScore) {
        this.unknownScore = nonNegative(unknownScore);
    }

    public double getConfidenceBase() {
        return confidenceBase;
    }

    public void setConfidenceBase(double confidenceBase) {
        this.confidenceBase = nonNegative(confidenceBase);
    }

    public double getConfidenceWords() {
        return confidenceWords;
    }

    public void setConfidenceWords(double confidenceWords) {
        this.confidenceWords = nonNegative(confidenceWords);
    }

    public int getConfidenceWordCap() {
        return confidenceWordCap;
    }

    public void setConfidenceWordCap(int confidenceWordCap) {
        this.confidenceWordCap = Math.max(1, confidenceWordCap);
    }

    public double getConfidenceParagraphs() {
        return confidenceParagraphs;
    }

    public void setConfidenceParagraphs(double confidenceParagraphs) {
        this.confidenceParagraphs = nonNegative(confidenceParagraphs);
    }

    public double getBalancedLinkDensityBonus() {
        return balancedLinkDensityBonus;
    }

    public void setBalancedLinkDensityBonus(double balancedLinkDensityBonus) {
        this.balancedLinkDensityBonus = nonNegative(balancedLinkDensityBonus);
    }

    public double getBalancedLinkDensityMin() {
        return balancedLinkDensityMin;
    }

    public void setBalancedLinkDensityMin(double balancedLinkDensityMin) {
        this.balancedLinkDensityMin = nonNegative(balancedLinkDensityMin);
    }

    public double getBalancedLinkDensityMax() {
        return balancedLinkDensityMax;
    }

    public void setBalancedLinkDensityMax(double balancedLinkDensityMax) {
        this.balancedLinkDensityMax = nonNegative(balancedLinkDensityMax);
    }

    public int getPromotionMinLength() {
        return promotionMinLength;
    }

    public void setPromotionMinLength(int promotionMinLength) {
        this.promotionMinLength = Math.max(0, promotionMinLength);
    }

    public double getPromotionMinDensity() {
        return promotionMinDensity;
    }

    public void setPromotionMinDensity(double promotionMinDensity) {
        this.promotionMinDensity = nonNegative(promotionMinDensity);
    }

    private static double nonNegative(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, value);
    }
}
