package com.sitelens.crawl.structure;

import com.sitelens.crawl.model.ConfidenceLevel;
import com.sitelens.crawl.model.DebugInfo;
import com.sitelens.crawl.model.ExtractionMode;
import com.sitelens.crawl.model.Recommendations;
import com.sitelens.crawl.model.ScoringDetail;
import com.sitelens.crawl.model.Section;
import com.sitelens.crawl.model.SectionStats;
import com.sitelens.crawl.model.SectionType;
import com.sitelens.crawl.model.StructureAnalysis;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Evaluator;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.QueryParser;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Classifies DOM regions by semantic role and ranks them as extraction candidates.
 *
 * <p>Selectors are compiled once at construction; instances are immutable and safe to share.
 */
public class StructureAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(StructureAnalyzer.class);

    public static final String DEFAULT_TITLE_SELECTOR = "h1, h2, title";
    public static final List<SectionSelector> DEFAULT_SELECTORS = List.of(
        new SectionSelector("article", SectionType.ARTICLE),
        new SectionSelector("main", SectionType.MAIN_CONTENT),
        new SectionSelector("[role='main']", SectionType.MAIN_CONTENT),
        new SectionSelector(".content", SectionType.MAIN_CONTENT),
        new SectionSelector(".main-content", SectionType.MAIN_CONTENT),
        new SectionSelector(".post-content", SectionType.ARTICLE),
        new SectionSelector(".article-body", SectionType.ARTICLE),
        new SectionSelector("aside", SectionType.SIDEBAR),
        new SectionSelector(".sidebar", SectionType.SIDEBAR),
        new SectionSelector(".widget", SectionType.SIDEBAR),
        new SectionSelector("nav", SectionType.NAVIGATION),
        new SectionSelector(".navigation", SectionType.NAVIGATION),
        new SectionSelector(".menu", SectionType.NAVIGATION),
        new SectionSelector("header", SectionType.HEADER),
        new SectionSelector("footer", SectionType.FOOTER),
        new SectionSelector(".comments", SectionType.COMMENTS),
        new SectionSelector("#comments", SectionType.COMMENTS),
        new SectionSelector(".comment-list", SectionType.COMMENTS)
    );

    private static final int PREVIEW_LENGTH = 200;
    private static final int FINGERPRINT_LENGTH = 100;
    private static final int FALLBACK_MIN_PARAGRAPHS = 2;
    private static final double FALLBACK_MIN_DENSITY = 0.6;
    private static final double FALLBACK_MIN_SCORE = 0.5;
    private static final Evaluator FALLBACK_CONTAINERS = QueryParser.parse("div, section");

    private final SectionScorer scorer;
    private final List<CompiledSelector> selectors;

    public StructureAnalyzer() {
        this(ScoringWeights.defaults());
    }

    public StructureAnalyzer(ScoringWeights weights) {
        this(weights, DEFAULT_SELECTORS);
    }

    public StructureAnalyzer(ScoringWeights weights, List<SectionSelector> selectorTable) {
        this.scorer = new SectionScorer(weights);
        this.selectors = compile(selectorTable);
    }

    public StructureAnalysis analyze(String html, String url) {
        return analyze(html, url, AnalyzerOptions.defaults());
    }

    public StructureAnalysis analyze(String html, String url, AnalyzerOptions options) {
        long startedNanos = System.nanoTime();
        AnalyzerOptions effective = options == null ? AnalyzerOptions.defaults() : options;
        if (html == null || html.isBlank()) {
            return new StructureAnalysis(
                url,
                Instant.now(),
                List.of(),
                recommend(List.of()),
                effective.debugMode() ? new DebugInfo(0, 0, elapsedMillis(startedNanos), List.of()) : null
            );
        }

        Document document = Jsoup.parse(html, url == null ? "" : url);
        List<Candidate> candidates = findCandidates(document, effective);
        List<Section> sections = new ArrayList<>(candidates.size());
        List<ScoringDetail> details = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            sections.add(candidate.section());
            details.add(candidate.detail());
        }

        DebugInfo debugInfo = null;
        if (effective.debugMode()) {
            debugInfo = new DebugInfo(
                document.getAllElements().size(),
                sections.size(),
                elapsedMillis(startedNanos),
                List.copyOf(details)
            );
        }
        log.debug("Analyzed {}: {} sections", url, sections.size());
        return new StructureAnalysis(url, Instant.now(), List.copyOf(sections), recommend(sections), debugInfo);
    }

    public static Recommendations recommend(List<Section> sections) {
        String bestMainContent = null;
        String bestComments = null;
        boolean hasProductSelector = false;
        boolean hasArticle = false;
        boolean hasComments = false;
        for (Section section : sections) {
            SectionType type = section.sectionType();
            if (bestMainContent == null && type.isContent()) {
                bestMainContent = section.selector();
            }
            if (bestComments == null && type == SectionType.COMMENTS) {
                bestComments = section.selector();
            }
            hasProductSelector |= section.selector().contains("product");
            hasArticle |= type == SectionType.ARTICLE;
            hasComments |= type == SectionType.COMMENTS;
        }

        ExtractionMode mode;
        if (hasProductSelector) {
            mode = ExtractionMode.PRODUCT;
        } else if (hasArticle) {
            mode = ExtractionMode.ARTICLE;
        } else if (hasComments) {
            mode = ExtractionMode.FORUM;
        } else {
            mode = ExtractionMode.GENERIC;
        }
        Double topScore = sections.isEmpty() ? null : sections.get(0).score();
        return new Recommendations(
            bestMainContent,
            DEFAULT_TITLE_SELECTOR,
            bestComments,
            mode,
            ConfidenceLevel.fromTopScore(topScore)
        );
    }

    private List<Candidate> findCandidates(Document document, AnalyzerOptions options) {
        List<Candidate> candidates = new ArrayList<>();
        for (CompiledSelector selector : selectors) {
            if (!options.detectComments() && selector.type() == SectionType.COMMENTS) {
                continue;
            }
            for (Element element : document.select(selector.evaluator())) {
                Candidate candidate = analyzeElement(element, selector.css(), selector.type());
                if (candidate == null) {
                    continue;
                }
                SectionStats stats = candidate.section().stats();
                if (stats.textLength() >= options.minContentLength() || candidate.section().sectionType().isPageChrome()) {
                    candidates.add(candidate);
                }
            }
        }

        boolean hasContent = candidates.stream().anyMatch(candidate -> candidate.section().sectionType().isContent());
        if (!hasContent) {
            candidates.addAll(fallbackContainers(document, options.minContentLength()));
        }

        candidates.sort(Comparator.comparingDouble((Candidate candidate) -> candidate.section().score()).reversed());
        return deduplicate(candidates);
    }

    private Candidate analyzeElement(Element element, String selector, SectionType declaredType) {
        String text = element.text();
        if (text.isBlank()) {
            return null;
        }
        SectionStats stats = computeStats(element, text);
        SectionType type = declaredType;
        if (type == SectionType.MAIN_CONTENT && scorer.shouldPromoteToArticle(stats)) {
            type = SectionType.ARTICLE;
        }
        return score(element, selector, type, stats, text);
    }

    private List<Candidate> fallbackContainers(Document document, int minContentLength) {
        List<Candidate> found = new ArrayList<>();
        for (Element element : document.select(FALLBACK_CONTAINERS)) {
            String text = element.text();
            SectionStats stats = computeStats(element, text);
            if (stats.textLength() < 2L * minContentLength
                || stats.densityScore() <= FALLBACK_MIN_DENSITY
                || stats.paragraphCount() <= FALLBACK_MIN_PARAGRAPHS) {
                continue;
            }
            Candidate candidate = score(element, synthesizeSelector(element), SectionType.MAIN_CONTENT, stats, text);
            if (candidate.section().score() > FALLBACK_MIN_SCORE) {
                found.add(candidate);
            }
        }
        return found;
    }

    private Candidate score(Element element, String selector, SectionType type, SectionStats stats, String text) {
        Map<String, Double> terms = scorer.terms(stats, type);
        double rawScore = scorer.rawScore(terms);
        double score = SectionScorer.clamp(rawScore);
        Section section = new Section(
            selector,
            type,
            score,
            scorer.confidence(stats, type),
            stats,
            preview(text),
            xpathOf(element)
        );
        return new Candidate(section, new ScoringDetail(selector, rawScore, terms, score));
    }

    private SectionStats computeStats(Element element, String text) {
        int textLength = text.length();
        int wordCount = text.isBlank() ? 0 : text.trim().split("\\s+").length;
        int linkCount = element.getElementsByTag("a").size();
        int imageCount = element.getElementsByTag("img").size();
        int paragraphCount = element.getElementsByTag("p").size();
        int headingCount = element.getElementsByTag("h1").size()
            + element.getElementsByTag("h2").size()
            + element.getElementsByTag("h3").size();
        int elementCount = countNodes(element);
        double densityScore = elementCount > 0 ? Math.min(1.0, (double) textLength / elementCount) : 0.0;
        double linkDensity = textLength > 0 ? (linkCount * 50.0) / textLength : 1.0;
        return new SectionStats(
            textLength,
            wordCount,
            linkCount,
            imageCount,
            paragraphCount,
            headingCount,
            densityScore,
            linkDensity,
            elementCount
        );
    }

    private List<Candidate> deduplicate(List<Candidate> sorted) {
        Set<String> seen = new HashSet<>();
        List<Candidate> kept = new ArrayList<>();
        for (Candidate candidate : sorted) {
            String preview = candidate.section().preview();
            String fingerprint = preview.length() > FINGERPRINT_LENGTH ? preview.substring(0, FINGERPRINT_LENGTH) : preview;
            if (seen.add(fingerprint)) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    static String preview(String text) {
        String trimmed = text.trim();
        if (trimmed.length() <= PREVIEW_LENGTH) {
            return trimmed;
        }
        return trimmed.substring(0, PREVIEW_LENGTH) + "...";
    }

    static String synthesizeSelector(Element element) {
        if (!element.id().isBlank()) {
            return "#" + element.id();
        }
        for (String className : element.classNames()) {
            if (!className.isBlank()) {
                return "." + className;
            }
        }
        return element.tagName();
    }

    static String xpathOf(Element element) {
        Deque<String> steps = new ArrayDeque<>();
        Element current = element;
        while (current != null && !(current instanceof Document)) {
            Element parent = current.parent();
            if (parent == null || parent instanceof Document) {
                steps.push("/" + current.tagName());
                break;
            }
            int position = 1;
            for (Element sibling : parent.children()) {
                if (sibling == current) {
                    break;
                }
                if (sibling.tagName().equals(current.tagName())) {
                    position++;
                }
            }
            steps.push("/" + current.tagName() + "[" + position + "]");
            current = parent;
        }
        return String.join("", steps);
    }

    private static int countNodes(Element element) {
        int[] count = {0};
        NodeTraversor.traverse((node, depth) -> count[0]++, element);
        return count[0];
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static List<CompiledSelector> compile(List<SectionSelector> table) {
        List<CompiledSelector> compiled = new ArrayList<>();
        if (table == null) {
            return compiled;
        }
        for (SectionSelector entry : table) {
            try {
                compiled.add(new CompiledSelector(entry.css(), QueryParser.parse(entry.css()), entry.type()));
            } catch (Selector.SelectorParseException | IllegalArgumentException e) {
                log.warn("Skipping malformed section selector {}: {}", entry.css(), e.getMessage());
            }
        }
        return List.copyOf(compiled);
    }

    public record SectionSelector(String css, SectionType type) {
    }

    private record CompiledSelector(String css, Evaluator evaluator, SectionType type) {
    }

    private record Candidate(Section section, ScoringDetail detail) {
    }
}
