package com.sitelens.crawl.extract;

import com.sitelens.crawl.model.AutoSelectors;
import com.sitelens.crawl.model.ImageData;
import com.sitelens.crawl.model.LinkData;
import com.sitelens.crawl.model.PageContent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PageContentExtractorTest {
    private static final String PAGE_URL = "https://site.com/posts/1";
    private static final String HTML = """
        <html>
          <head>
            <title>Page Title</title>
            <meta name="description" content="A short summary">
            <meta property="og:description" content="Shared summary">
            <meta name="Author" content="Ada">
          </head>
          <body>
            <nav><a href="/about">About</a> <a href="https://other.org/x">Elsewhere</a> <a href="/about">About again</a></nav>
            <h1>Main Heading</h1>
            <article><p>First paragraph with enough text.</p></article>
            <img src="/a.png" alt="A picture">
            <img data-src="/lazy.png">
          </body>
        </html>
        """;

    private final PageContentExtractor extractor = new PageContentExtractor();

    @Test
    void extractsDefaultFields() {
        PageContent content = extractor.extract(HTML, PAGE_URL);

        assertThat(content.title()).isEqualTo("Main Heading");
        assertThat(content.content()).containsExactly("First paragraph with enough text.");
        assertThat(content.links()).containsExactly(
            new LinkData("About", "https://site.com/about", false),
            new LinkData("Elsewhere", "https://other.org/x", true)
        );
        assertThat(content.images()).containsExactly(
            new ImageData("https://site.com/a.png", "A picture", null),
            new ImageData("https://site.com/lazy.png", null, null)
        );
        assertThat(content.metadata())
            .containsEntry("description", "A short summary")
            .containsEntry("og:description", "Shared summary")
            .containsEntry("author", "Ada");
    }

    @Test
    void customSelectorsOverrideOnlyWhatTheyName() {
        AutoSelectors selectors = new AutoSelectors(List.of("title"), List.of("nav"), null, List.of(), null);

        PageContent content = extractor.extract(HTML, PAGE_URL, selectors);

        assertThat(content.title()).isEqualTo("Page Title");
        assertThat(content.content()).singleElement().asString().startsWith("About Elsewhere");
        assertThat(content.links()).hasSize(2);
        assertThat(content.images()).isEmpty();
    }

    @Test
    void malformedSelectorsAreIgnored() {
        AutoSelectors selectors = new AutoSelectors(List.of("!!!", "h1"), List.of("div["), null, null, null);

        PageContent content = extractor.extract(HTML, PAGE_URL, selectors);

        assertThat(content.title()).isEqualTo("Main Heading");
        assertThat(content.content()).isEmpty();
    }

    @Test
    void blankMarkupGivesEmptyContent() {
        assertThat(extractor.extract("", PAGE_URL)).isEqualTo(PageContent.empty());
        assertThat(extractor.extract(null, PAGE_URL)).isEqualTo(PageContent.empty());
    }
}
