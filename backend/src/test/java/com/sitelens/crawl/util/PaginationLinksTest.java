package com.sitelens.crawl.util;

import com.sitelens.crawl.model.LinkData;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PaginationLinksTest {
    private static final String CURRENT = "https://shop.com/list";

    @Test
    void pagerLabelsAreRecognised() {
        for (String label : List.of("Next", "Next page", "→", "»", "›", "Older posts »")) {
            List<LinkData> links = List.of(
                new LinkData("Home", "https://shop.com/", false),
                new LinkData(label, "https://shop.com/list/2", false)
            );

            assertThat(PaginationLinks.findNextPage(links, CURRENT)).as(label).isEqualTo("https://shop.com/list/2");
        }
    }

    @Test
    void externalAndSelfLinksAreSkipped() {
        List<LinkData> links = List.of(
            new LinkData("Next", "https://partner.com/list/2", true),
            new LinkData("Next", CURRENT, false),
            new LinkData("Next", "https://shop.com/list/3", false)
        );

        assertThat(PaginationLinks.findNextPage(links, CURRENT)).isEqualTo("https://shop.com/list/3");
    }

    @Test
    void pageParameterOnSameHostAndPathCounts() {
        List<LinkData> links = List.of(
            new LinkData("2", "https://shop.com/other?page=2", false),
            new LinkData("2", "https://cdn.shop.com/list?page=2", false),
            new LinkData("2", "https://shop.com/list?p=2", false)
        );

        assertThat(PaginationLinks.findNextPage(links, CURRENT)).isEqualTo("https://shop.com/list?p=2");
    }

    @Test
    void noCandidateMeansNoNextPage() {
        List<LinkData> links = List.of(
            new LinkData("About", "https://shop.com/about", false),
            new LinkData("Cart", "https://shop.com/cart?item=4", false)
        );

        assertThat(PaginationLinks.findNextPage(links, CURRENT)).isNull();
        assertThat(PaginationLinks.findNextPage(List.of(), CURRENT)).isNull();
        assertThat(PaginationLinks.findNextPage(null, CURRENT)).isNull();
    }
}
