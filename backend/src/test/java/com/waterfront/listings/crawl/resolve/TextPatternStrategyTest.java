package com.waterfront.listings.crawl.resolve;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class TextPatternStrategyTest {

    @Test
    void compiledPatternsAreReusedPerVariant() {
        List<Pattern> first = TextPatternStrategy.patternsFor("waterDepth");

        assertThat(TextPatternStrategy.patternsFor("waterDepth")).isSameAs(first);
        assertThat(TextPatternStrategy.patternsFor("water_depth")).isNotSameAs(first);
    }

    @Test
    void variantIsMatchedLiterallyAndCaseInsensitively() {
        List<Pattern> patterns = TextPatternStrategy.patternsFor("lot.size");

        assertThat(patterns).anyMatch(p -> p.matcher("\"LOT.SIZE\": \"0.25 acres\"").find());
        assertThat(patterns).noneMatch(p -> p.matcher("\"lotXsize\": \"0.25 acres\"").find());
    }
}
