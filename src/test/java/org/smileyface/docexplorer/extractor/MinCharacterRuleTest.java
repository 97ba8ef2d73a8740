package org.smileyface.docexplorer.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MinCharacterRuleTest {

    @Test
    void isMatched_trueWhenLengthEqualsOrExceedsMin() {
        Document doc = Jsoup.parse("<p>Hello World</p>");
        Element p = doc.selectFirst("p");
        assertThat(new MinCharacterRule(11).isMatched(p)).isTrue(); // "Hello World" -> 11
        assertThat(new MinCharacterRule(12).isMatched(p)).isFalse();
    }

    @Test
    void isMatched_trimsWhitespace() {
        Document doc = Jsoup.parse("<div>   abc  </div>");
        Element div = doc.selectFirst("div");
        assertThat(new MinCharacterRule(3).isMatched(div)).isTrue();
        assertThat(new MinCharacterRule(4).isMatched(div)).isFalse();
        assertThat(new MinCharacterRule(3).isMatched("  abc \n")).isTrue();
    }

    @Test
    void negativeThresholdTreatedAsZero() {
        Element span = Jsoup.parse("<span>  </span>").selectFirst("span");
        MinCharacterRule rule = new MinCharacterRule(-5);
        assertThat(rule.getMinChars()).isZero();
        assertThat(rule.isMatched(span)).as("Negative min should match even empty text").isTrue();
    }

    @Test
    void longerThan_isStrict() {
        MinCharacterRule rule = MinCharacterRule.longerThan(5);
        assertThat(rule.isMatched("12345")).isFalse();
        assertThat(rule.isMatched("123456")).isTrue();
    }

    @Test
    void nullInputsNeverMatchNonZeroMinimum() {
        MinCharacterRule rule = new MinCharacterRule(1);
        assertThat(rule.isMatched((Element) null)).isFalse();
        assertThat(rule.isMatched((String) null)).isFalse();
    }
}
