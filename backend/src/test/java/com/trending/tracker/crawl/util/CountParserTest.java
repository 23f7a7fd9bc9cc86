package com.trending.tracker.crawl.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CountParserTest {

    @Test
    void stripsThousandsSeparators() {
        assertThat(CountParser.parse("1,234")).isEqualTo(1234);
        assertThat(CountParser.parse(" 163,512 ")).isEqualTo(163512);
    }

    @Test
    void appliesUnitSuffixAndTruncates() {
        assertThat(CountParser.parse("2.3k")).isEqualTo(2300);
        assertThat(CountParser.parse("1.5m")).isEqualTo(1_500_000);
        assertThat(CountParser.parse("1.9999K")).isEqualTo(1999);
        assertThat(CountParser.parse("12M")).isEqualTo(12_000_000);
    }

    @Test
    void unreadableInputDefaultsToZero() {
        assertThat(CountParser.parse("")).isZero();
        assertThat(CountParser.parse(null)).isZero();
        assertThat(CountParser.parse("abc")).isZero();
        assertThat(CountParser.parse("k")).isZero();
        assertThat(CountParser.parse("-5")).isZero();
    }

    @Test
    void rejectsExponentNotation() {
        assertThat(CountParser.parse("1e999999999")).isZero();
        assertThat(CountParser.parse("2E3")).isZero();
        assertThat(CountParser.parse("1e-999999999k")).isZero();
    }

    @Test
    void saturatesAtIntegerMax() {
        assertThat(CountParser.parse("99999m")).isEqualTo(Integer.MAX_VALUE);
    }
}
