package io.github.stephanpirnbaum.mermaid.export.naming;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link HashingUtil}.
 */
class HashingUtilTest {

    @Test
    void shortHash_returnsFirstEightHexCharactersOfSha256() {
        assertThat(HashingUtil.shortHash("abc")).isEqualTo("ba7816bf");
    }

    @Test
    void shortHash_ignoresSurroundingWhitespace() {
        assertThat(HashingUtil.shortHash("  graph TD\n  A --> B\n\n")).isEqualTo(HashingUtil.shortHash("graph TD\n  A --> B"));
    }

    @Test
    void shortHash_ignoresSurroundingUnicodeWhitespace() {
        String expected = HashingUtil.shortHash("graph TD");

        assertThat(HashingUtil.shortHash("graph TD\u00A0")).isEqualTo(expected);
        assertThat(HashingUtil.shortHash("\uFEFFgraph TD")).isEqualTo(expected);
        assertThat(HashingUtil.shortHash("\u2003graph TD\u2028")).isEqualTo(expected);
    }

    @Test
    void trim_keepsInnerWhitespace() {
        assertThat(HashingUtil.trim("\u00A0 graph\u00A0TD \n")).isEqualTo("graph\u00A0TD");
        assertThat(HashingUtil.trim(null)).isEmpty();
    }

    @Test
    void shortHash_withEmptyContent_isDeterministic() {
        assertThat(HashingUtil.shortHash("")).isEqualTo("e3b0c442");
        assertThat(HashingUtil.shortHash("   ")).isEqualTo("e3b0c442");
        assertThat(HashingUtil.shortHash(null)).isEqualTo("e3b0c442");
    }

    @Test
    void shortHash_withDifferentContent_differs() {
        assertThat(HashingUtil.shortHash("flow A->B")).isNotEqualTo(HashingUtil.shortHash("flow A->B->C"));
    }

}
