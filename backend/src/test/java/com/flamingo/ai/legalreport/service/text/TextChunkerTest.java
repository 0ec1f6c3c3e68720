package com.flamingo.ai.legalreport.service.text;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TextChunker Tests")
class TextChunkerTest {

  private final TextChunker chunker = new TextChunker();

  @Test
  @DisplayName("Should end windows at a word boundary")
  void shouldBreakAtWhitespace() {
    assertThat(chunker.split("aaaa bbbb cccc dddd", 10, 0))
        .containsExactly("aaaa bbbb", "cccc dddd");
  }

  @Test
  @DisplayName("Should overlap consecutive windows")
  void shouldOverlapWindows() {
    assertThat(chunker.split("abcdefghij", 4, 2))
        .containsExactly("abcd", "cdef", "efgh", "ghij");
  }

  @Test
  @DisplayName("Should return a single chunk for short text")
  void shouldKeepShortText() {
    assertThat(chunker.split("  hola mundo  ", 100, 10)).containsExactly("hola mundo");
  }

  @Test
  @DisplayName("Should return nothing for blank text")
  void shouldIgnoreBlankText() {
    assertThat(chunker.split(null, 10, 0)).isEmpty();
    assertThat(chunker.split(" \n ", 10, 0)).isEmpty();
  }

  @Test
  @DisplayName("Should reject an overlap as large as the window")
  void shouldRejectInvalidOverlap() {
    assertThatThrownBy(() -> chunker.split("texto", 10, 10))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("overlap");
  }
}
