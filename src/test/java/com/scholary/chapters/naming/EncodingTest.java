package com.scholary.chapters.naming;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Locale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EncodingTest {

  private Locale previous;

  @BeforeEach
  void setUp() {
    previous = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("tr-TR"));
  }

  @AfterEach
  void tearDown() {
    Locale.setDefault(previous);
  }

  @Test
  void fromLetter_shouldIgnoreDefaultLocale() {
    assertThat(Encoding.fromLetter("h")).isEqualTo(Encoding.H);
    assertThat(Encoding.fromLetter("x")).isEqualTo(Encoding.X);
    assertThat(Encoding.fromLetter("X")).isEqualTo(Encoding.X);
  }
}
