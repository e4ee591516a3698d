package com.scholary.chapters.naming;

import java.util.Locale;

/**
 * Camera compression variant encoded in the second letter of a chapter filename.
 *
 * <p>{@code H} is AVC, {@code X} is HEVC. Two sequences with the same number but different
 * encodings are unrelated recordings.
 */
public enum Encoding {
  H,
  X;

  static Encoding fromLetter(String letter) {
    return valueOf(letter.toUpperCase(Locale.ROOT));
  }
}
