package com.typepulse.anomaly.detection;

import java.util.List;
import java.util.Random;

/** Pangram pool for verification challenges. */
public final class ChallengePhrases {

  static final List<String> PHRASES = List.of(
      "The quick brown fox jumps over the lazy dog near the river bank.",
      "Pack my box with five dozen liquor jugs and bring them to the store.",
      "How vexingly quick daft zebras jump across the open field today.",
      "The five boxing wizards jump quickly through the morning fog now.",
      "Sphinx of black quartz judge my vow while sitting by the campfire.",
      "Two driven jocks help fax my big quiz about swimming techniques.",
      "The job requires extra pluck and zeal from every young wage earner.",
      "Crazy Frederick bought many very exquisite opal jewels for the auction.");

  private final Random random;

  public ChallengePhrases(Random random) {
    this.random = random;
  }

  public String next() {
    return PHRASES.get(random.nextInt(PHRASES.size()));
  }

  public static List<String> all() {
    return PHRASES;
  }
}
