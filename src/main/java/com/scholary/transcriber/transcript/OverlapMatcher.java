package com.scholary.transcriber.transcript;

/**
 * Finds the text duplicated between the end of one transcript and the start of the next.
 *
 * <p>Adjacent chunks share a few seconds of audio, so the next chunk usually starts by repeating
 * the last words of the previous one. The match is searched from the longest candidate down, so
 * the longest duplicated run wins. Both ends of the match must fall on word boundaries, which keeps
 * "art" from matching the tail of "start".
 *
 * <p>The one exception is a full window: when the whole search window of the next chunk repeats the
 * tail of the transcript, it is dropped even if the window ends inside a word.
 */
public final class OverlapMatcher {

  private OverlapMatcher() {}

  /**
   * Find the length of the prefix of {@code next} that repeats the tail of {@code accumulated}.
   *
   * <p>Example: accumulated = "hello there", next = "there, how are you", window = 50. Result: 5
   * ("there").
   *
   * @param accumulated the transcript built so far
   * @param next the transcript of the following chunk, trimmed
   * @param window maximum number of characters of {@code next} to consider
   * @param minMatchChars shortest match accepted
   * @return number of leading characters of {@code next} to drop, 0 if there is no overlap
   */
  public static int findOverlap(String accumulated, String next, int window, int minMatchChars) {
    if (window > 0
        && next.length() >= window
        && accumulated.length() >= window
        && accumulated.regionMatches(true, accumulated.length() - window, next, 0, window)) {
      return window;
    }
    int limit = Math.min(Math.min(window, next.length()), accumulated.length());
    for (int length = limit; length >= Math.max(1, minMatchChars); length--) {
      if (!endsWord(next, length)) {
        continue;
      }
      int suffixStart = accumulated.length() - length;
      if (suffixStart > 0 && Character.isLetterOrDigit(accumulated.charAt(suffixStart - 1))) {
        continue;
      }
      if (accumulated.regionMatches(true, suffixStart, next, 0, length)) {
        return length;
      }
    }
    return 0;
  }

  /**
   * Append {@code next} to {@code accumulated}, dropping the first {@code overlap} characters.
   *
   * <p>A remainder that starts with punctuation is attached directly, anything else after one
   * space.
   */
  public static String merge(String accumulated, String next, int overlap) {
    if (accumulated.isEmpty()) {
      return next;
    }
    String remainder = next.substring(overlap);
    if (remainder.isBlank()) {
      return accumulated;
    }
    if (overlap > 0 && !Character.isWhitespace(remainder.charAt(0))) {
      return accumulated + remainder;
    }
    return accumulated + " " + remainder.strip();
  }

  private static boolean endsWord(String text, int length) {
    if (Character.isWhitespace(text.charAt(length - 1))) {
      return false;
    }
    return length == text.length() || !Character.isLetterOrDigit(text.charAt(length));
  }
}
