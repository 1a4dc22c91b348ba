package com.scholary.transcriber.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The inputs that determine a cached artifact.
 *
 * <p>Only semantically relevant inputs belong here. Inputs are kept sorted by name, so the
 * fingerprint does not depend on the order they were added in.
 */
public final class FingerprintInputs {

  private final String namespace;
  private final SortedMap<String, String> values;

  private FingerprintInputs(String namespace, SortedMap<String, String> values) {
    this.namespace = namespace;
    this.values = Collections.unmodifiableSortedMap(values);
  }

  public static FingerprintInputs of(String namespace, Map<String, String> values) {
    Objects.requireNonNull(namespace, "namespace");
    TreeMap<String, String> sorted = new TreeMap<>();
    values.forEach((name, value) -> sorted.put(name, value == null ? "" : value));
    return new FingerprintInputs(namespace, sorted);
  }

  public String namespace() {
    return namespace;
  }

  public SortedMap<String, String> values() {
    return values;
  }

  /** SHA-256 over the namespace and the {@code name=value} pairs, as lowercase hex. */
  public String fingerprint() {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      update(digest, namespace);
      for (Map.Entry<String, String> entry : values.entrySet()) {
        update(digest, entry.getKey() + "=" + entry.getValue());
      }
      return HexFormat.of().formatHex(digest.digest());
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  // length prefix keeps ("ab", "c") and ("a", "bc") apart
  private static void update(MessageDigest digest, String part) {
    byte[] bytes = part.getBytes(StandardCharsets.UTF_8);
    digest.update(Integer.toString(bytes.length).getBytes(StandardCharsets.UTF_8));
    digest.update((byte) ':');
    digest.update(bytes);
  }
}
