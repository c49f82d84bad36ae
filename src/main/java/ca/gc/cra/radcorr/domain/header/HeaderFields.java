package ca.gc.cra.radcorr.domain.header;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Case-insensitive, last-write-wins map of decoded header declarations.
 * <p><strong>Why:</strong> Header keys are matched case-insensitively; a repeated key replaces the earlier
 * assignment rather than accumulating values.</p>
 * <p><strong>Role:</strong> Output of the header parser and input to {@link HeaderModel#from(HeaderFields)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable once built; the {@link Builder} is not thread-safe.</p>
 * <p><strong>Performance:</strong> Backed by a {@link LinkedHashMap}; lookups are constant-time.</p>
 *
 * @since 0.1.0
 */
public final class HeaderFields {
  private static final HeaderFields EMPTY = new HeaderFields(Map.of());

  private final Map<String, HeaderField> fields;

  private HeaderFields(Map<String, HeaderField> fields) {
    this.fields = fields;
  }

  /**
   * Creates a builder preserving first-appearance order of keys.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Normalizes a header key for lookup: trimmed and lower-cased with {@link Locale#ROOT}.
   *
   * @param key raw key; must not be {@code null}
   * @return normalized key
   */
  public static String normalizeKey(String key) {
    return Objects.requireNonNull(key, "key").trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Looks up a field by key, ignoring case.
   *
   * @param key header key
   * @return decoded field when declared
   */
  public Optional<HeaderField> get(String key) {
    return Optional.ofNullable(fields.get(normalizeKey(key)));
  }

  /**
   * Returns the number of distinct keys.
   *
   * @return distinct key count
   */
  public int size() {
    return fields.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HeaderFields that)) {
      return false;
    }
    return fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "HeaderFields" + fields;
  }

  /** Accumulates declarations; a repeated key overwrites the previous value. */
  public static final class Builder {
    private final Map<String, HeaderField> fields = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Assigns a field, replacing any earlier assignment of the same key.
     *
     * @param key raw key; normalized before insertion
     * @param value decoded value; must not be {@code null}
     * @return this builder
     */
    public Builder put(String key, HeaderField value) {
      fields.put(normalizeKey(key), Objects.requireNonNull(value, "value"));
      return this;
    }

    /**
     * Builds an immutable snapshot.
     *
     * @return field map
     */
    public HeaderFields build() {
      return fields.isEmpty() ? EMPTY : new HeaderFields(new LinkedHashMap<>(fields));
    }
  }
}
