package ca.gc.cra.radcorr.domain.header;

import java.nio.ByteOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Validated, typed view over the header fields a correction run depends on.
 * <p><strong>Why:</strong> Decouples the pipeline from raw {@link HeaderFields} so dimension, wavelength and
 * layout checks happen once, before any cube file is opened.</p>
 * <p><strong>Role:</strong> Domain aggregate built from parsed input headers and serialized for the output
 * header.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Require positive {@code samples}, {@code lines} and {@code bands}.</li>
 *   <li>Expose the optional wavelength table and description.</li>
 *   <li>Carry the optional pass-through fields and the binary layout of the paired cube.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param shape cube geometry
 * @param wavelengths optional wavelength table in header units; length is not forced to match {@code bands}
 * @param description optional description field, text or list
 * @param passThrough optional fields from {@link HeaderKeys#PASS_THROUGH} in declaration order
 * @param headerOffset bytes to skip at the start of the paired binary file
 * @param byteOrder byte order of the paired binary file
 * @since 0.1.0
 */
public record HeaderModel(
    CubeShape shape,
    Optional<List<Double>> wavelengths,
    Optional<HeaderField> description,
    Map<String, HeaderField> passThrough,
    long headerOffset,
    ByteOrder byteOrder) {

  /** ENVI data type code for 32-bit IEEE-754 floats. */
  public static final long DATA_TYPE_FLOAT32 = 4;
  /** Band-sequential interleave keyword. */
  public static final String INTERLEAVE_BSQ = "bsq";

  public HeaderModel {
    Objects.requireNonNull(shape, "shape");
    wavelengths = Objects.requireNonNullElse(wavelengths, Optional.<List<Double>>empty()).map(List::copyOf);
    description = Objects.requireNonNullElse(description, Optional.empty());
    passThrough = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNullElse(passThrough, Map.of())));
    if (headerOffset < 0) {
      throw new IllegalArgumentException("headerOffset must not be negative");
    }
    byteOrder = Objects.requireNonNullElse(byteOrder, ByteOrder.LITTLE_ENDIAN);
  }

  /**
   * Builds a model for a freshly written little-endian cube with no leading offset.
   *
   * @param shape cube geometry
   * @param wavelengths optional wavelength table
   * @param description description to record
   * @param passThrough pass-through fields to copy
   * @return output header model
   */
  public static HeaderModel forOutput(
      CubeShape shape,
      Optional<List<Double>> wavelengths,
      HeaderField description,
      Map<String, HeaderField> passThrough) {
    return new HeaderModel(
        shape, wavelengths, Optional.of(description), passThrough, 0L, ByteOrder.LITTLE_ENDIAN);
  }

  /**
   * Validates decoded fields and projects them into a model.
   *
   * @param fields decoded header fields
   * @return validated model
   * @throws MissingFieldException if {@code samples}, {@code lines} or {@code bands} is absent
   * @throws InvalidFieldException if a dimension is not a positive integer, the wavelength table is not numeric,
   *     or {@code header offset} / {@code byte order} hold unsupported values
   */
  public static HeaderModel from(HeaderFields fields) throws MissingFieldException, InvalidFieldException {
    Objects.requireNonNull(fields, "fields");
    int samples = requireDimension(fields, HeaderKeys.SAMPLES);
    int lines = requireDimension(fields, HeaderKeys.LINES);
    int bands = requireDimension(fields, HeaderKeys.BANDS);

    Optional<List<Double>> wavelengths = Optional.empty();
    Optional<HeaderField> wavelengthField = fields.get(HeaderKeys.WAVELENGTH);
    if (wavelengthField.isPresent()) {
      wavelengths = Optional.of(decodeWavelengths(wavelengthField.get()));
    }

    Map<String, HeaderField> passThrough = new LinkedHashMap<>();
    for (String key : HeaderKeys.PASS_THROUGH) {
      fields.get(key).ifPresent(value -> passThrough.put(key, value));
    }

    long offset = optionalInteger(fields, HeaderKeys.HEADER_OFFSET).orElse(0L);
    if (offset < 0) {
      throw new InvalidFieldException(HeaderKeys.HEADER_OFFSET, "must not be negative (was " + offset + ")");
    }
    long order = optionalInteger(fields, HeaderKeys.BYTE_ORDER).orElse(0L);
    if (order != 0 && order != 1) {
      throw new InvalidFieldException(HeaderKeys.BYTE_ORDER, "must be 0 or 1 (was " + order + ")");
    }

    return new HeaderModel(
        new CubeShape(bands, lines, samples),
        wavelengths,
        fields.get(HeaderKeys.DESCRIPTION),
        passThrough,
        offset,
        order == 1 ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN);
  }

  /**
   * Indicates whether a wavelength table is present and has exactly one entry per band.
   *
   * @return {@code true} when the table length equals {@code bands}
   */
  public boolean wavelengthMatchesBands() {
    return wavelengths.map(values -> values.size() == shape.bands()).orElse(false);
  }

  /**
   * Returns the wavelength recorded for a band.
   *
   * @param band zero-based band index
   * @return wavelength, or empty when the table is absent or shorter than {@code band + 1}
   */
  public OptionalDouble wavelength(int band) {
    if (band < 0 || wavelengths.isEmpty() || band >= wavelengths.get().size()) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(wavelengths.get().get(band));
  }

  /**
   * Finds the band whose wavelength is closest to {@code target}; ties resolve to the lowest index.
   *
   * @param target wavelength in header units
   * @return band index, or empty when no wavelength table is declared
   */
  public OptionalInt nearestBand(double target) {
    if (wavelengths.isEmpty() || wavelengths.get().isEmpty()) {
      return OptionalInt.empty();
    }
    List<Double> values = wavelengths.get();
    int limit = Math.min(values.size(), shape.bands());
    int best = -1;
    double bestDistance = Double.POSITIVE_INFINITY;
    for (int i = 0; i < limit; i++) {
      double distance = Math.abs(values.get(i) - target);
      if (distance < bestDistance) {
        bestDistance = distance;
        best = i;
      }
    }
    return best < 0 ? OptionalInt.empty() : OptionalInt.of(best);
  }

  private static int requireDimension(HeaderFields fields, String key)
      throws MissingFieldException, InvalidFieldException {
    HeaderField field = fields.get(key).orElseThrow(() -> new MissingFieldException(key));
    if (!(field instanceof HeaderField.IntegerValue integer)) {
      throw new InvalidFieldException(key, "must be an integer (was '" + field.text() + "')");
    }
    long value = integer.value();
    if (value <= 0 || value > Integer.MAX_VALUE) {
      throw new InvalidFieldException(key, "must be between 1 and " + Integer.MAX_VALUE + " (was " + value + ")");
    }
    return (int) value;
  }

  private static Optional<Long> optionalInteger(HeaderFields fields, String key) throws InvalidFieldException {
    Optional<HeaderField> field = fields.get(key);
    if (field.isEmpty()) {
      return Optional.empty();
    }
    if (field.get() instanceof HeaderField.IntegerValue integer) {
      return Optional.of(integer.value());
    }
    throw new InvalidFieldException(key, "must be an integer (was '" + field.get().text() + "')");
  }

  /**
   * Checks that the header describes a float32 band-sequential cube. Absent keys are accepted.
   *
   * @param fields decoded header fields
   * @throws InvalidFieldException if {@code data type} or {@code interleave} declare another layout
   */
  public static void requireFloat32Bsq(HeaderFields fields) throws InvalidFieldException {
    Optional<Long> dataType = optionalInteger(fields, HeaderKeys.DATA_TYPE);
    if (dataType.isPresent() && dataType.get() != DATA_TYPE_FLOAT32) {
      throw new InvalidFieldException(
          HeaderKeys.DATA_TYPE, "must be " + DATA_TYPE_FLOAT32 + " (float32), was " + dataType.get());
    }
    Optional<HeaderField> interleave = fields.get(HeaderKeys.INTERLEAVE);
    if (interleave.isPresent()
        && !INTERLEAVE_BSQ.equals(interleave.get().text().trim().toLowerCase(Locale.ROOT))) {
      throw new InvalidFieldException(
          HeaderKeys.INTERLEAVE, "must be " + INTERLEAVE_BSQ + " (was '" + interleave.get().text() + "')");
    }
  }

  private static List<Double> decodeWavelengths(HeaderField field) throws InvalidFieldException {
    if (field instanceof HeaderField.FloatListValue list) {
      return list.values();
    }
    if (field instanceof HeaderField.IntegerValue integer) {
      return List.of((double) integer.value());
    }
    if (field instanceof HeaderField.TextValue text) {
      OptionalDouble single = HeaderValues.parseFloat(text.text());
      if (single.isPresent()) {
        return List.of(single.getAsDouble());
      }
    }
    throw new InvalidFieldException(HeaderKeys.WAVELENGTH, "must be a list of numbers (was '" + field.text() + "')");
  }
}
