package ca.gc.cra.radcorr.config;

import ca.gc.cra.radcorr.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Configuration for the {@code inspect} command.
 *
 * @param header header to summarize
 * @param data optional cube paired with {@code header}; required for band statistics and spectra
 * @param band optional zero-based band whose statistics are reported
 * @param pixel optional pixel whose spectrum is reported
 * @param wavelength optional wavelength resolved to the nearest band
 * @since 0.1.0
 */
public record InspectConfig(
    Path header,
    Optional<Path> data,
    OptionalInt band,
    Optional<Pixel> pixel,
    OptionalDouble wavelength) {

  public InspectConfig {
    Objects.requireNonNull(header, "header");
    data = Objects.requireNonNullElse(data, Optional.empty());
    band = Objects.requireNonNullElse(band, OptionalInt.empty());
    pixel = Objects.requireNonNullElse(pixel, Optional.empty());
    wavelength = Objects.requireNonNullElse(wavelength, OptionalDouble.empty());
    if (band.isPresent() && band.getAsInt() < 0) {
      throw new IllegalArgumentException("band must not be negative (was " + band.getAsInt() + ")");
    }
    if (wavelength.isPresent() && !Double.isFinite(wavelength.getAsDouble())) {
      throw new IllegalArgumentException("wavelength must be finite");
    }
    if (data.isEmpty() && (band.isPresent() || pixel.isPresent())) {
      throw new IllegalArgumentException("band and pixel require data=PATH");
    }
  }

  /**
   * Builds a configuration from flat key/value options: {@code header}, {@code data}, {@code band},
   * {@code pixel=LINE,SAMPLE}, {@code wavelength}.
   *
   * @param options merged options
   * @return validated configuration
   * @throws IllegalArgumentException when {@code header} is missing or a value is invalid
   */
  public static InspectConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String headerRaw = trimmed(options.get("header"));
    if (headerRaw.isEmpty()) {
      throw new IllegalArgumentException("header is required");
    }
    String dataRaw = trimmed(options.get("data"));
    String bandRaw = trimmed(options.get("band"));
    String pixelRaw = trimmed(options.get("pixel"));
    String wavelengthRaw = trimmed(options.get("wavelength"));

    return new InspectConfig(
        toPath("header", headerRaw),
        dataRaw.isEmpty() ? Optional.empty() : Optional.of(toPath("data", dataRaw)),
        bandRaw.isEmpty()
            ? OptionalInt.empty()
            : OptionalInt.of((int) Numbers.requireRange(
                "band", Numbers.parseLong("band", bandRaw), 0, Integer.MAX_VALUE)),
        pixelRaw.isEmpty() ? Optional.empty() : Optional.of(Pixel.parse(pixelRaw)),
        wavelengthRaw.isEmpty()
            ? OptionalDouble.empty()
            : OptionalDouble.of(Numbers.parseDouble("wavelength", wavelengthRaw)));
  }

  /**
   * Zero-based pixel coordinates.
   *
   * @param line row
   * @param sample column
   */
  public record Pixel(int line, int sample) {
    public Pixel {
      if (line < 0 || sample < 0) {
        throw new IllegalArgumentException("pixel coordinates must not be negative (was " + line + "," + sample + ")");
      }
    }

    static Pixel parse(String raw) {
      int comma = raw.indexOf(',');
      if (comma < 0 || raw.indexOf(',', comma + 1) >= 0) {
        throw new IllegalArgumentException("pixel must be LINE,SAMPLE (was '" + raw + "')");
      }
      long line = Numbers.parseLong("pixel line", raw.substring(0, comma));
      long sample = Numbers.parseLong("pixel sample", raw.substring(comma + 1));
      return new Pixel(
          (int) Numbers.requireRange("pixel line", line, 0, Integer.MAX_VALUE),
          (int) Numbers.requireRange("pixel sample", sample, 0, Integer.MAX_VALUE));
    }
  }

  private static Path toPath(String key, String raw) {
    try {
      return Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
