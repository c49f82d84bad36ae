package ca.gc.cra.radcorr.config;

import ca.gc.cra.radcorr.util.PathUtils;
import ca.gc.cra.radcorr.validation.Numbers;
import ca.gc.cra.radcorr.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Configuration for one radiometric correction run.
 * <p><strong>Why:</strong> Consolidates CLI flags, YAML settings and defaults so every run is reproducible.</p>
 * <p><strong>Role:</strong> Adapter configuration aggregate consumed by the correction use case.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the source data and header, the reference header, and the output pair.</li>
 *   <li>Derive output names from the input when they are not given.</li>
 *   <li>Bound the chunk size and validate the default scale factor and output description.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param inputData source cube
 * @param inputHeader header paired with {@code inputData}
 * @param referenceHeader reference header supplying wavelengths, description and metadata
 * @param outputData corrected cube to create
 * @param outputHeader header written once {@code outputData} is complete
 * @param chunkSize rows per chunk, {@code 1..1_000_000}
 * @param storage cube storage backend
 * @param defaultScaleFactor radiance scale factor assumed when the reference description has none
 * @param outputDescription text written to the output {@code description} field
 * @since 0.1.0
 * @see ca.gc.cra.radcorr.application.pipeline.CorrectionUseCase
 */
public record CorrectConfig(
    Path inputData,
    Path inputHeader,
    Path referenceHeader,
    Path outputData,
    Path outputHeader,
    int chunkSize,
    CubeStorageMode storage,
    double defaultScaleFactor,
    String outputDescription) {

  public static final int DEFAULT_CHUNK_SIZE = 500;
  public static final int MAX_CHUNK_SIZE = 1_000_000;
  public static final double DEFAULT_SCALE_FACTOR = 1000.0;
  public static final String DEFAULT_DESCRIPTION = "Radiometrically corrected reflectance data";
  public static final String HEADER_SUFFIX = ".hdr";

  private static final String INPUT_MARKER = "reflectance";
  private static final String OUTPUT_MARKER = "radcorr";

  /**
   * Validates the configuration.
   *
   * @throws IllegalArgumentException if a value is out of range or the output would overwrite an input
   */
  public CorrectConfig {
    Objects.requireNonNull(inputData, "inputData");
    Objects.requireNonNull(inputHeader, "inputHeader");
    Objects.requireNonNull(referenceHeader, "referenceHeader");
    Objects.requireNonNull(outputData, "outputData");
    Objects.requireNonNull(outputHeader, "outputHeader");
    Numbers.requireRange("chunkSize", chunkSize, 1, MAX_CHUNK_SIZE);
    storage = Objects.requireNonNullElse(storage, CubeStorageMode.CHANNEL);
    Numbers.requirePositiveFinite("defaultScaleFactor", defaultScaleFactor);
    outputDescription = Strings.requireHeaderText("outputDescription", outputDescription);

    Path out = outputData.toAbsolutePath().normalize();
    Path outHdr = outputHeader.toAbsolutePath().normalize();
    if (out.equals(outHdr)) {
      throw new IllegalArgumentException("out and outHeader must differ: " + out);
    }
    for (Path input : new Path[] {inputData, inputHeader, referenceHeader}) {
      Path normalized = input.toAbsolutePath().normalize();
      if (normalized.equals(out) || normalized.equals(outHdr)) {
        throw new IllegalArgumentException("output " + normalized + " would overwrite an input");
      }
    }
  }

  /**
   * Builds a configuration from flat key/value options.
   *
   * <p>Recognized keys: {@code in}, {@code inHeader}, {@code refHeader}, {@code out}, {@code outHeader},
   * {@code chunkSize}, {@code storage}, {@code defaultScaleFactor}, {@code outputDescription}. Blank values fall
   * back to derived names or defaults.</p>
   *
   * @param options merged options
   * @return validated configuration
   * @throws IllegalArgumentException when a required key is missing or a value is invalid
   */
  public static CorrectConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path in = requirePath(options, "in");
    Path inHeader = optionalPath(options, "inHeader");
    Path refHeader = requirePath(options, "refHeader");
    Path out = optionalPath(options, "out");
    Path outHeader = optionalPath(options, "outHeader");

    if (inHeader == null) {
      inHeader = PathUtils.appendToFileName(in, HEADER_SUFFIX);
    }
    if (out == null) {
      out = deriveOutput(in);
    }
    if (outHeader == null) {
      outHeader = PathUtils.appendToFileName(out, HEADER_SUFFIX);
    }

    int chunkSize = DEFAULT_CHUNK_SIZE;
    String chunkRaw = trimmed(options.get("chunkSize"));
    if (!chunkRaw.isEmpty()) {
      chunkSize = (int) Numbers.requireRange(
          "chunkSize", Numbers.parseLong("chunkSize", chunkRaw), 1, MAX_CHUNK_SIZE);
    }

    double scale = DEFAULT_SCALE_FACTOR;
    String scaleRaw = trimmed(options.get("defaultScaleFactor"));
    if (!scaleRaw.isEmpty()) {
      scale = Numbers.parseDouble("defaultScaleFactor", scaleRaw);
    }

    String description = trimmed(options.get("outputDescription"));
    return new CorrectConfig(
        in,
        inHeader,
        refHeader,
        out,
        outHeader,
        chunkSize,
        CubeStorageMode.parse(options.get("storage"), CubeStorageMode.CHANNEL),
        scale,
        description.isEmpty() ? DEFAULT_DESCRIPTION : description);
  }

  /**
   * Derives the corrected cube name: {@code reflectance} in the file name becomes {@code radcorr}, otherwise
   * {@code _radcorr} is inserted before the extension.
   *
   * @param input source cube path
   * @return output cube path in the same directory
   */
  public static Path deriveOutput(Path input) {
    String name = PathUtils.fileName(input)
        .orElseThrow(() -> new IllegalArgumentException("in has no file name: " + input));
    if (name.contains(INPUT_MARKER)) {
      return input.resolveSibling(name.replace(INPUT_MARKER, OUTPUT_MARKER));
    }
    return PathUtils.insertBeforeExtension(input, "_" + OUTPUT_MARKER);
  }

  /**
   * Returns a copy with the output paths replaced by their validated forms.
   *
   * @param data validated output data path
   * @param header validated output header path
   * @return updated configuration
   */
  public CorrectConfig withOutputs(Path data, Path header) {
    return new CorrectConfig(
        inputData, inputHeader, referenceHeader, data, header,
        chunkSize, storage, defaultScaleFactor, outputDescription);
  }

  /**
   * Returns a copy with the input paths replaced by their validated forms.
   *
   * @param data validated input cube
   * @param header validated input header
   * @param reference validated reference header
   * @return updated configuration
   */
  public CorrectConfig withInputs(Path data, Path header, Path reference) {
    return new CorrectConfig(
        data, header, reference, outputData, outputHeader,
        chunkSize, storage, defaultScaleFactor, outputDescription);
  }

  private static Path requirePath(Map<String, String> options, String key) {
    Path path = optionalPath(options, key);
    if (path == null) {
      throw new IllegalArgumentException(key + " is required");
    }
    return path;
  }

  private static Path optionalPath(Map<String, String> options, String key) {
    String raw = trimmed(options.get(key));
    if (raw.isEmpty()) {
      return null;
    }
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
