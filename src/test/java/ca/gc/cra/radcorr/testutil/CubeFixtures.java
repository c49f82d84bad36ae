package ca.gc.cra.radcorr.testutil;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Builds small float32 BSQ cubes and headers on disk for tests. */
public final class CubeFixtures {
  private CubeFixtures() {}

  /** Value generator indexed by (band, line, sample). */
  @FunctionalInterface
  public interface Sample {
    float at(int band, int line, int sample);
  }

  /** Writes a BSQ cube with {@code offset} leading zero bytes. */
  public static Path writeCube(
      Path path, int bands, int lines, int samples, ByteOrder order, int offset, Sample values)
      throws IOException {
    ByteBuffer buffer = ByteBuffer.allocate(offset + bands * lines * samples * Float.BYTES).order(order);
    buffer.position(offset);
    for (int b = 0; b < bands; b++) {
      for (int l = 0; l < lines; l++) {
        for (int s = 0; s < samples; s++) {
          buffer.putFloat(values.at(b, l, s));
        }
      }
    }
    Files.write(path, buffer.array());
    return path;
  }

  /** Writes a little-endian cube with no offset. */
  public static Path writeCube(Path path, int bands, int lines, int samples, Sample values) throws IOException {
    return writeCube(path, bands, lines, samples, ByteOrder.LITTLE_ENDIAN, 0, values);
  }

  /** Reads a little-endian, zero-offset cube back as a flat array. */
  public static float[] readCube(Path path) throws IOException {
    ByteBuffer buffer = ByteBuffer.wrap(Files.readAllBytes(path)).order(ByteOrder.LITTLE_ENDIAN);
    float[] values = new float[buffer.remaining() / Float.BYTES];
    buffer.asFloatBuffer().get(values);
    return values;
  }

  /** Writes header text as UTF-8. */
  public static Path writeHeader(Path path, String text) throws IOException {
    Files.writeString(path, text, StandardCharsets.UTF_8);
    return path;
  }

  /** Minimal float32 BSQ header with optional extra lines appended. */
  public static String header(int bands, int lines, int samples, String... extra) {
    StringBuilder sb = new StringBuilder()
        .append("ENVI\n")
        .append("samples = ").append(samples).append('\n')
        .append("lines = ").append(lines).append('\n')
        .append("bands = ").append(bands).append('\n')
        .append("header offset = 0\n")
        .append("data type = 4\n")
        .append("interleave = bsq\n")
        .append("byte order = 0\n");
    for (String line : extra) {
      sb.append(line).append('\n');
    }
    return sb.toString();
  }
}
