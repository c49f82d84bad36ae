package ca.gc.cra.radcorr.domain.header;

import java.util.List;

/** Normalized header keys understood by the correction pipeline. */
public final class HeaderKeys {
  public static final String SAMPLES = "samples";
  public static final String LINES = "lines";
  public static final String BANDS = "bands";
  public static final String WAVELENGTH = "wavelength";
  public static final String DESCRIPTION = "description";
  public static final String WAVELENGTH_UNITS = "wavelength units";
  public static final String ACQUISITION_DATE = "acquisition date";
  public static final String SENSOR_TYPE = "sensor type";
  public static final String HEADER_OFFSET = "header offset";
  public static final String FILE_TYPE = "file type";
  public static final String DATA_TYPE = "data type";
  public static final String INTERLEAVE = "interleave";
  public static final String BYTE_ORDER = "byte order";

  /** Optional fields copied verbatim from an input header to the corrected output header. */
  public static final List<String> PASS_THROUGH = List.of(WAVELENGTH_UNITS, ACQUISITION_DATE, SENSOR_TYPE);

  private HeaderKeys() {}
}
