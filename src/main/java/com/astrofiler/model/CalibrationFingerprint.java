package com.astrofiler.model;

import java.util.Objects;

/**
 * Equipment parameters a calibration frame must share with the frames it calibrates:
 * telescope, instrument, binning, gain and offset, plus exposure and sensor temperature
 * for darks and filter for flats.
 * <p>
 * {@link #equals} is exact and identifies one master. {@link #matches} is what grouping,
 * linking and master selection use: dark temperatures may differ by up to
 * {@value #DARK_TEMP_TOLERANCE} degrees.
 */
public final class CalibrationFingerprint {

    public static final double DARK_TEMP_TOLERANCE = 5.0;

    private final ImageType type;
    private final String telescope;
    private final String instrument;
    private final Integer xBinning;
    private final Integer yBinning;
    private final Double gain;
    private final Double offset;
    private final Double exposure;
    private final Double ccdTemp;
    private final String filter;

    private CalibrationFingerprint(ImageType type, String telescope, String instrument,
                                   Integer xBinning, Integer yBinning, Double gain, Double offset,
                                   Double exposure, Double ccdTemp, String filter) {
        this.type = type;
        this.telescope = telescope;
        this.instrument = instrument;
        this.xBinning = xBinning;
        this.yBinning = yBinning;
        this.gain = gain;
        this.offset = offset;
        this.exposure = type == ImageType.DARK ? exposure : null;
        this.ccdTemp = type == ImageType.DARK ? ccdTemp : null;
        this.filter = type == ImageType.FLAT ? filter : null;
    }

    public static CalibrationFingerprint of(ImageType type, String telescope, String instrument,
                                            Integer xBinning, Integer yBinning, Double gain, Double offset,
                                            Double exposure, Double ccdTemp, String filter) {
        if (type == null || !type.isCalibration()) {
            throw new IllegalArgumentException("Fingerprint requires a calibration type, got " + type);
        }
        return new CalibrationFingerprint(type, telescope, instrument, xBinning, yBinning, gain, offset,
                exposure, ccdTemp, filter);
    }

    /** Fingerprint that a calibration of {@code type} must have to serve this session. */
    public static CalibrationFingerprint required(FitsSession session, ImageType type) {
        return of(type, session.telescope, session.imager, session.xBinning, session.yBinning,
                session.gain, session.offset, session.exposure, session.ccdTemp, session.filter);
    }

    public static CalibrationFingerprint of(FitsSession calibrationSession) {
        ImageType type = calibrationSession.calibrationType()
                .orElseThrow(() -> new IllegalArgumentException("Not a calibration session: " + calibrationSession));
        return required(calibrationSession, type);
    }

    public static CalibrationFingerprint of(FitsFile calibrationFrame) {
        return of(calibrationFrame.type, calibrationFrame.telescope, calibrationFrame.instrument,
                calibrationFrame.xBinning, calibrationFrame.yBinning, calibrationFrame.gain,
                calibrationFrame.offset, calibrationFrame.exposure, calibrationFrame.ccdTemp,
                calibrationFrame.filter);
    }

    /** Same as {@link #equals} except that dark temperatures only need to be close. */
    public boolean matches(CalibrationFingerprint other) {
        if (other == null) return false;
        return type == other.type
                && Objects.equals(telescope, other.telescope)
                && Objects.equals(instrument, other.instrument)
                && Objects.equals(xBinning, other.xBinning)
                && Objects.equals(yBinning, other.yBinning)
                && Objects.equals(gain, other.gain)
                && Objects.equals(offset, other.offset)
                && Objects.equals(exposure, other.exposure)
                && Objects.equals(filter, other.filter)
                && temperatureClose(ccdTemp, other.ccdTemp);
    }

    private static boolean temperatureClose(Double a, Double b) {
        if (a == null || b == null) return a == b;
        return Math.abs(a - b) <= DARK_TEMP_TOLERANCE;
    }

    public ImageType type() { return type; }
    public String telescope() { return telescope; }
    public String instrument() { return instrument; }
    public Integer xBinning() { return xBinning; }
    public Integer yBinning() { return yBinning; }
    public Double gain() { return gain; }
    public Double offset() { return offset; }
    public Double exposure() { return exposure; }
    public Double ccdTemp() { return ccdTemp; }
    public String filter() { return filter; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CalibrationFingerprint)) return false;
        CalibrationFingerprint that = (CalibrationFingerprint) o;
        return type == that.type
                && Objects.equals(telescope, that.telescope)
                && Objects.equals(instrument, that.instrument)
                && Objects.equals(xBinning, that.xBinning)
                && Objects.equals(yBinning, that.yBinning)
                && Objects.equals(gain, that.gain)
                && Objects.equals(offset, that.offset)
                && Objects.equals(exposure, that.exposure)
                && Objects.equals(ccdTemp, that.ccdTemp)
                && Objects.equals(filter, that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, telescope, instrument, xBinning, yBinning, gain, offset, exposure, ccdTemp, filter);
    }

    @Override
    public String toString() {
        return type.label() + "[" + telescope + "/" + instrument + " " + xBinning + "x" + yBinning
                + " gain=" + gain + " offset=" + offset
                + (exposure != null ? " " + exposure + "s" : "")
                + (ccdTemp != null ? " " + ccdTemp + "C" : "")
                + (filter != null ? " " + filter : "") + "]";
    }
}
