package com.astrofiler.model;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Files captured with the same equipment during one night.
 * Light sessions carry references to their calibration sessions and masters;
 * calibration sessions (object Bias, Dark or Flat) never do.
 */
public class FitsSession {
    public String id;
    public String objectName;
    public LocalDateTime date;
    public String telescope;
    public String imager;
    public Integer xBinning;
    public Integer yBinning;
    public Double ccdTemp;
    public Double gain;
    public Double offset;
    public String filter;
    public Double exposure;

    public String biasSession;
    public String darkSession;
    public String flatSession;

    public String biasMaster;
    public String darkMaster;
    public String flatMaster;

    /** Calibration type of this session, empty for light sessions. */
    public Optional<ImageType> calibrationType() {
        return ImageType.fromLabel(objectName).filter(ImageType::isCalibration);
    }

    public boolean isCalibration() {
        return calibrationType().isPresent();
    }

    public String calibrationSession(ImageType type) {
        switch (type) {
            case BIAS: return biasSession;
            case DARK: return darkSession;
            case FLAT: return flatSession;
            default: throw new IllegalArgumentException("Not a calibration type: " + type);
        }
    }

    public String masterPath(ImageType type) {
        switch (type) {
            case BIAS: return biasMaster;
            case DARK: return darkMaster;
            case FLAT: return flatMaster;
            default: throw new IllegalArgumentException("Not a calibration type: " + type);
        }
    }

    @Override
    public String toString() {
        return "FitsSession{" + id + ", " + objectName + ", " + telescope + "/" + imager + ", " + date + "}";
    }
}
