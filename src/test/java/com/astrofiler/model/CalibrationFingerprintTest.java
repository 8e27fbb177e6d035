package com.astrofiler.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CalibrationFingerprintTest {

    private static FitsSession light(double exposure, String filter) {
        FitsSession s = new FitsSession();
        s.objectName = "M42";
        s.telescope = "Celestron";
        s.imager = "ASI294";
        s.xBinning = 1;
        s.yBinning = 1;
        s.exposure = exposure;
        s.filter = filter;
        s.gain = 120.0;
        s.ccdTemp = -10.0;
        return s;
    }

    @Test
    void biasIgnoresExposureAndFilter() {
        assertEquals(CalibrationFingerprint.required(light(60, "Ha"), ImageType.BIAS),
                CalibrationFingerprint.required(light(300, "OIII"), ImageType.BIAS));
    }

    @Test
    void darkComparesExposureNotFilter() {
        assertEquals(CalibrationFingerprint.required(light(300, "Ha"), ImageType.DARK),
                CalibrationFingerprint.required(light(300, "OIII"), ImageType.DARK));
        assertNotEquals(CalibrationFingerprint.required(light(300, "Ha"), ImageType.DARK),
                CalibrationFingerprint.required(light(60, "Ha"), ImageType.DARK));
    }

    @Test
    void flatComparesFilterNotExposure() {
        assertEquals(CalibrationFingerprint.required(light(300, "Ha"), ImageType.FLAT),
                CalibrationFingerprint.required(light(60, "Ha"), ImageType.FLAT));
        assertNotEquals(CalibrationFingerprint.required(light(300, "Ha"), ImageType.FLAT),
                CalibrationFingerprint.required(light(300, "OIII"), ImageType.FLAT));
    }

    @Test
    void gainAndOffsetSeparateEveryType() {
        for (ImageType type : new ImageType[]{ImageType.BIAS, ImageType.DARK, ImageType.FLAT}) {
            FitsSession other = light(300, "Ha");
            other.gain = 300.0;
            assertFalse(CalibrationFingerprint.required(light(300, "Ha"), type)
                    .matches(CalibrationFingerprint.required(other, type)));
            other.gain = 120.0;
            other.offset = 30.0;
            assertFalse(CalibrationFingerprint.required(light(300, "Ha"), type)
                    .matches(CalibrationFingerprint.required(other, type)));
        }
    }

    @Test
    void darkTemperatureMatchesWithinTolerance() {
        FitsSession warmer = light(300, "Ha");
        warmer.ccdTemp = -5.0;
        FitsSession warm = light(300, "Ha");
        warm.ccdTemp = -4.5;
        CalibrationFingerprint required = CalibrationFingerprint.required(light(300, "Ha"), ImageType.DARK);

        assertTrue(required.matches(CalibrationFingerprint.required(warmer, ImageType.DARK)));
        assertFalse(required.matches(CalibrationFingerprint.required(warm, ImageType.DARK)));
        assertNotEquals(required, CalibrationFingerprint.required(warmer, ImageType.DARK));
        assertEquals(CalibrationFingerprint.required(light(300, "Ha"), ImageType.BIAS),
                CalibrationFingerprint.required(warm, ImageType.BIAS));
    }

    @Test
    void lightIsNotACalibrationType() {
        assertThrows(IllegalArgumentException.class,
                () -> CalibrationFingerprint.of(ImageType.LIGHT, "t", "i", 1, 1, null, null, null, null, null));
    }
}
