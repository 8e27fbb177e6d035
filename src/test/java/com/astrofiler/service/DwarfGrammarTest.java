package com.astrofiler.service;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class DwarfGrammarTest {

    @Test
    void rawFolderWithUnderscoreInObject() {
        Map<String, String> f = DwarfGrammar.RAW_FOLDER
                .parse("DWARF_RAW_TELE_M 42_Orion_EXP_15_GAIN_80_2024-10-08-21-04-39-046").get();
        assertEquals("TELE", f.get("instrument"));
        assertEquals("M 42_Orion", f.get("object"));
        assertEquals("15", f.get("exposure"));
        assertEquals("80", f.get("gain"));
        assertEquals("2024-10-08-21-04-39-046", f.get("date"));
    }

    @Test
    void calibrationFileNames() {
        Map<String, String> bias = DwarfGrammar.BIAS_FILE.parse("bias_gain_2_bin_1_20241008").get();
        assertEquals("2", bias.get("gain"));
        assertEquals("1", bias.get("binning"));

        Map<String, String> dark = DwarfGrammar.DARK_FILE.parse("dark_exp_60_gain_80_bin_2_-15_x").get();
        assertEquals("60", dark.get("exposure"));
        assertEquals("2", dark.get("binning"));
        assertEquals("-15", dark.get("temp"));

        Map<String, String> library = DwarfGrammar.DARK_LIBRARY_FILE
                .parse("tele_exp_0.5_gain_60_bin_1_2024-10-08-21-04-39").get();
        assertEquals("0.5", library.get("exposure"));
        assertEquals("2024-10-08-21-04-39", library.get("date"));
    }

    @Test
    void malformedNamesDoNotMatch() {
        assertFalse(DwarfGrammar.RAW_FOLDER.parse("DWARF_RAW_TELE_M42_EXP_x_GAIN_80_2024").isPresent());
        assertFalse(DwarfGrammar.DARK_FILE.parse("dark_exp_60_gain_80").isPresent());
        assertFalse(DwarfGrammar.FLAT_FILE.parse("bias_gain_2_bin_1").isPresent());
    }

    @Test
    void dwarfDatesBecomeIso() {
        assertEquals("2024-10-08T21:04:39", DwarfHeaderFixer.toIsoDate("2024-10-08-21-04-39-046").get());
        assertFalse(DwarfHeaderFixer.toIsoDate("yesterday").isPresent());
        assertFalse(DwarfHeaderFixer.toIsoDate("2024-13-40-21-04-39").isPresent());
    }
}
