package com.astrofiler.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naming grammars of the DWARF smart telescopes, which write almost no header cards and
 * encode acquisition settings in folder and file names instead.
 * <p>
 * Each grammar matches one name and yields its named fields ({@code instrument},
 * {@code object}, {@code exposure}, {@code gain}, {@code binning}, {@code temp},
 * {@code date}, as far as the grammar has them).
 */
public enum DwarfGrammar {

    /** Light folder: {@code DWARF_RAW_<INSTRUMENT>_<OBJECT>_EXP_<EXPTIME>_GAIN_<GAIN>_<DATE>}. */
    RAW_FOLDER("DWARF_RAW_(?<instrument>[A-Za-z0-9]+)_(?<object>.+?)_EXP_(?<exposure>" + Patterns.NUMBER + ")"
            + "_GAIN_(?<gain>" + Patterns.NUMBER + ")_(?<date>.+)"),

    /** {@code CALI_FRAME/bias/<cam>/bias_gain_<G>_bin_<B>_*}. */
    BIAS_FILE("bias_gain_(?<gain>" + Patterns.NUMBER + ")_bin_(?<binning>\\d+)(?:_.*)?"),

    /** {@code CALI_FRAME/flat/<cam>/flat_gain_<G>_bin_<B>_*}. */
    FLAT_FILE("flat_gain_(?<gain>" + Patterns.NUMBER + ")_bin_(?<binning>\\d+)(?:_.*)?"),

    /** {@code CALI_FRAME/dark/<cam>/dark_exp_<E>_gain_<G>_bin_<B>_<T>_*}. */
    DARK_FILE("dark_exp_(?<exposure>" + Patterns.NUMBER + ")_gain_(?<gain>" + Patterns.NUMBER + ")"
            + "_bin_(?<binning>\\d+)_(?<temp>-?" + Patterns.NUMBER + ")(?:_.*)?"),

    /** {@code DWARF_DARK/tele_exp_<E>_gain_<G>_bin_<B>_<DATE>}. */
    DARK_LIBRARY_FILE("tele_exp_(?<exposure>" + Patterns.NUMBER + ")_gain_(?<gain>" + Patterns.NUMBER + ")"
            + "_bin_(?<binning>\\d+)_(?<date>.+)");

    private static final List<String> FIELDS =
            List.of("instrument", "object", "exposure", "gain", "binning", "temp", "date");

    private final Pattern pattern;

    DwarfGrammar(String regex) {
        this.pattern = Pattern.compile(regex);
    }

    public Optional<Map<String, String>> parse(String name) {
        if (name == null) return Optional.empty();
        Matcher m = pattern.matcher(name);
        if (!m.matches()) return Optional.empty();
        Map<String, String> fields = new LinkedHashMap<>();
        for (String field : FIELDS) {
            if (pattern.pattern().contains("(?<" + field + ">")) {
                fields.put(field, m.group(field));
            }
        }
        return Optional.of(fields);
    }

    private static final class Patterns {
        static final String NUMBER = "\\d+(?:\\.\\d+)?";
    }
}
