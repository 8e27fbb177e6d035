package com.astrofiler.service;

import com.astrofiler.exception.VendorNormalizationException;
import com.astrofiler.model.FitsHeader;
import com.astrofiler.model.HeaderKey;
import com.astrofiler.model.ImageType;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Header repair applied before classification: vendor reconstruction, then the
 * generic fixes, then the user's value mappings.
 */
public class HeaderNormalizer {

    private final DwarfHeaderFixer dwarfFixer;
    private final HeaderMappingCache mappingCache;

    public HeaderNormalizer(DwarfHeaderFixer dwarfFixer, HeaderMappingCache mappingCache) {
        this.dwarfFixer = dwarfFixer;
        this.mappingCache = mappingCache;
    }

    public void normalize(Path file, FitsHeader header) throws VendorNormalizationException, SQLException {
        if (DwarfHeaderFixer.applies(header)) {
            dwarfFixer.fix(file, header);
        }
        applyGenericFixes(header);
        applyMappings(header);
    }

    void applyGenericFixes(FitsHeader header) {
        if (!header.has(HeaderKey.IMAGETYP) && header.has(HeaderKey.FRAME)) {
            header.set(HeaderKey.IMAGETYP, header.getString(HeaderKey.FRAME).get());
        }

        Optional<ImageType> type = ImageType.fromImageTyp(header.getString(HeaderKey.IMAGETYP).orElse(null));
        if (type.isPresent() && type.get().isCalibration()) {
            header.set(HeaderKey.OBJECT, type.get().label());
        }

        if (!header.has(HeaderKey.CD1_1)) {
            Optional<Double> cdelt1 = header.getDouble(HeaderKey.CDELT1);
            Optional<Double> cdelt2 = header.getDouble(HeaderKey.CDELT2);
            Optional<Double> crota2 = header.getDouble(HeaderKey.CROTA2);
            if (cdelt1.isPresent() && cdelt2.isPresent() && crota2.isPresent()) {
                double theta = crota2.get();
                header.set(HeaderKey.CD1_1, cdelt1.get() * Math.cos(theta));
                header.set(HeaderKey.CD1_2, -cdelt2.get() * Math.sin(theta));
                header.set(HeaderKey.CD2_1, cdelt1.get() * Math.sin(theta));
                header.set(HeaderKey.CD2_2, cdelt2.get() * Math.cos(theta));
            }
        }
    }

    void applyMappings(FitsHeader header) throws SQLException {
        for (String key : new ArrayList<>(header.keys())) {
            Object raw = header.getRaw(key);
            if (!(raw instanceof String)) continue;
            Optional<String> mapped = mappingCache.lookup(key, (String) raw);
            if (mapped.isPresent()) {
                header.set(key, mapped.get());
            }
        }
    }
}
