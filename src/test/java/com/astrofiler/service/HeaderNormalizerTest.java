package com.astrofiler.service;

import com.astrofiler.db.MappingDao;
import com.astrofiler.db.TestDatabases;
import com.astrofiler.model.FitsHeader;
import com.astrofiler.model.HeaderKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeaderNormalizerTest {

    @TempDir
    Path tmp;

    private MappingDao mappingDao;
    private HeaderMappingCache cache;
    private HeaderNormalizer normalizer;

    @BeforeEach
    void setUp() throws Exception {
        mappingDao = new MappingDao(TestDatabases.create(tmp));
        cache = new HeaderMappingCache(mappingDao);
        normalizer = new HeaderNormalizer(new DwarfHeaderFixer(Clock.systemUTC()), cache);
    }

    private static FitsHeader header(Object... kv) {
        Map<String, Object> m = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
        return new FitsHeader(m);
    }

    @Test
    void frameIsCopiedToImageTyp() throws Exception {
        FitsHeader h = header("FRAME", "Light", "OBJECT", "M42");
        normalizer.normalize(tmp.resolve("a.fits"), h);
        assertEquals("Light", h.getString(HeaderKey.IMAGETYP).get());
        assertEquals("M42", h.getString(HeaderKey.OBJECT).get());
    }

    @Test
    void calibrationObjectIsForced() throws Exception {
        FitsHeader h = header("IMAGETYP", "Dark Frame", "OBJECT", "M42");
        normalizer.normalize(tmp.resolve("a.fits"), h);
        assertEquals("Dark", h.getString(HeaderKey.OBJECT).get());

        FitsHeader flat = header("IMAGETYP", "FLAT");
        normalizer.normalize(tmp.resolve("b.fits"), flat);
        assertEquals("Flat", flat.getString(HeaderKey.OBJECT).get());
    }

    @Test
    void cdMatrixIsSynthesized() throws Exception {
        double theta = 0.5;
        FitsHeader h = header("IMAGETYP", "Light", "CDELT1", 2.0, "CDELT2", 3.0, "CROTA2", theta);
        normalizer.normalize(tmp.resolve("a.fits"), h);

        assertEquals(2.0 * Math.cos(theta), h.getDouble(HeaderKey.CD1_1).get(), 1e-12);
        assertEquals(-3.0 * Math.sin(theta), h.getDouble(HeaderKey.CD1_2).get(), 1e-12);
        assertEquals(2.0 * Math.sin(theta), h.getDouble(HeaderKey.CD2_1).get(), 1e-12);
        assertEquals(3.0 * Math.cos(theta), h.getDouble(HeaderKey.CD2_2).get(), 1e-12);
    }

    @Test
    void existingCdMatrixIsKept() throws Exception {
        FitsHeader h = header("IMAGETYP", "Light", "CD1_1", 7.0, "CDELT1", 2.0, "CDELT2", 3.0, "CROTA2", 0.5);
        normalizer.normalize(tmp.resolve("a.fits"), h);
        assertEquals(7.0, h.getDouble(HeaderKey.CD1_1).get());
        assertFalse(h.has(HeaderKey.CD2_2));
    }

    @Test
    void mappingsAreAppliedIgnoringCase() throws Exception {
        mappingDao.insert("TELESCOP", "c8", "Celestron C8");
        FitsHeader h = header("IMAGETYP", "Light", "TELESCOP", "C8", "INSTRUME", "c8");
        normalizer.normalize(tmp.resolve("a.fits"), h);

        assertEquals("Celestron C8", h.getString(HeaderKey.TELESCOP).get());
        assertEquals("c8", h.getString(HeaderKey.INSTRUME).get());
        assertTrue(h.modifiedKeys().contains("TELESCOP"));
    }

    @Test
    void mappingCacheIsReusedUntilInvalidated() throws Exception {
        normalizer.normalize(tmp.resolve("a.fits"), header("IMAGETYP", "Light", "TELESCOP", "C8"));
        assertTrue(cache.isLoaded());

        mappingDao.insert("TELESCOP", "C8", "Celestron C8");
        FitsHeader stale = header("IMAGETYP", "Light", "TELESCOP", "C8");
        normalizer.normalize(tmp.resolve("b.fits"), stale);
        assertEquals("C8", stale.getString(HeaderKey.TELESCOP).get());

        cache.invalidate();
        FitsHeader fresh = header("IMAGETYP", "Light", "TELESCOP", "C8");
        normalizer.normalize(tmp.resolve("c.fits"), fresh);
        assertEquals("Celestron C8", fresh.getString(HeaderKey.TELESCOP).get());
    }
}
