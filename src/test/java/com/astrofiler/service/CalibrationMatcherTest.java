package com.astrofiler.service;

import com.astrofiler.db.FitsSessionDao;
import com.astrofiler.db.TestDatabases;
import com.astrofiler.model.BatchResult;
import com.astrofiler.model.FitsSession;
import com.astrofiler.model.ImageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CalibrationMatcherTest {

    @TempDir
    Path tmp;

    private FitsSessionDao sessionDao;
    private CalibrationMatcher matcher;

    @BeforeEach
    void setUp() throws Exception {
        sessionDao = new FitsSessionDao(TestDatabases.create(tmp));
        matcher = new CalibrationMatcher(sessionDao);
    }

    private static FitsSession session(String object, String date, Double exposure, String filter) {
        FitsSession s = new FitsSession();
        s.id = UUID.randomUUID().toString();
        s.objectName = object;
        s.date = LocalDateTime.parse(date);
        s.telescope = "Celestron";
        s.imager = "ASI294";
        s.xBinning = 1;
        s.yBinning = 1;
        s.exposure = exposure;
        s.filter = filter;
        return s;
    }

    private FitsSession insert(String object, String date, Double exposure, String filter) throws Exception {
        FitsSession s = session(object, date, exposure, filter);
        sessionDao.insert(s);
        return s;
    }

    @Test
    void closestCalibrationSessionIsLinked() throws Exception {
        FitsSession light = insert("M31", "2023-07-15T22:00:00", 300.0, "Ha");
        insert("Bias", "2023-07-01T12:00:00", null, null);
        FitsSession nearBias = insert("Bias", "2023-07-14T12:00:00", null, null);
        FitsSession dark = insert("Dark", "2023-07-20T12:00:00", 300.0, null);
        insert("Dark", "2023-07-15T12:00:00", 60.0, null);
        FitsSession flat = insert("Flat", "2023-07-16T06:00:00", 1.0, "Ha");
        insert("Flat", "2023-07-15T23:00:00", 1.0, "OIII");

        BatchResult result = matcher.linkSessions(CancellationToken.none());

        assertEquals(1, result.processed);
        FitsSession linked = sessionDao.findById(light.id).get();
        assertEquals(nearBias.id, linked.biasSession);
        assertEquals(dark.id, linked.darkSession);
        assertEquals(flat.id, linked.flatSession);
    }

    @Test
    void equalDistancePrefersTheLaterSession() {
        FitsSession light = session("M31", "2023-07-15T22:00:00", 300.0, "Ha");
        FitsSession before = session("Bias", "2023-07-14T22:00:00", null, null);
        FitsSession after = session("Bias", "2023-07-16T22:00:00", null, null);

        FitsSession best = CalibrationMatcher.bestMatch(light, ImageType.BIAS, List.of(before, after)).get();

        assertEquals(after.id, best.id);
    }

    @Test
    void differentBinningNeverMatches() {
        FitsSession light = session("M31", "2023-07-15T22:00:00", 300.0, "Ha");
        FitsSession binned = session("Bias", "2023-07-15T21:00:00", null, null);
        binned.xBinning = 2;
        binned.yBinning = 2;

        assertFalse(CalibrationMatcher.bestMatch(light, ImageType.BIAS, List.of(binned)).isPresent());
    }

    @Test
    void darkWithOtherGainIsSkippedEvenWhenCloser() throws Exception {
        FitsSession light = session("M31", "2023-08-02T22:00:00", 300.0, "Ha");
        light.gain = 100.0;
        sessionDao.insert(light);
        FitsSession sameGain = session("Dark", "2023-07-20T12:00:00", 300.0, null);
        sameGain.gain = 100.0;
        sessionDao.insert(sameGain);
        FitsSession otherGain = session("Dark", "2023-08-02T23:00:00", 300.0, null);
        otherGain.gain = 300.0;
        sessionDao.insert(otherGain);

        matcher.linkSessions(CancellationToken.none());

        assertEquals(sameGain.id, sessionDao.findById(light.id).get().darkSession);
    }

    @Test
    void existingLinksAreKeptUntilCleared() throws Exception {
        FitsSession light = insert("M31", "2023-07-15T22:00:00", 300.0, "Ha");
        FitsSession far = insert("Bias", "2023-07-01T12:00:00", null, null);
        matcher.linkSessions(CancellationToken.none());
        assertEquals(far.id, sessionDao.findById(light.id).get().biasSession);

        FitsSession near = insert("Bias", "2023-07-15T20:00:00", null, null);
        matcher.linkSessions(CancellationToken.none());
        assertEquals(far.id, sessionDao.findById(light.id).get().biasSession);

        assertTrue(matcher.clearLinks() >= 1);
        assertNull(sessionDao.findById(light.id).get().biasSession);
        matcher.linkSessions(CancellationToken.none());
        assertEquals(near.id, sessionDao.findById(light.id).get().biasSession);
    }

    @Test
    void lightWithoutCandidatesStaysUnlinked() throws Exception {
        FitsSession light = insert("M31", "2023-07-15T22:00:00", 300.0, "Ha");
        insert("Flat", "2023-07-15T23:00:00", 1.0, "OIII");

        BatchResult result = matcher.linkSessions(CancellationToken.none());

        assertEquals(1, result.processed);
        assertTrue(result.errors().isEmpty());
        assertNull(sessionDao.findById(light.id).get().flatSession);
    }
}
