package com.astrofiler.service;

import com.astrofiler.db.Database;
import com.astrofiler.db.FitsFileDao;
import com.astrofiler.db.FitsSessionDao;
import com.astrofiler.db.MasterDao;
import com.astrofiler.db.TestDatabases;
import com.astrofiler.model.BatchResult;
import com.astrofiler.model.FitsFile;
import com.astrofiler.model.FitsHeader;
import com.astrofiler.model.FitsSession;
import com.astrofiler.model.HeaderKey;
import com.astrofiler.model.ImageType;
import com.astrofiler.model.Master;
import com.astrofiler.model.MasterValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisabledOnOs(OS.WINDOWS)
class MasterFrameManagerTest {

    private static final String COPY_FIRST_INPUT = "#!/bin/sh\n"
            + "script=\"$2\"\n"
            + "src=$(grep '^load ' \"$script\" | head -n 1 | sed -e 's/^load \"//' -e 's/\"$//')\n"
            + "dst=$(grep '^save ' \"$script\" | sed -e 's/^save \"//' -e 's/\"$//')\n"
            + "cp \"$src\" \"$dst\"\n";

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tmp;

    private Path repo;
    private Database database;
    private FitsFileDao fileDao;
    private FitsSessionDao sessionDao;
    private MasterDao masterDao;

    @BeforeEach
    void setUp() throws Exception {
        repo = Files.createDirectories(tmp.resolve("repo"));
        database = TestDatabases.create(tmp);
        fileDao = new FitsFileDao(database);
        sessionDao = new FitsSessionDao(database);
        masterDao = new MasterDao(database);
    }

    private Path tool(String name, String body) throws Exception {
        Path script = tmp.resolve(name);
        Files.writeString(script, body);
        assertTrue(script.toFile().setExecutable(true));
        return script;
    }

    private MasterFrameManager manager(Path tool) {
        FitsHeaderService headers = new FitsHeaderService();
        return new MasterFrameManager(fileDao, sessionDao, masterDao, headers,
                new ExternalToolService(tool.toString()), new MasterIntegrityService(headers),
                new RepositoryLayout(repo), CLOCK);
    }

    private FitsSession darkSession(int frames) throws Exception {
        return darkSession(frames, "2023-07-15", null);
    }

    private FitsSession darkSession(int frames, String night, Double gain) throws Exception {
        FitsSession s = new FitsSession();
        s.id = UUID.randomUUID().toString();
        s.objectName = "Dark";
        s.date = LocalDateTime.parse(night + "T22:00:00");
        s.gain = gain;
        s.telescope = "Celestron";
        s.imager = "ASI294";
        s.xBinning = 1;
        s.yBinning = 1;
        s.exposure = 300.0;
        sessionDao.insert(s);
        for (int i = 0; i < frames; i++) {
            String date = night + "T22:0" + i + ":00";
            Path file = FitsFixtures.write(tmp.resolve("darks").resolve(s.id).resolve("dark" + i + ".fits"),
                    FitsFixtures.dark(date, 300.0));
            FitsFile f = new FitsFile();
            f.id = UUID.randomUUID().toString();
            f.path = RepositoryLayout.toStoredPath(file);
            f.type = ImageType.DARK;
            f.objectName = "Dark";
            f.captureDate = LocalDateTime.parse(date);
            f.exposure = 300.0;
            f.telescope = "Celestron";
            f.instrument = "ASI294";
            f.ccdTemp = -10.0;
            f.gain = gain;
            f.sessionId = s.id;
            fileDao.insert(f);
        }
        return s;
    }

    private FitsSession lightSession() throws Exception {
        FitsSession s = new FitsSession();
        s.id = UUID.randomUUID().toString();
        s.objectName = "M31";
        s.date = LocalDateTime.parse("2023-07-16T22:00:00");
        s.telescope = "Celestron";
        s.imager = "ASI294";
        s.xBinning = 1;
        s.yBinning = 1;
        s.exposure = 300.0;
        s.filter = "Ha";
        sessionDao.insert(s);
        return s;
    }

    private Master storedMaster(ImageType type, String created, Path file) throws Exception {
        return storedMaster(type, created, file, 300.0);
    }

    private Master storedMaster(ImageType type, String created, Path file, double darkExposure) throws Exception {
        Master m = new Master();
        m.id = UUID.randomUUID().toString();
        m.type = type;
        m.telescope = "Celestron";
        m.instrument = "ASI294";
        m.exposure = type == ImageType.DARK ? darkExposure : null;
        m.path = RepositoryLayout.toStoredPath(file);
        m.creationDate = LocalDateTime.parse(created);
        m.frameCount = 10;
        if (Files.exists(file)) {
            m.contentHash = HashService.hash(file);
            m.fileSize = Files.size(file);
        }
        masterDao.insert(m);
        return m;
    }

    @Test
    void tooFewFramesProduceNoMaster() throws Exception {
        FitsSession session = darkSession(1);

        Optional<Master> master = manager(tool("stack.sh", COPY_FIRST_INPUT))
                .createMasterFromSession(session.id, ImageType.DARK, 2);

        assertFalse(master.isPresent());
        assertTrue(masterDao.findAll().isEmpty());
    }

    @Test
    void masterIsStackedTaggedAndLinkedToItsSession() throws Exception {
        FitsSession session = darkSession(3);

        Master master = manager(tool("stack.sh", COPY_FIRST_INPUT))
                .createMasterFromSession(session.id, ImageType.DARK, 2).get();

        Path file = Paths.get(master.path);
        assertTrue(Files.isRegularFile(file));
        assertEquals(repo.resolve("Masters").toAbsolutePath().normalize(), file.getParent());
        assertEquals("Master-Dark-Celestron-ASI294-20230715-300s-1x1-t-10.fits", file.getFileName().toString());
        assertEquals(3, master.frameCount);
        assertEquals(HashService.hash(file), master.contentHash);

        FitsHeader header = new FitsHeaderService().readHeader(file);
        assertEquals("Master Dark", header.getString(HeaderKey.IMAGETYP).get());
        assertEquals(3, header.getInt(HeaderKey.NCOMBINE).get());
        assertEquals(session.id, header.getString(HeaderKey.SESSID).get());

        assertEquals(master.path, sessionDao.findById(session.id).get().darkMaster);
        try (Stream<Path> leftovers = Files.list(file.getParent())) {
            assertEquals(1, leftovers.count());
        }
    }

    @Test
    void rebuildingUpdatesTheExistingMaster() throws Exception {
        FitsSession session = darkSession(2);
        MasterFrameManager manager = manager(tool("stack.sh", COPY_FIRST_INPUT));

        Master first = manager.createMasterFromSession(session.id, ImageType.DARK, 2).get();
        Master second = manager.createMasterFromSession(session.id, ImageType.DARK, 2).get();

        assertEquals(first.id, second.id);
        assertEquals(1, masterDao.findAll().size());
    }

    @Test
    void rebuildOnAnotherNightLeavesOneMasterFile() throws Exception {
        FitsSession first = darkSession(2, "2023-07-15", null);
        FitsSession second = darkSession(2, "2023-07-20", null);
        MasterFrameManager manager = manager(tool("stack.sh", COPY_FIRST_INPUT));

        Master older = manager.createMasterFromSession(first.id, ImageType.DARK, 2).get();
        Master newer = manager.createMasterFromSession(second.id, ImageType.DARK, 2).get();

        assertEquals(older.id, newer.id);
        assertFalse(Files.exists(Paths.get(older.path)));
        try (Stream<Path> files = Files.list(repo.resolve("Masters"))) {
            assertEquals(List.of(Paths.get(newer.path).getFileName()),
                    files.map(Path::getFileName).collect(Collectors.toList()));
        }
        assertEquals(newer.path, sessionDao.findById(first.id).get().darkMaster);
    }

    @Test
    void differentGainsGetTheirOwnMasters() throws Exception {
        FitsSession low = darkSession(2, "2023-08-02", 100.0);
        FitsSession high = darkSession(2, "2023-08-02", 300.0);
        MasterFrameManager manager = manager(tool("stack.sh", COPY_FIRST_INPUT));

        Master lowMaster = manager.createMasterFromSession(low.id, ImageType.DARK, 2).get();
        Master highMaster = manager.createMasterFromSession(high.id, ImageType.DARK, 2).get();

        assertFalse(lowMaster.id.equals(highMaster.id));
        assertFalse(lowMaster.path.equals(highMaster.path));
        assertEquals(2, masterDao.findAll().size());
        assertTrue(Files.exists(Paths.get(lowMaster.path)));
        assertEquals(lowMaster.path, sessionDao.findById(low.id).get().darkMaster);

        FitsSession light = lightSession();
        light.ccdTemp = -10.0;
        light.gain = 100.0;
        assertEquals(lowMaster.id, manager.findMatchingMaster(light, ImageType.DARK).get().id);
        light.gain = 200.0;
        assertFalse(manager.findMatchingMaster(light, ImageType.DARK).isPresent());
    }

    @Test
    void registeredMasterKeepsItsHeaderDate() throws Exception {
        Map<String, Object> cards = FitsFixtures.dark("2022-01-01T00:00:00", 300.0);
        cards.put("DATE", "2022-01-03T10:15:00");
        Path dated = FitsFixtures.write(tmp.resolve("import/master_dark_dated.fits"), cards);
        Path undated = FitsFixtures.write(tmp.resolve("import/master_bias_undated.fits"),
                FitsFixtures.dark("2022-01-01T00:00:00", 0.0));
        MasterFrameManager manager = manager(tool("stack.sh", COPY_FIRST_INPUT));

        String datedId = manager.registerMasterFile(dated).id;
        String undatedId = manager.registerMasterFile(undated).id;

        assertEquals(LocalDateTime.parse("2022-01-03T10:15:00"), masterDao.findById(datedId).get().creationDate);
        assertEquals(LocalDateTime.now(CLOCK), masterDao.findById(undatedId).get().creationDate);
    }

    @Test
    void failingToolLeavesNoRecordAndNoFile() throws Exception {
        FitsSession session = darkSession(2);

        Optional<Master> master = manager(tool("fail.sh", "#!/bin/sh\nexit 3\n"))
                .createMasterFromSession(session.id, ImageType.DARK, 2);

        assertFalse(master.isPresent());
        assertTrue(masterDao.findAll().isEmpty());
        try (Stream<Path> files = Files.list(repo.resolve("Masters"))) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void toolWithoutOutputCountsAsFailure() throws Exception {
        FitsSession session = darkSession(2);

        Optional<Master> master = manager(tool("silent.sh", "#!/bin/sh\nexit 0\n"))
                .createMasterFromSession(session.id, ImageType.DARK, 2);

        assertFalse(master.isPresent());
        assertTrue(masterDao.findAll().isEmpty());
    }

    @Test
    void batchCreationSkipsSessionsThatHaveAMaster() throws Exception {
        darkSession(2);
        MasterFrameManager manager = manager(tool("stack.sh", COPY_FIRST_INPUT));

        BatchResult first = manager.createMastersForSessions(2, CancellationToken.none());
        BatchResult second = manager.createMastersForSessions(2, CancellationToken.none());

        assertEquals(1, first.processed);
        assertEquals(0, second.attempted);
    }

    @Test
    void scriptLoadsEveryInputThenStacks() {
        List<String> flat = MasterFrameManager.buildScript(ImageType.FLAT,
                List.of(Paths.get("/data/a.fits"), Paths.get("/data/b.fits")), Paths.get("/data/out.fits"));
        assertEquals(List.of("load \"/data/a.fits\"", "load \"/data/b.fits\"", "stack median -norm=mul",
                "save \"/data/out.fits\""), flat);

        List<String> bias = MasterFrameManager.buildScript(ImageType.BIAS,
                List.of(Paths.get("/data/a.fits")), Paths.get("/data/out.fits"));
        assertEquals("stack median -nonorm", bias.get(1));
    }

    @Test
    void newestMatchingMasterWins() throws Exception {
        FitsSession light = lightSession();
        Path older = FitsFixtures.write(repo.resolve("Masters/old.fits"), FitsFixtures.dark("2023-01-01T00:00:00", 300));
        Path newer = FitsFixtures.write(repo.resolve("Masters/new.fits"), FitsFixtures.dark("2023-06-01T00:00:00", 300));
        storedMaster(ImageType.DARK, "2023-01-02T00:00:00", older);
        Master expected = storedMaster(ImageType.DARK, "2023-06-02T00:00:00", newer);
        storedMaster(ImageType.DARK, "2023-07-02T00:00:00", newer, 60.0);

        MasterFrameManager manager = manager(tool("stack.sh", COPY_FIRST_INPUT));
        assertEquals(expected.id, manager.findMatchingMaster(light, ImageType.DARK).get().id);
        assertFalse(manager.findMatchingMaster(light, ImageType.FLAT).isPresent());

        manager.assignMastersToLightSessions(CancellationToken.none());
        FitsSession assigned = sessionDao.findById(light.id).get();
        assertEquals(expected.path, assigned.darkMaster);
        assertNull(assigned.biasMaster);
    }

    @Test
    void validationSortsMastersIntoMissingInvalidAndValid() throws Exception {
        Path good = FitsFixtures.write(repo.resolve("Masters/good.fits"), FitsFixtures.dark("2023-01-01T00:00:00", 300));
        Path tampered = FitsFixtures.write(repo.resolve("Masters/tampered.fits"), FitsFixtures.dark("2023-01-01T00:00:00", 60));
        storedMaster(ImageType.DARK, "2024-01-01T00:00:00", good);
        Master changed = storedMaster(ImageType.BIAS, "2024-01-01T00:00:00", tampered);
        Files.write(tampered, new byte[]{1, 2, 3}, StandardOpenOption.APPEND);
        Master gone = storedMaster(ImageType.FLAT, "2024-01-01T00:00:00", repo.resolve("Masters/gone.fits"));

        MasterValidationReport report = manager(tool("stack.sh", COPY_FIRST_INPUT))
                .validateMasters(CancellationToken.none());

        assertEquals(3, report.checked);
        assertEquals(1, report.valid);
        assertEquals(List.of(gone.path), report.missing);
        assertEquals(List.of(changed.path), report.invalid);
        assertFalse(masterDao.findById(gone.id).get().validated);
    }

    @Test
    void cleanupRetiresOnlyOldUnreferencedMasters() throws Exception {
        FitsSession light = lightSession();
        Path unused = FitsFixtures.write(repo.resolve("Masters/unused.fits"), FitsFixtures.dark("2022-01-01T00:00:00", 300));
        Path used = FitsFixtures.write(repo.resolve("Masters/used.fits"), FitsFixtures.dark("2022-01-01T00:00:00", 300));
        Path recent = FitsFixtures.write(repo.resolve("Masters/recent.fits"), FitsFixtures.dark("2024-02-01T00:00:00", 300));
        Master old = storedMaster(ImageType.DARK, "2022-01-02T00:00:00", unused);
        Master referenced = storedMaster(ImageType.DARK, "2022-01-02T00:00:00", used);
        storedMaster(ImageType.DARK, "2024-02-02T00:00:00", recent);
        sessionDao.setMasterPath(light.id, ImageType.DARK, referenced.path);

        BatchResult result = manager(tool("stack.sh", COPY_FIRST_INPUT))
                .cleanupMasters(365, CancellationToken.none());

        assertEquals(1, result.processed);
        assertFalse(Files.exists(unused));
        assertTrue(masterDao.findById(old.id).get().softDeleted);
        assertTrue(Files.exists(used));
        assertTrue(Files.exists(recent));
        assertFalse(masterDao.findById(referenced.id).get().softDeleted);
    }
}
