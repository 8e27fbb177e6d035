package com.astrofiler.service;

import com.astrofiler.db.FitsFileDao;
import com.astrofiler.db.MappingDao;
import com.astrofiler.model.BatchResult;
import com.astrofiler.model.FitsFile;
import com.astrofiler.model.HeaderMapping;
import com.astrofiler.model.HeaderKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maintains header value mappings. Every change invalidates the cache used by ingestion.
 */
public class MappingService {
    private static final Logger LOG = LogManager.getLogger(MappingService.class);

    private final MappingDao mappingDao;
    private final FitsFileDao fileDao;
    private final HeaderMappingCache cache;

    public MappingService(MappingDao mappingDao, FitsFileDao fileDao, HeaderMappingCache cache) {
        this.mappingDao = mappingDao;
        this.fileDao = fileDao;
        this.cache = cache;
    }

    public long addMapping(String field, String oldValue, String newValue) throws SQLException {
        long id = mappingDao.insert(field, oldValue, newValue);
        cache.invalidate();
        LOG.info("Mapping {}: {} -> {}", field, oldValue, newValue);
        return id;
    }

    public boolean removeMapping(long id) throws SQLException {
        boolean removed = mappingDao.delete(id);
        cache.invalidate();
        return removed;
    }

    public List<HeaderMapping> listMappings() throws SQLException {
        return mappingDao.findAll();
    }

    /** Rewrites telescope, instrument, object and filter of registered files. */
    public BatchResult applyToRegisteredFiles(CancellationToken token) {
        BatchResult result = new BatchResult();
        List<FitsFile> files;
        try {
            files = fileDao.findAll();
        } catch (SQLException e) {
            LOG.error("Cannot list files for mapping", e);
            result.addError("Database error: " + e.getMessage());
            return result;
        }
        for (int i = 0; i < files.size(); i++) {
            FitsFile f = files.get(i);
            if (!token.proceed(i + 1, files.size(), f.fileName())) {
                result.cancelled = true;
                break;
            }
            result.attempted++;
            try {
                String telescope = mapped(HeaderKey.TELESCOP, f.telescope);
                String instrument = mapped(HeaderKey.INSTRUME, f.instrument);
                String object = mapped(HeaderKey.OBJECT, f.objectName);
                String filter = mapped(HeaderKey.FILTER, f.filter);
                if (Objects.equals(telescope, f.telescope) && Objects.equals(instrument, f.instrument)
                        && Objects.equals(object, f.objectName) && Objects.equals(filter, f.filter)) {
                    continue;
                }
                f.telescope = telescope;
                f.instrument = instrument;
                f.objectName = object;
                f.filter = filter;
                fileDao.updateMappedFields(f);
                result.processed++;
            } catch (SQLException e) {
                LOG.error("Mapping failed for {}", f.path, e);
                result.addError(f.path + ": " + e.getMessage());
            }
        }
        LOG.info("Header mappings changed {} of {} files", result.processed, result.attempted);
        return result;
    }

    private String mapped(HeaderKey key, String value) throws SQLException {
        if (value == null) return null;
        Optional<String> m = cache.lookup(key.key(), value);
        return m.orElse(value);
    }
}
