package com.astrofiler.service;

import com.astrofiler.db.MappingDao;
import com.astrofiler.model.HeaderMapping;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup table of header value substitutions, loaded from the mapping store on first use
 * and kept until {@link #invalidate()} is called.
 */
public class HeaderMappingCache {
    private static final Logger LOG = LogManager.getLogger(HeaderMappingCache.class);

    private final MappingDao mappingDao;
    private Map<String, String> table;

    public HeaderMappingCache(MappingDao mappingDao) {
        this.mappingDao = mappingDao;
    }

    public synchronized Optional<String> lookup(String field, String oldValue) throws SQLException {
        if (field == null || oldValue == null) return Optional.empty();
        if (table == null) {
            table = load();
        }
        return Optional.ofNullable(table.get(key(field, oldValue)));
    }

    public synchronized void invalidate() {
        table = null;
        LOG.debug("Header mapping cache invalidated");
    }

    public synchronized boolean isLoaded() {
        return table != null;
    }

    private Map<String, String> load() throws SQLException {
        Map<String, String> loaded = new HashMap<>();
        for (HeaderMapping m : mappingDao.findAll()) {
            loaded.put(key(m.field, m.oldValue), m.newValue);
        }
        LOG.debug("Loaded {} header mappings", loaded.size());
        return loaded;
    }

    private static String key(String field, String value) {
        return value.trim().toUpperCase(Locale.ROOT) + '\u0000' + field.trim().toUpperCase(Locale.ROOT);
    }
}
