package com.astrofiler.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.lang.reflect.Proxy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseTest {

    @TempDir
    Path tmp;

    @Test
    void connectCreatesTheParentFolder() throws Exception {
        Database database = new Database(tmp.resolve("nested/dir/astrofiler.db"));
        try (Connection conn = database.connect()) {
            assertFalse(conn.isClosed());
        }
        assertTrue(Files.isDirectory(tmp.resolve("nested/dir")));
    }

    @Test
    void connectionIsClosedWhenSetupFails() {
        AtomicBoolean closed = new AtomicBoolean();
        Connection failing = (Connection) Proxy.newProxyInstance(getClass().getClassLoader(),
                new Class<?>[]{Connection.class}, (proxy, method, args) -> {
                    switch (method.getName()) {
                        case "createStatement":
                            throw new SQLException("database is locked");
                        case "close":
                            closed.set(true);
                            return null;
                        default:
                            throw new UnsupportedOperationException(method.getName());
                    }
                });

        assertThrows(SQLException.class, () -> Database.configure(failing));
        assertTrue(closed.get());
    }
}
