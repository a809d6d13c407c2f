package org.example.crowdledger.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

public class LocalAccountTest {

    @TempDir Path tempDir;

    @Test
    @DisplayName("first call generates and saves an account; later calls return it")
    void ensure_isStable() throws Exception {
        Path file = tempDir.resolve(".local").resolve("account");
        String first = LocalAccount.ensureCurrentAccount(file);
        assertTrue(first.startsWith("user-"));
        assertEquals(first, Files.readString(file).trim());
        assertEquals(first, LocalAccount.ensureCurrentAccount(file));
    }

    @Test
    @DisplayName("setCurrentAccount overwrites the saved name and rejects blanks")
    void setCurrent() {
        Path file = tempDir.resolve("account");
        assertTrue(LocalAccount.setCurrentAccount(file, "  carol "));
        assertEquals("carol", LocalAccount.ensureCurrentAccount(file));
        assertFalse(LocalAccount.setCurrentAccount(file, " "));
        assertEquals("carol", LocalAccount.ensureCurrentAccount(file));
    }
}
