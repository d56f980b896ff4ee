package com.logicsim.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class FileLastExpressionStoreTest {
    @TempDir
    Path dir;

    @Test
    public void testMissingFileLoadsEmpty() throws IOException {
        FileLastExpressionStore store = new FileLastExpressionStore(dir.resolve(".last_expr"));

        assertEquals(Optional.empty(), store.load());
        assertEquals(LastExpressionStore.DEFAULT_EXPRESSION, store.loadOrDefault());
    }

    @Test
    public void testSaveThenLoad() throws IOException {
        FileLastExpressionStore store = new FileLastExpressionStore(dir.resolve(".last_expr"));

        store.save("  A XOR B \n");

        assertEquals(Optional.of("A XOR B"), store.load());
        assertEquals("A XOR B", Files.readString(store.file(), StandardCharsets.UTF_8));
        assertEquals("A XOR B", new FileLastExpressionStore(store.file()).loadOrDefault());
    }

    @Test
    public void testBlankFileLoadsEmpty() throws IOException {
        Path file = dir.resolve(".last_expr");
        Files.writeString(file, " \n\t");

        assertEquals(Optional.empty(), new FileLastExpressionStore(file).load());
    }

    @Test
    public void testSaveCreatesParentDirectories() throws IOException {
        FileLastExpressionStore store = new FileLastExpressionStore(dir.resolve("state/nested/last"));

        store.save("NOT A");

        assertEquals(Optional.of("NOT A"), store.load());
    }

    @Test
    public void testDirectoryInPlaceOfFile() throws IOException {
        // a directory sits where the file should be
        Path file = Files.createDirectory(dir.resolve("occupied"));
        FileLastExpressionStore store = new FileLastExpressionStore(file);

        assertEquals(LastExpressionStore.DEFAULT_EXPRESSION, store.loadOrDefault());
        assertThrows(IOException.class, () -> store.save("A"));
    }

    @Test
    public void testDefaultLocation() {
        assertEquals(Path.of(".last_expr"), new FileLastExpressionStore().file());
    }
}
