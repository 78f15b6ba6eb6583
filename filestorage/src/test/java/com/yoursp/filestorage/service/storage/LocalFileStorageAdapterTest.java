package com.yoursp.filestorage.service.storage;

import com.yoursp.filestorage.service.storage.exception.FileKeyNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LocalFileStorageAdapterTest {

    @TempDir
    Path tempDir;

    private LocalFileStorageAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new LocalFileStorageAdapter(tempDir);
    }

    @Test
    void testSaveAndLoad() {
        byte[] data = "Hello, storage!".getBytes();

        assertTrue(adapter.save(new FileRecord("test.txt", data)));

        FileRecord loaded = adapter.load("test.txt");
        assertEquals("test.txt", loaded.getKey());
        assertArrayEquals(data, loaded.getContent());
        assertNotNull(loaded.getLastModified());
    }

    @Test
    void testSaveWithSubdirectory() throws Exception {
        byte[] data = "Nested content".getBytes();

        adapter.save(new FileRecord("nested/dir/test.txt", data));

        assertTrue(Files.isRegularFile(tempDir.resolve("nested/dir/test.txt")));
        assertArrayEquals(data, adapter.load("nested/dir/test.txt").getContent());
    }

    @Test
    void testSaveStampsLastModified() {
        FileRecord record = new FileRecord("stamp.txt", "x".getBytes());

        adapter.save(record);

        assertNotNull(record.getLastModified());
    }

    @Test
    void testLoadFileNotFound() {
        FileKeyNotFoundException ex = assertThrows(FileKeyNotFoundException.class,
                () -> adapter.load("nonexistent.txt"));
        assertTrue(ex.getMessage().contains("File not found"));
        assertEquals("nonexistent.txt", ex.getKey());
    }

    @Test
    void testLoadDirectoryIsNotFound() throws Exception {
        Files.createDirectories(tempDir.resolve("somedir"));

        assertThrows(FileKeyNotFoundException.class, () -> adapter.load("somedir"));
    }

    @Test
    void testInitDoesNotWrite() {
        FileRecord record = adapter.init("fresh.txt", true);

        assertEquals("fresh.txt", record.getKey());
        assertEquals(0, record.getContent().length);
        assertFalse(Files.exists(tempDir.resolve("fresh.txt")));
    }

    @Test
    void testTouchThroughFacadeWritesEmptyFile() throws Exception {
        FileStorage fileStorage = new FileStorage(adapter);

        fileStorage.init("reserved.txt", true);

        assertTrue(Files.exists(tempDir.resolve("reserved.txt")));
        assertEquals(0, Files.size(tempDir.resolve("reserved.txt")));
        assertEquals(0, fileStorage.load("reserved.txt").getContent().length);
    }

    @Test
    void testDelete() {
        adapter.save(new FileRecord("delete-me.txt", "To be deleted".getBytes()));

        assertTrue(adapter.delete("delete-me.txt"));

        assertThrows(FileKeyNotFoundException.class, () -> adapter.load("delete-me.txt"));
    }

    @Test
    void testDeleteNonExistent() {
        assertThrows(FileKeyNotFoundException.class, () -> adapter.delete("never-existed.txt"));
    }

    @Test
    void testPathTraversalAttempt() {
        String key = "../outside.txt";
        assertThrows(SecurityException.class, () -> adapter.save(new FileRecord(key, new byte[] { 1 })));
        assertThrows(SecurityException.class, () -> adapter.load(key));
        assertThrows(SecurityException.class, () -> adapter.init(key, false));
        assertThrows(SecurityException.class, () -> adapter.delete(key));
        assertFalse(Files.exists(tempDir.getParent().resolve("outside.txt")));
    }

    @Test
    void testRootItselfIsRejected() {
        assertThrows(SecurityException.class, () -> adapter.load("."));
    }
}
