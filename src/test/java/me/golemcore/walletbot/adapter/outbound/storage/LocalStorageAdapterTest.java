package me.golemcore.walletbot.adapter.outbound.storage;

import me.golemcore.walletbot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "users";
    private static final String FILE_1 = "file1.json";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateUsersDirectoryOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve("users")));
    }

    @Test
    void putTextAtomicAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "{\"a\":1}", false).get();

        assertEquals("{\"a\":1}", storageAdapter.getText(TEST_DIR, FILE_1).get());
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve(FILE_1 + ".tmp")));
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.json").get());
    }

    @Test
    void putTextAtomic_keepsBackupOfPreviousContent() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "v1", true).get();
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "v2", true).get();

        assertEquals("v2", storageAdapter.getText(TEST_DIR, FILE_1).get());
        Path backup = tempDir.resolve(TEST_DIR).resolve(FILE_1 + ".bak");
        assertEquals("v1", Files.readString(backup, StandardCharsets.UTF_8));
    }

    @Test
    void putTextAtomic_withoutBackupLeavesNoBackupFile() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "v1", false).get();
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "v2", false).get();

        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve(FILE_1 + ".bak")));
    }

    @Test
    void exists_reflectsFileState() throws ExecutionException, InterruptedException {
        assertFalse(storageAdapter.exists(TEST_DIR, FILE_1).get());

        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "x", false).get();

        assertTrue(storageAdapter.exists(TEST_DIR, FILE_1).get());
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> storageAdapter.getText(TEST_DIR, "../../etc/passwd").join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
