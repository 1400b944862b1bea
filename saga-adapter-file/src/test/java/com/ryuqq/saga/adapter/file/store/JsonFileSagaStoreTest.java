package com.ryuqq.saga.adapter.file.store;

import com.ryuqq.saga.core.exception.SagaPersistenceException;
import com.ryuqq.saga.core.instance.SagaInstance;
import com.ryuqq.saga.core.model.SagaId;
import com.ryuqq.saga.testkit.fixture.SagaFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JsonFileSagaStore 파일 처리 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class JsonFileSagaStoreTest {

    @TempDir
    Path storageDir;

    private JsonFileSagaStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileSagaStore(storageDir);
    }

    @Test
    void save_WritesOneJsonFilePerSaga_NoTempFilesLeft() throws IOException {
        // given
        SagaInstance instance = SagaFixtures.compensatingInstance("saga-file-1", 1_000L);

        // when
        store.save(instance);
        store.save(instance);

        // then
        try (Stream<Path> files = Files.list(storageDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                .containsExactly("saga-file-1.json");
        }
    }

    @Test
    void save_FileContainsReadableJson() throws IOException {
        // given
        SagaInstance instance = SagaFixtures.runningInstance("saga-file-2", 1_000L);

        // when
        store.save(instance);

        // then
        String json = Files.readString(storageDir.resolve("saga-file-2.json"));
        assertThat(json)
            .contains("\"sagaId\":\"saga-file-2\"")
            .contains("\"status\":\"RUNNING\"")
            .contains("\"order_id\":\"123\"");
    }

    @Test
    void load_CorruptFile_ThrowsPersistenceException() throws IOException {
        // given
        Files.writeString(storageDir.resolve("saga-corrupt.json"), "{ not json");

        // when & then
        assertThatThrownBy(() -> store.load(SagaId.of("saga-corrupt")))
            .isInstanceOf(SagaPersistenceException.class)
            .hasMessageContaining("saga-corrupt");
    }

    @Test
    void scanStale_SkipsCorruptFiles() throws IOException {
        // given
        store.save(SagaFixtures.runningInstance("saga-ok", 1_000L));
        Files.writeString(storageDir.resolve("saga-corrupt.json"), "{ not json");

        // when & then
        assertThat(store.scanStale(5_000L, 10)).containsExactly(SagaId.of("saga-ok"));
    }

    @Test
    void secondStoreOnSameDirectory_SeesSavedInstances() {
        // given
        SagaInstance instance = SagaFixtures.compensatingInstance("saga-restart", 1_000L);
        store.save(instance);

        // when
        JsonFileSagaStore restarted = new JsonFileSagaStore(storageDir);

        // then
        assertThat(restarted.load(instance.id())).contains(instance);
    }

    @Test
    void constructor_CreatesMissingDirectory() {
        Path nested = storageDir.resolve("a").resolve("b");

        JsonFileSagaStore nestedStore = new JsonFileSagaStore(nested);

        assertThat(Files.isDirectory(nestedStore.getStorageDir())).isTrue();
    }
}
