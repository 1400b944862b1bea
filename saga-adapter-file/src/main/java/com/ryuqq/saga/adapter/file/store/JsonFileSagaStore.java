package com.ryuqq.saga.adapter.file.store;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import com.ryuqq.saga.core.exception.SagaPersistenceException;
import com.ryuqq.saga.core.instance.SagaInstance;
import com.ryuqq.saga.core.model.SagaId;
import com.ryuqq.saga.core.spi.SagaStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link SagaStore} implementation that keeps one JSON file per saga instance.
 *
 * <p>Each instance is stored as {@code <storageDir>/<sagaId>.json}. Saga ids are restricted to
 * {@code [a-zA-Z0-9\-_]} so they are always safe file names.</p>
 *
 * <p><strong>Atomic Replace:</strong></p>
 * <pre>
 * 1. serialize instance → &lt;sagaId&gt;-*.tmp (same directory)
 * 2. move tmp → &lt;sagaId&gt;.json (ATOMIC_MOVE, REPLACE_EXISTING)
 * 3. on failure, delete tmp and raise SagaPersistenceException
 * </pre>
 *
 * <p>A reader therefore sees either the previous file or the new one, never a partial write.</p>
 *
 * <p><strong>Payload Types:</strong> the default mapper records the Java type of every payload
 * value that JSON cannot represent on its own ({@code Long}, {@code BigDecimal}, {@code java.time}
 * values, ...), so {@code load(id)} returns a payload equal to the one that was saved. Values must be
 * JSON scalars, {@code java.lang} / {@code java.math} / {@code java.time} types, or maps, lists and
 * sets of those; any other class is rejected when the file is read back. A custom
 * {@link ObjectMapper} passed to the constructor must enable equivalent typing to keep this
 * guarantee.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Single node only: no cross-process locking</li>
 *   <li>{@code scanStale} reads every file in the directory</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JsonFileSagaStore implements SagaStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSagaStore.class);

    private static final String EXTENSION = ".json";

    private final Path storageDir;
    private final ObjectMapper objectMapper;

    /**
     * 기본 ObjectMapper로 생성.
     *
     * @param storageDir 저장 디렉토리 (없으면 생성)
     */
    public JsonFileSagaStore(Path storageDir) {
        this(storageDir, defaultObjectMapper());
    }

    /**
     * 사용자 정의 ObjectMapper로 생성.
     *
     * @param storageDir 저장 디렉토리 (없으면 생성)
     * @param objectMapper JSON 매퍼
     * @throws SagaPersistenceException 디렉토리를 만들 수 없는 경우
     */
    public JsonFileSagaStore(Path storageDir, ObjectMapper objectMapper) {
        if (storageDir == null) {
            throw new IllegalArgumentException("storageDir cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        try {
            Files.createDirectories(storageDir);
        } catch (IOException e) {
            throw new SagaPersistenceException("Cannot create storage directory: " + storageDir, null, e);
        }
        this.storageDir = storageDir;
        this.objectMapper = objectMapper;
    }

    private static ObjectMapper defaultObjectMapper() {
        PolymorphicTypeValidator payloadTypes = BasicPolymorphicTypeValidator.builder()
            .allowIfSubType("java.lang.")
            .allowIfSubType("java.math.")
            .allowIfSubType("java.time.")
            .allowIfSubType("java.util.")
            .build();

        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // JavaTimeModule
        // Object로 선언된 값(페이로드 값)에만 타입 정보 기록, 문서 구조 자체는 그대로 유지
        mapper.activateDefaultTyping(payloadTypes, ObjectMapper.DefaultTyping.JAVA_LANG_OBJECT,
            JsonTypeInfo.As.WRAPPER_ARRAY);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Override
    public void save(SagaInstance instance) {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        SagaId sagaId = instance.id();
        Path target = fileOf(sagaId);
        Path temp = null;
        try {
            temp = Files.createTempFile(storageDir, sagaId.getValue() + "-", ".tmp");
            objectMapper.writeValue(temp.toFile(), SagaDocument.from(instance));
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Saved saga {} ({}) to {}", sagaId.getValue(), instance.status(), target);
        } catch (IOException e) {
            deleteQuietly(temp, e);
            log.error("Failed to save saga {} to {}", sagaId.getValue(), target, e);
            throw new SagaPersistenceException("Failed to save saga: " + sagaId.getValue(), sagaId, e);
        }
    }

    @Override
    public Optional<SagaInstance> load(SagaId sagaId) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        Path file = fileOf(sagaId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(read(file));
        } catch (NoSuchFileException e) {
            // exists() 이후 delete와 경합한 경우
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load saga {} from {}", sagaId.getValue(), file, e);
            throw new SagaPersistenceException("Failed to load saga: " + sagaId.getValue(), sagaId, e);
        }
    }

    @Override
    public void delete(SagaId sagaId) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        try {
            Files.deleteIfExists(fileOf(sagaId));
        } catch (IOException e) {
            throw new SagaPersistenceException("Failed to delete saga: " + sagaId.getValue(), sagaId, e);
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Reads every {@code *.json} file in the storage directory</li>
     *   <li>Unreadable files are logged and skipped so one corrupt record cannot block recovery of the rest</li>
     * </ul>
     */
    @Override
    public List<SagaId> scanStale(long updatedBefore, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        List<SagaInstance> candidates = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(storageDir, "*" + EXTENSION)) {
            for (Path file : files) {
                try {
                    SagaInstance instance = read(file);
                    if (!instance.isTerminal() && instance.updatedAt() < updatedBefore) {
                        candidates.add(instance);
                    }
                } catch (IOException | RuntimeException e) {
                    log.warn("Skipping unreadable saga file {} during stale scan", file, e);
                }
            }
        } catch (IOException e) {
            throw new SagaPersistenceException("Failed to scan storage directory: " + storageDir, null, e);
        }
        return candidates.stream()
            .sorted(Comparator.comparingLong(SagaInstance::updatedAt))
            .limit(batchSize)
            .map(SagaInstance::id)
            .collect(Collectors.toList());
    }

    /**
     * 저장 디렉토리.
     *
     * @return 저장 디렉토리 경로
     */
    public Path getStorageDir() {
        return storageDir;
    }

    private SagaInstance read(Path file) throws IOException {
        SagaDocument document = objectMapper.readValue(file.toFile(), SagaDocument.class);
        return document.toInstance();
    }

    private Path fileOf(SagaId sagaId) {
        return storageDir.resolve(sagaId.getValue() + EXTENSION);
    }

    private static void deleteQuietly(Path temp, IOException original) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
            original.addSuppressed(cleanup);
        }
    }
}
