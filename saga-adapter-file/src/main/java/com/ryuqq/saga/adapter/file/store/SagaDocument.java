package com.ryuqq.saga.adapter.file.store;

import com.ryuqq.saga.core.instance.Attempt;
import com.ryuqq.saga.core.instance.SagaInstance;
import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;
import com.ryuqq.saga.core.statemachine.AttemptStatus;
import com.ryuqq.saga.core.statemachine.SagaStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JSON 문서 형태의 Saga 인스턴스.
 *
 * <p>도메인 레코드를 직접 직렬화하지 않고 이 DTO를 거쳐 변환합니다.
 * 파일 포맷은 도메인 타입의 내부 표현과 독립적으로 유지됩니다.</p>
 *
 * <p>페이로드 안의 컬렉션은 {@link LinkedHashMap} / {@link ArrayList} / {@link LinkedHashSet}으로
 * 복사한 뒤 기록합니다. 값의 타입 정보는 ObjectMapper의 기본 타이핑이 남기므로,
 * 불변 컬렉션 구현 클래스가 타입 ID로 기록되지 않도록 하기 위함입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
record SagaDocument(
    String sagaId,
    String definitionId,
    int forwardCursor,
    int compensationCursor,
    String status,
    List<AttemptDocument> attempts,
    Map<String, Object> sharedPayload,
    String correlationId,
    long createdAt,
    long updatedAt
) {

    static SagaDocument from(SagaInstance instance) {
        return new SagaDocument(
            instance.id().getValue(),
            instance.definitionId(),
            instance.forwardCursor(),
            instance.compensationCursor(),
            instance.status().name(),
            instance.attempts().stream().map(AttemptDocument::from).collect(Collectors.toList()),
            toDocument(instance.sharedPayload()),
            instance.correlationId(),
            instance.createdAt(),
            instance.updatedAt()
        );
    }

    SagaInstance toInstance() {
        List<Attempt> log = attempts == null
            ? List.of()
            : attempts.stream().map(AttemptDocument::toAttempt).collect(Collectors.toList());
        return new SagaInstance(
            SagaId.of(sagaId),
            definitionId,
            forwardCursor,
            compensationCursor,
            SagaStatus.valueOf(status),
            log,
            Payload.of(sharedPayload),
            correlationId,
            createdAt,
            updatedAt
        );
    }

    static Map<String, Object> toDocument(Payload payload) {
        if (payload == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        payload.asMap().forEach((key, value) -> copy.put(key, plain(value)));
        return copy;
    }

    private static Object plain(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, plain(nested)));
            return copy;
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            set.forEach(nested -> copy.add(plain(nested)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>();
            collection.forEach(nested -> copy.add(plain(nested)));
            return copy;
        }
        return value;
    }

    /**
     * JSON 문서 형태의 Attempt.
     */
    record AttemptDocument(
        String stepName,
        Map<String, Object> requestPayload,
        Map<String, Object> result,
        String error,
        String status,
        Map<String, Object> compensationPayload,
        String compensationError
    ) {

        static AttemptDocument from(Attempt attempt) {
            return new AttemptDocument(
                attempt.stepName(),
                toDocument(attempt.requestPayload()),
                toDocument(attempt.result()),
                attempt.error(),
                attempt.status().name(),
                toDocument(attempt.compensationPayload()),
                attempt.compensationError()
            );
        }

        Attempt toAttempt() {
            return new Attempt(
                stepName,
                Payload.of(requestPayload),
                result == null ? null : Payload.of(result),
                error,
                AttemptStatus.valueOf(status),
                compensationPayload == null ? null : Payload.of(compensationPayload),
                compensationError
            );
        }
    }
}
