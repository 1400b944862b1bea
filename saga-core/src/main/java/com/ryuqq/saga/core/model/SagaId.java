package com.ryuqq.saga.core.model;

import java.util.UUID;

/**
 * Saga 인스턴스의 전역 고유 식별자.
 *
 * <p>SagaId는 저장소 키, 응답 목적지 이름({@code saga.<id>.action_result}),
 * 그리고 다운스트림 소비자의 중복 제거 키 {@code (sagaId, stepIndex, phase)}의
 * 일부로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용 (목적지 구분자 '.' 불가)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SagaId {

    private final String value;

    private SagaId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SagaId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("SagaId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("SagaId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * SagaId 생성.
     *
     * @param value SagaId 값
     * @return SagaId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static SagaId of(String value) {
        return new SagaId(value);
    }

    /**
     * 정의 ID 기반 신규 SagaId 생성 ({@code saga-<definitionId>-<uuid>}).
     *
     * @param definitionId Saga 정의 ID
     * @return 신규 SagaId
     * @throws IllegalArgumentException definitionId가 식별자 규칙을 위반하는 경우
     */
    public static SagaId generate(String definitionId) {
        return new SagaId("saga-" + definitionId + "-" + UUID.randomUUID());
    }

    /**
     * SagaId 값 조회.
     *
     * @return SagaId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SagaId sagaId = (SagaId) o;
        return value.equals(sagaId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "SagaId{" + value + '}';
    }
}
