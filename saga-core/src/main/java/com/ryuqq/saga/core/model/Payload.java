package com.ryuqq.saga.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Step 사이에 전달되는 키-값 형태의 업무 데이터.
 *
 * <p>공유 페이로드(shared payload), Step 요청 페이로드, Action 결과,
 * 보상 페이로드가 모두 이 타입으로 표현됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Payload shared = Payload.of("order_id", "123");
 * Payload merged = shared.merge(Payload.of("payment_id", "PAY-9"));
 * // merged = {order_id=123, payment_id=PAY-9}
 * </pre>
 *
 * <p><strong>불변성:</strong> 최상위 맵은 생성 시 복사되며 수정 불가.
 * 값으로 들어간 컬렉션은 호출자가 변경하지 않아야 합니다.</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 맵은 빈 Payload로 취급</li>
 *   <li>null 키 불가, null 값 허용</li>
 *   <li>삽입 순서 유지</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(Collections.emptyMap());

    private final Map<String, Object> values;

    private Payload(Map<String, ?> values) {
        // Map.of 계열은 containsKey(null)에서 NPE를 던지므로 키를 직접 검사
        for (String key : values.keySet()) {
            if (key == null) {
                throw new IllegalArgumentException("Payload keys cannot be null");
            }
        }
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * 맵으로부터 Payload 생성.
     *
     * @param values 키-값 (null이면 빈 Payload)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException null 키가 포함된 경우
     */
    public static Payload of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new Payload(values);
    }

    /**
     * 단일 항목 Payload 생성.
     *
     * @param key 키
     * @param value 값 (null 허용)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException key가 null인 경우
     */
    public static Payload of(String key, Object value) {
        return empty().with(key, value);
    }

    /**
     * 빈 Payload.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * 값 조회.
     *
     * @param key 키
     * @return 값 (없으면 null)
     */
    public Object get(String key) {
        return values.get(key);
    }

    /**
     * 키 존재 여부.
     *
     * @param key 키
     * @return 존재하면 true
     */
    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * 항목 하나를 추가/교체한 새 Payload 반환.
     *
     * @param key 키
     * @param value 값 (null 허용)
     * @return 새 Payload
     * @throws IllegalArgumentException key가 null인 경우
     */
    public Payload with(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new Payload(copy);
    }

    /**
     * 다른 Payload를 병합한 새 Payload 반환.
     *
     * <p>동일 키는 {@code updates}의 값이 우선합니다.</p>
     *
     * @param updates 병합할 Payload (null이면 변경 없음)
     * @return 병합된 Payload
     */
    public Payload merge(Payload updates) {
        if (updates == null || updates.isEmpty()) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.putAll(updates.values);
        return new Payload(copy);
    }

    /**
     * 읽기 전용 맵 뷰.
     *
     * @return 수정 불가능한 맵
     */
    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * 비어있는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * 항목 수.
     *
     * @return 항목 수
     */
    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return values.equals(payload.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Payload" + values;
    }
}
