package com.ryuqq.saga.core.definition;

import com.ryuqq.saga.core.exception.SagaDefinitionException;
import com.ryuqq.saga.core.instance.Attempt;
import com.ryuqq.saga.core.instance.SagaInstance;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 순서가 있는 Step 목록으로 이루어진 불변 Saga 정의.
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * SagaDefinition definition = SagaDefinition.builder("order_processing")
 *     .step(Step.dispatch("charge_payment", "payments.charge", "payments.refund"))
 *     .step(Step.dispatch("reserve_inventory", "inventory.reserve", "inventory.release"))
 *     .step(Step.dispatch("ship_order", "shipping.ship", "shipping.cancel"))
 *     .build();
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>Step은 최소 1개</li>
 *   <li>Step 이름은 정의 내에서 고유</li>
 *   <li>정의 ID는 SagaId 생성에 사용되므로 영숫자, 하이픈, 언더스코어만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SagaDefinition {

    private final String id;
    private final List<Step> steps;
    private final Map<String, Integer> indexByName;

    private SagaDefinition(String id, List<Step> steps) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (!id.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("Definition id contains invalid characters: " + id);
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("steps cannot be null or empty");
        }

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            if (step == null) {
                throw new IllegalArgumentException("step cannot be null (index: " + i + ")");
            }
            Integer previous = index.putIfAbsent(step.name(), i);
            if (previous != null) {
                throw new SagaDefinitionException(
                    String.format("Duplicate step name '%s' at index %d and %d in definition '%s'",
                        step.name(), previous, i, id));
            }
        }

        this.id = id;
        this.steps = List.copyOf(steps);
        this.indexByName = Map.copyOf(index);
    }

    /**
     * Step 목록으로 정의 생성.
     *
     * @param id 정의 ID
     * @param steps 순서가 있는 Step 목록
     * @return SagaDefinition
     * @throws SagaDefinitionException Step 이름이 중복된 경우
     */
    public static SagaDefinition of(String id, List<Step> steps) {
        return new SagaDefinition(id, steps);
    }

    /**
     * 빌더 생성.
     *
     * @param id 정의 ID
     * @return Builder
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    /**
     * 인덱스로 Step 조회.
     *
     * @param index Step 인덱스
     * @return Step
     * @throws IllegalArgumentException 범위를 벗어난 경우
     */
    public Step step(int index) {
        if (index < 0 || index >= steps.size()) {
            throw new IllegalArgumentException(
                String.format("step index out of range: %d (size: %d)", index, steps.size()));
        }
        return steps.get(index);
    }

    /**
     * 이름으로 Step 조회.
     *
     * <p>로그에는 Step 이름만 저장되므로 보상 페이로드를 다시 만들 때 사용합니다.</p>
     *
     * @param name Step 이름
     * @return Step
     * @throws SagaDefinitionException 정의에 없는 이름인 경우 (정의/버전 불일치)
     */
    public Step step(String name) {
        Integer index = indexByName.get(name);
        if (index == null) {
            throw new SagaDefinitionException(
                String.format("Unknown step '%s' in definition '%s'", name, id));
        }
        return steps.get(index);
    }

    /**
     * 이름으로 Step 인덱스 조회.
     *
     * @param name Step 이름
     * @return 인덱스
     * @throws SagaDefinitionException 정의에 없는 이름인 경우
     */
    public int indexOf(String name) {
        Integer index = indexByName.get(name);
        if (index == null) {
            throw new SagaDefinitionException(
                String.format("Unknown step '%s' in definition '%s'", name, id));
        }
        return index;
    }

    /**
     * 모든 Step이 디스패치 변형인지 검증 (비동기 엔진용).
     *
     * @throws SagaDefinitionException Direct 변형이 섞인 경우
     */
    public void requireDispatchSteps() {
        steps.forEach(Step::dispatchInvoker);
    }

    /**
     * 모든 Step이 직접 호출 변형인지 검증 (인라인 실행기용).
     *
     * @throws SagaDefinitionException Dispatch 변형이 섞인 경우
     */
    public void requireDirectSteps() {
        steps.forEach(Step::directInvoker);
    }

    /**
     * 저장된 인스턴스가 이 정의로 처리 가능한지 검증.
     *
     * <p>정의 ID가 같아야 하고, Attempt 로그의 i번째 항목은 i번째 Step을 가리켜야 합니다.</p>
     *
     * @param instance 저장소에서 읽은 인스턴스
     * @throws SagaDefinitionException 정의 ID 또는 Step 이름이 맞지 않는 경우
     */
    public void verify(SagaInstance instance) {
        if (!id.equals(instance.definitionId())) {
            throw new SagaDefinitionException(
                String.format("Definition mismatch: instance uses '%s', engine has '%s'",
                    instance.definitionId(), id),
                instance.id());
        }
        List<Attempt> attempts = instance.attempts();
        if (attempts.size() > steps.size()) {
            throw new SagaDefinitionException(
                String.format("Attempt log has %d entries but definition '%s' has %d steps",
                    attempts.size(), id, steps.size()),
                instance.id());
        }
        for (int i = 0; i < attempts.size(); i++) {
            String logged = attempts.get(i).stepName();
            if (!logged.equals(steps.get(i).name())) {
                throw new SagaDefinitionException(
                    String.format("Attempt %d references step '%s' but definition '%s' has '%s' at that index",
                        i, logged, id, steps.get(i).name()),
                    instance.id());
            }
        }
    }

    @Override
    public String toString() {
        return "SagaDefinition{" + id + ", steps=" + steps.size() + '}';
    }

    /**
     * SagaDefinition 빌더.
     */
    public static final class Builder {

        private final String id;
        private final List<Step> steps = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        /**
         * Step 추가.
         */
        public Builder step(Step step) {
            steps.add(step);
            return this;
        }

        /**
         * 디스패치 Step 추가.
         */
        public Builder step(String name, String actionDestination, String compensationDestination) {
            return step(Step.dispatch(name, actionDestination, compensationDestination));
        }

        public SagaDefinition build() {
            return new SagaDefinition(id, steps);
        }
    }
}
