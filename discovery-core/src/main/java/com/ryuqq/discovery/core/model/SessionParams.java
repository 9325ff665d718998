package com.ryuqq.discovery.core.model;

/**
 * 세션 실행 파라미터.
 *
 * <p>세션 생성 시 함께 저장되며, 오케스트레이터는 {@link #iterations()}만 직접 해석합니다.
 * 나머지 값은 협력자에게 그대로 전달됩니다.</p>
 *
 * @param maxPapers 수집할 최대 논문 수 (양수)
 * @param maxHypotheses 생성할 최대 가설 수 (양수)
 * @param iterations 전체 단계 반복 횟수 (1 이상)
 * @param aiModel 사용할 언어 모델 서비스 이름
 * @author Discovery Team
 * @since 1.0.0
 */
public record SessionParams(int maxPapers, int maxHypotheses, int iterations, String aiModel) {

    public static final int DEFAULT_MAX_PAPERS = 20;
    public static final int DEFAULT_MAX_HYPOTHESES = 10;
    public static final int DEFAULT_ITERATIONS = 3;
    public static final String DEFAULT_AI_MODEL = "gemini";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public SessionParams {
        if (maxPapers <= 0) {
            throw new IllegalArgumentException("maxPapers must be positive (current: " + maxPapers + ")");
        }
        if (maxHypotheses <= 0) {
            throw new IllegalArgumentException("maxHypotheses must be positive (current: " + maxHypotheses + ")");
        }
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive (current: " + iterations + ")");
        }
        if (aiModel == null || aiModel.isBlank()) {
            throw new IllegalArgumentException("aiModel cannot be null or blank");
        }
    }

    /**
     * 기본값 생성자.
     *
     * <p>기본값: maxPapers=20, maxHypotheses=10, iterations=3, aiModel=gemini</p>
     */
    public SessionParams() {
        this(DEFAULT_MAX_PAPERS, DEFAULT_MAX_HYPOTHESES, DEFAULT_ITERATIONS, DEFAULT_AI_MODEL);
    }

    public SessionParams withMaxPapers(int maxPapers) {
        return new SessionParams(maxPapers, maxHypotheses, iterations, aiModel);
    }

    public SessionParams withMaxHypotheses(int maxHypotheses) {
        return new SessionParams(maxPapers, maxHypotheses, iterations, aiModel);
    }

    public SessionParams withIterations(int iterations) {
        return new SessionParams(maxPapers, maxHypotheses, iterations, aiModel);
    }

    public SessionParams withAiModel(String aiModel) {
        return new SessionParams(maxPapers, maxHypotheses, iterations, aiModel);
    }
}
