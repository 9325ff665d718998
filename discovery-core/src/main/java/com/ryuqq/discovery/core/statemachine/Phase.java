package com.ryuqq.discovery.core.statemachine;

/**
 * 파이프라인 단계와 단계별 진행률 하한(progress floor).
 *
 * <p>단계는 선언 순서대로만 진행합니다. 각 작업 단계(Stage)는 "진행 중" 단계와
 * "완료" 단계의 쌍으로 표현됩니다.</p>
 *
 * <pre>
 * STARTING(0)
 *   → COLLECTING_PAPERS(10)      → PAPERS_COLLECTED(20)
 *   → ANALYZING_PAPERS(30)       → ANALYSIS_COMPLETE(45)
 *   → GENERATING_HYPOTHESES(55)  → HYPOTHESES_GENERATED(65)
 *   → TESTING_HYPOTHESES(75)     → TESTING_COMPLETE(85)
 *   → EVALUATING_RESULTS(90)     → DISCOVERIES_FOUND(95)
 *   → COMPLETED(100)
 * </pre>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public enum Phase {

    STARTING("Starting", 0),
    COLLECTING_PAPERS("CollectingPapers", 10),
    PAPERS_COLLECTED("PapersCollected", 20),
    ANALYZING_PAPERS("AnalyzingPapers", 30),
    ANALYSIS_COMPLETE("AnalysisComplete", 45),
    GENERATING_HYPOTHESES("GeneratingHypotheses", 55),
    HYPOTHESES_GENERATED("HypothesesGenerated", 65),
    TESTING_HYPOTHESES("TestingHypotheses", 75),
    TESTING_COMPLETE("TestingComplete", 85),
    EVALUATING_RESULTS("EvaluatingResults", 90),
    DISCOVERIES_FOUND("DiscoveriesFound", 95),
    COMPLETED("Completed", 100);

    private final String displayName;
    private final int progressFloor;

    Phase(String displayName, int progressFloor) {
        this.displayName = displayName;
        this.progressFloor = progressFloor;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * 이 단계에 도달했을 때의 진행률 하한 (0~100).
     *
     * @return 진행률 하한
     */
    public int progressFloor() {
        return progressFloor;
    }

    /**
     * 표시 이름으로 단계 조회 (저장소 복원용).
     *
     * @param displayName 예: "CollectingPapers"
     * @return Phase
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static Phase fromDisplayName(String displayName) {
        for (Phase phase : values()) {
            if (phase.displayName.equals(displayName)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + displayName);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
