package com.ryuqq.discovery.core.statemachine;

/**
 * 반복 한 번을 구성하는 다섯 단계.
 *
 * <p>각 단계는 시작 시 기록하는 진행 중 페이즈와 종료 시 기록하는 완료 페이즈를 가집니다.
 * 선언 순서가 실행 순서입니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public enum Stage {

    COLLECTION(Phase.COLLECTING_PAPERS, Phase.PAPERS_COLLECTED),
    ANALYSIS(Phase.ANALYZING_PAPERS, Phase.ANALYSIS_COMPLETE),
    HYPOTHESIS(Phase.GENERATING_HYPOTHESES, Phase.HYPOTHESES_GENERATED),
    TESTING(Phase.TESTING_HYPOTHESES, Phase.TESTING_COMPLETE),
    EVALUATION(Phase.EVALUATING_RESULTS, Phase.DISCOVERIES_FOUND);

    private final Phase inProgress;
    private final Phase done;

    Stage(Phase inProgress, Phase done) {
        this.inProgress = inProgress;
        this.done = done;
    }

    public Phase inProgress() {
        return inProgress;
    }

    public Phase done() {
        return done;
    }
}
