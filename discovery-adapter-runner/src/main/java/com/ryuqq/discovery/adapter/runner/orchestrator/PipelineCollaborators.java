package com.ryuqq.discovery.adapter.runner.orchestrator;

import com.ryuqq.discovery.core.spi.Collaborator;
import com.ryuqq.discovery.core.statemachine.Stage;

/**
 * 다섯 단계 각각을 담당하는 협력자 묶음.
 *
 * @author Discovery Team
 * @since 1.0.0
 * @param collection 논문 수집
 * @param analysis 논문 분석
 * @param hypothesis 가설 생성
 * @param testing 가설 검증
 * @param evaluation 결과 평가
 */
public record PipelineCollaborators(
    Collaborator collection,
    Collaborator analysis,
    Collaborator hypothesis,
    Collaborator testing,
    Collaborator evaluation
) {

    public PipelineCollaborators {
        if (collection == null || analysis == null || hypothesis == null || testing == null || evaluation == null) {
            throw new IllegalArgumentException("every stage collaborator must be provided");
        }
    }

    public Collaborator forStage(Stage stage) {
        return switch (stage) {
            case COLLECTION -> collection;
            case ANALYSIS -> analysis;
            case HYPOTHESIS -> hypothesis;
            case TESTING -> testing;
            case EVALUATION -> evaluation;
        };
    }
}
