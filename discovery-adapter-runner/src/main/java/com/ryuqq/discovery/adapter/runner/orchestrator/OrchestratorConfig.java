package com.ryuqq.discovery.adapter.runner.orchestrator;

/**
 * PhaseOrchestrator 설정 (불변 record).
 *
 * @author Discovery Team
 * @since 1.0.0
 * @param cancellationMessage 운영자 취소 시 세션에 남길 메시지 (기본 "cancelled by operator")
 * @param resultFailurePhaseLabel 결과 저장 실패 시 진단 메시지 접두어 (기본 "SavingResults")
 */
public record OrchestratorConfig(String cancellationMessage, String resultFailurePhaseLabel) {

    public static final String DEFAULT_CANCELLATION_MESSAGE = "cancelled by operator";
    public static final String DEFAULT_RESULT_FAILURE_LABEL = "SavingResults";

    public OrchestratorConfig() {
        this(DEFAULT_CANCELLATION_MESSAGE, DEFAULT_RESULT_FAILURE_LABEL);
    }

    public OrchestratorConfig {
        if (cancellationMessage == null || cancellationMessage.isBlank()) {
            throw new IllegalArgumentException("cancellationMessage cannot be null or blank");
        }
        if (resultFailurePhaseLabel == null || resultFailurePhaseLabel.isBlank()) {
            throw new IllegalArgumentException("resultFailurePhaseLabel cannot be null or blank");
        }
    }

    public OrchestratorConfig withCancellationMessage(String cancellationMessage) {
        return new OrchestratorConfig(cancellationMessage, resultFailurePhaseLabel);
    }

    public OrchestratorConfig withResultFailurePhaseLabel(String resultFailurePhaseLabel) {
        return new OrchestratorConfig(cancellationMessage, resultFailurePhaseLabel);
    }
}
