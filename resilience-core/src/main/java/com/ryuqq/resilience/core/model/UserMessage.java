package com.ryuqq.resilience.core.model;

/**
 * 최종 사용자에게 보여줄 오류 문구.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param title 제목
 * @param message 본문
 * @param action 권장 조치
 */
public record UserMessage(
    String title,
    String message,
    String action
) {

    public UserMessage {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (action == null) {
            action = "";
        }
    }
}
