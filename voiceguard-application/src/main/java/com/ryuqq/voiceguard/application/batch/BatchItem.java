package com.ryuqq.voiceguard.application.batch;

import com.ryuqq.voiceguard.core.transport.TransportRequest;

/**
 * 배치 입력 항목.
 *
 * @param itemId 배치 내 고유 식별자 (예: 오디오 파일명)
 * @param request 실행할 요청
 * @author VoiceGuard Team
 * @since 1.0.0
 */
public record BatchItem(String itemId, TransportRequest request) {

    public BatchItem {
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId cannot be null or blank");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
    }
}
