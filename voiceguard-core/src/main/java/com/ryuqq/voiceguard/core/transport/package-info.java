/**
 * 전송 SPI 패키지.
 *
 * <p>요청/응답 모델과 재시도 분류에 필요한 오류 정보를 정의합니다.
 * JDK HttpClient 기반 구현은 adapter-http 모듈의 {@code JdkHttpTransport}입니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.voiceguard.core.transport;
