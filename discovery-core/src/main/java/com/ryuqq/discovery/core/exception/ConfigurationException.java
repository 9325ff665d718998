package com.ryuqq.discovery.core.exception;

/**
 * 설정 오류 (예: 필수 서비스의 자격 증명이 하나도 없음).
 *
 * <p>시작 시점에 발생하며 복구하지 않습니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public class ConfigurationException extends DiscoveryException {

    public ConfigurationException(String message) {
        super(message);
    }
}
