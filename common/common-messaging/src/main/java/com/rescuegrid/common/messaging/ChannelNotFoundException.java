package com.rescuegrid.common.messaging;

/** 토픽/큐가 아직 프로비저닝되지 않음. 소비자 초기화 단계에서 재시도 대상 */
public class ChannelNotFoundException extends RuntimeException {

    public ChannelNotFoundException(String message) {
        super(message);
    }
}
