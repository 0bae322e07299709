package com.rescuegrid.dispatch.event;

import com.rescuegrid.common.event.DispatchEventData;

/**
 * 라이프사이클 엔진 → 발행 리스너로 넘기는 JVM 내부 이벤트.
 *
 * <p>DispatchService가 트랜잭션 안에서 ApplicationEventPublisher로 던지고,
 * {@link DispatchEventPublisher}가 커밋 후에 받아 외부 토픽으로 발행한다.
 * 페이로드는 트랜잭션 안에서 문자열로 만들어 두므로 커밋 후 lazy loading이 필요 없다.</p>
 */
public record DispatchLifecycleEvent(
        String eventType,       // EventTypes.DISPATCH_*
        DispatchEventData data
) {
}
