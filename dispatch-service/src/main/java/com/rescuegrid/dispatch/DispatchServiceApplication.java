package com.rescuegrid.dispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 출동 서비스(Dispatch Service) 메인 애플리케이션.
 *
 * <p>유닛, 출동 지령, 배정의 라이프사이클을 관리한다.
 * 사건 이벤트를 구독해 로컬 projection을 유지하고, 출동 이벤트를 dispatch-events-topic으로 발행한다.</p>
 *
 * <h3>scanBasePackages 구성</h3>
 * <ul>
 *   <li>{@code com.rescuegrid.dispatch} - 출동 서비스 자체 패키지</li>
 *   <li>{@code com.rescuegrid.common.messaging} - 발행자, 소비자 루프, 전송 계층 설정</li>
 * </ul>
 */
@SpringBootApplication(scanBasePackages = {
        "com.rescuegrid.dispatch",
        "com.rescuegrid.common.messaging"
})
public class DispatchServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DispatchServiceApplication.class, args);
    }
}
