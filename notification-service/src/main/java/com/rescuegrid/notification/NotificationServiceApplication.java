package com.rescuegrid.notification;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 알림 서비스(Notification Service) 메인 애플리케이션.
 *
 * <p>사건/출동/이메일 이벤트를 구독해 사용자 알림을 만든다. 자신은 이벤트를 발행하지 않는다.</p>
 *
 * <h3>scanBasePackages 구성</h3>
 * <ul>
 *   <li>{@code com.rescuegrid.notification} - 알림 서비스 자체 패키지</li>
 *   <li>{@code com.rescuegrid.common.messaging} - 소비자 루프, 전송 계층 설정</li>
 * </ul>
 */
@SpringBootApplication(scanBasePackages = {
        "com.rescuegrid.notification",
        "com.rescuegrid.common.messaging"
})
public class NotificationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotificationServiceApplication.class, args);
    }
}
