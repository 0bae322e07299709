package com.rescuegrid.incident;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 사건 서비스(Incident Service) 메인 애플리케이션.
 *
 * <p>사건 접수/수정의 원본 저장소. IncidentCreated / IncidentUpdated를 발행하고,
 * 출동 이벤트를 구독해 사건 상태를 앞으로만 상향한다.</p>
 */
@SpringBootApplication(scanBasePackages = {
        "com.rescuegrid.incident",
        "com.rescuegrid.common.messaging"
})
public class IncidentServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(IncidentServiceApplication.class, args);
    }
}
