package com.rescuegrid.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 출동(Dispatch) 이벤트 페이로드
 *
 * <p>dispatch-events-topic 으로 나가는 네 가지 이벤트가 같은 모양을 공유한다.
 * 해당 이벤트에 의미 없는 필드는 null이며 직렬화에서 빠진다.</p>
 *
 * <table>
 *   <tr><th>eventType</th><th>채워지는 필드</th></tr>
 *   <tr><td>DispatchOrderCreated</td><td>dispatchOrderId, incidentId, createdByUserId</td></tr>
 *   <tr><td>DispatchAssignmentCreated</td><td>+ dispatchAssignmentId, assignmentStatus="1"</td></tr>
 *   <tr><td>DispatchAssignmentCompleted</td><td>+ dispatchAssignmentId, assignmentStatus="4"</td></tr>
 *   <tr><td>DispatchOrderCompleted</td><td>dispatchOrderId, incidentId, createdByUserId</td></tr>
 * </table>
 *
 * <p>식별자는 모두 UUID 문자열. assignmentStatus는 배정 상태의 숫자 코드 문자열.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DispatchEventData(
        @JsonProperty("dispatchOrderId") String dispatchOrderId,
        @JsonProperty("dispatchAssignmentId") String dispatchAssignmentId,
        @JsonProperty("incidentId") String incidentId,
        @JsonProperty("createdByUserId") String createdByUserId,  // 사건 신고자 (알림 수신자)
        @JsonProperty("assignmentStatus") String assignmentStatus
) {
    public static DispatchEventData forOrder(String dispatchOrderId, String incidentId,
                                             String createdByUserId) {
        return new DispatchEventData(dispatchOrderId, null, incidentId, createdByUserId, null);
    }

    public static DispatchEventData forAssignment(String dispatchAssignmentId, String dispatchOrderId,
                                                  String incidentId, String createdByUserId,
                                                  String assignmentStatus) {
        return new DispatchEventData(dispatchOrderId, dispatchAssignmentId, incidentId,
                createdByUserId, assignmentStatus);
    }
}
