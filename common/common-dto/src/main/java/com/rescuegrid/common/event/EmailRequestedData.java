package com.rescuegrid.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** NotificationEmailRequested 페이로드 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmailRequestedData(
        @JsonProperty("subject") String subject,
        @JsonProperty("body") String body,
        @JsonProperty("recipients") List<String> recipients
) {
}
