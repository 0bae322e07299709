package com.rescuegrid.dispatch.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class AssignmentStatusTest {

    @ParameterizedTest(name = "{0} → {1} = {2}")
    @CsvSource({
            "ASSIGNED, EN_ROUTE, true",
            "ASSIGNED, CANCELLED, true",
            "ASSIGNED, REPLACED, true",
            "ASSIGNED, ON_SITE, false",
            "ASSIGNED, COMPLETED, false",
            "EN_ROUTE, ON_SITE, true",
            "EN_ROUTE, CANCELLED, true",
            "EN_ROUTE, REPLACED, false",
            "EN_ROUTE, COMPLETED, false",
            "ON_SITE, COMPLETED, true",
            "ON_SITE, CANCELLED, true",
            "ON_SITE, EN_ROUTE, false",
            "ON_SITE, ASSIGNED, false"
    })
    @DisplayName("전이표에 있는 전이만 허용")
    void canTransitionTo(AssignmentStatus from, AssignmentStatus to, boolean allowed) {
        assertThat(from.canTransitionTo(to)).isEqualTo(allowed);
    }

    @ParameterizedTest
    @EnumSource(value = AssignmentStatus.class, names = {"COMPLETED", "CANCELLED", "REPLACED"})
    @DisplayName("종료 상태에서는 어떤 전이도 없고 유닛은 AVAILABLE")
    void terminalStates(AssignmentStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        assertThat(terminal.allowedNext()).isEmpty();
        assertThat(terminal.toUnitStatus()).isEqualTo(UnitStatus.AVAILABLE);
        for (AssignmentStatus next : AssignmentStatus.values()) {
            assertThat(terminal.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    @DisplayName("이벤트 와이어 코드: ASSIGNED=\"1\", COMPLETED=\"4\"")
    void wireCode() {
        assertThat(AssignmentStatus.ASSIGNED.wireCode()).isEqualTo("1");
        assertThat(AssignmentStatus.COMPLETED.wireCode()).isEqualTo("4");
        assertThat(AssignmentStatus.REPLACED.wireCode()).isEqualTo("6");
    }
}
