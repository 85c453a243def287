package com.ammann.biometrics.enumeration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class AlertStatusTest
{

    @ParameterizedTest
    @CsvSource({
            "ACTIVE,ACKNOWLEDGED,true",
            "ACTIVE,RESOLVED,true",
            "ACTIVE,DISMISSED,true",
            "ACKNOWLEDGED,RESOLVED,true",
            "ACKNOWLEDGED,DISMISSED,true",
            "ACKNOWLEDGED,ACTIVE,false",
            "ACKNOWLEDGED,ACKNOWLEDGED,false",
            "RESOLVED,DISMISSED,false",
            "DISMISSED,ACTIVE,false"
    })
    void transitionTable(AlertStatus from, AlertStatus to, boolean allowed)
    {
        assertThat(from.canTransitionTo(to)).isEqualTo(allowed);
    }

    @Test
    void onlyClosedStatesAreTerminal()
    {
        assertThat(AlertStatus.RESOLVED.isTerminal()).isTrue();
        assertThat(AlertStatus.DISMISSED.isTerminal()).isTrue();
        assertThat(AlertStatus.ACTIVE.isTerminal()).isFalse();
        assertThat(AlertStatus.ACKNOWLEDGED.isTerminal()).isFalse();
    }

    @Test
    void parsesWireAndConstantNames()
    {
        assertThat(AlertStatus.fromValue("acknowledged")).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(AlertStatus.fromValue("DISMISSED")).isEqualTo(AlertStatus.DISMISSED);
        assertThatThrownBy(() -> AlertStatus.fromValue("snoozed")).isInstanceOf(IllegalArgumentException.class);
    }
}
