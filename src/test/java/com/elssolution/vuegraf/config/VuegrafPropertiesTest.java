package com.elssolution.vuegraf.config;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VuegrafPropertiesTest {

    private static VuegrafProperties withAccount(String name) {
        VuegrafProperties props = new VuegrafProperties();
        VuegrafProperties.Account a = new VuegrafProperties.Account();
        a.setName(name);
        props.setAccounts(new ArrayList<>(List.of(a)));
        return props;
    }

    @Test
    void out_of_range_values_are_clamped() {
        VuegrafProperties props = withAccount("Home");
        props.setHistoryDays(30);
        props.setLagSecs(-3);
        props.setUpdateIntervalSecs(0);
        props.setBackfillPauseSecs(-1);
        props.setShutdownWaitSecs(-5);

        props.sanitize();

        assertThat(props.getHistoryDays()).isEqualTo(VuegrafProperties.MAX_HISTORY_DAYS);
        assertThat(props.getLagSecs()).isZero();
        assertThat(props.getUpdateIntervalSecs()).isEqualTo(60);
        assertThat(props.getBackfillPauseSecs()).isZero();
        assertThat(props.getShutdownWaitSecs()).isZero();
    }

    @Test
    void negative_history_means_none() {
        VuegrafProperties props = withAccount("Home");
        props.setHistoryDays(-2);

        props.sanitize();

        assertThat(props.getHistoryDays()).isZero();
    }

    @Test
    void missing_accounts_are_rejected() {
        assertThatThrownBy(() -> new VuegrafProperties().sanitize())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> withAccount(" ").sanitize())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("accounts[0]");
    }

    @Test
    void account_secrets_stay_out_of_logs() {
        VuegrafProperties.Account a = new VuegrafProperties.Account();
        a.setName("Home");
        a.setToken("jwt");

        assertThat(a.toString()).contains("Home").doesNotContain("jwt");
    }
}
