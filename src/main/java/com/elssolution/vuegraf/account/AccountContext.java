package com.elssolution.vuegraf.account;

import com.elssolution.vuegraf.config.VuegrafProperties;
import com.elssolution.vuegraf.integration.emporia.VueSession;
import com.elssolution.vuegraf.integration.emporia.VueSessionFactory;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;

/**
 * Runtime state of one configured account: its session, discovered devices and power states.
 * Touched only by the poll loop thread.
 */
@Slf4j
@Getter
public class AccountContext {

    private final VuegrafProperties.Account config;
    private final DeviceIndex index = new DeviceIndex();
    private final PowerStateTable powerStates = new PowerStateTable();

    private VueSession session;

    /** Startup history still to be loaded for this account. */
    @Setter private boolean backfillPending;

    public AccountContext(VuegrafProperties.Account config, boolean backfillPending) {
        this.config = config;
        this.backfillPending = backfillPending;
    }

    public String name() {
        return config.getName();
    }

    public Optional<VueSession> currentSession() {
        return Optional.ofNullable(session);
    }

    /**
     * Logs in and discovers devices unless a session already exists. The session is only kept once
     * discovery succeeded, so a failure here is retried in full next cycle.
     */
    public VueSession ensureSession(VueSessionFactory factory) throws IOException {
        if (session != null) return session;

        VueSession opened = factory.open(config);
        log.info("Login completed: account={}", name());
        index.rebuild(opened.listDevices());
        session = opened;
        return session;
    }

    /** Forget the session, e.g. after the token was rejected. */
    public void dropSession() {
        session = null;
    }
}
