package com.elssolution.vuegraf.integration.emporia;

import com.elssolution.vuegraf.config.VuegrafProperties;

import java.io.IOException;

public interface VueSessionFactory {

    /** Logs the account in. Failures are recoverable; the caller tries again next cycle. */
    VueSession open(VuegrafProperties.Account account) throws IOException;
}
