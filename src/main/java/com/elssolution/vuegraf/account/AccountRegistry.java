package com.elssolution.vuegraf.account;

import com.elssolution.vuegraf.config.VuegrafProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The configured accounts, created once at startup in configuration order.
 */
@Slf4j
@Component
public class AccountRegistry {

    private final List<AccountContext> accounts;

    public AccountRegistry(VuegrafProperties props) {
        props.sanitize();
        boolean backfill = props.getHistoryDays() > 0;
        List<AccountContext> list = new ArrayList<>();
        for (VuegrafProperties.Account a : props.getAccounts()) {
            list.add(new AccountContext(a, backfill));
            log.info("Account configured: {}", a);
        }
        this.accounts = Collections.unmodifiableList(list);
    }

    public List<AccountContext> all() {
        return accounts;
    }
}
