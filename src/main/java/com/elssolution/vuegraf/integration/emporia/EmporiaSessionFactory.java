package com.elssolution.vuegraf.integration.emporia;

import com.elssolution.vuegraf.config.VuegrafProperties;
import com.elssolution.vuegraf.integration.http.RetryingHttp;
import com.elssolution.vuegraf.integration.http.UpstreamException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Opens {@link EmporiaCloudClient} sessions. The id token is obtained outside this service and
 * configured per account.
 */
@Slf4j
@Component
public class EmporiaSessionFactory implements VueSessionFactory {

    private final VuegrafProperties props;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient = RetryingHttp.newClient(Duration.ofSeconds(4));

    public EmporiaSessionFactory(VuegrafProperties props, ObjectMapper objectMapper) {
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    public VueSession open(VuegrafProperties.Account account) throws UpstreamException {
        if (account.getToken() == null || account.getToken().isBlank()) {
            throw new UpstreamException("No Emporia token configured for account '" + account.getName() + "'");
        }
        VuegrafProperties.Emporia emporia = props.getEmporia();
        log.info("Opening Emporia session: account={}, email={}, api={}",
                account.getName(), account.getEmail(), emporia.getBaseUri());
        return new EmporiaCloudClient(
                new RetryingHttp(httpClient, "Emporia"),
                new EmporiaJson(objectMapper),
                emporia.getBaseUri(),
                account.getToken(),
                Duration.ofMillis(Math.max(1000, emporia.getRequestTimeoutMs())));
    }
}
