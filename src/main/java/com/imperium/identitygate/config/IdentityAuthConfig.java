package com.imperium.identitygate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.identitygate.auth.EndpointTokenVerifier;
import com.imperium.identitygate.auth.Hs256TokenVerifier;
import com.imperium.identitygate.auth.TokenVerifier;
import com.imperium.identitygate.auth.VerificationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.Optional;

/**
 * 按 app.identity.auth.* 选定凭证验证方式（启动时选一次）。
 * mode 为空或无法识别时，/verify 会提示未配置。
 */
@Configuration
public class IdentityAuthConfig {

    private static final Logger log = LoggerFactory.getLogger(IdentityAuthConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate verifyRestTemplate(
            @Value("${app.identity.auth.verify-timeout-ms:10000}") int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Bean
    public TokenVerifier tokenVerifier(
            @Value("${app.identity.auth.mode:}") String mode,
            @Value("${app.identity.auth.jwt-secret:}") String jwtSecret,
            @Value("${app.identity.auth.issuer:}") String issuer,
            @Value("${app.identity.auth.audience:}") String audience,
            @Value("${app.identity.auth.verify-endpoint:}") String verifyEndpoint,
            RestTemplate verifyRestTemplate,
            ObjectMapper objectMapper,
            Clock clock) {
        Optional<VerificationMode> selected = VerificationMode.fromConfig(mode);
        if (selected.isEmpty()) {
            if (mode != null && !mode.isBlank()) {
                log.warn("Unknown app.identity.auth.mode '{}', token verification disabled", mode);
            } else {
                log.info("No app.identity.auth.mode configured, token verification disabled");
            }
            return TokenVerifier.notConfigured();
        }
        log.info("Token verification mode: {}", selected.get().configValue());
        return switch (selected.get()) {
            case JWT_HS256 -> new Hs256TokenVerifier(jwtSecret, issuer, audience, objectMapper, clock);
            case VERIFY_ENDPOINT -> new EndpointTokenVerifier(verifyEndpoint, verifyRestTemplate, objectMapper);
        };
    }
}
