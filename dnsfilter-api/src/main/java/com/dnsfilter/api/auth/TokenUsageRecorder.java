package com.dnsfilter.api.auth;

import com.dnsfilter.api.config.AsyncConfig;
import com.dnsfilter.core.repository.AuthTokenRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.UUID;

/**
 * Best-effort token usage bookkeeping off the request thread.
 * A failed update is logged and dropped; it never affects the request.
 */
@Component
public class TokenUsageRecorder {

    private static final Logger log = LoggerFactory.getLogger(TokenUsageRecorder.class);

    private final AuthTokenRepository tokenRepository;
    private final TransactionTemplate transactionTemplate;

    public TokenUsageRecorder(AuthTokenRepository tokenRepository, PlatformTransactionManager transactionManager) {
        this.tokenRepository = tokenRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Async(AsyncConfig.TOKEN_USAGE_EXECUTOR)
    public void recordUsage(UUID tokenId, Instant usedAt, String sourceIp) {
        try {
            transactionTemplate.executeWithoutResult(status ->
                    tokenRepository.recordUsage(tokenId, usedAt, truncate(sourceIp)));
        } catch (DataAccessException | TransactionException e) {
            log.warn("Failed to record usage for token {}", tokenId, e);
        }
    }

    private static String truncate(String ip) {
        return ip != null && ip.length() > 45 ? ip.substring(0, 45) : ip;
    }
}
