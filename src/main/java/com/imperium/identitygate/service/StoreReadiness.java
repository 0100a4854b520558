package com.imperium.identitygate.service;

import com.imperium.identitygate.mapper.SchemaMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 关系库"可用 + 表结构就绪"的一次性闸门。
 * <p>
 * 并发的首批调用共享同一次初始化；失败结果在 {@code app.store.init-failure-ttl-ms} 内
 * 原样抛给所有调用方，不重试，过期后由下一位调用方发起且仅发起一次新的尝试。
 */
@Component
public class StoreReadiness {

    private static final Logger log = LoggerFactory.getLogger(StoreReadiness.class);

    private final SchemaMapper schemaMapper;
    private final Clock clock;
    private final Duration failureTtl;
    private final AtomicReference<Attempt> current = new AtomicReference<>();

    public StoreReadiness(SchemaMapper schemaMapper,
            Clock clock,
            @Value("${app.store.init-failure-ttl-ms:30000}") long failureTtlMs) {
        this.schemaMapper = schemaMapper;
        this.clock = clock;
        this.failureTtl = Duration.ofMillis(Math.max(0, failureTtlMs));
    }

    /**
     * @throws StoreUnavailableException 初始化失败（含缓存中的失败）
     */
    public void ensureReady() {
        Attempt attempt = current.get();
        if (attempt == null || attempt.isStale(clock.instant(), failureTtl)) {
            Attempt fresh = new Attempt();
            if (current.compareAndSet(attempt, fresh)) {
                fresh.run();
            }
            attempt = current.get();
        }
        attempt.await();
    }

    public boolean isReady() {
        Attempt attempt = current.get();
        return attempt != null && attempt.result.isDone() && !attempt.result.isCompletedExceptionally();
    }

    private void initialize() {
        schemaMapper.ping();
        schemaMapper.createUsers();
        schemaMapper.createUserChannels();
        schemaMapper.createUserChannelIndex();
        schemaMapper.createConversations();
        schemaMapper.createConversationIndex();
        schemaMapper.createMessages();
        schemaMapper.createMessageIndex();
    }

    private final class Attempt {

        private final CompletableFuture<Void> result = new CompletableFuture<>();
        private volatile Instant failedAt;

        void run() {
            try {
                initialize();
                result.complete(null);
                log.info("Identity store schema ready");
            } catch (RuntimeException e) {
                failedAt = clock.instant();
                log.error("Identity store init failed (cached for {} ms): {}", failureTtl.toMillis(), e.getMessage());
                result.completeExceptionally(e);
            } finally {
                // Error 不在上面捕获，照样向本调用方抛出，但等待方不能永远阻塞
                if (!result.isDone()) {
                    failedAt = clock.instant();
                    log.error("Identity store init aborted (cached for {} ms)", failureTtl.toMillis());
                    result.completeExceptionally(new IllegalStateException("identity store init aborted"));
                }
            }
        }

        boolean isStale(Instant now, Duration ttl) {
            Instant failed = failedAt;
            return failed != null && !now.isBefore(failed.plus(ttl));
        }

        void await() {
            try {
                result.join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new StoreUnavailableException("identity store unavailable", cause);
            }
        }
    }
}
