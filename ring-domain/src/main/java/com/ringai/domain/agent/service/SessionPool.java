package com.ringai.domain.agent.service;

import com.ringai.domain.agent.model.valobj.SessionConfig;
import com.ringai.domain.agent.model.valobj.SessionInfo;
import com.ringai.types.exception.AdmissionExhaustedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 会话池：限制全局并发上游会话数，登记并回收所有活跃会话。
 * <p>
 * 准入用信号量控制，槽位数即池容量；登记表由单把锁保护。
 * 会话启动失败时立即归还已占用的槽位；{@link #release(String)} 幂等，
 * 无论会话关闭是否出错都会归还槽位，避免前序错误导致槽位泄漏。
 * </p>
 *
 * @author ringai
 * @since 2026-03-02
 */
@Slf4j
public class SessionPool {

    private final int maxSessions;
    private final SessionConfig defaults;
    private final AgentSessionFactory sessionFactory;
    private final Executor teardownExecutor;
    private final Duration teardownTimeout;

    private final Semaphore slots;
    private final ReentrantLock registryLock = new ReentrantLock();
    /** guarded by registryLock */
    private final Map<String, AgentSession> sessions = new LinkedHashMap<>();

    private final AtomicLong admittedTotal = new AtomicLong();
    private final AtomicLong rejectedTotal = new AtomicLong();

    public SessionPool(int maxSessions,
                       SessionConfig defaults,
                       AgentSessionFactory sessionFactory,
                       Executor teardownExecutor,
                       Duration teardownTimeout) {
        if (maxSessions <= 0) {
            throw new IllegalArgumentException("Max sessions must be positive: " + maxSessions);
        }
        this.maxSessions = maxSessions;
        this.defaults = defaults == null
                ? SessionConfig.builtInDefaults()
                : defaults.mergeDefaults(SessionConfig.builtInDefaults());
        this.sessionFactory = sessionFactory;
        this.teardownExecutor = teardownExecutor == null ? ForkJoinPool.commonPool() : teardownExecutor;
        this.teardownTimeout = teardownTimeout == null ? Duration.ofSeconds(30) : teardownTimeout;
        this.slots = new Semaphore(maxSessions, true);
    }

    /**
     * 申请一个会话：等待槽位直到 timeout，随后创建并启动会话。
     *
     * @param config 可为 null，未设置的字段由池级默认值补齐
     * @param timeout 等待槽位的最长时间
     * @return 已启动并登记的会话
     * @throws AdmissionExhaustedException 超时仍无空闲槽位
     */
    public AgentSession acquire(SessionConfig config, Duration timeout) {
        long waitMillis = timeout == null ? 0L : Math.max(timeout.toMillis(), 0L);
        boolean admitted;
        try {
            admitted = slots.tryAcquire(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            rejectedTotal.incrementAndGet();
            throw new AdmissionExhaustedException("Interrupted while waiting for a session slot");
        }
        if (!admitted) {
            rejectedTotal.incrementAndGet();
            log.warn("Session pool exhausted. active={}/{}, waitedMs={}", activeCount(), maxSessions, waitMillis);
            throw new AdmissionExhaustedException("Session pool exhausted (" + maxSessions
                    + " active), no slot within " + waitMillis + "ms");
        }

        AgentSession session;
        try {
            SessionConfig merged = config == null ? defaults : config.mergeDefaults(defaults);
            session = sessionFactory.create(merged);
            session.start();
        } catch (RuntimeException ex) {
            slots.release();
            log.warn("Failed to start pooled session, slot returned. available={}, error={}",
                    slots.availablePermits(), ex.getMessage());
            throw ex;
        }

        registryLock.lock();
        try {
            sessions.put(session.getSessionId(), session);
        } finally {
            registryLock.unlock();
        }
        admittedTotal.incrementAndGet();
        log.info("Pool acquired session. sessionId={}, active={}/{}", session.getSessionId(), activeCount(), maxSessions);
        return session;
    }

    /**
     * 释放会话，未知或已释放的 id 直接返回。关闭错误只记录日志。
     */
    public void release(String sessionId) {
        AgentSession session;
        registryLock.lock();
        try {
            session = sessionId == null ? null : sessions.remove(sessionId);
        } finally {
            registryLock.unlock();
        }
        if (session == null) {
            log.debug("Release ignored for unknown session. sessionId={}", sessionId);
            return;
        }
        try {
            session.teardown();
        } catch (RuntimeException ex) {
            log.warn("Session teardown failed during release. sessionId={}, error={}", sessionId, ex.getMessage(), ex);
        } finally {
            slots.release();
        }
        log.info("Pool released session. sessionId={}, active={}/{}", sessionId, activeCount(), maxSessions);
    }

    /**
     * 并发关闭所有登记的会话，单个失败不影响其它会话。
     */
    public void teardownAll() {
        List<String> ids;
        registryLock.lock();
        try {
            ids = new ArrayList<>(sessions.keySet());
        } finally {
            registryLock.unlock();
        }
        if (ids.isEmpty()) {
            return;
        }
        log.info("Tearing down all pooled sessions. count={}", ids.size());
        List<CompletableFuture<Void>> futures = new ArrayList<>(ids.size());
        for (String id : ids) {
            futures.add(CompletableFuture.runAsync(() -> release(id), teardownExecutor)
                    .exceptionally(ex -> {
                        log.warn("Teardown task failed. sessionId={}, error={}", id, ex.getMessage());
                        return null;
                    }));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(teardownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while tearing down pooled sessions. remaining={}", activeCount());
        } catch (ExecutionException | TimeoutException ex) {
            log.warn("Pooled session teardown incomplete. remaining={}, error={}", activeCount(), ex.getMessage());
        }
    }

    public AgentSession get(String sessionId) {
        registryLock.lock();
        try {
            return sessions.get(sessionId);
        } finally {
            registryLock.unlock();
        }
    }

    public int activeCount() {
        registryLock.lock();
        try {
            return sessions.size();
        } finally {
            registryLock.unlock();
        }
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public SessionConfig getDefaults() {
        return defaults;
    }

    public long getAdmittedTotal() {
        return admittedTotal.get();
    }

    public long getRejectedTotal() {
        return rejectedTotal.get();
    }

    public List<SessionInfo> snapshots() {
        List<AgentSession> current;
        registryLock.lock();
        try {
            current = new ArrayList<>(sessions.values());
        } finally {
            registryLock.unlock();
        }
        List<SessionInfo> result = new ArrayList<>(current.size());
        for (AgentSession session : current) {
            result.add(session.snapshot());
        }
        return result;
    }
}
