package com.ringai.domain.agent.service;

import com.ringai.domain.agent.adapter.gateway.IAgentResponseListener;
import com.ringai.domain.agent.adapter.gateway.IRealtimeAgentClient;
import com.ringai.domain.agent.adapter.gateway.IRealtimeAgentClientFactory;
import com.ringai.domain.agent.model.valobj.AgentResponse;
import com.ringai.domain.agent.model.valobj.SessionConfig;
import com.ringai.domain.agent.model.valobj.SessionInfo;
import com.ringai.domain.agent.model.valobj.SessionMetrics;
import com.ringai.domain.agent.model.valobj.ToolResult;
import com.ringai.types.enums.SessionStateEnum;
import com.ringai.types.exception.AppException;
import com.ringai.types.exception.SessionLifecycleException;
import com.ringai.types.exception.SessionTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 上游实时语音会话：包装一条上游连接的生命周期状态机，并负责自动续期。
 * <p>
 * 状态迁移：CONNECTING → ACTIVE → {EXTENDING → ACTIVE | ERROR} → CLOSING → CLOSED。
 * 上游对单条连接有硬性时长上限，会话在 {@code timeout - buffer} 秒时用服务端下发的续期句柄
 * 重新建连，对话上下文随句柄延续。续期期间的发送会按序缓冲，新连接就绪后补发，不丢音频。
 * 续期失败后会话进入 ERROR，后续收发抛出 {@link SessionTimeoutException}，
 * 响应流也以该异常结束，调用方据此结束通话。
 * </p>
 * <p>
 * 响应通过 {@link #receive()} 取得的阻塞迭代器消费，通话期间需要一个线程持续拉取。
 * 每次建连对应一个"代"，旧连接的迟到回调按代号丢弃。
 * </p>
 *
 * @author ringai
 * @since 2026-03-02
 */
@Slf4j
public class AgentSession {

    private final String sessionId;
    private final SessionConfig config;
    private final IRealtimeAgentClientFactory clientFactory;
    private final TaskScheduler scheduler;
    private final long extendBufferSeconds;
    private final Clock clock;

    private final SessionMetrics metrics = new SessionMetrics();
    private final Instant createdAt;
    private volatile Instant lastActivityAt;
    private volatile SessionStateEnum state = SessionStateEnum.CONNECTING;
    private volatile AppException failure;

    private final Object lifecycleLock = new Object();
    private final Object ioLock = new Object();
    /** guarded by ioLock */
    private IRealtimeAgentClient client;
    /** guarded by ioLock */
    private final Deque<Consumer<IRealtimeAgentClient>> pendingSends = new ArrayDeque<>();
    /** guarded by lifecycleLock */
    private ScheduledFuture<?> extensionFuture;
    private final AtomicInteger generation = new AtomicInteger();
    private final AtomicInteger extensionCount = new AtomicInteger();
    private final BlockingQueue<Signal> inbox = new LinkedBlockingQueue<>();

    public AgentSession(String sessionId,
                        SessionConfig config,
                        IRealtimeAgentClientFactory clientFactory,
                        TaskScheduler scheduler,
                        long extendBufferSeconds,
                        Clock clock) {
        if (StringUtils.isBlank(sessionId)) {
            throw new IllegalArgumentException("Session id cannot be blank");
        }
        if (config == null || clientFactory == null) {
            throw new IllegalArgumentException("Session config and client factory are required");
        }
        this.sessionId = sessionId;
        this.config = config;
        this.clientFactory = clientFactory;
        this.scheduler = scheduler;
        this.extendBufferSeconds = Math.max(extendBufferSeconds, 0L);
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.createdAt = this.clock.instant();
        this.lastActivityAt = this.createdAt;
    }

    /**
     * 建立上游连接并进入 ACTIVE，只能从 CONNECTING 调用一次。
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (state != SessionStateEnum.CONNECTING) {
                throw new SessionLifecycleException("Session " + sessionId + " cannot start from state " + state);
            }
            IRealtimeAgentClient newClient = null;
            try {
                config.validate();
                newClient = clientFactory.create(config);
                newClient.connect(null, new GenerationListener(generation.incrementAndGet()));
            } catch (SessionLifecycleException ex) {
                transition(SessionStateEnum.ERROR);
                closeQuietly(newClient);
                throw ex;
            } catch (RuntimeException ex) {
                transition(SessionStateEnum.ERROR);
                closeQuietly(newClient);
                throw new SessionLifecycleException("Failed to connect session " + sessionId + ": " + ex.getMessage(), ex);
            }
            synchronized (ioLock) {
                client = newClient;
                state = SessionStateEnum.ACTIVE;
            }
            touch();
            scheduleExtension();
        }
        log.info("Agent session started. sessionId={}, model={}, voice={}, outputMode={}",
                sessionId, config.getModelId(), config.getVoiceName(), config.resolveOutputMode().getCode());
    }

    public void sendAudio(byte[] pcm) {
        if (pcm == null || pcm.length == 0) {
            return;
        }
        dispatch("send audio", c -> c.sendAudio(pcm));
        metrics.recordSent(pcm.length);
    }

    public void sendAudioEnd() {
        dispatch("send audio end", IRealtimeAgentClient::sendAudioEnd);
    }

    public void sendText(String text) {
        if (StringUtils.isBlank(text)) {
            throw new IllegalArgumentException("Text cannot be blank");
        }
        dispatch("send text", c -> c.sendText(text));
    }

    public void sendToolResponse(List<ToolResult> results) {
        if (results == null || results.isEmpty()) {
            return;
        }
        List<ToolResult> copy = List.copyOf(results);
        dispatch("send tool response", c -> c.sendToolResponse(copy));
    }

    /**
     * 响应事件流。迭代器的 {@code hasNext()} 会阻塞到下一个事件到达；
     * 会话关闭后流正常结束，续期失败或上游连接出错时以异常结束。只允许一个消费者。
     */
    public Iterator<AgentResponse> receive() {
        if (state == SessionStateEnum.CONNECTING) {
            throw new SessionLifecycleException("Session " + sessionId + " has not been started");
        }
        return new ResponseIterator();
    }

    /**
     * 关闭会话。任意状态下可重复调用。
     */
    public void teardown() {
        IRealtimeAgentClient toClose;
        synchronized (lifecycleLock) {
            if (state == SessionStateEnum.CLOSING || state == SessionStateEnum.CLOSED) {
                return;
            }
            synchronized (ioLock) {
                state = SessionStateEnum.CLOSING;
                toClose = client;
                client = null;
                pendingSends.clear();
            }
            cancelExtension();
            generation.incrementAndGet();
        }
        RuntimeException closeError = null;
        try {
            if (toClose != null) {
                toClose.close();
            }
        } catch (RuntimeException ex) {
            closeError = ex;
        } finally {
            transition(SessionStateEnum.CLOSED);
            inbox.offer(Signal.END);
        }
        log.info("Agent session closed. sessionId={}, chunksSent={}, chunksReceived={}, extensions={}",
                sessionId, metrics.getChunksSent(), metrics.getChunksReceived(), extensionCount.get());
        if (closeError != null) {
            throw new SessionLifecycleException("Failed to close upstream connection for session " + sessionId, closeError);
        }
    }

    /**
     * 续期：用当前连接的续期句柄重新建连。没有句柄时直接失败，不重试。
     */
    void extend() {
        IRealtimeAgentClient previous;
        synchronized (lifecycleLock) {
            extensionFuture = null;
            if (state != SessionStateEnum.ACTIVE) {
                log.debug("Skip session extension. sessionId={}, state={}", sessionId, state);
                return;
            }
            synchronized (ioLock) {
                state = SessionStateEnum.EXTENDING;
                previous = client;
            }
        }
        log.info("Extending agent session. sessionId={}, extensions={}", sessionId, extensionCount.get());
        IRealtimeAgentClient next = null;
        try {
            String handle = previous == null ? null : previous.getResumptionHandle();
            if (StringUtils.isBlank(handle)) {
                throw new SessionLifecycleException("No resumption handle available for session " + sessionId);
            }
            int nextGeneration = generation.incrementAndGet();
            closeQuietly(previous);
            next = clientFactory.create(config);
            next.connect(handle, new GenerationListener(nextGeneration));
            synchronized (lifecycleLock) {
                if (state != SessionStateEnum.EXTENDING) {
                    log.info("Session closed during extension, dropping new connection. sessionId={}", sessionId);
                    closeQuietly(next);
                    return;
                }
                synchronized (ioLock) {
                    client = next;
                    while (!pendingSends.isEmpty()) {
                        pendingSends.pollFirst().accept(next);
                    }
                    state = SessionStateEnum.ACTIVE;
                }
                extensionCount.incrementAndGet();
                touch();
                scheduleExtension();
            }
            log.info("Agent session extended. sessionId={}, extensions={}", sessionId, extensionCount.get());
        } catch (RuntimeException ex) {
            closeQuietly(next);
            failExtension(ex);
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionConfig getConfig() {
        return config;
    }

    public SessionStateEnum getState() {
        return state;
    }

    public SessionMetrics getMetrics() {
        return metrics;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public int getExtensionCount() {
        return extensionCount.get();
    }

    public String getResumptionHandle() {
        synchronized (ioLock) {
            return client == null ? null : client.getResumptionHandle();
        }
    }

    public SessionInfo snapshot() {
        return new SessionInfo(sessionId,
                state,
                config.getModelId(),
                config.getVoiceName(),
                config.resolveOutputMode(),
                createdAt,
                lastActivityAt,
                metrics.getChunksSent(),
                metrics.getChunksReceived(),
                metrics.getBytesSent(),
                metrics.getBytesReceived(),
                StringUtils.isNotBlank(getResumptionHandle()));
    }

    private void dispatch(String operation, Consumer<IRealtimeAgentClient> action) {
        synchronized (ioLock) {
            SessionStateEnum current = state;
            if (!current.acceptsIo()) {
                AppException cause = failure;
                if (current == SessionStateEnum.ERROR && cause instanceof SessionTimeoutException) {
                    throw new SessionTimeoutException("Session " + sessionId + " expired, cannot " + operation, cause);
                }
                throw new SessionLifecycleException("Cannot " + operation + " on session " + sessionId + " in state " + current);
            }
            if (current == SessionStateEnum.EXTENDING || client == null) {
                pendingSends.addLast(action);
            } else {
                action.accept(client);
            }
        }
        touch();
    }

    private void scheduleExtension() {
        if (scheduler == null) {
            return;
        }
        long timeoutSeconds = config.getTimeoutMinutes() * 60L;
        long delaySeconds = timeoutSeconds - extendBufferSeconds;
        if (delaySeconds <= 0) {
            delaySeconds = timeoutSeconds;
        }
        extensionFuture = scheduler.schedule(this::extend, clock.instant().plusSeconds(delaySeconds));
        log.debug("Session extension scheduled. sessionId={}, delaySeconds={}", sessionId, delaySeconds);
    }

    private void cancelExtension() {
        ScheduledFuture<?> future = extensionFuture;
        extensionFuture = null;
        if (future != null) {
            future.cancel(false);
        }
    }

    private void failExtension(RuntimeException cause) {
        IRealtimeAgentClient current;
        SessionTimeoutException timeout = new SessionTimeoutException(
                "Session " + sessionId + " extension failed: " + cause.getMessage(), cause);
        synchronized (lifecycleLock) {
            if (state == SessionStateEnum.CLOSING || state == SessionStateEnum.CLOSED) {
                return;
            }
            failure = timeout;
            synchronized (ioLock) {
                state = SessionStateEnum.ERROR;
                current = client;
                client = null;
                pendingSends.clear();
            }
            generation.incrementAndGet();
        }
        closeQuietly(current);
        log.error("Agent session extension failed. sessionId={}, error={}", sessionId, cause.getMessage(), cause);
        inbox.offer(Signal.failed(timeout));
    }

    private void failConnection(int connectionGeneration, Throwable error) {
        SessionLifecycleException lifecycleError = new SessionLifecycleException(
                "Upstream connection failed for session " + sessionId + ": "
                        + (error == null ? "unknown" : error.getMessage()), error);
        synchronized (lifecycleLock) {
            if (connectionGeneration != generation.get() || !state.acceptsIo()) {
                return;
            }
            failure = lifecycleError;
            transition(SessionStateEnum.ERROR);
        }
        log.warn("Upstream connection failed. sessionId={}, error={}", sessionId,
                error == null ? null : error.getMessage());
        inbox.offer(Signal.failed(lifecycleError));
    }

    private void transition(SessionStateEnum target) {
        synchronized (ioLock) {
            state = target;
        }
    }

    private void touch() {
        lastActivityAt = clock.instant();
    }

    private void closeQuietly(IRealtimeAgentClient target) {
        if (target == null) {
            return;
        }
        try {
            target.close();
        } catch (RuntimeException ex) {
            log.warn("Failed to close upstream connection. sessionId={}, error={}", sessionId, ex.getMessage());
        }
    }

    /**
     * 单次建连的回调，代号过期后所有回调被忽略。
     */
    private final class GenerationListener implements IAgentResponseListener {

        private final int connectionGeneration;

        private GenerationListener(int connectionGeneration) {
            this.connectionGeneration = connectionGeneration;
        }

        @Override
        public void onResponse(AgentResponse response) {
            if (response == null || connectionGeneration != generation.get()) {
                return;
            }
            inbox.offer(Signal.of(response));
        }

        @Override
        public void onError(Throwable error) {
            if (connectionGeneration != generation.get() || state == SessionStateEnum.EXTENDING) {
                return;
            }
            failConnection(connectionGeneration, error);
        }

        @Override
        public void onClosed() {
            if (connectionGeneration != generation.get() || state != SessionStateEnum.ACTIVE) {
                return;
            }
            log.info("Upstream closed the connection. sessionId={}", sessionId);
            synchronized (lifecycleLock) {
                if (connectionGeneration != generation.get() || state != SessionStateEnum.ACTIVE) {
                    return;
                }
                failure = new SessionLifecycleException("Upstream closed session " + sessionId);
                transition(SessionStateEnum.ERROR);
            }
            inbox.offer(Signal.END);
        }
    }

    private final class ResponseIterator implements Iterator<AgentResponse> {

        private AgentResponse next;
        private boolean done;

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (done) {
                return false;
            }
            Signal signal;
            try {
                signal = inbox.take();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                done = true;
                return false;
            }
            if (signal == Signal.END) {
                done = true;
                inbox.offer(Signal.END);
                return false;
            }
            if (signal.error != null) {
                done = true;
                throw signal.error;
            }
            next = signal.response;
            metrics.recordReceived(next.audioLength());
            touch();
            return true;
        }

        @Override
        public AgentResponse next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Response stream of session " + sessionId + " has ended");
            }
            AgentResponse current = next;
            next = null;
            return current;
        }
    }

    private static final class Signal {

        private static final Signal END = new Signal(null, null);

        private final AgentResponse response;
        private final AppException error;

        private Signal(AgentResponse response, AppException error) {
            this.response = response;
            this.error = error;
        }

        private static Signal of(AgentResponse response) {
            return new Signal(response, null);
        }

        private static Signal failed(AppException error) {
            return new Signal(null, error);
        }
    }
}
