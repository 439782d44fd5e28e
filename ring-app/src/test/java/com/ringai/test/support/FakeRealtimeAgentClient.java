package com.ringai.test.support;

import com.ringai.domain.agent.adapter.gateway.IAgentResponseListener;
import com.ringai.domain.agent.adapter.gateway.IRealtimeAgentClient;
import com.ringai.domain.agent.model.valobj.AgentResponse;
import com.ringai.domain.agent.model.valobj.SessionConfig;
import com.ringai.domain.agent.model.valobj.ToolResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 内存版上游连接：记录所有发送内容，由测试主动推送响应。
 */
public class FakeRealtimeAgentClient implements IRealtimeAgentClient {

    private final SessionConfig config;
    private final List<byte[]> sentAudio = new CopyOnWriteArrayList<>();
    private final List<String> sentTexts = new CopyOnWriteArrayList<>();
    private final List<List<ToolResult>> sentToolResponses = new CopyOnWriteArrayList<>();

    private volatile IAgentResponseListener listener;
    private volatile String connectHandle;
    private volatile String resumptionHandle;
    private volatile boolean connected;
    private volatile boolean closed;
    private volatile int audioEndCount;
    private volatile RuntimeException connectFailure;
    private volatile RuntimeException closeFailure;
    private volatile Runnable onConnect;

    public FakeRealtimeAgentClient(SessionConfig config) {
        this.config = config;
    }

    @Override
    public void connect(String resumptionHandle, IAgentResponseListener listener) {
        this.connectHandle = resumptionHandle;
        if (onConnect != null) {
            onConnect.run();
        }
        if (connectFailure != null) {
            throw connectFailure;
        }
        this.listener = listener;
        this.connected = true;
    }

    @Override
    public void sendAudio(byte[] pcm) {
        sentAudio.add(pcm);
    }

    @Override
    public void sendAudioEnd() {
        audioEndCount++;
    }

    @Override
    public void sendText(String text) {
        sentTexts.add(text);
    }

    @Override
    public void sendToolResponse(List<ToolResult> results) {
        sentToolResponses.add(results);
    }

    @Override
    public String getResumptionHandle() {
        return resumptionHandle;
    }

    @Override
    public boolean isConnected() {
        return connected && !closed;
    }

    @Override
    public void close() {
        closed = true;
        connected = false;
        if (closeFailure != null) {
            throw closeFailure;
        }
    }

    public void emit(AgentResponse response) {
        listener.onResponse(response);
    }

    public void fail(Throwable error) {
        listener.onError(error);
    }

    public void closeFromServer() {
        listener.onClosed();
    }

    public SessionConfig getConfig() {
        return config;
    }

    public List<byte[]> getSentAudio() {
        return sentAudio;
    }

    public List<String> getSentTexts() {
        return sentTexts;
    }

    public List<List<ToolResult>> getSentToolResponses() {
        return sentToolResponses;
    }

    public String getConnectHandle() {
        return connectHandle;
    }

    public boolean isClosed() {
        return closed;
    }

    public int getAudioEndCount() {
        return audioEndCount;
    }

    public void setResumptionHandle(String resumptionHandle) {
        this.resumptionHandle = resumptionHandle;
    }

    public void setConnectFailure(RuntimeException connectFailure) {
        this.connectFailure = connectFailure;
    }

    public void setCloseFailure(RuntimeException closeFailure) {
        this.closeFailure = closeFailure;
    }

    public void setOnConnect(Runnable onConnect) {
        this.onConnect = onConnect;
    }
}
