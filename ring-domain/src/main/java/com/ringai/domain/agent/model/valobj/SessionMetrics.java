package com.ringai.domain.agent.model.valobj;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 会话收发计数，发送线程和接收线程并发更新。
 */
public class SessionMetrics {

    private final AtomicLong chunksSent = new AtomicLong();
    private final AtomicLong chunksReceived = new AtomicLong();
    private final AtomicLong bytesSent = new AtomicLong();
    private final AtomicLong bytesReceived = new AtomicLong();

    public void recordSent(int bytes) {
        chunksSent.incrementAndGet();
        bytesSent.addAndGet(bytes);
    }

    public void recordReceived(int bytes) {
        chunksReceived.incrementAndGet();
        bytesReceived.addAndGet(bytes);
    }

    public long getChunksSent() {
        return chunksSent.get();
    }

    public long getChunksReceived() {
        return chunksReceived.get();
    }

    public long getBytesSent() {
        return bytesSent.get();
    }

    public long getBytesReceived() {
        return bytesReceived.get();
    }
}
