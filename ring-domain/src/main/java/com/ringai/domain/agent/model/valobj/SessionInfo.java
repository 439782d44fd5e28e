package com.ringai.domain.agent.model.valobj;

import com.ringai.types.enums.OutputModeEnum;
import com.ringai.types.enums.SessionStateEnum;

import java.time.Instant;

/**
 * 会话元数据快照，供会话池观测接口使用。
 */
public record SessionInfo(String sessionId,
                          SessionStateEnum state,
                          String modelId,
                          String voiceName,
                          OutputModeEnum outputMode,
                          Instant createdAt,
                          Instant lastActivityAt,
                          long chunksSent,
                          long chunksReceived,
                          long bytesSent,
                          long bytesReceived,
                          boolean resumable) {
}
