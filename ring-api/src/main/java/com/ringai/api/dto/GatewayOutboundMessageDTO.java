package com.ringai.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ringai.types.enums.GatewayOutboundMessageTypeEnum;
import com.ringai.types.enums.ToolExecutionStatusEnum;
import com.ringai.types.enums.TranscriptSpeakerEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 下发给网关设备的 JSON 控制帧，未设置的字段不序列化。
 * TURN_COMPLETE 使用 {@link GatewayTurnCompleteMessageDTO}。
 *
 * @author ringai
 * @since 2026-03-04
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayOutboundMessageDTO {

    private GatewayOutboundMessageTypeEnum type;

    @JsonProperty("call_id")
    private String callId;

    private String reason;

    @JsonProperty("forward_to")
    private String forwardTo;

    @JsonProperty("session_id")
    private String sessionId;

    private String error;

    @JsonProperty("tool_name")
    private String toolName;

    @JsonProperty("tool_call_id")
    private String toolCallId;

    private ToolExecutionStatusEnum status;

    private TranscriptSpeakerEnum speaker;

    private String text;

    public static GatewayOutboundMessageDTO answerCall(String callId) {
        return GatewayOutboundMessageDTO.builder()
                .type(GatewayOutboundMessageTypeEnum.ANSWER_CALL)
                .callId(callId)
                .build();
    }

    public static GatewayOutboundMessageDTO rejectCall(String callId, String reason) {
        return GatewayOutboundMessageDTO.builder()
                .type(GatewayOutboundMessageTypeEnum.REJECT_CALL)
                .callId(callId)
                .reason(reason)
                .build();
    }

    public static GatewayOutboundMessageDTO forwardCall(String callId, String forwardTo) {
        return GatewayOutboundMessageDTO.builder()
                .type(GatewayOutboundMessageTypeEnum.FORWARD_CALL)
                .callId(callId)
                .forwardTo(forwardTo)
                .build();
    }

    public static GatewayOutboundMessageDTO sessionReady(String callId, String sessionId) {
        return GatewayOutboundMessageDTO.builder()
                .type(GatewayOutboundMessageTypeEnum.SESSION_READY)
                .callId(callId)
                .sessionId(sessionId)
                .build();
    }

    public static GatewayOutboundMessageDTO sessionError(String callId, String error) {
        return GatewayOutboundMessageDTO.builder()
                .type(GatewayOutboundMessageTypeEnum.SESSION_ERROR)
                .callId(callId)
                .error(error)
                .build();
    }

    public static GatewayOutboundMessageDTO transcript(String callId, TranscriptSpeakerEnum speaker, String text) {
        return GatewayOutboundMessageDTO.builder()
                .type(GatewayOutboundMessageTypeEnum.CALL_TRANSCRIPT)
                .callId(callId)
                .speaker(speaker)
                .text(text)
                .build();
    }

    public static GatewayOutboundMessageDTO toolExecution(String callId, String toolName, String toolCallId,
                                                          ToolExecutionStatusEnum status) {
        return GatewayOutboundMessageDTO.builder()
                .type(GatewayOutboundMessageTypeEnum.TOOL_EXECUTION)
                .callId(callId)
                .toolName(toolName)
                .toolCallId(toolCallId)
                .status(status)
                .build();
    }
}
