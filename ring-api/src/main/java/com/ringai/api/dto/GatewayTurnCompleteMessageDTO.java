package com.ringai.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ringai.types.enums.GatewayOutboundMessageTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TURN_COMPLETE 帧。两个转写字段即使为空也输出为 null，设备端按固定键解析。
 *
 * @author ringai
 * @since 2026-03-04
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GatewayTurnCompleteMessageDTO {

    private GatewayOutboundMessageTypeEnum type = GatewayOutboundMessageTypeEnum.TURN_COMPLETE;

    @JsonProperty("call_id")
    private String callId;

    @JsonProperty("output_transcript")
    private String outputTranscript;

    @JsonProperty("input_transcript")
    private String inputTranscript;

    @JsonProperty("was_interrupted")
    private boolean wasInterrupted;

    public static GatewayTurnCompleteMessageDTO of(String callId, String outputTranscript,
                                                   String inputTranscript, boolean wasInterrupted) {
        return new GatewayTurnCompleteMessageDTO(GatewayOutboundMessageTypeEnum.TURN_COMPLETE,
                callId, outputTranscript, inputTranscript, wasInterrupted);
    }
}
