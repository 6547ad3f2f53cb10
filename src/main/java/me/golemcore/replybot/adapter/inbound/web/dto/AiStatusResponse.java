package me.golemcore.replybot.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Provider status for the dashboard: connectivity, circuit state and reply
 * rate limit headroom.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AiStatusResponse {
    private String provider;
    private String displayName;
    private boolean aiEnabled;
    private boolean connected;
    private String error;
    private int errorCount;
    /** 0 when the circuit is closed, -1 when it stays open until a success. */
    private long timeUntilRecoveryMs;
    private long remainingRepliesPerMinute;
    private long remainingRepliesPerHour;
    private List<String> availableHostedModels;
}
