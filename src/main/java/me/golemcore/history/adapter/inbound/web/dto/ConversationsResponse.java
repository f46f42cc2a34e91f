package me.golemcore.history.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.history.domain.model.SessionSummary;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationsResponse {
    private boolean success;
    private String projectPath;
    private List<SessionSummary> conversations;
    private int totalMessages;
}
