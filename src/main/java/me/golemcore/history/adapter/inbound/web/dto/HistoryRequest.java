package me.golemcore.history.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * History query. Only {@code projectPath} is required; {@code after} and
 * {@code before} are ISO-8601 instants, both inclusive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryRequest {
    private String projectPath;
    private List<String> sources;
    private List<String> roles;
    private String after;
    private String before;
    private Integer limit;
}
