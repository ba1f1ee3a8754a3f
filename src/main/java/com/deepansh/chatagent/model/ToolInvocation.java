package com.deepansh.chatagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One tool call proposed by the reasoning service. The orchestrator fills in
 * exactly one of resultText / errorText once the call has run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolInvocation {

    /** ID assigned by the reasoning service, if any */
    private String id;

    private String name;

    private Map<String, Object> arguments;

    private String resultText;

    private String errorText;

    public boolean failed() {
        return errorText != null;
    }
}
