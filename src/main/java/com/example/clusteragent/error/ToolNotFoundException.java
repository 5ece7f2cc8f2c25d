package com.example.clusteragent.error;

import lombok.Getter;

@Getter
public class ToolNotFoundException extends AgentException {

    private final String toolName;

    public ToolNotFoundException(String toolName) {
        super(ErrorKind.NOT_FOUND, "Tool '" + toolName + "' not found in any registered plugin");
        this.toolName = toolName;
    }
}
