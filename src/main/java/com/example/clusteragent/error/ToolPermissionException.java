package com.example.clusteragent.error;

import lombok.Getter;

/**
 * Raised by the tool gateway when a tool's risk class is not permitted for the
 * calling session's current phase, or when a mutating tool is requested before an
 * approval transition has been recorded.
 */
@Getter
public class ToolPermissionException extends AgentException {

    private final String toolName;

    public ToolPermissionException(String toolName, String message) {
        super(ErrorKind.PERMISSION, message);
        this.toolName = toolName;
    }
}
