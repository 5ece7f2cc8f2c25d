package com.example.clusteragent.cluster;

public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * stderr when present, otherwise stdout; what a failed command has to say.
     */
    public String errorText() {
        return stderr != null && !stderr.isBlank() ? stderr.trim() : (stdout != null ? stdout.trim() : "");
    }
}
