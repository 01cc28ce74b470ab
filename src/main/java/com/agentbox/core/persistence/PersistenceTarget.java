package com.agentbox.core.persistence;

/**
 * Where closed turns are written: a sandbox id on a core API base URL.
 *
 * @param sandboxId  the sandbox whose state is written
 * @param coreApiUrl base URL of the core API, trailing slash optional
 */
public record PersistenceTarget(String sandboxId, String coreApiUrl) {

    public PersistenceTarget {
        if (sandboxId == null || sandboxId.isBlank()) {
            throw new IllegalArgumentException("sandboxId is required");
        }
        if (coreApiUrl == null || coreApiUrl.isBlank()) {
            throw new IllegalArgumentException("coreApiUrl is required");
        }
        coreApiUrl = coreApiUrl.endsWith("/") ? coreApiUrl.substring(0, coreApiUrl.length() - 1) : coreApiUrl;
    }

    public String stateUrl() {
        return coreApiUrl + "/sandboxes/" + sandboxId + "/state";
    }

    public String logsUrl(int turnIndex) {
        return coreApiUrl + "/sandboxes/" + sandboxId + "/logs?turnIndex=" + turnIndex;
    }
}
