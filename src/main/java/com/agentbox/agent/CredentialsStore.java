package com.agentbox.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Latest credentials and the agent environment derived from them.
 * Every update bumps the revision, which forces the agent to restart on next use.
 */
@Component
public class CredentialsStore {

    private static final Logger log = LoggerFactory.getLogger(CredentialsStore.class);

    private CredentialsPayload payload;
    private Map<String, String> environment = Map.of();
    private long revision;

    public synchronized long update(CredentialsPayload newPayload) {
        payload = newPayload;
        environment = Map.copyOf(toEnvironment(newPayload));
        revision++;
        log.info("Credentials updated (revision {}, {} environment variables)", revision, environment.size());
        return revision;
    }

    public synchronized long revision() {
        return revision;
    }

    public synchronized Map<String, String> environment() {
        return environment;
    }

    public synchronized boolean hasCredentials() {
        return payload != null;
    }

    static Map<String, String> toEnvironment(CredentialsPayload payload) {
        Map<String, String> env = new LinkedHashMap<>();
        if (payload == null) {
            return env;
        }
        if (payload.llm() != null) {
            putTrimmed(env, "OPENAI_API_KEY", payload.llm().openaiApiKey());
            putTrimmed(env, "ANTHROPIC_API_KEY", payload.llm().anthropicApiKey());
        }
        if (payload.github() != null) {
            putTrimmed(env, "GITHUB_TOKEN", payload.github().token());
            putTrimmed(env, "GITHUB_USERNAME", payload.github().username());
            putTrimmed(env, "GITHUB_EMAIL", payload.github().email());
        }
        if (payload.extra() != null && payload.extra().env() != null) {
            payload.extra().env().forEach((key, value) -> putTrimmed(env, key, value));
        }
        return env;
    }

    private static void putTrimmed(Map<String, String> env, String key, String value) {
        if (key == null || value == null) {
            return;
        }
        String trimmed = value.trim();
        if (!trimmed.isEmpty()) {
            env.put(key, trimmed);
        }
    }
}
