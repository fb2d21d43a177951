package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.exception.UnknownSessionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class SessionRegistry {

    private final Map<String, SessionContext> sessions = new ConcurrentHashMap<>();

    public SessionContext forAgent(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new UnknownSessionException("X-Agent-Id header is required");
        }
        return sessions.computeIfAbsent(agentId.trim(), id -> {
            log.info("Opened session for agent {}", id);
            return new SessionContext(id);
        });
    }

    public void close(String agentId) {
        if (sessions.remove(agentId) != null) {
            log.info("Closed session for agent {}", agentId);
        }
    }
}
