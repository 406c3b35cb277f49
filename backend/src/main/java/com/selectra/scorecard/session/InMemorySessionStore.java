package com.selectra.scorecard.session;

import com.selectra.scorecard.model.AnswerResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local session store. Appends to the same session are serialised
 * through {@link ConcurrentHashMap#compute}; different sessions never contend.
 */
@Repository
@Slf4j
public class InMemorySessionStore implements SessionStore {

    private final Map<String, List<AnswerResult>> sessions = new ConcurrentHashMap<>();

    @Override
    public void append(String sessionId, AnswerResult result) {
        sessions.compute(sessionId, (id, answers) -> {
            List<AnswerResult> updated = answers == null ? new ArrayList<>() : answers;
            updated.add(result);
            return updated;
        });
    }

    @Override
    public List<AnswerResult> get(String sessionId) {
        List<AnswerResult> snapshot = new ArrayList<>();
        sessions.computeIfPresent(sessionId, (id, answers) -> {
            snapshot.addAll(answers);
            return answers;
        });
        return List.copyOf(snapshot);
    }

    @Override
    public void reset(String sessionId) {
        sessions.remove(sessionId);
        log.info("Session {} reset", sessionId);
    }
}
