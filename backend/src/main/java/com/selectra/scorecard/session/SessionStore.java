package com.selectra.scorecard.session;

import com.selectra.scorecard.model.AnswerResult;

import java.util.List;

/**
 * Keyed, append-only record of evaluated answers per interview session.
 */
public interface SessionStore {

    void append(String sessionId, AnswerResult result);

    /**
     * @return the session's answers in arrival order, or an empty list for an
     * unknown session. The returned list is a snapshot.
     */
    List<AnswerResult> get(String sessionId);

    void reset(String sessionId);
}
