package ai.classtalk.backend.service;

import ai.classtalk.backend.model.entity.DiscussionSession;
import ai.classtalk.backend.model.entity.FlaggedContent;

import java.util.Collections;
import java.util.List;

/**
 * The session after an append, together with the flags that batch produced.
 */
public class IngestionResult {

    private final DiscussionSession session;
    private final List<FlaggedContent> newFlags;

    public IngestionResult(DiscussionSession session, List<FlaggedContent> newFlags) {
        this.session = session;
        this.newFlags = Collections.unmodifiableList(newFlags);
    }

    public DiscussionSession getSession() {
        return session;
    }

    public List<FlaggedContent> getNewFlags() {
        return newFlags;
    }
}
