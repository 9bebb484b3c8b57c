package com.nexus.resolution.api;

import com.nexus.resolution.core.model.CandidateEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Candidates set aside for operator attention after graph writes exhausted their retries.
 */
public class DeadLetterQueue {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueue.class);

    private final ConcurrentLinkedQueue<DeadLetter> letters = new ConcurrentLinkedQueue<>();

    public DeadLetter add(CandidateEntity candidate, Throwable cause) {
        DeadLetter letter = DeadLetter.of(candidate, cause);
        letters.add(letter);
        log.error("resolution.dead_lettered ingestionId={} cause='{}'", candidate.ingestionId(), letter.cause());
        return letter;
    }

    public List<DeadLetter> list() {
        return List.copyOf(letters);
    }

    /**
     * Removes and returns every letter, e.g. for replay once the store recovers.
     */
    public List<DeadLetter> drain() {
        List<DeadLetter> drained = new ArrayList<>();
        DeadLetter letter;
        while ((letter = letters.poll()) != null) {
            drained.add(letter);
        }
        return drained;
    }

    public int size() {
        return letters.size();
    }
}
