package com.analysis.nodeflow.api;

import com.analysis.nodeflow.session.SessionOutcome;
import com.analysis.nodeflow.session.SessionValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A live interpreter holding the values bound by previously executed code.
 *
 * <p>
 * This is the fast tier of the cache: a name that is bound here does not
 * need to be loaded or recomputed. One session serves one project, and calls
 * on it are made from one request thread at a time.
 */
public interface RuntimeSession extends AutoCloseable {

    /**
     * Reports, in one round trip, which of the given names are bound.
     *
     * @return a map with an entry for every requested name
     */
    Map<String, Boolean> checkExist(List<String> names);

    /**
     * Runs code, waiting at most {@code timeout}. A timeout is reported in the
     * outcome rather than thrown.
     */
    SessionOutcome execute(String code, Duration timeout);

    /** Describes the value bound under {@code name}, or empty if none (or None). */
    Optional<SessionValue> getValue(String name);

    @Override
    void close();
}
