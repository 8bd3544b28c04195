package com.projectpulse.publishers.api;

import com.projectpulse.core.model.Candidate;
import com.projectpulse.core.model.Destination;

public interface ContentRenderer {
    /**
     * @param shortened {@code true} after the destination rejected the regular rendering as too long
     */
    String render(Candidate candidate, Destination destination, boolean shortened);
}
