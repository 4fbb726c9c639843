package org.learningjava.carbonengine.application.port;

import org.learningjava.carbonengine.domain.model.activity.ExtractedActivity;

/** Language-understanding backend that turns free text into activity fields. */
public interface ActivityExtractionPort {
    ExtractedActivity extract(String rawText);
}
