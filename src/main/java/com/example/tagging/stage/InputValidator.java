package com.example.tagging.stage;

import com.example.tagging.model.EventRecord;

/**
 * First pipeline stage: rejects unusable events and cleans the text of the others.
 */
@FunctionalInterface
public interface InputValidator {

    /**
     * @return a cleaned copy of the event
     * @throws ValidationException if a required field is missing or the event must not be processed
     */
    EventRecord validate(EventRecord event);
}
