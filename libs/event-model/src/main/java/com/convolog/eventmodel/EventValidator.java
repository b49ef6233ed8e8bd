package com.convolog.eventmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates events before they are appended to the log.
 *
 * <p>Collects every problem at once into a {@link ValidationResult} instead of failing on the
 * first one.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Validates a single event.
     *
     * @param event the event to validate
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(EventData event) {
        if (event == null) {
            return ValidationResult.fail(List.of("event must not be null"));
        }
        var errors = new ArrayList<String>();

        if (isBlank(event.eventType())) {
            errors.add("eventType must not be null or blank");
        }
        if (event.data().keySet().stream().anyMatch(EventValidator::isBlank)) {
            errors.add("data keys must not be blank");
        }
        if (event.metadata().keySet().stream().anyMatch(EventValidator::isBlank)) {
            errors.add("metadata keys must not be blank");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /**
     * Validates an append request: the stream id, the expected version and every event.
     *
     * @return a {@link ValidationResult} with all errors found, prefixed by event position
     */
    public static ValidationResult validateAppend(String streamId, long expectedVersion, List<EventData> events) {
        var errors = new ArrayList<String>();

        if (isBlank(streamId)) {
            errors.add("streamId must not be null or blank");
        }
        if (expectedVersion < 0) {
            errors.add("expectedVersion must be >= 0");
        }
        if (events == null || events.isEmpty()) {
            errors.add("events must not be empty");
        } else {
            for (int i = 0; i < events.size(); i++) {
                for (String error : validate(events.get(i)).errors()) {
                    errors.add("events[" + i + "]: " + error);
                }
            }
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
