package com.example.tagging.model;

/**
 * An event to be tagged, as received from the boundary.
 *
 * @param id               event number; may be blank, the processor then assigns one
 * @param title            event title (required)
 * @param organizer        organizing body
 * @param subtype          event subtype
 * @param teaser           short teaser text
 * @param description      long description
 * @param plainDescription description with HTML stripped, preferred over {@code description}
 */
public record EventRecord(
        String id,
        String title,
        String organizer,
        String subtype,
        String teaser,
        String description,
        String plainDescription
) {

    /** Creates a copy with the given id. */
    public EventRecord withId(String newId) {
        return new EventRecord(newId, title, organizer, subtype, teaser, description, plainDescription);
    }

    /** Creates a copy with cleaned text fields; id, organizer and subtype are kept. */
    public EventRecord withText(String newTitle, String newTeaser, String newDescription, String newPlainDescription) {
        return new EventRecord(id, newTitle, organizer, subtype, newTeaser, newDescription, newPlainDescription);
    }

    public boolean hasDescription() {
        return notBlank(teaser) || notBlank(description) || notBlank(plainDescription);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
