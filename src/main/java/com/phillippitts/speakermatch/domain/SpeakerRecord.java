package com.phillippitts.speakermatch.domain;

/**
 * Immutable catalog entry describing one conference speaker.
 *
 * <p>{@code name} is a display key only; two records may share a name.
 * Null fields are normalized to the empty string.
 *
 * @param name         speaker display name
 * @param title        job title
 * @param organization employer or affiliation
 * @param bio          free-text biography (untruncated)
 */
public record SpeakerRecord(
        String name,
        String title,
        String organization,
        String bio
) {

    public SpeakerRecord {
        name = name == null ? "" : name;
        title = title == null ? "" : title;
        organization = organization == null ? "" : organization;
        bio = bio == null ? "" : bio;
    }
}
