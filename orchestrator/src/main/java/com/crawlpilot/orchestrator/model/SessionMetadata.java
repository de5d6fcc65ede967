package com.crawlpilot.orchestrator.model;

/**
 * Facts derived while a session runs. Every field is nullable: a null field
 * in a partial update means "leave as is".
 */
public record SessionMetadata(
        String  title,
        String  author,
        String  publishTime,
        String  accountName,
        Integer wordCount,
        Integer imageCount,
        Boolean hasExpandButton
) {
    public static SessionMetadata initial() {
        return new SessionMetadata(null, null, null, null, 0, 0, false);
    }

    public static SessionMetadata expandFlag(boolean hasExpandButton) {
        return new SessionMetadata(null, null, null, null, null, null, hasExpandButton);
    }

    public static SessionMetadata counts(int wordCount, int imageCount) {
        return new SessionMetadata(null, null, null, null, wordCount, imageCount, null);
    }

    public static SessionMetadata article(String title, String author, String publishTime) {
        return new SessionMetadata(title, author, publishTime, null, null, null, null);
    }

    /** Copy of this record with every non-null field of {@code partial} applied. */
    public SessionMetadata merge(SessionMetadata partial) {
        if (partial == null) return this;
        return new SessionMetadata(
                partial.title()           != null ? partial.title()           : title,
                partial.author()          != null ? partial.author()          : author,
                partial.publishTime()     != null ? partial.publishTime()     : publishTime,
                partial.accountName()     != null ? partial.accountName()     : accountName,
                partial.wordCount()       != null ? partial.wordCount()       : wordCount,
                partial.imageCount()      != null ? partial.imageCount()      : imageCount,
                partial.hasExpandButton() != null ? partial.hasExpandButton() : hasExpandButton);
    }
}
