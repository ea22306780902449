package com.trialmatch.error;

/**
 * The reasoning backend replied, but no usable verdict could be recovered from the text.
 */
public class ParseFailureException extends TrialMatchException {
    private final String rawExcerpt;

    public ParseFailureException(String message, String raw) {
        super(message);
        this.rawExcerpt = excerpt(raw);
    }

    public ParseFailureException(String message, String raw, Throwable cause) {
        super(message, cause);
        this.rawExcerpt = excerpt(raw);
    }

    /**
     * First 500 characters of the offending reply.
     */
    public String rawExcerpt() {
        return rawExcerpt;
    }

    private static String excerpt(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.length() <= 500 ? raw : raw.substring(0, 500);
    }
}
