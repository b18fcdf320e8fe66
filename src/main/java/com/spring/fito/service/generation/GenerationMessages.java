package com.spring.fito.service.generation;

import com.spring.fito.exception.ErrorCode;

/**
 * 사용자 노출 문구
 */
public final class GenerationMessages {

    public static final String EMPTY_PROMPT = "Please enter what you're doing today!";
    public static final String EMPTY_WARDROBE = "Your closet is empty! Add some clothes first.";
    public static final String QUOTA_EXCEEDED = "You've used all your free generations this month";
    public static final String MONTHLY_LIMIT_REACHED = "You've reached your monthly limit";
    public static final String NOT_AUTHENTICATED = "Please sign in to use AI styling";
    public static final String NOTHING_SUITABLE = "Nothing suitable for this occasion! Try adding more clothes to your closet 👗👔";

    private GenerationMessages() {
    }

    public static String forError(ErrorCode code) {
        if (code == null) return null;
        return switch (code) {
            case EMPTY_PROMPT -> EMPTY_PROMPT;
            case EMPTY_WARDROBE -> EMPTY_WARDROBE;
            case QUOTA_EXCEEDED -> QUOTA_EXCEEDED;
            case NOT_AUTHENTICATED -> NOT_AUTHENTICATED;
            default -> "Something went wrong. Please try again.";
        };
    }
}
