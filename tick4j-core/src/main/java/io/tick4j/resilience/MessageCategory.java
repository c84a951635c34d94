package io.tick4j.resilience;

/**
 * User-facing guidance key for a failure. The feature layer maps each category to its own text.
 */
public enum MessageCategory {
    TRY_AGAIN_LATER,
    TRY_AGAIN_SHORTLY,
    REAUTHORIZE,
    CHECK_CONNECTION,
    ITEM_GONE,
    SERVICE_ERROR,
    UNEXPECTED
}
