package dk.eventchain.components.common;

/**
 * Argument assertion methods that fail fast with an {@link IllegalArgumentException}
 */
public final class FailFast {
    private FailFast() {
    }

    /**
     * Assert that the <code>objectThatMayNotBeNull</code> is not null
     *
     * @param objectThatMayNotBeNull the object to check
     * @param errorMessage           the message of the {@link IllegalArgumentException}
     * @param <T>                    the type of the object
     * @return the object (if not null)
     * @throws IllegalArgumentException if the object is null
     */
    public static <T> T requireNonNull(T objectThatMayNotBeNull, String errorMessage) {
        if (objectThatMayNotBeNull == null) {
            throw new IllegalArgumentException(errorMessage);
        }
        return objectThatMayNotBeNull;
    }

    /**
     * @throws IllegalArgumentException if <code>mustBeTrue</code> is false
     */
    public static void requireTrue(boolean mustBeTrue, String errorMessage) {
        if (!mustBeTrue) {
            throw new IllegalArgumentException(errorMessage);
        }
    }

    /**
     * @throws IllegalArgumentException if <code>mustBeFalse</code> is true
     */
    public static void requireFalse(boolean mustBeFalse, String errorMessage) {
        if (mustBeFalse) {
            throw new IllegalArgumentException(errorMessage);
        }
    }
}
