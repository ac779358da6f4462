package hotreload.hook;

import java.lang.reflect.Method;

/**
 * Detours a loaded method to a replacement.
 *
 * <p>After a successful redirect every call of {@code original}, however it
 * was linked (direct call, virtual dispatch, reflection or a previously
 * obtained method handle), runs {@code replacement}. Redirecting the same
 * original again replaces the earlier redirection.
 *
 * @see InstrumentationRedirector
 */
public interface MethodRedirector {

    /**
     * Redirects {@code original} to {@code replacement}.
     *
     * @param original a loaded method with a body
     * @param replacement a static method taking the receiver of an instance
     *                    {@code original} as its first parameter, then the
     *                    parameters of {@code original}
     * @return the outcome; never null
     */
    RedirectResult redirect(Method original, Method replacement);

    /**
     * Publishes the redirections made since the last call to all threads.
     */
    default void commit() {
    }
}
