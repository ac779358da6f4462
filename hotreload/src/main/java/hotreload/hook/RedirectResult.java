package hotreload.hook;

/**
 * Outcome of one {@link MethodRedirector#redirect} call.
 *
 * @param success whether calls now reach the replacement
 * @param reason why the redirect failed, or null
 */
public record RedirectResult(boolean success, String reason) {

    private static final RedirectResult OK = new RedirectResult(true, null);

    public static RedirectResult ok() {
        return OK;
    }

    public static RedirectResult failed(String reason) {
        return new RedirectResult(false, reason);
    }
}
