package hotreload.config;

/**
 * Exception thrown when reload configuration cannot be loaded or is invalid.
 *
 * <p>Unchecked so configuration loading can sit in initialization code
 * without forced exception handling.
 *
 * @see HotReloadConfigLoader
 */
public class HotReloadConfigException extends RuntimeException {

    public HotReloadConfigException(String message) {
        super(message);
    }

    public HotReloadConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
