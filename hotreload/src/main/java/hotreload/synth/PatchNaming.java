package hotreload.synth;

import java.nio.file.Path;

/**
 * Names of the classes and the jar of one patch module.
 *
 * @param module module name
 * @param sequence strictly increasing per module
 * @param jarPath where the patch module is written
 */
public record PatchNaming(String module, long sequence, Path jarPath) {

    static final String PATCH_MARKER = "$$HotPatch$";

    /**
     * Name of the class holding the wrappers of {@code host}, in the host's package.
     */
    public String patchClassName(String host) {
        return host + PATCH_MARKER + sequence;
    }

    /** Name of the {@code index}-th compiler-generated class extracted under a patch class. */
    public String extractedName(String patchClass, int index) {
        return patchClass + "$" + index;
    }

    public static String jarFileName(String module, long sequence) {
        return module + "-patch-" + sequence + ".jar";
    }

    public static boolean isPatchClass(String internalName) {
        return internalName.contains(PATCH_MARKER);
    }
}
