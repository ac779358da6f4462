package hotreload.synth;

import java.nio.file.Path;

/**
 * A static wrapper method in a patch class.
 *
 * @param owner internal name of the patch class
 * @param name wrapper method name
 * @param descriptor wrapper descriptor; instance methods gain the receiver as first parameter
 * @param sequence sequence number of the patch module that defines it
 * @param patchJar the patch module jar
 */
public record WrapperRef(String owner, String name, String descriptor, long sequence, Path patchJar) {

    public String fullName() {
        return owner.replace('/', '.') + "::" + name + descriptor;
    }

    @Override
    public String toString() {
        return fullName();
    }
}
