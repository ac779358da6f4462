package hotreload.synth;

/**
 * A member (or new type) left out of a patch module.
 *
 * @param typeName internal name of the type
 * @param member method full name, or {@code null} when the whole type failed
 * @param reason why synthesis failed
 */
public record SynthesisFailure(String typeName, String member, String reason) {

    public String target() {
        return member != null ? member : typeName.replace('/', '.');
    }

    @Override
    public String toString() {
        return target() + ": " + reason;
    }
}
