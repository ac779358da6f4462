package hotreload.synth;

import hotreload.module.FieldKey;

/**
 * Literal initial value of an added field, harvested from the constructor,
 * the static initializer or a {@code ConstantValue} attribute.
 *
 * @param field the added field
 * @param value boxed value matching the field descriptor
 */
public record FieldInitializer(FieldKey field, Object value) {
}
