package io.automock.core.model;

/** Discriminator of a {@link Body} variant, spelled as the target engine's {@code type} key. */
public enum BodyType {
    JSON,
    REGEX,
    STRING,
    PARAMETERS,
    BINARY
}
