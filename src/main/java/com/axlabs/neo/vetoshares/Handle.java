package com.axlabs.neo.vetoshares;

import io.neow3j.utils.Numeric;

import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * The public name of a member. A handle is an opaque, fixed-size byte string of {@link #LENGTH} bytes. Shorter
 * inputs are right-padded with zeros.
 */
public final class Handle {

    public static final int LENGTH = 32;

    private final byte[] value;

    public Handle(byte[] value) {
        if (value == null) {
            throw new NullPointerException("Handle bytes must not be null");
        }
        if (value.length > LENGTH) {
            throw new IllegalArgumentException("Handle must not be longer than " + LENGTH + " bytes but was "
                    + value.length + " bytes long");
        }
        this.value = Arrays.copyOf(value, LENGTH);
    }

    /**
     * Creates a handle from the UTF-8 bytes of the given name.
     *
     * @param name the name.
     * @return the handle.
     */
    public static Handle fromString(String name) {
        return new Handle(name.getBytes(UTF_8));
    }

    public byte[] toArray() {
        return value.clone();
    }

    /**
     * @return the handle's bytes without the zero padding, decoded as UTF-8.
     */
    public String getName() {
        int end = LENGTH;
        while (end > 0 && value[end - 1] == 0) {
            end--;
        }
        return new String(value, 0, end, UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Handle)) {
            return false;
        }
        return Arrays.equals(value, ((Handle) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return Numeric.toHexStringNoPrefix(value);
    }
}
