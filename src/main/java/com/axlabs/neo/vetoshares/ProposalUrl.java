package com.axlabs.neo.vetoshares;

import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * The link to the off-chain part of a proposal, e.g., the discussion of the full proposal document.
 * <p>
 * The URL is held as {@link #BLOCKS} blocks of {@link #BLOCK_SIZE} bytes each. Shorter URLs are right-padded with
 * zeros, which keeps the proposal hash input fixed in size.
 */
public final class ProposalUrl {

    public static final int BLOCKS = 4;
    public static final int BLOCK_SIZE = 32;
    public static final int LENGTH = BLOCKS * BLOCK_SIZE;

    private final byte[] value;

    public ProposalUrl(byte[] value) {
        if (value == null) {
            throw new NullPointerException("URL bytes must not be null");
        }
        if (value.length > LENGTH) {
            throw new IllegalArgumentException("URL must not be longer than " + LENGTH + " bytes but was "
                    + value.length + " bytes long");
        }
        this.value = Arrays.copyOf(value, LENGTH);
    }

    public static ProposalUrl fromString(String url) {
        return new ProposalUrl(url.getBytes(UTF_8));
    }

    /**
     * Gets one of the URL's blocks.
     *
     * @param index the block index, from 0 to {@link #BLOCKS} - 1.
     * @return a copy of the block.
     */
    public byte[] getBlock(int index) {
        if (index < 0 || index >= BLOCKS) {
            throw new IndexOutOfBoundsException("Block index " + index + " out of bounds");
        }
        return Arrays.copyOfRange(value, index * BLOCK_SIZE, (index + 1) * BLOCK_SIZE);
    }

    public byte[] toArray() {
        return value.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProposalUrl)) {
            return false;
        }
        return Arrays.equals(value, ((ProposalUrl) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        int end = LENGTH;
        while (end > 0 && value[end - 1] == 0) {
            end--;
        }
        return new String(value, 0, end, UTF_8);
    }
}
