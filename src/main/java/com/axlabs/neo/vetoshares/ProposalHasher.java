package com.axlabs.neo.vetoshares;

import io.neow3j.crypto.Hash;
import io.neow3j.types.Hash160;
import io.neow3j.types.Hash256;

import java.math.BigInteger;
import java.nio.ByteBuffer;

/**
 * Derives proposal IDs.
 * <p>
 * The ID is the SHA-256 hash over the concatenation of the fixed-size proposal fields:
 * <pre>
 *  sponsor         20 bytes, little-endian script hash
 *  url            128 bytes, zero-padded
 *  digest          32 bytes
 *  wallet          20 bytes, little-endian script hash
 *  value           32 bytes, big-endian unsigned integer
 *  timeSubmitted   32 bytes, big-endian unsigned integer
 * </pre>
 * The submission time is part of the hashed data. Thus, the same proposal can be submitted again in a later second
 * and gets a new ID.
 */
public final class ProposalHasher {

    static final int SCRIPT_HASH_LENGTH = 20;
    static final int DIGEST_LENGTH = 32;
    static final int UINT256_LENGTH = 32;

    static final int INPUT_LENGTH = SCRIPT_HASH_LENGTH // sponsor
            + ProposalUrl.LENGTH
            + DIGEST_LENGTH
            + SCRIPT_HASH_LENGTH // wallet
            + UINT256_LENGTH // value
            + UINT256_LENGTH; // time

    private ProposalHasher() {
    }

    public static Hash256 hashProposal(Hash160 sponsor, ProposalUrl url, Hash256 digest, Hash160 wallet,
            BigInteger value, long timeSubmitted) {

        if (timeSubmitted < 0) {
            throw new IllegalArgumentException("Submission time must not be negative");
        }
        byte[] input = ByteBuffer.allocate(INPUT_LENGTH)
                .put(sponsor.toLittleEndianArray())
                .put(url.toArray())
                .put(digest.toArray())
                .put(wallet.toLittleEndianArray())
                .put(toUint256(value))
                .put(toUint256(BigInteger.valueOf(timeSubmitted)))
                .array();
        return new Hash256(Hash.sha256(input));
    }

    static byte[] toUint256(BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Value must not be negative");
        }
        if (value.bitLength() > UINT256_LENGTH * 8) {
            throw new IllegalArgumentException("Value does not fit into " + UINT256_LENGTH + " bytes");
        }
        byte[] bytes = value.toByteArray();
        // toByteArray() adds a leading zero byte if the highest bit is set.
        int offset = bytes.length > UINT256_LENGTH ? 1 : 0;
        int length = bytes.length - offset;
        byte[] padded = new byte[UINT256_LENGTH];
        System.arraycopy(bytes, offset, padded, UINT256_LENGTH - length, length);
        return padded;
    }
}
