package utilities;

import it.unimi.dsi.fastutil.longs.LongIterator;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.MessageDigestAlgorithms;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Maps a key to one bit position per slice.
 *
 * Positions are little-endian unsigned chunks of {@code digest(salt_i || key)}, reduced modulo
 * {@code bitsPerSlice}. The chunk width (2, 4 or 8 bytes) is the smallest that covers
 * {@code bitsPerSlice}; the digest is the smallest of MD5, SHA-1, SHA-256, SHA-384, SHA-512
 * wide enough for {@code sliceCount} chunks. Salt {@code i} is {@code digest(le32(i))}, so two hashers
 * built with the same parameters produce the same positions on any machine.
 *
 * <p>Keys are hashed as UTF-8 text, except {@code byte[]} keys, which are hashed as their raw
 * bytes. The Python {@code pybloom} library hashes a bytes key through its string form, so filters
 * holding byte-array keys do not share positions with filters written by that library.
 *
 * Not thread safe: the digest instance is reused across calls.
 */
public final class SliceHasher {

    private final int sliceCount;
    private final long bitsPerSlice;
    private final int chunkSize;
    private final String algorithm;
    private final int valuesPerDigest;
    private final byte[][] salts;
    private final MessageDigest digest;

    public SliceHasher(int sliceCount, long bitsPerSlice) {
        if (sliceCount <= 0)   throw new IllegalArgumentException("sliceCount must be > 0");
        if (bitsPerSlice <= 0) throw new IllegalArgumentException("bitsPerSlice must be > 0");
        this.sliceCount = sliceCount;
        this.bitsPerSlice = bitsPerSlice;
        this.chunkSize = chunkSize(bitsPerSlice);
        this.algorithm = algorithm((long) sliceCount * chunkSize * Byte.SIZE);
        this.digest = DigestUtils.getDigest(algorithm);
        this.valuesPerDigest = digest.getDigestLength() / chunkSize;

        int numSalts = (sliceCount + valuesPerDigest - 1) / valuesPerDigest;
        this.salts = new byte[numSalts][];
        byte[] index = new byte[Integer.BYTES];
        for (int i = 0; i < numSalts; i++) {
            ByteBuffer.wrap(index).order(ByteOrder.LITTLE_ENDIAN).putInt(0, i);
            salts[i] = digest.digest(index);
        }
    }

    static int chunkSize(long bitsPerSlice) {
        if (bitsPerSlice >= (1L << 31)) return 8;
        if (bitsPerSlice >= (1L << 15)) return 4;
        return 2;
    }

    static String algorithm(long totalHashBits) {
        if (totalHashBits > 384) return MessageDigestAlgorithms.SHA_512;
        if (totalHashBits > 256) return MessageDigestAlgorithms.SHA_384;
        if (totalHashBits > 160) return MessageDigestAlgorithms.SHA_256;
        if (totalHashBits > 128) return MessageDigestAlgorithms.SHA_1;
        return MessageDigestAlgorithms.MD5;
    }

    public int sliceCount() { return sliceCount; }
    public long bitsPerSlice() { return bitsPerSlice; }
    public int chunkSize() { return chunkSize; }
    public String algorithm() { return algorithm; }
    public int saltCount() { return salts.length; }

    // Text is hashed as UTF-8, byte arrays as is, anything else through String.valueOf.
    public static byte[] keyBytes(Object key) {
        Objects.requireNonNull(key, "key");
        if (key instanceof byte[]) return (byte[]) key;
        if (key instanceof CharSequence) return key.toString().getBytes(StandardCharsets.UTF_8);
        return String.valueOf(key).getBytes(StandardCharsets.UTF_8);
    }

    // Fresh iterator for every call; yields exactly sliceCount positions in [0, bitsPerSlice).
    public Positions positions(Object key) {
        return new Positions(keyBytes(key));
    }

    public long[] positionArray(Object key) {
        long[] out = new long[sliceCount];
        Positions it = positions(key);
        for (int i = 0; i < sliceCount; i++) out[i] = it.nextLong();
        return out;
    }

    public final class Positions implements LongIterator {
        private final byte[] key;
        private ByteBuffer block;
        private int salt;
        private int emitted;
        private int inBlock;

        private Positions(byte[] key) {
            this.key = key;
        }

        @Override
        public boolean hasNext() {
            return emitted < sliceCount;
        }

        @Override
        public long nextLong() {
            if (!hasNext()) throw new NoSuchElementException();
            if (block == null || inBlock == valuesPerDigest) {
                digest.update(salts[salt++]);
                block = ByteBuffer.wrap(digest.digest(key)).order(ByteOrder.LITTLE_ENDIAN);
                inBlock = 0;
            }
            long value;
            switch (chunkSize) {
                case 2 -> value = block.getShort(inBlock * 2) & 0xFFFFL;
                case 4 -> value = block.getInt(inBlock * 4) & 0xFFFF_FFFFL;
                default -> value = Long.remainderUnsigned(block.getLong(inBlock * 8), bitsPerSlice);
            }
            inBlock++;
            emitted++;
            return chunkSize == 8 ? value : value % bitsPerSlice;
        }
    }
}
