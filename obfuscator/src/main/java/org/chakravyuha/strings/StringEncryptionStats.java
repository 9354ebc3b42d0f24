package org.chakravyuha.strings;

/**
 * What one run of the {@link StringEncryptionPass} did.
 */
public final class StringEncryptionStats {

    public static final String METHOD = "XOR with dynamic per-run key";

    private final int count;
    private final long originalBytes;
    private final long encryptedBytes;
    private final int key;

    public StringEncryptionStats(int count, long originalBytes, long encryptedBytes, int key) {
        this.count = count;
        this.originalBytes = originalBytes;
        this.encryptedBytes = encryptedBytes;
        this.key = key;
    }

    public static StringEncryptionStats empty() {
        return new StringEncryptionStats(0, 0, 0, 0);
    }

    public int getCount() {
        return count;
    }

    /**
     * Text bytes of the encrypted strings, without their NUL terminators.
     */
    public long getOriginalBytes() {
        return originalBytes;
    }

    /**
     * Bytes of ciphertext emitted, terminators included.
     */
    public long getEncryptedBytes() {
        return encryptedBytes;
    }

    /**
     * @return the XOR key, or 0 if nothing was encrypted
     */
    public int getKey() {
        return key;
    }

    public String getMethod() {
        return METHOD;
    }

    public StringEncryptionStats plus(StringEncryptionStats other) {
        return new StringEncryptionStats(count + other.count, originalBytes + other.originalBytes,
                encryptedBytes + other.encryptedBytes, other.count > 0 ? other.key : key);
    }

    @Override
    public String toString() {
        return "StringEncryptionStats{count=" + count + ", originalBytes=" + originalBytes
                + ", encryptedBytes=" + encryptedBytes + '}';
    }
}
