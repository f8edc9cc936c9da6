package org.publicip.cache;

/**
 * Stores the cache document as plain JSON.
 */
public final class PlainCacheCodec implements CacheCodec {
    public static final PlainCacheCodec INSTANCE = new PlainCacheCodec();

    private PlainCacheCodec() {
    }

    @Override
    public byte[] encode(byte[] plain) {
        return plain;
    }

    @Override
    public byte[] decode(byte[] stored) {
        return stored;
    }
}
