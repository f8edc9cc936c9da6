package org.publicip.cache;

import org.publicip.errors.CacheException;

/**
 * Transforms the serialized cache document on its way to and from the disk.
 */
public interface CacheCodec {
    /**
     * Wraps the serialized document before it is written.
     *
     * @param plain the UTF-8 JSON document
     * @return the bytes to write
     * @throws CacheException if the document cannot be wrapped
     */
    byte[] encode(byte[] plain) throws CacheException;

    /**
     * Reverses {@link #encode(byte[])} exactly.
     *
     * @param stored the bytes read from the disk
     * @return the UTF-8 JSON document
     * @throws CacheException if the bytes cannot be unwrapped
     */
    byte[] decode(byte[] stored) throws CacheException;
}
