package com.umitunal.cronlite.serialization;

/**
 * Interface for encoding and decoding values stored by a job mirror.
 *
 * @param <T> the type of value
 */
public interface PayloadCodec<T> {

    /**
     * Encode a value to bytes.
     */
    byte[] encode(T value);

    /**
     * Decode bytes to a value.
     *
     * @throws IllegalArgumentException if the bytes are not a valid encoding
     */
    T decode(byte[] bytes);
}
