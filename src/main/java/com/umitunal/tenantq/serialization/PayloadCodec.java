package com.umitunal.tenantq.serialization;

/**
 * Interface for encoding and decoding stored values.
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
     */
    T decode(byte[] bytes);
}
