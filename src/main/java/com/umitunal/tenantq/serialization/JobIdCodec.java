package com.umitunal.tenantq.serialization;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Codec for queue entries: a job id as UTF-8 bytes.
 */
public class JobIdCodec implements PayloadCodec<String> {

    @Override
    public byte[] encode(String jobId) {
        if (jobId == null || jobId.isEmpty()) {
            throw new IllegalArgumentException("job id must not be empty");
        }
        return jobId.getBytes(UTF_8);
    }

    @Override
    public String decode(byte[] bytes) {
        return new String(bytes, UTF_8);
    }
}
