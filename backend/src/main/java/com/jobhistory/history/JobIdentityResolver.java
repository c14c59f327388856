package com.jobhistory.history;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Derives the stable job id from a job name: 128-bit MurmurHash3 (x64, seed 0) as lowercase hex.
 * Hex is h1 then h2, each big-endian, which matches ids issued by the job definition side.
 */
@Component
public class JobIdentityResolver {

    private static final HashFunction MURMUR3_128 = Hashing.murmur3_128();

    public String jobId(String jobName) {
        if (jobName == null || jobName.isEmpty()) {
            throw new IllegalArgumentException("job name is required");
        }
        HashCode hash = MURMUR3_128.hashString(jobName, StandardCharsets.UTF_8);
        return BaseEncoding.base16().lowerCase().encode(toBigEndianHalves(hash.asBytes()));
    }

    // Guava emits h1 and h2 little-endian.
    private static byte[] toBigEndianHalves(byte[] le) {
        byte[] be = new byte[le.length];
        for (int half = 0; half < le.length; half += 8) {
            for (int i = 0; i < 8; i++) {
                be[half + i] = le[half + 7 - i];
            }
        }
        return be;
    }
}
