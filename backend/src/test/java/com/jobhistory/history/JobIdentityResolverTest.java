package com.jobhistory.history;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobIdentityResolverTest {

    private final JobIdentityResolver resolver = new JobIdentityResolver();

    @Test
    @DisplayName("same name always yields the same id")
    void deterministic() {
        assertThat(resolver.jobId("Weekly Patch Rollout")).isEqualTo(resolver.jobId("Weekly Patch Rollout"));
        assertThat(new JobIdentityResolver().jobId("nightly")).isEqualTo(resolver.jobId("nightly"));
    }

    @Test
    @DisplayName("different names yield different ids")
    void distinctNames() {
        assertThat(resolver.jobId("job-a")).isNotEqualTo(resolver.jobId("job-b"));
        assertThat(resolver.jobId("Job")).isNotEqualTo(resolver.jobId("job"));
    }

    @Test
    @DisplayName("id is 32 lowercase hex chars: h1 then h2 of MurmurHash3 x64 128, big-endian")
    void knownVectors() {
        assertThat(resolver.jobId("hello")).isEqualTo("cbd8a7b341bd9b025b1e906a48ae1d19");
        assertThat(resolver.jobId("Weekly Patch Rollout")).isEqualTo("06e2118f12e10769197d3f3948414950");
        assertThat(resolver.jobId("The quick brown fox jumps over the lazy dog"))
                .isEqualTo("e34bbc7bbc071b6c7a433ca9c49a9347")
                .matches("[0-9a-f]{32}");
    }

    @Test
    @DisplayName("empty name is rejected")
    void emptyName() {
        assertThatThrownBy(() -> resolver.jobId("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.jobId(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
