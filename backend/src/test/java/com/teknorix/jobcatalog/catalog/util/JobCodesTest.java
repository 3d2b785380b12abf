package com.teknorix.jobcatalog.catalog.util;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JobCodesTest {

    @Test
    void derivesCodeFromLeadingUuidDigits() {
        UUID uuid = UUID.fromString("3fa85f64-5717-4562-b3fc-2c963f66afa6");
        assertThat(JobCodes.fromUuid(uuid)).isEqualTo("JOB-3FA85F64");
    }

    @Test
    void generatedCodesMatchPatternAndDoNotRepeat() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            String code = JobCodes.newCode();
            assertThat(code).matches("JOB-[0-9A-F]{8}");
            assertThat(seen.add(code)).isTrue();
        }
    }

    @Test
    void rejectsMalformedCodes() {
        assertThat(JobCodes.isValid("JOB-ABCDEF12")).isTrue();
        assertThat(JobCodes.isValid("JOB-abcdef12")).isFalse();
        assertThat(JobCodes.isValid("JOB-ABCDEF1")).isFalse();
        assertThat(JobCodes.isValid("JOB-ABCDEFG2")).isFalse();
        assertThat(JobCodes.isValid(null)).isFalse();
    }
}
