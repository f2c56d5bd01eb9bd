package com.bitanalytics.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("TemporaryKeyCleanupJob")
class TemporaryKeyCleanupJobTest {

    @Test
    @DisplayName("delegates to the engine and survives store failures")
    void cleanup() {
        BitOperationEngine engine = mock(BitOperationEngine.class);
        when(engine.deleteTemporaryKeys())
                .thenReturn(4L)
                .thenThrow(new RedisConnectionFailureException("down"));
        TemporaryKeyCleanupJob job = new TemporaryKeyCleanupJob(engine);

        job.cleanup();
        assertThatCode(job::cleanup).doesNotThrowAnyException();

        verify(engine, times(2)).deleteTemporaryKeys();
    }
}
