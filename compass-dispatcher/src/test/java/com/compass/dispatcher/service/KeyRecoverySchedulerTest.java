package com.compass.dispatcher.service;

import com.compass.dispatcher.pool.ApiKeyPool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KeyRecoverySchedulerTest {

    @Mock
    private ApiKeyPool keyPool;

    @InjectMocks
    private KeyRecoveryScheduler scheduler;

    @Test
    void nothingCoolingDownSkipsRecovery() {
        when(keyPool.failedCount()).thenReturn(0L);

        scheduler.recoverCooledDownKeys();

        verify(keyPool, never()).recoverFailedKeys();
    }

    @Test
    void coolingKeysAreOfferedForRecovery() {
        when(keyPool.failedCount()).thenReturn(2L);
        when(keyPool.recoverFailedKeys()).thenReturn(1);
        when(keyPool.availableCount()).thenReturn(3L);

        scheduler.recoverCooledDownKeys();

        verify(keyPool).recoverFailedKeys();
    }

    @Test
    void emptyPoolWithKeysStillCoolingIsChecked() {
        when(keyPool.failedCount()).thenReturn(2L);
        when(keyPool.recoverFailedKeys()).thenReturn(0);
        when(keyPool.availableCount()).thenReturn(0L);

        scheduler.recoverCooledDownKeys();

        verify(keyPool).recoverFailedKeys();
        verify(keyPool).availableCount();
    }
}
