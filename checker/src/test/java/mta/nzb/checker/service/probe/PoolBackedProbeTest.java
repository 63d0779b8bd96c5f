package mta.nzb.checker.service.probe;

import mta.nzb.checker.exception.ArticleAbsentException;
import mta.nzb.checker.exception.ProbeException;
import mta.nzb.checker.pool.ArticleNotFoundInProvidersException;
import mta.nzb.checker.pool.UsenetConnectionPool;
import mta.nzb.checker.pool.UsenetPoolManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PoolBackedProbeTest {

    private static final String ID = "<seg0@test>";
    private static final List<String> GROUPS = List.of("alt.binaries.test");

    @Mock
    private UsenetPoolManager poolManager;

    @Mock
    private UsenetConnectionPool pool;

    private PoolBackedProbe probe;

    @BeforeEach
    void setUp() {
        probe = new PoolBackedProbe(poolManager);
    }

    @Test
    void isAvailable_Status223_ShouldBePresent() throws Exception {
        when(poolManager.getPool()).thenReturn(pool);
        when(pool.stat(ID, GROUPS)).thenReturn(223);

        assertTrue(probe.isAvailable(ID, GROUPS));
    }

    @Test
    void isAvailable_NotFoundInProviders_ShouldBeDefinitive() throws Exception {
        when(poolManager.getPool()).thenReturn(pool);
        when(pool.stat(ID, GROUPS)).thenThrow(new ArticleNotFoundInProvidersException(ID));

        ArticleAbsentException ex = assertThrows(ArticleAbsentException.class, () -> probe.isAvailable(ID, GROUPS));

        assertEquals(ID, ex.getMessageId());
    }

    @Test
    void isAvailable_Timeout_ShouldBeInconclusive() throws Exception {
        when(poolManager.getPool()).thenReturn(pool);
        when(pool.stat(ID, GROUPS)).thenThrow(new SocketTimeoutException("read timed out"));

        ProbeException ex = assertThrows(ProbeException.class, () -> probe.isAvailable(ID, GROUPS));

        assertFalse(ex instanceof ArticleAbsentException);
    }

    @Test
    void isAvailable_UnexpectedStatus_ShouldBeInconclusive() throws Exception {
        when(poolManager.getPool()).thenReturn(pool);
        when(pool.stat(ID, GROUPS)).thenReturn(430);

        ProbeException ex = assertThrows(ProbeException.class, () -> probe.isAvailable(ID, GROUPS));

        assertFalse(ex instanceof ArticleAbsentException);
        assertTrue(ex.getMessage().contains("430"));
    }

    @Test
    void isAvailable_PoolUnavailable_ShouldBeInconclusive() throws Exception {
        when(poolManager.getPool()).thenThrow(new IOException("no pool configured"));

        ProbeException ex = assertThrows(ProbeException.class, () -> probe.isAvailable(ID, GROUPS));

        assertFalse(ex instanceof ArticleAbsentException);
        verifyNoInteractions(pool);
    }

    @Test
    void isAvailable_NullGroups_ShouldPassEmptyList() throws Exception {
        when(poolManager.getPool()).thenReturn(pool);
        when(pool.stat(ID, List.of())).thenReturn(223);

        assertTrue(probe.isAvailable(ID, null));
    }
}
