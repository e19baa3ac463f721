package org.learningjava.facevec.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.learningjava.facevec.application.port.VectorStorePort;
import org.learningjava.facevec.application.usecase.EmbeddingDiagnostics;
import org.learningjava.facevec.domain.error.CollectionUnavailableException;
import org.learningjava.facevec.domain.model.MetricsSnapshot;
import org.learningjava.facevec.domain.model.ModelInfo;

import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.time.Instant;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(OutputCaptureExtension.class)
class StartupTasksTest {

    private VectorStorePort store;
    private VectorStoreProperties props;
    private EmbeddingDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        store = mock(VectorStorePort.class);
        props = new VectorStoreProperties();
        diagnostics = mock(EmbeddingDiagnostics.class);
        when(diagnostics.snapshot()).thenReturn(new EmbeddingDiagnostics.Snapshot(
                new ModelInfo("arcface", "1", "cpu", "n/a", Instant.EPOCH, 512, 112),
                57, 4, MetricsSnapshot.EMPTY, "arcface-sandbox", false));
    }

    @Test
    void checks_collection_when_enabled() {
        new StartupTasks(store, props, diagnostics).run(null);

        verify(store).ensureCollectionReady();
    }

    @Test
    void skips_check_when_disabled(CapturedOutput output) {
        props.setEnsureOnStartup(false);

        new StartupTasks(store, props, diagnostics).run(null);

        verify(store, never()).ensureCollectionReady();
        assertTrue(output.getOut().contains("=== StartupTasks END ==="));
    }

    @Test
    void cancelled_check_does_not_abort_startup(CapturedOutput output) {
        doThrow(new CancellationException("interrupted")).when(store).ensureCollectionReady();

        assertDoesNotThrow(() -> new StartupTasks(store, props, diagnostics).run(null));
        assertTrue(output.getOut().contains("=== StartupTasks END ==="));
    }

    @Test
    void unreachable_store_does_not_abort_startup() {
        doThrow(new CollectionUnavailableException("arcface-sandbox", new RuntimeException("refused")))
                .when(store).ensureCollectionReady();

        assertDoesNotThrow(() -> new StartupTasks(store, props, diagnostics).run(null));
    }

    @Test
    void properties_convert_to_validated_options() {
        props.setEndpoint("http://qdrant:6333");
        props.setTimeoutMs(1500);

        var options = props.toOptions();

        assertEquals("http://qdrant:6333", options.endpoint().toString());
        assertEquals(1500, options.timeout().toMillis());
        props.setVectorSize(256);
        assertThrows(IllegalArgumentException.class, props::toOptions);
    }
}
