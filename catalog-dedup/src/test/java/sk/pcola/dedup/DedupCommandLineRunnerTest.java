package sk.pcola.dedup;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sk.pcola.dedup.catalog.ProductRecordStore;
import sk.pcola.dedup.config.ExportConfig;
import sk.pcola.dedup.config.IngestConfig;
import sk.pcola.dedup.export.CatalogExporter;
import sk.pcola.dedup.ingest.IngestResult;
import sk.pcola.dedup.ingest.IngestionCoordinator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DedupCommandLineRunnerTest {

    private IngestionCoordinator coordinator;
    private CatalogExporter exporter;
    private ProductRecordStore store;
    private IngestConfig ingestConfig;
    private DedupCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        coordinator = mock(IngestionCoordinator.class);
        exporter = mock(CatalogExporter.class);
        store = mock(ProductRecordStore.class);
        ingestConfig = new IngestConfig();
        when(coordinator.ingest()).thenReturn(IngestResult.empty());
        runner = new DedupCommandLineRunner(coordinator, exporter, store, ingestConfig, new ExportConfig());
    }

    @Test
    void shouldRunFullPipelineWithoutArguments() {
        runner.run();

        verify(store).createSchemaIfAbsent();
        verify(store).truncate();
        verify(coordinator).ingest();
        verify(exporter).export();
    }

    @Test
    void shouldRunOnlyExport() {
        runner.run("--export");

        verify(coordinator, never()).ingest();
        verify(store, never()).truncate();
        verify(exporter).export();
    }

    @Test
    void shouldKeepTableWhenResetDisabled() {
        ingestConfig.setResetBeforeRun(false);

        runner.run("--ingest");

        verify(store, never()).truncate();
        verify(coordinator).ingest();
        verify(exporter, never()).export();
    }

    @Test
    void shouldPropagateSetupFailure() {
        when(coordinator.ingest()).thenThrow(new IllegalStateException("Price directory does not exist"));

        assertThrows(IllegalStateException.class, () -> runner.run());
        verify(exporter, never()).export();
    }

    @Test
    void shouldRunNothingOnUnknownOption() {
        runner.run("--exprot");

        verifyNoInteractions(coordinator, exporter, store);
    }

    @Test
    void shouldRunNothingOnStrayArgument() {
        runner.run("--ingest", "prices");

        verifyNoInteractions(coordinator, exporter, store);
    }

    @Test
    void shouldAcceptSpringPropertyArguments() {
        runner.run("--catalog.ingest.worker-threads=2", "--ingest");

        verify(store).truncate();
        verify(coordinator).ingest();
        verify(exporter, never()).export();
    }

    @Test
    void shouldOnlyPrintHelp() {
        runner.run("--help");

        verifyNoInteractions(coordinator, exporter, store);
    }
}
