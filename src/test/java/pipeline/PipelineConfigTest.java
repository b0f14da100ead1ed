package pipeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(PipelineConfig.WORKERS);
        System.clearProperty(PipelineConfig.DOT_EXPORT);
    }

    @Test
    void readsValuesFromProperties() {
        // Arrange
        Properties properties = new Properties();
        properties.setProperty(PipelineConfig.WORKERS, "3");
        properties.setProperty(PipelineConfig.MODULE_GRAPH, "false");
        properties.setProperty(PipelineConfig.RESOLVE_CALLS, "true");
        properties.setProperty(PipelineConfig.DOT_EXPORT, "false");

        // Act
        PipelineConfig config = PipelineConfig.fromProperties(properties);

        // Assert
        assertEquals(3, config.getWorkers());
        assertFalse(config.isModuleGraph());
        assertTrue(config.isResolveCalls());
        assertFalse(config.isDotExport());
    }

    @Test
    void autoWorkersMeansOnePerProcessor() {
        Properties properties = new Properties();
        properties.setProperty(PipelineConfig.WORKERS, "auto");

        PipelineConfig config = PipelineConfig.fromProperties(properties);

        assertEquals(Runtime.getRuntime().availableProcessors(), config.getWorkers());
        assertTrue(config.isModuleGraph());
    }

    @Test
    void systemPropertiesWin() {
        // Arrange
        Properties properties = new Properties();
        properties.setProperty(PipelineConfig.WORKERS, "2");
        properties.setProperty(PipelineConfig.DOT_EXPORT, "true");
        System.setProperty(PipelineConfig.WORKERS, "5");
        System.setProperty(PipelineConfig.DOT_EXPORT, "false");

        // Act
        PipelineConfig config = PipelineConfig.fromProperties(properties);

        // Assert
        assertEquals(5, config.getWorkers());
        assertFalse(config.isDotExport());
    }

    @Test
    void loadsBundledDefaults() {
        PipelineConfig config = PipelineConfig.load();

        assertEquals(Runtime.getRuntime().availableProcessors(), config.getWorkers());
        assertTrue(config.isModuleGraph());
        assertTrue(config.isResolveCalls());
        assertTrue(config.isDotExport());
    }

    @Test
    void rejectsInvalidWorkerCounts() {
        Properties notANumber = new Properties();
        notANumber.setProperty(PipelineConfig.WORKERS, "many");

        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromProperties(notANumber));
        assertThrows(IllegalArgumentException.class, () -> new PipelineConfig(0, true, true, true));
        assertEquals(7, PipelineConfig.defaults().withWorkers(7).getWorkers());
    }
}
