package me.golemcore.scheduler.tasks;

import me.golemcore.scheduler.domain.model.TaskDefinition;
import me.golemcore.scheduler.domain.model.TaskParameter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessDataTaskTest {

    private final ProcessDataTask task = new ProcessDataTask(Duration.ZERO);

    @Test
    void shouldDeclareInputPathAsRequiredAndBatchSizeAsOptional() {
        TaskDefinition definition = task.getDefinition();

        assertEquals("process_data", definition.getName());
        assertEquals("Data Processing", definition.getTitle());
        TaskParameter inputPath = definition.getParameters().get(0);
        TaskParameter batchSize = definition.getParameters().get(1);
        assertTrue(inputPath.isRequired());
        assertFalse(batchSize.isRequired());
        assertEquals(TaskParameter.ParameterType.INTEGER, batchSize.getType());
    }

    @Test
    void shouldReportProcessedRecordsOfBatch() throws InterruptedException {
        Object result = task.execute(Map.of("input_path", "/data/daily_import", "batch_size", 1000L));

        assertEquals(Map.of("processed_records", 1000, "input_path", "/data/daily_import"), result);
    }

    @Test
    void shouldUseDefaultBatchSize() throws InterruptedException {
        Object result = task.execute(Map.of("input_path", "/data/in"));

        assertEquals(Map.of("processed_records", 100, "input_path", "/data/in"), result);
    }
}
