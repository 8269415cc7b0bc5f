package com.iot.relay.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iot.relay.MutableClock;
import com.iot.relay.config.PipelineConfig;
import com.iot.relay.observability.RelayMetrics;
import com.iot.relay.util.Jsons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingPipelineTest {

    private final ObjectMapper mapper = Jsons.mapper();
    private MutableClock clock;
    private FaultInjector.Toggle transformationFault;
    private ProcessingPipeline pipeline;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        transformationFault = FaultInjector.toggle();
        pipeline = ProcessingPipeline.standard(PipelineConfig.defaultConfig(), mapper, clock, transformationFault);
    }

    @Test
    void testValidPayloadIsEnriched() throws Exception {
        String output = pipeline.runPipeline("{\"device_id\":\"device_7\",\"temperature\":22.5,\"humidity\":51.0}");

        JsonNode node = mapper.readTree(output);
        assertEquals("device_7", node.get("device_id").asText());
        assertEquals(22.5, node.get("temperature").asDouble());
        assertTrue(node.get(TransformationStage.PROCESSED_FIELD).asBoolean());
        assertTrue(node.get(TransformationStage.SERVER_TIMESTAMP_FIELD).isNumber());
        assertEquals(clock.instant().getEpochSecond(), node.get(TransformationStage.SERVER_TIMESTAMP_FIELD).asLong());
    }

    @Test
    void testMissingDeviceIdRejectedByValidation() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> pipeline.runPipeline("{\"temperature\":22.5}"));

        assertEquals(ValidationStage.NAME, e.getStageName());
        assertTrue(e.getMessage().contains("device_id"));
    }

    @Test
    void testMissingTemperatureRejectedByValidation() {
        assertThrows(ValidationException.class, () -> pipeline.runPipeline("{\"device_id\":\"d1\"}"));
    }

    @Test
    void testMalformedJsonRejectedByValidation() {
        assertThrows(ValidationException.class, () -> pipeline.runPipeline("not json"));
        assertThrows(ValidationException.class, () -> pipeline.runPipeline("[1,2,3]"));
    }

    @Test
    void testValidationFailureSkipsLaterStages() {
        transformationFault.engage();

        assertThrows(ValidationException.class, () -> pipeline.runPipeline("{}"));
        TransformationStage transformation = (TransformationStage) pipeline.getStages().get(1);
        assertEquals(0, transformation.getConsecutiveFailures());
    }

    @Test
    void testTransformationFaultAbortsMessage() {
        transformationFault.engage();

        ProcessingException e = assertThrows(ProcessingException.class,
            () -> pipeline.runPipeline("{\"device_id\":\"d1\",\"temperature\":20}"));
        assertFalse(e instanceof ValidationException);
        assertEquals(TransformationStage.NAME, e.getStageName());
    }

    @Test
    void testStageOrderIsFixed() {
        List<PipelineStage> stages = pipeline.getStages();

        assertEquals(2, stages.size());
        assertEquals(ValidationStage.NAME, stages.get(0).name());
        assertEquals(TransformationStage.NAME, stages.get(1).name());
    }

    @Test
    void testHealthSweepReplacesUnhealthyStageInPlace() {
        transformationFault.engage();
        for (int i = 0; i < 3; i++) {
            assertThrows(ProcessingException.class,
                () -> pipeline.runPipeline("{\"device_id\":\"d1\",\"temperature\":20}"));
        }
        PipelineStage before = pipeline.getStages().get(1);
        assertFalse(before.isHealthy());

        RelayMetrics metrics = new RelayMetrics("node1");
        Supervisor supervisor = new Supervisor("node1", metrics, event -> { }, clock);
        int replaced = pipeline.healthSweep(supervisor);

        assertEquals(1, replaced);
        PipelineStage after = pipeline.getStages().get(1);
        assertNotSame(before, after);
        assertEquals(TransformationStage.NAME, after.name());
        assertTrue(after.isHealthy());
        assertEquals(1.0, metrics.getMeterRegistry().counter("relay.pipeline.stage.restarts", "node", "node1").count());
    }

    @Test
    void testHealthyPipelineUntouchedBySweep() {
        Supervisor supervisor = new Supervisor("node1", new RelayMetrics("node1"), event -> { }, clock);
        List<PipelineStage> before = pipeline.getStages();

        assertEquals(0, pipeline.healthSweep(supervisor));
        assertSame(before.get(0), pipeline.getStages().get(0));
        assertSame(before.get(1), pipeline.getStages().get(1));
    }

    @Test
    void testHealthFaultCadence() {
        PipelineConfig config = PipelineConfig.builder().healthFaultCadence(5).build();
        ProcessingPipeline cadenced = ProcessingPipeline.standard(config, mapper, clock);
        PipelineStage transformation = cadenced.getStages().get(1);

        for (int i = 1; i <= 4; i++) {
            assertTrue(transformation.isHealthy(), "probe " + i);
        }
        assertFalse(transformation.isHealthy());
    }

    @Test
    void testSuccessResetsConsecutiveFailures() {
        transformationFault.engage();
        assertThrows(ProcessingException.class,
            () -> pipeline.runPipeline("{\"device_id\":\"d1\",\"temperature\":20}"));
        transformationFault.clear();
        pipeline.runPipeline("{\"device_id\":\"d1\",\"temperature\":20}");

        TransformationStage transformation = (TransformationStage) pipeline.getStages().get(1);
        assertEquals(0, transformation.getConsecutiveFailures());
    }

    @Test
    void testEmptyPipelineRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ProcessingPipeline(List.of()));
    }
}
