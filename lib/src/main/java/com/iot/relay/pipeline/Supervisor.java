package com.iot.relay.pipeline;

import com.iot.relay.model.RelayEvent;
import com.iot.relay.model.RelayEventListener;
import com.iot.relay.model.RelayEventType;
import com.iot.relay.observability.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Replaces unhealthy pipeline stages through their {@link PipelineStage#restart()} contract.
 * Holds no per-stage state.
 */
public class Supervisor {
    
    private static final Logger logger = LoggerFactory.getLogger(Supervisor.class);
    
    private final String nodeId;
    private final RelayMetrics metrics;
    private final RelayEventListener eventListener;
    private final Clock clock;
    
    public Supervisor(String nodeId, RelayMetrics metrics, RelayEventListener eventListener, Clock clock) {
        this.nodeId = nodeId;
        this.metrics = metrics;
        this.eventListener = eventListener;
        this.clock = clock;
    }
    
    /**
     * @param stage the unhealthy stage
     * @return a fresh replacement for the stage
     */
    public PipelineStage restartStage(PipelineStage stage) {
        logger.warn("Stage {} reported unhealthy, restarting", stage.name());
        PipelineStage replacement = stage.restart();
        if (replacement == null || replacement == stage) {
            throw new IllegalStateException("Stage " + stage.name() + " did not return a fresh instance on restart");
        }
        metrics.recordStageRestart(stage.name());
        eventListener.onEvent(new RelayEvent(RelayEventType.STAGE_RESTARTED, nodeId, stage.name(), clock.instant()));
        logger.info("Stage {} restarted", stage.name());
        return replacement;
    }
}
