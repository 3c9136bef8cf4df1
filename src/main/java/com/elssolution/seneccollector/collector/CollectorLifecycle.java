package com.elssolution.seneccollector.collector;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Starts polling once the application is ready. Stopping is the collector bean's destroy hook. */
@Slf4j
@Component
public class CollectorLifecycle {
    private final SenecDataCollector collector;

    @Value("${senec.collector.auto-start:true}") boolean autoStart;

    public CollectorLifecycle(SenecDataCollector collector) { this.collector = collector; }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!autoStart) {
            log.info("Collector auto-start disabled, host={}", collector.getConfig().getHost());
            return;
        }
        if (collector.getState() == SenecDataCollector.State.IDLE) collector.start();
    }
}
