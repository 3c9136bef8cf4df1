package com.elssolution.seneccollector.web;

import com.elssolution.seneccollector.collector.SenecDataCollector;
import com.elssolution.seneccollector.domain.RawStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/** Consumer side of the collector queue. Every read removes what it returns. */
@RestController
public class DataController {

    private final SenecDataCollector collector;

    public DataController(SenecDataCollector collector) {
        this.collector = collector;
    }

    @GetMapping("/data/available")
    public Map<String, Integer> available() {
        return Map.of("available", collector.availableData());
    }

    @GetMapping("/data/next")
    public ResponseEntity<RawStatus> next() {
        return collector.getData(false)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/data")
    public List<RawStatus> drain() {
        return collector.getAllData();
    }
}
