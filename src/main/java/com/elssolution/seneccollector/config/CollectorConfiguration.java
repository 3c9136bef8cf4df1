package com.elssolution.seneccollector.config;

import com.elssolution.seneccollector.alerts.AlertService;
import com.elssolution.seneccollector.alerts.GlobalUncaughtHandler;
import com.elssolution.seneccollector.collector.CollectorConfig;
import com.elssolution.seneccollector.collector.SenecDataCollector;
import com.elssolution.seneccollector.integration.senec.AsyncFetcherAdapter;
import com.elssolution.seneccollector.integration.senec.SenecClient;
import com.elssolution.seneccollector.integration.senec.StatusFetcher;
import com.elssolution.seneccollector.integration.senec.StatusSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class CollectorConfiguration {

    // pysenec's default read set: overall state + grid meter phases
    static final String DEFAULT_REQUEST =
            "{\"ENERGY\":{\"STAT_STATE\":\"\",\"GUI_BAT_DATA_POWER\":\"\",\"GUI_INVERTER_POWER\":\"\","
                    + "\"GUI_HOUSE_POW\":\"\",\"GUI_GRID_POW\":\"\",\"GUI_BAT_DATA_FUEL_CHARGE\":\"\"},"
                    + "\"PM1OBJ1\":{\"FREQ\":\"\",\"U_AC\":\"\",\"I_AC\":\"\",\"P_AC\":\"\",\"P_TOTAL\":\"\"}}";

    @Bean
    public HttpClient senecHttpClient(@Value("${senec.http.connect-timeout-ms:4000}") int connectTimeoutMs) {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                // best-effort; the per-request timeout in SenecClient is the real bound
                .connectTimeout(Duration.ofMillis(Math.max(500, connectTimeoutMs)))
                .build();
    }

    @Bean
    public StatusSource senecClient(HttpClient senecHttpClient,
                                    ObjectMapper objectMapper,
                                    @Value("${senec.http.scheme:http}") String scheme,
                                    @Value("${senec.http.path:/lala.cgi}") String path,
                                    @Value("${senec.http.request-timeout-ms:6000}") int requestTimeoutMs,
                                    @Value("${senec.request.body:}") String requestBody) {
        String body = (requestBody == null || requestBody.isBlank()) ? DEFAULT_REQUEST : requestBody;
        return new SenecClient(senecHttpClient, objectMapper, scheme, path,
                Duration.ofMillis(Math.max(1000, requestTimeoutMs)), body);
    }

    @Bean
    public StatusFetcher statusFetcher(StatusSource senecClient) {
        return new AsyncFetcherAdapter(senecClient);
    }

    @Bean
    public CollectorConfig collectorConfig(@Value("${senec.host}") String host,
                                           @Value("${senec.interval-seconds:60}") long intervalSeconds,
                                           @Value("${senec.collector.single-shot:false}") boolean singleShot) {
        CollectorConfig cfg = CollectorConfig.of(host, Duration.ofSeconds(intervalSeconds), singleShot);
        log.info("Collector config: host={} interval={}s singleShot={}", cfg.getHost(), intervalSeconds, singleShot);
        return cfg;
    }

    @Bean(destroyMethod = "shutdown") // stop + join the poll thread with the context
    public SenecDataCollector senecDataCollector(CollectorConfig collectorConfig,
                                                 StatusFetcher statusFetcher,
                                                 AlertService alertService,
                                                 GlobalUncaughtHandler handler) {
        return new SenecDataCollector(collectorConfig, statusFetcher, alertService, collectorThreads(handler));
    }

    private static ThreadFactory collectorThreads(GlobalUncaughtHandler handler) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(GlobalUncaughtHandler.COLLECTOR_THREAD_PREFIX + seq.incrementAndGet());
            t.setDaemon(true); // don't block JVM exit; the destroy hook joins it
            t.setUncaughtExceptionHandler(handler);
            return t;
        };
    }
}
