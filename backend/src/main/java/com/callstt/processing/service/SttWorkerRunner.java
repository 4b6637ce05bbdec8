package com.callstt.processing.service;

import com.callstt.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(value = "app.stt.worker.enabled", havingValue = "true", matchIfMissing = true)
public class SttWorkerRunner implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SttWorkerRunner.class);

    private final SttWorker worker;
    private final Duration fetchTimeout;
    private Thread thread;

    public SttWorkerRunner(SttWorker worker, AppProperties appProperties) {
        this.worker = worker;
        this.fetchTimeout = appProperties.stt().fetchTimeout() == null
                ? Duration.ofSeconds(5)
                : appProperties.stt().fetchTimeout();
    }

    @Override
    public synchronized void start() {
        if (thread != null) {
            return;
        }
        thread = new Thread(() -> worker.runForever(fetchTimeout), "stt-worker");
        thread.start();
    }

    @Override
    public synchronized void stop() {
        if (thread == null) {
            return;
        }
        worker.stop();
        thread.interrupt();
        try {
            thread.join(TimeUnit.SECONDS.toMillis(fetchTimeout.toSeconds() + 5));
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the STT worker to stop");
        }
        thread = null;
    }

    @Override
    public synchronized boolean isRunning() {
        return thread != null;
    }
}
