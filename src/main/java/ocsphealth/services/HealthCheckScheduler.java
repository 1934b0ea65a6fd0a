package ocsphealth.services;

import java.io.Closeable;
import java.time.Clock;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.config.AppProperties;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Triggers health check cycles periodically once the application is ready.
 */
@Service
@Slf4j
public class HealthCheckScheduler implements Closeable {

    private final TaskScheduler taskScheduler;
    private final HealthCheckService healthCheckService;
    private final AppProperties.Dispatch dispatchProperties;
    private final Clock clock;
    private ScheduledFuture<?> scheduledCycles;

    public HealthCheckScheduler(TaskScheduler taskScheduler,
        HealthCheckService healthCheckService,
        AppProperties appProperties,
        Clock clock
    ) {
        this.taskScheduler = taskScheduler;
        this.healthCheckService = healthCheckService;
        this.dispatchProperties = appProperties.dispatch();
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (!dispatchProperties.schedulingEnabled()) {
            log.info("Periodic health checks are disabled");
            return;
        }
        if (scheduledCycles != null) {
            return;
        }
        log.info("Scheduling health check cycles every {} starting in {}", dispatchProperties.cycleInterval(),
            dispatchProperties.initialDelay());
        scheduledCycles = taskScheduler.scheduleWithFixedDelay(this::trigger,
            clock.instant().plus(dispatchProperties.initialDelay()),
            dispatchProperties.cycleInterval()
        );
    }

    void trigger() {
        healthCheckService.runCycle()
            .subscribe(report -> {
                }, throwable ->
                    log.error("Health check cycle failed", throwable)
            );
    }

    @Override
    public synchronized void close() {
        if (scheduledCycles != null) {
            scheduledCycles.cancel(false);
            scheduledCycles = null;
        }
        healthCheckService.close();
    }
}
