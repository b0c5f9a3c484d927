package io.github.drompincen.labseed.runtime.materialize;

import io.github.drompincen.labseed.runtime.context.SeedOptions;
import io.github.drompincen.labseed.runtime.error.SeedException;
import io.github.drompincen.labseed.runtime.platform.PlatformClient;
import io.github.drompincen.labseed.runtime.platform.RemoteRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Waits for a new project's asynchronous repository setup before anything is read from
 * or created in it. Polls readiness instead of sleeping a fixed time.
 */
@Component
public class ProjectSettler {

    private static final Logger log = LoggerFactory.getLogger(ProjectSettler.class);

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final PlatformClient client;
    private final Sleeper sleeper;

    @Autowired
    public ProjectSettler(PlatformClient client) {
        this(client, duration -> Thread.sleep(duration.toMillis()));
    }

    ProjectSettler(PlatformClient client, Sleeper sleeper) {
        this.client = client;
        this.sleeper = sleeper;
    }

    /**
     * Polls until the project reports ready or the timeout elapses, then re-fetches it.
     * A timeout is logged and the last fetched state is returned.
     */
    public RemoteRef awaitReady(RemoteRef project, SeedOptions options) {
        Duration interval = options.settlePollInterval();
        long maxPolls = Math.max(1, options.settleTimeout().toMillis() / Math.max(1, interval.toMillis()));
        for (long poll = 0; poll < maxPolls; poll++) {
            if (client.isReady(project)) {
                log.debug("Project '{}' ready after {} poll(s)", project.name(), poll + 1);
                return client.refresh(project);
            }
            try {
                sleeper.sleep(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SeedException("Interrupted while waiting for project '" + project.name() + "'", e);
            }
        }
        log.warn("Project '{}' not ready after {}, continuing", project.name(), options.settleTimeout());
        return client.refresh(project);
    }
}
