package io.github.drompincen.labseed.runtime.link;

import io.github.drompincen.labseed.runtime.platform.PlatformClient;
import io.github.drompincen.labseed.runtime.platform.RemoteRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Links an issue to an iteration by appending an {@code /iteration} quick action to the
 * issue description, which GitLab's text-command processor applies on save.
 *
 * <p>This is a workaround: the REST issue API has no iteration field.
 */
@Component
public class QuickActionIterationLinker implements IterationLinker {

    private static final Logger log = LoggerFactory.getLogger(QuickActionIterationLinker.class);

    private final PlatformClient client;

    public QuickActionIterationLinker(PlatformClient client) {
        this.client = client;
    }

    static String directive(RemoteRef iteration) {
        return "/iteration *iteration:" + iteration.id();
    }

    @Override
    public RemoteRef link(RemoteRef issue, RemoteRef iteration) {
        String directive = directive(iteration);
        String description = issue.description() == null ? "" : issue.description();
        if (description.contains(directive)) {
            log.debug("Issue '{}' already carries {}", issue.name(), directive);
            return issue;
        }
        String updated = description.isBlank() ? directive : description.stripTrailing() + "\n\n" + directive;
        return client.update(issue, Map.of("description", updated));
    }
}
