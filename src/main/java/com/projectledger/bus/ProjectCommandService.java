package com.projectledger.bus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectledger.ProjectLedgerProperties;
import com.projectledger.contract.EventStatus;
import com.projectledger.contract.EventType;
import com.projectledger.contract.EventTypeRegistry;
import com.projectledger.contract.ProjectEvent;
import com.projectledger.contract.ValidationException;
import com.projectledger.notification.EventHandlerChain;
import com.projectledger.policy.PolicyEvaluator;
import com.projectledger.projection.Project;
import com.projectledger.projection.ProjectProjection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Runs commands: load, reduce, decide, append, apply, then the post-append
 * handler chain. A lost append race reloads and re-decides, up to the
 * configured number of attempts.
 */
@Service
public class ProjectCommandService {

    private static final Logger log = LoggerFactory.getLogger(ProjectCommandService.class);

    private final EventTypeRegistry registry;
    private final EventStore eventStore;
    private final ProjectProjection projection;
    private final PolicyEvaluator policyEvaluator;
    private final EventHandlerChain handlerChain;
    private final ObjectMapper objectMapper;
    private final int maxAttempts;

    public ProjectCommandService(EventTypeRegistry registry,
                                 EventStore eventStore,
                                 ProjectProjection projection,
                                 PolicyEvaluator policyEvaluator,
                                 EventHandlerChain handlerChain,
                                 ObjectMapper objectMapper,
                                 ProjectLedgerProperties properties) {
        this.registry = registry;
        this.eventStore = eventStore;
        this.projection = projection;
        this.policyEvaluator = policyEvaluator;
        this.handlerChain = handlerChain;
        this.objectMapper = objectMapper;
        this.maxAttempts = Math.max(1, properties.getCommands().getMaxAttempts());
    }

    public CommandResult execute(ProjectCommand command) {
        EventType<?, ?> eventType = registry.require(command.type());
        Object input = bindInput(eventType, command.input());

        for (int attempt = 1; ; attempt++) {
            try {
                return attempt(command, input);
            } catch (ConcurrencyException e) {
                if (attempt >= maxAttempts) {
                    log.warn("Giving up on {} for project={} after {} attempt(s)",
                        command.type(), command.projectId(), attempt);
                    throw e;
                }
                log.info("Version conflict on project={} ({}), retrying {}/{}",
                    command.projectId(), command.type(), attempt + 1, maxAttempts);
            }
        }
    }

    private CommandResult attempt(ProjectCommand command, Object input) {
        EventStream stream = eventStore.load(command.projectId());
        Project current = stream.isEmpty() ? null : projection.reduce(command.projectId(), stream.events());

        EventStatus initialStatus = command.status() != null ? command.status() : EventStatus.APPROVED;
        Optional<ProjectEvent> decided = registry.decide(
            command.type(), command.projectId(), command.actor(), current, input, initialStatus);
        if (decided.isEmpty()) {
            log.debug("No-op {} for project={}", command.type(), command.projectId());
            return new CommandResult(current, null);
        }

        ProjectEvent event = decided.get();
        if (command.status() == null && policyEvaluator.requiresApproval(event, projection.preview(current, event))) {
            event = event.withStatus(EventStatus.PENDING);
        }

        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Command " + command.type() + " cancelled before append");
        }
        List<ProjectEvent> stored = eventStore.append(command.projectId(), stream.currentVersion(), List.of(event));

        Project state = current != null ? current : projection.reduce(command.projectId(), List.of());
        for (ProjectEvent appended : stored) {
            projection.apply(state, appended);
        }
        log.info("Recorded {} v{} on project={} status={}",
            event.type(), state.getVersion(), command.projectId(), event.status().getValue());

        for (ProjectEvent appended : stored) {
            handlerChain.dispatch(appended, state);
        }
        return new CommandResult(state, stored.get(stored.size() - 1));
    }

    private Object bindInput(EventType<?, ?> eventType, Object input) {
        if (input == null || eventType.inputType().isInstance(input)) {
            return input;
        }
        try {
            return objectMapper.convertValue(input, eventType.inputType());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid input for " + eventType.type() + ": " + e.getMessage());
        }
    }
}
