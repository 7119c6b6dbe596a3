package com.projectledger.notification;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectledger.contract.EventMessages;
import com.projectledger.contract.EventPayload.UnrecognizedPayload;
import com.projectledger.contract.EventType;
import com.projectledger.contract.EventTypeRegistry;
import com.projectledger.contract.FieldNames;
import com.projectledger.contract.ProjectEvent;
import com.projectledger.contract.RelatedIds;
import com.projectledger.projection.Project;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds user-facing messages from {{placeholder}} templates.
 *
 * Available placeholders: {@code event.<payload field>}, {@code event.type},
 * {@code event.friendly_name}, {@code project.title}, {@code project.slug},
 * {@code person.name}, {@code product.name}, {@code project_role.name},
 * {@code org_node.name} and {@code creator.name}. Placeholders without a
 * value are left in place.
 */
public class MessageComposer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.]+)\\s*}}");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final EventTypeRegistry registry;
    private final RelatedEntityLookup lookup;

    public MessageComposer(ObjectMapper objectMapper, EventTypeRegistry registry, RelatedEntityLookup lookup) {
        this.objectMapper = objectMapper;
        this.registry = registry;
        this.lookup = lookup;
    }

    public String render(String template, ProjectEvent event, Project project) {
        return substitute(template, variables(event, project));
    }

    /** Announcement for project members, empty if the event type is not announced. */
    public Optional<String> memberNotification(ProjectEvent event, Project project) {
        Optional<EventType<?, ?>> type = registry.find(event.type());
        if (type.isEmpty() || !type.get().notifiesMembers()) {
            return Optional.empty();
        }
        String template = type.get().messages().notification();
        if (template != null) {
            String message = render(template, event, project);
            if (!message.contains("{{")) {
                return Optional.of(message);
            }
        }
        return Optional.of(String.format("%s on project '%s'.", event.friendlyName(), title(project)));
    }

    public String approvalRequest(ProjectEvent event, Project project) {
        String template = messages(event).approvalRequest();
        if (template != null) {
            String message = render(template, event, project);
            if (!message.contains("{{")) {
                return message;
            }
        }
        String creator = lookup.userName(event.createdBy()).orElse("A user");
        return String.format("%s has requested a %s on project '%s' and it needs your approval.",
            creator, event.friendlyName(), title(project));
    }

    public String statusUpdate(ProjectEvent event, Project project) {
        String template = event.isApproved() ? messages(event).approved() : messages(event).rejected();
        if (template != null) {
            String message = render(template, event, project);
            if (!message.contains("{{")) {
                return message;
            }
        }
        return String.format("Your request '%s' has been %s.", event.friendlyName(), event.status().getValue());
    }

    static String substitute(String template, Map<String, String> variables) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = variables.get(FieldNames.normalize(matcher.group(1)));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private Map<String, String> variables(ProjectEvent event, Project project) {
        Map<String, String> vars = new HashMap<>();
        Map<String, Object> payload = event.payload() instanceof UnrecognizedPayload unknown
            ? unknown.fields()
            : objectMapper.convertValue(event.payload(), MAP_TYPE);
        payload.forEach((key, value) -> {
            if (value != null) {
                put(vars, "event." + key, String.valueOf(value));
            }
        });
        put(vars, "event.type", event.type());
        put(vars, "event.friendly_name", event.friendlyName());
        put(vars, "event.status", event.status().getValue());
        if (project != null) {
            put(vars, "project.title", project.getTitle());
            put(vars, "project.slug", project.getSlug());
        }

        RelatedIds related = registry.find(event.type())
            .map(type -> type.relatedIds(event.payload()))
            .orElse(RelatedIds.NONE);
        if (related.personId() != null) {
            lookup.personName(related.personId()).ifPresent(name -> put(vars, "person.name", name));
        }
        if (related.productId() != null) {
            lookup.productName(related.productId()).ifPresent(name -> put(vars, "product.name", name));
        }
        if (related.projectRoleId() != null) {
            lookup.projectRoleName(related.projectRoleId()).ifPresent(name -> put(vars, "project_role.name", name));
        }
        if (related.orgNodeId() != null) {
            lookup.orgNodeName(related.orgNodeId()).ifPresent(name -> put(vars, "org_node.name", name));
        }
        if (event.createdBy() != null) {
            lookup.userName(event.createdBy()).ifPresent(name -> put(vars, "creator.name", name));
        }
        return vars;
    }

    private EventMessages messages(ProjectEvent event) {
        return registry.find(event.type()).map(EventType::messages).orElse(EventMessages.NONE);
    }

    private static void put(Map<String, String> vars, String key, String value) {
        if (value != null) {
            vars.put(FieldNames.normalize(key), value);
        }
    }

    private static String title(Project project) {
        if (project == null) {
            return "unknown";
        }
        return project.getTitle() != null ? project.getTitle() : project.getId().toString();
    }
}
