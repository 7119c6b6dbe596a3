package com.projectledger;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "projectledger")
public class ProjectLedgerProperties {

    private final EventStore eventStore = new EventStore();
    private final Commands commands = new Commands();
    private final Notifications notifications = new Notifications();

    public EventStore getEventStore() {
        return eventStore;
    }

    public Commands getCommands() {
        return commands;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public static class EventStore {

        /** memory or jdbc */
        private String type = "jdbc";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    public static class Commands {

        /** Attempts per command when an append loses a concurrent race. */
        private int maxAttempts = 3;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Notifications {

        private int dispatchThreads = 4;

        public int getDispatchThreads() {
            return dispatchThreads;
        }

        public void setDispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
        }
    }
}
