package com.projectledger.contract;

/**
 * Message templates of an event type. Placeholders use {{name}} syntax.
 * Null means the event type has no template for that message kind.
 */
public record EventMessages(
    String notification,
    String approvalRequest,
    String approved,
    String rejected
) {

    public static final EventMessages NONE = new EventMessages(null, null, null, null);
}
