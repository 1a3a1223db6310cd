package com.my.caddy.domain.routing;

import com.my.caddy.domain.model.Intent;

public class TemplateResponseComposer implements ResponseComposer {

    static final String PATTERN_QUERY =
            "Let me check your miss patterns. Based on your recent shots, I'll give you insights.";
    static final String HELP_REQUEST =
            "I'm your digital caddy. Ask me about club selection, check your recovery, enter scores, "
                    + "or get coaching tips. What can I help you with?";
    static final String FEEDBACK = "Thanks for the feedback! I'm always learning to serve you better.";
    static final String GENERIC = "I understand. Let me help you with that.";

    @Override
    public String compose(Intent intent) {
        return switch (intent.type()) {
            case PATTERN_QUERY -> PATTERN_QUERY;
            case HELP_REQUEST -> HELP_REQUEST;
            case FEEDBACK -> FEEDBACK;
            default -> GENERIC;
        };
    }
}
