package com.deepansh.chatagent.core;

import com.deepansh.chatagent.tool.ToolDefinition;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Builds the system prompt for a persona. The persona changes only the
 * prompt text, never how the loop runs.
 */
@Component
public class SystemPromptFactory {

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy HH:mm 'UTC'", Locale.US);

    private final Clock clock;

    public SystemPromptFactory() {
        this(Clock.systemUTC());
    }

    SystemPromptFactory(Clock clock) {
        this.clock = clock;
    }

    public static boolean isDefaultPersona(String personaId) {
        if (personaId == null || personaId.isBlank()) return true;
        String p = personaId.trim().toLowerCase(Locale.ROOT);
        return p.equals("default") || p.equals("robot");
    }

    public String build(String personaId, List<ToolDefinition> tools) {
        String now = ZonedDateTime.now(clock).format(DATE_FORMAT);

        String toolList = tools.stream()
                .map(t -> "- " + t.getName() + ": " + t.summary())
                .collect(Collectors.joining("\n"));

        return """
                ## CURRENT CONTEXT
                Today is %s. Use the search tools for anything that may have changed recently.

                %s

                ## TOOLS
                %s

                ## RULES
                - Use one tool at a time and wait for its result before choosing the next step.
                - If a tool failed, do not call it again with the same arguments; work with what you have.
                - When you are ready, answer directly or deliver with send_messages. send_messages ENDS the conversation.
                - Keep answers concise and conversational; avoid links unless they are essential.
                """.formatted(now, personaSection(personaId), toolList);
    }

    private String personaSection(String personaId) {
        if (isDefaultPersona(personaId)) {
            return """
                    ## IDENTITY
                    You are Everything Bot, an analytical robot assistant. State facts clearly, lead with
                    the core answer, and support it with minimal context.
                    Message limit: 2 messages maximum.""";
        }
        String persona = personaId.trim();
        return """
                ## PERSONA
                Fully embody the persona of "%s": adopt its mindset, vocabulary, and worldview,
                research through its lens, and never break character.
                Message limit: 3 messages maximum.""".formatted(persona);
    }
}
