package org.gridiron.tool;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.memory.ChatMemory;
import dev.langchain4j.memory.chat.MessageWindowChatMemory;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Free-form questions answered by a chat model that can call the fantasy tools.
 */
public class FantasyAgent {

    private static final Logger log = LoggerFactory.getLogger(FantasyAgent.class);

    static final String SYSTEM_PROMPT =
        "You are a fantasy football assistant with access to the user's Yahoo leagues. "
        + "Use the tools to look up matchups, rosters and lineups before answering. "
        + "Answer briefly and only with data returned by the tools.";

    interface Assistant {
        String chat(String userMessage);
    }

    private final ChatModel model;
    private final FantasyAgentTools tools;

    public FantasyAgent(ChatModel model, FantasyAgentTools tools) {
        this.model = model;
        this.tools = tools;
    }

    public boolean isAvailable() {
        return model != null;
    }

    public String ask(String question) {
        if (model == null) {
            throw new IllegalStateException("MISTRAL_API_KEY is not configured");
        }
        // Enough room for several tool round trips.
        ChatMemory memory = MessageWindowChatMemory.withMaxMessages(20);
        memory.add(new SystemMessage(SYSTEM_PROMPT));

        Assistant assistant = AiServices.builder(Assistant.class)
                .chatModel(model)
                .chatMemory(memory)
                .tools(tools)
                .build();
        log.debug("Agent question: {}", question);
        return assistant.chat(question);
    }
}
