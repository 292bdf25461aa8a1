package uk.gegc.docintake.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Replaces the real {@link ChatClient} so no test ever calls the analysis provider.
 * The canned answer classifies every document as information.
 */
@TestConfiguration
@Profile({"test", "!real-ai"})
public class TestAiConfig {

    static final String CANNED_RESPONSE = """
            {"documentType":"Information","informationData":{"description":"Test document","summary":"Canned test analysis.","sentiment":"Neutral"}}
            """;

    @Bean
    @Primary
    public ChatClient testChatClient() {
        ChatClient mockChatClient = mock(ChatClient.class);
        ChatClient.ChatClientRequestSpec mockRequestSpec = mock(ChatClient.ChatClientRequestSpec.class);
        ChatClient.CallResponseSpec mockCallSpec = mock(ChatClient.CallResponseSpec.class);

        when(mockChatClient.prompt(any(Prompt.class))).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallSpec);
        when(mockCallSpec.chatResponse()).thenAnswer(invocation ->
                new ChatResponse(List.of(new Generation(new AssistantMessage(CANNED_RESPONSE)))));

        return mockChatClient;
    }
}
