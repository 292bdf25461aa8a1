package uk.gegc.docintake.features.analysis.infra;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Answers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import uk.gegc.docintake.features.analysis.application.ContentExtractor;
import uk.gegc.docintake.features.analysis.config.AnalysisProperties;
import uk.gegc.docintake.features.analysis.domain.AnalysisContent;
import uk.gegc.docintake.shared.exception.ExternalServiceException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpringAiAnalysisClientTest {

    @Mock(answer = Answers.RETURNS_DEEP_STUBS)
    private ChatClient chatClient;

    private ExecutorService executor;
    private AnalysisProperties properties;
    private SpringAiAnalysisClient client;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        properties = new AnalysisProperties();
        properties.setTimeout(Duration.ofSeconds(2));
        client = new SpringAiAnalysisClient(chatClient, executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ChatResponse response(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    @DisplayName("sends the instruction as system message and the text as user message")
    void analyze_text_buildsSystemAndUserMessages() {
        when(chatClient.prompt(any(Prompt.class)).call().chatResponse()).thenReturn(response("{\"ok\":true}"));

        String raw = client.analyze("SCHEMA", AnalysisContent.text("Analyze this document content:\n\nhello"));

        assertThat(raw).isEqualTo("{\"ok\":true}");
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatClient, org.mockito.Mockito.atLeastOnce()).prompt(captor.capture());
        Prompt prompt = captor.getAllValues().get(captor.getAllValues().size() - 1);
        assertThat(prompt.getInstructions()).hasSize(2);
        assertThat(prompt.getInstructions().get(0).getMessageType()).isEqualTo(MessageType.SYSTEM);
        assertThat(prompt.getInstructions().get(0).getText()).isEqualTo("SCHEMA");
        assertThat(prompt.getInstructions().get(1).getText()).endsWith("hello");
    }

    @Test
    @DisplayName("images are attached as media next to the image instruction")
    void analyze_image_attachesMedia() {
        when(chatClient.prompt(any(Prompt.class)).call().chatResponse()).thenReturn(response("{}"));

        client.analyze("SCHEMA", AnalysisContent.image("AAEC", "image/png"));

        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatClient, org.mockito.Mockito.atLeastOnce()).prompt(captor.capture());
        Prompt prompt = captor.getAllValues().get(captor.getAllValues().size() - 1);
        UserMessage user = (UserMessage) prompt.getInstructions().get(1);
        assertThat(user.getText()).isEqualTo(ContentExtractor.IMAGE_INSTRUCTION);
        assertThat(user.getMedia()).hasSize(1);
        assertThat(user.getMedia().get(0).getMimeType().toString()).isEqualTo("image/png");
    }

    @Test
    void analyze_emptyResponse_throwsExternalServiceException() {
        when(chatClient.prompt(any(Prompt.class)).call().chatResponse()).thenReturn(response("  "));

        assertThatThrownBy(() -> client.analyze("SCHEMA", AnalysisContent.text("t")))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("Empty response");
    }

    @Test
    void analyze_providerError_isWrapped() {
        when(chatClient.prompt(any(Prompt.class)).call().chatResponse())
                .thenThrow(new IllegalStateException("HTTP 500 from provider"));

        assertThatThrownBy(() -> client.analyze("SCHEMA", AnalysisContent.text("t")))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("HTTP 500 from provider");
    }

    @Test
    @DisplayName("a call exceeding the timeout fails like any other external error")
    void analyze_slowProvider_timesOut() {
        properties.setTimeout(Duration.ofMillis(100));
        when(chatClient.prompt(any(Prompt.class)).call().chatResponse()).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return response("{}");
        });

        assertThatThrownBy(() -> client.analyze("SCHEMA", AnalysisContent.text("t")))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("timed out");
    }
}
