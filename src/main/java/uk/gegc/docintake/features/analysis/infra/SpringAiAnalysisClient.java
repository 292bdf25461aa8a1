package uk.gegc.docintake.features.analysis.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeTypeUtils;
import uk.gegc.docintake.features.analysis.application.AnalysisClient;
import uk.gegc.docintake.features.analysis.application.ContentExtractor;
import uk.gegc.docintake.features.analysis.config.AnalysisProperties;
import uk.gegc.docintake.features.analysis.domain.AnalysisContent;
import uk.gegc.docintake.shared.exception.ExternalServiceException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link AnalysisClient} backed by Spring AI's {@link ChatClient}.
 * <p>
 * The schema instruction goes in as the system message. Text content is the user message;
 * images are attached to it as a base64 data URL. The call runs on {@code aiTaskExecutor} and
 * the caller waits at most {@code app.analysis.timeout}.
 */
@Component
@Slf4j
public class SpringAiAnalysisClient implements AnalysisClient {

    private final ChatClient chatClient;
    private final Executor aiTaskExecutor;
    private final AnalysisProperties properties;

    public SpringAiAnalysisClient(ChatClient chatClient,
                                  @Qualifier("aiTaskExecutor") Executor aiTaskExecutor,
                                  AnalysisProperties properties) {
        this.chatClient = chatClient;
        this.aiTaskExecutor = aiTaskExecutor;
        this.properties = properties;
    }

    @Override
    public String analyze(String instruction, AnalysisContent content) {
        Prompt prompt = new Prompt(List.of(new SystemMessage(instruction), toUserMessage(content)));
        Duration timeout = properties.getTimeout();

        CompletableFuture<String> call = CompletableFuture.supplyAsync(() -> invoke(prompt), aiTaskExecutor);
        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ExternalServiceException("Analysis service timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("Analysis call was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ExternalServiceException external) {
                throw external;
            }
            throw new ExternalServiceException("Analysis service error: " + cause.getMessage(), cause);
        }
    }

    private String invoke(Prompt prompt) {
        log.debug("Sending analysis request with {} messages", prompt.getInstructions().size());
        ChatResponse response = chatClient.prompt(prompt)
                .call()
                .chatResponse();

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ExternalServiceException("No response received from analysis service.");
        }
        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new ExternalServiceException("Empty response from analysis service.");
        }
        return text;
    }

    private static UserMessage toUserMessage(AnalysisContent content) {
        if (content.kind() == AnalysisContent.Kind.IMAGE) {
            Media image = Media.builder()
                    .mimeType(MimeTypeUtils.parseMimeType(content.imageMimeType()))
                    .data("data:" + content.imageMimeType() + ";base64," + content.imageBase64())
                    .build();
            return UserMessage.builder()
                    .text(ContentExtractor.IMAGE_INSTRUCTION)
                    .media(image)
                    .build();
        }
        return new UserMessage(content.text());
    }
}
