package com.purchasingpower.codegen.client;

import com.google.common.base.Preconditions;
import com.purchasingpower.codegen.configuration.LlmProperties;
import com.purchasingpower.codegen.exception.CodeGenerationException;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.DoubleFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Generates candidates with a local Ollama chat model through LangChain4j.
 *
 * <p>Ollama fixes the temperature when the model is built, so one model instance is
 * kept per temperature. Replies wrapped in Markdown code fences are unwrapped.
 *
 * <p><b>Thread Safety:</b> Models are cached in a concurrent map and are themselves
 * safe to share, so candidates can be generated in parallel.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class LangChain4jCodeGenerator implements CodeGenerator {

    private static final Pattern CODE_FENCE = Pattern.compile("```[\\w+-]*\\s*\\n(.*?)```", Pattern.DOTALL);

    private final DoubleFunction<ChatLanguageModel> modelFactory;
    private final Map<Double, ChatLanguageModel> models = new ConcurrentHashMap<>();

    @Autowired
    public LangChain4jCodeGenerator(LlmProperties properties) {
        this(temperature -> ollamaModel(properties, temperature));
        log.info("🔧 Code generator using Ollama model {} at {}", properties.getModelName(), properties.getBaseUrl());
    }

    public LangChain4jCodeGenerator(DoubleFunction<ChatLanguageModel> modelFactory) {
        this.modelFactory = Preconditions.checkNotNull(modelFactory, "Model factory cannot be null");
    }

    @Override
    public String generateCode(String prompt, double temperature) {
        Preconditions.checkNotNull(prompt, "Prompt cannot be null");

        ChatLanguageModel model = models.computeIfAbsent(temperature, modelFactory::apply);
        long start = System.currentTimeMillis();
        String response;
        try {
            response = model.generate(prompt);
        } catch (RuntimeException e) {
            throw new CodeGenerationException("Code generation failed: " + e.getMessage(), temperature, e);
        }
        if (response == null || response.isBlank()) {
            throw new CodeGenerationException("Model returned an empty response", temperature, null);
        }

        log.debug("✅ Generated {} chars at temperature {} in {}ms",
                response.length(), temperature, System.currentTimeMillis() - start);
        return stripCodeFences(response);
    }

    @Override
    public String getName() {
        return "langchain4j-ollama";
    }

    /**
     * Returns the first fenced block of a reply, or the trimmed reply if it has none.
     */
    static String stripCodeFences(String response) {
        Matcher matcher = CODE_FENCE.matcher(response);
        if (matcher.find()) {
            return matcher.group(1).strip() + "\n";
        }
        return response.strip() + "\n";
    }

    private static ChatLanguageModel ollamaModel(LlmProperties properties, double temperature) {
        return OllamaChatModel.builder()
                .baseUrl(properties.getBaseUrl())
                .modelName(properties.getModelName())
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .temperature(temperature)
                .maxRetries(properties.getMaxRetries())
                .logRequests(properties.isLogRequests())
                .logResponses(properties.isLogResponses())
                .build();
    }
}
