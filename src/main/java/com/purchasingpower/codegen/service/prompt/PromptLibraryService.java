package com.purchasingpower.codegen.service.prompt;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.codegen.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads prompts from {@code classpath:prompts/*.yaml} and renders them with variables.
 *
 * Usage:
 * String prompt = promptLibrary.render("constrained-code-gen", Map.of(
 *     "signature", "int findIndex(int[] items, int target)",
 *     "summary", "Find the first index of target"
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    static final String PROMPT_LOCATION = "classpath:prompts/*.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(PROMPT_LOCATION);

            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    PromptTemplate template = yamlMapper.readValue(in, PromptTemplate.class);
                    templates.put(template.getName(), template);
                    compiled.remove(template.getName());
                    log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
                }
            }

            log.info("Loaded {} prompt templates", templates.size());

        } catch (IOException e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    /**
     * Renders system and user prompt, separated by a blank line.
     *
     * @throws IllegalArgumentException if no template has that name
     */
    public String render(String templateName, Map<String, Object> variables) {
        Mustache mustache = compiled.computeIfAbsent(templateName, this::compile);

        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    /**
     * Get template metadata (for logging, debugging)
     */
    public Optional<PromptTemplate> getTemplate(String name) {
        return Optional.ofNullable(templates.get(name));
    }

    private Mustache compile(String templateName) {
        PromptTemplate template = templates.get(templateName);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }
        String fullPrompt = template.getSystemPrompt() + "\n\n" + template.getUserPrompt();
        return mustacheFactory.compile(new StringReader(fullPrompt), templateName);
    }
}
