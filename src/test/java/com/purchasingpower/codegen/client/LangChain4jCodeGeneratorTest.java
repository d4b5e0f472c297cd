package com.purchasingpower.codegen.client;

import com.purchasingpower.codegen.exception.CodeGenerationException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LangChain4j Code Generator Tests")
class LangChain4jCodeGeneratorTest {

    @Test
    @DisplayName("Should strip Markdown fences from replies")
    void testStripCodeFences() {
        assertEquals("int one() {\n    return 1;\n}\n",
                LangChain4jCodeGenerator.stripCodeFences("Here you go:\n```java\nint one() {\n    return 1;\n}\n```\nDone."));
        assertEquals("int two() { return 2; }\n",
                LangChain4jCodeGenerator.stripCodeFences("```\nint two() { return 2; }\n```"));
        assertEquals("int three() { return 3; }\n",
                LangChain4jCodeGenerator.stripCodeFences("  int three() { return 3; }  "));
    }

    @Test
    @DisplayName("Should build one model per temperature and return the stripped reply")
    void testGenerateCode_CachesModelPerTemperature() {
        // Given
        List<Double> created = new ArrayList<>();
        LangChain4jCodeGenerator generator = new LangChain4jCodeGenerator(temperature -> {
            created.add(temperature);
            return replying(() -> "```java\nint answer() { return 42; }\n```");
        });

        // When
        String first = generator.generateCode("prompt", 0.3);
        String second = generator.generateCode("prompt again", 0.3);
        generator.generateCode("prompt", 0.45);

        // Then
        assertEquals("int answer() { return 42; }\n", first);
        assertEquals(first, second);
        assertEquals(List.of(0.3, 0.45), created);
        System.out.println("✅ Models created for temperatures " + created);
    }

    @Test
    @DisplayName("Should wrap model failures and empty replies")
    void testGenerateCode_Failures() {
        // Given
        LangChain4jCodeGenerator failing = new LangChain4jCodeGenerator(temperature -> replying(() -> {
            throw new IllegalStateException("connection refused");
        }));
        LangChain4jCodeGenerator silent = new LangChain4jCodeGenerator(temperature -> replying(() -> "   "));

        // When
        CodeGenerationException error = assertThrows(CodeGenerationException.class,
                () -> failing.generateCode("prompt", 0.6));
        CodeGenerationException empty = assertThrows(CodeGenerationException.class,
                () -> silent.generateCode("prompt", 0.3));

        // Then
        assertEquals("Code generation failed: connection refused", error.getMessage());
        assertEquals(0.6, error.getTemperature(), 1e-9);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("Model returned an empty response", empty.getMessage());
    }

    private static ChatLanguageModel replying(Supplier<String> reply) {
        return new ChatLanguageModel() {
            @Override
            public Response<AiMessage> generate(List<ChatMessage> messages) {
                return Response.from(AiMessage.from(reply.get()));
            }
        };
    }
}
