package com.purchasingpower.codegen.service.testing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Sandbox Policy Tests")
class SandboxPolicyTest {

    @Test
    @DisplayName("Should detect forbidden APIs in source")
    void testFindForbiddenUsage() {
        assertEquals(Optional.of("ProcessBuilder"),
                SandboxPolicy.findForbiddenUsage("new ProcessBuilder(\"ls\").start();"));
        assertEquals(Optional.of("java.io / java.nio / java.net"),
                SandboxPolicy.findForbiddenUsage("java.nio.file.Files.delete(path);"));
        assertEquals(Optional.of("reflection"),
                SandboxPolicy.findForbiddenUsage("field.setAccessible(true);"));
    }

    @Test
    @DisplayName("Should detect method handles and host state mutators")
    void testFindForbiddenUsage_EscapeRoutes() {
        assertEquals(Optional.of("method handles"),
                SandboxPolicy.findForbiddenUsage("MethodHandles.publicLookup().findStatic(System.class, \"ex\" + \"it\", t);"));
        assertEquals(Optional.of("method handles"),
                SandboxPolicy.findForbiddenUsage("java.lang.invoke.VarHandle handle = null;"));
        assertEquals(Optional.of("System state"),
                SandboxPolicy.findForbiddenUsage("System.setOut(null);"));
        assertEquals(Optional.of("System state"),
                SandboxPolicy.findForbiddenUsage("System . setProperty(\"k\", \"v\");"));
        assertTrue(SandboxPolicy.findForbiddenUsage("System.out.println(System.lineSeparator());").isEmpty());
    }

    @Test
    @DisplayName("Should ignore API names inside string literals")
    void testStringLiterals_ShouldBeIgnored() {
        assertTrue(SandboxPolicy.findForbiddenUsage("return \"System.exit is not called\";").isEmpty());
        assertTrue(SandboxPolicy.findForbiddenUsage("throw new RuntimeException(\"bad\");").isEmpty());
    }

    @Test
    @DisplayName("Should block dangerous classes but not lookalikes")
    void testIsForbiddenClass() {
        assertTrue(SandboxPolicy.isForbiddenClass("java.lang.Runtime"));
        assertTrue(SandboxPolicy.isForbiddenClass("java.lang.reflect.Method"));
        assertTrue(SandboxPolicy.isForbiddenClass("java.net.Socket"));
        assertFalse(SandboxPolicy.isForbiddenClass("java.lang.RuntimeException"));
        assertFalse(SandboxPolicy.isForbiddenClass("java.lang.ThreadLocal"));
        assertFalse(SandboxPolicy.isForbiddenClass("java.util.ArrayList"));
    }
}
