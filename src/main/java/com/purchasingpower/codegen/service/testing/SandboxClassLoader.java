package com.purchasingpower.codegen.service.testing;

import java.util.Map;

/**
 * Loads one candidate's compiled classes inside the child JVM started for a test case.
 *
 * <p>The parent is the platform class loader, so candidate code sees the JDK but not the
 * launcher. JDK classes listed by {@link SandboxPolicy} are refused.
 */
class SandboxClassLoader extends ClassLoader {

    private final Map<String, byte[]> classFiles;

    SandboxClassLoader(Map<String, byte[]> classFiles) {
        super("candidate-sandbox", ClassLoader.getPlatformClassLoader());
        this.classFiles = classFiles;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        if (SandboxPolicy.isForbiddenClass(name)) {
            throw new ClassNotFoundException(name + " is not available to generated code");
        }
        return super.loadClass(name, resolve);
    }

    @Override
    protected Class<?> findClass(String name) throws ClassNotFoundException {
        byte[] bytes = classFiles.get(name);
        if (bytes == null) {
            throw new ClassNotFoundException(name);
        }
        return defineClass(name, bytes, 0, bytes.length);
    }
}
