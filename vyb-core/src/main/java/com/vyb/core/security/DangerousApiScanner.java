package com.vyb.core.security;

import lombok.extern.slf4j.Slf4j;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * 基于 ASM 的危险 API 字节码扫描
 * 终止 JVM 的调用总是致命；进程执行在 {@code forbidProcessExec} 时致命，否则只告警
 */
@Slf4j
public final class DangerousApiScanner {

    // owner.name + descriptor
    private static final Set<String> JVM_TERMINATION = Set.of(
            "java/lang/System.exit(I)V",
            "java/lang/Runtime.exit(I)V",
            "java/lang/Runtime.halt(I)V");

    // owner.name，任意重载
    private static final Set<String> PROCESS_EXECUTION = Set.of(
            "java/lang/Runtime.exec",
            "java/lang/ProcessBuilder.start");

    private DangerousApiScanner() {
    }

    /**
     * 扫描 Jar 内所有类文件
     *
     * @throws IOException Jar 无法读取或类文件损坏
     */
    public static ScanResult scan(File jarFile, boolean forbidProcessExec) throws IOException {
        CallCollector collector = new CallCollector(forbidProcessExec);
        try (JarFile jar = new JarFile(jarFile)) {
            for (JarEntry entry : Collections.list(jar.entries())) {
                if (entry.isDirectory() || !entry.getName().endsWith(".class")) {
                    continue;
                }
                try (InputStream in = jar.getInputStream(entry)) {
                    new ClassReader(in).accept(collector, ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
                }
            }
        }
        return new ScanResult(List.copyOf(collector.errors), List.copyOf(collector.warnings));
    }

    /**
     * 逐个类收集方法调用，按类别分到错误或告警
     */
    private static final class CallCollector extends ClassVisitor {

        private final boolean forbidProcessExec;
        private final List<Violation> errors = new ArrayList<>();
        private final List<Violation> warnings = new ArrayList<>();

        private String owner;

        CallCollector(boolean forbidProcessExec) {
            super(Opcodes.ASM9);
            this.forbidProcessExec = forbidProcessExec;
        }

        @Override
        public void visit(int version, int access, String name, String signature,
                          String superName, String[] interfaces) {
            this.owner = name;
        }

        @Override
        public MethodVisitor visitMethod(int access, String name, String descriptor,
                                         String signature, String[] exceptions) {
            return new MethodVisitor(Opcodes.ASM9) {
                @Override
                public void visitMethodInsn(int opcode, String target, String method,
                                            String desc, boolean isInterface) {
                    inspect(target + "." + method, desc);
                }
            };
        }

        private void inspect(String call, String desc) {
            if (JVM_TERMINATION.contains(call + desc)) {
                errors.add(new Violation(owner, call + desc, "call would terminate the JVM"));
            } else if (PROCESS_EXECUTION.contains(call)) {
                Violation violation = new Violation(owner, call + desc, "process execution");
                (forbidProcessExec ? errors : warnings).add(violation);
            }
        }
    }

    public record Violation(String className, String apiCall, String message) {
        @Override
        public String toString() {
            return apiCall + " in " + className + ": " + message;
        }
    }

    public record ScanResult(List<Violation> errors, List<Violation> warnings) {

        public boolean hasCriticalViolations() {
            return !errors.isEmpty();
        }

        public void logWarnings(String target) {
            for (Violation warning : warnings) {
                log.warn("[{}] Dangerous API: {}", target, warning);
            }
        }
    }
}
