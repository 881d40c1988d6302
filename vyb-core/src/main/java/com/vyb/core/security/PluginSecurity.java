package com.vyb.core.security;

import com.vyb.api.exception.PluginSecurityException;
import com.vyb.api.exception.PluginSecurityException.Reason;
import com.vyb.core.config.RuntimeConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * 插件安全门
 * <p>
 * 策略、可信哈希表、黑名单由本实例独占，读写锁保护。
 * 修改等级只影响之后的校验，不回溯已加载的插件。
 */
@Slf4j
public class PluginSecurity {

    private static final Pattern SEGMENT_SPLIT = Pattern.compile("[/\\\\]");

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private SecurityPolicy policy;

    // 规范化绝对路径 -> 小写十六进制 SHA-256
    private final Map<String, String> trustedHashes = new HashMap<>();

    // 小写插件名
    private final Set<String> blacklist = new HashSet<>();

    public PluginSecurity() {
        this(SecurityPolicy.builder().build());
    }

    public PluginSecurity(SecurityPolicy policy) {
        this.policy = policy.copy();
    }

    /**
     * 以运行时配置初始化策略、可信哈希与黑名单
     */
    public void initialize(RuntimeConfig config) {
        lock.writeLock().lock();
        try {
            SecurityPolicy seeded = config.toSecurityPolicy();
            seeded.setAllowedExtensions(policy.getAllowedExtensions());
            seeded.setRestrictedPaths(policy.getRestrictedPaths());
            this.policy = seeded;
            config.getTrustedHashes().forEach((path, hash) -> trustedHashes.put(key(Paths.get(path)), normalizeHash(hash)));
            config.getBlacklist().forEach(name -> blacklist.add(name.toLowerCase(Locale.ROOT)));
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Plugin security initialized: level={}, hashCheck={}, trustedHashes={}, blacklisted={}",
                config.getSecurityLevel().label(), config.isRequireHashCheck(),
                config.getTrustedHashes().size(), config.getBlacklist().size());
    }

    /**
     * 只检查黑名单（大小写不敏感的精确匹配）
     */
    public void validatePlugin(String name) {
        lock.readLock().lock();
        try {
            if (blacklist.contains(name.toLowerCase(Locale.ROOT))) {
                throw new PluginSecurityException(name, Reason.BLACKLISTED, "blacklisted");
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 校验插件文件，遇到第一个违规即失败：
     * 路径穿越 -> 存在性 -> 受限路径 -> 扩展名 -> 大小 -> 哈希 -> 危险 API（STRICT）
     */
    public void validatePluginFile(Path file) {
        String target = file.toString();
        SecurityPolicy current;
        String expectedHash;

        // 穿越检查作用于原始路径，任何等级都拒绝
        for (String segment : SEGMENT_SPLIT.split(target)) {
            if ("..".equals(segment)) {
                throw new PluginSecurityException(target, Reason.PATH_TRAVERSAL, "path traversal detected");
            }
        }

        if (!Files.exists(file)) {
            throw new PluginSecurityException(target, Reason.FILE_NOT_FOUND, "file not found");
        }

        lock.readLock().lock();
        try {
            current = policy.copy();
            expectedHash = trustedHashes.get(key(file));
        } finally {
            lock.readLock().unlock();
        }

        Path absolute = file.toAbsolutePath().normalize();
        for (String restricted : current.getRestrictedPaths()) {
            if (absolute.startsWith(Paths.get(restricted))) {
                throw new PluginSecurityException(target, Reason.RESTRICTED_PATH,
                        "restricted path " + restricted);
            }
        }

        String lowerName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (current.getAllowedExtensions().stream().noneMatch(ext -> lowerName.endsWith(ext.toLowerCase(Locale.ROOT)))) {
            throw new PluginSecurityException(target, Reason.EXTENSION,
                    "extension not allowed, expected one of " + current.getAllowedExtensions());
        }

        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new PluginSecurityException(target, Reason.FILE_NOT_FOUND, "cannot stat file: " + e.getMessage(), e);
        }
        if (size > current.getMaxPluginSize()) {
            throw new PluginSecurityException(target, Reason.SIZE,
                    "size " + size + " exceeds limit " + current.getMaxPluginSize());
        }

        if (current.isRequireHashCheck()) {
            verifyHash(file, target, expectedHash, current.getLevel());
        }

        if (current.getLevel() == SecurityLevel.STRICT) {
            scanBytecode(file, target);
        }

        log.debug("Plugin file validated: {}", target);
    }

    // ==================== 可信哈希 / 黑名单 ====================

    public void addTrustedHash(Path file, String sha256) {
        lock.writeLock().lock();
        try {
            trustedHashes.put(key(file), normalizeHash(sha256));
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Trusted hash registered for {}", file);
    }

    public void removeTrustedHash(Path file) {
        lock.writeLock().lock();
        try {
            trustedHashes.remove(key(file));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void addToBlacklist(String name) {
        lock.writeLock().lock();
        try {
            blacklist.add(name.toLowerCase(Locale.ROOT));
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[{}] Plugin blacklisted", name);
    }

    public void removeFromBlacklist(String name) {
        lock.writeLock().lock();
        try {
            blacklist.remove(name.toLowerCase(Locale.ROOT));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setSecurityLevel(SecurityLevel level) {
        lock.writeLock().lock();
        try {
            policy.setLevel(level);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Security level changed to {}", level.label());
    }

    public SecurityPolicy getPolicy() {
        lock.readLock().lock();
        try {
            return policy.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    public SecurityInfo getSecurityInfo() {
        lock.readLock().lock();
        try {
            return new SecurityInfo(policy.copy(), trustedHashes.size(), blacklist.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 计算文件 SHA-256（小写十六进制）
     */
    public static String sha256(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    // ==================== 内部方法 ====================

    private void verifyHash(Path file, String target, String expectedHash, SecurityLevel level) {
        if (expectedHash == null) {
            if (level.isAtLeast(SecurityLevel.HIGH)) {
                throw new PluginSecurityException(target, Reason.HASH_MISSING, "no trusted hash registered");
            }
            log.warn("No trusted hash registered for {}, accepting at level {}", target, level.label());
            return;
        }

        String actual;
        try {
            actual = sha256(file);
        } catch (IOException e) {
            throw new PluginSecurityException(target, Reason.HASH_MISMATCH, "cannot hash file: " + e.getMessage(), e);
        }
        if (!expectedHash.equals(actual)) {
            throw new PluginSecurityException(target, Reason.HASH_MISMATCH, "hash mismatch");
        }
    }

    private void scanBytecode(Path file, String target) {
        DangerousApiScanner.ScanResult result;
        try {
            result = DangerousApiScanner.scan(file.toFile(), true);
        } catch (IOException e) {
            throw new PluginSecurityException(target, Reason.DANGEROUS_API,
                    "cannot scan bytecode: " + e.getMessage(), e);
        }
        result.logWarnings(target);
        if (result.hasCriticalViolations()) {
            throw new PluginSecurityException(target, Reason.DANGEROUS_API,
                    "dangerous API usage: " + result.errors());
        }
    }

    private static String key(Path file) {
        return file.toAbsolutePath().normalize().toString();
    }

    private static String normalizeHash(String hash) {
        return hash.trim().toLowerCase(Locale.ROOT);
    }
}
