package com.vyb.api.exception;

import lombok.Getter;

/**
 * 安全校验拒绝
 */
@Getter
public class PluginSecurityException extends VybException {

    public enum Reason {
        BLACKLISTED,
        FILE_NOT_FOUND,
        PATH_TRAVERSAL,
        RESTRICTED_PATH,
        EXTENSION,
        SIZE,
        HASH_MISMATCH,
        HASH_MISSING,
        DANGEROUS_API
    }

    private final String target;
    private final Reason reason;

    public PluginSecurityException(String target, Reason reason, String detail) {
        super("plugin " + target + ": " + detail);
        this.target = target;
        this.reason = reason;
    }

    public PluginSecurityException(String target, Reason reason, String detail, Throwable cause) {
        super("plugin " + target + ": " + detail, cause);
        this.target = target;
        this.reason = reason;
    }
}
