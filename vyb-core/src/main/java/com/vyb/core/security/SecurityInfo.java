package com.vyb.core.security;

/**
 * 安全门当前状态快照
 */
public record SecurityInfo(SecurityPolicy policy, int trustedHashCount, int blacklistCount) {
}
