package com.projectgroup5.pongarena.service;

import java.util.Optional;

/**
 * 握手阶段把 token 解析为用户 id
 */
public interface CredentialVerifier {

    Optional<Long> resolveUserId(String token);
}
