package com.knowledgeengine.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ApiKeyUtil.
 */
class ApiKeyUtilTest {

    @Test
    void hashApiKey_IsSha256Hex() {
        assertThat(ApiKeyUtil.hashApiKey("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void matches_AcceptsConfiguredDigestOnly() {
        List<String> accepted = List.of(ApiKeyUtil.hashApiKey("ke_secret_key"));

        assertThat(ApiKeyUtil.matches("ke_secret_key", accepted)).isTrue();
        assertThat(ApiKeyUtil.matches("ke_other_key", accepted)).isFalse();
        assertThat(ApiKeyUtil.matches("", accepted)).isFalse();
        assertThat(ApiKeyUtil.matches(null, accepted)).isFalse();
    }

    @Test
    void getKeyPrefix_ShortKeysGiveEmptyPrefix() {
        assertThat(ApiKeyUtil.getKeyPrefix("ke_secret_key")).isEqualTo("ke_secr");
        assertThat(ApiKeyUtil.getKeyPrefix("short")).isEmpty();
    }
}
