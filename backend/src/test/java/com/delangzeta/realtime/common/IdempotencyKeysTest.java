package com.delangzeta.realtime.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdempotencyKeysTest {

    @Test
    @DisplayName("chain log key lowercases the tx hash so node casing does not split duplicates")
    void chainLogKeyIsCaseInsensitiveOnHash() {
        assertThat(IdempotencyKeys.chainLog("zetachain", "0xABCdef", 3))
                .isEqualTo("zetachain:0xabcdef:3")
                .isEqualTo(IdempotencyKeys.chainLog("zetachain", "0xabcdef", 3));
    }

    @Test
    @DisplayName("content hash is stable hex sha-256 and sensitive to part boundaries")
    void contentHashStable() {
        String a = IdempotencyKeys.contentHash("derived", "task_update", "zetachain:0x1:0");
        assertThat(a).hasSize(64).matches("[0-9a-f]+");
        assertThat(IdempotencyKeys.contentHash("derived", "task_update", "zetachain:0x1:0")).isEqualTo(a);
        assertThat(IdempotencyKeys.contentHash("derived", "reward_distributed", "zetachain:0x1:0")).isNotEqualTo(a);
    }
}
