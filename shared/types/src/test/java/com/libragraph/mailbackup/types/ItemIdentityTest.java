package com.libragraph.mailbackup.types;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class ItemIdentityTest {

    @Test
    void ordersByTenantMailboxItemThenKind() {
        ItemIdentity a = ItemIdentity.message("t1", "alice", "m2");
        ItemIdentity b = ItemIdentity.attachment("t1", "alice", "m1");
        ItemIdentity c = ItemIdentity.message("t1", "alice", "m1");
        ItemIdentity d = ItemIdentity.message("t0", "zed", "m9");

        List<ItemIdentity> sorted = Stream.of(a, b, c, d).sorted().toList();

        assertThat(sorted).containsExactly(d, c, b, a);
    }

    @Test
    void equalityCoversAllFourComponents() {
        assertThat(ItemIdentity.message("t1", "alice", "m1"))
                .isEqualTo(new ItemIdentity("t1", "alice", "m1", ItemKind.MESSAGE))
                .isNotEqualTo(ItemIdentity.attachment("t1", "alice", "m1"));
    }

    @Test
    void rejectsBlankComponents() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ItemIdentity.message("t1", "", "m1"));
        assertThatNullPointerException()
                .isThrownBy(() -> new ItemIdentity("t1", "alice", "m1", null));
    }

    @Test
    void rejectsComponentsWiderThanStoredColumns() {
        String longest = "A".repeat(ItemIdentity.MAX_PROVIDER_ITEM_ID_LENGTH);

        assertThat(ItemIdentity.attachment("t1", "alice", longest).providerItemId()).hasSize(512);
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ItemIdentity.attachment("t1", "alice", longest + "A"))
                .withMessageContaining("providerItemId");
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ItemIdentity.message("t".repeat(256), "alice", "m1"))
                .withMessageContaining("tenantId");
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ItemIdentity.message("t1", "b".repeat(256), "m1"))
                .withMessageContaining("mailboxId");
    }

    @Test
    void kindResolvesFromIdAndLabel() {
        assertThat(ItemKind.fromId(1)).isEqualTo(ItemKind.ATTACHMENT);
        assertThat(ItemKind.fromLabel("Message")).isEqualTo(ItemKind.MESSAGE);
        assertThatIllegalArgumentException().isThrownBy(() -> ItemKind.fromId(7));
    }
}
