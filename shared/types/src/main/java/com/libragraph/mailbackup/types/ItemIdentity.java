package com.libragraph.mailbackup.types;

import java.util.Comparator;
import java.util.Objects;

/**
 * Logical identity of a backed-up mailbox item: which tenant and mailbox it
 * belongs to, the id the provider assigned it, and whether it is a message
 * or an attachment. Independent of content.
 *
 * <p>Natural ordering is tenant, mailbox, provider item id, kind. Snapshots
 * and index listings are produced in this order.
 *
 * <p>Component lengths are capped at the widths the store persists, so an
 * identity that can be built can always be indexed or recorded as skipped.
 */
public record ItemIdentity(String tenantId, String mailboxId, String providerItemId, ItemKind kind)
        implements Comparable<ItemIdentity> {

    private static final Comparator<ItemIdentity> ORDER = Comparator
            .comparing(ItemIdentity::tenantId)
            .thenComparing(ItemIdentity::mailboxId)
            .thenComparing(ItemIdentity::providerItemId)
            .thenComparingInt(i -> i.kind().id());

    public static final int MAX_TENANT_ID_LENGTH = 255;
    public static final int MAX_MAILBOX_ID_LENGTH = 255;
    public static final int MAX_PROVIDER_ITEM_ID_LENGTH = 512;

    public ItemIdentity {
        requireText(tenantId, "tenantId", MAX_TENANT_ID_LENGTH);
        requireText(mailboxId, "mailboxId", MAX_MAILBOX_ID_LENGTH);
        requireText(providerItemId, "providerItemId", MAX_PROVIDER_ITEM_ID_LENGTH);
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    public static ItemIdentity message(String tenantId, String mailboxId, String providerItemId) {
        return new ItemIdentity(tenantId, mailboxId, providerItemId, ItemKind.MESSAGE);
    }

    public static ItemIdentity attachment(String tenantId, String mailboxId, String providerItemId) {
        return new ItemIdentity(tenantId, mailboxId, providerItemId, ItemKind.ATTACHMENT);
    }

    @Override
    public int compareTo(ItemIdentity other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return tenantId + "/" + mailboxId + "/" + kind.label() + ":" + providerItemId;
    }

    private static void requireText(String value, String name, int maxLength) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be blank");
        }
        if (value.length() > maxLength) {
            throw new IllegalArgumentException(
                    name + " longer than " + maxLength + " characters: " + value.length());
        }
    }
}
