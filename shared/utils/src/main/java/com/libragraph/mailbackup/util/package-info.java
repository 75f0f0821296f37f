/**
 * Shared utilities for all backup modules.
 *
 * <p>Contains {@link com.libragraph.mailbackup.util.ContentHash} (BLAKE3-256), the
 * content-only digest used as the deduplication key.
 * No framework dependencies.
 */
package com.libragraph.mailbackup.util;
