/**
 * Value types shared by the store, the ingestion pipeline and the API:
 * item identities, tenant scopes and the enums persisted by numeric id.
 */
package com.libragraph.mailbackup.types;
