package com.libragraph.mailbackup.core.tenant;

import com.libragraph.mailbackup.core.dao.TenantRecord;
import com.libragraph.mailbackup.core.testing.EmbeddedDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TenantRegistryTest {

    TenantRegistry registry;

    @BeforeEach
    void setUp() {
        registry = TenantFixtures.tenantRegistry(EmbeddedDatabase.create());
    }

    @Test
    void registerCreatesActiveTenant() {
        TenantRecord tenant = registry.register("contoso", "Contoso Ltd");

        assertThat(tenant.id()).isEqualTo("contoso");
        assertThat(tenant.name()).isEqualTo("Contoso Ltd");
        assertThat(tenant.active()).isTrue();
        assertThat(registry.listActive()).extracting(TenantRecord::id).containsExactly("contoso");
    }

    @Test
    void registerWithoutNameUsesId() {
        assertThat(registry.register("fabrikam", null).name()).isEqualTo("fabrikam");
    }

    @Test
    void registerTwiceIsIdempotent() {
        registry.register("contoso", "Contoso");
        registry.register("contoso", "Contoso");

        assertThat(registry.listAll()).hasSize(1);
    }

    @Test
    void deactivateExcludesFromActiveButKeepsRecord() {
        registry.register("contoso", "Contoso");
        registry.register("fabrikam", "Fabrikam");

        registry.deactivate("contoso");
        registry.deactivate("contoso");

        assertThat(registry.listActive()).extracting(TenantRecord::id).containsExactly("fabrikam");
        assertThat(registry.listAll()).hasSize(2);
        assertThat(registry.find("contoso")).map(TenantRecord::active).hasValue(false);
        assertThatThrownBy(() -> registry.requireActive("contoso"))
                .isInstanceOf(TenantNotFoundException.class);
    }

    @Test
    void registerReactivatesDeactivatedTenant() {
        registry.register("contoso", "Contoso");
        registry.deactivate("contoso");

        TenantRecord back = registry.register("contoso", "Contoso Group");

        assertThat(back.active()).isTrue();
        assertThat(back.name()).isEqualTo("Contoso Group");
        assertThat(registry.requireActive("contoso").id()).isEqualTo("contoso");
    }

    @Test
    void renameChangesDisplayName() {
        registry.register("contoso", "Contoso");

        assertThat(registry.rename("contoso", "Contoso Group").name()).isEqualTo("Contoso Group");
    }

    @Test
    void unknownTenantOperationsThrowNotFound() {
        assertThatThrownBy(() -> registry.deactivate("ghost")).isInstanceOf(TenantNotFoundException.class);
        assertThatThrownBy(() -> registry.rename("ghost", "x")).isInstanceOf(TenantNotFoundException.class);
        assertThatThrownBy(() -> registry.requireActive("ghost")).isInstanceOf(TenantNotFoundException.class);
        assertThatThrownBy(() -> registry.register(" ", "x")).isInstanceOf(IllegalArgumentException.class);
    }
}
