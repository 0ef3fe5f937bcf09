package tech.flowcatalyst.resourcebridge.authorization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class PrincipalTest {

    @Test
    @DisplayName("effectivePermissions should be the union of direct and group grants")
    void effectivePermissions_shouldUnionGroups() {
        Permission view = Permission.of("author", PermissionAction.VIEW);
        Permission change = Permission.of("author", PermissionAction.CHANGE);
        PermissionGroup group = new PermissionGroup("editors", Set.of(change, view));

        Principal principal = new Principal("crd_1", null, "p", Set.of(view), List.of(group));

        assertThat(principal.effectivePermissions()).containsExactlyInAnyOrder(view, change);
    }

    @Test
    @DisplayName("parse should read the resource:action storage form")
    void parse_shouldRoundTripStorageForm() {
        Permission permission = Permission.parse("author:delete");

        assertThat(permission).isEqualTo(Permission.of("author", PermissionAction.DELETE));
        assertThat(permission.toStorageString()).isEqualTo("author:delete");
    }

    @Test
    @DisplayName("parse should reject unknown actions")
    void parse_shouldRejectUnknownAction() {
        assertThatThrownBy(() -> Permission.parse("author:publish"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
