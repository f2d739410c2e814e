package personal.guestpass.access.grant.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * 외부 커뮤니티 공간 (Discord Guild)
 *
 * @param roles Guild 에 정의된 역할 목록
 */
public record Guild(String id, String name, List<GuildRole> roles) {

    public Guild {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public Optional<GuildRole> findRoleById(String roleId) {
        return roles.stream()
                .filter(role -> role.id().equals(roleId))
                .findFirst();
    }

    public Optional<GuildRole> findRoleByName(String roleName) {
        return roles.stream()
                .filter(role -> role.name().equals(roleName))
                .findFirst();
    }
}
