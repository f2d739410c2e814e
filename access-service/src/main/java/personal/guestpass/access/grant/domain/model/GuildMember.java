package personal.guestpass.access.grant.domain.model;

import java.util.Set;

/**
 * Guild에 속한 멤버
 *
 * @param roleIds 멤버가 가진 역할 ID
 */
public record GuildMember(String guildId, String accountId, String username, Set<String> roleIds) {

    public GuildMember {
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
    }

    public boolean hasRole(String roleId) {
        return roleIds.contains(roleId);
    }
}
