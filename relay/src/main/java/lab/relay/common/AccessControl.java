package lab.relay.common;

import lab.relay.config.RelayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Explicit permission sets checked at each privileged entry point.
 */
@Component
@Slf4j
public class AccessControl {

    private final Map<Role, Set<String>> members = new EnumMap<>(Role.class);

    public AccessControl(RelayProperties properties) {
        RelayProperties.Roles roles = properties.getRoles();
        members.put(Role.ADMIN, normalize(roles.getAdmins()));
        members.put(Role.RELAYER, normalize(roles.getRelayers()));
        members.put(Role.ORACLE, normalize(roles.getOracles()));
        log.info(
                "event=access_control.loaded admins={} relayers={} oracles={}",
                members.get(Role.ADMIN).size(),
                members.get(Role.RELAYER).size(),
                members.get(Role.ORACLE).size()
        );
    }

    public boolean hasRole(Role role, String account) {
        return account != null && members.get(role).contains(account.trim().toLowerCase(Locale.ROOT));
    }

    public void require(Role role, String account) {
        if (!hasRole(role, account)) {
            String normalized = account == null ? "<anonymous>" : account.trim().toLowerCase(Locale.ROOT);
            log.warn("event=access_control.denied account={} role={}", normalized, role.roleName());
            throw new BridgeException(
                    ErrorCode.UNAUTHORIZED,
                    "AccessControl: account " + normalized + " is missing role " + role.roleName(),
                    Map.of("role", role.roleName())
            );
        }
    }

    private static Set<String> normalize(List<String> accounts) {
        if (accounts == null) {
            return Set.of();
        }
        return accounts.stream()
                .filter(a -> a != null && !a.isBlank())
                .map(a -> a.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
