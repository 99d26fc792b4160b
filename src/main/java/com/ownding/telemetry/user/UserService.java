package com.ownding.telemetry.user;

import com.ownding.telemetry.common.ApiException;
import com.ownding.telemetry.retention.TierResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;

@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);
    private static final String DEFAULT_TIER = "free";

    private final UserRepository userRepository;
    private final TierResolver tierResolver;

    public UserService(UserRepository userRepository, TierResolver tierResolver) {
        this.userRepository = userRepository;
        this.tierResolver = tierResolver;
    }

    public UserAccount getUser(long id) {
        return userRepository.findUserById(id)
                .orElseThrow(() -> ApiException.notFound("用户不存在"));
    }

    public UserAccount createUser(CreateUserCommand command) {
        if (userRepository.findUserByUsername(command.username()).isPresent()) {
            throw ApiException.conflict("用户名已存在");
        }
        try {
            return userRepository.createUser(command.username(), command.email(), normalizeTier(command.tier()));
        } catch (DuplicateKeyException ex) {
            throw ApiException.conflict("用户名已存在");
        }
    }

    public UserAccount changeTier(long id, ChangeTierCommand command) {
        UserAccount current = getUser(id);
        if (command.capOverride() != null && command.capOverride() < 1) {
            throw ApiException.badRequest("单设备保留上限必须大于0");
        }
        String subscriptionEnd = normalizeInstant(command.subscriptionEnd());
        String tier = normalizeTier(command.tier());
        userRepository.updateTier(id, tier, subscriptionEnd, command.capOverride());
        tierResolver.invalidate(id);
        log.info("user tier changed. userId={}, from={}, to={}, subscriptionEnd={}, capOverride={}",
                id, current.tier(), tier, subscriptionEnd, command.capOverride());
        return getUser(id);
    }

    private String normalizeTier(String tier) {
        if (tier == null || tier.isBlank()) {
            return DEFAULT_TIER;
        }
        return tier.trim().toLowerCase(Locale.ROOT);
    }

    private String normalizeInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim()).toString();
        } catch (DateTimeParseException ex) {
            throw ApiException.badRequest("订阅到期时间格式错误，需为 ISO-8601 UTC 时间");
        }
    }

    public record CreateUserCommand(String username, String email, String tier) {
    }

    public record ChangeTierCommand(String tier, String subscriptionEnd, Integer capOverride) {
    }
}
