package com.imperium.identitygate.service;

import com.imperium.identitygate.config.RequestIdSupport;
import com.imperium.identitygate.model.entity.User;
import com.imperium.identitygate.model.entity.UserChannel;
import com.imperium.identitygate.model.identity.IdentityCommand;
import com.imperium.identitygate.model.identity.RegistrationResult;
import com.imperium.identitygate.model.identity.ResolvedIdentity;
import com.imperium.identitygate.model.identity.VerificationResult;
import com.imperium.identitygate.model.identity.VerifiedIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * /register、/verify、/whoami 的处理：调用 {@link IdentityResolver}，把结果格式化为回复文本。
 * 库不可用时统一回复一句简短提示，不向渠道暴露异常。
 */
@Service
public class IdentityCommandService {

    private static final Logger log = LoggerFactory.getLogger(IdentityCommandService.class);

    static final String UNKNOWN = "unknown";
    static final String UNAVAILABLE_TEXT = "Identity service is temporarily unavailable.";
    static final String VERIFY_TIP = "Tip: Use /verify <token> to link your app account for cross-channel access.";

    private final IdentityResolver identityResolver;

    public IdentityCommandService(IdentityResolver identityResolver) {
        this.identityResolver = identityResolver;
    }

    public String execute(IdentityCommand command, String channel, String senderId, String args) {
        String ch = blankToDefault(channel);
        String peer = blankToDefault(senderId);
        String trimmed = args != null ? args.trim() : "";
        try (RequestIdSupport.PeerScope ignored = RequestIdSupport.peer(ch, peer)) {
            return switch (command) {
                case REGISTER -> register(ch, peer, trimmed);
                case VERIFY -> verify(ch, peer, trimmed);
                case WHOAMI -> whoami(ch, peer);
            };
        } catch (StoreUnavailableException e) {
            log.warn("/{} unavailable for {}:{}: {}", command.commandName(), ch, peer, e.getMessage());
            return UNAVAILABLE_TEXT;
        }
    }

    private String register(String channel, String peerId, String args) {
        if (args.isEmpty()) {
            return "Usage: /register <first_name> <last_name>";
        }
        String[] parts = args.split("\\s+");
        String firstName = parts[0];
        String lastName = parts.length > 1 ? String.join(" ", List.of(parts).subList(1, parts.length)) : null;

        RegistrationResult result = identityResolver.register(channel, peerId, firstName, lastName);
        User user = result.user();
        String name = fullName(firstName, lastName);
        if (result.outcome() == RegistrationResult.Outcome.UPDATED) {
            return "Updated your name to " + name + "." + (user.isVerified() ? "" : "\n" + VERIFY_TIP);
        }
        return "Registered as " + name + ".\n"
                + "Your user ID: " + user.getId() + "\n"
                + VERIFY_TIP;
    }

    private String verify(String channel, String peerId, String token) {
        if (token.isEmpty()) {
            return "Usage: /verify <authorization_token>";
        }
        VerificationResult result = identityResolver.verify(channel, peerId, token);
        switch (result.outcome()) {
            case NOT_CONFIGURED:
                return "Token verification is not configured on this agent. Please contact the administrator.";
            case REJECTED:
                return "Token verification failed. Please check your token and try again.";
            case ALREADY_VERIFIED:
                String verifiedName = fullName(result.user().getFirstName(), result.user().getLastName());
                return "You're already verified" + (verifiedName.isEmpty() ? "" : " as " + verifiedName)
                        + ". No changes made.";
            default:
                break;
        }
        User user = result.user();
        VerifiedIdentity identity = result.identity();
        String name = fullName(
                user.getFirstName() != null ? user.getFirstName() : identity.firstName(),
                user.getLastName() != null ? user.getLastName() : identity.lastName());
        String channels = result.channels().stream()
                .map(c -> c.getChannel() + ":" + c.getChannelPeerId())
                .collect(Collectors.joining(", "));
        return "Identity verified! Welcome" + (name.isEmpty() ? "" : ", " + name) + ".\n"
                + "Your user ID: " + user.getId() + "\n"
                + "Linked channels: " + channels;
    }

    private String whoami(String channel, String peerId) {
        Optional<ResolvedIdentity> found = identityResolver.lookup(channel, peerId);
        if (found.isEmpty()) {
            return "You are not registered.\n"
                    + "Current channel: " + channel + "\n"
                    + "Channel ID: " + peerId + "\n\n"
                    + "Use /register <first_name> <last_name> or /verify <token> to set up your identity.";
        }
        ResolvedIdentity identity = found.get();
        List<UserChannel> channels = identityResolver.linkedChannels(identity.getId());
        String name = fullName(identity.getFirstName(), identity.getLastName());

        StringBuilder text = new StringBuilder();
        text.append("User ID: ").append(identity.getId()).append('\n');
        if (!name.isEmpty()) {
            text.append("Name: ").append(name).append('\n');
        }
        text.append("Verified: ").append(identity.isVerified() ? "yes" : "no").append('\n');
        if (identity.getExternalId() != null) {
            text.append("External ID: ").append(identity.getExternalId()).append('\n');
        }
        text.append("Linked channels:");
        for (UserChannel c : channels) {
            text.append("\n  - ").append(c.getChannel()).append(": ").append(c.getChannelPeerId());
        }
        return text.toString();
    }

    private static String fullName(String first, String last) {
        return ((first != null ? first : "") + " " + (last != null ? last : "")).trim();
    }

    private static String blankToDefault(String s) {
        return s == null || s.isBlank() ? UNKNOWN : s.trim();
    }
}
