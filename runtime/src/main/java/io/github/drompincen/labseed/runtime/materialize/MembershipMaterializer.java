package io.github.drompincen.labseed.runtime.materialize;

import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.protocol.document.MemberSpec;
import io.github.drompincen.labseed.protocol.document.UserSpec;
import io.github.drompincen.labseed.runtime.context.RunContext;
import io.github.drompincen.labseed.runtime.platform.Container;
import io.github.drompincen.labseed.runtime.platform.PlatformClient;
import io.github.drompincen.labseed.runtime.platform.RemoteRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Resolves declared users to platform accounts and grants container memberships.
 * Users are never created; an unknown handle leaves the user unregistered.
 */
@Service
public class MembershipMaterializer {

    private static final Logger log = LoggerFactory.getLogger(MembershipMaterializer.class);

    private final PlatformClient client;

    public MembershipMaterializer(PlatformClient client) {
        this.client = client;
    }

    public void resolveUsers(RunContext ctx, List<UserSpec> users) {
        RemoteRef me = null;
        for (UserSpec user : users) {
            String subject = "'" + user.username() + "' (" + user.id() + ")";
            Optional<RemoteRef> account;
            if (user.isCurrentUser()) {
                if (me == null) {
                    me = client.currentUser();
                }
                account = Optional.of(me);
            } else {
                account = client.findUser(user.handle());
            }
            if (account.isEmpty()) {
                ctx.report().skipped(EntityKind.USER, subject, "no account with that username");
                continue;
            }
            ctx.registry().register(EntityKind.USER, user.id(), account.get());
            log.info("Resolved user {} to account {} ({})", subject, account.get().name(), account.get().id());
        }
    }

    /**
     * Grants each member its role's access level unless it already has at least that
     * level, directly or inherited.
     */
    public void grant(RunContext ctx, Container container, List<MemberSpec> members) {
        for (MemberSpec member : members) {
            String subject = "'" + member.userId() + "' as " + member.role().name().toLowerCase();
            Optional<RemoteRef> user = ctx.registry().lookup(EntityKind.USER, member.userId());
            if (user.isEmpty()) {
                ctx.report().referenceGap(EntityKind.USER, member.userId(), "membership in " + container);
                continue;
            }
            int wanted = member.role().accessLevel();
            Optional<Integer> current = client.findMemberAccessLevel(container, user.get().id());
            if (current.isPresent() && current.get() >= wanted) {
                ctx.report().reused(EntityKind.MEMBER, subject, container.toString());
                continue;
            }
            client.addMember(container, user.get().id(), wanted);
            ctx.report().created(EntityKind.MEMBER, subject, container.toString());
        }
    }
}
