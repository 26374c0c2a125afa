package com.shopmate.backend.modules.member.infrastructure;

import java.util.List;
import java.util.Optional;

import com.shopmate.backend.modules.member.domain.Member;

/**
 * Read-only view of the member directory. Implementations refresh themselves so a lookup
 * always reflects the registry as of the current command.
 */
public interface MemberRegistry {

    Optional<Member> findByHandle(String handle);

    Optional<Member> findByCardUid(String cardUid);

    Optional<Member> findByName(String name);

    List<Member> all();
}
