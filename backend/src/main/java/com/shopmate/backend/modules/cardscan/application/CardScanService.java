package com.shopmate.backend.modules.cardscan.application;

import java.util.Optional;

import com.shopmate.backend.modules.cardscan.domain.CardScanResult;
import com.shopmate.backend.modules.member.domain.Member;
import com.shopmate.backend.modules.member.infrastructure.MemberRegistry;
import com.shopmate.backend.modules.shop.application.ShopActivityService;
import com.shopmate.backend.modules.shop.application.ShopActivityService.Toggle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CardScanService {

    private static final Logger log = LoggerFactory.getLogger(CardScanService.class);

    private final MemberRegistry memberRegistry;
    private final ShopActivityService shopActivityService;

    public CardScanService(MemberRegistry memberRegistry, ShopActivityService shopActivityService) {
        this.memberRegistry = memberRegistry;
        this.shopActivityService = shopActivityService;
    }

    /**
     * Checks the card's owner out if present, in otherwise.
     *
     * @throws com.shopmate.backend.global.error.ProblemException when the ledger rejects the transition
     */
    public CardScanResult scan(String rawUid) {
        String uid = Member.normalizeCardUid(rawUid);
        Optional<Member> member = uid.isEmpty() ? Optional.empty() : memberRegistry.findByCardUid(uid);
        if (member.isEmpty()) {
            log.info("Scan of unknown card {}", uid);
            return CardScanResult.unknown(uid);
        }

        Toggle toggle = shopActivityService.toggle(member.get());
        String name = member.get().displayName();
        return toggle.isCheckIn() ? CardScanResult.checkedIn(uid, name) : CardScanResult.checkedOut(uid, name);
    }
}
