package com.shopmate.backend.modules.shop.domain;

import java.util.List;
import java.util.Random;

/**
 * Texts used for the shop-open broadcast.
 */
public final class ShopOpenMessages {

    public static final String FORMAL = "The shop is now open.";

    public static final List<String> CASUAL = List.of(
            "Shop portal detached from frame alignment (shop open)",
            "Workroom barrier rotated off-axis from jamb (facility accessible)",
            "Workshop door decoupled from its seal (shop active)",
            "Maker-space barrier angularly displaced from frame (open condition)",
            "Door-frame interface disengaged (workspace open)",
            "Access panel rotated beyond 0-10 degree threshold (shop open)",
            "Entry barrier uncompressed from gasket (facility open)",
            "Primary door unengaged from strike plate (shop accessible)",
            "Ingress point mechanically liberated from frame (room open)",
            "Entrance panel no longer flush with threshold (open state achieved)",
            "Portal hinge system mobilized; access vector unobstructed (shop open)",
            "Entry mechanism actuated into the unsealed configuration (space open)",
            "Door-frame cohesion reduced to negligible levels (shop accessible)",
            "Barrier rotation > 1 radian detected (workspace open)",
            "Ingress aperture expanded beyond secure bounds (shop open)",
            "Physical access impedance minimized (facility open)",
            "Portal integrity intentionally compromised (open mode active)",
            "Threshold obstruction set to null (workspace open)",
            "Door has divorced the frame - irreconcilable openness achieved",
            "The door and frame are on a break (shop open)",
            "Portal is vibing away from the frame (shop open)",
            "Door reoriented into welcoming position (shop open)",
            "Barrier is expressing its extroverted phase (shop open)",
            "Door is in open world mode (shop open)",
            "Entry panel socially distancing from frame (shop open)"
    );

    private ShopOpenMessages() {
    }

    /**
     * Opening line without the name of the member who opened the shop.
     */
    public static String openLine(AnnouncementMode mode, Random random) {
        if (mode == AnnouncementMode.FORMAL) {
            return FORMAL;
        }
        return CASUAL.get(random.nextInt(CASUAL.size())) + ".";
    }
}
