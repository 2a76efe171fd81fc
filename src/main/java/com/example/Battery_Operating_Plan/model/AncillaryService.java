package com.example.Battery_Operating_Plan.model;

import java.util.List;

/**
 * Ancillary service products a battery can be committed to, with the status
 * they put the resource in and the hours of energy they hold back.
 */
public enum AncillaryService {

    REGULATION(ResourceStatus.ONREG, 0.0),
    RESPONSIVE_RESERVE(ResourceStatus.ONRR, 1.0),
    ECRS(ResourceStatus.ONECRS, 2.0);

    /**
     * Overlay order when one hour carries several commitments: first product with MW > 0 wins.
     */
    public static final List<AncillaryService> DEFAULT_PRIORITY =
            List.of(REGULATION, RESPONSIVE_RESERVE, ECRS);

    private final ResourceStatus status;
    private final double reserveHours;

    AncillaryService(ResourceStatus status, double reserveHours) {
        this.status = status;
        this.reserveHours = reserveHours;
    }

    public ResourceStatus getStatus() {
        return status;
    }

    /**
     * Hours of energy at the committed MW that must stay in the battery.
     * Regulation is treated as energy neutral and reserves nothing.
     */
    public double getReserveHours() {
        return reserveHours;
    }

    public double committedMw(AsCommitment commitment) {
        switch (this) {
            case REGULATION:
                return commitment.regulationMw;
            case RESPONSIVE_RESERVE:
                return commitment.responsiveReserveMw;
            case ECRS:
                return commitment.ecrsMw;
            default:
                return 0.0;
        }
    }
}
