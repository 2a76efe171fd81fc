package com.example.Battery_Operating_Plan.service;

import com.example.Battery_Operating_Plan.model.AncillaryService;
import com.example.Battery_Operating_Plan.model.AsCommitment;
import com.example.Battery_Operating_Plan.model.Plan;
import com.example.Battery_Operating_Plan.model.PlanHour;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Overlays ancillary service awards onto a generated plan
 *
 * Only one product is applied per hour, chosen by an ordered priority list
 * (regulation, then RRS, then ECRS by default):
 * - Regulation: status ONREG, planned MW set to 0 (energy neutral)
 * - RRS / ECRS: status ONRR / ONECRS, min SOC raised to hold the reserve energy
 */
@Service
public class AncillaryCommitmentApplier {

    private static final Logger logger = LoggerFactory.getLogger(AncillaryCommitmentApplier.class);

    private final List<AncillaryService> priority;

    public AncillaryCommitmentApplier() {
        this(AncillaryService.DEFAULT_PRIORITY);
    }

    public AncillaryCommitmentApplier(List<AncillaryService> priority) {
        this.priority = List.copyOf(priority);
    }

    public List<AncillaryService> getPriority() {
        return priority;
    }

    /**
     * Apply commitments to a copy of the plan
     *
     * @param plan Plan to overlay; left untouched
     * @param commitments Awards keyed by hour; hours absent from the plan are ignored
     * @return Overlaid copy
     */
    public Plan apply(Plan plan, Map<LocalDateTime, AsCommitment> commitments) {
        Plan result = plan.copy();
        if (commitments == null || commitments.isEmpty()) {
            return result;
        }

        Map<LocalDateTime, PlanHour> hoursByTime = new HashMap<>();
        result.hours.forEach(hour -> hoursByTime.put(hour.hourEnding, hour));

        int applied = 0;
        for (Map.Entry<LocalDateTime, AsCommitment> entry : commitments.entrySet()) {
            PlanHour hour = hoursByTime.get(entry.getKey());
            if (hour == null || entry.getValue() == null) {
                logger.debug("Ignoring AS commitment outside plan horizon: {}", entry.getKey());
                continue;
            }
            if (applyToHour(hour, entry.getValue())) {
                applied++;
            }
        }

        logger.info("Applied AS commitments to {} of {} hours for {}", applied, result.size(), result.resourceName);
        return result;
    }

    private boolean applyToHour(PlanHour hour, AsCommitment commitment) {
        for (AncillaryService service : priority) {
            double mw = service.committedMw(commitment);
            if (mw <= 0) {
                continue;
            }

            hour.status = service.getStatus();
            if (service == AncillaryService.REGULATION) {
                hour.setTarget(0.0);
            } else {
                double reserve = mw * service.getReserveHours();
                hour.socMin = hour.socMin != null ? Math.max(hour.socMin, reserve) : reserve;
            }

            logger.debug("Hour {}: {} {}MW -> status {}", hour.hourEnding, service, mw, hour.status);
            return true;
        }
        return false;
    }
}
