package com.example.Battery_Operating_Plan.service;

import com.example.Battery_Operating_Plan.config.PlanningProperties;
import com.example.Battery_Operating_Plan.exception.InvalidProfileException;
import com.example.Battery_Operating_Plan.model.AsCommitment;
import com.example.Battery_Operating_Plan.model.Plan;
import com.example.Battery_Operating_Plan.model.PlanHour;
import com.example.Battery_Operating_Plan.model.ResourceProfile;
import com.example.Battery_Operating_Plan.model.ResourceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Current Operating Plan Generator
 *
 * Builds an hourly plan for one battery resource:
 * 1. Hourly skeleton (status ON, sustained limits)
 * 2. Planned MW per hour, either from the default diurnal pattern or from a price forecast
 * 3. SOC trajectory derived from the planned MW
 * 4. Feasibility repair of the trajectory
 * 5. Optional ancillary service overlay
 * 6. Static COP fields
 *
 * Stateless: every call owns the plan it returns, so resources can be planned in parallel.
 */
@Service
public class OperatingPlanGenerator {

    private static final Logger logger = LoggerFactory.getLogger(OperatingPlanGenerator.class);

    private final PlanningProperties properties;
    private final FeasibilityEnforcer feasibilityEnforcer;
    private final AncillaryCommitmentApplier commitmentApplier;
    private final PlanAssembler planAssembler;

    public OperatingPlanGenerator(PlanningProperties properties,
                                  FeasibilityEnforcer feasibilityEnforcer,
                                  AncillaryCommitmentApplier commitmentApplier,
                                  PlanAssembler planAssembler) {
        this.properties = properties;
        this.feasibilityEnforcer = feasibilityEnforcer;
        this.commitmentApplier = commitmentApplier;
        this.planAssembler = planAssembler;
    }

    public Plan generate(ResourceProfile profile, LocalDateTime startTime, int horizonHours) {
        return generate(profile, startTime, horizonHours, null, null, null);
    }

    public Plan generate(ResourceProfile profile,
                         LocalDateTime startTime,
                         int horizonHours,
                         Map<LocalDateTime, Double> priceForecast,
                         Map<LocalDateTime, AsCommitment> asCommitments) {
        return generate(profile, startTime, horizonHours, priceForecast, asCommitments, null);
    }

    /**
     * Generate a plan
     *
     * @param profile Resource parameters
     * @param startTime First hour of the plan
     * @param horizonHours Number of hourly records
     * @param priceForecast Price per hour ($/MWh); null selects the default pattern, hours missing from it hold
     * @param asCommitments Ancillary service awards per hour, may be null
     * @param initialSoc SOC at the start of the first hour (MWh); null uses the configured fraction of max SOC
     * @return Repaired plan ready for validation
     * @throws InvalidProfileException if the profile is not physically meaningful
     */
    public Plan generate(ResourceProfile profile,
                         LocalDateTime startTime,
                         int horizonHours,
                         Map<LocalDateTime, Double> priceForecast,
                         Map<LocalDateTime, AsCommitment> asCommitments,
                         Double initialSoc) {
        Objects.requireNonNull(profile, "Resource profile cannot be null");
        Objects.requireNonNull(startTime, "Start time cannot be null");

        List<String> violations = profile.physicalViolations();
        if (!violations.isEmpty()) {
            throw new InvalidProfileException(profile.getResourceName(), violations);
        }
        if (horizonHours <= 0) {
            throw new IllegalArgumentException("Horizon must be at least one hour, was " + horizonHours);
        }

        Plan plan = buildSkeleton(profile, startTime, horizonHours);

        if (priceForecast != null) {
            applyPriceSignals(plan, profile, priceForecast);
        } else {
            applyDefaultPattern(plan, profile);
        }

        double startSoc = initialSoc != null ? initialSoc : profile.getMaxSoc() * properties.getInitialSocFraction();
        calculateSocTrajectory(plan, profile, startSoc);

        feasibilityEnforcer.enforce(plan, profile);
        updateSocBracket(plan, profile);

        if (asCommitments != null && !asCommitments.isEmpty()) {
            plan = commitmentApplier.apply(plan, asCommitments);
        }

        planAssembler.assemble(plan, profile);

        logger.info("Generated {} plan for {}: {} hours from {}",
                priceForecast != null ? "price-based" : "default", profile.getResourceName(), plan.size(), startTime);
        return plan;
    }

    private Plan buildSkeleton(ResourceProfile profile, LocalDateTime startTime, int horizonHours) {
        List<PlanHour> hours = new ArrayList<>(horizonHours);
        for (int i = 0; i < horizonHours; i++) {
            PlanHour hour = new PlanHour(startTime.plusHours(i), ResourceStatus.ON);
            hour.hsl = profile.getHsl();
            hour.lsl = profile.getLsl();
            hours.add(hour);
        }
        return new Plan(profile.getResourceName(), hours);
    }

    /**
     * Default diurnal pattern: charge overnight, hold in the morning,
     * discharge over the afternoon peak, hold otherwise.
     */
    private void applyDefaultPattern(Plan plan, ResourceProfile profile) {
        for (PlanHour hour : plan.hours) {
            int hourOfDay = hour.hourEnding.getHour();

            if (hourOfDay >= properties.getChargeStartHour() && hourOfDay < properties.getChargeEndHour()) {
                hour.setTarget(profile.getLsl() * properties.getChargeFactor());
            } else if (hourOfDay >= properties.getDischargeStartHour() && hourOfDay < properties.getDischargeEndHour()) {
                hour.setTarget(profile.getHsl() * properties.getDischargeFactor());
            } else {
                hour.setTarget(0.0);
            }
        }
    }

    /**
     * Threshold rule on the forecast price of each hour
     */
    private void applyPriceSignals(Plan plan, ResourceProfile profile, Map<LocalDateTime, Double> priceForecast) {
        int priced = 0;
        for (PlanHour hour : plan.hours) {
            Double price = priceForecast.get(hour.hourEnding);
            if (price == null || price.isNaN()) {
                hour.setTarget(0.0);
                continue;
            }
            priced++;
            hour.setTarget(targetForPrice(price, profile));
        }
        logger.debug("Price forecast covers {} of {} plan hours", priced, plan.size());
    }

    /**
     * Planned MW for a price ($/MWh)
     */
    public double targetForPrice(double price, ResourceProfile profile) {
        if (price > properties.getFullDischargePrice()) {
            return profile.getHsl();
        }
        if (price < properties.getFullChargePrice()) {
            return profile.getLsl();
        }
        if (price > properties.getPartialDischargePrice()) {
            return profile.getHsl() * properties.getPartialDischargeFactor();
        }
        return 0.0;
    }

    /**
     * Beginning SOC of each hour from the planned MW of the previous hour.
     * Charging is discounted by round-trip efficiency, discharging is not.
     */
    void calculateSocTrajectory(Plan plan, ResourceProfile profile, double initialSoc) {
        double soc = initialSoc;
        for (int i = 0; i < plan.size(); i++) {
            if (i > 0) {
                double previousTarget = plan.hour(i - 1).targetOrZero();
                double socChange;
                if (previousTarget > 0) {
                    socChange = -previousTarget;
                } else if (previousTarget < 0) {
                    socChange = -previousTarget * profile.getRoundTripEfficiency();
                } else {
                    socChange = 0.0;
                }
                soc += socChange;
            }
            plan.hour(i).socBegin = soc;
        }
        updateSocBracket(plan, profile);
    }

    /**
     * Working SOC bracket: what the hour could reach at full discharge / full charge
     */
    private void updateSocBracket(Plan plan, ResourceProfile profile) {
        for (PlanHour hour : plan.hours) {
            hour.socMin = Math.max(profile.getMinSoc(), hour.socBegin - profile.getHsl());
            hour.socMax = Math.min(profile.getMaxSoc(), hour.socBegin + profile.getHourlyChargeEnergy());
        }
    }
}
