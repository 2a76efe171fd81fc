package com.example.Battery_Operating_Plan.service;

import com.example.Battery_Operating_Plan.model.Plan;
import com.example.Battery_Operating_Plan.model.PlanHour;
import com.example.Battery_Operating_Plan.model.ResourceProfile;
import com.example.Battery_Operating_Plan.model.SocSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * SOC Feasibility Enforcement
 *
 * Repairs a beginning-of-hour SOC trajectory so that every hour-to-hour change
 * is physically achievable by the battery:
 * - Charge per hour limited by |LSL| * efficiency and the headroom to max SOC
 * - Discharge per hour limited by HSL and the energy above min SOC
 *
 * Infeasible steps are clamped and the planned MW of the hour is forced to full
 * charge/discharge power. Violations are never raised: the repaired plan is the output.
 * Running the repair on its own output changes nothing.
 */
@Service
public class FeasibilityEnforcer {

    private static final Logger logger = LoggerFactory.getLogger(FeasibilityEnforcer.class);

    /**
     * Repair a standalone SOC sequence
     *
     * @param input SOC values with the planned MW of each hour
     * @param profile Resource limits
     * @return New sequence; repairCount holds the number of clamped transitions
     */
    public SocSequence enforce(SocSequence input, ResourceProfile profile) {
        double[] soc = input.getSocBegin();
        double[] target = input.getTargetMw();

        int repairs = repair(soc, target, profile);

        return new SocSequence(soc, target, repairs);
    }

    /**
     * Repair the SOC trajectory of a plan in place
     * Hours without a SOC value are treated as hold at the previous level.
     *
     * @return Number of clamped transitions
     */
    public int enforce(Plan plan, ResourceProfile profile) {
        int size = plan.size();
        double[] soc = new double[size];
        double[] target = new double[size];

        for (int i = 0; i < size; i++) {
            PlanHour hour = plan.hour(i);
            soc[i] = hour.socBegin != null ? hour.socBegin : (i > 0 ? soc[i - 1] : profile.getMinSoc());
            target[i] = hour.targetOrZero();
        }

        int repairs = repair(soc, target, profile);

        for (int i = 0; i < size; i++) {
            PlanHour hour = plan.hour(i);
            hour.socBegin = soc[i];
            if (target[i] != hour.targetOrZero()) {
                hour.setTarget(target[i]);
            }
        }

        if (repairs > 0) {
            logger.info("Feasibility enforcement repaired {} of {} transitions for {}",
                    repairs, Math.max(0, size - 1), plan.resourceName);
        }
        return repairs;
    }

    /**
     * Maximum SOC increase achievable in one hour starting from the given SOC (MWh)
     */
    public static double maxCharge(double soc, ResourceProfile profile) {
        return Math.min(profile.getHourlyChargeEnergy(), profile.getMaxSoc() - soc);
    }

    /**
     * Maximum SOC decrease achievable in one hour starting from the given SOC (MWh)
     */
    public static double maxDischarge(double soc, ResourceProfile profile) {
        return Math.min(profile.getHsl(), soc - profile.getMinSoc());
    }

    private int repair(double[] soc, double[] target, ResourceProfile profile) {
        if (soc.length == 0) {
            return 0;
        }

        double minSoc = profile.getMinSoc();
        double maxSoc = profile.getMaxSoc();
        int repairs = 0;

        for (int i = 0; i < soc.length - 1; i++) {
            double current = soc[i];
            double change = soc[i + 1] - current;

            double chargeLimit = maxCharge(current, profile);
            double dischargeLimit = maxDischarge(current, profile);

            if (change > chargeLimit) {
                soc[i + 1] = current + chargeLimit;
                target[i] = profile.getLsl();
                repairs++;
                logger.warn("Adjusted SOC at hour {} - infeasible charge ({} MWh requested, {} MWh possible)",
                        i + 1, String.format("%.2f", change), String.format("%.2f", chargeLimit));
            } else if (change < -dischargeLimit) {
                soc[i + 1] = current - dischargeLimit;
                target[i] = profile.getHsl();
                repairs++;
                logger.warn("Adjusted SOC at hour {} - infeasible discharge ({} MWh requested, {} MWh possible)",
                        i + 1, String.format("%.2f", -change), String.format("%.2f", dischargeLimit));
            }
        }

        for (int i = 0; i < soc.length; i++) {
            soc[i] = clip(soc[i], minSoc, maxSoc);
        }
        return repairs;
    }

    private static double clip(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
