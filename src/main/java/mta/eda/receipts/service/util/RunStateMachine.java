package mta.eda.receipts.service.util;

import mta.eda.receipts.model.schedule.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static mta.eda.receipts.model.schedule.RunState.*;

/**
 * RunStateMachine: allowed lifecycle transitions of a delivery scheduler run.
 *
 * IDLE → SCHEDULED → RUNNING → COMPLETED
 *                           ↘ CANCELLED
 *                           ↘ FAILED
 *
 * Rules:
 * 1. schedule() is accepted from IDLE, SCHEDULED (re-schedule) and every terminal state
 * 2. start() only moves SCHEDULED → RUNNING
 * 3. A running schedule ends in exactly one of COMPLETED, CANCELLED or FAILED
 * 4. Nothing can be scheduled while RUNNING
 */
public final class RunStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(RunStateMachine.class);

    private static final Map<RunState, Set<RunState>> ALLOWED = Map.of(
            IDLE, EnumSet.of(SCHEDULED),
            SCHEDULED, EnumSet.of(SCHEDULED, RUNNING),
            RUNNING, EnumSet.of(COMPLETED, CANCELLED, FAILED),
            COMPLETED, EnumSet.of(SCHEDULED),
            CANCELLED, EnumSet.of(SCHEDULED),
            FAILED, EnumSet.of(SCHEDULED)
    );

    private RunStateMachine() {}

    /**
     * @param current the state the scheduler is in
     * @param next    the requested state
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(RunState current, RunState next) {
        if (current == null || next == null) {
            return false;
        }
        boolean valid = ALLOWED.get(current).contains(next);
        if (!valid) {
            logger.warn("Invalid run transition: {} → {}", current, next);
        }
        return valid;
    }

    public static String describe() {
        return """
            Run lifecycle
            =============
            IDLE → SCHEDULED → RUNNING → COMPLETED | CANCELLED | FAILED

            - schedule() from IDLE, SCHEDULED or any terminal state
            - start() from SCHEDULED only; a second start() while RUNNING joins the run
            - stop() turns RUNNING into CANCELLED
            """;
    }
}
