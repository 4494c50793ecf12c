package com.leadranker.common.fitness;

import java.util.ArrayList;
import java.util.List;

/**
 * Error breakdown of one evaluation. "Too high" means the predicted rank number
 * is smaller (better) than the label, "too low" the opposite.
 */
public record ErrorPatterns(int falsePositives, int falseNegatives, int rankTooHigh, int rankTooLow) {

    public boolean isEmpty() {
        return falsePositives == 0 && falseNegatives == 0 && rankTooHigh == 0 && rankTooLow == 0;
    }

    /** One improvement hint per non-zero counter, in a fixed order. Consumed by the mutation operator. */
    public List<String> hints() {
        List<String> hints = new ArrayList<>(4);
        if (falsePositives > 0) {
            hints.add("- Marking " + falsePositives + " irrelevant leads as relevant. "
                + "Be stricter about excluding HR, Finance, Engineering, and other non-sales roles.");
        }
        if (falseNegatives > 0) {
            hints.add("- Missing " + falseNegatives + " relevant leads (marking them as irrelevant). "
                + "Be more inclusive of sales-adjacent roles.");
        }
        if (rankTooHigh > 0) {
            hints.add("- Ranking " + rankTooHigh + " leads too highly (predicted rank lower than actual). "
                + "Be more conservative with top rankings.");
        }
        if (rankTooLow > 0) {
            hints.add("- Ranking " + rankTooLow + " leads too low (predicted rank higher than actual). "
                + "Better recognize high-value titles.");
        }
        return hints;
    }
}
