package com.fraud.analytics.api;

import com.fraud.analytics.domain.RiskVerdict;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * In-memory store of the last N HIGH/CRITICAL verdicts for the REST API, newest first.
 */
@Component
public class RecentAlertsStore {

    static final int MAX_RECENT = 100;
    private final ConcurrentLinkedDeque<RiskVerdict> recent = new ConcurrentLinkedDeque<>();

    public void addAll(List<RiskVerdict> alerts) {
        // highest score of the batch ends up first
        for (int i = alerts.size() - 1; i >= 0; i--) {
            recent.addFirst(alerts.get(i));
        }
        while (recent.size() > MAX_RECENT) recent.removeLast();
    }

    public List<RiskVerdict> getRecent(int limit) {
        List<RiskVerdict> out = new ArrayList<>();
        for (RiskVerdict v : recent) {
            if (out.size() >= limit) break;
            out.add(v);
        }
        return out;
    }
}
