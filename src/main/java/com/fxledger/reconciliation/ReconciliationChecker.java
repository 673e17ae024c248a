package com.fxledger.reconciliation;

import com.fxledger.domain.model.BalanceCheck;
import com.fxledger.domain.model.PositionSummary;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Compares computed end-of-period balances with the balances declared by the broker.
 *
 * <p>The comparison is an outer join on ticker. A ticker is sufficient when
 * <ul>
 *   <li>its computed balance equals the declared one, or</li>
 *   <li>its computed balance is zero and nothing is declared for it.</li>
 * </ul>
 * A ticker that is declared but never traded has no computed balance and is always insufficient.
 */
@Service
public class ReconciliationChecker {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationChecker.class);

    public static boolean isSufficient(Long computed, Long declared) {
        if (computed == null) {
            return false;
        }
        if (declared == null) {
            return computed == 0L;
        }
        return Objects.equals(computed, declared);
    }

    /** One check per ticker present on either side, ordered by ticker. */
    public List<BalanceCheck> check(List<PositionSummary> positions, Map<String, Long> declaredBalances) {
        Map<String, Long> computed = new TreeMap<>();
        for (PositionSummary position : positions) {
            computed.put(position.getTicker(), position.getSignedBalance());
        }
        Map<String, Long> declared = declaredBalances == null ? Map.of() : declaredBalances;

        TreeSet<String> tickers = new TreeSet<>(computed.keySet());
        tickers.addAll(declared.keySet());

        return tickers.stream()
                .map(ticker -> {
                    Long computedBalance = computed.get(ticker);
                    Long declaredBalance = declared.get(ticker);
                    return BalanceCheck.builder()
                            .ticker(ticker)
                            .computedBalance(computedBalance)
                            .declaredBalance(declaredBalance)
                            .sufficient(isSufficient(computedBalance, declaredBalance))
                            .build();
                })
                .toList();
    }

    /** The failing subset of {@link #check}. */
    public List<BalanceCheck> insufficient(List<PositionSummary> positions, Map<String, Long> declaredBalances) {
        List<BalanceCheck> failing = check(positions, declaredBalances).stream()
                .filter(c -> !c.isSufficient())
                .toList();
        if (!failing.isEmpty()) {
            log.info(
                    "Reconciliation: {} tickers disagree with declared balances: {}",
                    failing.size(),
                    failing.stream().map(BalanceCheck::getTicker).toList());
        }
        return failing;
    }
}
