package com.testweaver.locator;

import com.testweaver.core.ExecutionListener;
import com.testweaver.driver.BrowserDriver;
import com.testweaver.driver.ElementHandle;
import com.testweaver.driver.MalformedSelectorException;
import com.testweaver.model.StructureHint;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Turns a human-named target into one element on the page.
 *
 * ## Budget
 *
 *   1. Every tier's candidates are enumerated up front (no browser calls) and
 *      de-duplicated, keeping the first occurrence.
 *   2. The total timeout is sliced evenly: {@code slice = total / candidateCount}.
 *   3. Each probe waits at most {@code min(slice, remaining)}.
 *   4. Probing stops as soon as the deadline passes.
 *
 * Wall-clock time is therefore bounded by the total timeout plus per-probe call
 * overhead, however many tiers or candidates there are. The first candidate is
 * always probed, even with a zero budget.
 *
 * ## Faults
 *
 *   - An absent element is an empty probe, never an exception.
 *   - A selector the browser rejects as malformed is skipped and reported.
 *   - Any other driver fault propagates to the caller.
 *
 * Interactability is not checked here; step handlers do that.
 */
public class ElementResolver {

    private final BrowserDriver     driver;
    private final StrategyRegistry  strategies;
    private final ExecutionListener listener;

    public ElementResolver(BrowserDriver driver, StrategyRegistry strategies, ExecutionListener listener) {
        this.driver     = driver;
        this.strategies = strategies;
        this.listener   = listener != null ? listener : ExecutionListener.NOOP;
    }

    public ElementResolver(BrowserDriver driver) {
        this(driver, new StrategyRegistry(), ExecutionListener.NOOP);
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    public ElementHandle resolve(String target, List<StructureHint> hints, long totalTimeoutMs) {
        return resolve(new ResolutionRequest(target, hints), totalTimeoutMs);
    }

    /**
     * Resolves the request inside {@code totalTimeoutMs}.
     *
     * @throws ElementNotFoundException when no candidate matched before the deadline
     */
    public ElementHandle resolve(ResolutionRequest request, long totalTimeoutMs) {
        String target = request.getTarget();
        List<SelectorCandidate> plan = plan(request);
        if (plan.isEmpty()) {
            listener.onResolutionFailed(target, 0, 0);
            throw new ElementNotFoundException(target, 0, 0, suggest(request, plan));
        }

        long budgetMs   = Math.max(0, totalTimeoutMs);
        long sliceMs    = budgetMs / plan.size();
        long start      = System.nanoTime();
        long deadline   = start + TimeUnit.MILLISECONDS.toNanos(budgetMs);
        int  attempted  = 0;

        for (SelectorCandidate candidate : plan) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (attempted > 0 && remainingMs <= 0) break;

            long waitMs = Math.max(0, Math.min(sliceMs, remainingMs));
            attempted++;
            listener.onProbe(target, candidate, waitMs);
            try {
                Optional<ElementHandle> found =
                    driver.findCandidate(candidate.getKind(), candidate.getValue(), Duration.ofMillis(waitMs));
                if (found.isPresent()) {
                    listener.onResolved(target, candidate, attempted, plan.size());
                    return found.get();
                }
            } catch (MalformedSelectorException e) {
                listener.onMalformedSelector(target, candidate, e.getMessage());
            }
        }

        listener.onResolutionFailed(target, attempted, plan.size());
        throw new ElementNotFoundException(target, attempted, plan.size(), suggest(request, plan));
    }

    /**
     * The full, de-duplicated probe order for a request, tier by tier.
     */
    public List<SelectorCandidate> plan(ResolutionRequest request) {
        Set<SelectorCandidate> ordered = new LinkedHashSet<>();
        for (StrategyRegistry.Tier tier : strategies.getTiers()) {
            tier.getStrategy().candidates(request).forEach(ordered::add);
        }
        return new ArrayList<>(ordered);
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    /**
     * A hint sharing at least one word with the target whose selector was not
     * already in the plan. Looser than the hint tier's substring match.
     */
    private static String suggest(ResolutionRequest request, List<SelectorCandidate> plan) {
        Set<String> targetWords = words(request.getTarget());
        Set<String> planned = plan.stream().map(SelectorCandidate::getValue).collect(Collectors.toSet());
        for (StructureHint hint : request.getHints()) {
            if (planned.contains(hint.getSelector())) continue;
            Set<String> hintWords = words(hint.getKeyword());
            hintWords.retainAll(targetWords);
            if (!hintWords.isEmpty()) {
                return hint.getSelector();
            }
        }
        return null;
    }

    private static Set<String> words(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
            .filter(w -> w.length() > 1)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
