package ai.holdem.game;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies five to seven cards into the best achievable {@link HandEvaluation}.
 * <p>
 * For more than five cards every five-card subset is scored with {@link #evaluate5(List)}
 * and the strongest one under {@link #compare(HandEvaluation, HandEvaluation)} is kept
 * (21 subsets for seven cards). Scoring a subset checks, in order:
 * <ol>
 *   <li>flush: all five suits equal;</li>
 *   <li>straight: five distinct ranks spanning four, or the wheel A-5-4-3-2 which plays as
 *       a five-high straight;</li>
 *   <li>rank groups ordered by (count desc, rank desc), which fixes kicker order.</li>
 * </ol>
 */
public final class HandEvaluator {
    private static final int HAND_SIZE = 5;
    private static final int MAX_CARDS = 7;

    private HandEvaluator() {
    }

    /**
     * Returns the best five-card hand contained in {@code cards}.
     *
     * @param cards five to seven distinct cards
     * @return the strongest evaluation over all five-card subsets
     * @throws IllegalArgumentException if fewer than five or more than seven cards are given
     */
    public static HandEvaluation evaluate(List<Card> cards) {
        if (cards == null || cards.size() < HAND_SIZE || cards.size() > MAX_CARDS) {
            throw new IllegalArgumentException(
                    "Need 5 to 7 cards to evaluate, got " + (cards == null ? 0 : cards.size()));
        }
        HandEvaluation best = null;
        for (List<Card> combo : combinations(cards, HAND_SIZE)) {
            HandEvaluation result = evaluate5(combo);
            if (best == null || compare(result, best) > 0) {
                best = result;
            }
        }
        return best;
    }

    /**
     * Scores exactly five cards.
     *
     * @param cards five cards
     * @return the category, tie-break values and the cards themselves
     */
    public static HandEvaluation evaluate5(List<Card> cards) {
        if (cards.size() != HAND_SIZE) {
            throw new IllegalArgumentException("evaluate5 needs exactly 5 cards, got " + cards.size());
        }
        List<Integer> ranks = new ArrayList<>(HAND_SIZE);
        for (Card card : cards) {
            ranks.add(card.getRank().getValue());
        }
        ranks.sort(Comparator.reverseOrder());

        Suit firstSuit = cards.get(0).getSuit();
        boolean flush = cards.stream().allMatch(c -> c.getSuit() == firstSuit);

        int straightHigh = straightHigh(ranks);
        boolean straight = straightHigh > 0;

        List<int[]> groups = groups(ranks);
        int[] top = groups.get(0);

        if (straight && flush) {
            HandCategory category = straightHigh == Rank.ACE.getValue()
                    ? HandCategory.ROYAL_FLUSH
                    : HandCategory.STRAIGHT_FLUSH;
            return new HandEvaluation(category, List.of(straightHigh), cards);
        }
        if (top[1] == 4) {
            return new HandEvaluation(HandCategory.FOUR_OF_A_KIND,
                    List.of(top[0], groups.get(1)[0]), cards);
        }
        if (top[1] == 3 && groups.get(1)[1] == 2) {
            return new HandEvaluation(HandCategory.FULL_HOUSE,
                    List.of(top[0], groups.get(1)[0]), cards);
        }
        if (flush) {
            return new HandEvaluation(HandCategory.FLUSH, ranks, cards);
        }
        if (straight) {
            return new HandEvaluation(HandCategory.STRAIGHT, List.of(straightHigh), cards);
        }
        if (top[1] == 3) {
            return new HandEvaluation(HandCategory.THREE_OF_A_KIND, groupRanks(groups), cards);
        }
        if (top[1] == 2 && groups.get(1)[1] == 2) {
            // groups are already (count desc, rank desc): high pair, low pair, kicker
            return new HandEvaluation(HandCategory.TWO_PAIR, groupRanks(groups), cards);
        }
        if (top[1] == 2) {
            return new HandEvaluation(HandCategory.PAIR, groupRanks(groups), cards);
        }
        return new HandEvaluation(HandCategory.HIGH_CARD, ranks, cards);
    }

    /**
     * Compares two evaluations: category first, then the tie-break sequences
     * lexicographically.
     *
     * @return negative, zero or positive as {@code a} is weaker than, tied with or stronger
     *         than {@code b}
     */
    public static int compare(HandEvaluation a, HandEvaluation b) {
        int byCategory = Integer.compare(a.category().ordinal(), b.category().ordinal());
        if (byCategory != 0) {
            return Integer.signum(byCategory);
        }
        List<Integer> av = a.tieBreaks();
        List<Integer> bv = b.tieBreaks();
        int len = Math.min(av.size(), bv.size());
        for (int i = 0; i < len; i++) {
            int diff = Integer.compare(av.get(i), bv.get(i));
            if (diff != 0) {
                return Integer.signum(diff);
            }
        }
        return Integer.signum(Integer.compare(av.size(), bv.size()));
    }

    /**
     * Returns every {@code k}-card subset of {@code cards}, in lexicographic index order.
     */
    static List<List<Card>> combinations(List<Card> cards, int k) {
        List<List<Card>> result = new ArrayList<>();
        collect(cards, k, 0, new ArrayList<>(k), result);
        return result;
    }

    private static void collect(List<Card> cards, int k, int start, List<Card> combo, List<List<Card>> out) {
        if (combo.size() == k) {
            out.add(new ArrayList<>(combo));
            return;
        }
        for (int i = start; i < cards.size(); i++) {
            combo.add(cards.get(i));
            collect(cards, k, i + 1, combo, out);
            combo.remove(combo.size() - 1);
        }
    }

    /**
     * High card of the straight formed by five descending ranks, or 0 when there is none.
     */
    private static int straightHigh(List<Integer> desc) {
        boolean distinct = desc.stream().distinct().count() == HAND_SIZE;
        if (!distinct) {
            return 0;
        }
        if (desc.get(0) - desc.get(4) == 4) {
            return desc.get(0);
        }
        // wheel: A-5-4-3-2 plays as a five-high straight
        if (desc.get(0) == Rank.ACE.getValue() && desc.get(1) == 5 && desc.get(4) == 2) {
            return 5;
        }
        return 0;
    }

    /**
     * Rank multiplicity groups as {rank, count} pairs sorted by count desc, then rank desc.
     */
    private static List<int[]> groups(List<Integer> desc) {
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (int rank : desc) {
            counts.merge(rank, 1, Integer::sum);
        }
        List<int[]> groups = new ArrayList<>();
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            groups.add(new int[]{entry.getKey(), entry.getValue()});
        }
        groups.sort((x, y) -> x[1] != y[1] ? Integer.compare(y[1], x[1]) : Integer.compare(y[0], x[0]));
        return groups;
    }

    private static List<Integer> groupRanks(List<int[]> groups) {
        List<Integer> values = new ArrayList<>(groups.size());
        for (int[] group : groups) {
            values.add(group[0]);
        }
        return values;
    }
}
