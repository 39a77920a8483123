package ai.holdem.player.ai;

import ai.holdem.game.Card;
import ai.holdem.game.HandCategory;
import ai.holdem.game.HandEvaluation;
import ai.holdem.game.HandEvaluator;
import ai.holdem.game.Rank;
import ai.holdem.game.Suit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Rough 0..1 strength estimates for a hole-card pair, before and after the flop.
 * <p>
 * These are heuristics, not equities: preflop strength scales with rank indices (0 for
 * Two, 12 for Ace) and post-flop strength starts from the made hand's category and is
 * nudged for board texture and drawing chances.
 */
public final class HandStrength {

    private static final Map<HandCategory, Double> BASE = new EnumMap<>(HandCategory.class);

    static {
        BASE.put(HandCategory.HIGH_CARD, 0.15);
        BASE.put(HandCategory.PAIR, 0.35);
        BASE.put(HandCategory.TWO_PAIR, 0.55);
        BASE.put(HandCategory.THREE_OF_A_KIND, 0.7);
        BASE.put(HandCategory.STRAIGHT, 0.78);
        BASE.put(HandCategory.FLUSH, 0.83);
        BASE.put(HandCategory.FULL_HOUSE, 0.9);
        BASE.put(HandCategory.FOUR_OF_A_KIND, 0.96);
        BASE.put(HandCategory.STRAIGHT_FLUSH, 0.98);
        BASE.put(HandCategory.ROYAL_FLUSH, 1.0);
    }

    private HandStrength() {
    }

    /**
     * Strength of two hole cards with no board.
     */
    public static double preflop(List<Card> hole) {
        requireHole(hole);
        int r1 = hole.get(0).getRank().index();
        int r2 = hole.get(1).getRank().index();
        int high = Math.max(r1, r2);
        int low = Math.min(r1, r2);
        int gap = high - low;
        boolean pair = r1 == r2;
        boolean suited = hole.get(0).getSuit() == hole.get(1).getSuit();

        double strength;
        if (pair) {
            strength = 0.5 + (high / 12.0) * 0.5;
        } else {
            strength = (high + low) / 24.0 * 0.6;
            if (suited) {
                strength += 0.06;
            }
            if (gap == 1) {
                strength += 0.04;
            } else if (gap == 2) {
                strength += 0.02;
            }
            if (gap > 4) {
                strength -= 0.05;
            }
        }

        int ace = Rank.ACE.index();
        if (pair && high >= Rank.TEN.index()) {
            strength = Math.max(strength, 0.85);
        }
        if (high == ace && low >= Rank.JACK.index()) {
            strength = Math.max(strength, 0.75);
        }
        if (high == ace && low == Rank.KING.index()) {
            strength = Math.max(strength, 0.8);
        }
        return clamp(strength);
    }

    /**
     * Strength of two hole cards against a board of three to five cards.
     */
    public static double postflop(List<Card> hole, List<Card> board) {
        requireHole(hole);
        List<Card> all = new ArrayList<>(hole);
        all.addAll(board);
        HandEvaluation made = HandEvaluator.evaluate(all);
        double strength = BASE.get(made.category());

        if (made.category() == HandCategory.PAIR) {
            boolean boardPaired = false;
            int boardHigh = -1;
            List<Rank> boardRanks = new ArrayList<>();
            for (Card card : board) {
                Rank rank = card.getRank();
                if (boardRanks.contains(rank)) {
                    boardPaired = true;
                }
                boardRanks.add(rank);
                boardHigh = Math.max(boardHigh, rank.getValue());
            }
            boolean holeHitsBoard = false;
            boolean topPair = false;
            for (Card card : hole) {
                if (boardRanks.contains(card.getRank())) {
                    holeHitsBoard = true;
                }
                if (card.getRank().getValue() >= boardHigh) {
                    topPair = true;
                }
            }
            if (boardPaired && !holeHitsBoard) {
                strength -= 0.1;
            }
            if (topPair) {
                strength += 0.08;
            }
        }

        if (made.category().ordinal() < HandCategory.STRAIGHT.ordinal() && board.size() < 5) {
            if (hasFourToAFlush(all)) {
                strength += 0.1;
            }
            if (hasFourWithinSpan(all)) {
                strength += 0.06;
            }
        }
        return clamp(strength);
    }

    private static boolean hasFourToAFlush(List<Card> cards) {
        Map<Suit, Integer> counts = new EnumMap<>(Suit.class);
        for (Card card : cards) {
            counts.merge(card.getSuit(), 1, Integer::sum);
        }
        return counts.containsValue(4);
    }

    /**
     * Four distinct ranks within a span of four: open-ended and gutshot draws alike.
     */
    private static boolean hasFourWithinSpan(List<Card> cards) {
        TreeSet<Integer> distinct = new TreeSet<>();
        for (Card card : cards) {
            distinct.add(card.getRank().index());
        }
        List<Integer> ranks = new ArrayList<>(distinct);
        for (int i = 0; i + 3 < ranks.size(); i++) {
            if (ranks.get(i + 3) - ranks.get(i) <= 4) {
                return true;
            }
        }
        return false;
    }

    private static void requireHole(List<Card> hole) {
        if (hole == null || hole.size() != 2) {
            throw new IllegalArgumentException("Expected two hole cards, got " + hole);
        }
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
